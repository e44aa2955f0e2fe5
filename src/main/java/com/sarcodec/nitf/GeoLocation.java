package com.sarcodec.nitf;

import lombok.experimental.UtilityClass;

import java.util.Locale;

/**
 * Text forms of corner coordinates used in NITF headers.
 */
@UtilityClass
public class GeoLocation {

    /**
     * IGEOLO for ICORDS=G: four corners as {@code ddmmssXdddmmssY}, 60 characters.
     *
     * @param corners four {lat, lon} pairs in degrees
     */
    public String formatIgeolo(double[][] corners) {
        if (corners.length != 4) {
            throw new IllegalArgumentException("IGEOLO needs four corners, got " + corners.length);
        }
        var sb = new StringBuilder(60);
        for (var corner : corners) {
            sb.append(formatDms(corner[0], true)).append(formatDms(corner[1], false));
        }
        return sb.toString();
    }

    /**
     * Degrees, minutes and seconds rounded to the nearest second, e.g. {@code 394500N} or
     * {@code 1044500W}.
     */
    public String formatDms(double degrees, boolean latitude) {
        char direction = latitude ? (degrees < 0 ? 'S' : 'N') : (degrees < 0 ? 'W' : 'E');
        long seconds = Math.abs(Math.round(degrees * 3600.0));
        long deg = seconds / 3600;
        long min = (seconds / 60) % 60;
        long sec = seconds % 60;
        return String.format(latitude ? "%02d%02d%02d%c" : "%03d%02d%02d%c", deg, min, sec, direction);
    }

    /**
     * Closed polygon of signed decimal degrees, {@code +dd.dddddddd+ddd.dddddddd} per vertex.
     */
    public String formatLatLonPolygon(double[][] vertices) {
        var sb = new StringBuilder();
        for (var vertex : vertices) {
            sb.append(String.format(Locale.ROOT, "%+012.8f%+013.8f", vertex[0], vertex[1]));
        }
        return sb.toString();
    }
}

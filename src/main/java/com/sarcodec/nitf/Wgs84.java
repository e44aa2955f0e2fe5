package com.sarcodec.nitf;

import lombok.experimental.UtilityClass;

/**
 * WGS-84 conversions between geodetic (degrees, metres) and earth-centred earth-fixed
 * cartesian coordinates (metres).
 */
@UtilityClass
public class Wgs84 {
    public final double SEMI_MAJOR_AXIS = 6_378_137.0;
    public final double FLATTENING = 1.0 / 298.257223563;
    private final double E2 = FLATTENING * (2.0 - FLATTENING);
    private final double SEMI_MINOR_AXIS = SEMI_MAJOR_AXIS * (1.0 - FLATTENING);
    private final double EP2 = (SEMI_MAJOR_AXIS * SEMI_MAJOR_AXIS - SEMI_MINOR_AXIS * SEMI_MINOR_AXIS)
            / (SEMI_MINOR_AXIS * SEMI_MINOR_AXIS);

    public double[] geodeticToCartesian(double latDeg, double lonDeg, double height) {
        double lat = Math.toRadians(latDeg);
        double lon = Math.toRadians(lonDeg);
        double sinLat = Math.sin(lat);
        double n = SEMI_MAJOR_AXIS / Math.sqrt(1.0 - E2 * sinLat * sinLat);
        return new double[]{
                (n + height) * Math.cos(lat) * Math.cos(lon),
                (n + height) * Math.cos(lat) * Math.sin(lon),
                (n * (1.0 - E2) + height) * sinLat
        };
    }

    /**
     * Bowring's closed form; returns {latDeg, lonDeg, height}.
     */
    public double[] cartesianToGeodetic(double[] ecef) {
        double x = ecef[0];
        double y = ecef[1];
        double z = ecef[2];
        double p = Math.hypot(x, y);
        double theta = Math.atan2(z * SEMI_MAJOR_AXIS, p * SEMI_MINOR_AXIS);
        double sinT = Math.sin(theta);
        double cosT = Math.cos(theta);
        double lat = Math.atan2(z + EP2 * SEMI_MINOR_AXIS * sinT * sinT * sinT,
                p - E2 * SEMI_MAJOR_AXIS * cosT * cosT * cosT);
        double lon = Math.atan2(y, x);
        double sinLat = Math.sin(lat);
        double n = SEMI_MAJOR_AXIS / Math.sqrt(1.0 - E2 * sinLat * sinLat);
        double height = Math.abs(Math.cos(lat)) > 1e-10
                ? p / Math.cos(lat) - n
                : Math.abs(z) - SEMI_MINOR_AXIS;
        return new double[]{Math.toDegrees(lat), Math.toDegrees(lon), height};
    }
}

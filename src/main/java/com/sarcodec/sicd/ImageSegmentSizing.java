package com.sarcodec.sicd;

import com.sarcodec.nitf.GeoLocation;
import com.sarcodec.nitf.Wgs84;
import lombok.Value;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a SICD image into NITF image segments. A single segment is used unless the image
 * exceeds the largest allowed segment; then every segment but the last holds the largest row
 * count that fits both the segment size limit and the ILOC row limit. Segment corners are
 * interpolated between the image corners in ECEF.
 */
@UtilityClass
public class ImageSegmentSizing {
    public final long MAX_SEGMENT_BYTES = 9_999_999_998L;
    public final int MAX_ILOC_ROWS = 99_999;

    @Value
    public static class SegmentInfo {
        int index;
        int firstRow;
        int numRows;
        /** Row offset of this segment relative to the one it is attached to. */
        int ilocRow;
        int idlvl;
        int ialvl;
        String igeolo;
        double[][] corners;
    }

    /**
     * @param corners image corners {lat, lon} in degrees, ordered FRFC, FRLC, LRLC, LRFC
     */
    public List<SegmentInfo> compute(int numRows, int numCols, PixelType pixelType, double[][] corners) {
        if (numRows <= 0 || numCols <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive: " + numRows + "x" + numCols);
        }
        if (corners.length != 4) {
            throw new IllegalArgumentException("Expected four image corners, got " + corners.length);
        }
        long bytesPerRow = (long) pixelType.getBytesPerPixel() * numCols;
        long productSize = bytesPerRow * numRows;
        int rowsLimit = (int) Math.min(MAX_SEGMENT_BYTES / bytesPerRow, MAX_ILOC_ROWS);

        int count;
        int[] rows;
        int[] firstRows;
        int[] rowOffsets;
        if (productSize <= MAX_SEGMENT_BYTES) {
            count = 1;
            rows = new int[]{numRows};
            firstRows = new int[]{0};
            rowOffsets = new int[]{0};
        } else {
            count = (numRows + rowsLimit - 1) / rowsLimit;
            rows = new int[count];
            firstRows = new int[count];
            rowOffsets = new int[count];
            for (int n = 0; n < count - 1; n++) {
                rows[n] = rowsLimit;
                firstRows[n + 1] = (n + 1) * rowsLimit;
                rowOffsets[n + 1] = rowsLimit;
            }
            rows[count - 1] = numRows - (count - 1) * rowsLimit;
        }

        var icp = new double[4][];
        for (int i = 0; i < 4; i++) {
            icp[i] = Wgs84.geodeticToCartesian(corners[i][0], corners[i][1], 0.0);
        }
        var ecef = new double[count][4][];
        for (int n = 0; n < count; n++) {
            double wgt1 = numRows > 1 ? (double) (numRows - 1 - firstRows[n]) / (numRows - 1) : 1.0;
            double wgt2 = numRows > 1 ? (double) firstRows[n] / (numRows - 1) : 0.0;
            ecef[n][0] = blend(wgt1, icp[0], wgt2, icp[3]);
            ecef[n][1] = blend(wgt1, icp[1], wgt2, icp[2]);
        }
        for (int n = 0; n < count - 1; n++) {
            ecef[n][2] = ecef[n + 1][1];
            ecef[n][3] = ecef[n + 1][0];
        }
        ecef[count - 1][2] = icp[2];
        ecef[count - 1][3] = icp[3];

        var segments = new ArrayList<SegmentInfo>(count);
        for (int n = 0; n < count; n++) {
            var latLon = new double[4][];
            for (int c = 0; c < 4; c++) {
                var llh = Wgs84.cartesianToGeodetic(ecef[n][c]);
                latLon[c] = new double[]{llh[0], llh[1]};
            }
            segments.add(new SegmentInfo(n, firstRows[n], rows[n], rowOffsets[n], n + 1, n,
                    GeoLocation.formatIgeolo(latLon), latLon));
        }
        return segments;
    }

    private double[] blend(double w1, double[] a, double w2, double[] b) {
        return new double[]{w1 * a[0] + w2 * b[0], w1 * a[1] + w2 * b[1], w1 * a[2] + w2 * b[2]};
    }
}

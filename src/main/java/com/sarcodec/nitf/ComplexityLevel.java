package com.sarcodec.nitf;

import lombok.experimental.UtilityClass;

/**
 * CLEVEL for a NITF 2.1 file carrying only uncompressed image and data extension segments.
 * The level is the lowest one whose file size and image dimension limits both hold.
 */
@UtilityClass
public class ComplexityLevel {
    private final long MIB = 1024L * 1024L;
    private final long GIB = 1024L * MIB;

    private final int[] LEVELS = {3, 5, 6, 7, 9};
    private final long[] MAX_FILE_SIZE = {50 * MIB, 1 * GIB, 2 * GIB, 10 * GIB, 999_999_999_999L};
    private final long[] MAX_DIMENSION = {2048, 8192, 65536, 99_999_999, 99_999_999};

    public int compute(long fileLength, long maxRows, long maxCols) {
        long dimension = Math.max(maxRows, maxCols);
        for (int i = 0; i < LEVELS.length; i++) {
            if (fileLength < MAX_FILE_SIZE[i] && dimension <= MAX_DIMENSION[i]) {
                return LEVELS[i];
            }
        }
        return LEVELS[LEVELS.length - 1];
    }
}

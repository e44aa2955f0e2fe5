package com.sarcodec.xml;

import lombok.Value;

/**
 * Dense row-major matrix; {@code values[i][j]} is the entry with {@code index1 = i + 1} and
 * {@code index2 = j + 1}.
 */
@Value
public class Matrix {
    double[][] values;

    public int getRows() {
        return values.length;
    }

    public int getCols() {
        return values.length == 0 ? 0 : values[0].length;
    }

    public double get(int row, int col) {
        return values[row][col];
    }
}

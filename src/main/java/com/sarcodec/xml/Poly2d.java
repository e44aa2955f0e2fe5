package com.sarcodec.xml;

import lombok.Value;

/**
 * Two-dimensional polynomial; {@code coefs[i][j]} multiplies {@code x^i * y^j}. Rows are
 * always of equal length, and an array without columns is the empty polynomial.
 */
@Value
public class Poly2d {
    double[][] coefs;

    public Poly2d(double[][] coefs) {
        int cols = coefs.length == 0 ? 0 : coefs[0].length;
        for (var row : coefs) {
            if (row.length != cols) {
                throw new IllegalArgumentException("Ragged coefficient array");
            }
        }
        this.coefs = cols == 0 ? new double[0][0] : coefs;
    }

    public int getOrder1() {
        return coefs.length - 1;
    }

    public int getOrder2() {
        return coefs.length == 0 ? -1 : coefs[0].length - 1;
    }

    public double evaluate(double x, double y) {
        double result = 0.0;
        for (int i = coefs.length - 1; i >= 0; i--) {
            double inner = 0.0;
            for (int j = coefs[i].length - 1; j >= 0; j--) {
                inner = inner * y + coefs[i][j];
            }
            result = result * x + inner;
        }
        return result;
    }
}

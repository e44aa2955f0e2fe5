package com.sarcodec.xml;

import lombok.Value;

/**
 * One-dimensional polynomial; {@code coefs[i]} multiplies {@code x^i}.
 */
@Value
public class Poly1d {
    double[] coefs;

    public static Poly1d of(double... coefs) {
        return new Poly1d(coefs.clone());
    }

    public int getOrder() {
        return coefs.length - 1;
    }

    public double evaluate(double x) {
        double result = 0.0;
        for (int i = coefs.length - 1; i >= 0; i--) {
            result = result * x + coefs[i];
        }
        return result;
    }
}

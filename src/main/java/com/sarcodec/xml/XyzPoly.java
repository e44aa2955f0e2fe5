package com.sarcodec.xml;

import lombok.Value;

/**
 * Three one-dimensional polynomials sharing a variable, typically position over time.
 */
@Value
public class XyzPoly {
    Poly1d x;
    Poly1d y;
    Poly1d z;

    public double[] evaluate(double t) {
        return new double[]{x.evaluate(t), y.evaluate(t), z.evaluate(t)};
    }
}

package com.sarcodec.xml;

import lombok.Value;

/**
 * Complex number with {@code Real} and {@code Imag} parts.
 */
@Value
public class Complex {
    double real;
    double imag;
}

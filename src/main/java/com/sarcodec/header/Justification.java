package com.sarcodec.header;

/**
 * Side of the field a shorter value is aligned to; the other side is filled.
 */
public enum Justification {
    LEFT,
    RIGHT
}

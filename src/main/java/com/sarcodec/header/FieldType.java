package com.sarcodec.header;

import lombok.Getter;

/**
 * Character class and value mapping of a header field.
 * <ul>
 *   <li>{@link #ALPHANUMERIC}: basic character set, decoded as a {@code String}</li>
 *   <li>{@link #EXTENDED}: extended character set, decoded as a {@code String}</li>
 *   <li>{@link #INTEGER}: zero-filled non-negative integer, decoded as a {@code Long}</li>
 *   <li>{@link #NUMERIC}: numeric characters kept as text (dates, signed values)</li>
 *   <li>{@link #BINARY}: raw bytes</li>
 * </ul>
 */
@Getter
public enum FieldType {
    ALPHANUMERIC(Justification.LEFT, (byte) ' '),
    EXTENDED(Justification.LEFT, (byte) ' '),
    INTEGER(Justification.RIGHT, (byte) '0'),
    NUMERIC(Justification.LEFT, (byte) ' '),
    BINARY(Justification.LEFT, (byte) 0);

    private final Justification defaultJustification;
    private final byte fill;

    FieldType(Justification defaultJustification, byte fill) {
        this.defaultJustification = defaultJustification;
        this.fill = fill;
    }

    public boolean accepts(byte value) {
        int b = value & 0xFF;
        switch (this) {
            case ALPHANUMERIC:
                return b >= 0x20 && b <= 0x7E;
            case EXTENDED:
                return (b >= 0x20 && b <= 0x7E) || b >= 0xA0 || b == 0x0A || b == 0x0C || b == 0x0D;
            case INTEGER:
                return b >= '0' && b <= '9';
            case NUMERIC:
                return (b >= '0' && b <= '9') || b == '+' || b == '-' || b == '.' || b == '/' || b == ' ';
            default:
                return true;
        }
    }

    public boolean isText() {
        return this != INTEGER && this != BINARY;
    }
}

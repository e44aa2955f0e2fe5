package com.sarcodec.data;

import com.sarcodec.error.ErrorType;
import com.sarcodec.error.SarCodecException;
import lombok.Getter;

import java.nio.ByteBuffer;
import java.util.HashMap;
import java.util.Map;

/**
 * Primitive element types found in container payloads. Codes follow the binary format
 * string convention ({@code I2}, {@code U8}, {@code F4}, ...). Values are always big-endian
 * on disk; callers pass big-endian buffers.
 */
public enum ScalarType {
    I1("I1", 1, Kind.SIGNED),
    I2("I2", 2, Kind.SIGNED),
    I4("I4", 4, Kind.SIGNED),
    I8("I8", 8, Kind.SIGNED),
    U1("U1", 1, Kind.UNSIGNED),
    U2("U2", 2, Kind.UNSIGNED),
    U4("U4", 4, Kind.UNSIGNED),
    U8("U8", 8, Kind.UNSIGNED),
    F4("F4", 4, Kind.FLOAT),
    F8("F8", 8, Kind.FLOAT);

    public enum Kind {
        SIGNED,
        UNSIGNED,
        FLOAT
    }

    @Getter
    private final String code;
    @Getter
    private final int size;
    @Getter
    private final Kind kind;

    private static final Map<String, ScalarType> LOOKUP = new HashMap<>();

    static {
        for (var type : values()) {
            LOOKUP.put(type.code, type);
        }
    }

    ScalarType(String code, int size, Kind kind) {
        this.code = code;
        this.size = size;
        this.kind = kind;
    }

    public boolean isFloatingPoint() {
        return kind == Kind.FLOAT;
    }

    public static ScalarType fromCode(String code) throws SarCodecException {
        var type = LOOKUP.get(code);
        if (type != null) return type;
        throw new SarCodecException(ErrorType.INVALID_FIELD_VALUE, "Unknown scalar type code: '" + code + "'");
    }

    /**
     * Looks up the type of the given kind and byte size, e.g. {@code (FLOAT, 4) -> F4}.
     */
    public static ScalarType of(Kind kind, int size) throws SarCodecException {
        for (var type : values()) {
            if (type.kind == kind && type.size == size) return type;
        }
        throw new SarCodecException(ErrorType.INVALID_FIELD_VALUE,
                "No " + kind + " scalar type of " + size + " bytes");
    }

    /**
     * Reads the value at an absolute byte offset of a big-endian buffer.
     */
    public double read(ByteBuffer buffer, int offset) {
        switch (this) {
            case I1:
                return buffer.get(offset);
            case I2:
                return buffer.getShort(offset);
            case I4:
                return buffer.getInt(offset);
            case I8:
                return buffer.getLong(offset);
            case U1:
                return buffer.get(offset) & 0xFF;
            case U2:
                return buffer.getShort(offset) & 0xFFFF;
            case U4:
                return buffer.getInt(offset) & 0xFFFFFFFFL;
            case U8:
                long bits = buffer.getLong(offset);
                return bits >= 0 ? bits : ((bits >>> 1) * 2.0) + (bits & 1);
            case F4:
                return buffer.getFloat(offset);
            case F8:
                return buffer.getDouble(offset);
            default:
                throw new IllegalStateException("Unhandled scalar type " + this);
        }
    }

    /**
     * Reads an integer value without going through {@code double}. {@code U8} values above
     * {@link Long#MAX_VALUE} come back as their two's-complement bits; use
     * {@link Long#toUnsignedString(long)} to print them.
     */
    public long readLong(ByteBuffer buffer, int offset) {
        switch (this) {
            case I1:
                return buffer.get(offset);
            case I2:
                return buffer.getShort(offset);
            case I4:
                return buffer.getInt(offset);
            case I8:
            case U8:
                return buffer.getLong(offset);
            case U1:
                return buffer.get(offset) & 0xFFL;
            case U2:
                return buffer.getShort(offset) & 0xFFFFL;
            case U4:
                return buffer.getInt(offset) & 0xFFFFFFFFL;
            default:
                throw new UnsupportedOperationException(this + " is not an integer type");
        }
    }

    /**
     * Writes the low {@link #getSize()} bytes of an integer value.
     */
    public void writeLong(ByteBuffer buffer, int offset, long value) {
        switch (this) {
            case I1:
            case U1:
                buffer.put(offset, (byte) value);
                break;
            case I2:
            case U2:
                buffer.putShort(offset, (short) value);
                break;
            case I4:
            case U4:
                buffer.putInt(offset, (int) value);
                break;
            case I8:
            case U8:
                buffer.putLong(offset, value);
                break;
            default:
                throw new UnsupportedOperationException(this + " is not an integer type");
        }
    }

    /**
     * Writes the value at an absolute byte offset of a big-endian buffer. Integer types
     * truncate toward zero.
     */
    public void write(ByteBuffer buffer, int offset, double value) {
        switch (this) {
            case I1:
            case U1:
                buffer.put(offset, (byte) (long) value);
                break;
            case I2:
            case U2:
                buffer.putShort(offset, (short) (long) value);
                break;
            case I4:
            case U4:
                buffer.putInt(offset, (int) (long) value);
                break;
            case I8:
                buffer.putLong(offset, (long) value);
                break;
            case U8:
                buffer.putLong(offset, value >= 0x1p63 ? (long) (value - 0x1p63) | Long.MIN_VALUE : (long) value);
                break;
            case F4:
                buffer.putFloat(offset, (float) value);
                break;
            case F8:
                buffer.putDouble(offset, value);
                break;
            default:
                throw new IllegalStateException("Unhandled scalar type " + this);
        }
    }
}

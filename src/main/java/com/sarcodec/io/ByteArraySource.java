package com.sarcodec.io;

import java.io.EOFException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * In-memory {@link ByteSource}.
 */
public class ByteArraySource implements ByteSource {
    private final byte[] bytes;
    private final String identifier;

    public ByteArraySource(byte[] bytes) {
        this(bytes, "memory");
    }

    public ByteArraySource(byte[] bytes, String identifier) {
        this.bytes = Objects.requireNonNull(bytes, "Bytes cannot be null");
        this.identifier = identifier;
    }

    @Override
    public long size() {
        return bytes.length;
    }

    @Override
    public ByteBuffer read(long offset, int length) throws EOFException {
        if (offset < 0 || length < 0) {
            throw new IllegalArgumentException("Invalid range: offset=" + offset + ", length=" + length);
        }
        if (offset + length > bytes.length) {
            throw new EOFException(identifier + ": range [" + offset + ", " + (offset + length)
                    + ") beyond " + bytes.length + " bytes");
        }
        var copy = new byte[length];
        System.arraycopy(bytes, (int) offset, copy, 0, length);
        return ByteBuffer.wrap(copy).order(ByteOrder.BIG_ENDIAN);
    }

    @Override
    public String getSourceIdentifier() {
        return identifier;
    }

    @Override
    public void close() {
    }
}

package com.sarcodec.io;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Random-access source of container bytes. Readers only ever ask for explicit byte ranges,
 * so a source never has to load a whole file.
 */
public interface ByteSource extends Closeable {

    long size() throws IOException;

    /**
     * Reads exactly {@code length} bytes starting at {@code offset}.
     *
     * @return a big-endian buffer positioned at 0 with {@code length} remaining bytes
     * @throws java.io.EOFException if the source ends before {@code offset + length}
     */
    ByteBuffer read(long offset, int length) throws IOException;

    /**
     * Identifier of the underlying data, used in log and error messages.
     */
    String getSourceIdentifier();
}

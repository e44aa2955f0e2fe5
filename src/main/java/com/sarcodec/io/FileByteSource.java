package com.sarcodec.io;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * {@link ByteSource} over a local file using positional {@link FileChannel} reads.
 */
public class FileByteSource implements ByteSource {
    private final Path path;
    private final FileChannel channel;

    public FileByteSource(Path path) throws IOException {
        this.path = Objects.requireNonNull(path, "Path cannot be null");
        this.channel = FileChannel.open(path, StandardOpenOption.READ);
    }

    @Override
    public long size() throws IOException {
        return channel.size();
    }

    @Override
    public ByteBuffer read(long offset, int length) throws IOException {
        if (offset < 0 || length < 0) {
            throw new IllegalArgumentException("Invalid range: offset=" + offset + ", length=" + length);
        }
        var buffer = ByteBuffer.allocate(length).order(ByteOrder.BIG_ENDIAN);
        long position = offset;
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, position);
            if (read < 0) {
                throw new EOFException(path + ": end of file at " + position + " while reading "
                        + length + " bytes from offset " + offset);
            }
            position += read;
        }
        return buffer.flip();
    }

    @Override
    public String getSourceIdentifier() {
        return path.toAbsolutePath().toString();
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}

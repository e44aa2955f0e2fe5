package com.sarcodec.io;

import com.sarcodec.data.PayloadArray;
import com.sarcodec.error.ErrorType;
import com.sarcodec.error.SarCodecException;
import com.sarcodec.layout.LayoutPlan;
import com.sarcodec.layout.Segment;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Base of the format readers. Subclasses parse headers and metadata in their constructor
 * through {@link #readBytes}; payload bytes are read only by the segment accessors. After
 * {@link #close()} parsed metadata remains available but byte access fails with
 * {@link ErrorType#CLOSED_SOURCE}.
 */
@Slf4j
public abstract class ContainerReader implements AutoCloseable {
    private final ByteSource source;
    private boolean closed;

    protected ContainerReader(ByteSource source) {
        this.source = Objects.requireNonNull(source, "Byte source cannot be null");
    }

    /**
     * Segment layout reconstructed from the headers.
     */
    public abstract LayoutPlan getLayout();

    public boolean isClosed() {
        return closed;
    }

    protected String getSourceIdentifier() {
        return source.getSourceIdentifier();
    }

    /**
     * Reads the complete payload of data segment {@code index}.
     */
    public PayloadArray readSegment(int index) throws IOException, SarCodecException {
        var segment = dataSegment(index);
        return readRows(segment, 0, segment.getShape()[0]);
    }

    /**
     * Reads {@code numRows} first-axis slices of {@code segment} starting at {@code startRow}.
     */
    protected PayloadArray readRows(Segment segment, int startRow, int numRows) throws IOException, SarCodecException {
        var shape = segment.getShape();
        if (startRow < 0 || numRows < 0 || (long) startRow + numRows > shape[0]) {
            throw new SarCodecException(ErrorType.OUT_OF_RANGE, "Rows [" + startRow + ", " + ((long) startRow + numRows)
                    + ") outside segment " + segment.getName() + " with " + shape[0] + " rows");
        }
        long rowBytes = segment.getLength() / shape[0];
        long length = rowBytes * numRows;
        if (length > Integer.MAX_VALUE) {
            throw new SarCodecException(ErrorType.OUT_OF_RANGE, "Cannot read " + length + " bytes of segment "
                    + segment.getName() + " at once; read fewer rows");
        }
        shape[0] = numRows;
        var bytes = readBytes(segment.getOffset() + rowBytes * startRow, (int) length);
        return PayloadArray.wrap(segment.getDataType(), bytes, shape);
    }

    /**
     * Reads exactly {@code length} bytes at {@code offset}, checked against the planned file
     * length.
     */
    protected ByteBuffer readBytes(long offset, int length) throws IOException, SarCodecException {
        if (closed) {
            throw new SarCodecException(ErrorType.CLOSED_SOURCE, source.getSourceIdentifier() + " is closed");
        }
        if (offset < 0 || length < 0 || offset + length > source.size()) {
            throw new SarCodecException(ErrorType.OUT_OF_RANGE, "Byte range [" + offset + ", " + (offset + length)
                    + ") outside " + source.getSourceIdentifier() + " of " + source.size() + " bytes");
        }
        return source.read(offset, length);
    }

    protected Segment dataSegment(int index) throws SarCodecException {
        var segments = getLayout().getSegments();
        if (index < 0 || index >= segments.size() || !segments.get(index).isData()) {
            throw new SarCodecException(ErrorType.OUT_OF_RANGE, "No data segment #" + index + " in "
                    + source.getSourceIdentifier());
        }
        return segments.get(index);
    }

    @Override
    public void close() throws IOException {
        if (!closed) {
            closed = true;
            log.debug("Closing {}", source.getSourceIdentifier());
            source.close();
        }
    }
}

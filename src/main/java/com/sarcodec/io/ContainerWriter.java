package com.sarcodec.io;

import com.sarcodec.data.PayloadArray;
import com.sarcodec.error.ErrorType;
import com.sarcodec.error.SarCodecException;
import com.sarcodec.layout.LayoutPlan;
import com.sarcodec.layout.Segment;
import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.Objects;

/**
 * Base of the format writers. The plan is fixed at construction; subclasses write headers
 * and metadata immediately through {@link #writeAt} and payloads through
 * {@link #writePayload}. Output goes to a sibling temporary file that replaces the target
 * only when {@link #close()} finds every data segment fully written. Bytes of pending fields
 * are held back until then, so an abandoned file never carries a valid magic number.
 */
@Slf4j
public abstract class ContainerWriter implements AutoCloseable {
    private final Path target;
    private final Path temporary;
    private final FileChannel channel;
    private final LayoutPlan plan;
    private final Int2ObjectLinkedOpenHashMap<Coverage> coverage = new Int2ObjectLinkedOpenHashMap<>();
    private final Long2ObjectOpenHashMap<byte[]> deferred = new Long2ObjectOpenHashMap<>();
    private boolean closed;

    protected ContainerWriter(Path target, LayoutPlan plan) throws IOException {
        this.target = Objects.requireNonNull(target, "Target path cannot be null").toAbsolutePath();
        this.plan = Objects.requireNonNull(plan, "Layout plan cannot be null");
        this.temporary = Files.createTempFile(this.target.getParent(), this.target.getFileName().toString(), ".partial");
        try {
            this.channel = FileChannel.open(temporary, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
            if (plan.getTotalLength() > 0) {
                channel.write(ByteBuffer.allocate(1), plan.getTotalLength() - 1);
            }
        } catch (IOException e) {
            Files.deleteIfExists(temporary);
            throw e;
        }
        for (var segment : plan.dataSegments()) {
            var shape = segment.getShape();
            coverage.put(segment.getIndex(), new Coverage(shape[0], shape.length > 1 ? shape[1] : 1));
        }
        log.info("Writing {} {} ({} bytes, {} data segments)", plan.getFormat(), this.target,
                plan.getTotalLength(), coverage.size());
    }

    public LayoutPlan getLayout() {
        return plan;
    }

    public Path getTarget() {
        return target;
    }

    /**
     * Writes {@code bytes} at {@code offset}. Bytes falling on a pending field are zeroed now
     * and written at finalize.
     */
    protected void writeAt(long offset, byte[] bytes) throws IOException, SarCodecException {
        ensureOpen();
        var copy = bytes.clone();
        for (var field : plan.getPendingFields()) {
            long from = Math.max(offset, field.getOffset());
            long to = Math.min(offset + bytes.length, field.getOffset() + field.getWidth());
            if (from < to) {
                var held = deferred.computeIfAbsent(field.getOffset(), k -> new byte[field.getWidth()]);
                for (long p = from; p < to; p++) {
                    held[(int) (p - field.getOffset())] = copy[(int) (p - offset)];
                    copy[(int) (p - offset)] = 0;
                }
            }
        }
        write(offset, ByteBuffer.wrap(copy));
    }

    /**
     * Writes {@code data} into data segment {@code segmentIndex} with its first element at
     * ({@code startRow}, {@code startCol}). The array must have the segment's data type and a
     * shape that fits; otherwise nothing is written.
     */
    protected void writePayload(int segmentIndex, PayloadArray data, int startRow, int startCol)
            throws IOException, SarCodecException {
        ensureOpen();
        var segment = plan.getSegment(segmentIndex);
        checkPayload(segment, data, startRow, startCol);
        var shape = segment.getShape();
        var dataShape = data.getShape();
        int numRows = dataShape[0];
        int numCols = dataShape.length > 1 ? dataShape[1] : 1;
        int segmentCols = shape.length > 1 ? shape[1] : 1;
        long cellBytes = segment.getLength() / ((long) shape[0] * segmentCols);
        int rowBytes = (int) (numCols * cellBytes);
        var source = data.asByteBuffer();
        if (numCols == segmentCols) {
            write(segment.getOffset() + (long) startRow * segmentCols * cellBytes, source);
        } else {
            for (int r = 0; r < numRows; r++) {
                source.limit((r + 1) * rowBytes).position(r * rowBytes);
                long offset = segment.getOffset() + ((long) (startRow + r) * segmentCols + startCol) * cellBytes;
                write(offset, source);
            }
        }
        coverage.get(segmentIndex).add(startRow, startCol, numRows, numCols);
        log.debug("Wrote {} rows x {} cols to segment {} at ({}, {})", numRows, numCols, segment.getName(), startRow, startCol);
    }

    /**
     * True once every element of data segment {@code segmentIndex} has been written.
     */
    protected boolean isWritten(int segmentIndex) {
        var segmentCoverage = coverage.get(segmentIndex);
        return segmentCoverage != null && segmentCoverage.isComplete();
    }

    /**
     * Finalizes the container: checks that every data segment is fully written, writes the
     * pending fields and moves the file into place. On an incomplete write the temporary file
     * is deleted and {@link ErrorType#INCOMPLETE_WRITE} is thrown.
     */
    @Override
    public void close() throws IOException, SarCodecException {
        if (closed) return;
        closed = true;
        try {
            for (var entry : coverage.int2ObjectEntrySet()) {
                if (!entry.getValue().isComplete()) {
                    var segment = plan.getSegment(entry.getIntKey());
                    throw new SarCodecException(ErrorType.INCOMPLETE_WRITE, "Segment #" + segment.getIndex() + " '"
                            + segment.getName() + "' of " + target + " was not fully written");
                }
            }
            for (var field : plan.getPendingFields()) {
                write(field.getOffset(), ByteBuffer.wrap(deferred.getOrDefault(field.getOffset(), new byte[field.getWidth()])));
            }
            channel.force(true);
            channel.close();
            move();
            log.info("Finalized {} ({} bytes)", target, plan.getTotalLength());
        } catch (IOException | SarCodecException | RuntimeException e) {
            abort();
            throw e;
        }
    }

    /**
     * Discards the output without touching the target. Subclasses call this when their
     * constructor fails after the temporary file was created.
     */
    protected void abort() {
        closed = true;
        try {
            channel.close();
            Files.deleteIfExists(temporary);
        } catch (IOException e) {
            log.warn("Could not remove partial file {}", temporary, e);
        }
    }

    private void move() throws IOException {
        try {
            Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void write(long offset, ByteBuffer buffer) throws IOException {
        long position = offset;
        while (buffer.hasRemaining()) {
            position += channel.write(buffer, position);
        }
    }

    private void ensureOpen() throws SarCodecException {
        if (closed) {
            throw new SarCodecException(ErrorType.CLOSED_SOURCE, "Writer for " + target + " is closed");
        }
    }

    private static void checkPayload(Segment segment, PayloadArray data, int startRow, int startCol) throws SarCodecException {
        if (!segment.isData()) {
            throw new SarCodecException(ErrorType.OUT_OF_RANGE, "Segment #" + segment.getIndex() + " '"
                    + segment.getName() + "' is not a data segment");
        }
        if (!segment.getDataType().equals(data.getDataType())) {
            throw new SarCodecException(ErrorType.PAYLOAD_MISMATCH, "Segment '" + segment.getName() + "' expects "
                    + segment.getDataType() + " elements but got " + data.getDataType());
        }
        var shape = segment.getShape();
        var dataShape = data.getShape();
        boolean fits = dataShape.length == shape.length && startRow >= 0 && startCol >= 0
                && (long) startRow + dataShape[0] <= shape[0];
        if (fits && shape.length > 1) {
            fits = (long) startCol + dataShape[1] <= shape[1];
            for (int axis = 2; axis < shape.length && fits; axis++) {
                fits = dataShape[axis] == shape[axis];
            }
        } else if (fits) {
            fits = startCol == 0;
        }
        if (!fits) {
            throw new SarCodecException(ErrorType.PAYLOAD_MISMATCH, "Segment '" + segment.getName() + "' of shape "
                    + Arrays.toString(shape) + " cannot hold " + Arrays.toString(dataShape) + " at (" + startRow
                    + ", " + startCol + ")");
        }
    }
}

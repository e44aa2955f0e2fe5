package com.sarcodec.layout;

import com.sarcodec.data.DataType;
import com.sarcodec.error.ErrorType;
import com.sarcodec.error.SarCodecException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Appends segments back to back and produces a {@link LayoutPlan}. Every length is validated
 * as it is added, so a plan that builds is always addressable by its format.
 */
@Slf4j
public final class LayoutBuilder {
    private final String format;
    private final long maxFileLength;
    private final int blockAlignment;
    private final List<Segment> segments = new ArrayList<>();
    private final List<PendingField> pendingFields = new ArrayList<>();
    private long offset;

    /**
     * @param format         format name used in messages
     * @param maxFileLength  largest total length the format can address
     * @param blockAlignment total length is padded to a multiple of this; 1 for none
     */
    public LayoutBuilder(String format, long maxFileLength, int blockAlignment) {
        this.format = Objects.requireNonNull(format, "Format cannot be null");
        if (maxFileLength <= 0 || blockAlignment <= 0) {
            throw new IllegalArgumentException("Maximum length and block alignment must be positive");
        }
        this.maxFileLength = maxFileLength;
        this.blockAlignment = blockAlignment;
    }

    public long currentOffset() {
        return offset;
    }

    public LayoutBuilder header(String name, long length) throws SarCodecException {
        return append(SegmentKind.HEADER, name, length, null, null);
    }

    public LayoutBuilder metadata(String name, long length) throws SarCodecException {
        return append(SegmentKind.METADATA, name, length, null, null);
    }

    public LayoutBuilder padding(String name, long length) throws SarCodecException {
        if (length == 0) return this;
        return append(SegmentKind.PADDING, name, length, null, null);
    }

    /**
     * Data segment of {@code product(shape)} elements of {@code dataType}.
     */
    public LayoutBuilder data(String name, DataType dataType, int... shape) throws SarCodecException {
        Objects.requireNonNull(dataType, "Data type cannot be null");
        if (dataType.getItemSize() <= 0) {
            throw new SarCodecException(ErrorType.LAYOUT_ERROR, format + " segment " + name
                    + ": unsupported element size " + dataType.getItemSize());
        }
        if (shape.length == 0) {
            throw new SarCodecException(ErrorType.LAYOUT_ERROR, format + " segment " + name + ": empty shape");
        }
        long length = dataType.getItemSize();
        for (int dim : shape) {
            if (dim <= 0) {
                throw new SarCodecException(ErrorType.LAYOUT_ERROR, format + " segment " + name
                        + ": dimensions must be positive, got " + Arrays.toString(shape));
            }
            try {
                length = Math.multiplyExact(length, dim);
            } catch (ArithmeticException e) {
                throw new SarCodecException(ErrorType.LAYOUT_ERROR, format + " segment " + name
                        + ": size of " + Arrays.toString(shape) + " x " + dataType.getItemSize() + " overflows", e);
            }
        }
        return append(SegmentKind.DATA, name, length, dataType, shape);
    }

    /**
     * Marks {@code width} bytes at absolute {@code fieldOffset} as written only at finalize.
     */
    public LayoutBuilder pending(String name, long fieldOffset, int width) {
        pendingFields.add(new PendingField(name, fieldOffset, width));
        return this;
    }

    public LayoutPlan build() throws SarCodecException {
        long remainder = offset % blockAlignment;
        if (remainder != 0) {
            append(SegmentKind.PADDING, "block alignment", blockAlignment - remainder, null, null);
        }
        for (var field : pendingFields) {
            if (field.getOffset() < 0 || field.getOffset() + field.getWidth() > offset) {
                throw new SarCodecException(ErrorType.LAYOUT_ERROR, format + " pending field " + field.getName()
                        + " at offset " + field.getOffset() + " lies outside the " + offset + "-byte file");
            }
        }
        var plan = new LayoutPlan(format, List.copyOf(segments), offset, List.copyOf(pendingFields));
        if (log.isDebugEnabled()) {
            log.debug("Planned {} {} segments, {} bytes", segments.size(), format, offset);
            for (var segment : segments) {
                log.debug("  #{} {} '{}' offset={} length={}", segment.getIndex(), segment.getKind(),
                        segment.getName(), segment.getOffset(), segment.getLength());
            }
        }
        return plan;
    }

    private LayoutBuilder append(SegmentKind kind, String name, long length, DataType dataType, int[] shape) throws SarCodecException {
        Objects.requireNonNull(name, "Segment name cannot be null");
        if (length < 0) {
            throw new SarCodecException(ErrorType.LAYOUT_ERROR, format + " segment " + name + ": negative length " + length);
        }
        long end;
        try {
            end = Math.addExact(offset, length);
        } catch (ArithmeticException e) {
            throw new SarCodecException(ErrorType.LAYOUT_ERROR, format + " segment " + name + ": offset overflows", e);
        }
        if (end > maxFileLength) {
            throw new SarCodecException(ErrorType.LAYOUT_ERROR, format + " segment " + name + " ends at byte " + end
                    + ", beyond the maximum file length " + maxFileLength);
        }
        segments.add(new Segment(segments.size(), kind, name, offset, length, dataType, shape));
        offset = end;
        return this;
    }
}

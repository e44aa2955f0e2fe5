package com.sarcodec.layout;

import com.sarcodec.data.DataType;
import lombok.Value;

import java.util.Objects;

/**
 * A planned byte range of a container. Data segments also carry the element type and shape
 * of their payload; other segments have a {@code null} data type and an empty shape.
 */
@Value
public class Segment {
    int index;
    SegmentKind kind;
    String name;
    long offset;
    long length;
    DataType dataType;
    int[] shape;

    public Segment(int index, SegmentKind kind, String name, long offset, long length, DataType dataType, int[] shape) {
        this.index = index;
        this.kind = Objects.requireNonNull(kind, "Segment kind cannot be null");
        this.name = Objects.requireNonNull(name, "Segment name cannot be null");
        this.offset = offset;
        this.length = length;
        this.dataType = dataType;
        this.shape = shape == null ? new int[0] : shape.clone();
        if (kind == SegmentKind.DATA && dataType == null) {
            throw new IllegalArgumentException("Data segment " + name + " needs a data type");
        }
    }

    public long getEnd() {
        return offset + length;
    }

    public int[] getShape() {
        return shape.clone();
    }

    public boolean isData() {
        return kind == SegmentKind.DATA;
    }
}

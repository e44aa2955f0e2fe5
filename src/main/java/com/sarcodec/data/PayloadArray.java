package com.sarcodec.data;

import com.sarcodec.error.ErrorType;
import com.sarcodec.error.SarCodecException;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Dense row-major array of {@link DataType} elements backed by a big-endian buffer. This is the
 * in-memory form of every payload segment; its bytes are exactly the bytes on disk.
 */
public final class PayloadArray {
    private final DataType dataType;
    private final int[] shape;
    private final ByteBuffer buffer;

    private PayloadArray(DataType dataType, int[] shape, ByteBuffer buffer) {
        this.dataType = dataType;
        this.shape = shape;
        this.buffer = buffer;
    }

    /**
     * Allocates a zero-filled array.
     */
    public static PayloadArray allocate(DataType dataType, int... shape) {
        Objects.requireNonNull(dataType, "Data type cannot be null");
        var dims = checkShape(shape);
        long bytes = elementCount(dims) * dataType.getItemSize();
        if (bytes > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Array of " + bytes + " bytes exceeds the in-memory limit");
        }
        return new PayloadArray(dataType, dims, ByteBuffer.allocate((int) bytes).order(ByteOrder.BIG_ENDIAN));
    }

    /**
     * Wraps big-endian bytes read from a segment. The remaining bytes of {@code data} must be
     * exactly {@code product(shape) * itemSize}.
     */
    public static PayloadArray wrap(DataType dataType, ByteBuffer data, int... shape) throws SarCodecException {
        Objects.requireNonNull(dataType, "Data type cannot be null");
        Objects.requireNonNull(data, "Data cannot be null");
        var dims = checkShape(shape);
        long expected = elementCount(dims) * dataType.getItemSize();
        if (data.remaining() != expected) {
            throw new SarCodecException(ErrorType.PAYLOAD_MISMATCH, "Expected " + expected + " bytes for "
                    + dataType + " " + Arrays.toString(dims) + " but got " + data.remaining());
        }
        var copy = data.slice().order(ByteOrder.BIG_ENDIAN);
        return new PayloadArray(dataType, dims, copy);
    }

    public DataType getDataType() {
        return dataType;
    }

    public int[] getShape() {
        return shape.clone();
    }

    public int getRank() {
        return shape.length;
    }

    public int getDimension(int axis) {
        return shape[axis];
    }

    public long getElementCount() {
        return elementCount(shape);
    }

    public int getByteLength() {
        return buffer.capacity();
    }

    /**
     * Read-only big-endian view positioned at the first byte.
     */
    public ByteBuffer asByteBuffer() {
        return buffer.asReadOnlyBuffer().order(ByteOrder.BIG_ENDIAN).clear();
    }

    public byte[] toByteArray() {
        var bytes = new byte[buffer.capacity()];
        buffer.duplicate().clear().get(bytes);
        return bytes;
    }

    /**
     * Row-major flat index of the given coordinates.
     */
    public int flatIndex(int... coords) {
        if (coords.length != shape.length) {
            throw new IllegalArgumentException("Expected " + shape.length + " coordinates, got " + coords.length);
        }
        int index = 0;
        for (int axis = 0; axis < shape.length; axis++) {
            if (coords[axis] < 0 || coords[axis] >= shape[axis]) {
                throw new IndexOutOfBoundsException("Coordinate " + coords[axis] + " outside axis "
                        + axis + " of length " + shape[axis]);
            }
            index = index * shape[axis] + coords[axis];
        }
        return index;
    }

    public double getDouble(int index) {
        return getComponent(index, 0);
    }

    public void setDouble(int index, double value) {
        setComponent(index, 0, value);
    }

    /**
     * Exact value of an integer scalar element; {@link #getDouble(int)} rounds beyond 2^53.
     */
    public long getLong(int index) {
        return getComponentLong(index, 0);
    }

    public void setLong(int index, long value) {
        setComponentLong(index, 0, value);
    }

    public double getReal(int index) {
        return getComponent(index, 0);
    }

    public double getImag(int index) {
        return getComponent(index, 1);
    }

    public void setComplex(int index, double real, double imag) {
        setComponent(index, 0, real);
        setComponent(index, 1, imag);
    }

    public double getField(int index, String name) {
        return getComponent(index, dataType.fieldIndex(name));
    }

    public void setField(int index, String name, double value) {
        setComponent(index, dataType.fieldIndex(name), value);
    }

    public long getFieldLong(int index, String name) {
        return getComponentLong(index, dataType.fieldIndex(name));
    }

    public void setFieldLong(int index, String name, long value) {
        setComponentLong(index, dataType.fieldIndex(name), value);
    }

    public double getComponent(int index, int component) {
        int offset = componentOffset(index, component);
        return componentType(component).read(buffer, offset);
    }

    public void setComponent(int index, int component, double value) {
        int offset = componentOffset(index, component);
        componentType(component).write(buffer, offset, value);
    }

    public long getComponentLong(int index, int component) {
        int offset = componentOffset(index, component);
        return componentType(component).readLong(buffer, offset);
    }

    public void setComponentLong(int index, int component, long value) {
        int offset = componentOffset(index, component);
        componentType(component).writeLong(buffer, offset, value);
    }

    /**
     * String element with trailing NUL and space padding removed.
     */
    public String getString(int index) {
        requireKind(DataType.Kind.STRING);
        var bytes = new byte[dataType.getItemSize()];
        buffer.duplicate().position(elementOffset(index)).get(bytes);
        int end = bytes.length;
        while (end > 0 && (bytes[end - 1] == 0 || bytes[end - 1] == ' ')) end--;
        return new String(bytes, 0, end, StandardCharsets.US_ASCII);
    }

    public void setString(int index, String value) {
        requireKind(DataType.Kind.STRING);
        var bytes = value.getBytes(StandardCharsets.US_ASCII);
        if (bytes.length > dataType.getItemSize()) {
            throw new IllegalArgumentException("String of " + bytes.length + " bytes does not fit " + dataType);
        }
        int offset = elementOffset(index);
        for (int i = 0; i < dataType.getItemSize(); i++) {
            buffer.put(offset + i, i < bytes.length ? bytes[i] : 0);
        }
    }

    /**
     * Copy of {@code count} consecutive rows (first-axis slices) starting at {@code start}.
     */
    public PayloadArray rows(int start, int count) {
        if (shape.length == 0 || start < 0 || count < 0 || start + count > shape[0]) {
            throw new IndexOutOfBoundsException("Rows [" + start + ", " + (start + count)
                    + ") outside " + Arrays.toString(shape));
        }
        var newShape = shape.clone();
        newShape[0] = count;
        var result = allocate(dataType, newShape);
        int rowBytes = buffer.capacity() / Math.max(shape[0], 1);
        var src = buffer.duplicate().clear();
        src.position(start * rowBytes).limit((start + count) * rowBytes);
        result.buffer.duplicate().clear().put(src);
        return result;
    }

    /**
     * Copy of a rectangular block of a two-dimensional array.
     */
    public PayloadArray block(int row, int col, int numRows, int numCols) {
        if (shape.length != 2) {
            throw new IllegalArgumentException("Blocks require a two-dimensional array, shape is " + Arrays.toString(shape));
        }
        if (row < 0 || col < 0 || numRows < 0 || numCols < 0 || row + numRows > shape[0] || col + numCols > shape[1]) {
            throw new IndexOutOfBoundsException("Block (" + row + ", " + col + ") " + numRows + "x" + numCols
                    + " outside " + Arrays.toString(shape));
        }
        var result = allocate(dataType, numRows, numCols);
        int itemSize = dataType.getItemSize();
        int rowBytes = numCols * itemSize;
        var src = buffer.duplicate().clear();
        var dst = result.buffer.duplicate().clear();
        for (int r = 0; r < numRows; r++) {
            int from = ((row + r) * shape[1] + col) * itemSize;
            src.limit(from + rowBytes).position(from);
            dst.put(src);
            src.clear();
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PayloadArray)) return false;
        var other = (PayloadArray) o;
        return dataType.equals(other.dataType)
                && Arrays.equals(shape, other.shape)
                && buffer.duplicate().clear().equals(other.buffer.duplicate().clear());
    }

    @Override
    public int hashCode() {
        return Objects.hash(dataType, Arrays.hashCode(shape), buffer.duplicate().clear());
    }

    @Override
    public String toString() {
        return "PayloadArray{" + dataType + " " + Arrays.toString(shape) + "}";
    }

    private int elementOffset(int index) {
        if (index < 0 || index >= getElementCount()) {
            throw new IndexOutOfBoundsException("Element " + index + " outside " + getElementCount() + " elements");
        }
        return index * dataType.getItemSize();
    }

    private int componentOffset(int index, int component) {
        int base = elementOffset(index);
        switch (dataType.getKind()) {
            case SCALAR:
                checkComponent(component, 1);
                return base;
            case COMPLEX:
            case AMP_PHASE:
                checkComponent(component, 2);
                return base + component * dataType.getComponent().getSize();
            case STRUCT:
                checkComponent(component, dataType.getFields().size());
                return base + dataType.getFields().get(component).getOffset();
            default:
                throw new UnsupportedOperationException("No numeric components in " + dataType);
        }
    }

    private ScalarType componentType(int component) {
        if (dataType.getKind() != DataType.Kind.STRUCT) {
            return dataType.getComponent();
        }
        var field = dataType.getFields().get(component);
        if (field.getType().getKind() != DataType.Kind.SCALAR) {
            throw new UnsupportedOperationException("Member '" + field.getName() + "' is not a scalar: " + field.getType());
        }
        return field.getType().getComponent();
    }

    private void checkComponent(int component, int count) {
        if (component < 0 || component >= count) {
            throw new IndexOutOfBoundsException("Component " + component + " outside " + count + " components of " + dataType);
        }
    }

    private void requireKind(DataType.Kind kind) {
        if (dataType.getKind() != kind) {
            throw new UnsupportedOperationException("Expected a " + kind + " array but element type is " + dataType);
        }
    }

    private static int[] checkShape(int[] shape) {
        Objects.requireNonNull(shape, "Shape cannot be null");
        for (int dim : shape) {
            if (dim < 0) {
                throw new IllegalArgumentException("Negative dimension in shape " + Arrays.toString(shape));
            }
        }
        return shape.clone();
    }

    private static long elementCount(int[] shape) {
        long count = 1;
        for (int dim : shape) {
            count *= dim;
        }
        return count;
    }
}

package com.sarcodec.data;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;
import java.util.Objects;

/**
 * Layout of one payload element: a scalar, a complex pair of scalars, an amplitude/phase
 * byte pair, a fixed-width string or a structured record of named fields.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DataType {

    public enum Kind {
        SCALAR,
        COMPLEX,
        AMP_PHASE,
        STRING,
        STRUCT
    }

    Kind kind;
    ScalarType component;
    int itemSize;
    List<DataField> fields;

    public static DataType scalar(ScalarType type) {
        Objects.requireNonNull(type, "Scalar type cannot be null");
        return new DataType(Kind.SCALAR, type, type.getSize(), List.of());
    }

    public static DataType complex(ScalarType component) {
        Objects.requireNonNull(component, "Component type cannot be null");
        if (component.getKind() == ScalarType.Kind.UNSIGNED) {
            throw new IllegalArgumentException("Complex components must be signed or floating point: " + component);
        }
        return new DataType(Kind.COMPLEX, component, 2 * component.getSize(), List.of());
    }

    /**
     * Unsigned 8-bit amplitude index followed by an unsigned 8-bit phase index.
     */
    public static DataType ampPhase() {
        return new DataType(Kind.AMP_PHASE, ScalarType.U1, 2, List.of());
    }

    public static DataType string(int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("String length must be positive: " + length);
        }
        return new DataType(Kind.STRING, null, length, List.of());
    }

    public static DataType struct(List<DataField> fields) {
        int size = 0;
        for (var field : fields) {
            size = Math.max(size, field.getOffset() + field.getType().getItemSize());
        }
        return struct(fields, size);
    }

    /**
     * Structured record padded to {@code itemSize} bytes.
     */
    public static DataType struct(List<DataField> fields, int itemSize) {
        Objects.requireNonNull(fields, "Fields cannot be null");
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("A structured type needs at least one field");
        }
        for (var field : fields) {
            if (field.getOffset() < 0 || field.getOffset() + field.getType().getItemSize() > itemSize) {
                throw new IllegalArgumentException("Field '" + field.getName() + "' does not fit in "
                        + itemSize + " bytes at offset " + field.getOffset());
            }
        }
        return new DataType(Kind.STRUCT, null, itemSize, List.copyOf(fields));
    }

    public boolean isComplex() {
        return kind == Kind.COMPLEX || kind == Kind.AMP_PHASE;
    }

    public int getComponentCount() {
        switch (kind) {
            case COMPLEX:
            case AMP_PHASE:
                return 2;
            case STRUCT:
                return fields.size();
            default:
                return 1;
        }
    }

    public int fieldIndex(String name) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).getName().equals(name)) return i;
        }
        throw new IllegalArgumentException("No field named '" + name + "' in " + this);
    }

    @Override
    public String toString() {
        switch (kind) {
            case SCALAR:
                return component.getCode();
            case COMPLEX:
                return (component.isFloatingPoint() ? "CF" : "CI") + itemSize;
            case AMP_PHASE:
                return "AMP8I_PHS8I";
            case STRING:
                return "S" + itemSize;
            default:
                var sb = new StringBuilder("{");
                for (var field : fields) {
                    sb.append(field.getName()).append('@').append(field.getOffset()).append('=')
                            .append(field.getType()).append(';');
                }
                return sb.append(" size=").append(itemSize).append('}').toString();
        }
    }
}

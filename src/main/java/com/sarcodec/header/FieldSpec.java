package com.sarcodec.header;

import lombok.Builder;
import lombok.Value;

import java.util.Objects;
import java.util.Set;

/**
 * One header field: its name, character class, width and optional default and allowed values.
 * A field either has a fixed {@code width} or takes its width from a previously decoded
 * integer field ({@code widthField}) minus {@code widthAdjustment}.
 */
@Value
@Builder(toBuilder = true)
public class FieldSpec implements FieldTable.Entry {
    String name;
    FieldType type;
    int width;
    String widthField;
    int widthAdjustment;
    Justification justification;
    Object defaultValue;
    @Builder.Default
    Set<String> allowedValues = Set.of();

    public static FieldSpec alpha(String name, int width) {
        return fixed(name, FieldType.ALPHANUMERIC, width);
    }

    public static FieldSpec extended(String name, int width) {
        return fixed(name, FieldType.EXTENDED, width);
    }

    public static FieldSpec integer(String name, int width) {
        return fixed(name, FieldType.INTEGER, width);
    }

    public static FieldSpec numeric(String name, int width) {
        return fixed(name, FieldType.NUMERIC, width);
    }

    public static FieldSpec binary(String name, int width) {
        return fixed(name, FieldType.BINARY, width);
    }

    /**
     * Field whose width is the value of {@code widthField} minus {@code adjustment}.
     */
    public static FieldSpec variable(String name, FieldType type, String widthField, int adjustment) {
        Objects.requireNonNull(widthField, "Width field cannot be null");
        return FieldSpec.builder().name(name).type(type).widthField(widthField).widthAdjustment(adjustment).build();
    }

    private static FieldSpec fixed(String name, FieldType type, int width) {
        if (width <= 0) {
            throw new IllegalArgumentException("Field " + name + " must have a positive width: " + width);
        }
        return FieldSpec.builder().name(name).type(type).width(width).build();
    }

    public FieldSpec withDefault(Object value) {
        return toBuilder().defaultValue(value).build();
    }

    public FieldSpec withAllowed(String... values) {
        return toBuilder().allowedValues(Set.of(values)).build();
    }

    public FieldSpec renamed(String newName) {
        return toBuilder().name(newName).build();
    }

    public boolean isVariableWidth() {
        return widthField != null;
    }

    public Justification effectiveJustification() {
        return justification != null ? justification : type.getDefaultJustification();
    }
}

package com.sarcodec.header;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Ordered name to value map of header field values. Text fields hold {@code String}, integer
 * fields {@code Long} and binary fields {@code byte[]}.
 */
public final class HeaderFields {
    private final LinkedHashMap<String, Object> values = new LinkedHashMap<>();

    public HeaderFields() {
    }

    public HeaderFields(Map<String, ?> initial) {
        initial.forEach(this::put);
    }

    public HeaderFields put(String name, Object value) {
        Objects.requireNonNull(name, "Field name cannot be null");
        Objects.requireNonNull(value, "Value of field " + name + " cannot be null");
        values.put(name, value);
        return this;
    }

    public HeaderFields putAll(HeaderFields other) {
        other.values.forEach(this::put);
        return this;
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public Object get(String name) {
        return values.get(name);
    }

    /**
     * Text value of the field, or {@code ""} when it is absent.
     */
    public String getString(String name) {
        var value = values.get(name);
        if (value == null) return "";
        if (value instanceof byte[]) {
            throw new IllegalArgumentException("Field " + name + " is binary");
        }
        return value.toString();
    }

    public long getLong(String name) {
        var value = values.get(name);
        if (value == null) {
            throw new NoSuchElementException("No value for field " + name);
        }
        return toLong(name, value);
    }

    public long getLong(String name, long defaultValue) {
        var value = values.get(name);
        return value == null ? defaultValue : toLong(name, value);
    }

    public int getInt(String name) {
        return Math.toIntExact(getLong(name));
    }

    public byte[] getBytes(String name) {
        var value = values.get(name);
        if (value == null) return new byte[0];
        if (!(value instanceof byte[])) {
            throw new IllegalArgumentException("Field " + name + " is not binary");
        }
        return ((byte[]) value).clone();
    }

    public List<String> names() {
        return Collections.unmodifiableList(new ArrayList<>(values.keySet()));
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public HeaderFields copy() {
        var copy = new HeaderFields();
        values.forEach((k, v) -> copy.values.put(k, v instanceof byte[] ? ((byte[]) v).clone() : v));
        return copy;
    }

    private static long toLong(String name, Object value) {
        if (value instanceof Number) return ((Number) value).longValue();
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Field " + name + " is not an integer: '" + value + "'", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HeaderFields)) return false;
        var other = ((HeaderFields) o).values;
        if (!values.keySet().equals(other.keySet())) return false;
        for (var entry : values.entrySet()) {
            if (!Objects.deepEquals(entry.getValue(), other.get(entry.getKey()))) return false;
        }
        return true;
    }

    /**
     * Sum of per-entry hashes, independent of insertion order like {@link #equals(Object)}.
     */
    @Override
    public int hashCode() {
        int hash = 0;
        for (var entry : values.entrySet()) {
            var v = entry.getValue();
            hash += entry.getKey().hashCode() ^ (v instanceof byte[] ? Arrays.hashCode((byte[]) v) : Objects.hashCode(v));
        }
        return hash;
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("HeaderFields{");
        values.forEach((k, v) -> sb.append(k).append('=')
                .append(v instanceof byte[] ? Arrays.toString((byte[]) v) : "'" + v + "'").append(", "));
        if (!values.isEmpty()) sb.setLength(sb.length() - 2);
        return sb.append('}').toString();
    }
}

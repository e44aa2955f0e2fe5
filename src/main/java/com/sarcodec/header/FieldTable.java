package com.sarcodec.header;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.ToIntFunction;

/**
 * Ordered description of a header: plain fields, repeated groups and conditional groups.
 * Tables are pure data; {@link HeaderFieldCodec} interprets them.
 */
@Value
public class FieldTable {
    String name;
    List<Entry> entries;

    /**
     * Marker for the members of a table.
     */
    public interface Entry {
    }

    /**
     * Group repeated {@code count} times. Repeated field names get a 1-based index suffix
     * zero-padded to {@code indexWidth} digits ({@code LISH001}, {@code ICOM1}).
     */
    @Value
    public static class Repeat implements Entry {
        String description;
        ToIntFunction<HeaderFields> count;
        int indexWidth;
        List<FieldSpec> fields;

        public String indexedName(FieldSpec field, int index) {
            return field.getName() + String.format("%0" + indexWidth + "d", index);
        }
    }

    /**
     * Group present only when {@code condition} holds for the values decoded so far.
     */
    @Value
    public static class Conditional implements Entry {
        String description;
        Predicate<HeaderFields> condition;
        List<Entry> entries;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private final List<Entry> entries = new ArrayList<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "Table name cannot be null");
        }

        public Builder field(FieldSpec field) {
            entries.add(Objects.requireNonNull(field, "Field cannot be null"));
            return this;
        }

        public Builder fields(Collection<FieldSpec> fields) {
            fields.forEach(this::field);
            return this;
        }

        public Builder repeat(String countField, int indexWidth, FieldSpec... fields) {
            return repeat(countField, values -> (int) values.getLong(countField), indexWidth, fields);
        }

        public Builder repeat(String description, ToIntFunction<HeaderFields> count, int indexWidth, FieldSpec... fields) {
            entries.add(new Repeat(description, count, indexWidth, List.of(fields)));
            return this;
        }

        public Builder when(String description, Predicate<HeaderFields> condition, Consumer<Builder> body) {
            var nested = new Builder(name);
            body.accept(nested);
            entries.add(new Conditional(description, condition, List.copyOf(nested.entries)));
            return this;
        }

        public FieldTable build() {
            return new FieldTable(name, List.copyOf(entries));
        }
    }
}

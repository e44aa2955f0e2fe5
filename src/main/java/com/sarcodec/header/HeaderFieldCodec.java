package com.sarcodec.header;

import com.sarcodec.error.ErrorType;
import com.sarcodec.error.SarCodecException;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * Encodes and decodes fixed-width header text according to a {@link FieldTable}.
 * Header text is ISO-8859-1. Decoding validates each byte against the field's character
 * class; encoding pads per justification and never truncates.
 */
public final class HeaderFieldCodec {

    private HeaderFieldCodec() {
    }

    /**
     * Decodes {@code bytes} completely. {@code baseOffset} is the file offset of the first
     * byte and only appears in error messages.
     *
     * @throws SarCodecException MALFORMED_HEADER when a field is truncated, holds characters
     *                           outside its class, is not an allowed value, or when bytes remain
     *                           after the last field
     */
    public static HeaderFields decode(FieldTable table, byte[] bytes, long baseOffset) throws SarCodecException {
        var decoder = new Decoder(table, bytes, baseOffset);
        decoder.decodeEntries(table.getEntries());
        if (decoder.position != bytes.length) {
            throw new SarCodecException(ErrorType.MALFORMED_HEADER, table.getName() + ": " + (bytes.length - decoder.position)
                    + " unexpected bytes after the last field at offset " + (baseOffset + decoder.position));
        }
        return decoder.values;
    }

    /**
     * Decodes as many fields as the table describes from the start of {@code bytes}, ignoring
     * anything after them.
     */
    public static HeaderFields decodePrefix(FieldTable table, byte[] bytes, long baseOffset) throws SarCodecException {
        var decoder = new Decoder(table, bytes, baseOffset);
        decoder.decodeEntries(table.getEntries());
        return decoder.values;
    }

    /**
     * Decodes a single fixed-width field located at {@code offset} within {@code bytes}.
     */
    public static Object decodeField(FieldSpec spec, byte[] bytes, int offset, long baseOffset) throws SarCodecException {
        if (spec.isVariableWidth()) {
            throw new IllegalArgumentException("Field " + spec.getName() + " has a variable width");
        }
        if (offset < 0 || offset + spec.getWidth() > bytes.length) {
            throw new SarCodecException(ErrorType.MALFORMED_HEADER, "Field " + spec.getName() + " at offset "
                    + (baseOffset + offset) + " is truncated: need " + spec.getWidth() + " bytes");
        }
        return decodeValue(spec, bytes, offset, spec.getWidth(), baseOffset + offset);
    }

    /**
     * Encodes every field of the table. Missing values take the field default, or the field's
     * fill when there is none.
     *
     * @throws SarCodecException FIELD_OVERFLOW when a value is wider than its field,
     *                           INVALID_FIELD_VALUE when it has the wrong type, characters or
     *                           is not one of the allowed values
     */
    public static byte[] encode(FieldTable table, HeaderFields values) throws SarCodecException {
        var encoder = new Encoder(values);
        encoder.encodeEntries(table.getEntries());
        return encoder.out.toByteArray();
    }

    public static int encodedLength(FieldTable table, HeaderFields values) throws SarCodecException {
        return encode(table, values).length;
    }

    /**
     * Encodes one fixed-width field value.
     */
    public static byte[] encodeField(FieldSpec spec, Object value) throws SarCodecException {
        if (spec.isVariableWidth()) {
            throw new IllegalArgumentException("Field " + spec.getName() + " has a variable width");
        }
        return encodeValue(spec, value != null ? value : spec.getDefaultValue(), spec.getWidth());
    }

    private static final class Decoder {
        private final FieldTable table;
        private final byte[] bytes;
        private final long baseOffset;
        private final HeaderFields values = new HeaderFields();
        private int position;

        Decoder(FieldTable table, byte[] bytes, long baseOffset) {
            this.table = table;
            this.bytes = bytes;
            this.baseOffset = baseOffset;
        }

        void decodeEntries(List<FieldTable.Entry> entries) throws SarCodecException {
            for (var entry : entries) {
                if (entry instanceof FieldSpec) {
                    var spec = (FieldSpec) entry;
                    values.put(spec.getName(), next(spec, spec.getName()));
                } else if (entry instanceof FieldTable.Repeat) {
                    var repeat = (FieldTable.Repeat) entry;
                    int count = evaluateCount(repeat, values, table, baseOffset + position);
                    for (int i = 1; i <= count; i++) {
                        for (var spec : repeat.getFields()) {
                            var name = repeat.indexedName(spec, i);
                            values.put(name, next(spec, name));
                        }
                    }
                } else {
                    var conditional = (FieldTable.Conditional) entry;
                    if (conditional.getCondition().test(values)) {
                        decodeEntries(conditional.getEntries());
                    }
                }
            }
        }

        private Object next(FieldSpec spec, String name) throws SarCodecException {
            long fileOffset = baseOffset + position;
            int width = resolveWidth(spec, name, values, ErrorType.MALFORMED_HEADER, fileOffset);
            if (position + width > bytes.length) {
                throw new SarCodecException(ErrorType.MALFORMED_HEADER, table.getName() + ": field " + name
                        + " at offset " + fileOffset + " is truncated: need " + width + " bytes, have "
                        + (bytes.length - position));
            }
            var value = decodeValue(spec.getName().equals(name) ? spec : spec.renamed(name), bytes, position, width, fileOffset);
            position += width;
            return value;
        }
    }

    private static final class Encoder {
        private final HeaderFields input;
        private final HeaderFields resolved = new HeaderFields();
        private final ByteArrayOutputStream out = new ByteArrayOutputStream();

        Encoder(HeaderFields input) {
            this.input = input;
        }

        void encodeEntries(List<FieldTable.Entry> entries) throws SarCodecException {
            for (var entry : entries) {
                if (entry instanceof FieldSpec) {
                    var spec = (FieldSpec) entry;
                    write(spec, spec.getName());
                } else if (entry instanceof FieldTable.Repeat) {
                    var repeat = (FieldTable.Repeat) entry;
                    int count = evaluateCount(repeat, resolved, null, out.size());
                    for (int i = 1; i <= count; i++) {
                        for (var spec : repeat.getFields()) {
                            write(spec, repeat.indexedName(spec, i));
                        }
                    }
                } else {
                    var conditional = (FieldTable.Conditional) entry;
                    if (conditional.getCondition().test(resolved)) {
                        encodeEntries(conditional.getEntries());
                    }
                }
            }
        }

        private void write(FieldSpec spec, String name) throws SarCodecException {
            var value = input.has(name) ? input.get(name) : spec.getDefaultValue();
            int width = resolveWidth(spec, name, resolved, ErrorType.INVALID_FIELD_VALUE, out.size());
            var named = spec.getName().equals(name) ? spec : spec.renamed(name);
            var encoded = encodeValue(named, value, width);
            out.writeBytes(encoded);
            resolved.put(name, value != null ? normalize(named, value) : fillValue(named, encoded));
        }
    }

    private static int evaluateCount(FieldTable.Repeat repeat, HeaderFields values, FieldTable table, long offset) throws SarCodecException {
        int count;
        try {
            count = repeat.getCount().applyAsInt(values);
        } catch (RuntimeException e) {
            throw new SarCodecException(table != null ? ErrorType.MALFORMED_HEADER : ErrorType.INVALID_FIELD_VALUE,
                    "Cannot evaluate repeat count " + repeat.getDescription() + " at offset " + offset, e);
        }
        if (count < 0) {
            throw new SarCodecException(table != null ? ErrorType.MALFORMED_HEADER : ErrorType.INVALID_FIELD_VALUE,
                    "Negative repeat count " + count + " for " + repeat.getDescription() + " at offset " + offset);
        }
        return count;
    }

    private static int resolveWidth(FieldSpec spec, String name, HeaderFields values, ErrorType error, long offset) throws SarCodecException {
        if (!spec.isVariableWidth()) {
            return spec.getWidth();
        }
        if (!values.has(spec.getWidthField())) {
            throw new SarCodecException(error, "Field " + name + " at offset " + offset
                    + " takes its width from missing field " + spec.getWidthField());
        }
        long width = values.getLong(spec.getWidthField()) - spec.getWidthAdjustment();
        if (width < 0 || width > Integer.MAX_VALUE) {
            throw new SarCodecException(error, "Field " + name + " at offset " + offset + " has invalid width "
                    + width + " derived from " + spec.getWidthField());
        }
        return (int) width;
    }

    private static Object decodeValue(FieldSpec spec, byte[] bytes, int start, int width, long fileOffset) throws SarCodecException {
        for (int i = start; i < start + width; i++) {
            if (!spec.getType().accepts(bytes[i])) {
                throw new SarCodecException(ErrorType.MALFORMED_HEADER, "Field " + spec.getName() + " at offset "
                        + fileOffset + ": byte 0x" + Integer.toHexString(bytes[i] & 0xFF) + " at position "
                        + (i - start) + " is not valid " + spec.getType());
            }
        }
        Object value;
        switch (spec.getType()) {
            case INTEGER:
                if (width > 18) {
                    throw new SarCodecException(ErrorType.MALFORMED_HEADER, "Field " + spec.getName() + " at offset "
                            + fileOffset + " is too wide to hold an integer: " + width);
                }
                value = width == 0 ? 0L : Long.parseLong(new String(bytes, start, width, StandardCharsets.ISO_8859_1));
                break;
            case BINARY:
                value = Arrays.copyOfRange(bytes, start, start + width);
                break;
            default:
                value = stripTrailing(new String(bytes, start, width, StandardCharsets.ISO_8859_1));
                break;
        }
        if (!spec.getAllowedValues().isEmpty() && !spec.getAllowedValues().contains(value.toString())) {
            throw new SarCodecException(ErrorType.MALFORMED_HEADER, "Field " + spec.getName() + " at offset "
                    + fileOffset + ": expected one of " + spec.getAllowedValues() + " but found '" + value + "'");
        }
        return value;
    }

    private static byte[] encodeValue(FieldSpec spec, Object value, int width) throws SarCodecException {
        var type = spec.getType();
        var result = new byte[width];
        if (value == null) {
            Arrays.fill(result, type.getFill());
            return result;
        }
        if (type == FieldType.BINARY) {
            if (!(value instanceof byte[])) {
                throw new SarCodecException(ErrorType.INVALID_FIELD_VALUE, "Field " + spec.getName()
                        + " expects bytes but got " + value.getClass().getSimpleName());
            }
            var raw = (byte[]) value;
            if (raw.length > width) {
                throw new SarCodecException(ErrorType.FIELD_OVERFLOW, "Field " + spec.getName() + ": expected at most "
                        + width + " bytes, actual " + raw.length);
            }
            System.arraycopy(raw, 0, result, 0, raw.length);
            return result;
        }

        var text = toText(spec, value);
        if (!spec.getAllowedValues().isEmpty() && !spec.getAllowedValues().contains(text)) {
            throw new SarCodecException(ErrorType.INVALID_FIELD_VALUE, "Field " + spec.getName() + ": expected one of "
                    + spec.getAllowedValues() + " but got '" + text + "'");
        }
        var encoded = text.getBytes(StandardCharsets.ISO_8859_1);
        if (!StandardCharsets.ISO_8859_1.newEncoder().canEncode(text)) {
            throw new SarCodecException(ErrorType.INVALID_FIELD_VALUE, "Field " + spec.getName()
                    + " holds characters outside ISO-8859-1: '" + text + "'");
        }
        for (byte b : encoded) {
            if (!type.accepts(b)) {
                throw new SarCodecException(ErrorType.INVALID_FIELD_VALUE, "Field " + spec.getName() + ": byte 0x"
                        + Integer.toHexString(b & 0xFF) + " is not valid " + type + " in '" + text + "'");
            }
        }
        if (encoded.length > width) {
            throw new SarCodecException(ErrorType.FIELD_OVERFLOW, "Field " + spec.getName() + ": value '" + text
                    + "' is " + encoded.length + " bytes, width " + width);
        }
        Arrays.fill(result, type.getFill());
        int pad = width - encoded.length;
        int start = spec.effectiveJustification() == Justification.RIGHT ? pad : 0;
        System.arraycopy(encoded, 0, result, start, encoded.length);
        return result;
    }

    private static String toText(FieldSpec spec, Object value) throws SarCodecException {
        if (spec.getType() == FieldType.INTEGER) {
            long number;
            if (value instanceof Number) {
                number = ((Number) value).longValue();
            } else {
                try {
                    number = Long.parseLong(value.toString().trim());
                } catch (NumberFormatException e) {
                    throw new SarCodecException(ErrorType.INVALID_FIELD_VALUE, "Field " + spec.getName()
                            + " expects an integer but got '" + value + "'", e);
                }
            }
            if (number < 0) {
                throw new SarCodecException(ErrorType.INVALID_FIELD_VALUE, "Field " + spec.getName()
                        + " cannot hold negative value " + number);
            }
            return Long.toString(number);
        }
        if (value instanceof CharSequence || value instanceof Number) {
            return value.toString();
        }
        throw new SarCodecException(ErrorType.INVALID_FIELD_VALUE, "Field " + spec.getName()
                + " expects text but got " + value.getClass().getSimpleName());
    }

    private static Object normalize(FieldSpec spec, Object value) {
        if (spec.getType() == FieldType.INTEGER && !(value instanceof Number)) {
            return Long.parseLong(value.toString().trim());
        }
        return value;
    }

    private static Object fillValue(FieldSpec spec, byte[] encoded) {
        switch (spec.getType()) {
            case INTEGER:
                return 0L;
            case BINARY:
                return encoded;
            default:
                return "";
        }
    }

    private static String stripTrailing(String text) {
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == ' ') end--;
        return text.substring(0, end);
    }
}

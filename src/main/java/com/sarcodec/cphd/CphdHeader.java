package com.sarcodec.cphd;

import com.sarcodec.error.ErrorType;
import com.sarcodec.error.SarCodecException;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;

/**
 * The CPHD file header: a {@code CPHD/<version>} line, {@code KEY := value} lines and a
 * form-feed/newline section terminator.
 */
@Value
public class CphdHeader {
    public static final String XML_BLOCK_SIZE = "XML_BLOCK_SIZE";
    public static final String XML_BLOCK_BYTE_OFFSET = "XML_BLOCK_BYTE_OFFSET";
    public static final String SUPPORT_BLOCK_SIZE = "SUPPORT_BLOCK_SIZE";
    public static final String SUPPORT_BLOCK_BYTE_OFFSET = "SUPPORT_BLOCK_BYTE_OFFSET";
    public static final String PVP_BLOCK_SIZE = "PVP_BLOCK_SIZE";
    public static final String PVP_BLOCK_BYTE_OFFSET = "PVP_BLOCK_BYTE_OFFSET";
    public static final String SIGNAL_BLOCK_SIZE = "SIGNAL_BLOCK_SIZE";
    public static final String SIGNAL_BLOCK_BYTE_OFFSET = "SIGNAL_BLOCK_BYTE_OFFSET";
    public static final String CLASSIFICATION = "CLASSIFICATION";
    public static final String RELEASE_INFO = "RELEASE_INFO";

    public static final Set<String> DEFINED_KEYS = Set.of(XML_BLOCK_SIZE, XML_BLOCK_BYTE_OFFSET, SUPPORT_BLOCK_SIZE,
            SUPPORT_BLOCK_BYTE_OFFSET, PVP_BLOCK_SIZE, PVP_BLOCK_BYTE_OFFSET, SIGNAL_BLOCK_SIZE,
            SIGNAL_BLOCK_BYTE_OFFSET, CLASSIFICATION, RELEASE_INFO);

    /** Ends the header and the XML block. */
    public static final byte[] SECTION_TERMINATOR = {'\f', '\n'};
    /** The reserved header length is a multiple of this. */
    public static final int ALIGNMENT = 64;
    /** Widest possible offset value, used to size the header before offsets are known. */
    static final String OFFSET_PLACEHOLDER = "18446744073709551615";

    private static final String MAGIC = "CPHD/";
    private static final String SEPARATOR = " := ";

    String version;
    Map<String, String> kvps;

    public CphdHeader(String version, Map<String, String> kvps) {
        this.version = version;
        this.kvps = Collections.unmodifiableMap(new LinkedHashMap<>(kvps));
    }

    /**
     * Header text including the section terminator.
     */
    public byte[] encode() {
        var sb = new StringBuilder(MAGIC).append(version).append('\n');
        kvps.forEach((key, value) -> sb.append(key).append(SEPARATOR).append(value).append('\n'));
        var text = sb.toString().getBytes(StandardCharsets.UTF_8);
        var bytes = new byte[text.length + SECTION_TERMINATOR.length];
        System.arraycopy(text, 0, bytes, 0, text.length);
        System.arraycopy(SECTION_TERMINATOR, 0, bytes, text.length, SECTION_TERMINATOR.length);
        return bytes;
    }

    public String get(String key) {
        return kvps.get(key);
    }

    /**
     * Value of a required key.
     *
     * @throws SarCodecException MALFORMED_HEADER when the key is missing
     */
    public String getRequired(String key) throws SarCodecException {
        var value = kvps.get(key);
        if (value == null) {
            throw new SarCodecException(ErrorType.MALFORMED_HEADER, "CPHD header has no " + key);
        }
        return value;
    }

    /**
     * Numeric value of a required key.
     *
     * @throws SarCodecException MALFORMED_HEADER when the key is missing or not a number
     */
    public long getLong(String key) throws SarCodecException {
        var value = kvps.get(key);
        if (value == null) {
            throw new SarCodecException(ErrorType.MALFORMED_HEADER, "CPHD header has no " + key);
        }
        return parseLong(key, value);
    }

    public OptionalLong getOptionalLong(String key) throws SarCodecException {
        var value = kvps.get(key);
        return value == null ? OptionalLong.empty() : OptionalLong.of(parseLong(key, value));
    }

    /**
     * Key/value pairs other than the ones the format defines.
     */
    public Map<String, String> additionalKvps() {
        var extra = new LinkedHashMap<String, String>();
        kvps.forEach((key, value) -> {
            if (!DEFINED_KEYS.contains(key)) extra.put(key, value);
        });
        return extra;
    }

    /**
     * Bytes to reserve for this header and its terminator when every offset value is a
     * placeholder: the header text rounded up to {@link #ALIGNMENT}, plus the terminator.
     */
    public long reservedLength() {
        long text = encode().length - SECTION_TERMINATOR.length;
        return (text + ALIGNMENT - 1) / ALIGNMENT * ALIGNMENT + SECTION_TERMINATOR.length;
    }

    /**
     * Index just past the section terminator, or -1 when {@code bytes} holds no complete
     * header.
     */
    public static int findEnd(byte[] bytes, int length) {
        for (int i = 1; i + 1 < length; i++) {
            if (bytes[i - 1] == '\n' && bytes[i] == SECTION_TERMINATOR[0] && bytes[i + 1] == SECTION_TERMINATOR[1]) {
                return i + 2;
            }
        }
        return -1;
    }

    /**
     * Parses a header that ends with its section terminator at {@code end}.
     */
    public static CphdHeader decode(byte[] bytes, int end) throws SarCodecException {
        var text = new String(bytes, 0, end - SECTION_TERMINATOR.length, StandardCharsets.UTF_8);
        var lines = text.split("\n", -1);
        if (lines.length < 2 || !lines[0].startsWith(MAGIC)) {
            throw new SarCodecException(ErrorType.UNSUPPORTED_FORMAT, "Not a CPHD file: first line is '"
                    + (lines.length > 0 ? abbreviate(lines[0]) : "") + "'");
        }
        var kvps = new LinkedHashMap<String, String>();
        int offset = lines[0].length() + 1;
        for (int i = 1; i < lines.length - 1; i++) {
            var line = lines[i];
            int sep = line.indexOf(SEPARATOR);
            if (sep <= 0) {
                throw new SarCodecException(ErrorType.MALFORMED_HEADER, "CPHD header line " + (i + 1) + " at offset "
                        + offset + " is not 'KEY := value': '" + abbreviate(line) + "'");
            }
            var key = line.substring(0, sep);
            if (kvps.put(key, line.substring(sep + SEPARATOR.length())) != null) {
                throw new SarCodecException(ErrorType.MALFORMED_HEADER, "CPHD header line " + (i + 1) + " at offset "
                        + offset + " repeats key " + key);
            }
            offset += line.length() + 1;
        }
        if (!lines[lines.length - 1].isEmpty()) {
            throw new SarCodecException(ErrorType.MALFORMED_HEADER, "CPHD header line before the terminator is not "
                    + "newline-terminated at offset " + offset);
        }
        return new CphdHeader(lines[0].substring(MAGIC.length()), kvps);
    }

    static String checkKey(String key) {
        if (key == null || key.isEmpty() || !key.chars().allMatch(c -> c > ' ' && c < 0x7F)) {
            throw new IllegalArgumentException("Invalid CPHD header key: '" + key + "'");
        }
        if (key.contains(":=")) {
            throw new IllegalArgumentException("CPHD header key cannot contain ':=': '" + key + "'");
        }
        return key;
    }

    static String checkValue(String key, String value) {
        Objects.requireNonNull(value, "Value of " + key + " cannot be null");
        if (value.indexOf('\n') >= 0 || value.indexOf('\f') >= 0) {
            throw new IllegalArgumentException("Value of CPHD header key " + key + " cannot contain line breaks");
        }
        return value;
    }

    private static long parseLong(String key, String value) throws SarCodecException {
        try {
            long number = Long.parseLong(value.trim());
            if (number < 0) {
                throw new SarCodecException(ErrorType.MALFORMED_HEADER, "CPHD header " + key + " is negative: " + number);
            }
            return number;
        } catch (NumberFormatException e) {
            throw new SarCodecException(ErrorType.MALFORMED_HEADER, "CPHD header " + key + " is not a number: '"
                    + value + "'", e);
        }
    }

    private static String abbreviate(String text) {
        return text.length() > 40 ? text.substring(0, 40) + "..." : text;
    }
}

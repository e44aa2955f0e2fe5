package com.sarcodec.xml;

import com.sarcodec.error.ErrorType;
import com.sarcodec.error.SarCodecException;
import org.jdom2.Element;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;

/**
 * Lexical forms of XML schema simple types.
 */
final class XmlText {
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private XmlText() {
    }

    static String text(Element element) {
        return element.getTextTrim();
    }

    static long parseLong(Element element) throws SarCodecException {
        var text = text(element);
        try {
            return Long.parseLong(text.startsWith("+") ? text.substring(1) : text);
        } catch (NumberFormatException e) {
            throw malformed(element, "integer", text, e);
        }
    }

    /**
     * xs:double, including {@code INF}, {@code -INF} and {@code NaN}.
     */
    static double parseDouble(Element element) throws SarCodecException {
        var text = text(element);
        switch (text) {
            case "INF":
            case "+INF":
                return Double.POSITIVE_INFINITY;
            case "-INF":
                return Double.NEGATIVE_INFINITY;
            case "NaN":
                return Double.NaN;
            default:
                break;
        }
        try {
            if (text.isEmpty() || text.endsWith("d") || text.endsWith("D") || text.endsWith("f") || text.endsWith("F")
                    || text.contains("Infinity") || text.contains("x")) {
                throw new NumberFormatException("not an xs:double");
            }
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw malformed(element, "double", text, e);
        }
    }

    /**
     * Shortest text that parses back to exactly {@code value}.
     */
    static String formatDouble(double value) {
        if (Double.isNaN(value)) return "NaN";
        if (value == Double.POSITIVE_INFINITY) return "INF";
        if (value == Double.NEGATIVE_INFINITY) return "-INF";
        return Double.toString(value);
    }

    static boolean parseBoolean(Element element) throws SarCodecException {
        var text = text(element);
        switch (text) {
            case "true":
            case "1":
                return true;
            case "false":
            case "0":
                return false;
            default:
                throw malformed(element, "boolean", text, null);
        }
    }

    /**
     * Date-times without an offset are taken as UTC.
     */
    static OffsetDateTime parseDateTime(Element element) throws SarCodecException {
        var text = text(element);
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return (OffsetDateTime) parsed;
            }
            return ((LocalDateTime) parsed).atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw malformed(element, "dateTime", text, e);
        }
    }

    static String formatDateTime(OffsetDateTime value) {
        return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(value);
    }

    static byte[] parseHex(Element element) throws SarCodecException {
        var text = text(element);
        if (text.length() % 2 != 0) {
            throw malformed(element, "hexBinary", text, null);
        }
        var bytes = new byte[text.length() / 2];
        for (int i = 0; i < bytes.length; i++) {
            int hi = Character.digit(text.charAt(2 * i), 16);
            int lo = Character.digit(text.charAt(2 * i + 1), 16);
            if (hi < 0 || lo < 0) {
                throw malformed(element, "hexBinary", text, null);
            }
            bytes[i] = (byte) ((hi << 4) | lo);
        }
        return bytes;
    }

    static String formatHex(byte[] bytes) {
        var chars = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            chars[2 * i] = HEX[(bytes[i] >> 4) & 0xF];
            chars[2 * i + 1] = HEX[bytes[i] & 0xF];
        }
        return new String(chars);
    }

    static int intAttribute(Element element, String name) throws SarCodecException {
        var value = element.getAttributeValue(name);
        if (value == null) {
            throw new SarCodecException(ErrorType.MALFORMED_XML, XmlTrees.describe(element) + " has no '" + name + "' attribute");
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new SarCodecException(ErrorType.MALFORMED_XML, XmlTrees.describe(element) + " attribute '" + name
                    + "' is not an integer: '" + value + "'", e);
        }
    }

    static SarCodecException malformed(Element element, String type, String text, Throwable cause) {
        return new SarCodecException(ErrorType.MALFORMED_XML, String.format(Locale.ROOT,
                "%s: expected %s but found '%s'", XmlTrees.describe(element), type, text), cause);
    }
}

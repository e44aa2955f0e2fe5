package com.sarcodec.data;

import com.sarcodec.error.ErrorType;
import com.sarcodec.error.SarCodecException;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.Objects;

/**
 * Binary format strings as used by phase-history metadata: {@code "I2"}, {@code "CF8"},
 * {@code "S16"}, or a record such as {@code "X=F8;Y=F8;Z=F8;"}.
 */
@UtilityClass
public class BinaryFormat {

    public DataType parse(String format) throws SarCodecException {
        Objects.requireNonNull(format, "Format cannot be null");
        var text = format.trim();
        if (!text.contains("=")) {
            return parseSingle(text);
        }
        var fields = new ArrayList<DataField>();
        int offset = 0;
        for (var part : text.split(";")) {
            if (part.isBlank()) continue;
            int eq = part.indexOf('=');
            if (eq <= 0 || eq == part.length() - 1) {
                throw new SarCodecException(ErrorType.INVALID_FIELD_VALUE,
                        "Malformed record member '" + part + "' in binary format '" + format + "'");
            }
            var type = parseSingle(part.substring(eq + 1).trim());
            fields.add(new DataField(part.substring(0, eq).trim(), type, offset));
            offset += type.getItemSize();
        }
        if (fields.isEmpty()) {
            throw new SarCodecException(ErrorType.INVALID_FIELD_VALUE, "Empty binary format: '" + format + "'");
        }
        return DataType.struct(fields);
    }

    public String format(DataType type) {
        switch (type.getKind()) {
            case SCALAR:
            case COMPLEX:
            case STRING:
                return type.toString();
            case STRUCT:
                var sb = new StringBuilder();
                for (var field : type.getFields()) {
                    if (field.getType().getKind() == DataType.Kind.STRUCT
                            || field.getType().getKind() == DataType.Kind.AMP_PHASE) {
                        throw new IllegalArgumentException("Nested member '" + field.getName()
                                + "' has no binary format representation");
                    }
                    sb.append(field.getName()).append('=').append(field.getType()).append(';');
                }
                return sb.toString();
            default:
                throw new IllegalArgumentException("No binary format representation for " + type);
        }
    }

    private DataType parseSingle(String code) throws SarCodecException {
        try {
            if (code.startsWith("CI") || code.startsWith("CF")) {
                int size = Integer.parseInt(code.substring(2));
                if (size % 2 != 0) {
                    throw new SarCodecException(ErrorType.INVALID_FIELD_VALUE, "Odd complex size in '" + code + "'");
                }
                var kind = code.charAt(1) == 'F' ? ScalarType.Kind.FLOAT : ScalarType.Kind.SIGNED;
                return DataType.complex(ScalarType.of(kind, size / 2));
            }
            if (code.startsWith("S")) {
                int length = Integer.parseInt(code.substring(1));
                if (length <= 0) {
                    throw new SarCodecException(ErrorType.INVALID_FIELD_VALUE, "Non-positive string length in '" + code + "'");
                }
                return DataType.string(length);
            }
        } catch (NumberFormatException e) {
            throw new SarCodecException(ErrorType.INVALID_FIELD_VALUE, "Malformed binary format '" + code + "'", e);
        }
        return DataType.scalar(ScalarType.fromCode(code));
    }
}

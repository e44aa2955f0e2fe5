package com.sarcodec.sicd;

import com.sarcodec.error.SarCodecException;
import com.sarcodec.header.FieldSpec;
import com.sarcodec.header.HeaderFieldCodec;

/**
 * Build-time checks of producer-chosen header values against their NITF field layout, so
 * an oversized or ill-formed value fails when the fields are built rather than at write time.
 */
final class NitfFieldChecks {

    private NitfFieldChecks() {
    }

    /**
     * Returns {@code value} when it encodes into {@code spec}.
     *
     * @throws IllegalArgumentException if the value is too wide, holds characters the field
     *                                  type does not allow or is not one of the allowed values
     */
    static String checked(FieldSpec spec, String value) {
        try {
            HeaderFieldCodec.encodeField(spec, value);
        } catch (SarCodecException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
        return value;
    }

    static String blankIfNull(String value) {
        return value == null ? "" : value;
    }
}

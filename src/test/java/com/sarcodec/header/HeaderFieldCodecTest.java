package com.sarcodec.header;

import com.sarcodec.error.ErrorType;
import com.sarcodec.error.SarCodecException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class HeaderFieldCodecTest {

    private static final FieldTable SIMPLE = FieldTable.builder("simple")
            .field(FieldSpec.alpha("TAG", 4).withDefault("ABCD"))
            .field(FieldSpec.integer("LEN", 5))
            .field(FieldSpec.alpha("NOTE", 6))
            .build();

    private static final FieldTable GROUPS = FieldTable.builder("groups")
            .field(FieldSpec.integer("NUM", 2))
            .repeat("NUM", 3, FieldSpec.integer("LS", 4), FieldSpec.alpha("ID", 2))
            .field(FieldSpec.integer("XL", 3))
            .when("XL > 0", values -> values.getLong("XL") > 0, body -> body
                    .field(FieldSpec.integer("XOFL", 3))
                    .field(FieldSpec.variable("XDATA", FieldType.ALPHANUMERIC, "XL", 3)))
            .build();

    private static byte[] ascii(String text) {
        return text.getBytes(StandardCharsets.ISO_8859_1);
    }

    @Nested
    @DisplayName("encoding")
    class Encoding {

        @Test
        void shouldPadTextLeftAndIntegersRight() throws SarCodecException {
            var bytes = HeaderFieldCodec.encode(SIMPLE, new HeaderFields().put("LEN", 42).put("NOTE", "hi"));

            assertThat(new String(bytes, StandardCharsets.ISO_8859_1)).isEqualTo("ABCD00042hi    ");
        }

        @Test
        void shouldAcceptIntegersGivenAsText() throws SarCodecException {
            var bytes = HeaderFieldCodec.encode(SIMPLE, new HeaderFields().put("LEN", "7"));

            assertThat(new String(bytes, StandardCharsets.ISO_8859_1)).isEqualTo("ABCD00007      ");
        }

        @Test
        void shouldRejectOverflowWithoutTruncating() {
            assertThatThrownBy(() -> HeaderFieldCodec.encode(SIMPLE, new HeaderFields().put("NOTE", "too long")))
                    .isInstanceOf(SarCodecException.class)
                    .hasMessageContaining("NOTE")
                    .extracting("errorType")
                    .isEqualTo(ErrorType.FIELD_OVERFLOW);
            assertThatThrownBy(() -> HeaderFieldCodec.encode(SIMPLE, new HeaderFields().put("LEN", 123456)))
                    .isInstanceOf(SarCodecException.class)
                    .extracting("errorType")
                    .isEqualTo(ErrorType.FIELD_OVERFLOW);
        }

        @Test
        void shouldRejectInvalidValues() {
            assertThatThrownBy(() -> HeaderFieldCodec.encode(SIMPLE, new HeaderFields().put("LEN", -1)))
                    .isInstanceOf(SarCodecException.class)
                    .extracting("errorType")
                    .isEqualTo(ErrorType.INVALID_FIELD_VALUE);
            assertThatThrownBy(() -> HeaderFieldCodec.encode(SIMPLE, new HeaderFields().put("LEN", "x1")))
                    .isInstanceOf(SarCodecException.class)
                    .extracting("errorType")
                    .isEqualTo(ErrorType.INVALID_FIELD_VALUE);
            assertThatThrownBy(() -> HeaderFieldCodec.encode(SIMPLE, new HeaderFields().put("NOTE", "tab\t")))
                    .isInstanceOf(SarCodecException.class)
                    .extracting("errorType")
                    .isEqualTo(ErrorType.INVALID_FIELD_VALUE);
        }

        @Test
        void shouldEnforceAllowedValues() throws SarCodecException {
            var spec = FieldSpec.alpha("CLAS", 1).withAllowed("U", "C", "S");

            assertThat(HeaderFieldCodec.encodeField(spec, "U")).containsExactly('U');
            assertThatThrownBy(() -> HeaderFieldCodec.encodeField(spec, "X"))
                    .isInstanceOf(SarCodecException.class)
                    .extracting("errorType")
                    .isEqualTo(ErrorType.INVALID_FIELD_VALUE);
        }

        @Test
        void shouldExpandRepeatsAndConditionals() throws SarCodecException {
            var values = new HeaderFields()
                    .put("NUM", 2)
                    .put("LS001", 10).put("ID001", "a")
                    .put("LS002", 20).put("ID002", "b")
                    .put("XL", 5).put("XOFL", 0).put("XDATA", "xy");

            var text = new String(HeaderFieldCodec.encode(GROUPS, values), StandardCharsets.ISO_8859_1);

            assertThat(text).isEqualTo("020010a 0020b 005000xy");
            assertThat(HeaderFieldCodec.encodedLength(GROUPS, values)).isEqualTo(text.length());
        }

        @Test
        void shouldSkipConditionalWhenConditionFails() throws SarCodecException {
            var values = new HeaderFields().put("NUM", 0).put("XL", 0);

            assertThat(HeaderFieldCodec.encode(GROUPS, values)).containsExactly(ascii("00000"));
        }
    }

    @Nested
    @DisplayName("decoding")
    class Decoding {

        @Test
        void shouldDecodeTypedValues() throws SarCodecException {
            var values = HeaderFieldCodec.decode(SIMPLE, ascii("WXYZ00042hi    "), 0);

            assertThat(values.get("TAG")).isEqualTo("WXYZ");
            assertThat(values.get("LEN")).isEqualTo(42L);
            assertThat(values.get("NOTE")).isEqualTo("hi");
        }

        @Test
        void shouldDecodeWhatWasEncoded() throws SarCodecException {
            var values = new HeaderFields()
                    .put("NUM", 1L).put("LS001", 99L).put("ID001", "zz")
                    .put("XL", 4L).put("XOFL", 12L).put("XDATA", "q");

            var decoded = HeaderFieldCodec.decode(GROUPS, HeaderFieldCodec.encode(GROUPS, values), 0);

            assertThat(decoded).isEqualTo(values);
        }

        @Test
        void shouldReportTruncationWithFileOffset() {
            assertThatThrownBy(() -> HeaderFieldCodec.decode(SIMPLE, ascii("WXYZ0004"), 100))
                    .isInstanceOf(SarCodecException.class)
                    .hasMessageContaining("LEN")
                    .hasMessageContaining("104")
                    .extracting("errorType")
                    .isEqualTo(ErrorType.MALFORMED_HEADER);
        }

        @Test
        void shouldRejectBadCharacters() {
            assertThatThrownBy(() -> HeaderFieldCodec.decode(SIMPLE, ascii("WXYZ0A042hi    "), 0))
                    .isInstanceOf(SarCodecException.class)
                    .hasMessageContaining("LEN")
                    .extracting("errorType")
                    .isEqualTo(ErrorType.MALFORMED_HEADER);
        }

        @Test
        void shouldRejectTrailingBytesUnlessDecodingPrefix() throws SarCodecException {
            var bytes = ascii("WXYZ00042hi    extra");

            assertThatThrownBy(() -> HeaderFieldCodec.decode(SIMPLE, bytes, 0))
                    .isInstanceOf(SarCodecException.class)
                    .extracting("errorType")
                    .isEqualTo(ErrorType.MALFORMED_HEADER);
            assertThat(HeaderFieldCodec.decodePrefix(SIMPLE, bytes, 0).getLong("LEN")).isEqualTo(42L);
        }

        @Test
        void shouldDecodeSingleField() throws SarCodecException {
            var value = HeaderFieldCodec.decodeField(FieldSpec.integer("HL", 6), ascii("....000404...."), 4, 0);

            assertThat(value).isEqualTo(404L);
        }

        @Test
        void shouldRejectDisallowedDecodedValue() {
            var table = FieldTable.builder("t").field(FieldSpec.alpha("FHDR", 4).withAllowed("NITF")).build();

            assertThatThrownBy(() -> HeaderFieldCodec.decode(table, ascii("NSIF"), 0))
                    .isInstanceOf(SarCodecException.class)
                    .extracting("errorType")
                    .isEqualTo(ErrorType.MALFORMED_HEADER);
        }
    }
}

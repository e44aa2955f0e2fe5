package com.sarcodec.cphd;

import com.sarcodec.error.ErrorType;
import com.sarcodec.error.SarCodecException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CphdHeaderTest {

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void shouldEncodeVersionLineKvpsAndTerminator() {
        var kvps = new LinkedHashMap<String, String>();
        kvps.put("XML_BLOCK_SIZE", "100");
        kvps.put("CLASSIFICATION", "UNCLASSIFIED");
        var header = new CphdHeader("1.1.0", kvps);

        assertThat(new String(header.encode(), StandardCharsets.UTF_8))
                .isEqualTo("CPHD/1.1.0\nXML_BLOCK_SIZE := 100\nCLASSIFICATION := UNCLASSIFIED\n\f\n");
    }

    @Test
    void shouldDecodeWhatItEncodes() throws SarCodecException {
        var kvps = new LinkedHashMap<String, String>();
        kvps.put("XML_BLOCK_SIZE", "100");
        kvps.put("XML_BLOCK_BYTE_OFFSET", "130");
        kvps.put("EXTRA", "a := b");
        var encoded = new CphdHeader("1.0.1", kvps).encode();

        var decoded = CphdHeader.decode(encoded, CphdHeader.findEnd(encoded, encoded.length));

        assertThat(decoded.getVersion()).isEqualTo("1.0.1");
        assertThat(decoded.getKvps()).containsExactlyEntriesOf(kvps);
        assertThat(decoded.getLong("XML_BLOCK_BYTE_OFFSET")).isEqualTo(130);
        assertThat(decoded.additionalKvps()).containsExactly(Map.entry("EXTRA", "a := b"));
    }

    @Test
    void shouldFindTerminatorOnlyAfterCompleteLine() {
        var text = bytes("CPHD/1.1.0\nA := 1\n\f\nXML");

        assertThat(CphdHeader.findEnd(text, text.length)).isEqualTo(text.length - 3);
        assertThat(CphdHeader.findEnd(text, 12)).isEqualTo(-1);
    }

    @Test
    void shouldReserveAlignedLength() {
        var header = new CphdHeader("1.1.0", Map.of("XML_BLOCK_SIZE", CphdHeader.OFFSET_PLACEHOLDER));
        long text = header.encode().length - 2;

        long reserved = header.reservedLength();

        assertThat(reserved - 2).isGreaterThanOrEqualTo(text);
        assertThat((reserved - 2) % CphdHeader.ALIGNMENT).isZero();
    }

    @Test
    void shouldRejectOtherFormats() {
        var text = bytes("NITF/2.1\nA := 1\n\f\n");

        assertThatThrownBy(() -> CphdHeader.decode(text, text.length))
                .isInstanceOf(SarCodecException.class)
                .extracting("errorType").isEqualTo(ErrorType.UNSUPPORTED_FORMAT);
    }

    @Test
    void shouldRejectLineWithoutSeparator() {
        var text = bytes("CPHD/1.1.0\nA := 1\nBROKEN\n\f\n");

        assertThatThrownBy(() -> CphdHeader.decode(text, text.length))
                .isInstanceOf(SarCodecException.class)
                .hasMessageContaining("line 3")
                .extracting("errorType").isEqualTo(ErrorType.MALFORMED_HEADER);
    }

    @Test
    void shouldRejectRepeatedKey() {
        var text = bytes("CPHD/1.1.0\nA := 1\nA := 2\n\f\n");

        assertThatThrownBy(() -> CphdHeader.decode(text, text.length))
                .isInstanceOf(SarCodecException.class)
                .extracting("errorType").isEqualTo(ErrorType.MALFORMED_HEADER);
    }

    @Test
    void shouldRejectMissingOrNonNumericValues() {
        var header = new CphdHeader("1.1.0", Map.of("PVP_BLOCK_SIZE", "12a"));

        assertThatThrownBy(() -> header.getLong(CphdHeader.SIGNAL_BLOCK_SIZE))
                .isInstanceOf(SarCodecException.class)
                .extracting("errorType").isEqualTo(ErrorType.MALFORMED_HEADER);
        assertThatThrownBy(() -> header.getLong(CphdHeader.PVP_BLOCK_SIZE))
                .isInstanceOf(SarCodecException.class)
                .extracting("errorType").isEqualTo(ErrorType.MALFORMED_HEADER);
    }

    @Test
    void shouldRejectComputedKeysInProducerFields() {
        var builder = CphdFileHeaderFields.builder().classification("U").releaseInfo("R");

        assertThatThrownBy(() -> builder.additionalKvps(Map.of("PVP_BLOCK_SIZE", "1")).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.additionalKvps(Map.of("NOTE", "two\nlines")).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.additionalKvps(Map.of("BAD KEY", "x")).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}

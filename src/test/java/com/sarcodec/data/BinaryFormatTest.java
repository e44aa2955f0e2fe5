package com.sarcodec.data;

import com.sarcodec.error.ErrorType;
import com.sarcodec.error.SarCodecException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

class BinaryFormatTest {

    @ParameterizedTest
    @CsvSource({
            "I2, SCALAR, 2",
            "U8, SCALAR, 8",
            "F4, SCALAR, 4",
            "CI2, COMPLEX, 2",
            "CI4, COMPLEX, 4",
            "CF8, COMPLEX, 8",
            "CF16, COMPLEX, 16",
            "S16, STRING, 16"
    })
    void shouldParseSingleFormats(String format, DataType.Kind kind, int itemSize) throws SarCodecException {
        var type = BinaryFormat.parse(format);

        assertThat(type.getKind()).isEqualTo(kind);
        assertThat(type.getItemSize()).isEqualTo(itemSize);
        assertThat(BinaryFormat.format(type)).isEqualTo(format);
    }

    @Test
    void shouldParseComplexComponents() throws SarCodecException {
        assertThat(BinaryFormat.parse("CI2").getComponent()).isEqualTo(ScalarType.I1);
        assertThat(BinaryFormat.parse("CF8").getComponent()).isEqualTo(ScalarType.F4);
    }

    @Test
    void shouldParseRecordFormat() throws SarCodecException {
        var type = BinaryFormat.parse("X=F8;Y=F8;Z=F8;");

        assertThat(type.getKind()).isEqualTo(DataType.Kind.STRUCT);
        assertThat(type.getItemSize()).isEqualTo(24);
        assertThat(type.getFields()).extracting(DataField::getName).containsExactly("X", "Y", "Z");
        assertThat(type.getFields()).extracting(DataField::getOffset).containsExactly(0, 8, 16);
        assertThat(BinaryFormat.format(type)).isEqualTo("X=F8;Y=F8;Z=F8;");
    }

    @Test
    void shouldParseMixedRecordWithoutTrailingSemicolon() throws SarCodecException {
        var type = BinaryFormat.parse("Gain=F4;Flag=U1");

        assertThat(type.getItemSize()).isEqualTo(5);
        assertThat(type.getFields().get(1).getType()).isEqualTo(DataType.scalar(ScalarType.U1));
    }

    @ParameterizedTest
    @ValueSource(strings = {"Q4", "CI3", "S0", "Sx", "X=;", "=F8;", ";;"})
    void shouldRejectMalformedFormats(String format) {
        assertThatThrownBy(() -> BinaryFormat.parse(format))
                .isInstanceOf(SarCodecException.class)
                .extracting("errorType")
                .isEqualTo(ErrorType.INVALID_FIELD_VALUE);
    }

    @Test
    void shouldNotFormatAmplitudePhase() {
        assertThatThrownBy(() -> BinaryFormat.format(DataType.ampPhase()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

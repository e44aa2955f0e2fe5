package com.sarcodec.data;

import com.sarcodec.error.ErrorType;
import com.sarcodec.error.SarCodecException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

import static org.assertj.core.api.Assertions.*;

class PayloadArrayTest {

    private static final DataType CF8 = DataType.complex(ScalarType.F4);

    @Test
    void shouldStoreBigEndianComplexValues() {
        var array = PayloadArray.allocate(CF8, 2, 3);
        array.setComplex(array.flatIndex(1, 2), 1.5, -2.0);

        assertThat(array.getByteLength()).isEqualTo(48);
        assertThat(array.getReal(5)).isEqualTo(1.5);
        assertThat(array.getImag(5)).isEqualTo(-2.0);
        var buffer = array.asByteBuffer();
        assertThat(buffer.getFloat(40)).isEqualTo(1.5f);
        assertThat(buffer.get(40)).isEqualTo((byte) 0x3F);
    }

    @Test
    void shouldReadUnsignedScalars() {
        var array = PayloadArray.allocate(DataType.scalar(ScalarType.U2), 1);
        array.setDouble(0, 65535);

        assertThat(array.getDouble(0)).isEqualTo(65535.0);
        assertThat(array.toByteArray()).containsExactly(0xFF, 0xFF);
    }

    @Test
    void shouldKeep64BitIntegersExact() {
        long beyondDouble = (1L << 53) + 1;
        var signed = PayloadArray.allocate(DataType.scalar(ScalarType.I8), 2);
        signed.setLong(0, beyondDouble);
        signed.setLong(1, Long.MIN_VALUE);

        assertThat(signed.getLong(0)).isEqualTo(beyondDouble);
        assertThat(signed.getLong(1)).isEqualTo(Long.MIN_VALUE);

        var unsigned = PayloadArray.allocate(DataType.scalar(ScalarType.U8), 1);
        unsigned.setLong(0, -1L);
        assertThat(Long.toUnsignedString(unsigned.getLong(0))).isEqualTo("18446744073709551615");
    }

    @Test
    void shouldZeroExtendUnsignedIntegers() {
        var array = PayloadArray.allocate(DataType.scalar(ScalarType.U4), 1);
        array.setLong(0, 0xFFFFFFFFL);

        assertThat(array.getLong(0)).isEqualTo(4294967295L);
        assertThatThrownBy(() -> PayloadArray.allocate(DataType.scalar(ScalarType.F8), 1).getLong(0))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void shouldAccessIntegerStructFieldsExactly() throws SarCodecException {
        var array = PayloadArray.allocate(BinaryFormat.parse("T=F8;SIGNAL=I8;"), 1);
        array.setFieldLong(0, "SIGNAL", (1L << 53) + 1);

        assertThat(array.getFieldLong(0, "SIGNAL")).isEqualTo(9007199254740993L);
        assertThat(array.getField(0, "T")).isZero();
    }

    @Test
    void shouldAccessStructFieldsByName() throws SarCodecException {
        var type = BinaryFormat.parse("A=I4;B=F8;");
        var array = PayloadArray.allocate(type, 2);
        array.setField(1, "A", -7);
        array.setField(1, "B", 3.25);

        assertThat(array.getField(1, "A")).isEqualTo(-7.0);
        assertThat(array.getField(1, "B")).isEqualTo(3.25);
        assertThat(array.getField(0, "B")).isZero();
        assertThatThrownBy(() -> array.getField(0, "C")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldPadStrings() {
        var array = PayloadArray.allocate(DataType.string(6), 1);
        array.setString(0, "abc");

        assertThat(array.getString(0)).isEqualTo("abc");
        assertThat(array.toByteArray()).containsExactly('a', 'b', 'c', 0, 0, 0);
        assertThatThrownBy(() -> array.setString(0, "toolong")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectWrapWithWrongLength() {
        assertThatThrownBy(() -> PayloadArray.wrap(CF8, ByteBuffer.allocate(7), 1))
                .isInstanceOf(SarCodecException.class)
                .extracting("errorType")
                .isEqualTo(ErrorType.PAYLOAD_MISMATCH);
    }

    @Test
    void shouldCompareByTypeShapeAndBytes() throws SarCodecException {
        var a = PayloadArray.allocate(CF8, 2, 2);
        a.setComplex(3, 1, 1);
        var b = PayloadArray.wrap(CF8, ByteBuffer.wrap(a.toByteArray()), 2, 2);

        assertThat(b).isEqualTo(a);
        assertThat(b.hashCode()).isEqualTo(a.hashCode());
        assertThat(PayloadArray.wrap(CF8, ByteBuffer.wrap(a.toByteArray()), 4, 1)).isNotEqualTo(a);
    }

    @Nested
    class Slicing {

        private PayloadArray numbered() {
            var array = PayloadArray.allocate(DataType.scalar(ScalarType.I2), 4, 5);
            for (int i = 0; i < 20; i++) {
                array.setDouble(i, i);
            }
            return array;
        }

        @Test
        void shouldCopyRows() {
            var rows = numbered().rows(1, 2);

            assertThat(rows.getShape()).containsExactly(2, 5);
            assertThat(rows.getDouble(0)).isEqualTo(5.0);
            assertThat(rows.getDouble(9)).isEqualTo(14.0);
        }

        @Test
        void shouldCopyBlocks() {
            var block = numbered().block(1, 2, 2, 3);

            assertThat(block.getShape()).containsExactly(2, 3);
            assertThat(block.getDouble(0)).isEqualTo(7.0);
            assertThat(block.getDouble(5)).isEqualTo(14.0);
        }

        @Test
        void shouldRejectOutOfBoundsSlices() {
            var array = numbered();

            assertThatThrownBy(() -> array.rows(3, 2)).isInstanceOf(IndexOutOfBoundsException.class);
            assertThatThrownBy(() -> array.block(0, 3, 1, 3)).isInstanceOf(IndexOutOfBoundsException.class);
        }
    }
}

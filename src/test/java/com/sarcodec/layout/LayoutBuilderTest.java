package com.sarcodec.layout;

import com.sarcodec.data.DataType;
import com.sarcodec.data.ScalarType;
import com.sarcodec.error.ErrorType;
import com.sarcodec.error.SarCodecException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class LayoutBuilderTest {

    private static final DataType CF8 = DataType.complex(ScalarType.F4);

    private static LayoutPlan sample() throws SarCodecException {
        return new LayoutBuilder("TEST", 10_000, 1)
                .header("header", 100)
                .pending("magic", 0, 4)
                .metadata("xml", 50)
                .padding("none", 0)
                .padding("gap", 6)
                .data("pixels", CF8, 10, 20)
                .build();
    }

    @Test
    void shouldPlaceSegmentsBackToBack() throws SarCodecException {
        var plan = sample();

        assertThat(plan.getSegments()).extracting(Segment::getName).containsExactly("header", "xml", "gap", "pixels");
        assertThat(plan.getSegments()).extracting(Segment::getOffset).containsExactly(0L, 100L, 150L, 156L);
        assertThat(plan.getTotalLength()).isEqualTo(156 + 10 * 20 * 8);
        for (int i = 1; i < plan.getSegments().size(); i++) {
            assertThat(plan.getSegment(i).getOffset()).isEqualTo(plan.getSegment(i - 1).getEnd());
        }
    }

    @Test
    void shouldBeDeterministic() throws SarCodecException {
        assertThat(sample()).isEqualTo(sample());
    }

    @Test
    void shouldDescribeDataSegments() throws SarCodecException {
        var plan = sample();
        var pixels = plan.find("pixels").orElseThrow();

        assertThat(plan.dataSegments()).containsExactly(pixels);
        assertThat(pixels.getShape()).containsExactly(10, 20);
        assertThat(pixels.getDataType()).isEqualTo(CF8);
        assertThat(plan.segmentsOf(SegmentKind.PADDING)).hasSize(1);
        assertThat(plan.getPendingFields()).containsExactly(new PendingField("magic", 0, 4));
    }

    @Test
    void shouldPadToBlockAlignment() throws SarCodecException {
        var plan = new LayoutBuilder("TEST", 10_000, 64).header("header", 70).build();

        assertThat(plan.getTotalLength()).isEqualTo(128);
        assertThat(plan.getSegment(1).getKind()).isEqualTo(SegmentKind.PADDING);
        assertThat(plan.getSegment(1).getLength()).isEqualTo(58);
    }

    @Test
    void shouldRejectFilesBeyondAddressableLength() {
        assertThatThrownBy(() -> new LayoutBuilder("TEST", 1000, 1).header("header", 10).data("big", CF8, 100, 2))
                .isInstanceOf(SarCodecException.class)
                .hasMessageContaining("big")
                .extracting("errorType")
                .isEqualTo(ErrorType.LAYOUT_ERROR);
    }

    @Test
    void shouldRejectNonPositiveDimensions() {
        assertThatThrownBy(() -> new LayoutBuilder("TEST", 1000, 1).data("empty", CF8, 0, 5))
                .isInstanceOf(SarCodecException.class)
                .extracting("errorType")
                .isEqualTo(ErrorType.LAYOUT_ERROR);
        assertThatThrownBy(() -> new LayoutBuilder("TEST", 1000, 1).data("none", CF8))
                .isInstanceOf(SarCodecException.class)
                .extracting("errorType")
                .isEqualTo(ErrorType.LAYOUT_ERROR);
    }

    @Test
    void shouldRejectOverflowingSizes() {
        assertThatThrownBy(() -> new LayoutBuilder("TEST", Long.MAX_VALUE, 1)
                .data("huge", CF8, Integer.MAX_VALUE, Integer.MAX_VALUE, Integer.MAX_VALUE))
                .isInstanceOf(SarCodecException.class)
                .extracting("errorType")
                .isEqualTo(ErrorType.LAYOUT_ERROR);
    }

    @Test
    void shouldRejectPendingFieldOutsideFile() {
        assertThatThrownBy(() -> new LayoutBuilder("TEST", 1000, 1).header("header", 10).pending("late", 8, 4).build())
                .isInstanceOf(SarCodecException.class)
                .extracting("errorType")
                .isEqualTo(ErrorType.LAYOUT_ERROR);
    }
}

package com.sarcodec.sicd;

import com.sarcodec.error.ErrorType;
import com.sarcodec.error.SarCodecException;
import com.sarcodec.layout.Segment;
import com.sarcodec.layout.SegmentKind;
import com.sarcodec.xml.XmlHelper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SicdNitfPlannerTest {

    @Test
    void shouldPlanSingleSegmentProduct() throws SarCodecException {
        var layout = SicdTestData.planner().layout(SicdTestData.plan(SicdTestData.sicdXml(PixelType.RE32F_IM32F, 5727, 2362)));
        var plan = layout.getPlan();

        assertThat(plan.getFormat()).isEqualTo("NITF");
        assertThat(plan.getSegments()).extracting(Segment::getName).containsExactly(
                "file header", "image subheader 001", "image segment 001", "DES subheader 001", "SICD XML");
        var image = plan.find("image segment 001").orElseThrow();
        assertThat(image.getKind()).isEqualTo(SegmentKind.DATA);
        assertThat(image.getLength()).isEqualTo(5727L * 2362 * 8);
        assertThat(image.getShape()).containsExactly(5727, 2362);
        assertThat(plan.getSegments().stream().mapToLong(Segment::getLength).sum()).isEqualTo(plan.getTotalLength());
        assertThat(plan.getPendingFields()).hasSize(1);
    }

    @Test
    void shouldFillHeadersFromXmlAndPlan() throws SarCodecException {
        var layout = SicdTestData.planner().layout(SicdTestData.plan(SicdTestData.sicdXml(PixelType.RE32F_IM32F, 5727, 2362)));

        var fileHeader = layout.getFileHeader();
        assertThat(fileHeader.getLong("CLEVEL")).isEqualTo(5);
        assertThat(fileHeader.getLong("FL")).isEqualTo(layout.getPlan().getTotalLength());
        assertThat(fileHeader.getLong("HL")).isEqualTo(layout.getFileHeaderBytes().length);
        assertThat(fileHeader.getString("FTITLE")).isEqualTo(SicdTestData.FTITLE);
        assertThat(fileHeader.getString("FDT")).isEqualTo("20240501120000");

        var subheader = layout.getImageSubheaders().get(0);
        assertThat(subheader.getString("IID1")).isEqualTo("SICD000");
        assertThat(subheader.getString("PVTYPE")).isEqualTo("R");
        assertThat(subheader.getString("ICORDS")).isEqualTo("G");
        assertThat(subheader.getLong("NROWS")).isEqualTo(5727);
        assertThat(subheader.getLong("NCOLS")).isEqualTo(2362);
        assertThat(subheader.getLong("NBPP")).isEqualTo(32);
        assertThat(subheader.getString("IMODE")).isEqualTo("P");

        var des = layout.getDesSubheader();
        assertThat(des.getString("DESID")).isEqualTo("XML_DATA_CONTENT");
        assertThat(des.getString("DESSHTN")).isEqualTo(SicdTestData.NAMESPACE);
        assertThat(des.getString("DESSHRP")).isEqualTo("producer");
    }

    @Test
    void shouldSplitOversizedImageIntoSegments() throws SarCodecException {
        var layout = SicdTestData.planner().layout(SicdTestData.plan(SicdTestData.sicdXml(PixelType.RE32F_IM32F, 150_000, 10_000)));

        assertThat(layout.getImageSegments()).extracting(ImageSegmentSizing.SegmentInfo::getNumRows)
                .containsExactly(99_999, 50_001);
        assertThat(layout.getImageSubheaders()).extracting(h -> h.getString("IID1")).containsExactly("SICD001", "SICD002");
        assertThat(layout.getImageSubheaders().get(1).getString("ILOC")).isEqualTo("9999900000");
        assertThat(layout.getImageSubheaders().get(1).getLong("IALVL")).isEqualTo(1);
        assertThat(layout.getImageSubheaders().get(0).getLong("NPPBH")).isZero();
        assertThat(layout.getFileHeader().getLong("NUMI")).isEqualTo(2);
        assertThat(layout.getPlan().dataSegments()).hasSize(2);
    }

    @Test
    void shouldPlanDeterministicallyWithFixedClock() throws SarCodecException {
        var planner = SicdTestData.planner();
        var first = planner.layout(SicdTestData.plan(SicdTestData.sicdXml(PixelType.AMP8I_PHS8I, 40, 30)));
        var second = planner.layout(SicdTestData.plan(SicdTestData.sicdXml(PixelType.AMP8I_PHS8I, 40, 30)));

        assertThat(second.getPlan()).isEqualTo(first.getPlan());
        assertThat(second.getFileHeaderBytes()).isEqualTo(first.getFileHeaderBytes());
        assertThat(second.getDesSubheaderBytes()).isEqualTo(first.getDesSubheaderBytes());
        assertThat(second.getXmlBytes()).isEqualTo(first.getXmlBytes());
    }

    @Test
    void shouldRejectXmlWithoutImageCorners() throws SarCodecException {
        var xml = SicdTestData.sicdXml(PixelType.RE16I_IM16I, 10, 10);
        new XmlHelper(xml, SicdTranscoders.create()).find("./{*}GeoData").removeChild("ImageCorners", xml.getRootElement().getNamespace());
        var plan = SicdTestData.plan(xml);

        assertThatThrownBy(() -> SicdTestData.planner().plan(plan))
                .isInstanceOf(SarCodecException.class)
                .extracting("errorType").isEqualTo(ErrorType.MALFORMED_XML);
    }

    @Test
    void shouldRejectUnknownPixelType() throws SarCodecException {
        var xml = SicdTestData.sicdXml(PixelType.RE16I_IM16I, 10, 10);
        var helper = new XmlHelper(xml, SicdTranscoders.create());

        assertThatThrownBy(() -> helper.set("./{*}ImageData/{*}PixelType", "RE64F_IM64F"))
                .isInstanceOf(SarCodecException.class)
                .extracting("errorType").isEqualTo(ErrorType.INVALID_FIELD_VALUE);

        helper.find("./{*}ImageData/{*}PixelType").setText("RE64F_IM64F");
        var plan = SicdTestData.plan(xml);

        assertThatThrownBy(() -> SicdTestData.planner().plan(plan))
                .isInstanceOf(SarCodecException.class)
                .extracting("errorType").isEqualTo(ErrorType.MALFORMED_XML);
    }
}

package com.sarcodec.sicd;

import com.sarcodec.header.HeaderFields;
import com.sarcodec.layout.LayoutPlan;
import lombok.Value;

import java.util.List;

/**
 * Result of planning a SICD NITF: the segment layout plus the encoded headers and XML that
 * fill its header and metadata segments.
 */
@Value
public class SicdNitfLayout {
    static final String FILE_HEADER = "file header";
    static final String DES_SUBHEADER = "DES subheader 001";
    static final String SICD_XML = "SICD XML";

    SicdNitfPlan model;
    LayoutPlan plan;
    PixelType pixelType;
    int numRows;
    int numCols;
    List<ImageSegmentSizing.SegmentInfo> imageSegments;
    HeaderFields fileHeader;
    List<HeaderFields> imageSubheaders;
    HeaderFields desSubheader;
    byte[] fileHeaderBytes;
    List<byte[]> imageSubheaderBytes;
    byte[] desSubheaderBytes;
    byte[] xmlBytes;

    static String imageSubheaderName(int index) {
        return String.format("image subheader %03d", index + 1);
    }

    static String imageSegmentName(int index) {
        return String.format("image segment %03d", index + 1);
    }
}

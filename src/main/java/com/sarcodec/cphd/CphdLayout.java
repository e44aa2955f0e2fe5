package com.sarcodec.cphd;

import com.sarcodec.layout.LayoutPlan;
import lombok.Value;

/**
 * Result of planning a CPHD: the segment layout, the header that describes it and the
 * serialized XML.
 */
@Value
public class CphdLayout {
    static final String FILE_HEADER = "file header";
    static final String CPHD_XML = "CPHD XML";
    static final String XML_TERMINATOR = "XML section terminator";

    CphdPlan model;
    CphdStructure structure;
    LayoutPlan plan;
    CphdHeader header;
    byte[] headerBytes;
    byte[] xmlBytes;

    static String signalSegmentName(String channel) {
        return "signal " + channel;
    }

    static String pvpSegmentName(String channel) {
        return "PVP " + channel;
    }

    static String supportSegmentName(String identifier) {
        return "support array " + identifier;
    }
}

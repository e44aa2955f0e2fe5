package com.sarcodec.sicd;

import lombok.Builder;
import lombok.Value;
import org.jdom2.Document;

import java.util.Objects;

/**
 * Everything needed to write a SICD NITF: the SICD XML and the NITF fields a producer
 * controls. All other header values are derived from the XML.
 */
@Value
public class SicdNitfPlan {
    Document sicdXml;
    SicdNitfHeaderFields headerFields;
    SicdNitfImageSegmentFields imageSegmentFields;
    SicdNitfDesFields desFields;

    @Builder(toBuilder = true)
    private SicdNitfPlan(Document sicdXml, SicdNitfHeaderFields headerFields,
                         SicdNitfImageSegmentFields imageSegmentFields, SicdNitfDesFields desFields) {
        this.sicdXml = Objects.requireNonNull(sicdXml, "SICD XML cannot be null");
        this.headerFields = Objects.requireNonNull(headerFields, "Header fields cannot be null");
        this.imageSegmentFields = Objects.requireNonNull(imageSegmentFields, "Image segment fields cannot be null");
        this.desFields = Objects.requireNonNull(desFields, "DES fields cannot be null");
    }

    /**
     * Copy whose XML document is detached from the caller's.
     */
    public SicdNitfPlan snapshot() {
        return toBuilder().sicdXml(sicdXml.clone()).build();
    }
}

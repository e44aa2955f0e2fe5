package com.sarcodec.cphd;

import lombok.Builder;
import lombok.Value;
import org.jdom2.Document;

import java.util.Objects;

/**
 * Everything needed to write a CPHD: the CPHD XML, which declares every array, and the file
 * header values a producer controls.
 */
@Value
public class CphdPlan {
    Document cphdXml;
    CphdFileHeaderFields fileHeader;

    @Builder(toBuilder = true)
    private CphdPlan(Document cphdXml, CphdFileHeaderFields fileHeader) {
        this.cphdXml = Objects.requireNonNull(cphdXml, "CPHD XML cannot be null");
        this.fileHeader = Objects.requireNonNull(fileHeader, "File header fields cannot be null");
    }

    /**
     * Copy whose XML document is detached from the caller's.
     */
    public CphdPlan snapshot() {
        return toBuilder().cphdXml(cphdXml.clone()).build();
    }
}

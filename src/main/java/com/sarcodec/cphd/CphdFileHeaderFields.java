package com.sarcodec.cphd;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * File header values a CPHD producer chooses. Block sizes and offsets are always computed;
 * additional key/value pairs follow them in insertion order.
 */
@Value
public class CphdFileHeaderFields {
    String classification;
    String releaseInfo;
    Map<String, String> additionalKvps;

    @Builder(toBuilder = true)
    private CphdFileHeaderFields(String classification, String releaseInfo, Map<String, String> additionalKvps) {
        this.classification = CphdHeader.checkValue("CLASSIFICATION",
                Objects.requireNonNull(classification, "CLASSIFICATION cannot be null"));
        this.releaseInfo = CphdHeader.checkValue("RELEASE_INFO",
                Objects.requireNonNull(releaseInfo, "RELEASE_INFO cannot be null"));
        var kvps = new LinkedHashMap<String, String>();
        if (additionalKvps != null) {
            additionalKvps.forEach((key, value) -> {
                if (CphdHeader.DEFINED_KEYS.contains(key)) {
                    throw new IllegalArgumentException("Header key " + key + " is computed and cannot be supplied");
                }
                kvps.put(CphdHeader.checkKey(key), CphdHeader.checkValue(key, value));
            });
        }
        this.additionalKvps = Collections.unmodifiableMap(kvps);
    }
}

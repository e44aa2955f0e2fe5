package com.sarcodec.sicd;

import lombok.Value;
import lombok.experimental.UtilityClass;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Known SICD XML namespaces with the version and date recorded in the DES subheader.
 */
@UtilityClass
public class SicdVersions {
    public final String SPECIFICATION_IDENTIFIER = "SICD Volume 1 Design & Implementation Description Document";
    public final String NAMESPACE_PREFIX = "urn:SICD";

    private final Map<String, VersionInfo> VERSIONS = createVersions();

    @Value
    public static class VersionInfo {
        String version;
        String date;
    }

    public Optional<VersionInfo> lookup(String namespace) {
        return Optional.ofNullable(VERSIONS.get(namespace));
    }

    public Map<String, VersionInfo> all() {
        return VERSIONS;
    }

    private Map<String, VersionInfo> createVersions() {
        var versions = new LinkedHashMap<String, VersionInfo>();
        versions.put("urn:SICD:1.1.0", new VersionInfo("1.1", "2014-09-30T00:00:00Z"));
        versions.put("urn:SICD:1.2.1", new VersionInfo("1.2.1", "2018-12-13T00:00:00Z"));
        versions.put("urn:SICD:1.3.0", new VersionInfo("1.3.0", "2021-11-30T00:00:00Z"));
        versions.put("urn:SICD:1.4.0", new VersionInfo("1.4.0", "2023-10-26T00:00:00Z"));
        return Collections.unmodifiableMap(versions);
    }
}

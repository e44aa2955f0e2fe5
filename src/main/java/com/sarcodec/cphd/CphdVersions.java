package com.sarcodec.cphd;

import lombok.Value;
import lombok.experimental.UtilityClass;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Known CPHD XML namespaces and the version written on the first header line.
 */
@UtilityClass
public class CphdVersions {

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
        versions.put("http://api.nsgreg.nga.mil/schema/cphd/1.0.1", new VersionInfo("1.0.1", "2018-05-21T00:00:00Z"));
        versions.put("http://api.nsgreg.nga.mil/schema/cphd/1.1.0", new VersionInfo("1.1.0", "2021-11-30T00:00:00Z"));
        return Collections.unmodifiableMap(versions);
    }
}

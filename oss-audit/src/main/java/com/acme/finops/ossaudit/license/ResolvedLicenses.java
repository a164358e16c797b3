package com.acme.finops.ossaudit.license;

import com.acme.finops.ossaudit.model.AuditWarning;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * License text per jar URL for one run. URLs whose lookup failed map to the
 * empty string and have a matching {@link AuditWarning}.
 */
public final class ResolvedLicenses {
    private final SortedMap<String, String> byUrl;
    private final List<AuditWarning> warnings;

    public ResolvedLicenses(Map<String, String> byUrl, List<AuditWarning> warnings) {
        this.byUrl = new TreeMap<>(byUrl);
        this.warnings = List.copyOf(warnings);
    }

    public static ResolvedLicenses empty() {
        return new ResolvedLicenses(Map.of(), List.of());
    }

    public String licenseFor(String jarUrl) {
        if (jarUrl == null) {
            return "";
        }
        return byUrl.getOrDefault(jarUrl, "");
    }

    public boolean contains(String jarUrl) {
        return byUrl.containsKey(jarUrl);
    }

    public int size() {
        return byUrl.size();
    }

    public List<AuditWarning> warnings() {
        return warnings;
    }
}

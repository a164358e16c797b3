package com.acme.finops.ossaudit.manifest;

import com.acme.finops.ossaudit.model.AuditIssue;
import com.acme.finops.ossaudit.model.PackageRecord;
import com.acme.finops.ossaudit.policy.PolicyEntry;
import com.acme.finops.ossaudit.policy.PolicyLists;
import com.acme.finops.ossaudit.util.AuditDefaults;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renders manifest entries into the BOM document shape: one mapping per
 * package keyed by coordinate, fields in alphabetical order.
 *
 * <pre>
 * com.google.code.findbugs:jsr305:3.0.2:
 *   copyright_notices: ''
 *   interaction_types: []
 *   jar_url: https://repo1.maven.org/maven2/com/google/code/findbugs/jsr305/3.0.2/jsr305-3.0.2.jar
 *   license: The Apache Software License, Version 2.0
 *   maven-artifactId: jsr305
 *   maven-groupId: com.google.code.findbugs
 *   modified: 'no'
 *   name: com.google.code.findbugs:jsr305
 *   repository: Maven
 *   resolution: ''
 *   url: https://repo1.maven.org/maven2/com/google/code/findbugs/jsr305/3.0.2/jsr305-3.0.2-sources.jar
 *   version: 3.0.2
 * </pre>
 *
 * A coordinate fetched from several locations keeps its plain key for the
 * first entry in manifest order; later ones are keyed {@code <coordinate>#2},
 * {@code #3} and so on.
 */
public final class BomDocument {
    static final String REASON = "reason";

    private final PolicyLists policy;

    public BomDocument(PolicyLists policy) {
        this.policy = policy == null ? PolicyLists.empty() : policy;
    }

    public Map<String, Object> bom(List<PackageRecord> manifest) {
        Objects.requireNonNull(manifest, "manifest");
        Map<String, Object> doc = new LinkedHashMap<>();
        Map<String, Integer> seen = new HashMap<>();
        for (PackageRecord record : manifest) {
            doc.put(key(record, seen), entry(record));
        }
        return doc;
    }

    /**
     * Issue entries use the same keys the BOM gives those packages.
     */
    public Map<String, Object> issues(List<PackageRecord> manifest, List<AuditIssue> issues) {
        Map<PackageRecord, String> keys = new HashMap<>();
        Map<String, Integer> seen = new HashMap<>();
        for (PackageRecord record : manifest) {
            keys.put(record, key(record, seen));
        }
        Map<String, Object> doc = new LinkedHashMap<>();
        for (AuditIssue issue : issues) {
            Map<String, Object> entry = entry(issue.record());
            entry.put(REASON, issue.reason().label());
            doc.put(keys.getOrDefault(issue.record(), issue.record().coordinate().toString()), sorted(entry));
        }
        return doc;
    }

    Map<String, Object> entry(PackageRecord record) {
        PolicyEntry review = policy.reviewFor(record.coordinate()).orElse(null);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("copyright_notices", review == null ? "" : review.copyrightNotices());
        out.put("interaction_types", review == null ? List.of() : review.interactionTypes());
        out.put("jar_url", record.jarUrl());
        out.put("license", normalizeLicense(record.license()));
        out.put("maven-artifactId", record.coordinate().artifact());
        out.put("maven-groupId", record.coordinate().group());
        out.put("modified", record.modified() ? "yes" : "no");
        out.put("name", record.coordinate().name());
        out.put("repository", AuditDefaults.REPOSITORY_MAVEN);
        out.put("resolution", review == null ? "" : review.resolution());
        out.put("url", record.sourceUrl());
        out.put("version", record.coordinate().version());
        return out;
    }

    /**
     * Multi-line text is written as a literal block, which cannot hold carriage
     * returns or keep surrounding blank lines.
     */
    static String normalizeLicense(String license) {
        if (license.indexOf('\n') < 0) {
            return license;
        }
        return license.replace("\r", "").strip();
    }

    private static String key(PackageRecord record, Map<String, Integer> seen) {
        String coordinate = record.coordinate().toString();
        int n = seen.merge(coordinate, 1, Integer::sum);
        return n == 1 ? coordinate : coordinate + "#" + n;
    }

    private static Map<String, Object> sorted(Map<String, Object> entry) {
        Map<String, Object> out = new LinkedHashMap<>();
        entry.keySet().stream().sorted().forEach(k -> out.put(k, entry.get(k)));
        return out;
    }
}

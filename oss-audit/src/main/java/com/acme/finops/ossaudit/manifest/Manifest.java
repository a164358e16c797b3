package com.acme.finops.ossaudit.manifest;

import com.acme.finops.ossaudit.model.AuditWarning;
import com.acme.finops.ossaudit.model.PackageRecord;

import java.util.List;

/**
 * @param entries          external packages with license text, manifest order
 * @param internalPackages sorted coordinates of skipped internal packages
 * @param warnings         coordinates that occur with more than one jar URL
 */
public record Manifest(List<PackageRecord> entries, List<String> internalPackages, List<AuditWarning> warnings) {
    public Manifest {
        entries = List.copyOf(entries);
        internalPackages = List.copyOf(internalPackages);
        warnings = List.copyOf(warnings);
    }
}

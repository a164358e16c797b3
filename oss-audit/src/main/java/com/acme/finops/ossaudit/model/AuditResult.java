package com.acme.finops.ossaudit.model;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one audit run. Both lists use manifest order.
 *
 * @param manifest         external packages with resolved license text
 * @param issues           denied or unapproved manifest entries
 * @param verdict          pass/fail signal for the build
 * @param warnings         data-quality problems absorbed during the run
 * @param environment      packages supplied by the deployment environment, informational only
 * @param internalPackages coordinates skipped because they carry no jar URL
 */
public record AuditResult(
    List<PackageRecord> manifest,
    List<AuditIssue> issues,
    Verdict verdict,
    List<AuditWarning> warnings,
    List<PackageRecord> environment,
    List<String> internalPackages
) {
    public AuditResult {
        manifest = List.copyOf(manifest);
        issues = List.copyOf(issues);
        Objects.requireNonNull(verdict, "verdict");
        warnings = List.copyOf(warnings);
        environment = List.copyOf(environment);
        internalPackages = List.copyOf(internalPackages);
    }
}

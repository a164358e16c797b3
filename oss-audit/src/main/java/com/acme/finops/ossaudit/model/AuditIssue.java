package com.acme.finops.ossaudit.model;

import java.util.Objects;

public record AuditIssue(PackageRecord record, IssueReason reason) {
    public AuditIssue {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(reason, "reason");
    }
}

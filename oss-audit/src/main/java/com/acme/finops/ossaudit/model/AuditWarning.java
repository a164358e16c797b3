package com.acme.finops.ossaudit.model;

import java.util.Objects;

/**
 * Data-quality problem absorbed by the run instead of aborting it.
 */
public record AuditWarning(Kind kind, String subject, String message) {
    public enum Kind {
        MALFORMED_COORDINATE,
        LICENSE_LOOKUP_FAILED,
        LIST_INCONSISTENCY,
        DUPLICATE_COORDINATE
    }

    public AuditWarning {
        Objects.requireNonNull(kind, "kind");
        subject = subject == null ? "" : subject;
        message = message == null ? "" : message;
    }
}

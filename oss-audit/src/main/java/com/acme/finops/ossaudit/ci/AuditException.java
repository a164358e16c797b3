package com.acme.finops.ossaudit.ci;

/**
 * The run could not produce a BOM: invalid graph, unreadable policy list,
 * fatal resolver failure or unwritable output.
 */
public final class AuditException extends Exception {
    public AuditException(String message) {
        super(message);
    }

    public AuditException(String message, Throwable cause) {
        super(message, cause);
    }
}

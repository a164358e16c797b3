package com.acme.finops.ossaudit.util;

/**
 * Canonical environment variable names read by the audit tool.
 */
public final class AuditEnvKeys {
    public static final String OSS_AUDIT_STRICT = "OSS_AUDIT_STRICT";
    public static final String OSS_AUDIT_DEBUG = "OSS_AUDIT_DEBUG";
    public static final String OSS_AUDIT_SUPPRESS = "OSS_AUDIT_SUPPRESS";

    public static final String OSS_AUDIT_RESOLVER_THREADS = "OSS_AUDIT_RESOLVER_THREADS";
    public static final String OSS_AUDIT_HTTP_TIMEOUT_MS = "OSS_AUDIT_HTTP_TIMEOUT_MS";
    public static final String OSS_AUDIT_HTTP_RETRIES = "OSS_AUDIT_HTTP_RETRIES";
    public static final String OSS_AUDIT_HTTP_RETRY_DELAY_MS = "OSS_AUDIT_HTTP_RETRY_DELAY_MS";

    private AuditEnvKeys() {
    }
}

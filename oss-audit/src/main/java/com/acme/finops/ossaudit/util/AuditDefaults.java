package com.acme.finops.ossaudit.util;

/**
 * Default tuning constants for the audit run.
 * <p>
 * These values are used when the corresponding environment variable or CLI
 * flag is not set.
 */
public final class AuditDefaults {

    // ---- License resolution pool ----
    public static final int MAX_DEFAULT_RESOLVER_THREADS = 4;
    public static final int MAX_RESOLVER_THREADS = 64;

    // ---- POM fetch over HTTP ----
    public static final int DEFAULT_CONNECT_TIMEOUT_MS = 5_000;
    public static final int DEFAULT_RESPONSE_TIMEOUT_MS = 10_000;
    public static final int DEFAULT_FETCH_TRIES = 3;
    public static final int DEFAULT_RETRY_DELAY_MS = 3_000;
    public static final int MAX_REDIRECTS = 5;
    public static final int POM_RESPONSE_LIMIT = 4 * 1024 * 1024;
    public static final int HTTPS_DEFAULT_PORT = 443;
    public static final int HTTP_DEFAULT_PORT = 80;
    public static final int DEFAULT_IO_THREADS = 2;

    // ---- Output ----
    public static final String BOM_SUFFIX = ".bom.yaml";
    public static final String BOM_ISSUES_SUFFIX = ".bom-issues.yaml";
    public static final String REPOSITORY_MAVEN = "Maven";

    private AuditDefaults() {
    }

    public static int defaultResolverThreads() {
        return Math.max(1, Math.min(MAX_DEFAULT_RESOLVER_THREADS, Runtime.getRuntime().availableProcessors()));
    }
}

package com.acme.finops.ossaudit.util;

/**
 * Process exit codes of the audit CLI.
 */
public final class AuditExitCodes {

    public static final int OK = 0;

    // Denied packages under strict mode.
    public static final int POLICY_VIOLATION = 1;

    // Structural failure: unreadable graph or policy list, fatal resolver error.
    public static final int AUDIT_FAILED = 3;

    public static final int USAGE = 64;

    private AuditExitCodes() {
    }
}

package com.acme.finops.ossaudit.license;

/**
 * License metadata for one artifact could not be obtained. Never fatal for
 * the run.
 */
public final class LicenseLookupException extends Exception {
    public LicenseLookupException(String message) {
        super(message);
    }

    public LicenseLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}

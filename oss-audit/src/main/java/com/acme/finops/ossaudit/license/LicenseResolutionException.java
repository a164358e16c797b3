package com.acme.finops.ossaudit.license;

/**
 * A resolver failed in a way that is not a missing-license condition, so the
 * run cannot continue. Outstanding lookups are cancelled before this is thrown.
 */
public final class LicenseResolutionException extends Exception {
    private final String jarUrl;

    public LicenseResolutionException(String jarUrl, Throwable cause) {
        super("license resolver failed for " + jarUrl + ": " + cause, cause);
        this.jarUrl = jarUrl;
    }

    public String jarUrl() {
        return jarUrl;
    }
}

package com.acme.finops.ossaudit.policy;

/**
 * A policy list document could not be read or understood. Policy cannot be
 * evaluated safely without it, so the run stops.
 */
public final class PolicyListException extends Exception {
    public PolicyListException(String message) {
        super(message);
    }

    public PolicyListException(String message, Throwable cause) {
        super(message, cause);
    }
}

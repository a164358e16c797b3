package com.acme.finops.ossaudit.model;

public enum IssueReason {
    DENIED("Denied"),
    UNAPPROVED("Unapproved");

    private final String label;

    IssueReason(String label) {
        this.label = label;
    }

    /** Value written to the {@code reason} field of the issues document. */
    public String label() {
        return label;
    }
}

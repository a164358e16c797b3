package com.acme.finops.ossaudit.model;

import java.util.List;

public sealed interface Verdict permits Verdict.Pass, Verdict.Fail {
    record Pass() implements Verdict {}

    /** Strict mode with at least one denied, unsuppressed package. */
    record Fail(List<String> deniedCoordinates) implements Verdict {
        public Fail {
            deniedCoordinates = List.copyOf(deniedCoordinates);
        }
    }

    static Verdict pass() {
        return new Pass();
    }

    default boolean passed() {
        return this instanceof Pass;
    }
}

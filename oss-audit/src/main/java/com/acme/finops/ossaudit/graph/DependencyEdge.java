package com.acme.finops.ossaudit.graph;

import java.util.Objects;

public record DependencyEdge(EdgeKind kind, BuildNode target) {
    public DependencyEdge {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(target, "target");
    }
}

package com.acme.finops.ossaudit.graph;

import java.util.Locale;

/**
 * Dependency attributes followed by the collector, named after the build
 * rule attributes they come from.
 */
public enum EdgeKind {
    DATA("data"),
    SRCS("srcs"),
    DEPS("deps"),
    EXPORTS("exports"),
    JAR("jar"),
    RUNTIME_DEPS("runtime_deps"),
    DEPLOY_ENV("deploy_env");

    private final String attribute;

    EdgeKind(String attribute) {
        this.attribute = attribute;
    }

    public String attribute() {
        return attribute;
    }

    /** {@code deploy_env} targets are provided at runtime and are not bundled. */
    public boolean audited() {
        return this != DEPLOY_ENV;
    }

    public static EdgeKind fromAttribute(String attribute) {
        if (attribute != null) {
            String normalized = attribute.trim().toLowerCase(Locale.ROOT);
            for (EdgeKind kind : values()) {
                if (kind.attribute.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new GraphException("unknown edge kind: " + attribute);
    }
}

package com.acme.finops.ossaudit.policy;

import com.acme.finops.ossaudit.model.PackageCoordinate;

import java.util.List;
import java.util.Objects;

/**
 * One approved or denied list entry. {@code pattern} is a full coordinate, a
 * coordinate prefix ending at a segment boundary ({@code group:artifact},
 * {@code group}), or a plain string prefix ending in {@code *}.
 *
 * <p>The remaining fields are legal-review metadata copied into BOM entries
 * matched by this pattern.</p>
 */
public record PolicyEntry(
    String pattern,
    String copyrightNotices,
    List<String> interactionTypes,
    String resolution
) {
    private static final String REPOSITORY_QUALIFIER = "maven:";
    private static final String WILDCARD = "*";

    public PolicyEntry {
        pattern = normalize(Objects.requireNonNull(pattern, "pattern"));
        if (pattern.isEmpty()) {
            throw new IllegalArgumentException("empty policy pattern");
        }
        copyrightNotices = copyrightNotices == null ? "" : copyrightNotices;
        interactionTypes = interactionTypes == null ? List.of() : List.copyOf(interactionTypes);
        resolution = resolution == null ? "" : resolution;
    }

    public static PolicyEntry of(String pattern) {
        return new PolicyEntry(pattern, "", List.of(), "");
    }

    /** Strips whitespace and the {@code maven:} repository qualifier. */
    public static String normalize(String raw) {
        String value = raw.trim();
        if (value.startsWith(REPOSITORY_QUALIFIER)) {
            value = value.substring(REPOSITORY_QUALIFIER.length()).trim();
        }
        return value;
    }

    public boolean wildcard() {
        return pattern.endsWith(WILDCARD);
    }

    public boolean matches(PackageCoordinate coordinate) {
        String c = coordinate.toString();
        if (wildcard()) {
            return c.startsWith(pattern.substring(0, pattern.length() - WILDCARD.length()));
        }
        return c.equals(pattern) || c.startsWith(pattern + ":");
    }
}

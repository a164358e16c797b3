package com.acme.finops.ossaudit.model;

import java.util.Objects;

/**
 * Maven-style {@code group:artifact:version} identity of one audited package.
 */
public record PackageCoordinate(String group, String artifact, String version) implements Comparable<PackageCoordinate> {
    public PackageCoordinate {
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(artifact, "artifact");
        Objects.requireNonNull(version, "version");
    }

    /**
     * Parses {@code group:artifact:version}. The version is everything after the
     * last colon; the remainder splits on its first colon, so extra qualifiers
     * such as a packaging type stay in the artifact part.
     *
     * @throws IllegalArgumentException if the string has fewer than two colons
     *                                  or any of the three parts is blank
     */
    public static PackageCoordinate parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("coordinate is null");
        }
        String value = raw.trim();
        int lastColon = value.lastIndexOf(':');
        if (lastColon < 0) {
            throw new IllegalArgumentException("coordinate has no version separator: " + raw);
        }
        String name = value.substring(0, lastColon);
        String version = value.substring(lastColon + 1);
        int firstColon = name.indexOf(':');
        if (firstColon < 0) {
            throw new IllegalArgumentException("coordinate has no group separator: " + raw);
        }
        String group = name.substring(0, firstColon);
        String artifact = name.substring(firstColon + 1);
        if (group.isBlank() || artifact.isBlank() || version.isBlank()) {
            throw new IllegalArgumentException("coordinate has an empty segment: " + raw);
        }
        return new PackageCoordinate(group, artifact, version);
    }

    /** {@code group:artifact}, the versionless package name. */
    public String name() {
        return group + ":" + artifact;
    }

    @Override
    public int compareTo(PackageCoordinate other) {
        return toString().compareTo(other.toString());
    }

    @Override
    public String toString() {
        return group + ":" + artifact + ":" + version;
    }
}

package com.acme.finops.ossaudit.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Deduplication key of a collected package: the full
 * {@code (coordinate, jarUrl, sourceUrl)} tuple. The same coordinate fetched
 * from two repositories yields two keys.
 */
public record RecordKey(PackageCoordinate coordinate, String jarUrl, String sourceUrl) implements Comparable<RecordKey> {
    private static final Comparator<RecordKey> ORDER = Comparator
        .comparing(RecordKey::coordinate)
        .thenComparing(RecordKey::jarUrl)
        .thenComparing(RecordKey::sourceUrl);

    public RecordKey {
        Objects.requireNonNull(coordinate, "coordinate");
        jarUrl = jarUrl == null ? "" : jarUrl;
        sourceUrl = sourceUrl == null ? "" : sourceUrl;
    }

    @Override
    public int compareTo(RecordKey other) {
        return ORDER.compare(this, other);
    }
}

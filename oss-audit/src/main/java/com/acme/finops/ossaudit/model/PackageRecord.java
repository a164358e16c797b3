package com.acme.finops.ossaudit.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * One audited dependency. Created once per unique {@link RecordKey} during
 * graph collection and enriched with license text by {@link #withLicense}.
 *
 * <p>An empty {@code jarUrl} marks an internal package built in-house; such
 * records never reach the manifest. {@code sourceUrl} is empty when the
 * package has no downloadable source bundle.</p>
 */
public record PackageRecord(
    PackageCoordinate coordinate,
    String jarUrl,
    String license,
    String sourceUrl,
    boolean modified
) {
    /** Manifest order: coordinate, then jar URL, then source URL. */
    public static final Comparator<PackageRecord> MANIFEST_ORDER = Comparator.comparing(PackageRecord::key);

    public PackageRecord {
        Objects.requireNonNull(coordinate, "coordinate");
        jarUrl = jarUrl == null ? "" : jarUrl;
        license = license == null ? "" : license;
        sourceUrl = sourceUrl == null ? "" : sourceUrl;
    }

    public static PackageRecord collected(PackageCoordinate coordinate, String jarUrl, String sourceUrl) {
        return new PackageRecord(coordinate, jarUrl, "", sourceUrl, false);
    }

    public boolean isInternal() {
        return jarUrl.isEmpty();
    }

    public RecordKey key() {
        return new RecordKey(coordinate, jarUrl, sourceUrl);
    }

    public PackageRecord withLicense(String resolvedLicense) {
        return new PackageRecord(coordinate, jarUrl, resolvedLicense, sourceUrl, modified);
    }
}

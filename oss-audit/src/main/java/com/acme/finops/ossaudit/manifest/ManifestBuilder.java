package com.acme.finops.ossaudit.manifest;

import com.acme.finops.ossaudit.license.ResolvedLicenses;
import com.acme.finops.ossaudit.model.AuditWarning;
import com.acme.finops.ossaudit.model.PackageCoordinate;
import com.acme.finops.ossaudit.model.PackageRecord;
import com.acme.finops.ossaudit.model.RecordKey;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Joins collected records with their resolved license text and puts them in
 * manifest order.
 *
 * <p>Every record with a jar URL appears exactly once, with an empty license
 * if resolution failed. Records without a jar URL are internal packages and
 * are only counted.</p>
 */
public final class ManifestBuilder {

    public Manifest build(List<PackageRecord> closure, ResolvedLicenses licenses) {
        Objects.requireNonNull(closure, "closure");
        ResolvedLicenses resolved = licenses == null ? ResolvedLicenses.empty() : licenses;

        Map<RecordKey, PackageRecord> entries = new TreeMap<>();
        TreeSet<String> internal = new TreeSet<>();
        for (PackageRecord record : closure) {
            if (record.isInternal()) {
                internal.add(record.coordinate().toString());
                continue;
            }
            entries.putIfAbsent(record.key(), record.withLicense(resolved.licenseFor(record.jarUrl())));
        }

        List<AuditWarning> warnings = new ArrayList<>();
        Map<PackageCoordinate, TreeSet<String>> urlsByCoordinate = new TreeMap<>();
        for (PackageRecord r : entries.values()) {
            urlsByCoordinate.computeIfAbsent(r.coordinate(), k -> new TreeSet<>()).add(r.jarUrl());
        }
        urlsByCoordinate.forEach((coordinate, urls) -> {
            if (urls.size() > 1) {
                warnings.add(new AuditWarning(
                    AuditWarning.Kind.DUPLICATE_COORDINATE,
                    coordinate.toString(),
                    "resolved from " + urls.size() + " locations: " + String.join(", ", urls)
                ));
            }
        });
        return new Manifest(new ArrayList<>(entries.values()), new ArrayList<>(internal), warnings);
    }
}

package com.acme.finops.ossaudit.license;

/**
 * Looks up license metadata for one published artifact.
 *
 * <p>Implementations must be thread-safe; {@link LicenseResolutionService}
 * calls them from a worker pool. A lookup that cannot find or read the
 * metadata throws {@link LicenseLookupException}, which degrades only that
 * package. Unchecked exceptions abort the whole run.</p>
 */
@FunctionalInterface
public interface LicenseResolver {
    /**
     * @param jarUrl download URL of the artifact
     * @return license names, possibly empty; multiple licenses may be joined
     *         or span several lines
     */
    String resolve(String jarUrl) throws LicenseLookupException;
}

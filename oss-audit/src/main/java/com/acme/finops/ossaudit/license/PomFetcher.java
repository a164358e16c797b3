package com.acme.finops.ossaudit.license;

import java.net.URI;

/**
 * Downloads a POM document.
 */
@FunctionalInterface
public interface PomFetcher {
    byte[] fetch(URI pomUri) throws LicenseLookupException;
}

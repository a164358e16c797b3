package com.acme.finops.ossaudit.license;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Default resolver: reads the license names declared in the POM published
 * next to the jar, e.g. {@code .../jsr305/3.0.2/jsr305-3.0.2.pom} for
 * {@code .../jsr305/3.0.2/jsr305-3.0.2.jar}.
 *
 * <p>{@code file:} URLs are read from disk; everything else goes through the
 * {@link PomFetcher}.</p>
 */
public final class PomLicenseResolver implements LicenseResolver {
    private final PomFetcher fetcher;

    public PomLicenseResolver(PomFetcher fetcher) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    }

    @Override
    public String resolve(String jarUrl) throws LicenseLookupException {
        if (jarUrl == null || jarUrl.isBlank()) {
            return "";
        }
        URI pomUri = pomUri(jarUrl);
        byte[] pom = "file".equalsIgnoreCase(pomUri.getScheme()) ? readLocal(pomUri) : fetcher.fetch(pomUri);
        return PomLicenseParser.licenses(pom);
    }

    static URI pomUri(String jarUrl) throws LicenseLookupException {
        String trimmed = jarUrl.trim();
        int slash = trimmed.lastIndexOf('/');
        String fileName = trimmed.substring(slash + 1);
        int dot = fileName.lastIndexOf('.');
        if (fileName.isEmpty() || dot <= 0) {
            throw new LicenseLookupException("cannot derive POM location from " + jarUrl);
        }
        String pomUrl = trimmed.substring(0, slash + 1) + fileName.substring(0, dot) + ".pom";
        try {
            URI uri = new URI(pomUrl);
            if (uri.getScheme() == null) {
                throw new LicenseLookupException("artifact URL has no scheme: " + jarUrl);
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new LicenseLookupException("malformed artifact URL: " + jarUrl, e);
        }
    }

    private static byte[] readLocal(URI pomUri) throws LicenseLookupException {
        try {
            return Files.readAllBytes(Path.of(pomUri));
        } catch (IOException | IllegalArgumentException e) {
            throw new LicenseLookupException("cannot read " + pomUri + ": " + e.getMessage(), e);
        }
    }
}

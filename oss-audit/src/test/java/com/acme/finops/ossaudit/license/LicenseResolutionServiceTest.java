package com.acme.finops.ossaudit.license;

import com.acme.finops.ossaudit.model.AuditWarning;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LicenseResolutionServiceTest {

    @Test
    void shouldResolveEachUniqueUrlOnce() throws Exception {
        CountingResolver resolver = new CountingResolver(Map.of(
            "https://repo/a.jar", "Apache-2.0",
            "https://repo/b.jar", "MIT"
        ));
        LicenseResolutionService service = new LicenseResolutionService(resolver, 4);

        ResolvedLicenses resolved = service.resolveAll(List.of(
            "https://repo/a.jar", "https://repo/b.jar", "https://repo/a.jar", "", "https://repo/b.jar"
        ));

        assertEquals("Apache-2.0", resolved.licenseFor("https://repo/a.jar"));
        assertEquals("MIT", resolved.licenseFor("https://repo/b.jar"));
        assertEquals(2, resolved.size());
        assertEquals(1, resolver.calls.get("https://repo/a.jar").get());
        assertEquals(1, resolver.calls.get("https://repo/b.jar").get());
        assertTrue(resolved.warnings().isEmpty());
    }

    @Test
    void shouldDegradeFailedLookupToEmptyLicense() throws Exception {
        CountingResolver resolver = new CountingResolver(Map.of("https://repo/a.jar", "Apache-2.0"));
        LicenseResolutionService service = new LicenseResolutionService(resolver, 2);

        ResolvedLicenses resolved = service.resolveAll(List.of("https://repo/a.jar", "https://repo/missing.jar"));

        assertEquals("", resolved.licenseFor("https://repo/missing.jar"));
        assertTrue(resolved.contains("https://repo/missing.jar"));
        assertEquals(1, resolved.warnings().size());
        AuditWarning warning = resolved.warnings().get(0);
        assertEquals(AuditWarning.Kind.LICENSE_LOOKUP_FAILED, warning.kind());
        assertEquals("https://repo/missing.jar", warning.subject());
    }

    @Test
    void shouldAbortOnUnexpectedResolverFailure() {
        IllegalStateException boom = new IllegalStateException("resolver bug");
        LicenseResolutionService service = new LicenseResolutionService(url -> {
            if (url.endsWith("bad.jar")) {
                throw boom;
            }
            return "MIT";
        }, 3);

        LicenseResolutionException e = assertThrows(LicenseResolutionException.class,
            () -> service.resolveAll(List.of("https://repo/a.jar", "https://repo/bad.jar", "https://repo/c.jar")));
        assertEquals("https://repo/bad.jar", e.jarUrl());
        assertSame(boom, e.getCause());
    }

    @Test
    void shouldPropagateErrorsUnwrapped() {
        LinkageError broken = new LinkageError("broken classpath");
        LicenseResolutionService service = new LicenseResolutionService(url -> {
            throw broken;
        }, 1);

        LinkageError thrown = assertThrows(LinkageError.class, () -> service.resolveAll(List.of("https://repo/a.jar")));
        assertSame(broken, thrown);
    }

    @Test
    void shouldRunLookupsOnNamedWorkerThreads() throws Exception {
        Set<String> threads = ConcurrentHashMap.newKeySet();
        LicenseResolutionService service = new LicenseResolutionService(url -> {
            threads.add(Thread.currentThread().getName());
            return "";
        }, 8);

        service.resolveAll(List.of("https://repo/1.jar", "https://repo/2.jar", "https://repo/3.jar"));

        assertFalse(threads.isEmpty());
        assertTrue(threads.size() <= 3);
        threads.forEach(name -> assertTrue(name.startsWith("license-resolver-"), name));
    }

    @Test
    void shouldSkipPoolForEmptyInput() throws Exception {
        LicenseResolutionService service = new LicenseResolutionService(url -> {
            throw new AssertionError("unexpected lookup");
        }, 2);
        assertEquals(0, service.resolveAll(List.of("", " ")).size());
    }

    private static final class CountingResolver implements LicenseResolver {
        private final Map<String, String> licenses;
        private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();

        private CountingResolver(Map<String, String> licenses) {
            this.licenses = licenses;
        }

        @Override
        public String resolve(String jarUrl) throws LicenseLookupException {
            calls.computeIfAbsent(jarUrl, k -> new AtomicInteger()).incrementAndGet();
            String license = licenses.get(jarUrl);
            if (license == null) {
                throw new LicenseLookupException("unable to download " + jarUrl + ": HTTP 404");
            }
            return license;
        }
    }
}

package com.acme.finops.ossaudit.license;

import com.acme.finops.ossaudit.model.AuditWarning;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Resolves licenses for a set of jar URLs on a bounded worker pool.
 *
 * <p>Each unique, non-empty URL is looked up exactly once per call. Workers
 * only return their outcome; the calling thread is the single collection
 * point and returns once every lookup has completed. A
 * {@link LicenseLookupException} degrades its own URL to an empty license.
 * Any other failure cancels outstanding lookups and is rethrown as
 * {@link LicenseResolutionException}.</p>
 */
public final class LicenseResolutionService {
    private static final Logger LOG = Logger.getLogger(LicenseResolutionService.class.getName());

    private final LicenseResolver resolver;
    private final int maxThreads;

    public LicenseResolutionService(LicenseResolver resolver, int maxThreads) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.maxThreads = Math.max(1, maxThreads);
    }

    public ResolvedLicenses resolveAll(Collection<String> jarUrls) throws LicenseResolutionException, InterruptedException {
        Set<String> unique = new TreeSet<>();
        for (String url : jarUrls) {
            if (url != null && !url.isBlank()) {
                unique.add(url);
            }
        }
        if (unique.isEmpty()) {
            return ResolvedLicenses.empty();
        }

        int threads = Math.min(maxThreads, unique.size());
        ExecutorService pool = Executors.newFixedThreadPool(threads, new WorkerFactory());
        List<Future<Outcome>> futures = new ArrayList<>(unique.size());
        try {
            CompletionService<Outcome> completion = new ExecutorCompletionService<>(pool);
            for (String url : unique) {
                futures.add(completion.submit(() -> lookup(url)));
            }

            Map<String, String> licenses = new TreeMap<>();
            List<AuditWarning> warnings = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                Outcome outcome;
                try {
                    outcome = completion.take().get();
                } catch (ExecutionException e) {
                    cancelAll(futures);
                    Throwable cause = e.getCause();
                    if (cause instanceof LicenseResolutionException fatal) {
                        throw fatal;
                    }
                    if (cause instanceof Error error) {
                        throw error;
                    }
                    throw new LicenseResolutionException("<unknown>", cause == null ? e : cause);
                }
                licenses.put(outcome.url(), outcome.license());
                if (outcome.failure() != null) {
                    warnings.add(new AuditWarning(AuditWarning.Kind.LICENSE_LOOKUP_FAILED, outcome.url(), outcome.failure()));
                }
            }
            warnings.sort((a, b) -> a.subject().compareTo(b.subject()));
            LOG.info(() -> "Resolved licenses for " + licenses.size() + " artifacts on " + threads
                + " workers, " + warnings.size() + " lookups failed");
            return new ResolvedLicenses(licenses, warnings);
        } catch (InterruptedException e) {
            cancelAll(futures);
            throw e;
        } finally {
            pool.shutdownNow();
        }
    }

    private Outcome lookup(String url) throws LicenseResolutionException {
        try {
            String license = resolver.resolve(url);
            LOG.fine(() -> "License for " + url + ": " + license);
            return new Outcome(url, license == null ? "" : license, null);
        } catch (LicenseLookupException e) {
            LOG.warning("License lookup failed for " + url + ", leaving license empty: " + e.getMessage());
            return new Outcome(url, "", e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        } catch (RuntimeException e) {
            throw new LicenseResolutionException(url, e);
        }
    }

    private static void cancelAll(List<Future<Outcome>> futures) {
        for (Future<Outcome> f : futures) {
            f.cancel(true);
        }
    }

    private record Outcome(String url, String license, String failure) {}

    private static final class WorkerFactory implements ThreadFactory {
        private final AtomicInteger seq = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "license-resolver-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}

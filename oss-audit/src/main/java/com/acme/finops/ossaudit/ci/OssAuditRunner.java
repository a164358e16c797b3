package com.acme.finops.ossaudit.ci;

import com.acme.finops.ossaudit.graph.BuildGraph;
import com.acme.finops.ossaudit.graph.CollectedGraph;
import com.acme.finops.ossaudit.graph.GraphCollector;
import com.acme.finops.ossaudit.graph.GraphException;
import com.acme.finops.ossaudit.graph.GraphSnapshot;
import com.acme.finops.ossaudit.graph.GraphSnapshotLoader;
import com.acme.finops.ossaudit.license.LicenseResolutionException;
import com.acme.finops.ossaudit.license.LicenseResolutionService;
import com.acme.finops.ossaudit.license.LicenseResolver;
import com.acme.finops.ossaudit.license.ResolvedLicenses;
import com.acme.finops.ossaudit.manifest.BomWriter;
import com.acme.finops.ossaudit.manifest.Manifest;
import com.acme.finops.ossaudit.manifest.ManifestBuilder;
import com.acme.finops.ossaudit.model.AuditResult;
import com.acme.finops.ossaudit.model.AuditWarning;
import com.acme.finops.ossaudit.model.IssueReason;
import com.acme.finops.ossaudit.model.PackageRecord;
import com.acme.finops.ossaudit.policy.PolicyEntry;
import com.acme.finops.ossaudit.policy.PolicyEvaluation;
import com.acme.finops.ossaudit.policy.PolicyEvaluator;
import com.acme.finops.ossaudit.policy.PolicyListException;
import com.acme.finops.ossaudit.policy.PolicyListLoader;
import com.acme.finops.ossaudit.policy.PolicyLists;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one audit end to end: collect the closure, resolve licenses, build the
 * manifest, evaluate the policy lists and write the BOM files.
 */
public final class OssAuditRunner {
    private static final Logger LOG = Logger.getLogger(OssAuditRunner.class.getName());

    private final GraphCollector collector = new GraphCollector();
    private final ManifestBuilder manifestBuilder = new ManifestBuilder();
    private final PolicyEvaluator evaluator = new PolicyEvaluator();
    private final LicenseResolutionService licenses;

    public OssAuditRunner(LicenseResolver resolver, int threads) {
        this.licenses = new LicenseResolutionService(Objects.requireNonNull(resolver, "resolver"), threads);
    }

    public record RunReport(AuditResult result, BomWriter.BomFiles files, List<String> denied) {}

    public AuditResult audit(BuildGraph graph, String rootLabel, PolicyLists policy, boolean strict, boolean debug)
        throws AuditException {
        return run(graph, rootLabel, policy, strict, debug).result();
    }

    public RunReport execute(AuditOptions options) throws AuditException {
        GraphSnapshot graph;
        try {
            graph = new GraphSnapshotLoader().load(options.graphFile());
        } catch (GraphException e) {
            throw new AuditException(e.getMessage(), e);
        }
        String rootLabel = options.target() != null ? options.target() : graph.rootLabel();
        if (rootLabel == null || rootLabel.isBlank()) {
            throw new AuditException("no target to audit: pass --target or set root in " + options.graphFile());
        }

        PolicyLists policy = new PolicyLists(
            loadList(options.approvedList()),
            loadList(options.deniedList()),
            options.suppress()
        );
        Evaluated evaluated = run(graph, rootLabel, policy, options.strict(), options.debug());
        AuditResult result = evaluated.result();

        String prefix = options.outputPrefix() != null ? options.outputPrefix() : prefixFor(rootLabel);
        BomWriter.BomFiles files;
        try {
            files = new BomWriter().write(options.outputDir(), prefix, result, policy);
        } catch (IOException e) {
            throw new AuditException("unable to write BOM files to " + options.outputDir(), e);
        }

        List<String> denied = evaluated.evaluation().denied();
        if (!denied.isEmpty()) {
            alert(denied, result.verdict().passed(), files.bom(), options.deniedList());
        }
        long unapproved = result.issues().stream().filter(i -> i.reason() == IssueReason.UNAPPROVED).count();
        LOG.info("Audited " + rootLabel + ": " + result.manifest().size() + " packages, "
            + denied.size() + " denied, " + unapproved + " unapproved, "
            + result.warnings().size() + " warnings; bom=" + files.bom() + " issues=" + files.issues());
        return new RunReport(result, files, denied);
    }

    /**
     * Output prefix derived from a target label: the name after the last {@code :}
     * or {@code /}, restricted to file-name-safe characters.
     */
    static String prefixFor(String rootLabel) {
        String name = rootLabel.trim();
        int cut = Math.max(name.lastIndexOf(':'), name.lastIndexOf('/'));
        if (cut >= 0) {
            name = name.substring(cut + 1);
        }
        name = name.replaceAll("[^A-Za-z0-9._-]", "_");
        return name.isEmpty() ? "audit" : name;
    }

    private Evaluated run(BuildGraph graph, String rootLabel, PolicyLists policy, boolean strict, boolean debug)
        throws AuditException {
        CollectedGraph collected;
        try {
            collected = collector.collect(graph, rootLabel);
        } catch (GraphException e) {
            throw new AuditException("invalid build graph: " + e.getMessage(), e);
        }

        List<String> jarUrls = collected.closure().stream()
            .filter(r -> !r.isInternal())
            .map(PackageRecord::jarUrl)
            .toList();
        ResolvedLicenses resolved;
        try {
            resolved = licenses.resolveAll(jarUrls);
        } catch (LicenseResolutionException e) {
            throw new AuditException("license resolution failed for " + e.jarUrl(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuditException("interrupted while resolving licenses", e);
        }

        Manifest manifest = manifestBuilder.build(collected.closure(), resolved);
        if (debug && !manifest.internalPackages().isEmpty()) {
            LOG.info("Internal jars ignored for open source tracking: " + manifest.internalPackages());
        }
        if (debug && !collected.environment().isEmpty()) {
            LOG.info("Packages supplied by the deployment environment: " + collected.environment().size());
        }
        PolicyEvaluation evaluation = evaluator.evaluate(manifest.entries(), policy, strict);

        List<AuditWarning> warnings = new ArrayList<>(collected.warnings());
        warnings.addAll(resolved.warnings());
        warnings.addAll(manifest.warnings());
        warnings.addAll(evaluation.warnings());

        AuditResult result = new AuditResult(
            manifest.entries(),
            evaluation.issues(),
            evaluation.verdict(),
            warnings,
            collected.environment(),
            manifest.internalPackages()
        );
        return new Evaluated(result, evaluation);
    }

    private static List<PolicyEntry> loadList(Path file) throws AuditException {
        try {
            return new PolicyListLoader().load(file);
        } catch (PolicyListException e) {
            throw new AuditException(e.getMessage(), e);
        }
    }

    private static void alert(List<String> denied, boolean passed, Path bom, Path deniedList) {
        StringBuilder sb = new StringBuilder();
        sb.append("The following open source libraries found in this build are not allowed for use.")
            .append(" They must be removed from product code for the build to comply with license requirements:\n");
        for (String coordinate : denied) {
            sb.append("    ").append(coordinate).append('\n');
        }
        sb.append("Catalog of packages used by this build:\n    ").append(bom).append('\n');
        if (deniedList != null) {
            sb.append("Catalog of denied packages:\n    ").append(deniedList).append('\n');
        }
        LOG.log(passed ? Level.WARNING : Level.SEVERE, sb.toString());
    }

    private record Evaluated(AuditResult result, PolicyEvaluation evaluation) {}
}

package com.acme.finops.ossaudit.graph;

import com.acme.finops.ossaudit.model.AuditWarning;
import com.acme.finops.ossaudit.model.PackageCoordinate;
import com.acme.finops.ossaudit.model.PackageRecord;
import com.acme.finops.ossaudit.model.RecordKey;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Walks the transitive closure of a target and extracts package identity from
 * target tags.
 *
 * <p>Audited edges ({@code data}, {@code srcs}, {@code deps}, {@code exports},
 * {@code jar}, {@code runtime_deps}) feed the audited closure. Targets reached
 * through {@code deploy_env} are walked separately and land in the environment
 * set unless the audited walk also reached them. Each target is expanded at
 * most once per walk.</p>
 */
public final class GraphCollector {
    private static final Logger LOG = Logger.getLogger(GraphCollector.class.getName());

    static final String COORDINATES_TAG = "maven_coordinates=";
    static final String URL_TAG = "maven_url=";
    private static final String SRCJAR_URL_PREFIX = "v1/https/";
    private static final String SRCJAR_HTTP_URL_PREFIX = "v1/http/";

    public CollectedGraph collect(BuildGraph graph, String rootLabel) {
        Objects.requireNonNull(graph, "graph");
        BuildNode root = graph.node(Objects.requireNonNull(rootLabel, "rootLabel"));

        List<AuditWarning> warnings = new ArrayList<>();
        Map<RecordKey, PackageRecord> closure = new TreeMap<>();
        List<BuildNode> environmentRoots = new ArrayList<>();
        Set<String> audited = walk(graph, List.of(root), Set.of(), true, closure, environmentRoots, warnings);

        Map<RecordKey, PackageRecord> environment = new TreeMap<>();
        Set<String> envVisited = walk(graph, environmentRoots, audited, false, environment, new ArrayList<>(), warnings);

        int visited = audited.size() + envVisited.size();
        LOG.fine(() -> "Collected " + closure.size() + " package records and " + environment.size()
            + " environment records from " + visited + " targets under " + rootLabel);
        return new CollectedGraph(
            new ArrayList<>(closure.values()),
            new ArrayList<>(environment.values()),
            warnings,
            visited
        );
    }

    /**
     * Iterative depth-first walk. {@code auditedOnly} stops at {@code deploy_env}
     * edges and hands their targets to {@code deferred}; otherwise every edge is
     * followed. Targets in {@code exclude} are neither recorded nor expanded.
     */
    private Set<String> walk(BuildGraph graph,
                             Collection<BuildNode> roots,
                             Set<String> exclude,
                             boolean auditedOnly,
                             Map<RecordKey, PackageRecord> sink,
                             List<BuildNode> deferred,
                             List<AuditWarning> warnings) {
        Set<String> visited = new HashSet<>();
        Deque<BuildNode> stack = new ArrayDeque<>();
        for (BuildNode r : roots) {
            stack.push(r);
        }
        while (!stack.isEmpty()) {
            BuildNode node = stack.pop();
            if (exclude.contains(node.label()) || !visited.add(node.label())) {
                continue;
            }
            PackageRecord record = extract(node, warnings);
            if (record != null) {
                sink.putIfAbsent(record.key(), record);
            }
            List<DependencyEdge> edges = graph.edges(node);
            for (int i = edges.size() - 1; i >= 0; i--) {
                DependencyEdge edge = edges.get(i);
                if (auditedOnly && !edge.kind().audited()) {
                    deferred.add(edge.target());
                    continue;
                }
                if (!visited.contains(edge.target().label())) {
                    stack.push(edge.target());
                }
            }
        }
        return visited;
    }

    /**
     * Zero or one record per target. Targets without a coordinate tag yield
     * nothing; a malformed coordinate is reported and skipped.
     */
    static PackageRecord extract(BuildNode node, List<AuditWarning> warnings) {
        String coordinate = "";
        String url = "";
        for (String tag : node.tags()) {
            if (tag.startsWith(COORDINATES_TAG)) {
                coordinate = tag.substring(COORDINATES_TAG.length()).trim();
            } else if (tag.startsWith(URL_TAG)) {
                url = tag.substring(URL_TAG.length()).trim();
            }
        }
        if (coordinate.isEmpty()) {
            return null;
        }
        PackageCoordinate parsed;
        try {
            parsed = PackageCoordinate.parse(coordinate);
        } catch (IllegalArgumentException e) {
            LOG.warning("Skipping target " + node.label() + ": " + e.getMessage());
            warnings.add(new AuditWarning(AuditWarning.Kind.MALFORMED_COORDINATE, node.label(), e.getMessage()));
            return null;
        }
        return PackageRecord.collected(parsed, url, sourceUrl(node.srcjarLabel()));
    }

    /**
     * Source bundle targets fetched by the maven rules are named after their
     * download path, e.g. {@code @maven//:v1/https/repo1.maven.org/.../x-sources.jar}.
     */
    static String sourceUrl(String srcjarLabel) {
        if (srcjarLabel == null || srcjarLabel.isBlank()) {
            return "";
        }
        int https = srcjarLabel.indexOf(SRCJAR_URL_PREFIX);
        if (https >= 0) {
            return "https://" + srcjarLabel.substring(https + SRCJAR_URL_PREFIX.length());
        }
        int http = srcjarLabel.indexOf(SRCJAR_HTTP_URL_PREFIX);
        if (http >= 0) {
            return "http://" + srcjarLabel.substring(http + SRCJAR_HTTP_URL_PREFIX.length());
        }
        return srcjarLabel;
    }
}

package com.acme.finops.ossaudit.graph;

import com.acme.finops.ossaudit.model.AuditWarning;
import com.acme.finops.ossaudit.model.PackageRecord;

import java.util.List;

/**
 * Result of walking one target.
 *
 * @param closure      deduplicated records reachable through audited edges, internal ones included, manifest order
 * @param environment  records reachable only through {@code deploy_env} edges, manifest order
 * @param warnings     malformed coordinate tags, in visit order
 * @param visitedNodes number of distinct targets visited
 */
public record CollectedGraph(
    List<PackageRecord> closure,
    List<PackageRecord> environment,
    List<AuditWarning> warnings,
    int visitedNodes
) {
    public CollectedGraph {
        closure = List.copyOf(closure);
        environment = List.copyOf(environment);
        warnings = List.copyOf(warnings);
    }
}

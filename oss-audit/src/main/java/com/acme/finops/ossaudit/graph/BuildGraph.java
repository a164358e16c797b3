package com.acme.finops.ossaudit.graph;

import java.util.List;

/**
 * Read-only view over an already materialized build graph.
 *
 * <p>Implementations must return the same answer for the same node for the
 * lifetime of one audit run. The graph is expected to be acyclic; the
 * collector still never visits a node twice.</p>
 */
public interface BuildGraph {
    /**
     * @throws GraphException if no target has this label
     */
    BuildNode node(String label);

    /** Outgoing edges of {@code node} in declaration order. */
    List<DependencyEdge> edges(BuildNode node);
}

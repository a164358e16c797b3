package com.acme.finops.ossaudit.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable in-memory build graph, typically exported by the build system and
 * read back through {@link GraphSnapshotLoader}.
 */
public final class GraphSnapshot implements BuildGraph {
    private final String rootLabel;
    private final Map<String, BuildNode> nodes;
    private final Map<String, List<DependencyEdge>> edges;

    private GraphSnapshot(String rootLabel, Map<String, BuildNode> nodes, Map<String, List<DependencyEdge>> edges) {
        this.rootLabel = rootLabel;
        this.nodes = nodes;
        this.edges = edges;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Default audit target, or {@code null} if the snapshot does not name one. */
    public String rootLabel() {
        return rootLabel;
    }

    public int size() {
        return nodes.size();
    }

    @Override
    public BuildNode node(String label) {
        BuildNode node = nodes.get(label);
        if (node == null) {
            throw new GraphException("unknown target: " + label);
        }
        return node;
    }

    @Override
    public List<DependencyEdge> edges(BuildNode node) {
        Objects.requireNonNull(node, "node");
        return edges.getOrDefault(node.label(), List.of());
    }

    public static final class Builder {
        private record PendingEdge(String from, EdgeKind kind, String to) {}

        private final Map<String, BuildNode> nodes = new LinkedHashMap<>();
        private final List<PendingEdge> pending = new ArrayList<>();
        private String rootLabel;

        private Builder() {
        }

        public Builder root(String label) {
            this.rootLabel = label;
            return this;
        }

        public Builder node(String label, List<String> tags) {
            return node(label, tags, null);
        }

        public Builder node(String label, List<String> tags, String srcjarLabel) {
            if (nodes.putIfAbsent(label, new BuildNode(label, tags, srcjarLabel)) != null) {
                throw new GraphException("duplicate target: " + label);
            }
            return this;
        }

        public Builder edge(String from, EdgeKind kind, String to) {
            pending.add(new PendingEdge(
                Objects.requireNonNull(from, "from"),
                Objects.requireNonNull(kind, "kind"),
                Objects.requireNonNull(to, "to")
            ));
            return this;
        }

        public GraphSnapshot build() {
            if (rootLabel != null && !nodes.containsKey(rootLabel)) {
                throw new GraphException("root target not in graph: " + rootLabel);
            }
            Map<String, List<DependencyEdge>> adjacency = new LinkedHashMap<>();
            for (PendingEdge e : pending) {
                if (!nodes.containsKey(e.from())) {
                    throw new GraphException("edge from unknown target: " + e.from());
                }
                BuildNode target = nodes.get(e.to());
                if (target == null) {
                    throw new GraphException("dangling " + e.kind().attribute() + " edge " + e.from() + " -> " + e.to());
                }
                adjacency.computeIfAbsent(e.from(), k -> new ArrayList<>()).add(new DependencyEdge(e.kind(), target));
            }
            Map<String, List<DependencyEdge>> frozen = new LinkedHashMap<>();
            adjacency.forEach((label, list) -> frozen.put(label, List.copyOf(list)));
            return new GraphSnapshot(rootLabel, Map.copyOf(nodes), Map.copyOf(frozen));
        }
    }
}

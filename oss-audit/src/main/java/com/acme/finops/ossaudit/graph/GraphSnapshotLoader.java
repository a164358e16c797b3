package com.acme.finops.ossaudit.graph;

import com.acme.finops.ossaudit.util.YamlCodec;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads a graph export (YAML or JSON) of the form:
 *
 * <pre>
 * root: //app:server
 * nodes:
 *   //app:server:
 *     deps: [//lib:core]
 *     deploy_env: [//platform:runtime]
 *   //lib:core:
 *     tags: [maven_coordinates=com.example:core:1.0, maven_url=https://repo/core-1.0.jar]
 *     srcjar: "@maven//:v1/https/repo/core-1.0-sources.jar"
 * </pre>
 *
 * Edge attributes use the {@link EdgeKind} attribute names; {@code jar} may be a
 * single label or a list.
 */
public final class GraphSnapshotLoader {
    private static final String TAGS = "tags";
    private static final String SRCJAR = "srcjar";

    public GraphSnapshot load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new GraphException("graph file not found: " + file);
        }
        JsonNode root;
        try {
            root = YamlCodec.readTree(file);
        } catch (IOException e) {
            throw new GraphException("unreadable graph file: " + file, e);
        }
        return parse(root);
    }

    GraphSnapshot parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new GraphException("graph document must be a mapping");
        }
        JsonNode nodes = root.get("nodes");
        if (nodes == null || !nodes.isObject()) {
            throw new GraphException("missing required mapping field: nodes");
        }
        GraphSnapshot.Builder builder = GraphSnapshot.builder();
        JsonNode rootLabel = root.get("root");
        if (rootLabel != null && rootLabel.isTextual() && !rootLabel.asText().isBlank()) {
            builder.root(rootLabel.asText().trim());
        }

        Iterator<Map.Entry<String, JsonNode>> it = nodes.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String label = entry.getKey();
            JsonNode body = entry.getValue();
            if (body == null || body.isNull()) {
                builder.node(label, List.of());
                continue;
            }
            if (!body.isObject()) {
                throw new GraphException("target " + label + " must be a mapping");
            }
            builder.node(label, labels(body.get(TAGS), label, TAGS), optionalText(body.get(SRCJAR)));

            Iterator<Map.Entry<String, JsonNode>> attrs = body.fields();
            while (attrs.hasNext()) {
                Map.Entry<String, JsonNode> attr = attrs.next();
                if (TAGS.equals(attr.getKey()) || SRCJAR.equals(attr.getKey())) {
                    continue;
                }
                EdgeKind kind = EdgeKind.fromAttribute(attr.getKey());
                for (String target : labels(attr.getValue(), label, attr.getKey())) {
                    builder.edge(label, kind, target);
                }
            }
        }
        return builder.build();
    }

    private static List<String> labels(JsonNode node, String owner, String field) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (node.isTextual()) {
            return List.of(node.asText());
        }
        if (!node.isArray()) {
            throw new GraphException("field " + field + " of " + owner + " must be a string or a list");
        }
        List<String> out = new ArrayList<>(node.size());
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                throw new GraphException("field " + field + " of " + owner + " must contain only strings");
            }
            out.add(item.asText());
        }
        return out;
    }

    private static String optionalText(JsonNode node) {
        return node == null || !node.isTextual() || node.asText().isBlank() ? null : node.asText().trim();
    }
}

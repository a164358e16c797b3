package com.acme.finops.ossaudit.policy;

import com.acme.finops.ossaudit.util.YamlCodec;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads approved and denied list documents.
 *
 * <p>{@code .yaml}, {@code .yml} and {@code .json} files hold either a mapping
 * keyed by coordinate, whose values may carry {@code copyright_notices},
 * {@code interaction_types} and {@code resolution}, or a sequence of
 * coordinate strings. Any other file is read one entry per line, skipping
 * blank lines and {@code #} comments. An empty document is an empty list.</p>
 */
public final class PolicyListLoader {
    static final String COPYRIGHT_NOTICES = "copyright_notices";
    static final String INTERACTION_TYPES = "interaction_types";
    static final String RESOLUTION = "resolution";

    public List<PolicyEntry> load(Path file) throws PolicyListException {
        if (file == null) {
            return List.of();
        }
        if (!Files.isRegularFile(file)) {
            throw new PolicyListException("policy list not found: " + file);
        }
        String raw;
        try {
            raw = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PolicyListException("unreadable policy list " + file + ": " + e.getMessage(), e);
        }
        return structured(file) ? parseStructured(raw, file) : parseLines(raw, file);
    }

    List<PolicyEntry> parseStructured(String raw, Path source) throws PolicyListException {
        JsonNode root;
        try {
            root = YamlCodec.readTree(raw);
        } catch (IOException e) {
            throw new PolicyListException("malformed policy list " + source + ": " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return List.of();
        }
        List<PolicyEntry> out = new ArrayList<>();
        if (root.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = root.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                out.add(entry(e.getKey(), e.getValue(), source));
            }
            return out;
        }
        if (root.isArray()) {
            for (JsonNode item : root) {
                if (!item.isTextual() || item.asText().isBlank()) {
                    throw new PolicyListException("policy list " + source + " must contain only coordinate strings, found: " + item);
                }
                out.add(entry(item.asText(), null, source));
            }
            return out;
        }
        throw new PolicyListException("policy list " + source + " must be a mapping or a sequence");
    }

    List<PolicyEntry> parseLines(String raw, Path source) throws PolicyListException {
        List<PolicyEntry> out = new ArrayList<>();
        for (String line : raw.split("\\R")) {
            String value = line.strip();
            if (value.isEmpty() || value.startsWith("#")) {
                continue;
            }
            out.add(entry(value, null, source));
        }
        return out;
    }

    private static PolicyEntry entry(String key, JsonNode meta, Path source) throws PolicyListException {
        if (key == null || PolicyEntry.normalize(key).isEmpty()) {
            throw new PolicyListException("empty entry in policy list " + source);
        }
        if (meta == null || meta.isNull() || !meta.isObject()) {
            return PolicyEntry.of(key);
        }
        return new PolicyEntry(
            key,
            text(meta.get(COPYRIGHT_NOTICES)),
            list(meta.get(INTERACTION_TYPES)),
            text(meta.get(RESOLUTION))
        );
    }

    private static String text(JsonNode node) {
        return node == null || node.isNull() || node.isContainerNode() ? "" : node.asText();
    }

    private static List<String> list(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            String single = node.asText();
            return single.isBlank() ? List.of() : List.of(single);
        }
        List<String> out = new ArrayList<>(node.size());
        for (JsonNode item : node) {
            out.add(item.asText());
        }
        return out;
    }

    private static boolean structured(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml") || name.endsWith(".json");
    }
}

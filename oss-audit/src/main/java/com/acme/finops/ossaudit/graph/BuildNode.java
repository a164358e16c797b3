package com.acme.finops.ossaudit.graph;

import java.util.List;
import java.util.Objects;

/**
 * One build target as exposed by the build system.
 *
 * @param label       unique target label, e.g. {@code @maven//:com_google_guava_guava}
 * @param tags        rule tags; {@code maven_coordinates=} and {@code maven_url=} carry package identity
 * @param srcjarLabel label of the source bundle target, or {@code null}
 */
public record BuildNode(String label, List<String> tags, String srcjarLabel) {
    public BuildNode {
        Objects.requireNonNull(label, "label");
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}

package com.acme.finops.ossaudit.graph;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GraphSnapshotLoaderTest {

    @TempDir
    Path dir;

    @Test
    void shouldLoadYamlSnapshot() throws Exception {
        Path file = write("graph.yaml", """
            root: //app:bin
            nodes:
              //app:bin:
                deps: ["@maven//:core"]
                deploy_env: //platform:env
              "@maven//:core":
                tags:
                  - maven_coordinates=com.acme:core:1.0
                  - maven_url=https://repo/core-1.0.jar
                srcjar: "@maven//:v1/https/repo/core-1.0-sources.jar"
                jar: "@maven//:core_jar"
              "@maven//:core_jar":
              //platform:env: {}
            """);

        GraphSnapshot graph = new GraphSnapshotLoader().load(file);

        assertEquals("//app:bin", graph.rootLabel());
        assertEquals(4, graph.size());
        BuildNode core = graph.node("@maven//:core");
        assertEquals(List.of("maven_coordinates=com.acme:core:1.0", "maven_url=https://repo/core-1.0.jar"), core.tags());
        assertEquals("@maven//:v1/https/repo/core-1.0-sources.jar", core.srcjarLabel());
        List<DependencyEdge> rootEdges = graph.edges(graph.node("//app:bin"));
        assertEquals(2, rootEdges.size());
        assertEquals(EdgeKind.DEPS, rootEdges.get(0).kind());
        assertEquals(EdgeKind.DEPLOY_ENV, rootEdges.get(1).kind());
        assertEquals(EdgeKind.JAR, graph.edges(core).get(0).kind());
    }

    @Test
    void shouldLoadJsonSnapshotWithoutRoot() throws Exception {
        Path file = write("graph.json", """
            {"nodes": {"//a": {"deps": "//b"}, "//b": {"tags": ["maven_coordinates=g:b:1"]}}}
            """);

        GraphSnapshot graph = new GraphSnapshotLoader().load(file);

        assertNull(graph.rootLabel());
        assertEquals("//b", graph.edges(graph.node("//a")).get(0).target().label());
    }

    @Test
    void shouldRejectDanglingEdge() throws Exception {
        Path file = write("graph.yaml", """
            root: //a
            nodes:
              //a:
                deps: [//missing]
            """);
        GraphException e = assertThrows(GraphException.class, () -> new GraphSnapshotLoader().load(file));
        assertTrue(e.getMessage().contains("//missing"));
    }

    @Test
    void shouldRejectUnknownEdgeKind() throws Exception {
        Path file = write("graph.yaml", """
            nodes:
              //a:
                plugins: [//b]
              //b: {}
            """);
        assertThrows(GraphException.class, () -> new GraphSnapshotLoader().load(file));
    }

    @Test
    void shouldRejectMissingFileAndMissingNodes() throws Exception {
        assertThrows(GraphException.class, () -> new GraphSnapshotLoader().load(dir.resolve("absent.yaml")));
        Path file = write("graph.yaml", "root: //a\n");
        assertThrows(GraphException.class, () -> new GraphSnapshotLoader().load(file));
    }

    private Path write(String name, String content) throws Exception {
        Path file = dir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}

package com.acme.finops.ossaudit.ci;

import com.acme.finops.ossaudit.graph.EdgeKind;
import com.acme.finops.ossaudit.graph.GraphSnapshot;
import com.acme.finops.ossaudit.license.LicenseLookupException;
import com.acme.finops.ossaudit.license.LicenseResolver;
import com.acme.finops.ossaudit.model.AuditResult;
import com.acme.finops.ossaudit.model.AuditWarning;
import com.acme.finops.ossaudit.model.IssueReason;
import com.acme.finops.ossaudit.model.PackageRecord;
import com.acme.finops.ossaudit.model.Verdict;
import com.acme.finops.ossaudit.policy.PolicyLists;
import com.acme.finops.ossaudit.util.YamlCodec;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OssAuditRunnerTest {
    private static final String GRAPH = """
        root: //app:bin
        nodes:
          //app:bin:
            deps: ["//third_party:a", "//third_party:b"]
            runtime_deps: //third_party:c
            deploy_env: //platform:env
          //third_party:a:
            tags: ["maven_coordinates=a:a:1.0", "maven_url=https://repo/a/a/1.0/a-1.0.jar"]
            deps: //third_party:c
          //third_party:b:
            tags: ["maven_coordinates=b:b:2.0", "maven_url=https://repo/b/b/2.0/b-2.0.jar"]
            srcjar: "@maven//:v1/https/repo/b/b/2.0/b-2.0-sources.jar"
          //third_party:c:
            tags: ["maven_coordinates=c:c:1.0", "maven_url=https://repo/c/c/1.0/c-1.0.jar"]
          //lib:internal:
            tags: ["maven_coordinates=com.acme:internal:1.0"]
          //platform:env:
            tags: ["maven_coordinates=p:platform:1.0", "maven_url=https://repo/p/platform/1.0/platform-1.0.jar"]
        """;

    @TempDir
    Path dir;

    @Test
    void shouldAuditGraphEndToEnd() throws Exception {
        Path graph = write("graph.yaml", GRAPH);
        Path approved = write("approved.yaml", "b:b:2.0:\n  resolution: approved\n");
        Path denied = write("denied.txt", "a:a:1.0\n");
        CountingResolver resolver = new CountingResolver(Map.of(
            "https://repo/a/a/1.0/a-1.0.jar", "GPL-3.0",
            "https://repo/b/b/2.0/b-2.0.jar", "Apache-2.0",
            "https://repo/c/c/1.0/c-1.0.jar", "MIT"
        ));

        OssAuditRunner.RunReport report = new OssAuditRunner(resolver, 2)
            .execute(options(graph, approved, denied, List.of(), true));
        AuditResult result = report.result();

        assertEquals(List.of("a:a:1.0", "b:b:2.0", "c:c:1.0"), coordinates(result.manifest()));
        assertEquals(List.of("p:platform:1.0"), coordinates(result.environment()));
        assertEquals(2, result.issues().size());
        assertEquals(IssueReason.DENIED, result.issues().get(0).reason());
        assertEquals(IssueReason.UNAPPROVED, result.issues().get(1).reason());
        assertEquals("c:c:1.0", result.issues().get(1).record().coordinate().toString());
        assertEquals(List.of("a:a:1.0"), assertInstanceOf(Verdict.Fail.class, result.verdict()).deniedCoordinates());
        assertEquals(List.of("a:a:1.0"), report.denied());
        resolver.calls.values().forEach(n -> assertEquals(1, n.get()));
        assertFalse(resolver.calls.containsKey("https://repo/p/platform/1.0/platform-1.0.jar"));

        assertEquals(dir.resolve("out").resolve("bin.bom.yaml"), report.files().bom());
        JsonNode bom = YamlCodec.readTree(report.files().bom());
        assertEquals(3, bom.size());
        assertEquals("approved", bom.get("b:b:2.0").get("resolution").asText());
        assertEquals("https://repo/b/b/2.0/b-2.0-sources.jar", bom.get("b:b:2.0").get("url").asText());
        JsonNode issues = YamlCodec.readTree(report.files().issues());
        assertEquals("Denied", issues.get("a:a:1.0").get("reason").asText());
        assertEquals("Unapproved", issues.get("c:c:1.0").get("reason").asText());
    }

    @Test
    void shouldKeepPackageWhenLicenseCannotBeFound() throws Exception {
        GraphSnapshot graph = GraphSnapshot.builder()
            .root("//app")
            .node("//app", List.of())
            .node("//a", List.of("maven_coordinates=a:a:1.0", "maven_url=https://repo/a-1.0.jar"))
            .node("//b", List.of("maven_coordinates=b:b:2.0", "maven_url=https://repo/b-2.0.jar"))
            .edge("//app", EdgeKind.DEPS, "//a")
            .edge("//app", EdgeKind.DEPS, "//b")
            .build();
        CountingResolver resolver = new CountingResolver(Map.of("https://repo/a-1.0.jar", "MIT"));

        AuditResult result = new OssAuditRunner(resolver, 4)
            .audit(graph, "//app", PolicyLists.of(List.of("a", "b"), List.of(), List.of()), true, false);

        assertEquals(2, result.manifest().size());
        PackageRecord b = result.manifest().get(1);
        assertEquals("b:b:2.0", b.coordinate().toString());
        assertEquals("", b.license());
        assertTrue(result.issues().isEmpty());
        assertTrue(result.verdict().passed());
        assertEquals(1, result.warnings().size());
        assertEquals(AuditWarning.Kind.LICENSE_LOOKUP_FAILED, result.warnings().get(0).kind());
    }

    @Test
    void shouldResolveSharedJarUrlOnce() throws Exception {
        String shared = "https://repo/shaded/bundle-1.0.jar";
        GraphSnapshot graph = GraphSnapshot.builder()
            .root("//app")
            .node("//app", List.of())
            .node("//x", List.of("maven_coordinates=x:x:1.0", "maven_url=" + shared))
            .node("//y", List.of("maven_coordinates=y:y:1.0", "maven_url=" + shared))
            .edge("//app", EdgeKind.DEPS, "//x")
            .edge("//app", EdgeKind.RUNTIME_DEPS, "//y")
            .edge("//x", EdgeKind.DEPS, "//y")
            .build();
        CountingResolver resolver = new CountingResolver(Map.of(shared, "Apache-2.0"));

        AuditResult result = new OssAuditRunner(resolver, 4)
            .audit(graph, "//app", PolicyLists.empty(), false, false);

        assertEquals(List.of("x:x:1.0", "y:y:1.0"), coordinates(result.manifest()));
        result.manifest().forEach(r -> assertEquals("Apache-2.0", r.license()));
        assertEquals(1, resolver.calls.size());
        assertEquals(1, resolver.calls.get(shared).get());
    }

    @Test
    void shouldListInternalPackagesSeparately() throws Exception {
        GraphSnapshot graph = GraphSnapshot.builder()
            .root("//app")
            .node("//app", List.of("maven_coordinates=com.acme:app:1.0"))
            .build();

        AuditResult result = new OssAuditRunner(url -> {
            throw new AssertionError("internal packages are never resolved");
        }, 1).audit(graph, "//app", PolicyLists.empty(), false, true);

        assertTrue(result.manifest().isEmpty());
        assertEquals(List.of("com.acme:app:1.0"), result.internalPackages());
    }

    @Test
    void shouldHonorSuppressionsInStrictMode() throws Exception {
        Path graph = write("graph.yaml", GRAPH);
        Path denied = write("denied.yaml", "- maven:a:a:1.0\n");

        OssAuditRunner.RunReport report = new OssAuditRunner(url -> "MIT", 2)
            .execute(options(graph, null, denied, List.of("maven:a:a:1.0"), true));

        assertTrue(report.result().verdict().passed());
        assertEquals(List.of("a:a:1.0"), report.denied());
        report.result().issues().forEach(i -> assertEquals(IssueReason.UNAPPROVED, i.reason()));
    }

    @Test
    void shouldFailOnFatalResolverError() throws Exception {
        Path graph = write("graph.yaml", GRAPH);
        OssAuditRunner runner = new OssAuditRunner(url -> {
            throw new IllegalStateException("broken resolver");
        }, 2);

        AuditException e = assertThrows(AuditException.class,
            () -> runner.execute(options(graph, null, null, List.of(), false)));
        assertTrue(e.getMessage().contains("license resolution failed"), e.getMessage());
        assertFalse(Files.exists(dir.resolve("out").resolve("bin.bom.yaml")));
    }

    @Test
    void shouldFailOnInvalidInputs() throws Exception {
        OssAuditRunner runner = new OssAuditRunner(url -> "", 1);
        Path graph = write("graph.yaml", GRAPH);

        assertThrows(AuditException.class,
            () -> runner.execute(options(dir.resolve("missing.yaml"), null, null, List.of(), false)));
        assertThrows(AuditException.class,
            () -> runner.execute(options(graph, dir.resolve("missing-approved.yaml"), null, List.of(), false)));
        GraphSnapshot snapshot = GraphSnapshot.builder().node("//a", List.of()).build();
        assertThrows(AuditException.class,
            () -> runner.audit(snapshot, "//nope", PolicyLists.empty(), false, false));
    }

    @Test
    void shouldDerivePrefixFromTargetLabel() {
        assertEquals("bin", OssAuditRunner.prefixFor("//app:bin"));
        assertEquals("server", OssAuditRunner.prefixFor("//services/server"));
        assertEquals("a_b", OssAuditRunner.prefixFor("//x:a b"));
        assertEquals("audit", OssAuditRunner.prefixFor("//x:"));
    }

    private AuditOptions options(Path graph, Path approved, Path denied, List<String> suppress, boolean strict) {
        return new AuditOptions(graph, null, dir.resolve("out"), null, approved, denied, suppress, strict, false, 2, 1_000, 1, 0);
    }

    private Path write(String name, String content) throws Exception {
        Path file = dir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private static List<String> coordinates(List<PackageRecord> records) {
        return records.stream().map(r -> r.coordinate().toString()).toList();
    }

    private static final class CountingResolver implements LicenseResolver {
        private final Map<String, String> licenses;
        private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();

        private CountingResolver(Map<String, String> licenses) {
            this.licenses = licenses;
        }

        @Override
        public String resolve(String jarUrl) throws LicenseLookupException {
            calls.computeIfAbsent(jarUrl, k -> new AtomicInteger()).incrementAndGet();
            String license = licenses.get(jarUrl);
            if (license == null) {
                throw new LicenseLookupException("unable to download " + jarUrl + ": HTTP 404");
            }
            return license;
        }
    }
}

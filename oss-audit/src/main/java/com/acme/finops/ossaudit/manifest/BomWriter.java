package com.acme.finops.ossaudit.manifest;

import com.acme.finops.ossaudit.model.AuditResult;
import com.acme.finops.ossaudit.policy.PolicyLists;
import com.acme.finops.ossaudit.util.AuditDefaults;
import com.acme.finops.ossaudit.util.YamlCodec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Writes {@code <prefix>.bom.yaml} and {@code <prefix>.bom-issues.yaml}.
 * Empty documents are written as {@code {}}.
 */
public final class BomWriter {

    public record BomFiles(Path bom, Path issues) {}

    public BomFiles write(Path outputDir, String prefix, AuditResult result, PolicyLists policy) throws IOException {
        Files.createDirectories(outputDir);
        BomDocument document = new BomDocument(policy);
        Path bom = outputDir.resolve(prefix + AuditDefaults.BOM_SUFFIX);
        Path issues = outputDir.resolve(prefix + AuditDefaults.BOM_ISSUES_SUFFIX);
        Files.writeString(bom, render(document.bom(result.manifest())), StandardCharsets.UTF_8);
        Files.writeString(issues, render(document.issues(result.manifest(), result.issues())), StandardCharsets.UTF_8);
        return new BomFiles(bom, issues);
    }

    static String render(Map<String, Object> document) throws IOException {
        if (document.isEmpty()) {
            return "{}\n";
        }
        return YamlCodec.writeString(document);
    }
}

package com.acme.finops.ossaudit.license;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PomLicenseParserTest {

    @Test
    void shouldJoinLicenseNamesFromNamespacedPom() throws Exception {
        String pom = """
            <?xml version="1.0" encoding="UTF-8"?>
            <project xmlns="http://maven.apache.org/POM/4.0.0">
              <modelVersion>4.0.0</modelVersion>
              <licenses>
                <license>
                  <name> Apache License, Version 2.0 </name>
                  <url>https://www.apache.org/licenses/LICENSE-2.0.txt</url>
                </license>
                <license>
                  <name>MIT</name>
                </license>
              </licenses>
            </project>
            """;
        assertEquals("Apache License, Version 2.0;MIT", PomLicenseParser.licenses(pom.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void shouldReadPomWithoutNamespace() throws Exception {
        String pom = "<project><licenses><license><name>BSD-3-Clause</name></license></licenses></project>";
        assertEquals("BSD-3-Clause", PomLicenseParser.licenses(pom.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void shouldIgnoreLicensesOutsideProjectLevel() throws Exception {
        String pom = """
            <project>
              <dependencies>
                <dependency><licenses><license><name>GPL</name></license></licenses></dependency>
              </dependencies>
            </project>
            """;
        assertEquals("", PomLicenseParser.licenses(pom.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void shouldFailOnUnparsableContent() {
        assertThrows(LicenseLookupException.class,
            () -> PomLicenseParser.licenses("<html><body>not found".getBytes(StandardCharsets.UTF_8)));
    }
}

package com.acme.finops.ossaudit.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Shared YAML codec for graph snapshots, policy lists and BOM documents.
 *
 * <p>JSON input is accepted wherever YAML is, since every JSON document is
 * also a YAML document.</p>
 */
public final class YamlCodec {
    private static final ObjectMapper READER = new YAMLMapper();
    private static final ObjectMapper WRITER = new ObjectMapper(YAMLFactory.builder()
        .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
        .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
        .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
        .enable(YAMLGenerator.Feature.LITERAL_BLOCK_STYLE)
        .disable(YAMLGenerator.Feature.SPLIT_LINES)
        .build());

    private YamlCodec() {
    }

    public static JsonNode readTree(String raw) throws JsonProcessingException {
        return READER.readTree(raw);
    }

    public static JsonNode readTree(Path file) throws IOException {
        return readTree(Files.readString(file, StandardCharsets.UTF_8));
    }

    public static String writeString(Object value) throws JsonProcessingException {
        return WRITER.writeValueAsString(value);
    }
}

package com.acme.finops.ossaudit.util;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnvVarsTest {

    @Test
    void shouldReturnDefaultForMissingOrBlank() {
        Map<String, String> env = Map.of("EMPTY", "   ", "SET", " value ");
        assertEquals("fallback", EnvVars.getOrDefault(env, "MISSING", "fallback"));
        assertEquals("fallback", EnvVars.getOrDefault(env, "EMPTY", "fallback"));
        assertEquals("value", EnvVars.getOrDefault(env, "SET", "fallback"));
    }

    @Test
    void shouldParseBooleanWithDefault() {
        Map<String, String> env = Map.of("ENABLED", "true", "DISABLED", "false");
        assertTrue(EnvVars.getBoolean(env, "ENABLED", false));
        assertFalse(EnvVars.getBoolean(env, "DISABLED", true));
        assertTrue(EnvVars.getBoolean(env, "MISSING", true));
    }

    @Test
    void shouldClampIntAndFallbackOnMalformed() {
        Map<String, String> env = Map.of(
            "LOW", "-10",
            "HIGH", "9000",
            "OK", " 42 ",
            "BAD", "abc"
        );
        assertEquals(1, EnvVars.getIntClamped(env, "LOW", 10, 1, 100));
        assertEquals(100, EnvVars.getIntClamped(env, "HIGH", 10, 1, 100));
        assertEquals(42, EnvVars.getIntClamped(env, "OK", 10, 1, 100));
        assertEquals(10, EnvVars.getIntClamped(env, "BAD", 10, 1, 100));
        assertEquals(10, EnvVars.getIntClamped(env, "MISSING", 10, 1, 100));
    }

    @Test
    void shouldSplitCommaSeparatedList() {
        Map<String, String> env = Map.of("LIST", " a:b:1, ,maven:c:d:2 ,", "BLANK", "  ");
        assertEquals(List.of("a:b:1", "maven:c:d:2"), EnvVars.getList(env, "LIST"));
        assertEquals(List.of(), EnvVars.getList(env, "BLANK"));
        assertEquals(List.of(), EnvVars.getList(env, "MISSING"));
    }
}

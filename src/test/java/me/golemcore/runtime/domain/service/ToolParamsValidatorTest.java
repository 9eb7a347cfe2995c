package me.golemcore.runtime.domain.service;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolParamsValidatorTest {

    private static final Map<String, Object> SCHEMA = Map.of(
            "type", "object",
            "required", List.of("path"),
            "properties", Map.of(
                    "path", Map.of("type", "string"),
                    "limit", Map.of("type", "integer"),
                    "mode", Map.of("type", "string", "enum", List.of("read", "write")),
                    "tags", Map.of("type", "array", "items", Map.of("type", "string")),
                    "options", Map.of(
                            "type", "object",
                            "required", List.of("depth"),
                            "properties", Map.of("depth", Map.of("type", "number")))));

    @Test
    void shouldAcceptValidArguments() {
        Optional<String> error = ToolParamsValidator.validate(SCHEMA, Map.of(
                "path", "a.txt",
                "limit", 10,
                "mode", "read",
                "tags", List.of("x", "y"),
                "options", Map.of("depth", 1.5)));

        assertTrue(error.isEmpty());
    }

    @Test
    void shouldReportMissingRequiredProperty() {
        assertEquals(Optional.of("params must have required property 'path'"),
                ToolParamsValidator.validate(SCHEMA, Map.of("limit", 1)));
    }

    @Test
    void shouldReportWrongType() {
        assertEquals(Optional.of("params/limit must be integer"),
                ToolParamsValidator.validate(SCHEMA, Map.of("path", "a", "limit", "ten")));
    }

    @Test
    void shouldAcceptWholeDoublesAsIntegers() {
        assertTrue(ToolParamsValidator.validate(SCHEMA, Map.of("path", "a", "limit", 3.0)).isEmpty());
    }

    @Test
    void shouldReportValueOutsideEnum() {
        assertTrue(ToolParamsValidator.validate(SCHEMA, Map.of("path", "a", "mode", "delete")).orElseThrow()
                .startsWith("params/mode must be equal to one of the allowed values"));
    }

    @Test
    void shouldValidateNestedObjectsAndArrayItems() {
        assertEquals(Optional.of("params/tags/1 must be string"),
                ToolParamsValidator.validate(SCHEMA, Map.of("path", "a", "tags", List.of("x", 2))));
        assertEquals(Optional.of("params/options must have required property 'depth'"),
                ToolParamsValidator.validate(SCHEMA, Map.of("path", "a", "options", Map.of())));
    }

    @Test
    void shouldSkipValidationWithoutSchema() {
        assertTrue(ToolParamsValidator.validate(null, Map.of("anything", 1)).isEmpty());
        assertTrue(ToolParamsValidator.validate(Map.of(), null).isEmpty());
    }

    @Test
    void shouldAcceptAnyOfTypeList() {
        Map<String, Object> schema = Map.of("type", "object", "properties",
                Map.of("id", Map.of("type", List.of("string", "integer"))));

        assertTrue(ToolParamsValidator.validate(schema, Map.of("id", 5)).isEmpty());
        assertTrue(ToolParamsValidator.validate(schema, Map.of("id", true)).isPresent());
    }
}

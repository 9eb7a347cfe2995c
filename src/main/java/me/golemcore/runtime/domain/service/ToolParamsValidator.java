package me.golemcore.runtime.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.math.BigInteger;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks tool arguments against the subset of JSON Schema that tool
 * declarations use: {@code type}, {@code required}, {@code properties},
 * {@code enum} and {@code items}, recursively.
 */
public final class ToolParamsValidator {

    private static final String ROOT = "params";

    private ToolParamsValidator() {
    }

    /**
     * @return the first violation found, or empty when the arguments conform
     */
    public static Optional<String> validate(Map<String, Object> schema, Map<String, Object> args) {
        if (schema == null || schema.isEmpty()) {
            return Optional.empty();
        }
        return validateValue(schema, args != null ? args : Map.of(), ROOT);
    }

    @SuppressWarnings("unchecked")
    private static Optional<String> validateValue(Map<String, Object> schema, Object value, String path) {
        Object type = schema.get("type");
        if (type instanceof String typeName && !matchesType(typeName, value)) {
            return Optional.of(path + " must be " + typeName);
        }
        if (type instanceof Collection<?> typeNames
                && typeNames.stream().noneMatch(t -> matchesType(String.valueOf(t), value))) {
            return Optional.of(path + " must be one of types " + typeNames);
        }

        Object allowed = schema.get("enum");
        if (allowed instanceof Collection<?> values && !values.contains(value)) {
            return Optional.of(path + " must be equal to one of the allowed values " + values);
        }

        if (value instanceof Map<?, ?> object) {
            Object required = schema.get("required");
            if (required instanceof Collection<?> names) {
                for (Object name : names) {
                    if (!object.containsKey(name) || object.get(name) == null) {
                        return Optional.of(path + " must have required property '" + name + "'");
                    }
                }
            }
            Object properties = schema.get("properties");
            if (properties instanceof Map<?, ?> propertySchemas) {
                for (Map.Entry<?, ?> entry : propertySchemas.entrySet()) {
                    Object propertyValue = object.get(entry.getKey());
                    if (propertyValue == null || !(entry.getValue() instanceof Map<?, ?>)) {
                        continue;
                    }
                    Optional<String> error = validateValue((Map<String, Object>) entry.getValue(), propertyValue,
                            path + "/" + entry.getKey());
                    if (error.isPresent()) {
                        return error;
                    }
                }
            }
        }

        if (value instanceof List<?> list && schema.get("items") instanceof Map<?, ?> itemSchema) {
            for (int i = 0; i < list.size(); i++) {
                Optional<String> error = validateValue((Map<String, Object>) itemSchema, list.get(i),
                        path + "/" + i);
                if (error.isPresent()) {
                    return error;
                }
            }
        }
        return Optional.empty();
    }

    private static boolean matchesType(String type, Object value) {
        return switch (type) {
        case "object" -> value instanceof Map<?, ?>;
        case "array" -> value instanceof List<?>;
        case "string" -> value instanceof String;
        case "boolean" -> value instanceof Boolean;
        case "number" -> value instanceof Number;
        case "integer" -> isInteger(value);
        case "null" -> value == null;
        default -> true;
        };
    }

    private static boolean isInteger(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte
                || value instanceof BigInteger) {
            return true;
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return !Double.isInfinite(d) && d == Math.rint(d);
        }
        return false;
    }
}

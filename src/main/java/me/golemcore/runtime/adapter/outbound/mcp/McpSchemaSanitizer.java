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

package me.golemcore.runtime.adapter.outbound.mcp;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cleans MCP input schemas before they are handed to the model: drops
 * {@code $schema} and {@code additionalProperties}, and drops {@code default}
 * next to {@code anyOf}, at every nesting level. Returns a copy.
 */
public final class McpSchemaSanitizer {

    private McpSchemaSanitizer() {
    }

    public static Map<String, Object> sanitize(Map<String, Object> schema) {
        if (schema == null) {
            return Map.of("type", "object", "properties", Map.of());
        }
        return sanitizeObject(schema);
    }

    private static Map<String, Object> sanitizeObject(Map<?, ?> schema) {
        Map<String, Object> cleaned = new LinkedHashMap<>();
        boolean hasAnyOf = schema.containsKey("anyOf");
        for (Map.Entry<?, ?> entry : schema.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if ("$schema".equals(key) || "additionalProperties".equals(key)) {
                continue;
            }
            if (hasAnyOf && "default".equals(key)) {
                continue;
            }
            cleaned.put(key, sanitizeValue(entry.getValue()));
        }
        return cleaned;
    }

    private static Object sanitizeValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return sanitizeObject(map);
        }
        if (value instanceof List<?> list) {
            List<Object> cleaned = new ArrayList<>(list.size());
            for (Object item : list) {
                cleaned.add(sanitizeValue(item));
            }
            return cleaned;
        }
        return value;
    }
}

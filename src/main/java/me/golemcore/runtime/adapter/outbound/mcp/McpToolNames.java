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

/**
 * Registry names for MCP tools: {@code server__tool}, restricted to characters
 * model APIs accept and to 63 characters.
 */
public final class McpToolNames {

    public static final String SEPARATOR = "__";
    static final int MAX_LENGTH = 63;

    private McpToolNames() {
    }

    public static String qualify(String serverName, String toolName) {
        String name = (serverName + SEPARATOR + toolName).replaceAll("[^a-zA-Z0-9_.-]", "_");
        if (name.length() > MAX_LENGTH) {
            name = name.substring(0, 28) + "___" + name.substring(name.length() - 32);
        }
        return name;
    }
}

package me.golemcore.runtime.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Resolved configuration of one MCP server. Stdio servers set {@code command};
 * remote servers set {@code url}.
 */
@Value
@Builder(toBuilder = true)
public class McpServerConfig {

    String name;
    String command;
    @Builder.Default
    List<String> args = List.of();
    @Builder.Default
    Map<String, String> env = Map.of();
    String cwd;
    String url;
    @Builder.Default
    Map<String, String> headers = Map.of();
    @Builder.Default
    boolean enabled = true;
    @Builder.Default
    int timeoutSeconds = 30;
    boolean trust;
    @Builder.Default
    List<String> includeTools = List.of();
    @Builder.Default
    List<String> excludeTools = List.of();

    public boolean isRemote() {
        return url != null && !url.isBlank();
    }

    public boolean hasTransport() {
        return isRemote() || (command != null && !command.isBlank());
    }

    /**
     * Applies the include and exclude filters to an original (server-side) tool
     * name. Exclusions win.
     */
    public boolean isToolIncluded(String toolName) {
        if (excludeTools.contains(toolName)) {
            return false;
        }
        return includeTools.isEmpty() || includeTools.contains(toolName);
    }
}

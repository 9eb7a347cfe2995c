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

import java.util.regex.Pattern;

/**
 * One policy rule. {@code toolName} is either an exact name or a
 * {@code server__*} wildcard covering every tool of an MCP server.
 * {@code argsPattern} is matched against the key-sorted JSON form of the
 * arguments.
 */
@Value
@Builder
public class PolicyRule {

    public static final String SERVER_WILDCARD_SUFFIX = "__*";

    String toolName;
    Pattern argsPattern;
    PolicyDecision decision;
    String source;

    public boolean isServerWildcard() {
        return toolName != null && toolName.endsWith(SERVER_WILDCARD_SUFFIX);
    }

    /**
     * Server name of a wildcard rule, or {@code null} for exact rules.
     */
    public String getWildcardServer() {
        if (!isServerWildcard()) {
            return null;
        }
        return toolName.substring(0, toolName.length() - SERVER_WILDCARD_SUFFIX.length());
    }
}

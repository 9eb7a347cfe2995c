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

import me.golemcore.runtime.domain.model.PolicyDecision;
import me.golemcore.runtime.domain.model.PolicyRule;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates {@code runtime.policy.*} and {@code runtime.mcp.*} settings into
 * policy rules.
 *
 * <ul>
 * <li>excluded MCP servers: DENY {@code server__*}</li>
 * <li>excluded tools: DENY</li>
 * <li>allowed tools: ALLOW; {@code shell(git status)} allows shell commands
 * starting with {@code git status}</li>
 * <li>trusted and allowed MCP servers: ALLOW {@code server__*}</li>
 * <li>explicit rules as configured</li>
 * </ul>
 */
public final class PolicyRuleFactory {

    private static final Pattern LEGACY_SHELL = Pattern.compile("^(?:run_shell_command|shell|bash)\\((.+)\\)$");

    private PolicyRuleFactory() {
    }

    public static List<PolicyRule> fromProperties(RuntimeProperties properties) {
        List<PolicyRule> rules = new ArrayList<>();
        RuntimeProperties.McpProperties mcp = properties.getMcp();
        RuntimeProperties.PolicyProperties policy = properties.getPolicy();

        for (String server : mcp.getExcludedServers()) {
            rules.add(serverRule(server, PolicyDecision.DENY, "mcp.excluded-servers"));
        }
        for (String tool : policy.getExcludedTools()) {
            rules.add(toolRule(tool, PolicyDecision.DENY, "policy.excluded-tools"));
        }
        for (String tool : policy.getAllowedTools()) {
            Matcher legacy = LEGACY_SHELL.matcher(tool.trim());
            if (legacy.matches()) {
                rules.addAll(shellPrefixRules(legacy.group(1).trim()));
            } else {
                rules.add(toolRule(tool, PolicyDecision.ALLOW, "policy.allowed-tools"));
            }
        }
        for (Map.Entry<String, RuntimeProperties.McpServerProperties> entry : mcp.getServers().entrySet()) {
            if (entry.getValue().isTrust()) {
                rules.add(serverRule(entry.getKey(), PolicyDecision.ALLOW, "mcp.servers.trust"));
            }
        }
        for (String server : mcp.getAllowedServers()) {
            rules.add(serverRule(server, PolicyDecision.ALLOW, "mcp.allowed-servers"));
        }
        for (RuntimeProperties.RuleProperties rule : policy.getRules()) {
            rules.add(PolicyRule.builder()
                    .toolName(rule.getToolName())
                    .argsPattern(rule.getArgsPattern() != null ? Pattern.compile(rule.getArgsPattern()) : null)
                    .decision(rule.getDecision())
                    .source(rule.getSource())
                    .build());
        }
        return rules;
    }

    /**
     * Rule set matching shell invocations whose {@code command} starts with
     * {@code prefix} as a whole word.
     */
    static List<PolicyRule> shellPrefixRules(String prefix) {
        Pattern pattern = Pattern.compile("\"command\":\"" + Pattern.quote(prefix) + "(?:[\\s\"]|\\\\)");
        return PolicyEngine.SHELL_TOOL_NAMES.stream()
                .sorted()
                .map(shell -> PolicyRule.builder()
                        .toolName(shell)
                        .argsPattern(pattern)
                        .decision(PolicyDecision.ALLOW)
                        .source("policy.allowed-tools")
                        .build())
                .toList();
    }

    private static PolicyRule toolRule(String toolName, PolicyDecision decision, String source) {
        return PolicyRule.builder()
                .toolName(toolName.trim())
                .decision(decision)
                .source(source)
                .build();
    }

    private static PolicyRule serverRule(String server, PolicyDecision decision, String source) {
        return PolicyRule.builder()
                .toolName(server.trim() + PolicyRule.SERVER_WILDCARD_SUFFIX)
                .decision(decision)
                .source(source)
                .build();
    }
}

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.model.ApprovalMode;
import me.golemcore.runtime.domain.model.PolicyContext;
import me.golemcore.runtime.domain.model.PolicyDecision;
import me.golemcore.runtime.domain.model.PolicyRule;
import me.golemcore.runtime.domain.model.ToolKind;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a tool call may run, must be confirmed by the user, or is
 * refused.
 *
 * <p>
 * The rule set is fixed at construction and {@link #check} has no side effects,
 * so the same inputs always give the same decision. Precedence is: a matching
 * DENY rule, then a matching ALLOW rule, then a matching ASK_USER rule, then
 * the approval-mode default for the tool's kind. YOLO turns ASK_USER into
 * ALLOW; a non-interactive context turns ASK_USER into DENY.
 *
 * <p>
 * Shell commands are also checked part by part, so an allowed prefix cannot
 * smuggle a second command through {@code &&} or {@code |}.
 */
@Slf4j
public class PolicyEngine {

    public static final Set<String> SHELL_TOOL_NAMES = Set.of("run_shell_command", "shell", "bash");

    private static final String COMMAND = "command";
    private static final String UNKNOWN = "unknown";
    private static final int COMMAND_LENGTH_THRESHOLD = 80;

    private final List<PolicyRule> rules;

    public PolicyEngine(List<PolicyRule> rules) {
        this.rules = List.copyOf(rules);
        log.info("[Policy] Loaded {} rule(s)", this.rules.size());
    }

    public List<PolicyRule> getRules() {
        return rules;
    }

    public PolicyDecision check(String toolName, Map<String, Object> args, ApprovalMode approvalMode,
            PolicyContext context) {
        PolicyContext effectiveContext = context != null ? context : PolicyContext.defaults();
        ApprovalMode mode = approvalMode != null ? approvalMode : ApprovalMode.DEFAULT;

        PolicyDecision decision = evaluate(toolName, args, mode, effectiveContext);
        if (isShellCommand(toolName, args) && decision != PolicyDecision.DENY) {
            decision = checkShellParts(toolName, args, mode, effectiveContext, decision);
        }

        if (mode == ApprovalMode.YOLO && decision == PolicyDecision.ASK_USER) {
            decision = PolicyDecision.ALLOW;
        }
        if (!effectiveContext.isInteractive() && decision == PolicyDecision.ASK_USER) {
            decision = PolicyDecision.DENY;
        }
        return decision;
    }

    /**
     * Builds a human-readable description of the action for logs and
     * confirmation prompts.
     */
    public String describeAction(String toolName, Map<String, Object> args) {
        if (SHELL_TOOL_NAMES.contains(toolName)) {
            return describeShellAction(args);
        }
        Object path = args != null ? args.getOrDefault("file_path", args.get("path")) : null;
        if (path != null) {
            return toolName + " on " + path;
        }
        return toolName + ": " + (args != null ? args : Map.of());
    }

    private PolicyDecision checkShellParts(String toolName, Map<String, Object> args, ApprovalMode mode,
            PolicyContext context, PolicyDecision wholeDecision) {
        String command = (String) args.get(COMMAND);
        Optional<List<String>> parts = ShellCommandSplitter.split(command);
        if (parts.isEmpty()) {
            log.debug("[Policy] Could not parse shell command, asking: {}", command);
            return PolicyDecision.ASK_USER;
        }
        if (parts.get().size() == 1) {
            return wholeDecision;
        }

        PolicyDecision aggregate = PolicyDecision.ALLOW;
        for (String part : parts.get()) {
            Map<String, Object> partArgs = new HashMap<>(args);
            partArgs.put(COMMAND, part);
            PolicyDecision partDecision = evaluate(toolName, partArgs, mode, context);
            if (partDecision == PolicyDecision.DENY) {
                return PolicyDecision.DENY;
            }
            if (partDecision == PolicyDecision.ASK_USER) {
                aggregate = PolicyDecision.ASK_USER;
            }
        }
        return aggregate;
    }

    private PolicyDecision evaluate(String toolName, Map<String, Object> args, ApprovalMode mode,
            PolicyContext context) {
        String argsJson = null;
        boolean allow = false;
        boolean ask = false;
        for (PolicyRule rule : rules) {
            if (!matchesName(rule, toolName, context.getServerName())) {
                continue;
            }
            if (rule.getArgsPattern() != null) {
                if (argsJson == null) {
                    argsJson = StableArgsSerializer.stringify(args);
                }
                if (!rule.getArgsPattern().matcher(argsJson).find()) {
                    continue;
                }
            }
            switch (rule.getDecision()) {
            case DENY -> {
                return PolicyDecision.DENY;
            }
            case ALLOW -> allow = true;
            case ASK_USER -> ask = true;
            default -> throw new IllegalStateException("Unexpected decision: " + rule.getDecision());
            }
        }
        if (allow) {
            return PolicyDecision.ALLOW;
        }
        if (ask) {
            return PolicyDecision.ASK_USER;
        }
        return modeDefault(mode, context.getToolKind());
    }

    private static boolean matchesName(PolicyRule rule, String toolName, String serverName) {
        if (rule.getToolName() == null || toolName == null) {
            return false;
        }
        if (!rule.isServerWildcard()) {
            return rule.getToolName().equals(toolName);
        }
        String ruleServer = rule.getWildcardServer();
        if (!toolName.startsWith(ruleServer + "__")) {
            return false;
        }
        // a tool may only claim a server prefix that is really its own
        return serverName == null || serverName.equals(ruleServer);
    }

    private static PolicyDecision modeDefault(ApprovalMode mode, ToolKind kind) {
        ToolKind effectiveKind = kind != null ? kind : ToolKind.OTHER;
        if (!effectiveKind.isMutating()) {
            return PolicyDecision.ALLOW;
        }
        if (mode == ApprovalMode.PLAN) {
            return PolicyDecision.DENY;
        }
        if (mode == ApprovalMode.AUTO_EDIT && effectiveKind.isEdit()) {
            return PolicyDecision.ALLOW;
        }
        return PolicyDecision.ASK_USER;
    }

    private static boolean isShellCommand(String toolName, Map<String, Object> args) {
        return SHELL_TOOL_NAMES.contains(toolName) && args != null && args.get(COMMAND) instanceof String;
    }

    private static String describeShellAction(Map<String, Object> args) {
        Object raw = args != null ? args.get(COMMAND) : null;
        String command = raw != null ? raw.toString() : UNKNOWN;
        if (command.length() > COMMAND_LENGTH_THRESHOLD) {
            command = command.substring(0, COMMAND_LENGTH_THRESHOLD) + "...";
        }
        return "Run command: " + command;
    }
}

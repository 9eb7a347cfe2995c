package me.golemcore.runtime.domain.service;

import me.golemcore.runtime.domain.model.ApprovalMode;
import me.golemcore.runtime.domain.model.PolicyContext;
import me.golemcore.runtime.domain.model.PolicyDecision;
import me.golemcore.runtime.domain.model.PolicyRule;
import me.golemcore.runtime.domain.model.ToolKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PolicyEngineTest {

    private static final String SHELL = "run_shell_command";

    private static PolicyRule rule(String toolName, PolicyDecision decision) {
        return PolicyRule.builder().toolName(toolName).decision(decision).source("test").build();
    }

    private static PolicyRule rule(String toolName, String argsPattern, PolicyDecision decision) {
        return PolicyRule.builder()
                .toolName(toolName)
                .argsPattern(Pattern.compile(argsPattern))
                .decision(decision)
                .source("test")
                .build();
    }

    private static PolicyContext kind(ToolKind kind) {
        return PolicyContext.builder().toolKind(kind).build();
    }

    private static Map<String, Object> command(String command) {
        return Map.of("command", command);
    }

    // ===== rule precedence =====

    @Test
    void shouldPreferDenyOverAllow() {
        PolicyEngine engine = new PolicyEngine(List.of(
                rule("write_file", PolicyDecision.ALLOW),
                rule("write_file", PolicyDecision.DENY)));

        assertEquals(PolicyDecision.DENY,
                engine.check("write_file", Map.of(), ApprovalMode.DEFAULT, kind(ToolKind.EDIT)));
    }

    @Test
    void shouldPreferAllowOverAskUser() {
        PolicyEngine engine = new PolicyEngine(List.of(
                rule("write_file", PolicyDecision.ASK_USER),
                rule("write_file", PolicyDecision.ALLOW)));

        assertEquals(PolicyDecision.ALLOW,
                engine.check("write_file", Map.of(), ApprovalMode.DEFAULT, kind(ToolKind.EDIT)));
    }

    @Test
    void shouldAskWhenAskRuleMatchesReadOnlyTool() {
        PolicyEngine engine = new PolicyEngine(List.of(rule("web_fetch", PolicyDecision.ASK_USER)));

        assertEquals(PolicyDecision.ASK_USER,
                engine.check("web_fetch", Map.of(), ApprovalMode.DEFAULT, kind(ToolKind.FETCH)));
    }

    @Test
    void shouldReturnSameDecisionForSameInputs() {
        PolicyEngine engine = new PolicyEngine(List.of(rule("edit", PolicyDecision.ASK_USER)));
        Map<String, Object> args = Map.of("path", "a.txt");

        PolicyDecision first = engine.check("edit", args, ApprovalMode.DEFAULT, kind(ToolKind.EDIT));
        PolicyDecision second = engine.check("edit", args, ApprovalMode.DEFAULT, kind(ToolKind.EDIT));

        assertEquals(first, second);
    }

    // ===== approval mode defaults =====

    @Test
    void shouldAllowReadOnlyKindsByDefault() {
        PolicyEngine engine = new PolicyEngine(List.of());

        for (ToolKind kind : List.of(ToolKind.READ, ToolKind.SEARCH, ToolKind.FETCH, ToolKind.THINK)) {
            assertEquals(PolicyDecision.ALLOW, engine.check("t", Map.of(), ApprovalMode.DEFAULT, kind(kind)),
                    kind.name());
        }
    }

    @Test
    void shouldAskForMutatingKindsByDefault() {
        PolicyEngine engine = new PolicyEngine(List.of());

        assertEquals(PolicyDecision.ASK_USER,
                engine.check("edit", Map.of(), ApprovalMode.DEFAULT, kind(ToolKind.EDIT)));
        assertEquals(PolicyDecision.ASK_USER,
                engine.check(SHELL, command("ls"), ApprovalMode.DEFAULT, kind(ToolKind.EXECUTE)));
    }

    @Test
    void shouldAllowEditsInAutoEditMode() {
        PolicyEngine engine = new PolicyEngine(List.of());

        assertEquals(PolicyDecision.ALLOW,
                engine.check("edit", Map.of(), ApprovalMode.AUTO_EDIT, kind(ToolKind.EDIT)));
        assertEquals(PolicyDecision.ASK_USER,
                engine.check(SHELL, command("ls"), ApprovalMode.AUTO_EDIT, kind(ToolKind.EXECUTE)));
    }

    @Test
    void shouldDenyMutationsInPlanMode() {
        PolicyEngine engine = new PolicyEngine(List.of());

        assertEquals(PolicyDecision.DENY, engine.check("edit", Map.of(), ApprovalMode.PLAN, kind(ToolKind.EDIT)));
        assertEquals(PolicyDecision.ALLOW, engine.check("read", Map.of(), ApprovalMode.PLAN, kind(ToolKind.READ)));
    }

    @Test
    void shouldTurnAskIntoAllowInYoloMode() {
        PolicyEngine engine = new PolicyEngine(List.of(rule("edit", PolicyDecision.ASK_USER)));

        assertEquals(PolicyDecision.ALLOW, engine.check("edit", Map.of(), ApprovalMode.YOLO, kind(ToolKind.EDIT)));
    }

    @Test
    void shouldKeepExplicitDenyInYoloMode() {
        PolicyEngine engine = new PolicyEngine(List.of(rule("edit", PolicyDecision.DENY)));

        assertEquals(PolicyDecision.DENY, engine.check("edit", Map.of(), ApprovalMode.YOLO, kind(ToolKind.EDIT)));
    }

    @Test
    void shouldDenyWhatNeedsAskingWhenNonInteractive() {
        PolicyEngine engine = new PolicyEngine(List.of());
        PolicyContext headless = PolicyContext.builder().toolKind(ToolKind.EDIT).interactive(false).build();

        assertEquals(PolicyDecision.DENY, engine.check("edit", Map.of(), ApprovalMode.DEFAULT, headless));
        assertEquals(PolicyDecision.ALLOW, engine.check("edit", Map.of(), ApprovalMode.YOLO, headless));
    }

    @Test
    void shouldTreatMissingContextAsInteractiveOther() {
        PolicyEngine engine = new PolicyEngine(List.of());

        assertEquals(PolicyDecision.ASK_USER, engine.check("custom", Map.of(), null, null));
    }

    // ===== MCP server wildcards =====

    @Test
    void shouldMatchServerWildcardForOwnServer() {
        PolicyEngine engine = new PolicyEngine(List.of(rule("github__*", PolicyDecision.ALLOW)));
        PolicyContext context = PolicyContext.builder().serverName("github").build();

        assertEquals(PolicyDecision.ALLOW,
                engine.check("github__create_issue", Map.of(), ApprovalMode.DEFAULT, context));
    }

    @Test
    void shouldNotLetToolSpoofAnotherServerPrefix() {
        PolicyEngine engine = new PolicyEngine(List.of(rule("github__*", PolicyDecision.ALLOW)));
        PolicyContext spoofed = PolicyContext.builder().serverName("evil").build();

        assertEquals(PolicyDecision.ASK_USER,
                engine.check("github__create_issue", Map.of(), ApprovalMode.DEFAULT, spoofed));
    }

    @Test
    void shouldNotMatchWildcardWithoutSeparator() {
        PolicyEngine engine = new PolicyEngine(List.of(rule("github__*", PolicyDecision.DENY)));

        assertEquals(PolicyDecision.ALLOW,
                engine.check("github_reader", Map.of(), ApprovalMode.DEFAULT, kind(ToolKind.READ)));
    }

    // ===== argument patterns =====

    @Test
    void shouldMatchArgsPatternAgainstSortedJson() {
        PolicyEngine engine = new PolicyEngine(List.of(
                rule("write_file", "\\{\"content\":\"[^\"]*\",\"path\":\"docs/", PolicyDecision.ALLOW)));
        Map<String, Object> docs = new LinkedHashMap<>();
        docs.put("path", "docs/readme.md");
        docs.put("content", "hello");

        assertEquals(PolicyDecision.ALLOW, engine.check("write_file", docs, ApprovalMode.DEFAULT,
                kind(ToolKind.EDIT)));
        assertEquals(PolicyDecision.ASK_USER, engine.check("write_file",
                Map.of("path", "src/Main.java", "content", "x"), ApprovalMode.DEFAULT, kind(ToolKind.EDIT)));
    }

    // ===== shell commands =====

    @Test
    void shouldAllowShellCommandWithAllowedPrefix() {
        PolicyEngine engine = new PolicyEngine(PolicyRuleFactory.shellPrefixRules("git status"));

        assertEquals(PolicyDecision.ALLOW,
                engine.check(SHELL, command("git status"), ApprovalMode.DEFAULT, kind(ToolKind.EXECUTE)));
        assertEquals(PolicyDecision.ALLOW,
                engine.check(SHELL, command("git status --short"), ApprovalMode.DEFAULT, kind(ToolKind.EXECUTE)));
        assertEquals(PolicyDecision.ASK_USER,
                engine.check(SHELL, command("git statusx"), ApprovalMode.DEFAULT, kind(ToolKind.EXECUTE)));
    }

    @Test
    void shouldAskWhenAllowedPrefixChainsAnotherCommand() {
        PolicyEngine engine = new PolicyEngine(PolicyRuleFactory.shellPrefixRules("git status"));

        assertEquals(PolicyDecision.ASK_USER, engine.check(SHELL, command("git status && rm -rf /tmp/x"),
                ApprovalMode.DEFAULT, kind(ToolKind.EXECUTE)));
    }

    @Test
    void shouldDenyCompoundCommandWhenAnyPartIsDenied() {
        List<PolicyRule> rules = new ArrayList<>(PolicyRuleFactory.shellPrefixRules("git status"));
        rules.add(rule(SHELL, "\"command\":\"rm ", PolicyDecision.DENY));
        PolicyEngine engine = new PolicyEngine(rules);

        assertEquals(PolicyDecision.DENY, engine.check(SHELL, command("git status; rm -rf /"),
                ApprovalMode.DEFAULT, kind(ToolKind.EXECUTE)));
        assertEquals(PolicyDecision.DENY, engine.check(SHELL, command("git status | rm -rf /"),
                ApprovalMode.YOLO, kind(ToolKind.EXECUTE)));
    }

    @Test
    void shouldAllowCompoundCommandWhenEveryPartIsAllowed() {
        List<PolicyRule> rules = new ArrayList<>(PolicyRuleFactory.shellPrefixRules("git status"));
        rules.addAll(PolicyRuleFactory.shellPrefixRules("git diff"));
        PolicyEngine engine = new PolicyEngine(rules);

        assertEquals(PolicyDecision.ALLOW, engine.check(SHELL, command("git status && git diff"),
                ApprovalMode.DEFAULT, kind(ToolKind.EXECUTE)));
    }

    @Test
    void shouldAskWhenShellCommandCannotBeParsed() {
        PolicyEngine engine = new PolicyEngine(PolicyRuleFactory.shellPrefixRules("echo"));

        assertEquals(PolicyDecision.ASK_USER, engine.check(SHELL, command("echo \"unterminated"),
                ApprovalMode.DEFAULT, kind(ToolKind.EXECUTE)));
    }

    @Test
    void shouldNotSplitSeparatorsInsideQuotes() {
        PolicyEngine engine = new PolicyEngine(PolicyRuleFactory.shellPrefixRules("echo"));

        assertEquals(PolicyDecision.ALLOW, engine.check(SHELL, command("echo 'a && b'"),
                ApprovalMode.DEFAULT, kind(ToolKind.EXECUTE)));
    }

    // ===== describeAction =====

    @Test
    void shouldDescribeShellAndFileActions() {
        PolicyEngine engine = new PolicyEngine(List.of());

        assertEquals("Run command: ls -la", engine.describeAction(SHELL, command("ls -la")));
        assertEquals("write_file on a.txt", engine.describeAction("write_file", Map.of("file_path", "a.txt")));
        assertTrue(engine.describeAction(SHELL, command("x".repeat(200))).endsWith("..."));
    }
}

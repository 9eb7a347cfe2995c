package me.golemcore.runtime.adapter.outbound.mcp;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class McpToolNamesTest {

    @Test
    void shouldJoinServerAndToolName() {
        assertEquals("github__search", McpToolNames.qualify("github", "search"));
    }

    @Test
    void shouldReplaceUnsupportedCharacters() {
        assertEquals("my_server__tool_x", McpToolNames.qualify("my server", "tool/x"));
    }

    @Test
    void shouldKeepDotsAndDashes() {
        assertEquals("docs-v2__read.file", McpToolNames.qualify("docs-v2", "read.file"));
    }

    @Test
    void shouldShortenLongNamesKeepingBothEnds() {
        String server = "a".repeat(40);
        String tool = "b".repeat(40);

        String qualified = McpToolNames.qualify(server, tool);

        assertEquals(McpToolNames.MAX_LENGTH, qualified.length());
        assertTrue(qualified.startsWith("a".repeat(28) + "___"));
        assertTrue(qualified.endsWith("b".repeat(32)));
    }
}

package me.golemcore.runtime.domain.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolCallTest {

    private static ToolCall newCall() {
        return new ToolCall(ToolCallRequest.builder()
                .callId("c1")
                .name("read_file")
                .args(Map.of("path", "a.txt"))
                .build());
    }

    private static ToolCallResponse response(ToolCallStatus status) {
        return ToolCallResponse.builder()
                .callId("c1")
                .name("read_file")
                .status(status)
                .content("x")
                .build();
    }

    // ===== status transitions =====

    @Test
    void shouldStartInValidating() {
        ToolCall call = newCall();

        assertEquals(ToolCallStatus.VALIDATING, call.getStatus());
        assertFalse(call.isTerminal());
        assertEquals("c1", call.getCallId());
        assertEquals("read_file", call.getName());
    }

    @Test
    void shouldMoveForwardOnly() {
        ToolCall call = newCall();

        assertTrue(call.transitionTo(ToolCallStatus.SCHEDULED));
        assertTrue(call.transitionTo(ToolCallStatus.EXECUTING));
        assertFalse(call.transitionTo(ToolCallStatus.SCHEDULED));
        assertFalse(call.transitionTo(ToolCallStatus.AWAITING_APPROVAL));
        assertEquals(ToolCallStatus.EXECUTING, call.getStatus());
        assertNotNull(call.getStartTime());
    }

    @Test
    void shouldAllowCancelFromAnyNonTerminalState() {
        for (ToolCallStatus from : ToolCallStatus.values()) {
            assertEquals(!from.isTerminal(), from.canTransitionTo(ToolCallStatus.CANCELLED), from.name());
        }
    }

    @Test
    void shouldNeverLeaveTerminalState() {
        for (ToolCallStatus terminal : new ToolCallStatus[] { ToolCallStatus.SUCCESS, ToolCallStatus.ERROR,
                ToolCallStatus.CANCELLED }) {
            for (ToolCallStatus next : ToolCallStatus.values()) {
                assertFalse(terminal.canTransitionTo(next), terminal + " -> " + next);
            }
        }
    }

    // ===== completion =====

    @Test
    void shouldKeepFirstTerminalOutcome() {
        ToolCall call = newCall();
        call.transitionTo(ToolCallStatus.SCHEDULED);
        call.transitionTo(ToolCallStatus.EXECUTING);
        ToolCallResponse success = response(ToolCallStatus.SUCCESS);

        assertTrue(call.complete(success));
        assertFalse(call.complete(response(ToolCallStatus.CANCELLED)));

        assertEquals(ToolCallStatus.SUCCESS, call.getStatus());
        assertSame(success, call.getResponse());
        assertNotNull(call.getEndTime());
    }

    @Test
    void shouldCompleteWithoutStartTimeWhenNeverExecuted() {
        ToolCall call = newCall();

        assertTrue(call.complete(response(ToolCallStatus.ERROR)));

        assertNull(call.getStartTime());
        assertEquals(0, call.getResponse().getDurationMillis());
    }

    // ===== response payload =====

    @Test
    void shouldBuildOutputPayloadForSuccess() {
        assertEquals(Map.of("output", "x"), response(ToolCallStatus.SUCCESS).toPayload());
    }

    @Test
    void shouldBuildErrorPayloadForFailure() {
        ToolCallResponse failed = ToolCallResponse.builder()
                .status(ToolCallStatus.ERROR)
                .errorType(ToolErrorType.EXECUTION_FAILED)
                .errorMessage("boom")
                .build();

        assertEquals(Map.of("error", "boom"), failed.toPayload());
        assertFalse(failed.isSuccess());
    }
}

package me.golemcore.runtime.domain.service;

import me.golemcore.runtime.domain.model.ApprovalMode;
import me.golemcore.runtime.domain.model.CancellationSignal;
import me.golemcore.runtime.domain.model.ConfirmationOutcome;
import me.golemcore.runtime.domain.model.ToolCall;
import me.golemcore.runtime.domain.model.ToolCallRequest;
import me.golemcore.runtime.domain.model.bus.MessageBusType;
import me.golemcore.runtime.domain.model.bus.ToolConfirmationRequest;
import me.golemcore.runtime.domain.model.bus.ToolConfirmationResponse;
import me.golemcore.runtime.domain.model.confirmation.ExecConfirmationDetails;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.infrastructure.event.MessageBus;
import me.golemcore.runtime.infrastructure.event.SpringEventBus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BusConfirmationStrategyTest {

    private static final long WAIT_SECONDS = 5;

    private MessageBus messageBus;
    private BusConfirmationStrategy strategy;
    private CompletableFuture<ToolConfirmationRequest> published;

    @BeforeEach
    void setUp() {
        messageBus = new MessageBus(new RuntimeProperties(), mock(SpringEventBus.class));
        strategy = new BusConfirmationStrategy(messageBus);
        published = new CompletableFuture<>();
        messageBus.subscribe(MessageBusType.TOOL_CONFIRMATION_REQUEST, ToolConfirmationRequest.class,
                published::complete);
    }

    @AfterEach
    void tearDown() {
        messageBus.shutdown();
    }

    private static ToolCall shellCall() {
        return new ToolCall(ToolCallRequest.builder()
                .callId("call-1")
                .name("run_shell_command")
                .args(Map.of("command", "rm -rf build"))
                .build());
    }

    private static ExecConfirmationDetails details() {
        return ExecConfirmationDetails.builder()
                .title("Confirm Shell Command")
                .command("rm -rf build")
                .rootCommand("rm")
                .build();
    }

    private void answer(String correlationId, boolean confirmed, Boolean requiresUser) {
        messageBus.publish(ToolConfirmationResponse.builder()
                .correlationId(correlationId)
                .confirmed(confirmed)
                .requiresUserConfirmation(requiresUser)
                .build());
    }

    @Test
    void shouldPublishRequestWithCallDetails() throws Exception {
        ToolCall call = shellCall();
        call.setApprovalMode(ApprovalMode.PLAN);

        strategy.confirm(call, details(), CancellationSignal.create());

        ToolConfirmationRequest request = published.get(WAIT_SECONDS, TimeUnit.SECONDS);
        assertNotNull(call.getConfirmationCorrelationId());
        assertEquals(call.getConfirmationCorrelationId(), request.getCorrelationId());
        assertEquals("call-1", request.getToolCall().getId());
        assertEquals("run_shell_command", request.getToolCall().getName());
        assertEquals("rm", ((ExecConfirmationDetails) request.getConfirmationDetails()).getRootCommand());
        assertEquals(ApprovalMode.PLAN, request.getApprovalMode());
    }

    @Test
    void shouldProceedWhenConfirmed() throws Exception {
        ToolCall call = shellCall();
        CompletableFuture<ConfirmationOutcome> outcome = strategy.confirm(call, details(),
                CancellationSignal.create());

        answer(published.get(WAIT_SECONDS, TimeUnit.SECONDS).getCorrelationId(), true, null);

        assertEquals(ConfirmationOutcome.PROCEED_ONCE, outcome.get(WAIT_SECONDS, TimeUnit.SECONDS));
    }

    @Test
    void shouldCancelWhenDenied() throws Exception {
        CompletableFuture<ConfirmationOutcome> outcome = strategy.confirm(shellCall(), details(),
                CancellationSignal.create());

        answer(published.get(WAIT_SECONDS, TimeUnit.SECONDS).getCorrelationId(), false, null);

        assertEquals(ConfirmationOutcome.CANCEL, outcome.get(WAIT_SECONDS, TimeUnit.SECONDS));
    }

    @Test
    void shouldKeepWaitingOnProvisionalResponse() throws Exception {
        CompletableFuture<ConfirmationOutcome> outcome = strategy.confirm(shellCall(), details(),
                CancellationSignal.create());
        String correlationId = published.get(WAIT_SECONDS, TimeUnit.SECONDS).getCorrelationId();

        answer(correlationId, false, true);
        answer("unrelated", true, null);
        Thread.sleep(100);
        assertFalse(outcome.isDone());

        answer(correlationId, true, false);
        assertEquals(ConfirmationOutcome.PROCEED_ONCE, outcome.get(WAIT_SECONDS, TimeUnit.SECONDS));
    }

    @Test
    void shouldCancelAndUnsubscribeOnAbort() throws Exception {
        CancellationSignal signal = CancellationSignal.create();
        CompletableFuture<ConfirmationOutcome> outcome = strategy.confirm(shellCall(), details(), signal);
        published.get(WAIT_SECONDS, TimeUnit.SECONDS);
        assertEquals(1, messageBus.getSubscriberCount(MessageBusType.TOOL_CONFIRMATION_RESPONSE));

        signal.cancel("user abort");

        assertEquals(ConfirmationOutcome.CANCEL, outcome.get(WAIT_SECONDS, TimeUnit.SECONDS));
        assertEquals(0, messageBus.getSubscriberCount(MessageBusType.TOOL_CONFIRMATION_RESPONSE));
    }

    @Test
    void shouldCancelWithoutPublishingWhenAlreadyAborted() throws Exception {
        CancellationSignal signal = CancellationSignal.create();
        signal.cancel("gone");

        CompletableFuture<ConfirmationOutcome> outcome = strategy.confirm(shellCall(), details(), signal);

        assertEquals(ConfirmationOutcome.CANCEL, outcome.get(WAIT_SECONDS, TimeUnit.SECONDS));
        Thread.sleep(100);
        assertFalse(published.isDone());
    }

    @Test
    void shouldDenyWhenRequestCannotBePublished() throws Exception {
        MessageBus failing = mock(MessageBus.class);
        doThrow(new IllegalStateException("bus down")).when(failing).publish(any());
        MessageBus.Subscription noop = () -> {
        };
        when(failing.subscribe(any(MessageBusType.class), any(), any())).thenReturn(noop);

        CompletableFuture<ConfirmationOutcome> outcome = new BusConfirmationStrategy(failing)
                .confirm(shellCall(), details(), CancellationSignal.create());

        assertEquals(ConfirmationOutcome.CANCEL, outcome.get(WAIT_SECONDS, TimeUnit.SECONDS));
    }
}

package me.golemcore.runtime.adapter.outbound.confirmation;

import me.golemcore.runtime.domain.model.ApprovalMode;
import me.golemcore.runtime.domain.model.PolicyDecision;
import me.golemcore.runtime.domain.model.PolicyRule;
import me.golemcore.runtime.domain.model.ToolKind;
import me.golemcore.runtime.domain.model.bus.MessageBusType;
import me.golemcore.runtime.domain.model.bus.ToolConfirmationRequest;
import me.golemcore.runtime.domain.model.bus.ToolConfirmationResponse;
import me.golemcore.runtime.domain.service.PolicyEngine;
import me.golemcore.runtime.domain.service.ToolRegistry;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.infrastructure.event.MessageBus;
import me.golemcore.runtime.testsupport.StubTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultPolicyConfirmationResponderTest {

    private MessageBus messageBus;
    private RuntimeProperties properties;
    private DefaultPolicyConfirmationResponder responder;

    @BeforeEach
    void setUp() {
        messageBus = mock(MessageBus.class);
        PolicyEngine policyEngine = new PolicyEngine(List.of(
                PolicyRule.builder().toolName("read_file").decision(PolicyDecision.ALLOW).source("test").build(),
                PolicyRule.builder().toolName("rm_rf").decision(PolicyDecision.DENY).source("test").build()));
        ToolRegistry registry = new ToolRegistry(List.of(
                StubTool.returning("read_file", "ok"),
                StubTool.of("write_file", ToolKind.EDIT, (args, signal) -> null)));
        properties = new RuntimeProperties();
        responder = new DefaultPolicyConfirmationResponder(messageBus, policyEngine, registry, properties);
    }

    private ToolConfirmationResponse answer(String toolName) {
        return answer(toolName, null);
    }

    private ToolConfirmationResponse answer(String toolName, ApprovalMode requestMode) {
        responder.onRequest(ToolConfirmationRequest.builder()
                .correlationId("corr-" + toolName)
                .toolCall(new ToolConfirmationRequest.ToolCallInfo("1", toolName, Map.of("path", "a.txt")))
                .approvalMode(requestMode)
                .build());
        ArgumentCaptor<ToolConfirmationResponse> captor = ArgumentCaptor.forClass(ToolConfirmationResponse.class);
        verify(messageBus).publish(captor.capture());
        assertEquals("corr-" + toolName, captor.getValue().getCorrelationId());
        return captor.getValue();
    }

    @Test
    void shouldConfirmAllowedTool() {
        ToolConfirmationResponse response = answer("read_file");

        assertTrue(response.isConfirmed());
        assertFalse(response.isProvisional());
    }

    @Test
    void shouldRejectDeniedTool() {
        ToolConfirmationResponse response = answer("rm_rf");

        assertFalse(response.isConfirmed());
        assertFalse(response.isProvisional());
    }

    @Test
    void shouldDeferToUserWhenPolicyAsks() {
        ToolConfirmationResponse response = answer("write_file");

        assertFalse(response.isConfirmed());
        assertTrue(response.isProvisional());
    }

    @Test
    void shouldEvaluateWithRequestApprovalModeOverConfiguredMode() {
        properties.getScheduler().setApprovalMode(ApprovalMode.AUTO_EDIT);

        ToolConfirmationResponse response = answer("write_file", ApprovalMode.DEFAULT);

        assertFalse(response.isConfirmed());
        assertTrue(response.isProvisional());
    }

    @Test
    void shouldNotDenyAskingCallBecauseConfiguredModeIsPlan() {
        properties.getScheduler().setApprovalMode(ApprovalMode.PLAN);

        ToolConfirmationResponse response = answer("write_file", ApprovalMode.DEFAULT);

        assertTrue(response.isProvisional());
    }

    @Test
    void shouldFallBackToConfiguredModeWhenRequestHasNone() {
        properties.getScheduler().setApprovalMode(ApprovalMode.AUTO_EDIT);

        ToolConfirmationResponse response = answer("write_file");

        assertTrue(response.isConfirmed());
        assertFalse(response.isProvisional());
    }

    @Test
    void shouldDeferWhenRequestHasNoToolCall() {
        responder.onRequest(ToolConfirmationRequest.builder().correlationId("corr-x").build());

        ArgumentCaptor<ToolConfirmationResponse> captor = ArgumentCaptor.forClass(ToolConfirmationResponse.class);
        verify(messageBus).publish(captor.capture());
        assertTrue(captor.getValue().isProvisional());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldSubscribeWithLowPriorityAndUnsubscribeOnDestroy() {
        MessageBus.Subscription subscription = mock(MessageBus.Subscription.class);
        when(messageBus.subscribe(eq(MessageBusType.TOOL_CONFIRMATION_REQUEST),
                eq(ToolConfirmationRequest.class), any(Consumer.class),
                eq(DefaultPolicyConfirmationResponder.PRIORITY))).thenReturn(subscription);

        responder.init();
        responder.destroy();

        verify(subscription).close();
    }
}

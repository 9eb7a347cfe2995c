package me.golemcore.runtime.adapter.outbound.confirmation;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.component.ToolComponent;
import me.golemcore.runtime.domain.model.ApprovalMode;
import me.golemcore.runtime.domain.model.PolicyContext;
import me.golemcore.runtime.domain.model.PolicyDecision;
import me.golemcore.runtime.domain.model.ToolKind;
import me.golemcore.runtime.domain.model.bus.MessageBusType;
import me.golemcore.runtime.domain.model.bus.ToolConfirmationRequest;
import me.golemcore.runtime.domain.model.bus.ToolConfirmationResponse;
import me.golemcore.runtime.domain.service.PolicyEngine;
import me.golemcore.runtime.domain.service.ToolRegistry;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.infrastructure.event.MessageBus;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Low-priority answerer for confirmation requests, backed by the policy engine.
 *
 * <p>
 * ALLOW and DENY are answered authoritatively. ASK_USER is answered with
 * {@code requiresUserConfirmation=true}, which tells the requester that a human
 * must still decide; the requester keeps waiting for a UI answer. Interactive
 * handlers subscribe with a higher priority and see each request first.
 */
@Component
@Slf4j
public class DefaultPolicyConfirmationResponder {

    static final int PRIORITY = -100;

    private final MessageBus messageBus;
    private final PolicyEngine policyEngine;
    private final ToolRegistry toolRegistry;
    private final RuntimeProperties properties;

    private MessageBus.Subscription subscription;

    public DefaultPolicyConfirmationResponder(MessageBus messageBus, PolicyEngine policyEngine,
            ToolRegistry toolRegistry, RuntimeProperties properties) {
        this.messageBus = messageBus;
        this.policyEngine = policyEngine;
        this.toolRegistry = toolRegistry;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        subscription = messageBus.subscribe(MessageBusType.TOOL_CONFIRMATION_REQUEST,
                ToolConfirmationRequest.class, this::onRequest, PRIORITY);
    }

    @PreDestroy
    public void destroy() {
        if (subscription != null) {
            subscription.close();
        }
    }

    void onRequest(ToolConfirmationRequest request) {
        ToolConfirmationRequest.ToolCallInfo toolCall = request.getToolCall();
        PolicyDecision decision = toolCall != null ? evaluate(request, toolCall) : PolicyDecision.ASK_USER;
        log.debug("[Confirm] Default policy answer for {}: {}", request.getCorrelationId(), decision);

        ToolConfirmationResponse.ToolConfirmationResponseBuilder response = ToolConfirmationResponse.builder()
                .correlationId(request.getCorrelationId());
        switch (decision) {
        case ALLOW -> response.confirmed(true);
        case DENY -> response.confirmed(false);
        case ASK_USER -> response.confirmed(false).requiresUserConfirmation(true);
        default -> throw new IllegalStateException("Unexpected decision: " + decision);
        }
        messageBus.publish(response.build());
    }

    private PolicyDecision evaluate(ToolConfirmationRequest request, ToolConfirmationRequest.ToolCallInfo toolCall) {
        Optional<ToolComponent> tool = toolRegistry.getTool(toolCall.getName());
        PolicyContext context = PolicyContext.builder()
                .serverName(tool.map(ToolComponent::getServerName).orElse(request.getServerName()))
                .toolKind(tool.map(ToolComponent::getKind).orElse(ToolKind.OTHER))
                .interactive(true)
                .build();
        Map<String, Object> args = toolCall.getArgs() != null ? toolCall.getArgs() : Map.of();
        ApprovalMode mode = request.getApprovalMode() != null
                ? request.getApprovalMode()
                : properties.getScheduler().getApprovalMode();
        return policyEngine.check(toolCall.getName(), args, mode, context);
    }
}

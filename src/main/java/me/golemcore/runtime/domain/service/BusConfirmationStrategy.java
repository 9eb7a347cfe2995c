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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.model.CancellationSignal;
import me.golemcore.runtime.domain.model.ConfirmationOutcome;
import me.golemcore.runtime.domain.model.ToolCall;
import me.golemcore.runtime.domain.model.bus.MessageBusType;
import me.golemcore.runtime.domain.model.bus.ToolConfirmationRequest;
import me.golemcore.runtime.domain.model.bus.ToolConfirmationResponse;
import me.golemcore.runtime.domain.model.confirmation.ConfirmationDetails;
import me.golemcore.runtime.infrastructure.event.MessageBus;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Asks for confirmation over the message bus.
 *
 * <p>
 * Publishes a {@link ToolConfirmationRequest} and waits for the matching
 * {@link ToolConfirmationResponse}. Responses marked
 * {@code requiresUserConfirmation} only say that a human must decide, so the
 * wait goes on. There is no timeout: a human may take as long as they like, and
 * the batch cancellation signal bounds the wait.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BusConfirmationStrategy implements ConfirmationStrategy {

    private final MessageBus messageBus;

    @Override
    public CompletableFuture<ConfirmationOutcome> confirm(ToolCall toolCall, ConfirmationDetails details,
            CancellationSignal signal) {
        String correlationId = UUID.randomUUID().toString();
        toolCall.setConfirmationCorrelationId(correlationId);
        CompletableFuture<ConfirmationOutcome> outcome = new CompletableFuture<>();

        MessageBus.Subscription subscription = messageBus.subscribe(MessageBusType.TOOL_CONFIRMATION_RESPONSE,
                ToolConfirmationResponse.class, response -> {
                    if (!correlationId.equals(response.getCorrelationId())) {
                        return;
                    }
                    if (response.isProvisional()) {
                        log.debug("[Confirm] '{}' deferred to user, still waiting", toolCall.getName());
                        return;
                    }
                    outcome.complete(response.isConfirmed()
                            ? ConfirmationOutcome.PROCEED_ONCE
                            : ConfirmationOutcome.CANCEL);
                });
        CancellationSignal.Registration registration = signal.onCancel(
                () -> outcome.complete(ConfirmationOutcome.CANCEL));
        outcome.whenComplete((result, error) -> {
            subscription.close();
            registration.close();
            log.debug("[Confirm] '{}' resolved: {}", toolCall.getName(), result);
        });
        if (outcome.isDone()) {
            return outcome;
        }

        ToolConfirmationRequest request = ToolConfirmationRequest.builder()
                .correlationId(correlationId)
                .toolCall(ToolConfirmationRequest.ToolCallInfo.builder()
                        .id(toolCall.getCallId())
                        .name(toolCall.getName())
                        .args(toolCall.getRequest().getArgs())
                        .build())
                .confirmationDetails(details)
                .serverName(toolCall.getTool() != null ? toolCall.getTool().getServerName() : null)
                .approvalMode(toolCall.getApprovalMode())
                .build();
        log.info("[Confirm] Requesting confirmation for '{}' ({})", toolCall.getName(), correlationId);
        try {
            messageBus.publish(request);
        } catch (RuntimeException e) {
            log.error("[Confirm] Confirmation request failed, denying", e);
            outcome.complete(ConfirmationOutcome.CANCEL);
        }
        return outcome;
    }
}

package me.golemcore.runtime.adapter.inbound.confirmation;

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
import me.golemcore.runtime.domain.model.ConfirmationCallbackEvent;
import me.golemcore.runtime.domain.model.bus.ToolConfirmationResponse;
import me.golemcore.runtime.infrastructure.event.MessageBus;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Turns a UI's {@link ConfirmationCallbackEvent} into an authoritative
 * confirmation response on the message bus.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConfirmationCallbackListener {

    private final MessageBus messageBus;

    @EventListener
    public void onConfirmationCallback(ConfirmationCallbackEvent event) {
        if (event.correlationId() == null || event.correlationId().isBlank()) {
            log.warn("[Confirm] Ignoring confirmation callback without correlation id");
            return;
        }
        log.info("[Confirm] User {} {}", event.approved() ? "approved" : "denied", event.correlationId());
        messageBus.publish(ToolConfirmationResponse.builder()
                .correlationId(event.correlationId())
                .confirmed(event.approved())
                .build());
    }
}

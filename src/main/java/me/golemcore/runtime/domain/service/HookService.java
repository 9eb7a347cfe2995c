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
import me.golemcore.runtime.domain.model.bus.HookEventName;
import me.golemcore.runtime.domain.model.bus.HookExecutionRequest;
import me.golemcore.runtime.domain.model.bus.HookExecutionResponse;
import me.golemcore.runtime.domain.model.bus.HookOutput;
import me.golemcore.runtime.domain.model.bus.MessageBusType;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.infrastructure.event.MessageBus;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Fires lifecycle hooks as request/response round-trips on the message bus.
 *
 * <p>
 * A hook that cannot be reached (timeout, rejected request, runner failure) is
 * treated as absent. The BeforeTool hook is the exception when
 * {@code runtime.hooks.before-tool-fail-closed} is set: the call is then denied,
 * since that hook guards an action that is about to happen.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HookService {

    private final MessageBus messageBus;
    private final RuntimeProperties properties;

    public boolean isEnabled() {
        return properties.getHooks().isEnabled();
    }

    public CompletableFuture<Optional<HookOutput>> fireBeforeTool(String toolName, Map<String, Object> toolInput,
            CancellationSignal signal) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("tool_name", toolName);
        input.put("tool_input", toolInput != null ? toolInput : Map.of());
        return fire(HookEventName.BEFORE_TOOL, input, signal, properties.getHooks().isBeforeToolFailClosed());
    }

    public CompletableFuture<Optional<HookOutput>> fireAfterTool(String toolName, Map<String, Object> toolInput,
            Map<String, Object> toolResponse, CancellationSignal signal) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("tool_name", toolName);
        input.put("tool_input", toolInput != null ? toolInput : Map.of());
        input.put("tool_response", toolResponse != null ? toolResponse : Map.of());
        return fire(HookEventName.AFTER_TOOL, input, signal, false);
    }

    public CompletableFuture<Optional<HookOutput>> fireBeforeSubAgent(String agentName, String prompt,
            CancellationSignal signal) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("agent_name", agentName);
        input.put("prompt", prompt != null ? prompt : "");
        return fire(HookEventName.BEFORE_SUB_AGENT, input, signal, false);
    }

    public CompletableFuture<Optional<HookOutput>> fireAfterSubAgent(String agentName, String prompt,
            String response, CancellationSignal signal) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("agent_name", agentName);
        input.put("prompt", prompt != null ? prompt : "");
        input.put("prompt_response", response != null ? response : "");
        return fire(HookEventName.AFTER_SUB_AGENT, input, signal, false);
    }

    private CompletableFuture<Optional<HookOutput>> fire(HookEventName event, Map<String, Object> input,
            CancellationSignal signal, boolean failClosed) {
        if (!isEnabled()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        HookExecutionRequest request = HookExecutionRequest.builder()
                .eventName(event)
                .input(input)
                .build();
        Duration timeout = Duration.ofSeconds(properties.getHooks().getTimeoutSeconds());

        return messageBus.request(request, MessageBusType.HOOK_EXECUTION_RESPONSE, HookExecutionResponse.class,
                timeout, signal != null ? signal : CancellationSignal.none())
                .handle((response, error) -> {
                    if (error != null) {
                        return unavailable(event, describe(error), failClosed);
                    }
                    if (!response.isSuccess()) {
                        return unavailable(event, response.getError(), failClosed);
                    }
                    return Optional.ofNullable(response.getOutput());
                });
    }

    private static Optional<HookOutput> unavailable(HookEventName event, String cause, boolean failClosed) {
        if (failClosed) {
            log.warn("[Hooks] {} hook failed, denying: {}", event.getWireName(), cause);
            return Optional.of(HookOutput.deny(event.getWireName() + " hook failed: " + cause));
        }
        log.warn("[Hooks] {} hook failed, ignoring: {}", event.getWireName(), cause);
        return Optional.empty();
    }

    private static String describe(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}

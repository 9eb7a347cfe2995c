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

import me.golemcore.runtime.domain.model.CancellationSignal;
import me.golemcore.runtime.domain.model.ConfirmationOutcome;
import me.golemcore.runtime.domain.model.ToolCall;
import me.golemcore.runtime.domain.model.confirmation.ConfirmationDetails;

import java.util.concurrent.CompletableFuture;

/**
 * Obtains a user decision for a tool call the policy engine flagged as
 * ASK_USER.
 */
public interface ConfirmationStrategy {

    /**
     * Never completes exceptionally: failures resolve to
     * {@link ConfirmationOutcome#CANCEL}. Completes with CANCEL as soon as
     * {@code signal} fires.
     */
    CompletableFuture<ConfirmationOutcome> confirm(ToolCall toolCall, ConfirmationDetails details,
            CancellationSignal signal);
}

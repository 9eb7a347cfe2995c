package me.golemcore.runtime.domain.model.bus;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of running the hooks for one event. {@code success=false} means the
 * hook runner itself failed; {@code output} is then meaningless.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HookExecutionResponse implements BusMessage {

    private String correlationId;
    private boolean success;
    private HookOutput output;
    private String error;

    @Override
    @JsonIgnore
    public MessageBusType getType() {
        return MessageBusType.HOOK_EXECUTION_RESPONSE;
    }
}

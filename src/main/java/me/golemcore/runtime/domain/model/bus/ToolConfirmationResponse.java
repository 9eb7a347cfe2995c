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
 * Answer to a {@link ToolConfirmationRequest}. A response with
 * {@code requiresUserConfirmation == TRUE} is provisional: the policy layer
 * defers to a human and the requester keeps waiting.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolConfirmationResponse implements BusMessage {

    private String correlationId;
    private boolean confirmed;
    private Boolean requiresUserConfirmation;

    @Override
    @JsonIgnore
    public MessageBusType getType() {
        return MessageBusType.TOOL_CONFIRMATION_RESPONSE;
    }

    @JsonIgnore
    public boolean isProvisional() {
        return Boolean.TRUE.equals(requiresUserConfirmation);
    }
}

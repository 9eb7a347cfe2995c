package me.golemcore.runtime.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Terminal outcome of one tool call, in the shape handed back to the model
 * layer.
 */
@Data
@Builder
public class ToolCallResponse {

    private String callId;
    private String name;
    private ToolCallStatus status;
    private String content;
    private ToolErrorType errorType;
    private String errorMessage;
    private long durationMillis;

    public boolean isSuccess() {
        return status == ToolCallStatus.SUCCESS;
    }

    /**
     * Structured function-response payload: {@code {"output": ...}} for success,
     * {@code {"error": ...}} otherwise.
     */
    public Map<String, Object> toPayload() {
        if (isSuccess()) {
            return Map.of("output", content != null ? content : "");
        }
        String error = errorMessage != null ? errorMessage : String.valueOf(status);
        return Map.of("error", error);
    }
}

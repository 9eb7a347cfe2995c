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

/**
 * Result reported by a tool implementation: success flag, output text, optional
 * structured data, and error information. The scheduler turns it into a
 * {@link ToolCallResponse} for the model layer.
 */
@Data
@Builder
public class ToolResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String output;
    private Object data;
    private String error;
    private ToolErrorType errorType;

    public static ToolResult success(String output) {
        return ToolResult.builder()
                .success(true)
                .output(output)
                .build();
    }

    public static ToolResult success(String output, Object data) {
        return ToolResult.builder()
                .success(true)
                .output(output)
                .data(data)
                .build();
    }

    /**
     * Creates a failed result classified as {@link ToolErrorType#EXECUTION_FAILED}.
     */
    public static ToolResult failure(String error) {
        return failure(ToolErrorType.EXECUTION_FAILED, error);
    }

    public static ToolResult failure(ToolErrorType errorType, String error) {
        return ToolResult.builder()
                .success(false)
                .error(error)
                .errorType(errorType)
                .build();
    }
}

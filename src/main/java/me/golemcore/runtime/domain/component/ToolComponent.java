package me.golemcore.runtime.domain.component;

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
import me.golemcore.runtime.domain.model.ToolDefinition;
import me.golemcore.runtime.domain.model.ToolKind;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.domain.model.confirmation.ConfirmationDetails;
import me.golemcore.runtime.domain.model.confirmation.ExecConfirmationDetails;
import me.golemcore.runtime.domain.model.confirmation.InfoConfirmationDetails;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Executable tool that can be invoked by the model. Tools expose their JSON
 * Schema definition for function calling and implement the execution logic.
 * Built-in tools are Spring beans; MCP tools are registered dynamically by the
 * MCP client manager.
 */
public interface ToolComponent {

    /**
     * Returns the tool definition with JSON Schema for function calling.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool. Implementations should watch {@code signal} and stop
     * promptly once it fires; the scheduler also cancels the returned future.
     *
     * @param parameters
     *            arguments already validated against the schema
     * @param signal
     *            cancellation signal of the batch this call belongs to
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> parameters, CancellationSignal signal);

    default String getToolName() {
        return getDefinition().getName();
    }

    default ToolKind getKind() {
        return ToolKind.OTHER;
    }

    /**
     * MCP server this tool belongs to, or {@code null} for built-in tools.
     */
    default String getServerName() {
        return null;
    }

    /**
     * Tool-specific validation after the schema check.
     *
     * @return an error message, or empty when the parameters are acceptable
     */
    default Optional<String> validateParams(Map<String, Object> parameters) {
        return Optional.empty();
    }

    /**
     * Key of the resource a mutating call touches. Mutating calls sharing a key
     * never run concurrently. File tools should return the file path.
     *
     * @return the key, or {@code null} when the call needs no serialization
     */
    default String resourceKey(Map<String, Object> parameters) {
        return getKind().isMutating() ? "tool:" + getToolName() : null;
    }

    /**
     * Describes what the user is asked to approve.
     */
    default ConfirmationDetails getConfirmationDetails(Map<String, Object> parameters) {
        Object command = parameters != null ? parameters.get("command") : null;
        if (command instanceof String commandText) {
            String trimmed = commandText.trim();
            int space = trimmed.indexOf(' ');
            return ExecConfirmationDetails.builder()
                    .title("Confirm Shell Command")
                    .command(commandText)
                    .rootCommand(space > 0 ? trimmed.substring(0, space) : trimmed)
                    .build();
        }
        return InfoConfirmationDetails.builder()
                .title("Confirm " + getToolName())
                .prompt(getDefinition().getDescription())
                .build();
    }

    default boolean isEnabled() {
        return true;
    }
}

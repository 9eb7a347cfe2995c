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

package me.golemcore.runtime.adapter.outbound.mcp;

import me.golemcore.runtime.domain.component.ToolComponent;
import me.golemcore.runtime.domain.model.CancellationSignal;
import me.golemcore.runtime.domain.model.ToolDefinition;
import me.golemcore.runtime.domain.model.ToolErrorType;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.domain.model.confirmation.ConfirmationDetails;
import me.golemcore.runtime.domain.model.confirmation.McpConfirmationDetails;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Wraps a single MCP tool as a ToolComponent.
 *
 * <p>
 * Created dynamically when an MCP server starts, NOT a Spring bean. Registered
 * under the qualified name {@code server__tool}; calls go out under the
 * server's own tool name through whichever client is currently live for the
 * server, so a restarted server is picked up without re-registration.
 *
 * @see McpClient
 * @see McpClientManager
 */
public class McpToolAdapter implements ToolComponent {

    private final String serverName;
    private final String serverToolName;
    private final ToolDefinition definition;
    private final McpClientManager clientManager;

    public McpToolAdapter(String serverName, String serverToolName, ToolDefinition definition,
            McpClientManager clientManager) {
        this.serverName = serverName;
        this.serverToolName = serverToolName;
        this.definition = definition;
        this.clientManager = clientManager;
    }

    @Override
    public ToolDefinition getDefinition() {
        return definition;
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, CancellationSignal signal) {
        return clientManager.getClient(serverName)
                .map(client -> client.callTool(serverToolName, parameters, signal))
                .orElse(CompletableFuture.completedFuture(
                        ToolResult.failure(ToolErrorType.MCP_TOOL_ERROR,
                                "MCP server not running: " + serverName)));
    }

    @Override
    public String getServerName() {
        return serverName;
    }

    @Override
    public ConfirmationDetails getConfirmationDetails(Map<String, Object> parameters) {
        return McpConfirmationDetails.builder()
                .title("Confirm MCP Tool Execution")
                .serverName(serverName)
                .toolName(serverToolName)
                .toolDisplayName(definition.getName())
                .build();
    }

    @Override
    public boolean isEnabled() {
        return clientManager.getClient(serverName)
                .map(McpClient::isRunning)
                .orElse(false);
    }

    public String getServerToolName() {
        return serverToolName;
    }
}

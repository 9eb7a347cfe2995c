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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.runtime.domain.model.CancellationSignal;
import me.golemcore.runtime.domain.model.McpServerConfig;
import me.golemcore.runtime.domain.model.ToolDefinition;
import me.golemcore.runtime.domain.model.ToolErrorType;
import me.golemcore.runtime.domain.model.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JSON-RPC 2.0 client for a single MCP (Model Context Protocol) server.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>Open the transport (subprocess or HTTP endpoint)
 * <li>Send initialize request (JSON-RPC handshake), remember the server's
 * instructions
 * <li>Fetch available tools (tools/list) and, if offered, resources
 * <li>Call tools (tools/call), answer server pings
 * <li>Close the transport
 * </ol>
 *
 * <p>
 * Responses are matched to requests by JSON-RPC id. A JSON-RPC error becomes a
 * {@link McpException}; tool calls report it as an
 * {@link ToolErrorType#MCP_TOOL_ERROR} result instead of throwing.
 *
 * <p>
 * MCP protocol version: 2024-11-05
 *
 * <p>
 * Not a Spring bean: created per server by {@link McpClientFactory}.
 *
 * @see McpClientManager
 * @see McpToolAdapter
 */
public class McpClient implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(McpClient.class);
    private static final String JSONRPC_VERSION = "2.0";
    private static final String MCP_PROTOCOL_VERSION = "2024-11-05";
    private static final String KEY_METHOD = "method";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final McpServerConfig config;
    private final McpTransport transport;
    private final ObjectMapper objectMapper;

    private final AtomicInteger nextId = new AtomicInteger(1);
    private final Map<Integer, CompletableFuture<JsonNode>> pendingRequests = new ConcurrentHashMap<>();

    private volatile boolean running;
    private volatile Runnable toolsChangedHandler = () -> {
    };
    private volatile List<ToolDefinition> cachedTools = List.of();
    private List<Map<String, Object>> resources = List.of();
    private String instructions;

    public McpClient(McpServerConfig config, McpTransport transport, ObjectMapper objectMapper) {
        this.config = config;
        this.transport = transport;
        this.objectMapper = objectMapper;
    }

    /**
     * Open the transport, send initialize, and fetch available tools.
     */
    public List<ToolDefinition> start() throws Exception {
        transport.start(new McpTransport.Listener() {
            @Override
            public void onMessage(String message) {
                handleMessage(message);
            }

            @Override
            public void onClose(String reason) {
                handleClose(reason);
            }
        });
        running = true;

        try {
            int timeoutSeconds = config.getTimeoutSeconds();

            JsonNode initResult = sendRequest("initialize", Map.of(
                    "protocolVersion", MCP_PROTOCOL_VERSION,
                    "capabilities", Map.of(),
                    "clientInfo", Map.of(
                            "name", "golemcore-runtime",
                            "version", "1.0.0")),
                    timeoutSeconds)
                    .get(timeoutSeconds, TimeUnit.SECONDS);

            log.info("[MCP:{}] Initialized: {}", getServerName(),
                    initResult != null ? initResult.path("serverInfo") : "{}");
            JsonNode instructionsNode = initResult != null ? initResult.get("instructions") : null;
            instructions = instructionsNode != null && instructionsNode.isTextual() ? instructionsNode.asText()
                    : null;

            sendNotification("notifications/initialized", Map.of());

            listTools();

            if (initResult != null && initResult.path("capabilities").has("resources")) {
                resources = fetchResources(timeoutSeconds);
            }
            return cachedTools;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("[MCP:{}] Initialization failed, cleaning up: {}", getServerName(), e.getMessage());
            close();
            throw e;
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            log.error("[MCP:{}] Initialization failed, cleaning up: {}", getServerName(), e.getMessage());
            close();
            throw e;
        }
    }

    /**
     * Fetch the tool list again and replace the cached one.
     */
    public List<ToolDefinition> listTools() throws InterruptedException, ExecutionException, TimeoutException {
        int timeoutSeconds = config.getTimeoutSeconds();
        JsonNode toolsResult = sendRequest("tools/list", Map.of(), timeoutSeconds)
                .get(timeoutSeconds, TimeUnit.SECONDS);
        cachedTools = parseToolDefinitions(toolsResult);
        log.info("[MCP:{}] Available tools: {}", getServerName(),
                cachedTools.stream().map(ToolDefinition::getName).toList());
        return cachedTools;
    }

    /**
     * Lightweight liveness check.
     *
     * @return {@code true} if the server answered the ping in time
     */
    public boolean ping() {
        if (!isRunning()) {
            return false;
        }
        int timeoutSeconds = Math.max(1, Math.min(config.getTimeoutSeconds(), 10));
        try {
            sendRequest("ping", Map.of(), timeoutSeconds).get(timeoutSeconds, TimeUnit.SECONDS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException | TimeoutException e) {
            log.debug("[MCP:{}] Ping failed: {}", getServerName(), e.getMessage());
            return false;
        }
    }

    /**
     * Call an MCP tool by its server-side name. When {@code signal} fires the
     * server is sent {@code notifications/cancelled} and the future is cancelled.
     */
    public CompletableFuture<ToolResult> callTool(String name, Map<String, Object> arguments,
            CancellationSignal signal) {
        int id = nextId.getAndIncrement();
        CompletableFuture<JsonNode> response = sendRequest(id, "tools/call", Map.of(
                "name", name,
                "arguments", arguments != null ? arguments : Map.of()), 0);
        CancellationSignal.Registration registration = signal.onCancel(() -> {
            if (response.completeExceptionally(new CancellationException("MCP tool call cancelled"))) {
                sendNotification("notifications/cancelled", Map.of(
                        "requestId", id,
                        "reason", String.valueOf(signal.getReason())));
            }
        });
        return response
                .whenComplete((result, error) -> registration.close())
                .thenApply(result -> parseToolCallResult(name, result))
                .exceptionally(error -> {
                    Throwable cause = unwrap(error);
                    if (cause instanceof CancellationException cancellation) {
                        throw cancellation;
                    }
                    return ToolResult.failure(ToolErrorType.MCP_TOOL_ERROR,
                            "MCP tool call failed: " + cause.getMessage());
                });
    }

    CompletableFuture<JsonNode> sendRequest(String method, Map<String, Object> params, int timeoutSeconds) {
        return sendRequest(nextId.getAndIncrement(), method, params, timeoutSeconds);
    }

    private CompletableFuture<JsonNode> sendRequest(int id, String method, Map<String, Object> params,
            int timeoutSeconds) {
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        if (timeoutSeconds > 0) {
            future.orTimeout(timeoutSeconds, TimeUnit.SECONDS);
        }
        future.whenComplete((result, ex) -> pendingRequests.remove(id));
        pendingRequests.put(id, future);

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", JSONRPC_VERSION);
        request.put("id", id);
        request.put(KEY_METHOD, method);
        request.put("params", params);

        write(request).whenComplete((ignored, error) -> {
            if (error != null) {
                future.completeExceptionally(unwrap(error));
            }
        });
        return future;
    }

    /**
     * Send a JSON-RPC notification (no id, no response expected).
     */
    void sendNotification(String method, Map<String, Object> params) {
        Map<String, Object> notification = new LinkedHashMap<>();
        notification.put("jsonrpc", JSONRPC_VERSION);
        notification.put(KEY_METHOD, method);
        if (params != null && !params.isEmpty()) {
            notification.put("params", params);
        }
        write(notification).whenComplete((ignored, error) -> {
            if (error != null) {
                log.warn("[MCP:{}] Failed to send notification {}: {}", getServerName(), method,
                        unwrap(error).getMessage());
            }
        });
    }

    private CompletableFuture<Void> write(Map<String, Object> message) {
        try {
            String json = objectMapper.writeValueAsString(message);
            log.debug("[MCP:{}] → {}", getServerName(), json);
            return transport.send(json);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    void handleMessage(String line) {
        log.debug("[MCP:{}] ← {}", getServerName(), line);
        JsonNode message;
        try {
            message = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.warn("[MCP:{}] Failed to parse message: {}", getServerName(), e.getMessage());
            return;
        }

        JsonNode idNode = message.get("id");
        boolean hasMethod = message.hasNonNull(KEY_METHOD);
        if (idNode != null && !idNode.isNull() && hasMethod) {
            answerServerRequest(idNode, message.get(KEY_METHOD).asText());
        } else if (idNode != null && idNode.canConvertToInt()) {
            completePending(idNode.asInt(), message);
        } else if (hasMethod) {
            handleNotification(message.get(KEY_METHOD).asText());
        } else {
            log.warn("[MCP:{}] Ignoring message without id or method", getServerName());
        }
    }

    private void completePending(int id, JsonNode message) {
        CompletableFuture<JsonNode> pending = pendingRequests.remove(id);
        if (pending == null) {
            log.warn("[MCP:{}] Received response for unknown id: {}", getServerName(), id);
            return;
        }
        JsonNode error = message.get("error");
        if (error != null && !error.isNull()) {
            pending.completeExceptionally(new McpException(
                    error.has("code") ? error.get("code").asInt() : -1,
                    error.has("message") ? error.get("message").asText() : "Unknown MCP error"));
        } else {
            pending.complete(message.get("result"));
        }
    }

    private void answerServerRequest(JsonNode id, String method) {
        Map<String, Object> reply = new LinkedHashMap<>();
        reply.put("jsonrpc", JSONRPC_VERSION);
        reply.put("id", id);
        if ("ping".equals(method)) {
            reply.put("result", Map.of());
        } else {
            reply.put("error", Map.of("code", -32601, "message", "Method not found: " + method));
        }
        write(reply);
    }

    private void handleNotification(String method) {
        if ("notifications/tools/list_changed".equals(method)) {
            log.info("[MCP:{}] Server reported a tool list change", getServerName());
            toolsChangedHandler.run();
        } else {
            log.debug("[MCP:{}] Server notification: {}", getServerName(), method);
        }
    }

    private void handleClose(String reason) {
        if (running) {
            log.warn("[MCP:{}] Connection closed: {}", getServerName(), reason);
        }
        running = false;
        failPending(new IOException("MCP connection closed: " + reason));
    }

    private List<Map<String, Object>> fetchResources(int timeoutSeconds) {
        try {
            JsonNode result = sendRequest("resources/list", Map.of(), timeoutSeconds)
                    .get(timeoutSeconds, TimeUnit.SECONDS);
            JsonNode list = result != null ? result.get("resources") : null;
            if (list == null || !list.isArray()) {
                return List.of();
            }
            List<Map<String, Object>> parsed = new ArrayList<>();
            for (JsonNode resource : list) {
                parsed.add(objectMapper.convertValue(resource, MAP_TYPE_REF));
            }
            return List.copyOf(parsed);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of();
        } catch (ExecutionException | TimeoutException | IllegalArgumentException e) {
            log.warn("[MCP:{}] Failed to list resources: {}", getServerName(), e.getMessage());
            return List.of();
        }
    }

    private List<ToolDefinition> parseToolDefinitions(JsonNode result) {
        if (result == null) {
            return List.of();
        }

        JsonNode toolsNode = result.get("tools");
        if (toolsNode == null || !toolsNode.isArray()) {
            return List.of();
        }

        List<ToolDefinition> tools = new ArrayList<>();
        for (JsonNode toolNode : toolsNode) {
            String name = toolNode.has("name") ? toolNode.get("name").asText() : null;
            String description = toolNode.has("description") ? toolNode.get("description").asText() : "";

            if (name == null) {
                continue;
            }

            Map<String, Object> inputSchema = Map.of("type", "object", "properties", Map.of());
            if (toolNode.has("inputSchema")) {
                try {
                    inputSchema = objectMapper.convertValue(toolNode.get("inputSchema"), MAP_TYPE_REF);
                } catch (IllegalArgumentException e) {
                    log.warn("[MCP:{}] Failed to parse inputSchema for tool '{}': {}", getServerName(), name,
                            e.getMessage());
                }
            }

            tools.add(ToolDefinition.builder()
                    .name(name)
                    .description(description)
                    .inputSchema(inputSchema)
                    .build());
        }
        return List.copyOf(tools);
    }

    private ToolResult parseToolCallResult(String toolName, JsonNode result) {
        if (result == null) {
            return ToolResult.failure(ToolErrorType.MCP_TOOL_ERROR, "No result from MCP tool: " + toolName);
        }

        boolean isError = result.has("isError") && result.get("isError").asBoolean(false);

        StringBuilder output = new StringBuilder();
        JsonNode contentNode = result.get("content");
        if (contentNode != null && contentNode.isArray()) {
            for (JsonNode item : contentNode) {
                String type = item.has("type") ? item.get("type").asText() : "text";
                if ("text".equals(type) && item.has("text")) {
                    if (!output.isEmpty()) {
                        output.append("\n");
                    }
                    output.append(item.get("text").asText());
                } else if (!"text".equals(type)) {
                    if (!output.isEmpty()) {
                        output.append("\n");
                    }
                    output.append('[').append(type).append(" content]");
                }
            }
        }

        if (isError) {
            return ToolResult.failure(output.isEmpty() ? "MCP tool error" : output.toString());
        }
        Object structured = result.has("structuredContent")
                ? objectMapper.convertValue(result.get("structuredContent"), Object.class)
                : null;
        return ToolResult.success(output.isEmpty() ? "(no output)" : output.toString(), structured);
    }

    private void failPending(Exception cause) {
        for (CompletableFuture<JsonNode> future : pendingRequests.values()) {
            future.completeExceptionally(cause);
        }
        pendingRequests.clear();
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cursor = error;
        while ((cursor instanceof CompletionException || cursor instanceof ExecutionException)
                && cursor.getCause() != null) {
            cursor = cursor.getCause();
        }
        return cursor;
    }

    public void setToolsChangedHandler(Runnable toolsChangedHandler) {
        this.toolsChangedHandler = toolsChangedHandler != null ? toolsChangedHandler : () -> {
        };
    }

    public List<ToolDefinition> getCachedTools() {
        return cachedTools;
    }

    public List<Map<String, Object>> getResources() {
        return resources;
    }

    public String getInstructions() {
        return instructions;
    }

    public boolean isRunning() {
        return running && transport.isOpen();
    }

    public String getServerName() {
        return config.getName();
    }

    public McpServerConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        log.info("[MCP:{}] Closing client", getServerName());
        running = false;
        failPending(new IOException("MCP client closing"));
        transport.close();
    }

    /**
     * Exception for MCP JSON-RPC errors.
     */
    public static class McpException extends Exception {
        private static final long serialVersionUID = 1L;
        private final int code;

        public McpException(int code, String message) {
            super(message);
            this.code = code;
        }

        public int getCode() {
            return code;
        }
    }
}

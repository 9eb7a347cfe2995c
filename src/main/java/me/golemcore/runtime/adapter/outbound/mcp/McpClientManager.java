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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.model.McpServerConfig;
import me.golemcore.runtime.domain.model.McpServerStatus;
import me.golemcore.runtime.domain.model.ToolDefinition;
import me.golemcore.runtime.domain.service.ToolRegistry;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Manages MCP client lifecycles: one live {@link McpClient} per configured
 * server, with its tools registered in the {@link ToolRegistry}.
 *
 * <p>
 * This manager provides:
 * <ul>
 * <li>Single-flight discovery: concurrent {@link #start()} calls share one
 * in-flight run
 * <li>Pool reuse: a client that still answers {@code ping} is kept
 * <li>Per-server locking: never two live clients for one server name; an
 * unhealthy client is stopped before its replacement starts
 * <li>Failure isolation: one server failing to start does not affect the others
 * <li>Debounced refresh on configuration or tool-list changes
 * <li>Periodic health checks that restart servers which stopped answering
 * <li>@PreDestroy shutdown: stops all clients on application shutdown
 * </ul>
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code runtime.mcp.enabled} - Enable/disable MCP feature
 * <li>{@code runtime.mcp.servers.<name>.*} - server definitions
 * <li>{@code runtime.mcp.excluded-servers}, {@code runtime.mcp.allowed-servers}
 * - which configured servers may start
 * <li>{@code runtime.mcp.health-check-interval-seconds} - 0 disables health
 * checks
 * <li>{@code runtime.mcp.refresh-debounce-millis} - refresh coalescing window
 * </ul>
 *
 * @see McpClient
 * @see McpToolAdapter
 */
@Component
@Slf4j
public class McpClientManager {

    private final RuntimeProperties properties;
    private final ToolRegistry toolRegistry;
    private final McpClientFactory clientFactory;

    private final Map<String, McpClient> clients = new ConcurrentHashMap<>();
    private final Map<String, McpServerStatus> statuses = new ConcurrentHashMap<>();
    private final Map<String, Object> serverLocks = new ConcurrentHashMap<>();
    private final AtomicReference<CompletableFuture<Void>> startInFlight = new AtomicReference<>();
    private final AtomicInteger refreshCount = new AtomicInteger();
    private volatile Map<String, McpServerConfig> servers;

    private final Object refreshLock = new Object();
    private ScheduledFuture<?> pendingRefresh;
    private CompletableFuture<Void> nextRefresh;
    private boolean refreshRunning;
    private boolean rerunRequested;

    private final ExecutorService startExecutor;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "mcp-maintenance");
        t.setDaemon(true);
        return t;
    });

    public McpClientManager(RuntimeProperties properties, ToolRegistry toolRegistry,
            McpClientFactory clientFactory) {
        this.properties = properties;
        this.toolRegistry = toolRegistry;
        this.clientFactory = clientFactory;
        this.servers = buildServerConfigs(properties.getMcp());

        AtomicInteger threadIndex = new AtomicInteger();
        this.startExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "mcp-start-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        int interval = properties.getMcp().getHealthCheckIntervalSeconds();
        if (interval > 0) {
            scheduler.scheduleWithFixedDelay(this::checkHealth, interval, interval, TimeUnit.SECONDS);
        }
    }

    /**
     * Brings every startable configured server up and registers its tools. A
     * call made while discovery is running returns the in-flight future. Never
     * completes exceptionally because of a single server.
     */
    public CompletableFuture<Void> start() {
        while (true) {
            CompletableFuture<Void> current = startInFlight.get();
            if (current != null) {
                return current;
            }
            CompletableFuture<Void> fresh = new CompletableFuture<>();
            if (startInFlight.compareAndSet(null, fresh)) {
                runDiscovery().whenComplete((ignored, error) -> {
                    startInFlight.compareAndSet(fresh, null);
                    if (error != null) {
                        fresh.completeExceptionally(error);
                    } else {
                        fresh.complete(null);
                    }
                });
                return fresh;
            }
        }
    }

    /**
     * Stops all clients concurrently and clears their tools.
     */
    public CompletableFuture<Void> stop() {
        log.info("[McpManager] Stopping {} MCP client(s)", clients.size());
        List<CompletableFuture<Void>> stops = new ArrayList<>();
        for (String name : new ArrayList<>(clients.keySet())) {
            stops.add(CompletableFuture.runAsync(() -> stopServer(name), startExecutor));
        }
        return CompletableFuture.allOf(stops.toArray(CompletableFuture[]::new))
                .whenComplete((ignored, error) -> statuses.clear());
    }

    /**
     * Every configured server, including disabled and excluded ones.
     */
    public Map<String, McpServerConfig> getMcpServers() {
        return Collections.unmodifiableMap(servers);
    }

    /**
     * Instructions reported by connected servers, for the system prompt.
     */
    public String getMcpInstructions() {
        List<String> sections = new ArrayList<>();
        for (String name : servers.keySet()) {
            McpClient client = clients.get(name);
            if (client == null || !client.isRunning()) {
                continue;
            }
            String instructions = client.getInstructions();
            if (instructions != null && !instructions.isBlank()) {
                sections.add("# Instructions from MCP server '" + name + "'\n" + instructions.trim());
            }
        }
        return String.join("\n\n", sections);
    }

    /**
     * Requests a rediscovery. Triggers arriving within the debounce window are
     * coalesced into one run; a trigger arriving while a run is in progress
     * causes exactly one more run afterwards.
     *
     * @return completes when the refresh covering this trigger has finished
     */
    public CompletableFuture<Void> scheduleMcpContextRefresh() {
        synchronized (refreshLock) {
            if (nextRefresh == null) {
                nextRefresh = new CompletableFuture<>();
            }
            if (pendingRefresh != null) {
                pendingRefresh.cancel(false);
            }
            pendingRefresh = scheduler.schedule(this::runRefresh,
                    properties.getMcp().getRefreshDebounceMillis(), TimeUnit.MILLISECONDS);
            return nextRefresh;
        }
    }

    /**
     * Replaces the configured server set and schedules a refresh.
     */
    public CompletableFuture<Void> updateServers(Map<String, McpServerConfig> newServers) {
        this.servers = Collections.unmodifiableMap(new LinkedHashMap<>(newServers));
        return scheduleMcpContextRefresh();
    }

    /**
     * Stops the server's client and starts a fresh one.
     */
    public CompletableFuture<Void> restartServer(String name) {
        return CompletableFuture.runAsync(() -> {
            synchronized (lockFor(name)) {
                stopServer(name);
                McpServerConfig config = servers.get(name);
                if (config != null && isStartable(config)) {
                    startServer(config);
                }
            }
        }, startExecutor);
    }

    /**
     * Get a running client by server name.
     */
    public Optional<McpClient> getClient(String serverName) {
        McpClient client = clients.get(serverName);
        if (client != null && client.isRunning()) {
            return Optional.of(client);
        }
        return Optional.empty();
    }

    public int getLiveClientCount() {
        return clients.size();
    }

    public McpServerStatus getServerStatus(String serverName) {
        return statuses.getOrDefault(serverName, McpServerStatus.DISCONNECTED);
    }

    int getRefreshCount() {
        return refreshCount.get();
    }

    @PreDestroy
    public void shutdown() {
        log.info("[McpManager] Shutting down all MCP clients");
        scheduler.shutdownNow();
        for (String name : new ArrayList<>(clients.keySet())) {
            try {
                stopServer(name);
            } catch (RuntimeException e) {
                log.warn("[McpManager] Error closing client '{}': {}", name, e.getMessage());
            }
        }
        statuses.clear();
        startExecutor.shutdownNow();
    }

    private CompletableFuture<Void> runDiscovery() {
        if (!properties.getMcp().isEnabled()) {
            return CompletableFuture.completedFuture(null);
        }
        Map<String, McpServerConfig> configured = servers;
        List<CompletableFuture<Void>> tasks = new ArrayList<>();

        for (String name : new ArrayList<>(clients.keySet())) {
            McpServerConfig config = configured.get(name);
            if (config == null || !isStartable(config)) {
                tasks.add(CompletableFuture.runAsync(() -> stopServer(name), startExecutor));
            }
        }
        for (McpServerConfig config : configured.values()) {
            if (isStartable(config)) {
                tasks.add(CompletableFuture.runAsync(() -> startServer(config), startExecutor));
            }
        }
        return CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new))
                .whenComplete((ignored, error) -> log.info("[McpManager] Discovery finished: {} live client(s)",
                        clients.size()));
    }

    @SuppressWarnings("PMD.CloseResource")
    private void startServer(McpServerConfig config) {
        String name = config.getName();
        synchronized (lockFor(name)) {
            McpClient existing = clients.get(name);
            if (existing != null) {
                if (existing.ping()) {
                    log.debug("[McpManager] Reusing healthy client for '{}'", name);
                    statuses.put(name, McpServerStatus.CONNECTED);
                    return;
                }
                log.warn("[McpManager] Client for '{}' is unhealthy, replacing it", name);
                stopServer(name);
            }

            statuses.put(name, McpServerStatus.CONNECTING);
            McpClient client = clientFactory.create(config);
            client.setToolsChangedHandler(() -> startExecutor.execute(() -> refreshServerTools(name)));
            try {
                List<ToolDefinition> tools = client.start();
                int registered = registerTools(config, tools);
                clients.put(name, client);
                statuses.put(name, McpServerStatus.CONNECTED);
                log.info("[McpManager] Started server '{}', {} tools", name, registered);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                client.close();
                statuses.put(name, McpServerStatus.FAILED);
            } catch (Exception e) {
                log.error("[McpManager] Failed to start MCP server '{}': {}", name, e.getMessage(), e);
                toolRegistry.unregisterServerTools(name);
                client.close();
                statuses.put(name, McpServerStatus.FAILED);
            }
        }
    }

    @SuppressWarnings("PMD.CloseResource")
    private void stopServer(String name) {
        synchronized (lockFor(name)) {
            McpClient client = clients.remove(name);
            List<String> removed = toolRegistry.unregisterServerTools(name);
            if (client != null) {
                client.close();
                log.info("[McpManager] Stopped server '{}', removed {} tool(s)", name, removed.size());
            }
            statuses.put(name, McpServerStatus.DISCONNECTED);
        }
    }

    private void refreshServerTools(String name) {
        synchronized (lockFor(name)) {
            McpClient client = clients.get(name);
            if (client == null) {
                return;
            }
            try {
                List<ToolDefinition> tools = client.listTools();
                toolRegistry.unregisterServerTools(name);
                registerTools(client.getConfig(), tools);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (Exception e) {
                log.warn("[McpManager] Failed to refresh tools of '{}': {}", name, e.getMessage());
            }
        }
    }

    private int registerTools(McpServerConfig config, List<ToolDefinition> tools) {
        int registered = 0;
        for (ToolDefinition tool : tools) {
            if (!config.isToolIncluded(tool.getName())) {
                continue;
            }
            ToolDefinition qualified = ToolDefinition.builder()
                    .name(McpToolNames.qualify(config.getName(), tool.getName()))
                    .description(tool.getDescription())
                    .inputSchema(McpSchemaSanitizer.sanitize(tool.getInputSchema()))
                    .build();
            toolRegistry.register(new McpToolAdapter(config.getName(), tool.getName(), qualified, this));
            registered++;
        }
        return registered;
    }

    private void runRefresh() {
        CompletableFuture<Void> target;
        synchronized (refreshLock) {
            pendingRefresh = null;
            if (refreshRunning) {
                rerunRequested = true;
                return;
            }
            target = nextRefresh;
            nextRefresh = null;
            if (target == null) {
                return;
            }
            refreshRunning = true;
        }
        refreshCount.incrementAndGet();
        log.debug("[McpManager] Refreshing MCP context");
        startAfterInFlight().whenComplete((ignored, error) -> {
            boolean rerun;
            synchronized (refreshLock) {
                refreshRunning = false;
                rerun = rerunRequested;
                rerunRequested = false;
            }
            if (error != null) {
                target.completeExceptionally(error);
            } else {
                target.complete(null);
            }
            if (rerun) {
                runRefresh();
            }
        });
    }

    /**
     * A discovery already running may have read an older server set, so a
     * refresh waits for it and then runs its own.
     */
    private CompletableFuture<Void> startAfterInFlight() {
        CompletableFuture<Void> inFlight = startInFlight.get();
        if (inFlight == null) {
            return start();
        }
        return inFlight.handle((ignored, error) -> null).thenCompose(ignored -> start());
    }

    private void checkHealth() {
        for (Map.Entry<String, McpClient> entry : clients.entrySet()) {
            try {
                if (!entry.getValue().ping()) {
                    log.warn("[McpManager] Server '{}' failed health check, restarting", entry.getKey());
                    restartServer(entry.getKey());
                }
            } catch (RuntimeException e) {
                log.warn("[McpManager] Health check of '{}' failed: {}", entry.getKey(), e.getMessage());
            }
        }
    }

    private boolean isStartable(McpServerConfig config) {
        RuntimeProperties.McpProperties mcp = properties.getMcp();
        if (!config.isEnabled() || !config.hasTransport()) {
            return false;
        }
        if (mcp.getExcludedServers().contains(config.getName())) {
            return false;
        }
        return mcp.getAllowedServers().isEmpty() || mcp.getAllowedServers().contains(config.getName());
    }

    private Object lockFor(String name) {
        return serverLocks.computeIfAbsent(name, key -> new Object());
    }

    static Map<String, McpServerConfig> buildServerConfigs(RuntimeProperties.McpProperties mcp) {
        Map<String, McpServerConfig> configs = new LinkedHashMap<>();
        for (Map.Entry<String, RuntimeProperties.McpServerProperties> entry : mcp.getServers().entrySet()) {
            RuntimeProperties.McpServerProperties server = entry.getValue();
            configs.put(entry.getKey(), McpServerConfig.builder()
                    .name(entry.getKey())
                    .command(server.getCommand())
                    .args(List.copyOf(server.getArgs()))
                    .env(Map.copyOf(server.getEnv()))
                    .cwd(server.getCwd())
                    .url(server.getUrl())
                    .headers(Map.copyOf(server.getHeaders()))
                    .enabled(server.isEnabled())
                    .timeoutSeconds(server.getTimeoutSeconds() > 0
                            ? server.getTimeoutSeconds()
                            : mcp.getDefaultTimeoutSeconds())
                    .trust(server.isTrust())
                    .includeTools(List.copyOf(server.getIncludeTools()))
                    .excludeTools(List.copyOf(server.getExcludeTools()))
                    .build());
        }
        return Collections.unmodifiableMap(configs);
    }
}

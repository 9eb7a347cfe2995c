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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.component.ToolComponent;
import me.golemcore.runtime.domain.model.ToolDefinition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Name-keyed catalogue of callable tools.
 *
 * <p>
 * Copy-on-write: writers build a new immutable map under a lock and publish it
 * through a volatile field, readers never block. A {@link Snapshot} taken for a
 * batch keeps resolving against the map it captured, whatever is registered or
 * removed afterwards.
 */
@Slf4j
public class ToolRegistry {

    private static final int MAX_SUGGESTIONS = 3;
    private static final int MAX_SUGGESTION_DISTANCE = 3;

    private final Object writeLock = new Object();
    private volatile State state = new State(Map.of(), 0);

    public ToolRegistry() {
    }

    public ToolRegistry(Collection<? extends ToolComponent> initialTools) {
        for (ToolComponent tool : initialTools) {
            register(tool);
        }
    }

    /**
     * Inserts or overwrites the tool under its own name.
     */
    public void register(ToolComponent tool) {
        String name = tool.getToolName();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank");
        }
        synchronized (writeLock) {
            Map<String, ToolComponent> next = new LinkedHashMap<>(state.tools());
            ToolComponent previous = next.put(name, tool);
            publish(next);
            if (previous != null && previous != tool) {
                log.debug("[Tools] Replaced tool '{}'", name);
            }
        }
    }

    public Optional<ToolComponent> getTool(String name) {
        return Optional.ofNullable(name).map(state.tools()::get);
    }

    /**
     * @return {@code true} if a tool was removed
     */
    public boolean unregisterTool(String name) {
        synchronized (writeLock) {
            if (!state.tools().containsKey(name)) {
                return false;
            }
            Map<String, ToolComponent> next = new LinkedHashMap<>(state.tools());
            next.remove(name);
            publish(next);
            return true;
        }
    }

    /**
     * Removes every tool contributed by the given MCP server.
     *
     * @return names of the removed tools
     */
    public List<String> unregisterServerTools(String serverName) {
        synchronized (writeLock) {
            List<String> removed = new ArrayList<>();
            Map<String, ToolComponent> next = new LinkedHashMap<>();
            for (Map.Entry<String, ToolComponent> entry : state.tools().entrySet()) {
                if (Objects.equals(serverName, entry.getValue().getServerName())) {
                    removed.add(entry.getKey());
                } else {
                    next.put(entry.getKey(), entry.getValue());
                }
            }
            if (!removed.isEmpty()) {
                publish(next);
                log.debug("[Tools] Unregistered {} tool(s) of server '{}'", removed.size(), serverName);
            }
            return removed;
        }
    }

    public List<ToolComponent> getToolsByServer(String serverName) {
        return state.tools().values().stream()
                .filter(tool -> Objects.equals(serverName, tool.getServerName()))
                .toList();
    }

    /**
     * Definitions of all enabled tools, for the model's function-calling list.
     */
    public List<ToolDefinition> getFunctionDeclarations() {
        return state.tools().values().stream()
                .filter(ToolComponent::isEnabled)
                .map(ToolComponent::getDefinition)
                .toList();
    }

    public List<String> getAllToolNames() {
        return List.copyOf(state.tools().keySet());
    }

    public Snapshot snapshot() {
        State current = state;
        return new Snapshot(current.tools(), current.version());
    }

    public long getVersion() {
        return state.version();
    }

    /**
     * Registered names closest to {@code name} by edit distance.
     */
    public List<String> suggest(String name) {
        return snapshot().suggest(name);
    }

    private void publish(Map<String, ToolComponent> next) {
        state = new State(Collections.unmodifiableMap(next), state.version() + 1);
    }

    private record State(Map<String, ToolComponent> tools, long version) {
    }

    /**
     * Immutable view of the registry at one point in time.
     */
    public static final class Snapshot {

        private final Map<String, ToolComponent> tools;
        private final long version;

        private Snapshot(Map<String, ToolComponent> tools, long version) {
            this.tools = tools;
            this.version = version;
        }

        public Optional<ToolComponent> getTool(String name) {
            return Optional.ofNullable(name).map(tools::get);
        }

        public long getVersion() {
            return version;
        }

        public int size() {
            return tools.size();
        }

        public List<String> suggest(String name) {
            if (name == null || name.isBlank()) {
                return List.of();
            }
            String needle = name.toLowerCase();
            return tools.keySet().stream()
                    .map(candidate -> Map.entry(candidate, distance(needle, candidate.toLowerCase())))
                    .filter(entry -> entry.getValue() <= MAX_SUGGESTION_DISTANCE
                            || entry.getKey().toLowerCase().contains(needle))
                    .sorted(Map.Entry.<String, Integer>comparingByValue()
                            .thenComparing(Map.Entry.comparingByKey(Comparator.naturalOrder())))
                    .limit(MAX_SUGGESTIONS)
                    .map(Map.Entry::getKey)
                    .toList();
        }
    }

    static int distance(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}

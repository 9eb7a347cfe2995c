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

package me.golemcore.runtime;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the GolemCore tool-execution runtime.
 *
 * <p>
 * The runtime takes the tool calls a model produces in one turn and runs them
 * safely:
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Tool Call Scheduler</b> - per-call state machine, ordered results,
 * cooperative cancellation, serialized mutations per resource</li>
 * <li><b>Policy Engine</b> - allow/deny/ask rules with approval modes</li>
 * <li><b>Message Bus</b> - correlated confirmation and hook round-trips</li>
 * <li><b>MCP Client</b> - Model Context Protocol servers over stdio or HTTP,
 * with health checks and restart</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Domain Layer       → ToolCallScheduler, PolicyEngine, ToolRegistry, HookService
 * Infrastructure     → MessageBus, SpringEventBus, configuration
 * Adapters           → MCP clients, confirmation responders
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code runtime.*}
 * prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class RuntimeApplication {

    public static void main(String[] args) {
        SpringApplication.run(RuntimeApplication.class, args);
    }

}

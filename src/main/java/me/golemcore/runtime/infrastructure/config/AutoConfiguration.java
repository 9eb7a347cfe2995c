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

package me.golemcore.runtime.infrastructure.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.adapter.outbound.mcp.McpClientManager;
import me.golemcore.runtime.domain.component.ToolComponent;
import me.golemcore.runtime.domain.service.PolicyEngine;
import me.golemcore.runtime.domain.service.PolicyRuleFactory;
import me.golemcore.runtime.domain.service.ToolRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Composition root for the runtime's shared instances and startup.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Creates the tool registry, seeded with every {@link ToolComponent}
 * bean</li>
 * <li>Builds the policy engine from {@code runtime.policy.*} and
 * {@code runtime.mcp.*}</li>
 * <li>Provides the executor tool calls run on</li>
 * <li>Starts MCP discovery via {@code @PostConstruct}</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final RuntimeProperties properties;
    private final McpClientManager mcpClientManager;

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public static ToolRegistry toolRegistry(ObjectProvider<ToolComponent> tools) {
        return new ToolRegistry(tools.orderedStream().toList());
    }

    @Bean
    public static PolicyEngine policyEngine(RuntimeProperties properties) {
        return new PolicyEngine(PolicyRuleFactory.fromProperties(properties));
    }

    @Bean(destroyMethod = "shutdownNow")
    public static ExecutorService toolCallExecutor() {
        AtomicInteger threadIndex = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "tool-call-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore Runtime starting...");
        log.info("Approval mode: {}, interactive: {}", properties.getScheduler().getApprovalMode(),
                properties.getScheduler().isInteractive());
        if (!properties.getMcp().isEnabled()) {
            log.info("MCP disabled");
            return;
        }
        log.info("Configured MCP servers: {}", mcpClientManager.getMcpServers().keySet());
        mcpClientManager.start();
    }
}

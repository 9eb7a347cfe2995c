package me.golemcore.runtime.infrastructure.config;

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

import lombok.Data;
import me.golemcore.runtime.domain.model.ApprovalMode;
import me.golemcore.runtime.domain.model.PolicyDecision;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the runtime, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code runtime.*} prefix:
 * <ul>
 * <li>{@link SchedulerProperties} - tool call timeouts, result size, approval
 * mode</li>
 * <li>{@link BusProperties} - message bus dispatch and request timeout</li>
 * <li>{@link HookProperties} - hook round-trips</li>
 * <li>{@link PolicyProperties} - allow/deny lists and explicit rules</li>
 * <li>{@link McpProperties} - MCP servers</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "runtime")
@Data
public class RuntimeProperties {

    private SchedulerProperties scheduler = new SchedulerProperties();
    private BusProperties bus = new BusProperties();
    private HookProperties hooks = new HookProperties();
    private PolicyProperties policy = new PolicyProperties();
    private McpProperties mcp = new McpProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class SchedulerProperties {
        private int toolTimeoutSeconds = 300;
        private int timeoutGraceSeconds = 30;
        private int maxResultChars = 100000;
        private ApprovalMode approvalMode = ApprovalMode.DEFAULT;
        private boolean interactive = true;
    }

    @Data
    public static class BusProperties {
        private int requestTimeoutSeconds = 60;
        private int dispatchThreads = 4;
    }

    @Data
    public static class HookProperties {
        private boolean enabled = false;
        private int timeoutSeconds = 60;
        private boolean beforeToolFailClosed = true;
    }

    @Data
    public static class PolicyProperties {
        private List<String> allowedTools = new ArrayList<>();
        private List<String> excludedTools = new ArrayList<>();
        private List<RuleProperties> rules = new ArrayList<>();
    }

    @Data
    public static class RuleProperties {
        private String toolName;
        private String argsPattern;
        private PolicyDecision decision = PolicyDecision.ASK_USER;
        private String source = "config";
    }

    @Data
    public static class McpProperties {
        private boolean enabled = true;
        private int defaultTimeoutSeconds = 30;
        private int healthCheckIntervalSeconds = 60;
        private long refreshDebounceMillis = 300;
        private List<String> excludedServers = new ArrayList<>();
        private List<String> allowedServers = new ArrayList<>();
        private Map<String, McpServerProperties> servers = new LinkedHashMap<>();
    }

    @Data
    public static class McpServerProperties {
        private String command;
        private List<String> args = new ArrayList<>();
        private Map<String, String> env = new HashMap<>();
        private String cwd;
        private String url;
        private Map<String, String> headers = new HashMap<>();
        private boolean enabled = true;
        private int timeoutSeconds = 0;
        private boolean trust = false;
        private List<String> includeTools = new ArrayList<>();
        private List<String> excludeTools = new ArrayList<>();
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
        private String userAgent = "golemcore-runtime";
    }
}

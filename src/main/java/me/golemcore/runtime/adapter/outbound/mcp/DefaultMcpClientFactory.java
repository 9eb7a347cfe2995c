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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.golemcore.runtime.domain.model.McpServerConfig;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

/**
 * Picks the transport from the configuration: {@code url} means streamable
 * HTTP, otherwise the command is run as a stdio subprocess.
 */
@Component
@RequiredArgsConstructor
public class DefaultMcpClientFactory implements McpClientFactory {

    private final ObjectMapper objectMapper;
    private final OkHttpClient okHttpClient;

    @Override
    public McpClient create(McpServerConfig config) {
        McpTransport transport = config.isRemote()
                ? new HttpMcpTransport(config, okHttpClient)
                : new StdioMcpTransport(config);
        return new McpClient(config, transport, objectMapper);
    }
}

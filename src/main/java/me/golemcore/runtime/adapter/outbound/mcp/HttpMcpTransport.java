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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.model.McpServerConfig;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * MCP over streamable HTTP: every JSON-RPC message is POSTed to the server URL
 * and the reply comes back either as a JSON body or as an SSE stream of
 * {@code data:} events. The {@code Mcp-Session-Id} returned by the server is
 * echoed on later requests.
 */
@Slf4j
public class HttpMcpTransport implements McpTransport {

    static final String SESSION_HEADER = "Mcp-Session-Id";
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final McpServerConfig config;
    private final OkHttpClient httpClient;
    private final Set<Call> inFlight = ConcurrentHashMap.newKeySet();

    private Listener listener;
    private volatile String sessionId;
    private volatile boolean open;

    public HttpMcpTransport(McpServerConfig config, OkHttpClient httpClient) {
        this.config = config;
        this.httpClient = httpClient;
    }

    @Override
    public void start(Listener listener) {
        this.listener = listener;
        this.open = true;
        log.info("[MCP:{}] Connecting to {}", config.getName(), config.getUrl());
    }

    @Override
    public CompletableFuture<Void> send(String message) {
        if (!open) {
            return CompletableFuture.failedFuture(new IOException("MCP transport closed"));
        }
        Request.Builder builder = new Request.Builder()
                .url(config.getUrl())
                .header("Accept", "application/json, text/event-stream")
                .post(RequestBody.create(message, JSON));
        for (Map.Entry<String, String> header : config.getHeaders().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        if (sessionId != null) {
            builder.header(SESSION_HEADER, sessionId);
        }

        CompletableFuture<Void> delivered = new CompletableFuture<>();
        Call call = httpClient.newCall(builder.build());
        inFlight.add(call);
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call failed, IOException e) {
                inFlight.remove(failed);
                delivered.completeExceptionally(e);
            }

            @Override
            public void onResponse(Call completed, Response response) {
                inFlight.remove(completed);
                try (response) {
                    handleResponse(response);
                    delivered.complete(null);
                } catch (IOException | RuntimeException e) {
                    delivered.completeExceptionally(e);
                }
            }
        });
        return delivered;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        if (!open) {
            return;
        }
        open = false;
        for (Call call : inFlight) {
            call.cancel();
        }
        inFlight.clear();
        if (listener != null) {
            listener.onClose("closed");
        }
    }

    String getSessionId() {
        return sessionId;
    }

    private void handleResponse(Response response) throws IOException {
        String session = response.header(SESSION_HEADER);
        if (session != null && !session.isBlank()) {
            sessionId = session;
        }
        if (!response.isSuccessful()) {
            throw new IOException("HTTP " + response.code() + " from MCP server " + config.getName());
        }
        ResponseBody body = response.body();
        if (body == null) {
            return;
        }
        String text = body.string();
        String contentType = response.header("Content-Type", "");
        if (contentType.startsWith("text/event-stream")) {
            for (String event : parseSseData(text)) {
                listener.onMessage(event);
            }
        } else if (!text.isBlank()) {
            listener.onMessage(text.trim());
        }
    }

    static List<String> parseSseData(String stream) {
        List<String> events = new ArrayList<>();
        StringBuilder data = new StringBuilder();
        for (String rawLine : stream.split("\r?\n", -1)) {
            if (rawLine.isEmpty()) {
                flushEvent(events, data);
            } else if (rawLine.startsWith("data:")) {
                if (!data.isEmpty()) {
                    data.append('\n');
                }
                data.append(rawLine.substring(5).stripLeading());
            }
        }
        flushEvent(events, data);
        return events;
    }

    private static void flushEvent(List<String> events, StringBuilder data) {
        if (!data.isEmpty()) {
            events.add(data.toString());
            data.setLength(0);
        }
    }
}

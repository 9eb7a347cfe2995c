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

import java.io.Closeable;
import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * Carries newline-free JSON-RPC messages between {@link McpClient} and one MCP
 * server. Incoming messages are pushed to the {@link Listener}.
 */
public interface McpTransport extends Closeable {

    void start(Listener listener) throws IOException;

    /**
     * Sends one serialized JSON-RPC message. The future fails if the message
     * could not be delivered.
     */
    CompletableFuture<Void> send(String message);

    boolean isOpen();

    @Override
    void close();

    interface Listener {

        void onMessage(String message);

        void onClose(String reason);
    }
}

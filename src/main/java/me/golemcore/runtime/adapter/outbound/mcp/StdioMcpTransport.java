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

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * MCP over a subprocess's stdin/stdout, one JSON message per line.
 *
 * <p>
 * The server is started through {@code /bin/sh -c} so configured commands can
 * use the usual shell syntax. stdout is read on a daemon thread; stderr is
 * drained to DEBUG on another.
 */
@Slf4j
public class StdioMcpTransport implements McpTransport {

    private final McpServerConfig config;

    private Process process;
    private BufferedWriter writer;
    private volatile boolean running;

    public StdioMcpTransport(McpServerConfig config) {
        this.config = config;
    }

    @Override
    public void start(Listener listener) throws IOException {
        String commandLine = buildCommandLine(config);
        log.info("[MCP:{}] Starting server: {}", config.getName(), commandLine);

        ProcessBuilder pb = new ProcessBuilder("/bin/sh", "-c", commandLine);
        pb.redirectErrorStream(false);
        if (config.getEnv() != null) {
            pb.environment().putAll(config.getEnv());
        }
        if (config.getCwd() != null && !config.getCwd().isBlank()) {
            pb.directory(new File(config.getCwd()));
        }

        process = pb.start();
        running = true;
        writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));

        Thread readerThread = new Thread(() -> readLoop(process, listener), "mcp-reader-" + config.getName());
        readerThread.setDaemon(true);
        readerThread.start();

        Thread stderrThread = new Thread(() -> stderrDrain(process), "mcp-stderr-" + config.getName());
        stderrThread.setDaemon(true);
        stderrThread.start();
    }

    @Override
    public CompletableFuture<Void> send(String message) {
        if (writer == null) {
            return CompletableFuture.failedFuture(new IOException("MCP transport not started"));
        }
        try {
            synchronized (writer) {
                writer.write(message);
                writer.newLine();
                writer.flush();
            }
            return CompletableFuture.completedFuture(null);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public boolean isOpen() {
        return running && process != null && process.isAlive();
    }

    @Override
    public void close() {
        running = false;
        if (writer != null) {
            try {
                writer.close();
            } catch (IOException e) {
                log.debug("[MCP:{}] Error closing writer: {}", config.getName(), e.getMessage());
            }
        }

        if (process != null && process.isAlive()) {
            process.destroy();
            try {
                if (!process.waitFor(5, TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }
    }

    static String buildCommandLine(McpServerConfig config) {
        StringBuilder commandLine = new StringBuilder(config.getCommand());
        for (String arg : config.getArgs()) {
            commandLine.append(' ').append(shellQuote(arg));
        }
        return commandLine.toString();
    }

    private static String shellQuote(String arg) {
        if (arg.matches("[A-Za-z0-9_./:=@%+-]+")) {
            return arg;
        }
        return "'" + arg.replace("'", "'\\''") + "'";
    }

    private void readLoop(Process p, Listener listener) {
        String reason = "process exited";
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                line = line.trim();
                if (!line.isEmpty()) {
                    listener.onMessage(line);
                }
            }
        } catch (IOException e) {
            reason = e.getMessage();
            if (running) {
                log.warn("[MCP:{}] Reader thread error: {}", config.getName(), e.getMessage());
            }
        } finally {
            running = false;
            listener.onClose(reason);
        }
    }

    private void stderrDrain(Process p) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("[MCP:{}] stderr: {}", config.getName(), line);
            }
        } catch (IOException e) {
            log.debug("[MCP:{}] Stderr drain ended: {}", config.getName(), e.getMessage());
        }
    }
}

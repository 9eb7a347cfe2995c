package me.golemcore.runtime.domain.model;

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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * Cooperative cancellation token shared by everything working on one batch of
 * tool calls. Cancelling is one-way and idempotent.
 */
@Slf4j
public final class CancellationSignal {

    private static final CancellationSignal NONE = new CancellationSignal();

    private final CompletableFuture<String> cancelled = new CompletableFuture<>();
    private final List<Runnable> callbacks = new ArrayList<>();
    private volatile String reason;

    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    /**
     * Signal that is never cancelled. {@link #cancel(String)} on it is a no-op.
     */
    public static CancellationSignal none() {
        return NONE;
    }

    public void cancel(String cancelReason) {
        if (this == NONE) {
            return;
        }
        List<Runnable> toRun;
        synchronized (callbacks) {
            if (reason != null) {
                return;
            }
            reason = cancelReason != null ? cancelReason : "cancelled";
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        for (Runnable callback : toRun) {
            runQuietly(callback);
        }
        cancelled.complete(reason);
    }

    public boolean isCancelled() {
        return reason != null;
    }

    public String getReason() {
        return reason;
    }

    /**
     * Registers a callback run once on cancellation. If the signal is already
     * cancelled the callback runs immediately on the calling thread.
     */
    public Registration onCancel(Runnable callback) {
        synchronized (callbacks) {
            if (reason == null) {
                callbacks.add(callback);
                return () -> {
                    synchronized (callbacks) {
                        callbacks.remove(callback);
                    }
                };
            }
        }
        runQuietly(callback);
        return () -> {
        };
    }

    /**
     * Completes with the cancellation reason. Never completes for
     * {@link #none()}.
     */
    public CompletableFuture<String> whenCancelled() {
        return cancelled.copy();
    }

    public void throwIfCancelled() {
        if (reason != null) {
            throw new CancellationException(reason);
        }
    }

    private static void runQuietly(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation callback failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Handle for removing a cancellation callback.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}

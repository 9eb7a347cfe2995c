package me.golemcore.runtime.infrastructure.event;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.model.CancellationSignal;
import me.golemcore.runtime.domain.model.bus.BusMessage;
import me.golemcore.runtime.domain.model.bus.MessageBusType;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-process typed publish/subscribe bus with correlated request/response.
 *
 * <p>
 * Delivery is asynchronous: {@link #publish} returns immediately and the
 * message is handed to every subscriber of its type on the dispatch executor,
 * highest priority first. A failing subscriber is logged and does not affect
 * the others or the publisher. Every message is also mirrored to Spring
 * listeners through {@link SpringEventBus}.
 *
 * <p>
 * {@link #request} subscribes to the response type before publishing, so a
 * response cannot be missed, and unsubscribes on every completion path.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class MessageBus {

    public static final int DEFAULT_PRIORITY = 0;

    private final Map<MessageBusType, List<Subscriber>> subscribers = new ConcurrentHashMap<>();
    private final AtomicLong subscriptionSeq = new AtomicLong();
    private final SpringEventBus springEventBus;
    private final Duration defaultRequestTimeout;
    private final ExecutorService dispatchExecutor;
    private final ScheduledExecutorService timeoutScheduler;

    public MessageBus(RuntimeProperties properties, SpringEventBus springEventBus) {
        this.springEventBus = springEventBus;
        RuntimeProperties.BusProperties bus = properties.getBus();
        this.defaultRequestTimeout = Duration.ofSeconds(bus.getRequestTimeoutSeconds());
        AtomicInteger threadIndex = new AtomicInteger();
        this.dispatchExecutor = Executors.newFixedThreadPool(Math.max(1, bus.getDispatchThreads()), r -> {
            Thread t = new Thread(r, "message-bus-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.timeoutScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "message-bus-timeouts");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Delivers {@code message} to all current subscribers of its type.
     *
     * @throws IllegalArgumentException
     *             if the message is null or carries no type
     */
    public void publish(BusMessage message) {
        if (message == null || message.getType() == null) {
            throw new IllegalArgumentException("Bus message must be non-null and typed");
        }
        List<Subscriber> targets = subscribers.getOrDefault(message.getType(), List.of());
        log.debug("[Bus] Publishing {} ({}) to {} subscriber(s)", message.getType(), message.getCorrelationId(),
                targets.size());
        try {
            dispatchExecutor.execute(() -> dispatch(message, targets));
        } catch (RejectedExecutionException e) {
            log.warn("[Bus] Dropping {} after shutdown", message.getType());
        }
    }

    public Subscription subscribe(MessageBusType type, Consumer<BusMessage> handler) {
        return subscribe(type, BusMessage.class, handler, DEFAULT_PRIORITY);
    }

    public <T extends BusMessage> Subscription subscribe(MessageBusType type, Class<T> messageClass,
            Consumer<T> handler) {
        return subscribe(type, messageClass, handler, DEFAULT_PRIORITY);
    }

    /**
     * Subscribes {@code handler} to messages of {@code type}. Messages that are
     * not instances of {@code messageClass} are skipped for this handler.
     * Subscribers with a higher priority see each message first.
     */
    public <T extends BusMessage> Subscription subscribe(MessageBusType type, Class<T> messageClass,
            Consumer<T> handler, int priority) {
        Consumer<BusMessage> typed = message -> {
            if (messageClass.isInstance(message)) {
                handler.accept(messageClass.cast(message));
            }
        };
        Subscriber subscriber = new Subscriber(handler, typed, priority, subscriptionSeq.incrementAndGet());
        subscribers.compute(type, (key, current) -> {
            List<Subscriber> next = current != null ? new ArrayList<>(current) : new ArrayList<>();
            next.add(subscriber);
            next.sort(Comparator.comparingInt(Subscriber::priority).reversed()
                    .thenComparingLong(Subscriber::seq));
            return List.copyOf(next);
        });
        return () -> remove(type, subscriber);
    }

    /**
     * Removes every subscription of {@code handler} for {@code type}.
     */
    public void unsubscribe(MessageBusType type, Consumer<?> handler) {
        subscribers.computeIfPresent(type, (key, current) -> {
            List<Subscriber> next = current.stream()
                    .filter(s -> s.identity() != handler)
                    .toList();
            return next.isEmpty() ? null : next;
        });
    }

    public <R extends BusMessage> CompletableFuture<R> request(BusMessage request, MessageBusType responseType,
            Class<R> responseClass) {
        return request(request, responseType, responseClass, defaultRequestTimeout, CancellationSignal.none());
    }

    /**
     * Publishes {@code request} and completes with the first response of
     * {@code responseType} carrying the same correlation id. A correlation id is
     * generated when the request has none.
     *
     * <p>
     * Fails with {@link MessageBusTimeoutException} after {@code timeout} and
     * with {@link CancellationException} when {@code signal} fires.
     */
    public <R extends BusMessage> CompletableFuture<R> request(BusMessage request, MessageBusType responseType,
            Class<R> responseClass, Duration timeout, CancellationSignal signal) {
        if (request.getCorrelationId() == null || request.getCorrelationId().isBlank()) {
            request.setCorrelationId(UUID.randomUUID().toString());
        }
        String correlationId = request.getCorrelationId();
        CompletableFuture<R> result = new CompletableFuture<>();

        Subscription subscription = subscribe(responseType, responseClass, response -> {
            if (correlationId.equals(response.getCorrelationId())) {
                result.complete(response);
            }
        });
        ScheduledFuture<?> timer = timeoutScheduler.schedule(
                () -> result.completeExceptionally(new MessageBusTimeoutException(
                        "No " + responseType + " for " + correlationId + " within " + timeout.toMillis() + "ms")),
                timeout.toMillis(), TimeUnit.MILLISECONDS);
        CancellationSignal.Registration registration = signal.onCancel(
                () -> result.completeExceptionally(new CancellationException("Request cancelled: "
                        + signal.getReason())));
        result.whenComplete((response, error) -> {
            subscription.close();
            timer.cancel(false);
            registration.close();
        });

        if (result.isDone()) {
            return result;
        }
        try {
            publish(request);
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    public int getSubscriberCount(MessageBusType type) {
        return subscribers.getOrDefault(type, List.of()).size();
    }

    @PreDestroy
    public void shutdown() {
        dispatchExecutor.shutdownNow();
        timeoutScheduler.shutdownNow();
    }

    private void dispatch(BusMessage message, List<Subscriber> targets) {
        for (Subscriber subscriber : targets) {
            try {
                subscriber.delivery().accept(message);
            } catch (RuntimeException e) {
                log.warn("[Bus] Subscriber failed on {} ({}): {}", message.getType(), message.getCorrelationId(),
                        e.getMessage(), e);
            }
        }
        if (springEventBus != null) {
            springEventBus.publish(message);
        }
    }

    private void remove(MessageBusType type, Subscriber subscriber) {
        subscribers.computeIfPresent(type, (key, current) -> {
            List<Subscriber> next = current.stream()
                    .filter(s -> s != subscriber)
                    .toList();
            return next.isEmpty() ? null : next;
        });
    }

    /**
     * Handle returned by subscribe; closing it removes exactly that subscription.
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }

    private record Subscriber(Object identity, Consumer<BusMessage> delivery, int priority, long seq) {
    }
}

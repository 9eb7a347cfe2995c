package me.golemcore.runtime.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.component.ToolComponent;
import me.golemcore.runtime.domain.model.ApprovalMode;
import me.golemcore.runtime.domain.model.CancellationSignal;
import me.golemcore.runtime.domain.model.ConfirmationOutcome;
import me.golemcore.runtime.domain.model.PolicyContext;
import me.golemcore.runtime.domain.model.PolicyDecision;
import me.golemcore.runtime.domain.model.ToolCall;
import me.golemcore.runtime.domain.model.ToolCallRequest;
import me.golemcore.runtime.domain.model.ToolCallResponse;
import me.golemcore.runtime.domain.model.ToolCallStatus;
import me.golemcore.runtime.domain.model.ToolCallUpdateEvent;
import me.golemcore.runtime.domain.model.ToolErrorType;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.domain.model.bus.HookOutput;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.infrastructure.event.SpringEventBus;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one batch of tool calls from a single model turn: resolve, validate,
 * policy, confirmation, execution, AfterTool hook.
 *
 * <p>
 * Calls run concurrently on the tool call executor, except that mutating calls
 * sharing a resource key are chained in request order. A failing call never
 * affects its siblings; only the batch {@link CancellationSignal} aborts
 * outstanding work. Per-call failures become error responses and never escape
 * as exceptions. Responses come back in request order.
 */
@Component
@Slf4j
public class ToolCallScheduler {

    static final String POLICY_DENIED_MESSAGE = "Tool execution denied by policy.";
    static final String USER_DENIED_MESSAGE = "User denied execution.";
    static final String CANCELLED_MESSAGE = "Operation cancelled";

    private static final CompletableFuture<Void> DONE = CompletableFuture.completedFuture(null);

    private final ToolRegistry toolRegistry;
    private final PolicyEngine policyEngine;
    private final ConfirmationStrategy confirmationStrategy;
    private final HookService hookService;
    private final SpringEventBus eventBus;
    private final RuntimeProperties properties;
    private final Executor executor;

    public ToolCallScheduler(ToolRegistry toolRegistry,
            PolicyEngine policyEngine,
            ConfirmationStrategy confirmationStrategy,
            HookService hookService,
            SpringEventBus eventBus,
            RuntimeProperties properties,
            @Qualifier("toolCallExecutor") Executor executor) {
        this.toolRegistry = toolRegistry;
        this.policyEngine = policyEngine;
        this.confirmationStrategy = confirmationStrategy;
        this.hookService = hookService;
        this.eventBus = eventBus;
        this.properties = properties;
        this.executor = executor;
    }

    public CompletableFuture<List<ToolCallResponse>> schedule(List<ToolCallRequest> requests) {
        return schedule(requests, properties.getScheduler().getApprovalMode(), CancellationSignal.create(),
                ToolCallListener.NONE);
    }

    public CompletableFuture<List<ToolCallResponse>> schedule(List<ToolCallRequest> requests,
            ApprovalMode approvalMode, CancellationSignal signal) {
        return schedule(requests, approvalMode, signal, ToolCallListener.NONE);
    }

    /**
     * Schedules the batch. The returned future completes once every call is
     * terminal and never completes exceptionally.
     */
    public CompletableFuture<List<ToolCallResponse>> schedule(List<ToolCallRequest> requests,
            ApprovalMode approvalMode, CancellationSignal signal, ToolCallListener listener) {
        Batch batch = new Batch(
                approvalMode != null ? approvalMode : properties.getScheduler().getApprovalMode(),
                signal != null ? signal : CancellationSignal.create(),
                listener != null ? listener : ToolCallListener.NONE,
                toolRegistry.snapshot());
        Map<String, CompletableFuture<Void>> tails = new HashMap<>();

        for (ToolCallRequest request : requests) {
            ToolCall call = new ToolCall(request);
            call.setApprovalMode(batch.approvalMode);
            CompletableFuture<ToolCallResponse> done = new CompletableFuture<>();
            batch.entries.add(new Entry(call, done));
            notifyUpdate(batch, call);

            Optional<ToolCallResponse> rejection = resolveAndValidate(batch, call);
            if (rejection.isPresent()) {
                finish(batch, call, done, rejection.get());
                continue;
            }
            transition(batch, call, ToolCallStatus.SCHEDULED);

            String resourceKey = resourceKey(call);
            CompletableFuture<Void> predecessor = resourceKey != null ? tails.getOrDefault(resourceKey, DONE) : DONE;
            CompletableFuture<Void> processing = predecessor
                    .thenComposeAsync(ignored -> process(batch, call, done), executor)
                    .exceptionally(error -> {
                        log.error("[Scheduler] Unexpected failure in '{}'", call.getName(), error);
                        finish(batch, call, done, error(call, ToolErrorType.EXECUTION_FAILED,
                                "Tool execution failed: " + safeCauseMessage(error)));
                        return null;
                    });
            if (resourceKey != null) {
                tails.put(resourceKey, processing);
            }
        }

        CancellationSignal.Registration registration = batch.signal.onCancel(() -> cancelOutstanding(batch));
        CompletableFuture<?>[] all = batch.entries.stream().map(Entry::done).toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(all)
                .thenApply(ignored -> batch.entries.stream().map(entry -> entry.done().join()).toList())
                .whenComplete((responses, error) -> {
                    registration.close();
                    if (responses != null) {
                        long succeeded = responses.stream().filter(ToolCallResponse::isSuccess).count();
                        log.info("[Scheduler] Batch settled: {}/{} succeeded", succeeded, responses.size());
                    }
                });
    }

    private Optional<ToolCallResponse> resolveAndValidate(Batch batch, ToolCall call) {
        String name = call.getName();
        Optional<ToolComponent> resolved = batch.snapshot.getTool(name).filter(ToolComponent::isEnabled);
        if (resolved.isEmpty()) {
            StringBuilder message = new StringBuilder("Tool \"").append(name).append("\" not found in registry.");
            List<String> suggestions = batch.snapshot.suggest(name);
            if (!suggestions.isEmpty()) {
                message.append(" Did you mean one of: \"").append(String.join("\", \"", suggestions)).append("\"?");
            }
            return Optional.of(error(call, ToolErrorType.UNKNOWN_TOOL, message.toString()));
        }
        ToolComponent tool = resolved.get();
        call.setTool(tool);

        Map<String, Object> args = call.getRequest().getArgs();
        try {
            Optional<String> invalid = ToolParamsValidator.validate(tool.getDefinition().getInputSchema(), args)
                    .or(() -> tool.validateParams(args));
            return invalid.map(message -> error(call, ToolErrorType.INVALID_TOOL_PARAMS, message));
        } catch (RuntimeException e) {
            return Optional.of(error(call, ToolErrorType.INVALID_TOOL_PARAMS,
                    "Invalid parameters: " + safeCauseMessage(e)));
        }
    }

    private CompletableFuture<Void> process(Batch batch, ToolCall call, CompletableFuture<ToolCallResponse> done) {
        if (call.isTerminal()) {
            return DONE;
        }
        if (batch.signal.isCancelled()) {
            finish(batch, call, done, cancelled(call, CANCELLED_MESSAGE));
            return DONE;
        }
        ToolComponent tool = call.getTool();
        PolicyContext context = PolicyContext.builder()
                .serverName(tool.getServerName())
                .toolKind(tool.getKind())
                .interactive(properties.getScheduler().isInteractive())
                .build();
        PolicyDecision decision = policyEngine.check(call.getName(), call.getRequest().getArgs(), batch.approvalMode,
                context);
        log.debug("[Scheduler] Policy for '{}' ({}): {}", call.getName(),
                policyEngine.describeAction(call.getName(), call.getRequest().getArgs()), decision);

        return switch (decision) {
        case DENY -> {
            finish(batch, call, done, error(call, ToolErrorType.POLICY_DENIED, POLICY_DENIED_MESSAGE));
            yield DONE;
        }
        case ALLOW -> execute(batch, call, done);
        case ASK_USER -> askUser(batch, call, done);
        };
    }

    private CompletableFuture<Void> askUser(Batch batch, ToolCall call, CompletableFuture<ToolCallResponse> done) {
        ToolComponent tool = call.getTool();
        Map<String, Object> args = call.getRequest().getArgs();

        return hookService.fireBeforeTool(call.getName(), args, batch.signal)
                .thenComposeAsync(hookOutput -> {
                    if (call.isTerminal()) {
                        return DONE;
                    }
                    if (hookOutput.isPresent()) {
                        HookOutput output = hookOutput.get();
                        if (output.shouldStopExecution()) {
                            finish(batch, call, done, error(call, ToolErrorType.STOP_EXECUTION,
                                    orDefault(output.getStopReason(), "Execution stopped by BeforeTool hook")));
                            return DONE;
                        }
                        if (output.isBlockingDecision()) {
                            finish(batch, call, done, error(call, ToolErrorType.POLICY_DENIED,
                                    orDefault(output.getReason(), POLICY_DENIED_MESSAGE)));
                            return DONE;
                        }
                    }
                    if (!transition(batch, call, ToolCallStatus.AWAITING_APPROVAL)) {
                        return DONE;
                    }
                    return confirmationStrategy.confirm(call, tool.getConfirmationDetails(args), batch.signal)
                            .thenComposeAsync(outcome -> {
                                if (outcome == ConfirmationOutcome.PROCEED_ONCE) {
                                    return execute(batch, call, done);
                                }
                                String message = batch.signal.isCancelled() ? CANCELLED_MESSAGE : USER_DENIED_MESSAGE;
                                finish(batch, call, done, cancelled(call, message));
                                return DONE;
                            }, executor);
                }, executor);
    }

    private CompletableFuture<Void> execute(Batch batch, ToolCall call, CompletableFuture<ToolCallResponse> done) {
        if (batch.signal.isCancelled() || !transition(batch, call, ToolCallStatus.EXECUTING)) {
            return DONE;
        }
        log.debug("[Scheduler] Executing '{}' ({})", call.getName(), call.getCallId());
        CancellationSignal callSignal = CancellationSignal.create();
        CancellationSignal.Registration linked = batch.signal
                .onCancel(() -> callSignal.cancel(batch.signal.getReason()));
        CompletableFuture<ToolResult> toolFuture = invoke(call.getTool(), call.getRequest().getArgs(), callSignal);
        CompletableFuture<ToolResult> observed = toolFuture.copy();
        int timeoutSeconds = properties.getScheduler().getToolTimeoutSeconds();
        if (timeoutSeconds > 0) {
            observed.orTimeout(timeoutSeconds, TimeUnit.SECONDS);
        }
        CancellationSignal.Registration registration = batch.signal.onCancel(() -> toolFuture.cancel(true));

        return observed
                .handle((result, error) -> {
                    registration.close();
                    if (error != null && unwrap(error) instanceof TimeoutException) {
                        callSignal.cancel("Tool execution timed out");
                    }
                    return error != null ? fromError(batch, call, error) : fromResult(call, result);
                })
                .thenCompose(response -> afterTool(batch, call, response))
                .thenAccept(response -> finish(batch, call, done, response))
                .thenCompose(ignored -> awaitSettled(call, toolFuture))
                .whenComplete((ignored, error) -> linked.close());
    }

    /**
     * Holds the resource-key chain until the tool's own future settles, so a
     * timed-out call that is still winding down never overlaps its successor.
     * Bounded by the configured grace period.
     */
    private CompletableFuture<Void> awaitSettled(ToolCall call, CompletableFuture<ToolResult> toolFuture) {
        if (toolFuture.isDone()) {
            return DONE;
        }
        CompletableFuture<Void> settled = toolFuture.handle((result, error) -> null);
        int graceSeconds = properties.getScheduler().getTimeoutGraceSeconds();
        if (graceSeconds <= 0) {
            return settled;
        }
        return settled.orTimeout(graceSeconds, TimeUnit.SECONDS)
                .exceptionally(error -> {
                    log.warn("[Scheduler] '{}' ({}) still running {}s after its result was reported, releasing its resource",
                            call.getName(), call.getCallId(), graceSeconds);
                    return null;
                });
    }

    private static CompletableFuture<ToolResult> invoke(ToolComponent tool, Map<String, Object> args,
            CancellationSignal signal) {
        try {
            CompletableFuture<ToolResult> future = tool.execute(args, signal);
            return future != null ? future
                    : CompletableFuture.failedFuture(new IllegalStateException("Tool returned no result"));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private CompletableFuture<ToolCallResponse> afterTool(Batch batch, ToolCall call, ToolCallResponse response) {
        if (response.getStatus() == ToolCallStatus.CANCELLED || call.isTerminal()) {
            return CompletableFuture.completedFuture(response);
        }
        return hookService.fireAfterTool(call.getName(), call.getRequest().getArgs(), response.toPayload(),
                batch.signal)
                .thenApply(hookOutput -> hookOutput.map(output -> applyAfterTool(call, response, output))
                        .orElse(response));
    }

    private static ToolCallResponse applyAfterTool(ToolCall call, ToolCallResponse response, HookOutput output) {
        if (output.shouldStopExecution()) {
            return error(call, ToolErrorType.STOP_EXECUTION,
                    orDefault(output.getStopReason(), "Execution stopped by AfterTool hook"));
        }
        if (output.isBlockingDecision()) {
            return error(call, ToolErrorType.EXECUTION_FAILED,
                    orDefault(output.getReason(), "Tool result blocked by AfterTool hook"));
        }
        String additionalContext = output.getAdditionalContext();
        if (response.isSuccess() && additionalContext != null && !additionalContext.isBlank()) {
            String content = response.getContent() != null ? response.getContent() : "";
            response.setContent(content + "\n\n" + additionalContext);
        }
        return response;
    }

    private ToolCallResponse fromResult(ToolCall call, ToolResult result) {
        if (result == null) {
            return error(call, ToolErrorType.EXECUTION_FAILED, "Tool returned no result");
        }
        if (result.isSuccess()) {
            return ToolCallResponse.builder()
                    .callId(call.getCallId())
                    .name(call.getName())
                    .status(ToolCallStatus.SUCCESS)
                    .content(truncateToolResult(result.getOutput() != null ? result.getOutput() : "", call.getName()))
                    .build();
        }
        ToolErrorType errorType = result.getErrorType() != null ? result.getErrorType()
                : ToolErrorType.EXECUTION_FAILED;
        String message = orDefault(result.getError(), "Tool execution failed");
        ToolCallResponse response = error(call, errorType, message);
        if (result.getOutput() != null && !result.getOutput().isBlank()) {
            response.setContent(result.getOutput());
        }
        response.setContent(truncateToolResult(response.getContent(), call.getName()));
        return response;
    }

    private ToolCallResponse fromError(Batch batch, ToolCall call, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof CancellationException || batch.signal.isCancelled()) {
            return cancelled(call, CANCELLED_MESSAGE);
        }
        if (cause instanceof TimeoutException) {
            return error(call, ToolErrorType.EXECUTION_FAILED, "Tool execution timed out after "
                    + properties.getScheduler().getToolTimeoutSeconds() + "s");
        }
        log.warn("[Scheduler] Tool '{}' failed: {}", call.getName(), safeCauseMessage(cause));
        return error(call, ToolErrorType.EXECUTION_FAILED, "Tool execution failed: " + safeCauseMessage(cause));
    }

    private void cancelOutstanding(Batch batch) {
        int aborted = 0;
        for (Entry entry : batch.entries) {
            if (!entry.call().isTerminal()) {
                finish(batch, entry.call(), entry.done(), cancelled(entry.call(), CANCELLED_MESSAGE));
                aborted++;
            }
        }
        log.info("[Scheduler] Batch cancelled ({}): {} call(s) aborted", batch.signal.getReason(), aborted);
    }

    private void finish(Batch batch, ToolCall call, CompletableFuture<ToolCallResponse> done,
            ToolCallResponse response) {
        if (call.complete(response)) {
            log.debug("[Scheduler] '{}' ({}) -> {}", call.getName(), call.getCallId(), response.getStatus());
            notifyUpdate(batch, call);
        }
        done.complete(call.getResponse());
    }

    private boolean transition(Batch batch, ToolCall call, ToolCallStatus status) {
        if (!call.transitionTo(status)) {
            return false;
        }
        notifyUpdate(batch, call);
        return true;
    }

    private void notifyUpdate(Batch batch, ToolCall call) {
        ToolCallUpdateEvent update = new ToolCallUpdateEvent(call.getCallId(), call.getName(), call.getStatus(),
                call.getResponse());
        eventBus.publish(update);
        try {
            batch.listener.onUpdate(update);
        } catch (RuntimeException e) {
            log.warn("[Scheduler] Progress listener failed: {}", e.getMessage(), e);
        }
    }

    private static String resourceKey(ToolCall call) {
        ToolComponent tool = call.getTool();
        if (!tool.getKind().isMutating()) {
            return null;
        }
        return tool.resourceKey(call.getRequest().getArgs());
    }

    /**
     * Truncate tool result content that exceeds the configured max length.
     */
    public String truncateToolResult(String content, String toolName) {
        if (content == null) {
            return null;
        }
        int maxChars = properties.getScheduler().getMaxResultChars();
        if (maxChars <= 0 || content.length() <= maxChars) {
            return content;
        }

        String suffix = "\n\n[OUTPUT TRUNCATED: " + content.length() + " chars total, showing first "
                + maxChars + " chars. Try a more specific query or process the data in smaller chunks.]";
        int cutPoint = Math.max(0, maxChars - suffix.length());
        log.warn("[Scheduler] Truncating '{}' result: {} chars -> ~{} chars",
                toolName, content.length(), cutPoint + suffix.length());
        return content.substring(0, cutPoint) + suffix;
    }

    private static ToolCallResponse error(ToolCall call, ToolErrorType errorType, String message) {
        return ToolCallResponse.builder()
                .callId(call.getCallId())
                .name(call.getName())
                .status(ToolCallStatus.ERROR)
                .errorType(errorType)
                .errorMessage(message)
                .content(message)
                .build();
    }

    private static ToolCallResponse cancelled(ToolCall call, String message) {
        return ToolCallResponse.builder()
                .callId(call.getCallId())
                .name(call.getName())
                .status(ToolCallStatus.CANCELLED)
                .errorType(ToolErrorType.ABORTED)
                .errorMessage(message)
                .content(message)
                .build();
    }

    private static String orDefault(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cursor = error;
        while ((cursor instanceof CompletionException || cursor instanceof ExecutionException)
                && cursor.getCause() != null) {
            cursor = cursor.getCause();
        }
        return cursor;
    }

    private static String safeCauseMessage(Throwable error) {
        if (error == null) {
            return "unknown";
        }

        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null) {
            if (cause.equals(cursor)) {
                break;
            }
            cursor = cause;
            cause = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }

    private static final class Batch {

        private final ApprovalMode approvalMode;
        private final CancellationSignal signal;
        private final ToolCallListener listener;
        private final ToolRegistry.Snapshot snapshot;
        private final List<Entry> entries = new ArrayList<>();

        private Batch(ApprovalMode approvalMode, CancellationSignal signal, ToolCallListener listener,
                ToolRegistry.Snapshot snapshot) {
            this.approvalMode = approvalMode;
            this.signal = signal;
            this.listener = listener;
            this.snapshot = snapshot;
        }
    }

    private record Entry(ToolCall call, CompletableFuture<ToolCallResponse> done) {
    }
}

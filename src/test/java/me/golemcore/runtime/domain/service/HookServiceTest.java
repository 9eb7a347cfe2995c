package me.golemcore.runtime.domain.service;

import me.golemcore.runtime.domain.model.CancellationSignal;
import me.golemcore.runtime.domain.model.bus.HookEventName;
import me.golemcore.runtime.domain.model.bus.HookExecutionRequest;
import me.golemcore.runtime.domain.model.bus.HookExecutionResponse;
import me.golemcore.runtime.domain.model.bus.HookOutput;
import me.golemcore.runtime.domain.model.bus.MessageBusType;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.infrastructure.event.MessageBus;
import me.golemcore.runtime.infrastructure.event.SpringEventBus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class HookServiceTest {

    private static final long WAIT_SECONDS = 5;

    private RuntimeProperties properties;
    private MessageBus messageBus;
    private HookService hookService;
    private CompletableFuture<HookExecutionRequest> received;

    @BeforeEach
    void setUp() {
        properties = new RuntimeProperties();
        properties.getHooks().setEnabled(true);
        properties.getHooks().setTimeoutSeconds(1);
        messageBus = new MessageBus(properties, mock(SpringEventBus.class));
        hookService = new HookService(messageBus, properties);
        received = new CompletableFuture<>();
    }

    @AfterEach
    void tearDown() {
        messageBus.shutdown();
    }

    private void respondWith(Function<HookExecutionRequest, HookExecutionResponse> runner) {
        messageBus.subscribe(MessageBusType.HOOK_EXECUTION_REQUEST, HookExecutionRequest.class, request -> {
            received.complete(request);
            HookExecutionResponse response = runner.apply(request);
            response.setCorrelationId(request.getCorrelationId());
            messageBus.publish(response);
        });
    }

    @Test
    void shouldSkipHooksWhenDisabled() throws Exception {
        properties.getHooks().setEnabled(false);

        Optional<HookOutput> output = hookService.fireBeforeTool("write_file", Map.of(), CancellationSignal.none())
                .get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertTrue(output.isEmpty());
    }

    @Test
    void shouldSendBeforeToolInputAndReturnOutput() throws Exception {
        respondWith(request -> HookExecutionResponse.builder()
                .success(true)
                .output(HookOutput.builder().decision("allow").build())
                .build());

        Optional<HookOutput> output = hookService.fireBeforeTool("write_file", Map.of("path", "a.txt"),
                CancellationSignal.none()).get(WAIT_SECONDS, TimeUnit.SECONDS);

        HookExecutionRequest request = received.get(WAIT_SECONDS, TimeUnit.SECONDS);
        assertEquals(HookEventName.BEFORE_TOOL, request.getEventName());
        assertEquals("write_file", request.getInput().get("tool_name"));
        assertEquals(Map.of("path", "a.txt"), request.getInput().get("tool_input"));
        assertEquals("allow", output.orElseThrow().getDecision());
    }

    @Test
    void shouldIncludeToolResponseForAfterTool() throws Exception {
        respondWith(request -> HookExecutionResponse.builder().success(true).build());

        Optional<HookOutput> output = hookService.fireAfterTool("read_file", Map.of(), Map.of("output", "text"),
                CancellationSignal.none()).get(WAIT_SECONDS, TimeUnit.SECONDS);

        HookExecutionRequest request = received.get(WAIT_SECONDS, TimeUnit.SECONDS);
        assertEquals(HookEventName.AFTER_TOOL, request.getEventName());
        assertEquals(Map.of("output", "text"), request.getInput().get("tool_response"));
        assertTrue(output.isEmpty());
    }

    @Test
    void shouldFireSubAgentHooks() throws Exception {
        respondWith(request -> HookExecutionResponse.builder().success(true).build());

        hookService.fireAfterSubAgent("codebase_investigator", "find usages", "found 3", CancellationSignal.none())
                .get(WAIT_SECONDS, TimeUnit.SECONDS);

        HookExecutionRequest request = received.get(WAIT_SECONDS, TimeUnit.SECONDS);
        assertEquals(HookEventName.AFTER_SUB_AGENT, request.getEventName());
        assertEquals("codebase_investigator", request.getInput().get("agent_name"));
        assertEquals("found 3", request.getInput().get("prompt_response"));
    }

    @Test
    void shouldDenyWhenBeforeToolRunnerFailsAndFailClosed() throws Exception {
        respondWith(request -> HookExecutionResponse.builder().success(false).error("runner crashed").build());

        HookOutput output = hookService.fireBeforeTool("write_file", Map.of(), CancellationSignal.none())
                .get(WAIT_SECONDS, TimeUnit.SECONDS).orElseThrow();

        assertTrue(output.isBlockingDecision());
        assertTrue(output.getReason().contains("runner crashed"));
    }

    @Test
    void shouldIgnoreBeforeToolFailureWhenFailOpen() throws Exception {
        properties.getHooks().setBeforeToolFailClosed(false);
        respondWith(request -> HookExecutionResponse.builder().success(false).error("runner crashed").build());

        Optional<HookOutput> output = hookService.fireBeforeTool("write_file", Map.of(), CancellationSignal.none())
                .get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertTrue(output.isEmpty());
    }

    @Test
    void shouldTreatAfterToolTimeoutAsAbsent() throws Exception {
        Optional<HookOutput> output = hookService.fireAfterTool("read_file", Map.of(), Map.of(),
                CancellationSignal.none()).get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertTrue(output.isEmpty());
    }

    @Test
    void shouldDenyBeforeToolOnTimeoutWhenFailClosed() throws Exception {
        Optional<HookOutput> output = hookService.fireBeforeTool("write_file", Map.of(), CancellationSignal.none())
                .get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertTrue(output.orElseThrow().isBlockingDecision());
    }

    @Test
    void shouldTreatSubAgentHookFailureAsAbsent() throws Exception {
        Optional<HookOutput> timedOut = hookService.fireBeforeSubAgent("codebase_investigator", "find usages",
                CancellationSignal.none()).get(WAIT_SECONDS, TimeUnit.SECONDS);
        assertTrue(timedOut.isEmpty());

        respondWith(request -> HookExecutionResponse.builder().success(false).error("runner crashed").build());

        Optional<HookOutput> beforeFailed = hookService.fireBeforeSubAgent("codebase_investigator", "find usages",
                CancellationSignal.none()).get(WAIT_SECONDS, TimeUnit.SECONDS);
        Optional<HookOutput> afterFailed = hookService.fireAfterSubAgent("codebase_investigator", "find usages",
                "found 3", CancellationSignal.none()).get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertEquals(HookEventName.BEFORE_SUB_AGENT, received.get(WAIT_SECONDS, TimeUnit.SECONDS).getEventName());
        assertTrue(beforeFailed.isEmpty());
        assertTrue(afterFailed.isEmpty());
    }

    @Test
    void shouldTreatAfterSubAgentTimeoutAsAbsent() throws Exception {
        Optional<HookOutput> output = hookService.fireAfterSubAgent("codebase_investigator", "find usages",
                "found 3", CancellationSignal.none()).get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertTrue(output.isEmpty());
    }
}

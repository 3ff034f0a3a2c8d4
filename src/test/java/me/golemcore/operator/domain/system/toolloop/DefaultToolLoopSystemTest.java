package me.golemcore.operator.domain.system.toolloop;

import me.golemcore.operator.domain.model.LlmRequest;
import me.golemcore.operator.domain.model.LlmResponse;
import me.golemcore.operator.domain.model.Message;
import me.golemcore.operator.domain.model.ToolResult;
import me.golemcore.operator.domain.stream.StreamEvent;
import me.golemcore.operator.domain.tool.OperatorToolCatalog;
import me.golemcore.operator.domain.tool.ToolDispatchResult;
import me.golemcore.operator.infrastructure.config.OperatorProperties;
import me.golemcore.operator.port.outbound.LlmPort;
import me.golemcore.operator.testsupport.MutableClock;
import me.golemcore.operator.testsupport.RecordingTurnStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultToolLoopSystemTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String USER = "alice";

    private LlmPort llmPort;
    private OperatorProperties properties;
    private MutableClock clock;
    private ExecutorService executor;
    private RecordingTurnStream stream;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        properties = new OperatorProperties();
        properties.getStream().setChunkSize(1000);
        clock = new MutableClock(NOW);
        executor = Executors.newCachedThreadPool();
        stream = new RecordingTurnStream();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldCompleteWithFinalAnswerWhenNoToolsRequested() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(answer("Your spend is $120.")));
        TurnContext context = context("what is my spend?");

        ToolLoopTurnResult result = system(echoExecutor()).processTurn(context, stream);

        assertEquals(ToolLoopTurnResult.Outcome.COMPLETED, result.outcome());
        assertEquals("Your spend is $120.", result.finalText());
        assertEquals(1, result.llmCalls());
        assertEquals(0, result.toolExecutions());
        assertEquals(1, context.getNewMessages().size());
        assertTrue(context.getNewMessages().get(0).isAssistantMessage());
        assertEquals("Your spend is $120.", stream.text());
        assertTrue(stream.eventsOfType(StreamEvent.DONE).isEmpty());
    }

    @Test
    void shouldSendSystemPromptHistoryAndCatalog() {
        List<LlmRequest> requests = new ArrayList<>();
        when(llmPort.chat(any())).thenAnswer(invocation -> {
            requests.add(invocation.getArgument(0));
            return CompletableFuture.completedFuture(answer("ok"));
        });

        system(echoExecutor()).processTurn(context("hi"), stream);

        LlmRequest request = requests.get(0);
        assertEquals("SYSTEM", request.getSystemPrompt());
        assertEquals(1, request.getMessages().size());
        assertEquals(new OperatorToolCatalog().getDefinitions().size(), request.getTools().size());
        assertEquals(properties.getRouter().getModel(), request.getModel());
    }

    @Test
    void shouldAppendToolResultsInRequestOrderRegardlessOfCompletionOrder() {
        when(llmPort.chat(any()))
                .thenReturn(CompletableFuture.completedFuture(toolCalls(call("c1", "slow"), call("c2", "fast"))))
                .thenReturn(CompletableFuture.completedFuture(answer("done")));
        ToolExecutorPort toolExecutor = (userId, toolCall) -> {
            if ("slow".equals(toolCall.getName())) {
                sleep(200);
            }
            return success(toolCall, toolCall.getName() + "-result");
        };
        TurnContext context = context("go");

        ToolLoopTurnResult result = system(toolExecutor).processTurn(context, stream);

        assertEquals(ToolLoopTurnResult.Outcome.COMPLETED, result.outcome());
        assertEquals(2, result.toolExecutions());
        List<Message> added = context.getNewMessages();
        assertEquals(3, added.size());
        assertTrue(added.get(0).hasToolCalls());
        Message bundle = added.get(1);
        assertTrue(bundle.hasToolResults());
        assertEquals(Message.ROLE_USER, bundle.getRole());
        assertEquals("c1", bundle.getToolResults().get(0).getToolCallId());
        assertEquals("slow-result", bundle.getToolResults().get(0).getContent());
        assertEquals("c2", bundle.getToolResults().get(1).getToolCallId());

        List<StreamEvent> statuses = stream.eventsOfType(StreamEvent.TOOL_STATUS);
        assertEquals(4, statuses.size());
        assertEquals(StreamEvent.STATUS_RUNNING, statuses.get(0).data().get("status"));
        assertEquals(StreamEvent.STATUS_RUNNING, statuses.get(1).data().get("status"));
        assertEquals("slow", statuses.get(2).data().get("tool"));
        assertEquals(StreamEvent.STATUS_DONE, statuses.get(2).data().get("status"));
        assertEquals("fast", statuses.get(3).data().get("tool"));
    }

    @Test
    void shouldStopAtStepLimitWithExplanation() {
        properties.getTurn().setMaxLlmCalls(3);
        AtomicInteger calls = new AtomicInteger();
        when(llmPort.chat(any())).thenAnswer(invocation -> CompletableFuture.completedFuture(
                toolCalls(call("c" + calls.incrementAndGet(), "list_entities"))));
        TurnContext context = context("loop forever");

        ToolLoopTurnResult result = system(echoExecutor()).processTurn(context, stream);

        assertEquals(ToolLoopTurnResult.Outcome.STEP_LIMIT, result.outcome());
        assertTrue(result.isFinished());
        assertEquals(3, result.llmCalls());
        assertEquals(3, result.toolExecutions());
        assertTrue(result.finalText().startsWith("Step limit exceeded: reached max internal LLM calls (3)"));
        Message last = context.getNewMessages().get(context.getNewMessages().size() - 1);
        assertEquals(result.finalText(), last.getContent());
        assertEquals(result.finalText(), stream.text());
    }

    @Test
    void shouldStopWhenDeadlinePasses() {
        properties.getTurn().setDeadline(Duration.ofSeconds(30));
        when(llmPort.chat(any())).thenAnswer(invocation -> {
            clock.advance(Duration.ofSeconds(31));
            return CompletableFuture.completedFuture(toolCalls(call("c1", "list_entities")));
        });

        ToolLoopTurnResult result = system(echoExecutor()).processTurn(context("slow"), stream);

        assertEquals(ToolLoopTurnResult.Outcome.STEP_LIMIT, result.outcome());
        assertEquals(1, result.llmCalls());
        assertTrue(result.finalText().contains("deadline exceeded"));
    }

    @Test
    void shouldRaiseOracleUnavailableWhenLlmFails() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("503")));
        TurnContext context = context("hi");

        OracleUnavailableException ex = assertThrows(OracleUnavailableException.class,
                () -> system(echoExecutor()).processTurn(context, stream));

        assertTrue(ex.getMessage().contains("503"));
        assertTrue(context.getNewMessages().isEmpty());
        assertTrue(stream.events().isEmpty());
    }

    @Test
    void shouldAbortBeforeCallingLlmWhenCallerLeft() {
        stream.cancel();
        TurnContext context = context("hi");

        ToolLoopTurnResult result = system(echoExecutor()).processTurn(context, stream);

        assertEquals(ToolLoopTurnResult.Outcome.ABORTED, result.outcome());
        assertFalse(result.isFinished());
        verify(llmPort, never()).chat(any());
    }

    @Test
    void shouldNotRunToolsWhenCallerLeftDuringLlmCall() {
        when(llmPort.chat(any())).thenAnswer(invocation -> {
            stream.cancel();
            return CompletableFuture.completedFuture(toolCalls(call("c1", "pause_meta_adset")));
        });
        ToolExecutorPort toolExecutor = mock(ToolExecutorPort.class);
        TurnContext context = context("pause spring launch");

        ToolLoopTurnResult result = system(toolExecutor).processTurn(context, stream);

        assertEquals(ToolLoopTurnResult.Outcome.ABORTED, result.outcome());
        assertEquals(1, result.llmCalls());
        assertEquals(0, result.toolExecutions());
        assertTrue(context.getNewMessages().isEmpty());
        verify(toolExecutor, never()).execute(any(), any());
    }

    @Test
    void shouldAbortAfterToolRoundWhenCallerLeft() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                toolCalls(call("c1", "list_entities"))));
        ToolExecutorPort toolExecutor = (userId, toolCall) -> {
            stream.cancel();
            return success(toolCall, "{}");
        };

        ToolLoopTurnResult result = system(toolExecutor).processTurn(context("hi"), stream);

        assertEquals(ToolLoopTurnResult.Outcome.ABORTED, result.outcome());
        assertEquals(1, result.llmCalls());
        assertNull(result.finalText());
    }

    @Test
    void shouldTurnToolExceptionIntoFailedResultAndContinue() {
        when(llmPort.chat(any()))
                .thenReturn(CompletableFuture.completedFuture(toolCalls(call("c1", "boom"), call("c2", "ok"))))
                .thenReturn(CompletableFuture.completedFuture(answer("partial success")));
        ToolExecutorPort toolExecutor = (userId, toolCall) -> {
            if ("boom".equals(toolCall.getName())) {
                throw new IllegalStateException("platform exploded");
            }
            return success(toolCall, "fine");
        };
        TurnContext context = context("go");

        ToolLoopTurnResult result = system(toolExecutor).processTurn(context, stream);

        assertEquals(ToolLoopTurnResult.Outcome.COMPLETED, result.outcome());
        Message.ToolResultBlock failed = context.getNewMessages().get(1).getToolResults().get(0);
        assertTrue(failed.isError());
        assertEquals("Tool execution failed: platform exploded", failed.getContent());
        assertFalse(context.getNewMessages().get(1).getToolResults().get(1).isError());
        List<StreamEvent> statuses = stream.eventsOfType(StreamEvent.TOOL_STATUS);
        assertEquals(StreamEvent.STATUS_ERROR, statuses.get(2).data().get("status"));
        assertEquals(StreamEvent.STATUS_DONE, statuses.get(3).data().get("status"));
    }

    @Test
    void shouldReportTimedOutToolAsFailure() {
        properties.getTurn().setToolTimeout(Duration.ofMillis(50));
        when(llmPort.chat(any()))
                .thenReturn(CompletableFuture.completedFuture(toolCalls(call("c1", "list_entities"))))
                .thenReturn(CompletableFuture.completedFuture(answer("gave up")));
        ToolExecutorPort toolExecutor = (userId, toolCall) -> {
            sleep(1000);
            return success(toolCall, "late");
        };
        TurnContext context = context("go");

        system(toolExecutor).processTurn(context, stream);

        Message.ToolResultBlock block = context.getNewMessages().get(1).getToolResults().get(0);
        assertTrue(block.isError());
        assertEquals("Tool execution timed out", block.getContent());
    }

    @Test
    void shouldEmitChartAndAttachItToFinalAnswer() {
        Map<String, Object> chart = Map.of("type", "kpi", "title", "ROAS");
        when(llmPort.chat(any()))
                .thenReturn(CompletableFuture.completedFuture(toolCalls(call("c1", "render_chart"))))
                .thenReturn(CompletableFuture.completedFuture(answer("Here is your ROAS.")));
        ToolExecutorPort toolExecutor = (userId, toolCall) -> new ToolDispatchResult(toolCall.getId(),
                toolCall.getName(), ToolResult.success("{}"), "{}", "📊 Chart: ROAS", chart);
        TurnContext context = context("chart it");

        system(toolExecutor).processTurn(context, stream);

        List<StreamEvent> charts = stream.eventsOfType(StreamEvent.CHART);
        assertEquals(1, charts.size());
        assertEquals(chart, charts.get(0).data().get("spec"));
        Message finalAnswer = context.getNewMessages().get(2);
        assertNotNull(finalAnswer.getCharts());
        assertEquals(chart, finalAnswer.getCharts().get(0));
    }

    @Test
    void shouldTreatMissingContentAsEmptyAnswer() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(LlmResponse.builder().build()));
        TurnContext context = context("hi");

        ToolLoopTurnResult result = system(echoExecutor()).processTurn(context, stream);

        assertEquals("", result.finalText());
        assertEquals("", context.getNewMessages().get(0).getContent());
    }

    private DefaultToolLoopSystem system(ToolExecutorPort toolExecutor) {
        return new DefaultToolLoopSystem(llmPort, toolExecutor, new DefaultHistoryWriter(clock),
                new OperatorToolCatalog(), properties, executor, clock);
    }

    private TurnContext context(String userText) {
        List<Message> messages = new ArrayList<>();
        messages.add(Message.builder().role(Message.ROLE_USER).content(userText).timestamp(NOW).build());
        return TurnContext.builder()
                .userId(USER)
                .conversationId("conv-1")
                .systemPrompt("SYSTEM")
                .messages(messages)
                .build();
    }

    private static ToolExecutorPort echoExecutor() {
        return (userId, toolCall) -> success(toolCall, "{\"ok\":true}");
    }

    private static ToolDispatchResult success(Message.ToolCall toolCall, String content) {
        return new ToolDispatchResult(toolCall.getId(), toolCall.getName(), ToolResult.success(content), content,
                "ok", null);
    }

    private static LlmResponse answer(String text) {
        return LlmResponse.builder().content(text).finishReason("stop").build();
    }

    private static LlmResponse toolCalls(Message.ToolCall... calls) {
        return LlmResponse.builder().toolCalls(List.of(calls)).finishReason("tool_calls").build();
    }

    private static Message.ToolCall call(String id, String name) {
        return Message.ToolCall.builder().id(id).name(name).arguments(Map.of()).build();
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

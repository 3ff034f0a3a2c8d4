package me.golemcore.operator.domain.system.toolloop;

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

import me.golemcore.operator.domain.model.LlmRequest;
import me.golemcore.operator.domain.model.LlmResponse;
import me.golemcore.operator.domain.model.Message;
import me.golemcore.operator.domain.model.ToolFailureKind;
import me.golemcore.operator.domain.stream.StreamEvent;
import me.golemcore.operator.domain.stream.TurnStream;
import me.golemcore.operator.domain.tool.OperatorToolCatalog;
import me.golemcore.operator.domain.tool.ToolDispatchResult;
import me.golemcore.operator.infrastructure.config.OperatorProperties;
import me.golemcore.operator.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Tool loop orchestrator (single-turn internal loop).
 *
 * <p>
 * The LLM is called with the history and the tool catalogue. Every tool call
 * it requests is dispatched, results are appended in request order, and the
 * LLM is called again, until it answers without tool calls or the turn runs
 * out of LLM calls or time. Tool calls of one round run concurrently on the
 * tool executor.
 */
public class DefaultToolLoopSystem implements ToolLoopSystem {

    private static final Logger log = LoggerFactory.getLogger(DefaultToolLoopSystem.class);

    private final LlmPort llmPort;
    private final ToolExecutorPort toolExecutor;
    private final HistoryWriter historyWriter;
    private final OperatorToolCatalog catalog;
    private final OperatorProperties properties;
    private final Executor executor;
    private final Clock clock;

    public DefaultToolLoopSystem(LlmPort llmPort, ToolExecutorPort toolExecutor, HistoryWriter historyWriter,
            OperatorToolCatalog catalog, OperatorProperties properties, Executor executor) {
        this(llmPort, toolExecutor, historyWriter, catalog, properties, executor, Clock.systemUTC());
    }

    // Visible for testing
    public DefaultToolLoopSystem(LlmPort llmPort, ToolExecutorPort toolExecutor, HistoryWriter historyWriter,
            OperatorToolCatalog catalog, OperatorProperties properties, Executor executor, Clock clock) {
        this.llmPort = llmPort;
        this.toolExecutor = toolExecutor;
        this.historyWriter = historyWriter;
        this.catalog = catalog;
        this.properties = properties;
        this.executor = executor;
        this.clock = clock;
    }

    @Override
    public ToolLoopTurnResult processTurn(TurnContext context, TurnStream stream) {
        OperatorProperties.TurnProperties settings = properties.getTurn();
        int maxLlmCalls = settings.getMaxLlmCalls();
        int chunkSize = properties.getStream().getChunkSize();
        Instant deadline = clock.instant().plus(settings.getDeadline());

        int llmCalls = 0;
        int toolExecutions = 0;

        while (llmCalls < maxLlmCalls && clock.instant().isBefore(deadline)) {
            if (stream.isCancelled()) {
                return aborted(context, llmCalls, toolExecutions);
            }

            // 1) LLM call
            LlmResponse response = callLlm(context);
            llmCalls++;
            if (stream.isCancelled()) {
                return aborted(context, llmCalls, toolExecutions);
            }

            // 2) Final answer (no tool calls)
            if (response == null || !response.hasToolCalls()) {
                String finalText = response != null && response.getContent() != null ? response.getContent() : "";
                historyWriter.appendFinalAssistantAnswer(context, finalText);
                if (!stream.emitText(finalText, chunkSize)) {
                    return aborted(context, llmCalls, toolExecutions);
                }
                log.debug("[ToolLoop] Turn completed: {} LLM calls, {} tool executions", llmCalls, toolExecutions);
                return new ToolLoopTurnResult(context, ToolLoopTurnResult.Outcome.COMPLETED, finalText, llmCalls,
                        toolExecutions);
            }

            // 3) Append assistant message with tool calls
            historyWriter.appendAssistantToolCalls(context, response);

            // 4) Execute tools, append results in request order
            List<ToolDispatchResult> results = executeRound(context, response.getToolCalls(), stream);
            toolExecutions += results.size();
            historyWriter.appendToolResults(context, results);

            if (stream.isCancelled()) {
                return aborted(context, llmCalls, toolExecutions);
            }
        }

        String stopReason = buildStopReason(llmCalls, maxLlmCalls, deadline);
        log.info("[ToolLoop] Step limit exceeded: {}", stopReason);
        String finalText = "Step limit exceeded: " + stopReason
                + ". I could not finish this request; please narrow it down and try again.";
        historyWriter.appendFinalAssistantAnswer(context, finalText);
        if (!stream.emitText(finalText, chunkSize)) {
            return aborted(context, llmCalls, toolExecutions);
        }
        return new ToolLoopTurnResult(context, ToolLoopTurnResult.Outcome.STEP_LIMIT, finalText, llmCalls,
                toolExecutions);
    }

    private List<ToolDispatchResult> executeRound(TurnContext context, List<Message.ToolCall> toolCalls,
            TurnStream stream) {
        List<CompletableFuture<ToolDispatchResult>> futures = new ArrayList<>(toolCalls.size());
        for (Message.ToolCall toolCall : toolCalls) {
            stream.emit(StreamEvent.toolStatus(toolCall.getName(), StreamEvent.STATUS_RUNNING, null));
            futures.add(CompletableFuture.supplyAsync(
                    () -> toolExecutor.execute(context.getUserId(), toolCall), executor));
        }

        long timeoutMs = properties.getTurn().getToolTimeout().toMillis();
        List<ToolDispatchResult> results = new ArrayList<>(toolCalls.size());
        for (int i = 0; i < toolCalls.size(); i++) {
            ToolDispatchResult result = await(toolCalls.get(i), futures.get(i), timeoutMs);
            results.add(result);

            String status = result.isSuccess() ? StreamEvent.STATUS_DONE : StreamEvent.STATUS_ERROR;
            stream.emit(StreamEvent.toolStatus(result.toolName(), status, result.summary()));
            if (result.chart() != null) {
                context.getCharts().add(result.chart());
                stream.emit(StreamEvent.chart(result.chart()));
            }
        }
        return results;
    }

    private ToolDispatchResult await(Message.ToolCall toolCall, CompletableFuture<ToolDispatchResult> future,
            long timeoutMs) {
        try {
            ToolDispatchResult result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (result == null) {
                return ToolDispatchResult.synthetic(toolCall, ToolFailureKind.EXECUTION_FAILED,
                        "Tool returned no result");
            }
            return result;
        } catch (TimeoutException e) {
            log.warn("[ToolLoop] Tool {} timed out after {} ms", toolCall.getName(), timeoutMs);
            return ToolDispatchResult.synthetic(toolCall, ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution timed out");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[ToolLoop] Tool {} failed: {}", toolCall.getName(), cause.getMessage());
            return ToolDispatchResult.synthetic(toolCall, ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution failed: " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolDispatchResult.synthetic(toolCall, ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution interrupted");
        }
    }

    private LlmResponse callLlm(TurnContext context) {
        LlmRequest request = buildRequest(context);
        try {
            return llmPort.chat(request).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[ToolLoop] LLM call failed: {}", cause.getMessage());
            throw new OracleUnavailableException("LLM call failed: " + cause.getMessage(), cause);
        } catch (RuntimeException e) {
            log.warn("[ToolLoop] LLM call failed: {}", e.getMessage());
            throw new OracleUnavailableException("LLM call failed: " + e.getMessage(), e);
        }
    }

    private LlmRequest buildRequest(TurnContext context) {
        OperatorProperties.RouterProperties router = properties.getRouter();
        return LlmRequest.builder()
                .model(router.getModel())
                .systemPrompt(context.getSystemPrompt())
                .messages(new ArrayList<>(context.getMessages()))
                .tools(catalog.getDefinitions())
                .temperature(router.getTemperature())
                .maxTokens(router.getMaxTokens())
                .build();
    }

    private String buildStopReason(int llmCalls, int maxLlmCalls, Instant deadline) {
        if (llmCalls >= maxLlmCalls) {
            return "reached max internal LLM calls (" + maxLlmCalls + ")";
        }
        if (!clock.instant().isBefore(deadline)) {
            return "deadline exceeded";
        }
        return "stopped by guard";
    }

    private ToolLoopTurnResult aborted(TurnContext context, int llmCalls, int toolExecutions) {
        log.info("[ToolLoop] Caller disconnected, aborting turn after {} LLM calls", llmCalls);
        return new ToolLoopTurnResult(context, ToolLoopTurnResult.Outcome.ABORTED, null, llmCalls, toolExecutions);
    }
}

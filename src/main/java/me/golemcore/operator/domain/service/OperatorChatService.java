package me.golemcore.operator.domain.service;

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

import me.golemcore.operator.domain.confirmation.ConfirmationGateway;
import me.golemcore.operator.domain.confirmation.ConfirmationIntent;
import me.golemcore.operator.domain.confirmation.ConfirmationIntentClassifier;
import me.golemcore.operator.domain.confirmation.ConfirmationOutcome;
import me.golemcore.operator.domain.confirmation.PendingAction;
import me.golemcore.operator.domain.model.Conversation;
import me.golemcore.operator.domain.model.Message;
import me.golemcore.operator.domain.model.OperatorTool;
import me.golemcore.operator.domain.stream.FluxTurnStream;
import me.golemcore.operator.domain.stream.StreamEvent;
import me.golemcore.operator.domain.stream.TurnStream;
import me.golemcore.operator.domain.system.toolloop.OracleUnavailableException;
import me.golemcore.operator.domain.system.toolloop.ToolLoopSystem;
import me.golemcore.operator.domain.system.toolloop.ToolLoopTurnResult;
import me.golemcore.operator.domain.system.toolloop.TurnContext;
import me.golemcore.operator.infrastructure.config.OperatorProperties;
import me.golemcore.operator.port.outbound.ConversationPort;
import me.golemcore.operator.port.outbound.MemoryFactPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Runs one chat turn for a user and streams its progress.
 *
 * <p>
 * The user message is persisted as soon as the turn starts. Messages produced
 * by the tool loop are persisted only when the turn finishes; an aborted or
 * failed turn leaves just the user message behind. A bare "yes" or "no" while
 * the user has outstanding pending actions confirms or cancels all of them
 * without calling the LLM.
 */
@Service
@Slf4j
public class OperatorChatService {

    static final String ORACLE_UNAVAILABLE_MESSAGE = "The assistant is unavailable right now. Please try again.";

    private final ConversationPort conversationPort;
    private final MemoryFactPort memoryFactPort;
    private final ToolLoopSystem toolLoopSystem;
    private final ConfirmationGateway gateway;
    private final ConfirmationIntentClassifier intentClassifier;
    private final SystemContextBuilder systemContextBuilder;
    private final SuggestionService suggestionService;
    private final MemoryExtractionTrigger memoryTrigger;
    private final OperatorProperties properties;
    private final Clock clock;
    private final Scheduler scheduler;

    @Autowired
    public OperatorChatService(ConversationPort conversationPort, MemoryFactPort memoryFactPort,
            ToolLoopSystem toolLoopSystem, ConfirmationGateway gateway, ConfirmationIntentClassifier intentClassifier,
            SystemContextBuilder systemContextBuilder, SuggestionService suggestionService,
            MemoryExtractionTrigger memoryTrigger, OperatorProperties properties, Clock clock) {
        this(conversationPort, memoryFactPort, toolLoopSystem, gateway, intentClassifier, systemContextBuilder,
                suggestionService, memoryTrigger, properties, clock, Schedulers.boundedElastic());
    }

    // Visible for testing
    OperatorChatService(ConversationPort conversationPort, MemoryFactPort memoryFactPort,
            ToolLoopSystem toolLoopSystem, ConfirmationGateway gateway, ConfirmationIntentClassifier intentClassifier,
            SystemContextBuilder systemContextBuilder, SuggestionService suggestionService,
            MemoryExtractionTrigger memoryTrigger, OperatorProperties properties, Clock clock, Scheduler scheduler) {
        this.conversationPort = conversationPort;
        this.memoryFactPort = memoryFactPort;
        this.toolLoopSystem = toolLoopSystem;
        this.gateway = gateway;
        this.intentClassifier = intentClassifier;
        this.systemContextBuilder = systemContextBuilder;
        this.suggestionService = suggestionService;
        this.memoryTrigger = memoryTrigger;
        this.properties = properties;
        this.clock = clock;
        this.scheduler = scheduler;
    }

    /**
     * Validates the request and returns the turn's event stream. The turn runs
     * once per subscription.
     *
     * @throws IllegalArgumentException
     *             if the user id is malformed or the message is empty
     * @throws ConversationNotFoundException
     *             if {@code conversationId} does not name a conversation of
     *             this user
     */
    public Flux<StreamEvent> chat(String userId, String conversationId, String message) {
        String owner = StorageKeyValidator.requireValidKey(userId, "userId");
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message must not be empty");
        }
        Conversation existing = null;
        if (conversationId != null && !conversationId.isBlank()) {
            existing = conversationPort.find(owner, conversationId.trim())
                    .orElseThrow(() -> new ConversationNotFoundException(conversationId));
        }
        Conversation conversation = existing;
        String text = message.trim();
        return FluxTurnStream.create(scheduler, stream -> runTurn(owner, conversation, text, stream));
    }

    private void runTurn(String userId, Conversation existing, String text, TurnStream stream) {
        Conversation conversation = existing != null ? existing : conversationPort.create(userId, text);
        List<Message> history = existing != null ? conversationPort.messages(conversation) : new ArrayList<>();

        Message userMessage = Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_USER)
                .content(text)
                .timestamp(clock.instant())
                .build();
        persist(conversation, List.of(userMessage));

        List<PendingAction> pending = gateway.pendingFor(userId);
        if (properties.getConfirmation().isShortcutEnabled() && !pending.isEmpty()) {
            ConfirmationIntent intent = intentClassifier.classify(text);
            if (intent != ConfirmationIntent.NEITHER) {
                runShortcut(userId, conversation, intent, stream);
                return;
            }
        }

        List<Message> messages = new ArrayList<>(history);
        messages.add(userMessage);
        TurnContext context = TurnContext.builder()
                .userId(userId)
                .conversationId(conversation.getId())
                .systemPrompt(systemContextBuilder.build(
                        memoryFactPort.recent(userId, properties.getMemory().getRecallLimit()), pending))
                .messages(messages)
                .build();

        ToolLoopTurnResult result;
        try {
            result = toolLoopSystem.processTurn(context, stream);
        } catch (OracleUnavailableException e) {
            log.warn("[Chat] Turn aborted for conversation {}: {}", conversation.getId(), e.getMessage());
            stream.fail(ORACLE_UNAVAILABLE_MESSAGE);
            return;
        }

        if (!result.isFinished()) {
            log.info("[Chat] Caller left conversation {}; turn discarded", conversation.getId());
            return;
        }

        persist(conversation, context.getNewMessages());

        if (result.outcome() == ToolLoopTurnResult.Outcome.COMPLETED && !stream.isCancelled()) {
            List<String> suggestions = suggestionService.suggest(result.finalText());
            if (!suggestions.isEmpty()) {
                stream.emit(StreamEvent.suggestions(suggestions));
            }
        }
        stream.complete(conversation.getId());
    }

    private void runShortcut(String userId, Conversation conversation, ConfirmationIntent intent,
            TurnStream stream) {
        String finalText = switch (intent) {
        case CONFIRM -> confirmAll(userId, stream);
        case CANCEL -> cancelAll(userId, stream);
        case NEITHER -> throw new IllegalStateException("No shortcut for " + intent);
        };

        Message answer = Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_ASSISTANT)
                .content(finalText)
                .timestamp(clock.instant())
                .build();
        persist(conversation, List.of(answer));

        stream.emitText(finalText, properties.getStream().getChunkSize());
        stream.complete(conversation.getId());
    }

    private String confirmAll(String userId, TurnStream stream) {
        String toolName = OperatorTool.CONFIRM_ACTION.getToolName();
        List<ConfirmationOutcome> outcomes = gateway.confirmAll(userId);
        if (outcomes.isEmpty()) {
            return "There are no pending actions to confirm; they may have expired.";
        }
        StringBuilder sb = new StringBuilder();
        for (ConfirmationOutcome outcome : outcomes) {
            String description = outcome.action().getDescription();
            String summary = outcome.isSucceeded()
                    ? "✅ " + description
                    : "❌ Failed: " + description + ": " + outcome.error();
            stream.emit(StreamEvent.toolStatus(toolName,
                    outcome.isSucceeded() ? StreamEvent.STATUS_DONE : StreamEvent.STATUS_ERROR, summary));
            sb.append(summary).append("\n");
        }
        return sb.toString().trim();
    }

    private String cancelAll(String userId, TurnStream stream) {
        List<PendingAction> cancelled = gateway.cancelAll(userId);
        if (cancelled.isEmpty()) {
            return "There are no pending actions to cancel.";
        }
        StringBuilder sb = new StringBuilder("Cancelled " + cancelled.size()
                + (cancelled.size() == 1 ? " action:" : " actions:"));
        for (PendingAction action : cancelled) {
            stream.emit(StreamEvent.toolStatus(OperatorTool.CANCEL_ACTION.getToolName(), StreamEvent.STATUS_DONE,
                    "Cancelled: " + action.getDescription()));
            sb.append("\n- ").append(action.getDescription());
        }
        return sb.toString();
    }

    private void persist(Conversation conversation, List<Message> messages) {
        if (messages.isEmpty()) {
            return;
        }
        conversationPort.append(conversation, messages);
        memoryTrigger.onAppended(conversation, messages);
    }
}

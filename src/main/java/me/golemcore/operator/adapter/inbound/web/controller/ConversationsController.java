package me.golemcore.operator.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.operator.adapter.inbound.web.dto.ConversationDetailDto;
import me.golemcore.operator.adapter.inbound.web.dto.ConversationSummaryDto;
import me.golemcore.operator.adapter.inbound.web.dto.PendingActionDto;
import me.golemcore.operator.domain.confirmation.ConfirmationGateway;
import me.golemcore.operator.domain.confirmation.PendingAction;
import me.golemcore.operator.domain.model.Conversation;
import me.golemcore.operator.domain.model.MemoryFact;
import me.golemcore.operator.domain.service.ConversationNotFoundException;
import me.golemcore.operator.domain.service.MemoryExtractionTrigger;
import me.golemcore.operator.domain.service.StorageKeyValidator;
import me.golemcore.operator.port.outbound.ConversationPort;
import me.golemcore.operator.port.outbound.MemoryFactPort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Conversation browser plus read-only views of the caller's pending actions
 * and remembered facts.
 */
@RestController
@RequestMapping("/api/operator")
@RequiredArgsConstructor
@Slf4j
public class ConversationsController {

    private static final int MAX_MEMORY_LIMIT = 200;

    private final ConversationPort conversationPort;
    private final MemoryFactPort memoryFactPort;
    private final ConfirmationGateway gateway;
    private final MemoryExtractionTrigger memoryTrigger;
    private final Clock clock;

    @GetMapping("/conversations")
    public Mono<ResponseEntity<List<ConversationSummaryDto>>> listConversations(
            @RequestHeader(OperatorChatController.USER_HEADER) String userId) {
        String owner = StorageKeyValidator.requireValidKey(userId, "userId");
        List<ConversationSummaryDto> dtos = conversationPort.list(owner).stream()
                .map(this::toSummary)
                .toList();
        return Mono.just(ResponseEntity.ok(dtos));
    }

    @GetMapping("/conversations/{id}")
    public Mono<ResponseEntity<ConversationDetailDto>> getConversation(
            @RequestHeader(OperatorChatController.USER_HEADER) String userId, @PathVariable String id) {
        String owner = StorageKeyValidator.requireValidKey(userId, "userId");
        Conversation conversation = conversationPort.find(owner, id)
                .orElseThrow(() -> new ConversationNotFoundException(id));
        ConversationDetailDto dto = ConversationDetailDto.builder()
                .id(conversation.getId())
                .title(conversation.getTitle())
                .createdAt(format(conversation.getCreatedAt()))
                .updatedAt(format(conversation.getUpdatedAt()))
                .messages(conversationPort.messages(conversation))
                .build();
        return Mono.just(ResponseEntity.ok(dto));
    }

    @DeleteMapping("/conversations/{id}")
    public Mono<ResponseEntity<Void>> deleteConversation(
            @RequestHeader(OperatorChatController.USER_HEADER) String userId, @PathVariable String id) {
        String owner = StorageKeyValidator.requireValidKey(userId, "userId");
        if (!conversationPort.delete(owner, id)) {
            throw new ConversationNotFoundException(id);
        }
        memoryTrigger.forget(id);
        log.info("[API] Deleted conversation {} of {}", id, owner);
        return Mono.just(ResponseEntity.noContent().build());
    }

    @GetMapping("/pending-actions")
    public Mono<ResponseEntity<List<PendingActionDto>>> listPendingActions(
            @RequestHeader(OperatorChatController.USER_HEADER) String userId) {
        String owner = StorageKeyValidator.requireValidKey(userId, "userId");
        Instant now = clock.instant();
        List<PendingActionDto> dtos = gateway.pendingFor(owner).stream()
                .map(action -> toDto(action, now))
                .toList();
        return Mono.just(ResponseEntity.ok(dtos));
    }

    @GetMapping("/memories")
    public Mono<ResponseEntity<List<MemoryFact>>> listMemories(
            @RequestHeader(OperatorChatController.USER_HEADER) String userId,
            @RequestParam(defaultValue = "50") int limit) {
        String owner = StorageKeyValidator.requireValidKey(userId, "userId");
        int normalizedLimit = Math.max(1, Math.min(limit, MAX_MEMORY_LIMIT));
        return Mono.just(ResponseEntity.ok(memoryFactPort.recent(owner, normalizedLimit)));
    }

    private ConversationSummaryDto toSummary(Conversation conversation) {
        return ConversationSummaryDto.builder()
                .id(conversation.getId())
                .title(conversation.getTitle())
                .createdAt(format(conversation.getCreatedAt()))
                .updatedAt(format(conversation.getUpdatedAt()))
                .build();
    }

    private PendingActionDto toDto(PendingAction action, Instant now) {
        return PendingActionDto.builder()
                .id(action.getId())
                .tool(action.getTool().getToolName())
                .description(action.getDescription())
                .parameters(action.getParameters())
                .createdAt(format(action.getCreatedAt()))
                .expiresAt(format(action.getExpiresAt()))
                .expiresInSeconds(Math.max(0, Duration.between(now, action.getExpiresAt()).toSeconds()))
                .build();
    }

    private static String format(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}

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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.operator.domain.model.Conversation;
import me.golemcore.operator.domain.model.LlmRequest;
import me.golemcore.operator.domain.model.LlmResponse;
import me.golemcore.operator.domain.model.Message;
import me.golemcore.operator.infrastructure.config.OperatorProperties;
import me.golemcore.operator.port.outbound.ConversationPort;
import me.golemcore.operator.port.outbound.LlmPort;
import me.golemcore.operator.port.outbound.MemoryFactPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Distills the recent part of a conversation into a few durable facts about
 * the user and appends them to long-term memory.
 *
 * <p>
 * Never throws: any failure is logged and the extraction is dropped.
 */
@Service
@Slf4j
public class MemoryExtractionService {

    private static final int EXTRACTION_MAX_TOKENS = 300;

    private final ConversationPort conversationPort;
    private final MemoryFactPort memoryFactPort;
    private final LlmPort llmPort;
    private final ObjectMapper objectMapper;
    private final OperatorProperties properties;

    public MemoryExtractionService(ConversationPort conversationPort, MemoryFactPort memoryFactPort,
            LlmPort llmPort, ObjectMapper objectMapper, OperatorProperties properties) {
        this.conversationPort = conversationPort;
        this.memoryFactPort = memoryFactPort;
        this.llmPort = llmPort;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Runs one extraction over the conversation's latest messages.
     *
     * @return number of facts stored
     */
    public int extract(Conversation conversation) {
        try {
            return doExtract(conversation);
        } catch (Exception e) {
            log.warn("[Memory] Extraction failed for conversation {}: {}", conversation.getId(), e.getMessage());
            return 0;
        }
    }

    private int doExtract(Conversation conversation) throws Exception {
        OperatorProperties.MemoryProperties settings = properties.getMemory();
        List<Message> conversational = conversationPort.messages(conversation).stream()
                .filter(MemoryExtractionTrigger::isConversational)
                .toList();
        if (conversational.isEmpty()) {
            return 0;
        }
        int from = Math.max(0, conversational.size() - settings.getWindowMessages());
        String transcript = conversational.subList(from, conversational.size()).stream()
                .map(message -> message.getRole() + ": " + truncate(message.getContent(),
                        settings.getMaxMessageChars()))
                .collect(Collectors.joining("\n"));

        LlmRequest request = LlmRequest.builder()
                .model(properties.getRouter().getLightModel())
                .messages(List.of(Message.builder()
                        .role(Message.ROLE_USER)
                        .content(buildPrompt(settings.getMaxFacts(), transcript))
                        .build()))
                .maxTokens(EXTRACTION_MAX_TOKENS)
                .build();
        LlmResponse response = llmPort.chat(request).join();
        List<String> facts = StringArrayReplyParser.parse(objectMapper,
                response != null ? response.getContent() : null);

        int stored = 0;
        for (String fact : facts.subList(0, Math.min(facts.size(), settings.getMaxFacts()))) {
            if (memoryFactPort.append(conversation.getOwnerId(), fact).isPresent()) {
                stored++;
            }
        }
        log.debug("[Memory] Stored {} of {} extracted facts for {}", stored, facts.size(),
                conversation.getOwnerId());
        return stored;
    }

    private static String buildPrompt(int maxFacts, String transcript) {
        return "Extract 0-" + maxFacts + " factual preferences or key decisions from this conversation "
                + "that would be useful to remember for future conversations. "
                + "Return a JSON array of strings, or an empty array if nothing is worth remembering.\n\n"
                + "Conversation:\n" + transcript;
    }

    private static String truncate(String content, int maxChars) {
        if (content == null) {
            return "";
        }
        return content.length() > maxChars ? content.substring(0, maxChars) : content;
    }
}

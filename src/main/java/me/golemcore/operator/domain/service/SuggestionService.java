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
import me.golemcore.operator.domain.model.LlmRequest;
import me.golemcore.operator.domain.model.LlmResponse;
import me.golemcore.operator.domain.model.Message;
import me.golemcore.operator.infrastructure.config.OperatorProperties;
import me.golemcore.operator.port.outbound.LlmPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Proposes follow-up questions for a final answer via the lightweight model.
 */
@Service
@Slf4j
public class SuggestionService {

    private static final int ANSWER_EXCERPT_CHARS = 1000;
    private static final int SUGGESTION_MAX_TOKENS = 200;

    private final LlmPort llmPort;
    private final ObjectMapper objectMapper;
    private final OperatorProperties properties;

    public SuggestionService(LlmPort llmPort, ObjectMapper objectMapper, OperatorProperties properties) {
        this.llmPort = llmPort;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Returns up to the configured number of suggestions; empty when disabled
     * or on any failure.
     */
    public List<String> suggest(String finalAnswer) {
        OperatorProperties.SuggestionsProperties settings = properties.getSuggestions();
        if (!settings.isEnabled() || finalAnswer == null || finalAnswer.isBlank()) {
            return List.of();
        }
        String excerpt = finalAnswer.length() > ANSWER_EXCERPT_CHARS
                ? finalAnswer.substring(0, ANSWER_EXCERPT_CHARS)
                : finalAnswer;
        LlmRequest request = LlmRequest.builder()
                .model(properties.getRouter().getLightModel())
                .messages(List.of(Message.builder()
                        .role(Message.ROLE_USER)
                        .content("Based on this assistant response about advertising and subscription data, "
                                + "generate 2-3 short follow-up questions the user might want to ask next. "
                                + "Return ONLY a JSON array of strings, nothing else.\n\nAssistant response:\n"
                                + excerpt)
                        .build()))
                .maxTokens(SUGGESTION_MAX_TOKENS)
                .build();
        try {
            LlmResponse response = llmPort.chat(request).join();
            List<String> suggestions = StringArrayReplyParser.parse(objectMapper,
                    response != null ? response.getContent() : null);
            int limit = Math.max(0, settings.getMaxSuggestions());
            return suggestions.size() > limit ? List.copyOf(suggestions.subList(0, limit)) : suggestions;
        } catch (Exception e) {
            log.debug("[Suggestions] Follow-up suggestions unavailable: {}", e.getMessage());
            return List.of();
        }
    }
}

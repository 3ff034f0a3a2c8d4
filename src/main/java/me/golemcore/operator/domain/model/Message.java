package me.golemcore.operator.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A single message in an operator conversation.
 *
 * <p>
 * Roles are {@code user} and {@code assistant}. An assistant message may carry
 * the tool calls requested by the LLM; the results of one round of tool calls
 * are bundled into a single synthetic {@code user} message whose blocks are
 * tagged with the originating call ids. Messages are never modified after they
 * are appended to a conversation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    private String id;
    private String role; // user, assistant
    private String content;

    private List<ToolCall> toolCalls;
    private List<ToolResultBlock> toolResults;

    // Chart specs rendered alongside the message
    private List<Map<String, Object>> charts;

    private Instant timestamp;

    /**
     * Checks if this message is from the user.
     */
    @JsonIgnore
    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    /**
     * Checks if this message is from the assistant.
     */
    @JsonIgnore
    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    /**
     * Checks if this message contains tool calls from the LLM.
     */
    @JsonIgnore
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    /**
     * Checks if this message is a bundle of tool results.
     */
    @JsonIgnore
    public boolean hasToolResults() {
        return toolResults != null && !toolResults.isEmpty();
    }

    /**
     * Tool call requested by the LLM.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToolCall {
        private String id;
        private String name;
        private Map<String, Object> arguments;
    }

    /**
     * Result of one tool call, correlated with the call by {@code toolCallId}.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToolResultBlock {
        private String toolCallId;
        private String toolName;
        private String content;
        private boolean error;
    }
}

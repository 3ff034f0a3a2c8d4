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

import me.golemcore.operator.domain.model.LlmResponse;
import me.golemcore.operator.domain.model.Message;
import me.golemcore.operator.domain.tool.ToolDispatchResult;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Default {@link HistoryWriter}: random ids, timestamps from the injected
 * clock.
 */
public class DefaultHistoryWriter implements HistoryWriter {

    private final Clock clock;

    public DefaultHistoryWriter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void appendAssistantToolCalls(TurnContext context, LlmResponse response) {
        Message assistant = Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_ASSISTANT)
                .content(response.getContent())
                .toolCalls(List.copyOf(response.getToolCalls()))
                .timestamp(now())
                .build();
        context.append(assistant);
    }

    @Override
    public void appendToolResults(TurnContext context, List<ToolDispatchResult> results) {
        List<Message.ToolResultBlock> blocks = results.stream()
                .map(result -> Message.ToolResultBlock.builder()
                        .toolCallId(result.toolCallId())
                        .toolName(result.toolName())
                        .content(result.content())
                        .error(!result.isSuccess())
                        .build())
                .toList();
        Message bundle = Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_USER)
                .toolResults(blocks)
                .timestamp(now())
                .build();
        context.append(bundle);
    }

    @Override
    public void appendFinalAssistantAnswer(TurnContext context, String finalText) {
        Message assistant = Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_ASSISTANT)
                .content(finalText)
                .charts(context.getCharts().isEmpty() ? null : List.copyOf(context.getCharts()))
                .timestamp(now())
                .build();
        context.append(assistant);
    }

    private Instant now() {
        return clock.instant();
    }
}

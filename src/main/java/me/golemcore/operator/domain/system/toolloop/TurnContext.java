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

import me.golemcore.operator.domain.model.Message;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one turn inside the tool loop.
 *
 * <p>
 * {@code messages} is the full ordered history sent to the LLM;
 * {@code newMessages} holds only what this turn appended, so the caller can
 * persist it once the turn completes.
 */
@Data
@Builder
public class TurnContext {

    private String userId;
    private String conversationId;
    private String systemPrompt;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    @Builder.Default
    private List<Message> newMessages = new ArrayList<>();

    @Builder.Default
    private List<Map<String, Object>> charts = new ArrayList<>();

    public void append(Message message) {
        messages.add(message);
        newMessages.add(message);
    }
}

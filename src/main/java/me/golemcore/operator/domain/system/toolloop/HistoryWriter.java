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
import me.golemcore.operator.domain.tool.ToolDispatchResult;

import java.util.List;

/**
 * Appends the messages produced by the tool loop to the turn's history.
 */
public interface HistoryWriter {

    void appendAssistantToolCalls(TurnContext context, LlmResponse response);

    /**
     * Appends one synthetic message bundling all results of a round, in the
     * order given.
     */
    void appendToolResults(TurnContext context, List<ToolDispatchResult> results);

    void appendFinalAssistantAnswer(TurnContext context, String finalText);
}

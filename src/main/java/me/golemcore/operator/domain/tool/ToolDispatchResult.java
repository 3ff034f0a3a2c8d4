package me.golemcore.operator.domain.tool;

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
import me.golemcore.operator.domain.model.ToolFailureKind;
import me.golemcore.operator.domain.model.ToolResult;

import java.util.Map;

/**
 * Outcome of one dispatched tool call.
 *
 * @param toolCallId
 *            correlation id of the originating call
 * @param toolName
 *            tool name as requested by the LLM
 * @param toolResult
 *            structured result
 * @param content
 *            JSON content sent back to the LLM
 * @param summary
 *            one-line human-readable summary for the stream
 * @param chart
 *            chart spec to render, or null
 */
public record ToolDispatchResult(String toolCallId, String toolName, ToolResult toolResult, String content,
        String summary, Map<String, Object> chart) {

    public boolean isSuccess() {
        return toolResult != null && toolResult.isSuccess();
    }

    /**
     * Failed result produced without running the tool.
     */
    public static ToolDispatchResult synthetic(Message.ToolCall toolCall, ToolFailureKind kind, String reason) {
        return new ToolDispatchResult(toolCall.getId(), toolCall.getName(), ToolResult.failure(kind, reason), reason,
                "❌ " + reason, null);
    }
}

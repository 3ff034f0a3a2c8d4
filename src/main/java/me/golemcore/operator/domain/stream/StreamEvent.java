package me.golemcore.operator.domain.stream;

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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One typed event of a turn's output stream.
 *
 * @param type
 *            event name ({@code tool_status}, {@code chart}, {@code text},
 *            {@code suggestions}, {@code done}, {@code error})
 * @param data
 *            event payload
 */
public record StreamEvent(String type, Map<String, Object> data) {

    public static final String TOOL_STATUS = "tool_status";
    public static final String CHART = "chart";
    public static final String TEXT = "text";
    public static final String SUGGESTIONS = "suggestions";
    public static final String DONE = "done";
    public static final String ERROR = "error";

    public static final String STATUS_RUNNING = "running";
    public static final String STATUS_DONE = "done";
    public static final String STATUS_ERROR = "error";

    public static StreamEvent toolStatus(String tool, String status, String summary) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("tool", tool);
        data.put("status", status);
        if (summary != null) {
            data.put("summary", summary);
        }
        return new StreamEvent(TOOL_STATUS, data);
    }

    public static StreamEvent chart(Map<String, Object> spec) {
        return new StreamEvent(CHART, Map.of("spec", spec));
    }

    public static StreamEvent text(String chunk) {
        return new StreamEvent(TEXT, Map.of("chunk", chunk));
    }

    public static StreamEvent suggestions(List<String> suggestions) {
        return new StreamEvent(SUGGESTIONS, Map.of("suggestions", List.copyOf(suggestions)));
    }

    public static StreamEvent done(String conversationId) {
        return new StreamEvent(DONE, Map.of("conversationId", conversationId));
    }

    public static StreamEvent error(String message) {
        return new StreamEvent(ERROR, Map.of("message", message != null ? message : "Unknown error"));
    }

    public boolean isTerminal() {
        return DONE.equals(type) || ERROR.equals(type);
    }
}

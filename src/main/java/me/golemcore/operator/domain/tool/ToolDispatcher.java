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

import me.golemcore.operator.domain.confirmation.ActionNotFoundException;
import me.golemcore.operator.domain.confirmation.ConfirmationGateway;
import me.golemcore.operator.domain.confirmation.ConfirmationOutcome;
import me.golemcore.operator.domain.confirmation.PendingAction;
import me.golemcore.operator.domain.confirmation.StagingOutcome;
import me.golemcore.operator.domain.model.EntityCandidate;
import me.golemcore.operator.domain.model.EntityDomain;
import me.golemcore.operator.domain.model.Message;
import me.golemcore.operator.domain.model.OperatorTool;
import me.golemcore.operator.domain.model.OwnedEntity;
import me.golemcore.operator.domain.model.ToolFailureKind;
import me.golemcore.operator.domain.model.ToolResult;
import me.golemcore.operator.domain.resolution.EntityDirectory;
import me.golemcore.operator.domain.resolution.EntityResolver;
import me.golemcore.operator.infrastructure.config.OperatorProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;

/**
 * Dispatches LLM tool calls against the closed {@link OperatorTool} catalogue.
 *
 * <p>
 * Read tools run immediately. Write tools never touch a platform: they are
 * staged through the {@link ConfirmationGateway}. Every failure is converted
 * into a failed {@link ToolResult}; {@link #dispatch} does not throw.
 */
@Service
@Slf4j
public class ToolDispatcher {

    private static final int LIST_LIMIT = 50;
    private static final String STATUS = "status";
    private static final String PENDING_ID = "pending_id";
    private static final String ERROR = "error";

    private final ToolInputParser parser;
    private final ConfirmationGateway gateway;
    private final EntityDirectory directory;
    private final EntityResolver resolver;
    private final ObjectMapper objectMapper;
    private final int maxResultChars;

    public ToolDispatcher(ToolInputParser parser, ConfirmationGateway gateway, EntityDirectory directory,
            EntityResolver resolver, ObjectMapper objectMapper, OperatorProperties properties) {
        this.parser = parser;
        this.gateway = gateway;
        this.directory = directory;
        this.resolver = resolver;
        this.objectMapper = objectMapper;
        this.maxResultChars = properties.getTurn().getMaxToolResultChars();
    }

    public ToolDispatchResult dispatch(String userId, Message.ToolCall toolCall) {
        String toolName = sanitizeToolName(toolCall.getName());
        Optional<OperatorTool> resolved = OperatorTool.fromToolName(toolName);
        if (resolved.isEmpty()) {
            log.warn("[Tools] Unknown tool requested: {}", toolName);
            return failure(toolCall, ToolFailureKind.UNKNOWN_TOOL, "Unknown tool: " + toolName);
        }
        OperatorTool tool = resolved.get();

        ToolInput input;
        try {
            input = parser.parse(tool, toolCall.getArguments());
        } catch (ToolValidationException e) {
            log.debug("[Tools] Invalid input for {}: {}", toolName, e.getMessage());
            return failure(toolCall, ToolFailureKind.VALIDATION_FAILED, "Invalid input: " + e.getMessage());
        }

        try {
            return switch (tool) {
            case LIST_ENTITIES -> listEntities(userId, toolCall, (ToolInputs.ListEntities) input);
            case RENDER_CHART -> renderChart(toolCall, (ToolInputs.Chart) input);
            case PAUSE_META_ADSET, ENABLE_META_ADSET, ADJUST_META_BUDGET, PAUSE_META_CAMPAIGN,
                    ENABLE_META_CAMPAIGN, PAUSE_TIKTOK_ADGROUP, ENABLE_TIKTOK_ADGROUP, ADJUST_TIKTOK_BUDGET,
                    PAUSE_SUBSCRIPTION, CANCEL_SUBSCRIPTION -> stage(userId, toolCall, tool,
                            (WriteToolInput) input);
            case CONFIRM_ACTION -> confirm(userId, toolCall, (ToolInputs.PendingActionReference) input);
            case CANCEL_ACTION -> cancel(userId, toolCall, (ToolInputs.PendingActionReference) input);
            };
        } catch (ActionNotFoundException e) {
            return failure(toolCall, ToolFailureKind.ACTION_NOT_FOUND, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("[Tools] {} failed: {}", toolName, safeCauseMessage(e));
            return failure(toolCall, ToolFailureKind.EXECUTION_FAILED, safeCauseMessage(e));
        }
    }

    // ==================== Read tools ====================

    private ToolDispatchResult listEntities(String userId, Message.ToolCall toolCall,
            ToolInputs.ListEntities input) {
        EntityDomain domain = input.domain();
        List<OwnedEntity> owned = directory.listOwned(userId, domain);
        Map<String, OwnedEntity> byId = new LinkedHashMap<>();
        owned.forEach(entity -> byId.put(entity.id(), entity));

        List<Map<String, Object>> rows = new ArrayList<>();
        for (EntityCandidate candidate : resolver.rank(owned, LIST_LIMIT)) {
            Map<String, Object> row = candidateRow(domain, candidate);
            OwnedEntity entity = byId.get(candidate.id());
            if (entity != null && entity.status() != null) {
                row.put(STATUS, entity.status());
            }
            rows.add(row);
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("domain", domain.getWireName());
        data.put("count", owned.size());
        data.put("entities", rows);
        return success(toolCall, data, "📋 " + owned.size() + " " + domain.getLabel() + "(s)", null);
    }

    private ToolDispatchResult renderChart(Message.ToolCall toolCall, ToolInputs.Chart input) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(STATUS, "rendered");
        data.put("type", input.type());
        data.put("title", input.title());
        data.put("points", input.data().size());
        return success(toolCall, data, "📊 Chart: " + input.title(), input.spec());
    }

    // ==================== Write tools ====================

    private ToolDispatchResult stage(String userId, Message.ToolCall toolCall, OperatorTool tool,
            WriteToolInput input) {
        StagingOutcome outcome = gateway.stage(userId, tool, input);
        if (!outcome.isStaged()) {
            EntityDomain domain = tool.getDomain();
            List<Map<String, Object>> suggestions = outcome.candidates().stream()
                    .map(candidate -> candidateRow(domain, candidate))
                    .toList();
            String error = outcome.ambiguous()
                    ? "Several " + domain.getLabel() + "s match " + input.target().display()
                            + ". Ask the operator which option they mean, then retry with its exact id."
                    : "No " + domain.getLabel() + " matches " + input.target().display()
                            + ". Ask the operator to pick one of the suggestions.";
            Map<String, Object> data = new LinkedHashMap<>();
            data.put(STATUS, "not_found");
            data.put(ERROR, error);
            data.put("suggestions", suggestions);
            return success(toolCall, data, "❌ Not found (" + suggestions.size() + " suggestions)", null);
        }

        PendingAction action = outcome.action();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(STATUS, "pending_confirmation");
        data.put(PENDING_ID, action.getId());
        data.put("action", tool.getToolName());
        data.put("description", action.getDescription());
        data.put("details", action.getParameters());
        data.put("expires_at", action.getExpiresAt().toString());
        return success(toolCall, data, "⏳ Pending confirmation: " + action.getDescription(), null);
    }

    // ==================== Confirmation tools ====================

    private ToolDispatchResult confirm(String userId, Message.ToolCall toolCall,
            ToolInputs.PendingActionReference input) {
        ConfirmationOutcome outcome = gateway.confirm(userId, input.pendingId());
        PendingAction action = outcome.action();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(PENDING_ID, action.getId());
        data.put("description", action.getDescription());
        if (!outcome.isSucceeded()) {
            data.put(STATUS, "failed");
            data.put(ERROR, outcome.error());
            ToolResult result = ToolResult.builder()
                    .success(false)
                    .error(outcome.error())
                    .failureKind(ToolFailureKind.EXECUTION_FAILED)
                    .data(data)
                    .build();
            return new ToolDispatchResult(toolCall.getId(), toolCall.getName(), result, toJson(data),
                    "❌ Failed: " + action.getDescription() + ": " + outcome.error(), null);
        }
        data.put(STATUS, "executed");
        if (outcome.result() != null) {
            data.put("result", outcome.result().message());
            data.put("details", outcome.result().details());
        }
        return success(toolCall, data, "✅ " + action.getDescription(), null);
    }

    private ToolDispatchResult cancel(String userId, Message.ToolCall toolCall,
            ToolInputs.PendingActionReference input) {
        PendingAction action = gateway.cancel(userId, input.pendingId());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("cancelled", true);
        data.put(PENDING_ID, action.getId());
        data.put("action", action.getDescription());
        return success(toolCall, data, "Cancelled: " + action.getDescription(), null);
    }

    // ==================== Results ====================

    private ToolDispatchResult success(Message.ToolCall toolCall, Map<String, Object> data, String summary,
            Map<String, Object> chart) {
        String content = toJson(data);
        return new ToolDispatchResult(toolCall.getId(), toolCall.getName(), ToolResult.success(content, data),
                content, summary, chart);
    }

    /**
     * Builds a failed result for a call that could not be dispatched.
     */
    public ToolDispatchResult failure(Message.ToolCall toolCall, ToolFailureKind kind, String error) {
        Map<String, Object> data = Map.of(ERROR, error);
        ToolResult result = ToolResult.builder()
                .success(false)
                .error(error)
                .failureKind(kind)
                .data(data)
                .build();
        return new ToolDispatchResult(toolCall.getId(), toolCall.getName(), result, toJson(data), "❌ " + error,
                null);
    }

    private Map<String, Object> candidateRow(EntityDomain domain, EntityCandidate candidate) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("option", candidate.option());
        row.put("id", candidate.id());
        row.put("name", candidate.name());
        row.put(domain == EntityDomain.SUBSCRIPTION ? "price" : "spend",
                String.format(Locale.ROOT, "$%.2f", candidate.rankingMetric()));
        return row;
    }

    private String toJson(Map<String, Object> data) {
        String content;
        try {
            content = objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            log.warn("[Tools] Failed to serialize tool result: {}", e.getMessage());
            content = String.valueOf(data);
        }
        return truncateToolResult(content);
    }

    /**
     * Truncate tool result content that exceeds the configured max length.
     */
    private String truncateToolResult(String content) {
        if (maxResultChars <= 0 || content.length() <= maxResultChars) {
            return content;
        }
        String suffix = "\n\n[OUTPUT TRUNCATED: " + content.length() + " chars total, showing first "
                + maxResultChars + " chars.]";
        int cutPoint = Math.max(0, maxResultChars - suffix.length());
        log.warn("[Tools] Truncating result: {} chars -> ~{} chars", content.length(), cutPoint + suffix.length());
        return content.substring(0, cutPoint) + suffix;
    }

    private String sanitizeToolName(String name) {
        if (name == null) {
            return "";
        }
        String sanitized = name.replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Tools] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }

    private static String safeCauseMessage(Throwable e) {
        Throwable current = e;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        String message = current.getMessage();
        return message != null && !message.isBlank() ? message : current.getClass().getSimpleName();
    }
}

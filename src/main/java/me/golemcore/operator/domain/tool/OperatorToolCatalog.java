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

import me.golemcore.operator.domain.model.EntityDomain;
import me.golemcore.operator.domain.model.OperatorTool;
import me.golemcore.operator.domain.model.ToolDefinition;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON schemas and descriptions of the tool catalogue, as sent to the LLM.
 */
@Component
public class OperatorToolCatalog {

    private static final String TYPE = "type";
    private static final String STRING = "string";
    private static final String NUMBER = "number";
    private static final String DESCRIPTION = "description";
    private static final String CONFIRMATION_NOTE = " Requires confirmation: returns a pending_id the operator must"
            + " approve with confirm_action.";

    private final List<ToolDefinition> definitions = Arrays.stream(OperatorTool.values())
            .map(OperatorToolCatalog::definitionOf)
            .toList();

    /**
     * All tool definitions, in catalogue order.
     */
    public List<ToolDefinition> getDefinitions() {
        return definitions;
    }

    static ToolDefinition definitionOf(OperatorTool tool) {
        return switch (tool) {
        case LIST_ENTITIES -> define(tool,
                "List the operator's entities in a domain with their recent spend (or price for subscriptions).",
                Map.of("domain", Map.of(TYPE, STRING,
                        "enum", Arrays.stream(EntityDomain.values()).map(EntityDomain::getWireName).toList(),
                        DESCRIPTION, "Entity domain to list")),
                List.of("domain"));
        case RENDER_CHART -> define(tool,
                "Render a chart inline in the chat. Use for trends, comparisons and KPI summaries.",
                chartProperties(), List.of(TYPE, "title"));
        case PAUSE_META_ADSET -> define(tool, "Pause a Meta ad set." + CONFIRMATION_NOTE,
                targetProperties(EntityDomain.META_AD_SET), List.of());
        case ENABLE_META_ADSET -> define(tool, "Enable (resume) a paused Meta ad set." + CONFIRMATION_NOTE,
                targetProperties(EntityDomain.META_AD_SET), List.of());
        case ADJUST_META_BUDGET -> define(tool,
                "Change a Meta ad set daily budget. Provide exactly one of daily_budget, increase_percent,"
                        + " decrease_percent. Minimum daily budget is $1." + CONFIRMATION_NOTE,
                budgetProperties(EntityDomain.META_AD_SET), List.of());
        case PAUSE_META_CAMPAIGN -> define(tool, "Pause a Meta campaign." + CONFIRMATION_NOTE,
                targetProperties(EntityDomain.META_CAMPAIGN), List.of());
        case ENABLE_META_CAMPAIGN -> define(tool, "Enable (resume) a paused Meta campaign." + CONFIRMATION_NOTE,
                targetProperties(EntityDomain.META_CAMPAIGN), List.of());
        case PAUSE_TIKTOK_ADGROUP -> define(tool, "Pause a TikTok ad group." + CONFIRMATION_NOTE,
                targetProperties(EntityDomain.TIKTOK_AD_GROUP), List.of());
        case ENABLE_TIKTOK_ADGROUP -> define(tool, "Enable (resume) a TikTok ad group." + CONFIRMATION_NOTE,
                targetProperties(EntityDomain.TIKTOK_AD_GROUP), List.of());
        case ADJUST_TIKTOK_BUDGET -> define(tool,
                "Change a TikTok ad group daily budget. Provide exactly one of daily_budget, increase_percent,"
                        + " decrease_percent. Minimum daily budget is $20." + CONFIRMATION_NOTE,
                budgetProperties(EntityDomain.TIKTOK_AD_GROUP), List.of());
        case PAUSE_SUBSCRIPTION -> define(tool, "Pause a customer's recurring subscription." + CONFIRMATION_NOTE,
                targetProperties(EntityDomain.SUBSCRIPTION), List.of());
        case CANCEL_SUBSCRIPTION -> define(tool, "Cancel a customer's recurring subscription." + CONFIRMATION_NOTE,
                withReason(targetProperties(EntityDomain.SUBSCRIPTION)), List.of());
        case CONFIRM_ACTION -> define(tool,
                "Execute a pending action after the operator explicitly approved it.",
                pendingIdProperties(), List.of("pending_id"));
        case CANCEL_ACTION -> define(tool, "Discard a pending action without executing it.",
                pendingIdProperties(), List.of("pending_id"));
        };
    }

    private static ToolDefinition define(OperatorTool tool, String description, Map<String, Object> properties,
            List<String> required) {
        return ToolDefinition.builder()
                .name(tool.getToolName())
                .description(description)
                .inputSchema(Map.of(
                        TYPE, "object",
                        "properties", properties,
                        "required", required))
                .build();
    }

    private static Map<String, Object> targetProperties(EntityDomain domain) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(domain.getIdParameter(), Map.of(TYPE, STRING,
                DESCRIPTION, "Exact " + domain.getLabel() + " id. Preferred when known."));
        properties.put("name", Map.of(TYPE, STRING,
                DESCRIPTION, "Name (or part of the name) of the " + domain.getLabel()));
        return properties;
    }

    private static Map<String, Object> budgetProperties(EntityDomain domain) {
        Map<String, Object> properties = targetProperties(domain);
        properties.put("daily_budget", Map.of(TYPE, NUMBER, DESCRIPTION, "New daily budget in dollars"));
        properties.put("increase_percent", Map.of(TYPE, NUMBER, DESCRIPTION, "Increase the budget by this percent"));
        properties.put("decrease_percent", Map.of(TYPE, NUMBER, DESCRIPTION, "Decrease the budget by this percent"));
        return properties;
    }

    private static Map<String, Object> withReason(Map<String, Object> properties) {
        properties.put("reason", Map.of(TYPE, STRING, DESCRIPTION, "Cancellation reason"));
        return properties;
    }

    private static Map<String, Object> pendingIdProperties() {
        return Map.of("pending_id", Map.of(TYPE, STRING, DESCRIPTION, "Id returned as pending_id when staged"));
    }

    private static Map<String, Object> chartProperties() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(TYPE, Map.of(TYPE, STRING, "enum", ToolInputParser.CHART_TYPES,
                DESCRIPTION, "Chart type"));
        properties.put("title", Map.of(TYPE, STRING, DESCRIPTION, "Chart title"));
        properties.put("data", Map.of(TYPE, "array", DESCRIPTION, "Data points, one object per x value",
                "items", Map.of(TYPE, "object")));
        properties.put("xKey", Map.of(TYPE, STRING, DESCRIPTION, "Field used for the x axis"));
        properties.put("yKeys", Map.of(TYPE, "array", DESCRIPTION, "Fields plotted as series",
                "items", Map.of(TYPE, STRING)));
        properties.put("kpis", Map.of(TYPE, "array", DESCRIPTION, "For kpi charts: label/value/change objects",
                "items", Map.of(TYPE, "object")));
        return properties;
    }
}

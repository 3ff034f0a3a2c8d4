package me.golemcore.operator.domain.confirmation;

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

import me.golemcore.operator.domain.model.BudgetChange;
import me.golemcore.operator.domain.model.OperatorTool;
import me.golemcore.operator.domain.model.OwnedEntity;
import me.golemcore.operator.domain.tool.WriteToolInput;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the human-readable description and the resolved parameters of a
 * staged write action, e.g. {@code Pause Meta ad set 42 "Spring Launch"}.
 */
@Component
public class WriteActionPolicy {

    static final String DEFAULT_CANCEL_REASON = "Cancelled via operator";

    /**
     * Describes the exact effect the action will have once confirmed.
     */
    public String describeAction(OperatorTool tool, OwnedEntity target, WriteToolInput input) {
        String subject = target.domain().getLabel() + " " + target.id() + " \"" + target.name() + "\"";
        return switch (tool) {
        case PAUSE_META_ADSET, PAUSE_META_CAMPAIGN, PAUSE_TIKTOK_ADGROUP, PAUSE_SUBSCRIPTION -> "Pause " + subject;
        case ENABLE_META_ADSET, ENABLE_META_CAMPAIGN, ENABLE_TIKTOK_ADGROUP -> "Enable " + subject;
        case ADJUST_META_BUDGET, ADJUST_TIKTOK_BUDGET -> describeBudget(subject, input.budgetChange());
        case CANCEL_SUBSCRIPTION -> "Cancel " + subject + " (reason: " + reasonOf(input) + ")";
        case LIST_ENTITIES, RENDER_CHART, CONFIRM_ACTION, CANCEL_ACTION -> throw new IllegalArgumentException(
                "Not a write tool: " + tool.getToolName());
        };
    }

    /**
     * Resolved input parameters, keyed the way the tool schema names them.
     */
    public Map<String, Object> parameters(OperatorTool tool, OwnedEntity target, WriteToolInput input) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put(target.domain().getIdParameter(), target.id());
        parameters.put("name", target.name());
        BudgetChange change = input.budgetChange();
        if (change != null) {
            String key = switch (change.kind()) {
            case DAILY_BUDGET -> "daily_budget";
            case INCREASE_PERCENT -> "increase_percent";
            case DECREASE_PERCENT -> "decrease_percent";
            };
            parameters.put(key, change.amount());
        }
        if (tool == OperatorTool.CANCEL_SUBSCRIPTION) {
            parameters.put("reason", reasonOf(input));
        }
        return parameters;
    }

    static String reasonOf(WriteToolInput input) {
        String reason = input.reason();
        return reason != null && !reason.isBlank() ? reason.strip() : DEFAULT_CANCEL_REASON;
    }

    private String describeBudget(String subject, BudgetChange change) {
        return switch (change.kind()) {
        case DAILY_BUDGET -> "Set " + subject + " " + change.describe();
        case INCREASE_PERCENT -> "Increase " + subject + " " + change.describe();
        case DECREASE_PERCENT -> "Decrease " + subject + " " + change.describe();
        };
    }
}

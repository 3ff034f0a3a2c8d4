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

import me.golemcore.operator.domain.model.BudgetChange;
import me.golemcore.operator.domain.model.EntityDomain;
import me.golemcore.operator.domain.model.EntityReference;
import me.golemcore.operator.domain.model.OperatorTool;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses raw LLM tool arguments into typed {@link ToolInput} records.
 */
@Component
public class ToolInputParser {

    static final List<String> CHART_TYPES = List.of("line", "bar", "area", "kpi", "pie");

    private static final double META_MIN_DAILY_BUDGET = 1.0;
    private static final double TIKTOK_MIN_DAILY_BUDGET = 20.0;
    private static final String DAILY_BUDGET = "daily_budget";
    private static final String INCREASE_PERCENT = "increase_percent";
    private static final String DECREASE_PERCENT = "decrease_percent";

    /**
     * @throws ToolValidationException
     *             if the arguments do not satisfy the tool's input schema
     */
    public ToolInput parse(OperatorTool tool, Map<String, Object> arguments) {
        Map<String, Object> args = arguments != null ? arguments : Map.of();
        return switch (tool) {
        case LIST_ENTITIES -> new ToolInputs.ListEntities(domainOf(args));
        case RENDER_CHART -> chartOf(args);
        case PAUSE_META_ADSET, ENABLE_META_ADSET, PAUSE_META_CAMPAIGN, ENABLE_META_CAMPAIGN,
                PAUSE_TIKTOK_ADGROUP, ENABLE_TIKTOK_ADGROUP, PAUSE_SUBSCRIPTION -> new ToolInputs.EntityAction(
                        targetOf(tool.getDomain(), args));
        case ADJUST_META_BUDGET -> new ToolInputs.BudgetAdjustment(targetOf(tool.getDomain(), args),
                budgetChangeOf(args, META_MIN_DAILY_BUDGET));
        case ADJUST_TIKTOK_BUDGET -> new ToolInputs.BudgetAdjustment(targetOf(tool.getDomain(), args),
                budgetChangeOf(args, TIKTOK_MIN_DAILY_BUDGET));
        case CANCEL_SUBSCRIPTION -> new ToolInputs.SubscriptionCancel(targetOf(tool.getDomain(), args),
                stringOf(args.get("reason")));
        case CONFIRM_ACTION, CANCEL_ACTION -> new ToolInputs.PendingActionReference(pendingIdOf(args));
        };
    }

    private EntityDomain domainOf(Map<String, Object> args) {
        String value = stringOf(args.get("domain"));
        return EntityDomain.fromWireName(value)
                .orElseThrow(() -> new ToolValidationException("domain must be one of "
                        + Arrays.stream(EntityDomain.values()).map(EntityDomain::getWireName).toList()));
    }

    private EntityReference targetOf(EntityDomain domain, Map<String, Object> args) {
        EntityReference reference = new EntityReference(stringOf(args.get(domain.getIdParameter())),
                stringOf(args.get("name")));
        if (reference.isEmpty()) {
            throw new ToolValidationException("Provide " + domain.getIdParameter() + " or name");
        }
        return reference;
    }

    private BudgetChange budgetChangeOf(Map<String, Object> args, double minimumDailyBudget) {
        List<BudgetChange> changes = new ArrayList<>();
        Double dailyBudget = numberOf(args, DAILY_BUDGET);
        Double increase = numberOf(args, INCREASE_PERCENT);
        Double decrease = numberOf(args, DECREASE_PERCENT);
        if (dailyBudget != null) {
            if (dailyBudget < minimumDailyBudget) {
                throw new ToolValidationException(String.format(Locale.ROOT,
                        "daily_budget must be at least $%.2f", minimumDailyBudget));
            }
            changes.add(BudgetChange.dailyBudget(dailyBudget));
        }
        if (increase != null) {
            requirePositive(INCREASE_PERCENT, increase);
            changes.add(BudgetChange.increase(increase));
        }
        if (decrease != null) {
            requirePositive(DECREASE_PERCENT, decrease);
            if (decrease >= 100) {
                throw new ToolValidationException("decrease_percent must be below 100");
            }
            changes.add(BudgetChange.decrease(decrease));
        }
        if (changes.size() != 1) {
            throw new ToolValidationException(
                    "Provide exactly one of daily_budget, increase_percent, decrease_percent");
        }
        return changes.get(0);
    }

    private ToolInputs.Chart chartOf(Map<String, Object> args) {
        String type = stringOf(args.get("type"));
        if (type == null || !CHART_TYPES.contains(type)) {
            throw new ToolValidationException("type must be one of " + CHART_TYPES);
        }
        String title = stringOf(args.get("title"));
        if (title == null) {
            throw new ToolValidationException("title is required");
        }
        List<Map<String, Object>> data = new ArrayList<>();
        if (args.get("data") instanceof List<?> rows) {
            for (Object row : rows) {
                if (row instanceof Map<?, ?> map) {
                    Map<String, Object> point = new LinkedHashMap<>();
                    map.forEach((key, value) -> point.put(String.valueOf(key), value));
                    data.add(point);
                }
            }
        }
        if (!"kpi".equals(type) && data.isEmpty()) {
            throw new ToolValidationException("data is required for " + type + " charts");
        }
        Map<String, Object> spec = new LinkedHashMap<>(args);
        spec.put("data", data);
        return new ToolInputs.Chart(type, title, data, spec);
    }

    private String pendingIdOf(Map<String, Object> args) {
        String pendingId = stringOf(args.get("pending_id"));
        if (pendingId == null) {
            throw new ToolValidationException("pending_id is required");
        }
        return pendingId;
    }

    private Double numberOf(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (value == null) {
            return null;
        }
        double number;
        if (value instanceof Number n) {
            number = n.doubleValue();
        } else {
            try {
                number = Double.parseDouble(value.toString().strip().replace("$", "").replace("%", ""));
            } catch (NumberFormatException e) {
                throw new ToolValidationException(key + " must be a number");
            }
        }
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            throw new ToolValidationException(key + " must be a number");
        }
        return number;
    }

    private void requirePositive(String key, double value) {
        if (value <= 0) {
            throw new ToolValidationException(key + " must be positive");
        }
    }

    /**
     * Strings are stripped; numbers become their plain decimal form so that an id
     * sent as 42 or 42.0 matches "42".
     */
    static String stringOf(Object value) {
        if (value == null) {
            return null;
        }
        String text;
        if (value instanceof Number number) {
            text = new BigDecimal(number.toString()).stripTrailingZeros().toPlainString();
        } else {
            text = value.toString().strip();
        }
        return text.isEmpty() ? null : text;
    }
}

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

import java.util.List;
import java.util.Map;

/**
 * Input records of the tool catalogue.
 */
public final class ToolInputs {

    private ToolInputs() {
    }

    /**
     * {@code list_entities}.
     */
    public record ListEntities(EntityDomain domain) implements ToolInput {
    }

    /**
     * {@code render_chart}. The spec is forwarded to the client as-is.
     */
    public record Chart(String type, String title, List<Map<String, Object>> data, Map<String, Object> spec)
            implements ToolInput {
    }

    /**
     * Pause and enable tools.
     */
    public record EntityAction(EntityReference target) implements WriteToolInput {
    }

    /**
     * Budget adjustment tools.
     */
    public record BudgetAdjustment(EntityReference target, BudgetChange budgetChange) implements WriteToolInput {
    }

    /**
     * {@code cancel_subscription}.
     */
    public record SubscriptionCancel(EntityReference target, String reason) implements WriteToolInput {
    }

    /**
     * {@code confirm_action} and {@code cancel_action}.
     */
    public record PendingActionReference(String pendingId) implements ToolInput {
    }
}

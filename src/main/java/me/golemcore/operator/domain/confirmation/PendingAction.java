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
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * A staged write action awaiting explicit confirmation. Instances are
 * immutable; state changes produce a new instance through the store.
 */
@Value
@Builder(toBuilder = true)
public class PendingAction {

    String id;
    String userId;
    OperatorTool tool;
    OwnedEntity target;
    BudgetChange budgetChange;
    String reason;
    String description;

    // Resolved parameters as shown to the LLM
    Map<String, Object> parameters;

    Instant createdAt;
    Instant expiresAt;
    PendingActionState state;
    Instant resolvedAt;
    String executionError;

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isPending() {
        return state == PendingActionState.PENDING_CONFIRMATION;
    }
}

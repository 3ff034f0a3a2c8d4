package me.golemcore.operator.port.outbound;

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
import me.golemcore.operator.domain.model.OwnedEntity;
import me.golemcore.operator.domain.model.PlatformActionResult;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Port for an advertising platform (Meta, TikTok). Calls are remote and
 * fallible; failures complete the returned future exceptionally and are never
 * retried by the caller.
 */
public interface AdPlatformPort {

    /**
     * Returns the platform identifier (e.g., "meta", "tiktok").
     */
    String getPlatformId();

    /**
     * Entity domains this platform serves.
     */
    Set<EntityDomain> getSupportedDomains();

    /**
     * Lists the user's entities of the given domain with their ranking metric.
     */
    CompletableFuture<List<OwnedEntity>> listEntities(String userId, EntityDomain domain);

    CompletableFuture<PlatformActionResult> pause(String userId, EntityDomain domain, String entityId);

    CompletableFuture<PlatformActionResult> enable(String userId, EntityDomain domain, String entityId);

    /**
     * Changes the daily budget. Percentage changes are applied to the budget
     * read from the platform at execution time.
     */
    CompletableFuture<PlatformActionResult> adjustBudget(String userId, EntityDomain domain, String entityId,
            BudgetChange change);
}

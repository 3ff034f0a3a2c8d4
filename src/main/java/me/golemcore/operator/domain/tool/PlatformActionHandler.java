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

import me.golemcore.operator.domain.confirmation.PendingAction;
import me.golemcore.operator.domain.confirmation.PendingActionHandler;
import me.golemcore.operator.domain.model.EntityDomain;
import me.golemcore.operator.domain.model.PlatformActionResult;
import me.golemcore.operator.domain.resolution.EntityDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Executes confirmed write actions against the owning platform. Only the
 * {@link me.golemcore.operator.domain.confirmation.ConfirmationGateway} calls
 * this handler.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PlatformActionHandler implements PendingActionHandler {

    private final EntityDirectory directory;

    @Override
    public CompletableFuture<PlatformActionResult> execute(PendingAction action) {
        String userId = action.getUserId();
        String entityId = action.getTarget().id();
        EntityDomain domain = action.getTarget().domain();
        log.debug("[Tools] Executing {} on {} {}", action.getTool().getToolName(), domain, entityId);

        return switch (action.getTool()) {
        case PAUSE_META_ADSET, PAUSE_META_CAMPAIGN, PAUSE_TIKTOK_ADGROUP -> directory.adPlatformFor(domain)
                .pause(userId, domain, entityId);
        case ENABLE_META_ADSET, ENABLE_META_CAMPAIGN, ENABLE_TIKTOK_ADGROUP -> directory.adPlatformFor(domain)
                .enable(userId, domain, entityId);
        case ADJUST_META_BUDGET, ADJUST_TIKTOK_BUDGET -> directory.adPlatformFor(domain)
                .adjustBudget(userId, domain, entityId, action.getBudgetChange());
        case PAUSE_SUBSCRIPTION -> directory.checkoutPlatform().pauseSubscription(userId, entityId);
        case CANCEL_SUBSCRIPTION -> directory.checkoutPlatform().cancelSubscription(userId, entityId,
                action.getReason());
        case LIST_ENTITIES, RENDER_CHART, CONFIRM_ACTION, CANCEL_ACTION -> CompletableFuture.failedFuture(
                new IllegalStateException("Not a write tool: " + action.getTool().getToolName()));
        };
    }
}

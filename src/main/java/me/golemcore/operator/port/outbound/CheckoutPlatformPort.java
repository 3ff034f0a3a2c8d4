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

import me.golemcore.operator.domain.model.OwnedEntity;
import me.golemcore.operator.domain.model.PlatformActionResult;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for a checkout platform managing recurring subscriptions.
 */
public interface CheckoutPlatformPort {

    /**
     * Lists the user's active subscriptions, ranked by price.
     */
    CompletableFuture<List<OwnedEntity>> listSubscriptions(String userId);

    CompletableFuture<PlatformActionResult> pauseSubscription(String userId, String purchaseId);

    CompletableFuture<PlatformActionResult> cancelSubscription(String userId, String purchaseId, String reason);
}

package me.golemcore.operator.domain.resolution;

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
import me.golemcore.operator.domain.model.OwnedEntity;
import me.golemcore.operator.port.outbound.AdPlatformPort;
import me.golemcore.operator.port.outbound.CheckoutPlatformPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Routes entity domains to the platform adapter that owns them.
 *
 * <p>
 * Ad platforms are indexed by the domains they declare; subscriptions always go
 * to the checkout platform.
 */
@Component
@Slf4j
public class EntityDirectory {

    private final Map<EntityDomain, AdPlatformPort> adPlatformsByDomain = new EnumMap<>(EntityDomain.class);
    private final CheckoutPlatformPort checkoutPlatform;

    public EntityDirectory(List<AdPlatformPort> adPlatforms, CheckoutPlatformPort checkoutPlatform) {
        this.checkoutPlatform = checkoutPlatform;
        for (AdPlatformPort platform : adPlatforms) {
            for (EntityDomain domain : platform.getSupportedDomains()) {
                AdPlatformPort previous = adPlatformsByDomain.put(domain, platform);
                if (previous != null) {
                    log.warn("[Entities] {} served by both {} and {}, using {}", domain,
                            previous.getPlatformId(), platform.getPlatformId(), platform.getPlatformId());
                }
            }
            log.debug("[Entities] Registered ad platform: {} {}", platform.getPlatformId(),
                    platform.getSupportedDomains());
        }
    }

    /**
     * Lists the user's entities in a domain. Blocks until the platform answers;
     * platform failures propagate as {@link java.util.concurrent.CompletionException}.
     */
    public List<OwnedEntity> listOwned(String userId, EntityDomain domain) {
        CompletableFuture<List<OwnedEntity>> future = switch (domain) {
        case META_AD_SET, META_CAMPAIGN, TIKTOK_AD_GROUP -> adPlatformFor(domain).listEntities(userId, domain);
        case SUBSCRIPTION -> checkoutPlatform.listSubscriptions(userId);
        };
        List<OwnedEntity> entities = future.join();
        return entities != null ? entities : List.of();
    }

    public AdPlatformPort adPlatformFor(EntityDomain domain) {
        AdPlatformPort platform = adPlatformsByDomain.get(domain);
        if (platform == null) {
            throw new IllegalStateException("No ad platform connected for " + domain.getLabel());
        }
        return platform;
    }

    public CheckoutPlatformPort checkoutPlatform() {
        return checkoutPlatform;
    }
}

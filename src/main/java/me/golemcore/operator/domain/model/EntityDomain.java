package me.golemcore.operator.domain.model;

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

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of platform entities an operator owns and can act on.
 */
public enum EntityDomain {

    META_AD_SET("meta_adset", "Meta ad set", "adset_id"),
    META_CAMPAIGN("meta_campaign", "Meta campaign", "campaign_id"),
    TIKTOK_AD_GROUP("tiktok_adgroup", "TikTok ad group", "adgroup_id"),
    SUBSCRIPTION("subscription", "subscription", "purchase_id");

    private final String wireName;
    private final String label;
    private final String idParameter;

    EntityDomain(String wireName, String label, String idParameter) {
        this.wireName = wireName;
        this.label = label;
        this.idParameter = idParameter;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Human-readable name used in action descriptions.
     */
    public String getLabel() {
        return label;
    }

    /**
     * Name of the tool parameter carrying the entity id.
     */
    public String getIdParameter() {
        return idParameter;
    }

    public static Optional<EntityDomain> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(domain -> domain.wireName.equals(normalized))
                .findFirst();
    }
}

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
import java.util.Optional;

/**
 * The closed catalogue of tools the LLM may call. Adding a tool means adding a
 * constant here; every switch over this enum then has to handle it.
 */
public enum OperatorTool {

    LIST_ENTITIES("list_entities", ToolSideEffect.READ, null),
    RENDER_CHART("render_chart", ToolSideEffect.READ, null),

    PAUSE_META_ADSET("pause_meta_adset", ToolSideEffect.WRITE, EntityDomain.META_AD_SET),
    ENABLE_META_ADSET("enable_meta_adset", ToolSideEffect.WRITE, EntityDomain.META_AD_SET),
    ADJUST_META_BUDGET("adjust_meta_budget", ToolSideEffect.WRITE, EntityDomain.META_AD_SET),
    PAUSE_META_CAMPAIGN("pause_meta_campaign", ToolSideEffect.WRITE, EntityDomain.META_CAMPAIGN),
    ENABLE_META_CAMPAIGN("enable_meta_campaign", ToolSideEffect.WRITE, EntityDomain.META_CAMPAIGN),

    PAUSE_TIKTOK_ADGROUP("pause_tiktok_adgroup", ToolSideEffect.WRITE, EntityDomain.TIKTOK_AD_GROUP),
    ENABLE_TIKTOK_ADGROUP("enable_tiktok_adgroup", ToolSideEffect.WRITE, EntityDomain.TIKTOK_AD_GROUP),
    ADJUST_TIKTOK_BUDGET("adjust_tiktok_budget", ToolSideEffect.WRITE, EntityDomain.TIKTOK_AD_GROUP),

    PAUSE_SUBSCRIPTION("pause_subscription", ToolSideEffect.WRITE, EntityDomain.SUBSCRIPTION),
    CANCEL_SUBSCRIPTION("cancel_subscription", ToolSideEffect.WRITE, EntityDomain.SUBSCRIPTION),

    CONFIRM_ACTION("confirm_action", ToolSideEffect.CONFIRMATION, null),
    CANCEL_ACTION("cancel_action", ToolSideEffect.CONFIRMATION, null);

    private final String toolName;
    private final ToolSideEffect sideEffect;
    private final EntityDomain domain;

    OperatorTool(String toolName, ToolSideEffect sideEffect, EntityDomain domain) {
        this.toolName = toolName;
        this.sideEffect = sideEffect;
        this.domain = domain;
    }

    /**
     * Name the LLM uses to call the tool.
     */
    public String getToolName() {
        return toolName;
    }

    public ToolSideEffect getSideEffect() {
        return sideEffect;
    }

    /**
     * Target entity domain of a write tool, null for other tools.
     */
    public EntityDomain getDomain() {
        return domain;
    }

    public boolean isWrite() {
        return sideEffect == ToolSideEffect.WRITE;
    }

    public static Optional<OperatorTool> fromToolName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(tool -> tool.toolName.equals(name))
                .findFirst();
    }
}

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

/**
 * An entity owned by the operator on a platform, as listed by the platform
 * adapter.
 *
 * @param id
 *            canonical platform id
 * @param name
 *            display name
 * @param domain
 *            entity kind
 * @param rankingMetric
 *            disambiguation metric (recent spend, budget or price)
 * @param status
 *            platform status, may be null
 */
public record OwnedEntity(String id, String name, EntityDomain domain, double rankingMetric, String status) {
}

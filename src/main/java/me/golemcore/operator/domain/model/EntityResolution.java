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

import java.util.List;

/**
 * Outcome of resolving a free-text entity reference.
 */
public record EntityResolution(Status status, OwnedEntity entity, List<EntityCandidate> candidates) {

    public enum Status {
        RESOLVED, AMBIGUOUS, NOT_FOUND
    }

    public static EntityResolution resolved(OwnedEntity entity) {
        return new EntityResolution(Status.RESOLVED, entity, List.of());
    }

    public static EntityResolution ambiguous(List<EntityCandidate> candidates) {
        return new EntityResolution(Status.AMBIGUOUS, null, List.copyOf(candidates));
    }

    public static EntityResolution notFound() {
        return new EntityResolution(Status.NOT_FOUND, null, List.of());
    }

    public boolean isResolved() {
        return status == Status.RESOLVED;
    }
}

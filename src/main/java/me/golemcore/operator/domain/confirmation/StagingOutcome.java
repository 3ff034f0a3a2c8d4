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

import me.golemcore.operator.domain.model.EntityCandidate;

import java.util.List;

/**
 * Result of staging a write action: either a new pending action, or the
 * candidates the LLM should choose from.
 *
 * @param action
 *            staged action, null when the target did not resolve
 * @param ambiguous
 *            true when several entities matched
 * @param candidates
 *            ranked matches, or the user's top entities when nothing matched
 */
public record StagingOutcome(PendingAction action, boolean ambiguous, List<EntityCandidate> candidates) {

    public static StagingOutcome staged(PendingAction action) {
        return new StagingOutcome(action, false, List.of());
    }

    public static StagingOutcome unresolved(boolean ambiguous, List<EntityCandidate> candidates) {
        return new StagingOutcome(null, ambiguous, List.copyOf(candidates));
    }

    public boolean isStaged() {
        return action != null;
    }
}

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

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Store of active pending actions, owned by the {@link ConfirmationGateway}.
 *
 * <p>
 * All state changes go through {@link #transition}, a per-id check-and-set:
 * when several callers race on the same id, at most one of them observes a
 * successful transition.
 */
public interface PendingActionStore {

    /**
     * Adds a new action. Ids are unique; saving an existing id is an error.
     */
    void save(PendingAction action);

    Optional<PendingAction> find(String id);

    List<PendingAction> findAll();

    /**
     * Atomically moves an action from {@code expected} to {@code target}.
     *
     * @param id
     *            action id
     * @param expected
     *            state the action must currently be in
     * @param target
     *            new state
     * @param guard
     *            extra condition evaluated inside the atomic section
     * @param at
     *            transition timestamp
     * @return the action in its new state, or empty if the action is missing, is
     *         not in {@code expected}, or is rejected by the guard
     */
    Optional<PendingAction> transition(String id, PendingActionState expected, PendingActionState target,
            Predicate<PendingAction> guard, Instant at);

    /**
     * Removes an action from the active set.
     */
    void remove(String id);
}

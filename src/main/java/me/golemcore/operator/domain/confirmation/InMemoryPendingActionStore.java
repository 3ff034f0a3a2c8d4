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

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * {@link PendingActionStore} backed by a {@link ConcurrentHashMap}. Transitions
 * run inside {@link ConcurrentHashMap#computeIfPresent}, which is atomic per
 * key.
 */
@Component
public class InMemoryPendingActionStore implements PendingActionStore {

    private final Map<String, PendingAction> actions = new ConcurrentHashMap<>();

    @Override
    public void save(PendingAction action) {
        PendingAction existing = actions.putIfAbsent(action.getId(), action);
        if (existing != null) {
            throw new IllegalStateException("Pending action already exists: " + action.getId());
        }
    }

    @Override
    public Optional<PendingAction> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(actions.get(id));
    }

    @Override
    public List<PendingAction> findAll() {
        List<PendingAction> all = new ArrayList<>(actions.values());
        all.sort(Comparator.comparing(PendingAction::getCreatedAt));
        return all;
    }

    @Override
    public Optional<PendingAction> transition(String id, PendingActionState expected, PendingActionState target,
            Predicate<PendingAction> guard, Instant at) {
        if (id == null) {
            return Optional.empty();
        }
        AtomicReference<PendingAction> transitioned = new AtomicReference<>();
        actions.computeIfPresent(id, (key, current) -> {
            if (current.getState() != expected || !guard.test(current)) {
                return current;
            }
            PendingAction next = current.toBuilder()
                    .state(target)
                    .resolvedAt(at)
                    .build();
            transitioned.set(next);
            return next;
        });
        return Optional.ofNullable(transitioned.get());
    }

    @Override
    public void remove(String id) {
        if (id != null) {
            actions.remove(id);
        }
    }
}

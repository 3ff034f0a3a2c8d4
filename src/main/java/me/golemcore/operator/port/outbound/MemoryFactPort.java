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

import me.golemcore.operator.domain.model.MemoryFact;

import java.util.List;
import java.util.Optional;

/**
 * Port for the operator's long-term memory facts.
 */
public interface MemoryFactPort {

    /**
     * Appends a fact. Returns empty when the fact was skipped as a duplicate.
     */
    Optional<MemoryFact> append(String ownerId, String text);

    /**
     * Returns up to {@code limit} most recent facts, oldest first.
     */
    List<MemoryFact> recent(String ownerId, int limit);
}

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

import me.golemcore.operator.domain.model.EntityCandidate;
import me.golemcore.operator.domain.model.EntityReference;
import me.golemcore.operator.domain.model.EntityResolution;
import me.golemcore.operator.domain.model.OwnedEntity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Maps an LLM-supplied entity reference to one of the user's owned entities.
 *
 * <p>
 * Resolution order:
 * <ol>
 * <li>exact id match</li>
 * <li>case-insensitive exact name match</li>
 * <li>case-insensitive substring match on names; when only an id was given,
 * substring hits on ids and names are returned as candidates and never
 * resolved</li>
 * </ol>
 * A step that matches several entities stops resolution and returns them as
 * ranked candidates. Ties are never broken silently.
 */
@Component
public class EntityResolver {

    private static final Comparator<OwnedEntity> BY_RANKING = Comparator
            .comparingDouble(OwnedEntity::rankingMetric).reversed()
            .thenComparing(entity -> entity.name() != null ? entity.name() : "")
            .thenComparing(OwnedEntity::id);

    public EntityResolution resolve(List<OwnedEntity> owned, EntityReference reference) {
        String id = normalize(reference.id());
        String name = normalize(reference.name());
        if (id == null && name == null) {
            return EntityResolution.notFound();
        }

        if (id != null) {
            for (OwnedEntity entity : owned) {
                if (id.equalsIgnoreCase(entity.id())) {
                    return EntityResolution.resolved(entity);
                }
            }
        }

        if (name != null) {
            List<OwnedEntity> exact = owned.stream()
                    .filter(entity -> entity.name() != null && entity.name().strip().equalsIgnoreCase(name))
                    .toList();
            if (!exact.isEmpty()) {
                return fromMatches(exact);
            }
        }

        if (name == null) {
            // An id that is not exact only yields candidates, even a single one
            String needle = id.toLowerCase(Locale.ROOT);
            List<OwnedEntity> partial = owned.stream()
                    .filter(entity -> contains(entity.id(), needle) || contains(entity.name(), needle))
                    .toList();
            return partial.isEmpty() ? EntityResolution.notFound()
                    : EntityResolution.ambiguous(rank(partial, partial.size()));
        }

        String needle = name.toLowerCase(Locale.ROOT);
        List<OwnedEntity> partial = owned.stream()
                .filter(entity -> contains(entity.name(), needle))
                .toList();
        return fromMatches(partial);
    }

    /**
     * Ranks entities by descending metric and numbers them from 1.
     */
    public List<EntityCandidate> rank(List<OwnedEntity> entities, int limit) {
        List<OwnedEntity> sorted = new ArrayList<>(entities);
        sorted.sort(BY_RANKING);
        List<EntityCandidate> candidates = new ArrayList<>();
        for (int i = 0; i < sorted.size() && i < limit; i++) {
            OwnedEntity entity = sorted.get(i);
            candidates.add(new EntityCandidate(i + 1, entity.id(), entity.name(), entity.rankingMetric()));
        }
        return candidates;
    }

    private EntityResolution fromMatches(List<OwnedEntity> matches) {
        if (matches.isEmpty()) {
            return EntityResolution.notFound();
        }
        if (matches.size() == 1) {
            return EntityResolution.resolved(matches.get(0));
        }
        return EntityResolution.ambiguous(rank(matches, matches.size()));
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static String normalize(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.strip();
    }
}

package me.golemcore.operator.domain.service;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.operator.domain.model.MemoryFact;
import me.golemcore.operator.infrastructure.config.OperatorProperties;
import me.golemcore.operator.port.outbound.MemoryFactPort;
import me.golemcore.operator.port.outbound.StoragePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only store of memory facts, one JSONL file per user under
 * {@code memory/{owner}.jsonl}.
 *
 * <p>
 * With deduplication enabled, a fact whose normalized text (trimmed,
 * lower-cased, whitespace collapsed) equals an existing fact of the same user
 * is skipped.
 */
@Service
@Slf4j
public class MemoryFactService implements MemoryFactPort {

    private static final String EXTENSION = ".jsonl";
    private static final int LOCK_STRIPES = 16;

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final OperatorProperties.MemoryProperties settings;
    private final String directory;
    private final Object[] locks = new Object[LOCK_STRIPES];

    public MemoryFactService(StoragePort storagePort, ObjectMapper objectMapper, Clock clock,
            OperatorProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.settings = properties.getMemory();
        this.directory = properties.getStorage().getMemoryDirectory();
        for (int i = 0; i < locks.length; i++) {
            locks[i] = new Object();
        }
    }

    @Override
    public Optional<MemoryFact> append(String ownerId, String text) {
        String owner = StorageKeyValidator.requireValidKey(ownerId, "userId");
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        synchronized (locks[Math.floorMod(owner.hashCode(), locks.length)]) {
            if (settings.isDeduplicate() && isDuplicate(owner, trimmed)) {
                log.debug("[Memory] Skipping duplicate fact for {}", owner);
                return Optional.empty();
            }
            MemoryFact fact = MemoryFact.builder()
                    .id(UUID.randomUUID().toString())
                    .ownerId(owner)
                    .text(trimmed)
                    .createdAt(clock.instant())
                    .build();
            storagePort.appendText(directory, owner + EXTENSION, toJson(fact) + "\n").join();
            return Optional.of(fact);
        }
    }

    @Override
    public List<MemoryFact> recent(String ownerId, int limit) {
        String owner = StorageKeyValidator.requireValidKey(ownerId, "userId");
        List<MemoryFact> facts = readAll(owner);
        if (limit <= 0) {
            return List.of();
        }
        if (facts.size() <= limit) {
            return facts;
        }
        return new ArrayList<>(facts.subList(facts.size() - limit, facts.size()));
    }

    static String normalize(String text) {
        return text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private boolean isDuplicate(String owner, String text) {
        String normalized = normalize(text);
        return readAll(owner).stream()
                .anyMatch(fact -> fact.getText() != null && normalize(fact.getText()).equals(normalized));
    }

    private List<MemoryFact> readAll(String owner) {
        String content = storagePort.getText(directory, owner + EXTENSION).join();
        List<MemoryFact> facts = new ArrayList<>();
        if (content == null || content.isBlank()) {
            return facts;
        }
        for (String line : content.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                facts.add(objectMapper.readValue(line, MemoryFact.class));
            } catch (IOException e) {
                log.trace("[Memory] Skipping invalid memory jsonl line: {}", e.getMessage());
            }
        }
        return facts;
    }

    private String toJson(MemoryFact fact) {
        try {
            return objectMapper.writeValueAsString(fact);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize memory fact", e);
        }
    }
}

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
import me.golemcore.operator.domain.model.Conversation;
import me.golemcore.operator.domain.model.Message;
import me.golemcore.operator.infrastructure.config.OperatorProperties;
import me.golemcore.operator.port.outbound.ConversationPort;
import me.golemcore.operator.port.outbound.StoragePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Stores conversations as a JSON header plus an append-only JSONL message log:
 * <ul>
 * <li>conversations/{owner}/{id}.json - header (title, timestamps)</li>
 * <li>conversations/{owner}/{id}.messages.jsonl - one message per line</li>
 * </ul>
 * Writes to one conversation are serialized on a lock picked from a fixed set
 * of stripes by conversation id.
 */
@Service
@Slf4j
public class ConversationService implements ConversationPort {

    private static final String HEADER_EXTENSION = ".json";
    private static final String MESSAGES_EXTENSION = ".messages.jsonl";
    private static final int LOCK_STRIPES = 64;

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String directory;
    private final Object[] locks = new Object[LOCK_STRIPES];

    public ConversationService(StoragePort storagePort, ObjectMapper objectMapper, Clock clock,
            OperatorProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.directory = properties.getStorage().getConversationsDirectory();
        for (int i = 0; i < locks.length; i++) {
            locks[i] = new Object();
        }
    }

    @Override
    public Conversation create(String ownerId, String title) {
        String owner = StorageKeyValidator.requireValidKey(ownerId, "userId");
        Instant now = clock.instant();
        Conversation conversation = Conversation.builder()
                .id(UUID.randomUUID().toString())
                .ownerId(owner)
                .title(Conversation.titleFrom(title))
                .createdAt(now)
                .updatedAt(now)
                .build();
        writeHeader(conversation);
        log.info("[Conversations] Created conversation {} for {}", conversation.getId(), owner);
        return conversation;
    }

    @Override
    public Optional<Conversation> find(String ownerId, String conversationId) {
        String owner = StorageKeyValidator.requireValidKey(ownerId, "userId");
        if (!StorageKeyValidator.isValidKey(conversationId)) {
            return Optional.empty();
        }
        return readHeader(owner + "/" + conversationId + HEADER_EXTENSION);
    }

    @Override
    public List<Conversation> list(String ownerId) {
        String owner = StorageKeyValidator.requireValidKey(ownerId, "userId");
        List<Conversation> conversations = new ArrayList<>();
        try {
            List<String> files = storagePort.listObjects(directory, owner).join();
            for (String file : files) {
                if (file.endsWith(HEADER_EXTENSION)) {
                    readHeader(file).ifPresent(conversations::add);
                }
            }
        } catch (RuntimeException e) {
            log.warn("[Conversations] Failed to scan conversations of {}: {}", owner, e.getMessage());
        }
        conversations.sort(StorageKeyValidator.byRecentActivity());
        return conversations;
    }

    @Override
    public void append(Conversation conversation, List<Message> messages) {
        if (messages == null || messages.isEmpty()) {
            return;
        }
        StringBuilder payload = new StringBuilder();
        for (Message message : messages) {
            payload.append(toJson(message)).append('\n');
        }
        synchronized (lockFor(conversation.getId())) {
            storagePort.appendText(directory, messagesPath(conversation), payload.toString()).join();
            conversation.setUpdatedAt(clock.instant());
            writeHeader(conversation);
        }
        log.debug("[Conversations] Appended {} messages to conversation {}", messages.size(), conversation.getId());
    }

    @Override
    public List<Message> messages(Conversation conversation) {
        String content = storagePort.getText(directory, messagesPath(conversation)).join();
        List<Message> messages = new ArrayList<>();
        if (content == null || content.isBlank()) {
            return messages;
        }
        for (String line : content.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                messages.add(objectMapper.readValue(line, Message.class));
            } catch (IOException e) {
                log.warn("[Conversations] Skipping unreadable message line in conversation {}: {}",
                        conversation.getId(), e.getMessage());
            }
        }
        return messages;
    }

    @Override
    public boolean delete(String ownerId, String conversationId) {
        Optional<Conversation> existing = find(ownerId, conversationId);
        if (existing.isEmpty()) {
            return false;
        }
        Conversation conversation = existing.get();
        synchronized (lockFor(conversation.getId())) {
            storagePort.deleteObject(directory, messagesPath(conversation)).join();
            storagePort.deleteObject(directory, headerPath(conversation)).join();
        }
        log.info("[Conversations] Deleted conversation {}", conversation.getId());
        return true;
    }

    private Optional<Conversation> readHeader(String path) {
        String json = storagePort.getText(directory, path).join();
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, Conversation.class));
        } catch (IOException e) {
            log.warn("[Conversations] Failed to parse conversation header {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeHeader(Conversation conversation) {
        storagePort.putTextAtomic(directory, headerPath(conversation), toJson(conversation)).join();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    // Visible for testing
    Object lockFor(String conversationId) {
        return locks[Math.floorMod(conversationId.hashCode(), locks.length)];
    }

    private String headerPath(Conversation conversation) {
        return conversation.getOwnerId() + "/" + conversation.getId() + HEADER_EXTENSION;
    }

    private String messagesPath(Conversation conversation) {
        return conversation.getOwnerId() + "/" + conversation.getId() + MESSAGES_EXTENSION;
    }
}

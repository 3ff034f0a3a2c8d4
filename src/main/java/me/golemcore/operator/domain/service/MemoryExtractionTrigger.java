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

import me.golemcore.operator.domain.model.Conversation;
import me.golemcore.operator.domain.model.Message;
import me.golemcore.operator.infrastructure.config.OperatorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Counts conversational messages per conversation and fires memory extraction
 * on every N-th one.
 *
 * <p>
 * Only user text and final assistant answers count; tool-call and tool-result
 * bundles do not. Counters live in memory and restart from zero. Only the
 * most recently active conversations are tracked; an evicted conversation
 * starts counting again from zero.
 */
@Component
@Slf4j
public class MemoryExtractionTrigger {

    private final MemoryExtractionService extractionService;
    private final Executor executor;
    private final OperatorProperties.MemoryProperties settings;
    private final Map<String, Integer> counters;

    public MemoryExtractionTrigger(MemoryExtractionService extractionService,
            @Qualifier("memoryExtractionExecutor") Executor executor, OperatorProperties properties) {
        this.extractionService = extractionService;
        this.executor = executor;
        this.settings = properties.getMemory();
        int maxTracked = Math.max(1, settings.getMaxTrackedConversations());
        this.counters = Collections.synchronizedMap(new LinkedHashMap<String, Integer>(16, 0.75f, true) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Integer> eldest) {
                return size() > maxTracked;
            }
        });
    }

    /**
     * Records appended messages.
     *
     * @return true if an extraction was scheduled
     */
    public boolean onAppended(Conversation conversation, List<Message> appended) {
        if (!settings.isEnabled() || appended == null || appended.isEmpty()) {
            return false;
        }
        int every = Math.max(1, settings.getExtractEvery());
        boolean fire = false;
        synchronized (counters) {
            int count = counters.getOrDefault(conversation.getId(), 0);
            for (Message message : appended) {
                if (isConversational(message) && ++count % every == 0) {
                    fire = true;
                }
            }
            counters.put(conversation.getId(), count);
        }
        if (!fire) {
            return false;
        }

        try {
            executor.execute(() -> extractionService.extract(conversation));
            log.debug("[Memory] Extraction scheduled for conversation {}", conversation.getId());
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("[Memory] Extraction rejected for conversation {}: {}", conversation.getId(), e.getMessage());
            return false;
        }
    }

    public void forget(String conversationId) {
        counters.remove(conversationId);
    }

    // Visible for testing
    int count(String conversationId) {
        return counters.getOrDefault(conversationId, 0);
    }

    static boolean isConversational(Message message) {
        return message != null && !message.hasToolCalls() && !message.hasToolResults()
                && message.getContent() != null && !message.getContent().isBlank();
    }
}

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

import me.golemcore.operator.domain.model.Conversation;
import me.golemcore.operator.domain.model.Message;

import java.util.List;
import java.util.Optional;

/**
 * Port for conversation persistence. Messages of a conversation form an
 * append-only sequence; appends to the same conversation are serialized so
 * the stored order is the append order.
 */
public interface ConversationPort {

    Conversation create(String ownerId, String title);

    /**
     * Finds a conversation owned by the given user.
     */
    Optional<Conversation> find(String ownerId, String conversationId);

    /**
     * Lists the user's conversations, most recently updated first.
     */
    List<Conversation> list(String ownerId);

    /**
     * Appends messages in the given order and touches the conversation's
     * updated timestamp.
     */
    void append(Conversation conversation, List<Message> messages);

    /**
     * Returns all messages of the conversation in append order.
     */
    List<Message> messages(Conversation conversation);

    boolean delete(String ownerId, String conversationId);
}

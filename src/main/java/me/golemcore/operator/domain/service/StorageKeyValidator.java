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

import java.util.Comparator;
import java.util.regex.Pattern;

/**
 * Validation helpers for user and conversation ids that become storage path
 * segments.
 *
 * <p>
 * Contract: {@code ^[a-zA-Z0-9_@-][a-zA-Z0-9_.@-]{0,63}$}, without
 * {@code ".."}.
 */
public final class StorageKeyValidator {

    private static final Pattern KEY_PATTERN = Pattern.compile("^[a-zA-Z0-9_@-][a-zA-Z0-9_.@-]{0,63}$");

    private StorageKeyValidator() {
    }

    public static boolean isValidKey(String value) {
        return value != null && KEY_PATTERN.matcher(value).matches() && !value.contains("..");
    }

    public static String requireValidKey(String value, String label) {
        String candidate = value != null ? value.trim() : null;
        if (!isValidKey(candidate)) {
            throw new IllegalArgumentException(label + " must match ^[a-zA-Z0-9_@-][a-zA-Z0-9_.@-]{0,63}$");
        }
        return candidate;
    }

    /**
     * Shared ordering for conversation lists by last activity timestamp.
     */
    public static Comparator<Conversation> byRecentActivity() {
        return Comparator.comparing(
                (Conversation conversation) -> conversation.getUpdatedAt() != null ? conversation.getUpdatedAt()
                        : conversation.getCreatedAt(),
                Comparator.nullsLast(Comparator.reverseOrder()));
    }
}

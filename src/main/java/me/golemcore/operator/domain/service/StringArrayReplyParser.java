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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the first {@code [...]} block of an LLM reply as a JSON array of
 * strings. Blank and non-string entries are dropped.
 */
final class StringArrayReplyParser {

    private static final Pattern ARRAY_PATTERN = Pattern.compile("\\[[\\s\\S]*\\]");
    private static final TypeReference<List<Object>> LIST_TYPE_REF = new TypeReference<>() {
    };

    private StringArrayReplyParser() {
    }

    static List<String> parse(ObjectMapper objectMapper, String reply) throws JsonProcessingException {
        if (reply == null) {
            return List.of();
        }
        Matcher matcher = ARRAY_PATTERN.matcher(reply);
        if (!matcher.find()) {
            return List.of();
        }
        List<Object> raw = objectMapper.readValue(matcher.group(), LIST_TYPE_REF);
        List<String> values = new ArrayList<>();
        for (Object item : raw) {
            if (item instanceof String text && !text.isBlank()) {
                values.add(text.trim());
            }
        }
        return values;
    }
}

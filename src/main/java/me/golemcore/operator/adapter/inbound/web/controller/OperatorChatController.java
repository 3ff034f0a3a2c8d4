package me.golemcore.operator.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.operator.adapter.inbound.web.dto.ChatRequest;
import me.golemcore.operator.domain.service.OperatorChatService;
import me.golemcore.operator.domain.stream.StreamEvent;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.util.Map;

/**
 * Chat endpoint streaming a turn as server-sent events. Request validation
 * happens before the stream opens, so a rejected request gets a plain JSON
 * error instead of an event stream.
 */
@RestController
@RequestMapping("/api/operator")
@RequiredArgsConstructor
@Slf4j
public class OperatorChatController {

    public static final String USER_HEADER = "X-Operator-User";

    private final OperatorChatService chatService;

    @PostMapping(value = "/chat", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<Map<String, Object>>> chat(@RequestHeader(USER_HEADER) String userId,
            @RequestBody ChatRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("message must not be empty");
        }
        log.debug("[API] Chat turn for {} in conversation {}", userId, request.getConversationId());
        return chatService.chat(userId, request.getConversationId(), request.getMessage())
                .map(OperatorChatController::toServerSentEvent);
    }

    static ServerSentEvent<Map<String, Object>> toServerSentEvent(StreamEvent event) {
        return ServerSentEvent.<Map<String, Object>>builder(event.data())
                .event(event.type())
                .build();
    }
}

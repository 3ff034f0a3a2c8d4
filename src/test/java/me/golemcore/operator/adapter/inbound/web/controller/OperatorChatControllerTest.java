package me.golemcore.operator.adapter.inbound.web.controller;

import me.golemcore.operator.adapter.inbound.web.dto.ChatRequest;
import me.golemcore.operator.domain.service.OperatorChatService;
import me.golemcore.operator.domain.stream.StreamEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.codec.ServerSentEvent;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class OperatorChatControllerTest {

    private OperatorChatService chatService;
    private OperatorChatController controller;

    @BeforeEach
    void setUp() {
        chatService = mock(OperatorChatService.class);
        controller = new OperatorChatController(chatService);
    }

    @Test
    void shouldStreamTurnEventsAsServerSentEvents() {
        when(chatService.chat("alice", "c-1", "how is spend?")).thenReturn(Flux.just(
                StreamEvent.toolStatus("list_entities", StreamEvent.STATUS_RUNNING, null),
                StreamEvent.text("Spend is up."),
                StreamEvent.suggestions(List.of("Show by campaign")),
                StreamEvent.done("c-1")));

        StepVerifier.create(controller.chat("alice", new ChatRequest("c-1", "how is spend?")))
                .assertNext(event -> {
                    assertEquals("tool_status", event.event());
                    assertEquals("list_entities", event.data().get("tool"));
                })
                .assertNext(event -> {
                    assertEquals("text", event.event());
                    assertEquals("Spend is up.", event.data().get("chunk"));
                })
                .assertNext(event -> assertEquals("suggestions", event.event()))
                .assertNext(event -> {
                    assertEquals("done", event.event());
                    assertEquals("c-1", event.data().get("conversationId"));
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectMissingBody() {
        assertThrows(IllegalArgumentException.class, () -> controller.chat("alice", null));

        verifyNoInteractions(chatService);
    }

    @Test
    void shouldMapErrorEvent() {
        ServerSentEvent<Map<String, Object>> event = OperatorChatController
                .toServerSentEvent(StreamEvent.error("Oracle unavailable"));

        assertEquals("error", event.event());
        assertEquals("Oracle unavailable", event.data().get("message"));
    }
}

package me.golemcore.operator.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.operator.domain.model.Conversation;
import me.golemcore.operator.domain.model.LlmRequest;
import me.golemcore.operator.domain.model.LlmResponse;
import me.golemcore.operator.domain.model.MemoryFact;
import me.golemcore.operator.domain.model.Message;
import me.golemcore.operator.infrastructure.config.OperatorProperties;
import me.golemcore.operator.port.outbound.ConversationPort;
import me.golemcore.operator.port.outbound.LlmPort;
import me.golemcore.operator.port.outbound.MemoryFactPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MemoryExtractionServiceTest {

    private ConversationPort conversationPort;
    private MemoryFactPort memoryFactPort;
    private LlmPort llmPort;
    private OperatorProperties properties;
    private MemoryExtractionService service;
    private Conversation conversation;

    @BeforeEach
    void setUp() {
        conversationPort = mock(ConversationPort.class);
        memoryFactPort = mock(MemoryFactPort.class);
        llmPort = mock(LlmPort.class);
        properties = new OperatorProperties();
        service = new MemoryExtractionService(conversationPort, memoryFactPort, llmPort, new ObjectMapper(),
                properties);
        conversation = Conversation.builder().id("conv-1").ownerId("alice").build();
        when(memoryFactPort.append(eq("alice"), anyString())).thenAnswer(invocation -> Optional.of(
                MemoryFact.builder().text(invocation.getArgument(1)).build()));
    }

    @Test
    void shouldStoreExtractedFactsUpToLimit() {
        when(conversationPort.messages(conversation)).thenReturn(transcript(4));
        reply("Sure:\n[\"Prefers ROAS over CPA\", \"Target CPA is $25\", \"\", \"Works in EST\", \"Extra\"]");

        int stored = service.extract(conversation);

        assertEquals(3, stored);
        verify(memoryFactPort).append("alice", "Prefers ROAS over CPA");
        verify(memoryFactPort).append("alice", "Target CPA is $25");
        verify(memoryFactPort).append("alice", "Works in EST");
        verify(memoryFactPort, never()).append("alice", "Extra");
    }

    @Test
    void shouldSendRecentConversationalWindowToLightModel() {
        List<Message> messages = new ArrayList<>(transcript(14));
        messages.add(Message.builder().role(Message.ROLE_USER)
                .toolResults(List.of(Message.ToolResultBlock.builder().toolCallId("c1").content("{}").build()))
                .build());
        messages.add(Message.builder().role(Message.ROLE_USER).content("x".repeat(800)).build());
        when(conversationPort.messages(conversation)).thenReturn(messages);
        reply("[]");

        service.extract(conversation);

        ArgumentCaptor<LlmRequest> request = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(request.capture());
        assertEquals(properties.getRouter().getLightModel(), request.getValue().getModel());
        String prompt = request.getValue().getMessages().get(0).getContent();
        assertTrue(prompt.startsWith("Extract 0-3 factual preferences or key decisions"));
        assertFalse(prompt.contains("message 5\n"));
        assertTrue(prompt.contains("message 6"));
        assertTrue(prompt.contains("user: " + "x".repeat(500)));
        assertFalse(prompt.contains("x".repeat(501)));
    }

    @Test
    void shouldCountOnlyFactsActuallyStored() {
        when(conversationPort.messages(conversation)).thenReturn(transcript(2));
        when(memoryFactPort.append("alice", "Known fact")).thenReturn(Optional.empty());
        reply("[\"Known fact\", \"New fact\"]");

        assertEquals(1, service.extract(conversation));
    }

    @Test
    void shouldSwallowOracleFailure() {
        when(conversationPort.messages(conversation)).thenReturn(transcript(5));
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("503")));

        assertEquals(0, service.extract(conversation));
        verify(memoryFactPort, never()).append(any(), any());
    }

    @Test
    void shouldSwallowMalformedReply() {
        when(conversationPort.messages(conversation)).thenReturn(transcript(5));
        reply("[not json");

        assertEquals(0, service.extract(conversation));
    }

    @Test
    void shouldSkipEmptyConversation() {
        when(conversationPort.messages(conversation)).thenReturn(List.of());

        assertEquals(0, service.extract(conversation));
        verify(llmPort, times(0)).chat(any());
    }

    private void reply(String content) {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content(content).build()));
    }

    private static List<Message> transcript(int count) {
        List<Message> messages = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            messages.add(Message.builder()
                    .role(i % 2 == 1 ? Message.ROLE_USER : Message.ROLE_ASSISTANT)
                    .content("message " + i)
                    .build());
        }
        return messages;
    }
}

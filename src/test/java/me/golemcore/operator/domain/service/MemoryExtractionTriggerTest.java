package me.golemcore.operator.domain.service;

import me.golemcore.operator.domain.model.Conversation;
import me.golemcore.operator.domain.model.Message;
import me.golemcore.operator.infrastructure.config.OperatorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class MemoryExtractionTriggerTest {

    private MemoryExtractionService extractionService;
    private OperatorProperties properties;
    private List<Runnable> scheduled;
    private MemoryExtractionTrigger trigger;
    private Conversation conversation;

    @BeforeEach
    void setUp() {
        extractionService = mock(MemoryExtractionService.class);
        properties = new OperatorProperties();
        scheduled = new ArrayList<>();
        Executor executor = scheduled::add;
        trigger = new MemoryExtractionTrigger(extractionService, executor, properties);
        conversation = Conversation.builder().id("conv-1").ownerId("alice").build();
    }

    @Test
    void shouldFireOnEveryFifthMessage() {
        List<Boolean> fired = new ArrayList<>();
        for (int i = 1; i <= 10; i++) {
            fired.add(trigger.onAppended(conversation, List.of(text(i))));
        }

        assertEquals(List.of(false, false, false, false, true, false, false, false, false, true), fired);
        assertEquals(2, scheduled.size());
        scheduled.forEach(Runnable::run);
        verify(extractionService, times(2)).extract(conversation);
    }

    @Test
    void shouldFireWhenBatchCrossesMultiple() {
        trigger.onAppended(conversation, List.of(text(1), text(2), text(3)));

        assertTrue(trigger.onAppended(conversation, List.of(text(4), text(5), text(6))));
        assertEquals(6, trigger.count("conv-1"));
        assertEquals(1, scheduled.size());
    }

    @Test
    void shouldIgnoreToolBundles() {
        Message toolCalls = Message.builder().role(Message.ROLE_ASSISTANT)
                .toolCalls(List.of(Message.ToolCall.builder().id("c1").name("list_entities").build())).build();
        Message toolResults = Message.builder().role(Message.ROLE_USER)
                .toolResults(List.of(Message.ToolResultBlock.builder().toolCallId("c1").content("{}").build()))
                .build();
        Message blank = Message.builder().role(Message.ROLE_ASSISTANT).content(" ").build();

        trigger.onAppended(conversation, List.of(toolCalls, toolResults, blank));

        assertEquals(0, trigger.count("conv-1"));
    }

    @Test
    void shouldCountConversationsIndependently() {
        Conversation other = Conversation.builder().id("conv-2").ownerId("alice").build();
        for (int i = 1; i <= 4; i++) {
            trigger.onAppended(conversation, List.of(text(i)));
        }

        assertFalse(trigger.onAppended(other, List.of(text(1))));
        assertTrue(trigger.onAppended(conversation, List.of(text(5))));
    }

    @Test
    void shouldDoNothingWhenDisabled() {
        properties.getMemory().setEnabled(false);
        for (int i = 1; i <= 5; i++) {
            assertFalse(trigger.onAppended(conversation, List.of(text(i))));
        }

        assertEquals(0, trigger.count("conv-1"));
        assertTrue(scheduled.isEmpty());
    }

    @Test
    void shouldResetCounterWhenForgotten() {
        trigger.onAppended(conversation, List.of(text(1), text(2)));

        trigger.forget("conv-1");

        assertEquals(0, trigger.count("conv-1"));
    }

    @Test
    void shouldReleaseCounterOfLeastRecentlyActiveConversation() {
        properties.getMemory().setMaxTrackedConversations(2);
        MemoryExtractionTrigger bounded = new MemoryExtractionTrigger(extractionService, scheduled::add, properties);
        Conversation second = Conversation.builder().id("conv-2").ownerId("alice").build();
        Conversation third = Conversation.builder().id("conv-3").ownerId("alice").build();

        bounded.onAppended(conversation, List.of(text(1)));
        bounded.onAppended(second, List.of(text(1)));
        bounded.onAppended(conversation, List.of(text(2)));
        bounded.onAppended(third, List.of(text(1)));

        assertEquals(2, bounded.count("conv-1"));
        assertEquals(0, bounded.count("conv-2"));
        assertEquals(1, bounded.count("conv-3"));
    }

    @Test
    void shouldSurviveRejectedExecution() {
        Executor rejecting = runnable -> {
            throw new RejectedExecutionException("shutting down");
        };
        MemoryExtractionTrigger rejectingTrigger = new MemoryExtractionTrigger(extractionService, rejecting,
                properties);

        for (int i = 1; i <= 5; i++) {
            assertFalse(rejectingTrigger.onAppended(conversation, List.of(text(i))));
        }
        verify(extractionService, never()).extract(conversation);
    }

    private static Message text(int i) {
        return Message.builder()
                .role(i % 2 == 1 ? Message.ROLE_USER : Message.ROLE_ASSISTANT)
                .content("message " + i)
                .build();
    }
}

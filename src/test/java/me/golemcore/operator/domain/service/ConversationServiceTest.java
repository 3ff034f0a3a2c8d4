package me.golemcore.operator.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.operator.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.operator.domain.model.Conversation;
import me.golemcore.operator.domain.model.Message;
import me.golemcore.operator.infrastructure.config.AutoConfiguration;
import me.golemcore.operator.infrastructure.config.OperatorProperties;
import me.golemcore.operator.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversationServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private ConversationService service;

    @BeforeEach
    void setUp() {
        OperatorProperties properties = new OperatorProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        ObjectMapper objectMapper = AutoConfiguration.objectMapper();
        clock = new MutableClock(NOW);
        service = new ConversationService(storage, objectMapper, clock, properties);
    }

    @Test
    void shouldCreateAndFindConversation() {
        Conversation created = service.create("alice", "  Pause the spring campaign please  ");

        Conversation found = service.find("alice", created.getId()).orElseThrow();

        assertEquals("Pause the spring campaign please", found.getTitle());
        assertEquals(NOW, found.getCreatedAt());
        assertTrue(Files.exists(tempDir.resolve("conversations/alice/" + created.getId() + ".json")));
    }

    @Test
    void shouldTruncateLongTitles() {
        Conversation created = service.create("alice", "x".repeat(300));

        assertEquals(Conversation.MAX_TITLE_LENGTH, created.getTitle().length());
    }

    @Test
    void shouldHideConversationsOfOtherUsers() {
        Conversation created = service.create("alice", "hi");

        assertTrue(service.find("bob", created.getId()).isEmpty());
        assertFalse(service.delete("bob", created.getId()));
        assertTrue(service.list("bob").isEmpty());
    }

    @Test
    void shouldTreatMalformedIdAsMissing() {
        assertTrue(service.find("alice", "../bob/x").isEmpty());
    }

    @Test
    void shouldRejectMalformedOwner() {
        assertThrows(IllegalArgumentException.class, () -> service.create("a/b", "hi"));
    }

    @Test
    void shouldAppendMessagesInOrderAndTouchUpdatedAt() {
        Conversation conversation = service.create("alice", "hi");
        clock.advance(Duration.ofMinutes(1));

        service.append(conversation, List.of(message(Message.ROLE_USER, "first")));
        service.append(conversation, List.of(
                Message.builder().role(Message.ROLE_ASSISTANT).timestamp(NOW)
                        .toolCalls(List.of(Message.ToolCall.builder().id("c1").name("list_entities")
                                .arguments(Map.of("domain", "meta_adset")).build()))
                        .build(),
                Message.builder().role(Message.ROLE_USER).timestamp(NOW)
                        .toolResults(List.of(Message.ToolResultBlock.builder().toolCallId("c1")
                                .toolName("list_entities").content("{}").build()))
                        .build(),
                message(Message.ROLE_ASSISTANT, "second")));

        List<Message> messages = service.messages(conversation);
        assertEquals(4, messages.size());
        assertEquals("first", messages.get(0).getContent());
        assertEquals("c1", messages.get(1).getToolCalls().get(0).getId());
        assertEquals("c1", messages.get(2).getToolResults().get(0).getToolCallId());
        assertEquals("second", messages.get(3).getContent());
        assertEquals(NOW.plus(Duration.ofMinutes(1)),
                service.find("alice", conversation.getId()).orElseThrow().getUpdatedAt());
    }

    @Test
    void shouldKeepEveryMessageUnderConcurrentAppends() throws Exception {
        Conversation conversation = service.create("alice", "hi");
        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 40; i++) {
                int n = i;
                futures.add(pool.submit(() -> service.append(conversation,
                        List.of(message(Message.ROLE_USER, "m" + n)))));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(40, service.messages(conversation).size());
    }

    @Test
    void shouldSkipUnreadableLines() throws Exception {
        Conversation conversation = service.create("alice", "hi");
        service.append(conversation, List.of(message(Message.ROLE_USER, "ok")));
        Files.writeString(tempDir.resolve("conversations/alice/" + conversation.getId() + ".messages.jsonl"),
                "{broken\n", StandardOpenOption.APPEND);

        assertEquals(1, service.messages(conversation).size());
    }

    @Test
    void shouldListMostRecentlyUpdatedFirst() {
        Conversation older = service.create("alice", "older");
        clock.advance(Duration.ofMinutes(1));
        Conversation newer = service.create("alice", "newer");
        clock.advance(Duration.ofMinutes(1));
        service.append(older, List.of(message(Message.ROLE_USER, "bump")));

        List<Conversation> listed = service.list("alice");

        assertEquals(List.of(older.getId(), newer.getId()), listed.stream().map(Conversation::getId).toList());
    }

    @Test
    void shouldDeleteConversationAndMessages() {
        Conversation conversation = service.create("alice", "hi");
        service.append(conversation, List.of(message(Message.ROLE_USER, "bye")));

        assertTrue(service.delete("alice", conversation.getId()));

        assertTrue(service.find("alice", conversation.getId()).isEmpty());
        assertFalse(Files.exists(tempDir.resolve("conversations/alice/" + conversation.getId()
                + ".messages.jsonl")));
    }

    @Test
    void shouldKeepLockSetBoundedAcrossManyConversations() {
        Set<Object> distinct = Collections.newSetFromMap(new IdentityHashMap<>());
        for (int i = 0; i < 1000; i++) {
            distinct.add(service.lockFor("conv-" + i));
        }

        assertSame(service.lockFor("conv-7"), service.lockFor("conv-7"));
        assertTrue(distinct.size() <= 64);
    }

    private static Message message(String role, String content) {
        return Message.builder().role(role).content(content).timestamp(NOW).build();
    }
}

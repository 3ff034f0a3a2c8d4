package me.golemcore.operator.domain.service;

import me.golemcore.operator.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.operator.domain.model.MemoryFact;
import me.golemcore.operator.infrastructure.config.AutoConfiguration;
import me.golemcore.operator.infrastructure.config.OperatorProperties;
import me.golemcore.operator.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MemoryFactServiceTest {

    @TempDir
    Path tempDir;

    private OperatorProperties properties;
    private MemoryFactService service;

    @BeforeEach
    void setUp() {
        properties = new OperatorProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        service = new MemoryFactService(storage, AutoConfiguration.objectMapper(),
                new MutableClock(Instant.parse("2026-03-01T10:00:00Z")), properties);
    }

    @Test
    void shouldAppendAndRecallOldestFirst() {
        service.append("alice", "Prefers ROAS over CPA");
        service.append("alice", "Target CPA is $25");
        service.append("alice", "Works in EST");

        List<MemoryFact> recent = service.recent("alice", 2);

        assertEquals(List.of("Target CPA is $25", "Works in EST"), recent.stream().map(MemoryFact::getText).toList());
        assertEquals("alice", recent.get(0).getOwnerId());
    }

    @Test
    void shouldSkipDuplicatesIgnoringCaseAndWhitespace() {
        Optional<MemoryFact> first = service.append("alice", "Prefers ROAS over CPA");
        Optional<MemoryFact> duplicate = service.append("alice", "  prefers   roas OVER cpa ");

        assertTrue(first.isPresent());
        assertTrue(duplicate.isEmpty());
        assertEquals(1, service.recent("alice", 10).size());
    }

    @Test
    void shouldKeepDuplicatesWhenDeduplicationDisabled() {
        properties.getMemory().setDeduplicate(false);

        service.append("alice", "Works in EST");
        service.append("alice", "works in est");

        assertEquals(2, service.recent("alice", 10).size());
    }

    @Test
    void shouldKeepUsersApart() {
        service.append("alice", "Works in EST");

        assertTrue(service.append("bob", "Works in EST").isPresent());
        assertEquals(1, service.recent("bob", 10).size());
    }

    @Test
    void shouldIgnoreBlankFacts() {
        assertTrue(service.append("alice", "   ").isEmpty());
        assertTrue(service.recent("alice", 10).isEmpty());
    }

    @Test
    void shouldNormalizeForComparison() {
        assertEquals("a b c", MemoryFactService.normalize("  A \t b\nC "));
    }
}

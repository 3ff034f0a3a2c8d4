package me.golemcore.operator.adapter.outbound.storage;

import me.golemcore.operator.infrastructure.config.OperatorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalStorageAdapterTest {

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storage;

    @BeforeEach
    void setUp() {
        OperatorProperties properties = new OperatorProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
    }

    @Test
    void shouldCreateStandardDirectories() {
        assertTrue(Files.isDirectory(tempDir.resolve("conversations")));
        assertTrue(Files.isDirectory(tempDir.resolve("memory")));
    }

    @Test
    void shouldAppendAndReadText() {
        storage.appendText("memory", "alice.jsonl", "{\"a\":1}\n").join();
        storage.appendText("memory", "alice.jsonl", "{\"a\":2}\n").join();

        assertEquals("{\"a\":1}\n{\"a\":2}\n", storage.getText("memory", "alice.jsonl").join());
        assertTrue(storage.exists("memory", "alice.jsonl").join());
    }

    @Test
    void shouldReturnNullForMissingFile() {
        assertNull(storage.getText("memory", "nobody.jsonl").join());
    }

    @Test
    void shouldReplaceContentAtomically() {
        storage.putTextAtomic("conversations", "alice/c1.json", "{\"v\":1}").join();
        storage.putTextAtomic("conversations", "alice/c1.json", "{\"v\":2}").join();

        assertEquals("{\"v\":2}", storage.getText("conversations", "alice/c1.json").join());
        assertFalse(Files.exists(tempDir.resolve("conversations/alice/c1.json.tmp")));
    }

    @Test
    void shouldListFilesRelativeToDirectory() {
        storage.putTextAtomic("conversations", "alice/c1.json", "{}").join();
        storage.putTextAtomic("conversations", "alice/c1.messages.jsonl", "").join();
        storage.putTextAtomic("conversations", "bob/c2.json", "{}").join();

        List<String> files = storage.listObjects("conversations", "alice").join();

        assertEquals(2, files.size());
        assertTrue(files.contains("alice/c1.json"));
        assertTrue(files.contains("alice/c1.messages.jsonl"));
        assertTrue(storage.listObjects("conversations", "carol").join().isEmpty());
    }

    @Test
    void shouldDeleteFiles() {
        storage.putTextAtomic("memory", "alice.jsonl", "x").join();

        storage.deleteObject("memory", "alice.jsonl").join();

        assertFalse(storage.exists("memory", "alice.jsonl").join());
    }

    @Test
    void shouldBlockPathTraversal() {
        CompletionException ex = assertThrows(CompletionException.class,
                () -> storage.getText("memory", "../../etc/passwd").join());

        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
    }
}

package me.golemcore.agentcore.adapter.outbound.storage;

import me.golemcore.agentcore.infrastructure.config.AgentCoreProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalStorageAdapterTest {

    private static final String CONVERSATIONS = "conversations";
    private static final String THREAD_FILE = "threads/support-1.json";
    private static final String ENTRIES_FILE = "entries/support-1.jsonl";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        AgentCoreProperties properties = new AgentCoreProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void shouldCreateWorkspaceDirectoriesOnInit() {
        assertTrue(Files.isDirectory(tempDir.resolve(CONVERSATIONS)));
        assertTrue(Files.isDirectory(tempDir.resolve("prompts")));
    }

    @Test
    void shouldWriteAndReadThreadFile() throws ExecutionException, InterruptedException {
        storageAdapter.putText(CONVERSATIONS, THREAD_FILE, "{\"id\":\"support-1\"}").get();

        assertEquals("{\"id\":\"support-1\"}", storageAdapter.getText(CONVERSATIONS, THREAD_FILE).get());
        assertTrue(storageAdapter.exists(CONVERSATIONS, THREAD_FILE).get());
    }

    @Test
    void shouldReturnNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(CONVERSATIONS, "threads/missing.json").get());
        assertFalse(storageAdapter.exists(CONVERSATIONS, "threads/missing.json").get());
    }

    @Test
    void shouldAppendEntryLines() throws ExecutionException, InterruptedException {
        storageAdapter.appendText(CONVERSATIONS, ENTRIES_FILE, "{\"n\":1}\n").get();
        storageAdapter.appendText(CONVERSATIONS, ENTRIES_FILE, "{\"n\":2}\n").get();

        assertEquals("{\"n\":1}\n{\"n\":2}\n", storageAdapter.getText(CONVERSATIONS, ENTRIES_FILE).get());
    }

    @Test
    void shouldDeleteFileAndIgnoreMissingOne() throws ExecutionException, InterruptedException {
        storageAdapter.putText(CONVERSATIONS, THREAD_FILE, "{}").get();

        storageAdapter.deleteObject(CONVERSATIONS, THREAD_FILE).get();

        assertFalse(storageAdapter.exists(CONVERSATIONS, THREAD_FILE).get());
        assertDoesNotThrow(() -> storageAdapter.deleteObject(CONVERSATIONS, THREAD_FILE).get());
    }

    @Test
    void shouldEnsureDirectory() throws ExecutionException, InterruptedException {
        storageAdapter.ensureDirectory("archive").get();

        assertTrue(Files.isDirectory(tempDir.resolve("archive")));
    }

    // ==================== listing ====================

    @Test
    void shouldListRelativePathsSorted() throws ExecutionException, InterruptedException {
        storageAdapter.putText(CONVERSATIONS, "threads/b.json", "{}").get();
        storageAdapter.putText(CONVERSATIONS, "threads/a.json", "{}").get();
        storageAdapter.putText(CONVERSATIONS, ENTRIES_FILE, "").get();

        List<String> all = storageAdapter.listObjects(CONVERSATIONS, "").get();
        List<String> threads = storageAdapter.listObjects(CONVERSATIONS, "threads").get();

        assertEquals(List.of(ENTRIES_FILE, "threads/a.json", "threads/b.json"), all);
        assertEquals(List.of("threads/a.json", "threads/b.json"), threads);
    }

    @Test
    void shouldListNothingForMissingDirectoryOrPrefix() throws ExecutionException, InterruptedException {
        assertTrue(storageAdapter.listObjects("nowhere", "").get().isEmpty());
        assertTrue(storageAdapter.listObjects(CONVERSATIONS, "threads").get().isEmpty());
        assertTrue(storageAdapter.listObjects(CONVERSATIONS, null).get().isEmpty());
    }

    // ==================== path traversal ====================

    @Test
    void shouldBlockPathTraversalOnWrite() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> storageAdapter.putText(CONVERSATIONS, "../../etc/passwd", "x").get());

        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
    }

    @Test
    void shouldBlockPathTraversalOnRead() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> storageAdapter.getText("prompts", "../../../secret").get());

        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
    }

    // ==================== atomic write ====================

    @Test
    void shouldReplaceThreadAtomicallyWithoutLeftovers() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(CONVERSATIONS, THREAD_FILE, "{\"v\":1}", false).get();
        storageAdapter.putTextAtomic(CONVERSATIONS, THREAD_FILE, "{\"v\":2}", false).get();

        assertEquals("{\"v\":2}", storageAdapter.getText(CONVERSATIONS, THREAD_FILE).get());
        assertEquals(List.of(THREAD_FILE), storageAdapter.listObjects(CONVERSATIONS, "threads").get());
        assertFalse(storageAdapter.exists(CONVERSATIONS, THREAD_FILE + ".bak").get());
    }

    @Test
    void shouldSurviveConcurrentAtomicWritesToOneFile() throws ExecutionException, InterruptedException {
        List<String> versions = IntStream.range(0, 100).mapToObj(i -> "{\"v\":" + i + "}").toList();

        List<CompletableFuture<Void>> writes = versions.stream()
                .map(content -> storageAdapter.putTextAtomic(CONVERSATIONS, THREAD_FILE, content, false))
                .toList();
        CompletableFuture.allOf(writes.toArray(new CompletableFuture[0])).get();

        assertTrue(versions.contains(storageAdapter.getText(CONVERSATIONS, THREAD_FILE).get()));
        assertEquals(List.of(THREAD_FILE), storageAdapter.listObjects(CONVERSATIONS, "threads").get());
    }

    @Test
    void shouldKeepBackupWhenRequested() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(CONVERSATIONS, THREAD_FILE, "{\"v\":1}", false).get();

        storageAdapter.putTextAtomic(CONVERSATIONS, THREAD_FILE, "{\"v\":2}", true).get();

        assertEquals("{\"v\":2}", storageAdapter.getText(CONVERSATIONS, THREAD_FILE).get());
        assertEquals("{\"v\":1}", storageAdapter.getText(CONVERSATIONS, THREAD_FILE + ".bak").get());
    }

    @Test
    void shouldWriteMultibyteContentAtomically() throws ExecutionException, InterruptedException {
        String content = "{\"text\":\"Привет, 世界\"}";

        storageAdapter.putTextAtomic(CONVERSATIONS, THREAD_FILE, content, false).get();

        assertEquals(content, storageAdapter.getText(CONVERSATIONS, THREAD_FILE).get());
    }
}

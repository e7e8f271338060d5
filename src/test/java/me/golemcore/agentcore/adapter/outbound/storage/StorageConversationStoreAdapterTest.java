package me.golemcore.agentcore.adapter.outbound.storage;

import me.golemcore.agentcore.domain.exception.MemoryException;
import me.golemcore.agentcore.domain.model.ConversationMessage;
import me.golemcore.agentcore.domain.model.ConversationState;
import me.golemcore.agentcore.domain.model.ConversationThread;
import me.golemcore.agentcore.domain.model.MemoryEntry;
import me.golemcore.agentcore.domain.model.Message;
import me.golemcore.agentcore.infrastructure.config.AgentCoreProperties;
import me.golemcore.agentcore.infrastructure.config.AutoConfiguration;
import me.golemcore.agentcore.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StorageConversationStoreAdapterTest {

    private static final Instant NOW = Instant.parse("2026-02-14T00:00:00Z");
    private static final String THREAD_ID = "user/42 chat";

    @TempDir
    Path tempDir;

    private AgentCoreProperties properties;
    private StorageConversationStoreAdapter store;

    @BeforeEach
    void setUp() {
        properties = new AgentCoreProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        store = new StorageConversationStoreAdapter(storage, AutoConfiguration.objectMapper(), properties);
    }

    private static ConversationThread thread(String id, Instant at) {
        return ConversationThread.create(id, at)
                .append(ConversationMessage.fromMessage(Message.user("hello from " + id), at, 7, Map.of()));
    }

    private static MemoryEntry entry(String threadId, String content, Instant at) {
        return MemoryEntry.builder()
                .threadId(threadId)
                .message(ConversationMessage.fromMessage(Message.assistant(content), at, 5, Map.of()))
                .recordedAt(at)
                .build();
    }

    private static MemoryException.Kind failureKind(CompletableFuture<?> future) {
        ExecutionException error = assertThrows(ExecutionException.class, future::get);
        return assertInstanceOf(MemoryException.class, error.getCause()).getKind();
    }

    @Test
    void shouldPersistThreadUnderEncodedFileName() throws Exception {
        ConversationThread original = thread(THREAD_ID, NOW).withState(ConversationState.COMPLETED, NOW);

        store.upsertThread(original).get();

        assertTrue(Files.exists(tempDir.resolve("conversations").resolve("threads")
                .resolve("user%2F42+chat.json")));
        assertEquals(original, store.loadThread(THREAD_ID).get().orElseThrow());
    }

    @Test
    void shouldReturnEmptyForUnknownThread() throws Exception {
        assertTrue(store.loadThread("missing").get().isEmpty());
    }

    @Test
    void shouldListThreadsMostRecentFirst() throws Exception {
        store.upsertThread(thread("first", NOW)).get();
        store.upsertThread(thread("second", NOW.plusSeconds(30))).get();

        List<String> ids = store.listThreads().get().stream().map(ConversationThread::getId).toList();

        assertEquals(List.of("second", "first"), ids);
    }

    @Test
    void shouldSearchAppendedEntries() throws Exception {
        store.appendEntry(entry("a", "The build is green", NOW)).get();
        store.appendEntry(entry("a", "unrelated", NOW.plusSeconds(1))).get();
        store.appendEntry(entry("b", "Green light for release", NOW.plusSeconds(2))).get();

        List<MemoryEntry> found = store.searchEntries("green", 10).get();

        assertEquals(List.of("b", "a"), found.stream().map(MemoryEntry::getThreadId).toList());
    }

    @Test
    void shouldSkipMalformedEntryLines() throws Exception {
        store.appendEntry(entry("a", "valid line", NOW)).get();
        Files.writeString(tempDir.resolve("conversations").resolve("entries").resolve("a.jsonl"),
                "{broken\n", StandardOpenOption.APPEND);

        List<MemoryEntry> found = store.searchEntries("valid", 10).get();

        assertEquals(1, found.size());
    }

    @Test
    void shouldRejectInvalidSearch() {
        assertEquals(MemoryException.Kind.INVALID_INPUT, failureKind(store.searchEntries("x", 0)));
    }

    @Test
    void shouldReportCorruptedThreadFile() throws Exception {
        Path threads = tempDir.resolve("conversations").resolve("threads");
        Files.createDirectories(threads);
        Files.writeString(threads.resolve("bad.json"), "{not json");

        assertEquals(MemoryException.Kind.PERSISTENCE_FAILED, failureKind(store.loadThread("bad")));
    }

    @Test
    void shouldDeleteThreadAndEntries() throws Exception {
        store.upsertThread(thread(THREAD_ID, NOW)).get();
        store.appendEntry(entry(THREAD_ID, "remember me", NOW)).get();

        store.deleteThread(THREAD_ID).get();

        assertTrue(store.loadThread(THREAD_ID).get().isEmpty());
        assertTrue(store.searchEntries("remember", 5).get().isEmpty());
    }

    @Test
    void shouldFailDeletingUnknownThread() {
        assertEquals(MemoryException.Kind.NOT_FOUND, failureKind(store.deleteThread("ghost")));
    }

    @Test
    void shouldWrapStorageFailures() {
        StoragePort failing = mock(StoragePort.class);
        when(failing.getText(anyString(), anyString())).thenReturn(
                CompletableFuture.failedFuture(new UncheckedIOException("disk", new IOException("io"))));
        StorageConversationStoreAdapter broken = new StorageConversationStoreAdapter(failing,
                AutoConfiguration.objectMapper(), properties);

        assertEquals(MemoryException.Kind.PERSISTENCE_FAILED, failureKind(broken.loadThread("t")));
    }
}

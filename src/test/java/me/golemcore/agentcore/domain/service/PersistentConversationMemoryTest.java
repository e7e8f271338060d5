package me.golemcore.agentcore.domain.service;

import me.golemcore.agentcore.domain.exception.MemoryException;
import me.golemcore.agentcore.domain.model.ConversationMessage;
import me.golemcore.agentcore.domain.model.ConversationThread;
import me.golemcore.agentcore.domain.model.LlmProvider;
import me.golemcore.agentcore.domain.model.MemoryEntry;
import me.golemcore.agentcore.domain.model.Message;
import me.golemcore.agentcore.port.outbound.ConversationStorePort;
import me.golemcore.agentcore.port.outbound.MemoryPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PersistentConversationMemoryTest {

    private static final Instant NOW = Instant.parse("2026-02-14T00:00:00Z");
    private static final String THREAD_ID = "thread-1";

    @Mock
    private ConversationStorePort store;

    private InMemoryConversationMemory cache;
    private PersistentConversationMemory memory;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        Clock clock = Clock.fixed(NOW, ZoneId.of("UTC"));
        cache = new InMemoryConversationMemory(clock, new DefaultTokenCounter(), LlmProvider.OPENAI);
        memory = new PersistentConversationMemory(cache, store, clock);

        when(store.upsertThread(any())).thenReturn(CompletableFuture.completedFuture(null));
        when(store.appendEntry(any())).thenReturn(CompletableFuture.completedFuture(null));
        when(store.loadThread(anyString())).thenReturn(CompletableFuture.completedFuture(Optional.empty()));
    }

    @Test
    void shouldWriteEntriesAndThreadOnAppend() throws Exception {
        ConversationThread thread = memory.appendAll(THREAD_ID,
                List.of(Message.user("one"), Message.assistant("two"))).get();

        ArgumentCaptor<MemoryEntry> entries = ArgumentCaptor.forClass(MemoryEntry.class);
        verify(store, times(2)).appendEntry(entries.capture());
        assertEquals(List.of("one", "two"),
                entries.getAllValues().stream().map(entry -> entry.getMessage().getContent()).toList());
        assertEquals(THREAD_ID, entries.getValue().getThreadId());
        verify(store).upsertThread(thread);
    }

    @Test
    void shouldLoadThreadFromStoreOnCacheMiss() throws Exception {
        ConversationThread stored = ConversationThread.create(THREAD_ID, NOW)
                .append(ConversationMessage.fromMessage(Message.user("persisted"), NOW, 5, Map.of()));
        when(store.loadThread(THREAD_ID)).thenReturn(CompletableFuture.completedFuture(Optional.of(stored)));

        List<ConversationMessage> messages = memory.read(THREAD_ID).get();

        assertEquals("persisted", messages.get(0).getContent());
        assertEquals(stored, cache.readThread(THREAD_ID).get());
    }

    @Test
    void shouldContinuePersistedThreadAfterRestart() throws Exception {
        ConversationThread stored = ConversationThread.create(THREAD_ID, NOW)
                .append(ConversationMessage.fromMessage(Message.user("before"), NOW, 5, Map.of()));
        when(store.loadThread(THREAD_ID)).thenReturn(CompletableFuture.completedFuture(Optional.of(stored)));

        ConversationThread thread = memory.append(THREAD_ID, Message.user("after")).get();

        assertEquals(2, thread.getMessages().size());
        verify(store, times(1)).appendEntry(any());
    }

    @Test
    void shouldFailReadWhenNeitherCacheNorStoreHasThread() {
        ExecutionException error = assertThrows(ExecutionException.class, () -> memory.read("missing").get());

        assertEquals(MemoryException.Kind.NOT_FOUND,
                assertInstanceOf(MemoryException.class, error.getCause()).getKind());
    }

    @Test
    void shouldPersistForkedThread() throws Exception {
        memory.append(THREAD_ID, Message.user("root")).get();

        ConversationThread fork = memory.fork(THREAD_ID, "thread-2").get();

        assertEquals(THREAD_ID, fork.getParentId());
        verify(store).upsertThread(fork);
    }

    // ==================== write ordering ====================

    @Test
    void shouldKeepLatestThreadWhenEarlierStoreWriteIsSlow() throws Exception {
        AtomicReference<ConversationThread> persisted = new AtomicReference<>();
        AtomicInteger upserts = new AtomicInteger();
        when(store.upsertThread(any())).thenAnswer(invocation -> {
            ConversationThread thread = invocation.getArgument(0);
            if (upserts.getAndIncrement() == 0) {
                return CompletableFuture.runAsync(() -> persisted.set(thread),
                        CompletableFuture.delayedExecutor(300, TimeUnit.MILLISECONDS));
            }
            persisted.set(thread);
            return CompletableFuture.completedFuture(null);
        });

        CompletableFuture<ConversationThread> first = memory.append(THREAD_ID, Message.user("one"));
        CompletableFuture<ConversationThread> second = memory.append(THREAD_ID, Message.user("two"));
        first.get();
        second.get();

        assertEquals(2, cache.readThread(THREAD_ID).get().getMessages().size());
        assertEquals(List.of("one", "two"),
                persisted.get().getMessages().stream().map(ConversationMessage::getContent).toList());
    }

    @Test
    void shouldPersistNextAppendAfterFailedStoreWrite() throws Exception {
        AtomicReference<ConversationThread> persisted = new AtomicReference<>();
        AtomicInteger upserts = new AtomicInteger();
        when(store.upsertThread(any())).thenAnswer(invocation -> {
            if (upserts.getAndIncrement() == 0) {
                return CompletableFuture.failedFuture(
                        MemoryException.persistenceFailed(THREAD_ID, "disk full", null));
            }
            persisted.set(invocation.getArgument(0));
            return CompletableFuture.completedFuture(null);
        });

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> memory.append(THREAD_ID, Message.user("one")).get());
        memory.append(THREAD_ID, Message.user("two")).get();

        assertEquals(MemoryException.Kind.PERSISTENCE_FAILED,
                assertInstanceOf(MemoryException.class, error.getCause()).getKind());
        assertEquals(2, persisted.get().getMessages().size());
    }

    // ==================== search ====================

    @Test
    void shouldFallBackToStoreWhenCacheSearchFails() throws Exception {
        MemoryPort brokenCache = mock(MemoryPort.class);
        when(brokenCache.search(anyString(), anyInt())).thenReturn(CompletableFuture.failedFuture(
                MemoryException.persistenceFailed(null, "cache unavailable", null)));
        MemoryEntry fromStore = MemoryEntry.builder().threadId(THREAD_ID).recordedAt(NOW).build();
        when(store.searchEntries("deploy", 5)).thenReturn(CompletableFuture.completedFuture(List.of(fromStore)));
        PersistentConversationMemory fallbackMemory = new PersistentConversationMemory(brokenCache, store,
                Clock.fixed(NOW, ZoneId.of("UTC")));

        List<MemoryEntry> entries = fallbackMemory.search("deploy", 5).get();

        assertEquals(List.of(fromStore), entries);
    }

    @Test
    void shouldNotFallBackOnInvalidSearchInput() {
        ExecutionException error = assertThrows(ExecutionException.class, () -> memory.search(" ", 5).get());

        assertEquals(MemoryException.Kind.INVALID_INPUT,
                assertInstanceOf(MemoryException.class, error.getCause()).getKind());
        verify(store, never()).searchEntries(anyString(), anyInt());
    }
}

package me.golemcore.agentcore.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentcore.domain.exception.MemoryException;
import me.golemcore.agentcore.domain.model.ConversationMessage;
import me.golemcore.agentcore.domain.model.ConversationThread;
import me.golemcore.agentcore.domain.model.MemoryEntry;
import me.golemcore.agentcore.domain.model.Message;
import me.golemcore.agentcore.port.outbound.ConversationStorePort;
import me.golemcore.agentcore.port.outbound.MemoryPort;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Memory that writes through to a durable {@link ConversationStorePort} and
 * keeps an in-memory fast path in front of it.
 *
 * <p>
 * Cache misses are served from the store and repopulate the cache. Search uses
 * the cache and falls back to the store unless the input itself was invalid.
 *
 * <p>
 * Store writes for one thread run one after another, and each thread upsert
 * stores the latest cached snapshot, so a slow write never overwrites a newer
 * one.
 */
@Slf4j
public class PersistentConversationMemory implements MemoryPort {

    private final MemoryPort cache;
    private final ConversationStorePort store;
    private final Clock clock;
    private final Map<String, CompletableFuture<Void>> writeTails = new ConcurrentHashMap<>();

    public PersistentConversationMemory(MemoryPort cache, ConversationStorePort store, Clock clock) {
        this.cache = cache;
        this.store = store;
        this.clock = clock;
    }

    @Override
    public CompletableFuture<ConversationThread> append(String threadId, Message message) {
        return appendAll(threadId, List.of(message));
    }

    @Override
    public CompletableFuture<ConversationThread> appendAll(String threadId, List<Message> messages) {
        return warmUp(threadId)
                .thenCompose(ignored -> cache.appendAll(threadId, messages))
                .thenCompose(thread -> serializeWrite(threadId,
                        () -> writeEntries(thread, messages.size())
                                .thenCompose(ignored -> persistLatest(threadId)))
                        .thenApply(ignored -> thread));
    }

    @Override
    public CompletableFuture<List<ConversationMessage>> read(String threadId) {
        return readThread(threadId).thenApply(ConversationThread::getMessages);
    }

    @Override
    public CompletableFuture<ConversationThread> readThread(String threadId) {
        return recoverNotFound(cache.readThread(threadId), () -> store.loadThread(threadId)
                .thenCompose(loaded -> loaded
                        .map(thread -> {
                            log.debug("[Memory] Loaded thread {} from store", threadId);
                            return cache.upsert(thread);
                        })
                        .orElseGet(() -> CompletableFuture.failedFuture(MemoryException.notFound(threadId)))));
    }

    @Override
    public CompletableFuture<ConversationThread> upsert(ConversationThread thread) {
        return cache.upsert(thread)
                .thenCompose(stored -> serializeWrite(stored.getId(), () -> persistLatest(stored.getId()))
                        .thenApply(ignored -> stored));
    }

    @Override
    public CompletableFuture<ConversationThread> fork(String fromThreadId, String newThreadId) {
        return readThread(fromThreadId)
                .thenCompose(ignored -> cache.fork(fromThreadId, newThreadId))
                .thenCompose(forked -> serializeWrite(newThreadId, () -> persistLatest(newThreadId))
                        .thenApply(ignored -> forked));
    }

    @Override
    public CompletableFuture<List<MemoryEntry>> search(String query, int limit) {
        return cache.search(query, limit)
                .handle((entries, error) -> {
                    if (error == null) {
                        return CompletableFuture.completedFuture(entries);
                    }
                    Throwable cause = unwrap(error);
                    if (cause instanceof MemoryException memoryException
                            && memoryException.getKind() == MemoryException.Kind.INVALID_INPUT) {
                        return CompletableFuture.<List<MemoryEntry>>failedFuture(cause);
                    }
                    log.warn("[Memory] Cache search failed, falling back to store: {}", cause.getMessage());
                    return store.searchEntries(query, limit);
                })
                .thenCompose(future -> future);
    }

    private CompletableFuture<Void> warmUp(String threadId) {
        return readThread(threadId)
                .handle((thread, error) -> {
                    if (error == null || isNotFound(unwrap(error))) {
                        return CompletableFuture.<Void>completedFuture(null);
                    }
                    return CompletableFuture.<Void>failedFuture(unwrap(error));
                })
                .thenCompose(future -> future);
    }

    private CompletableFuture<Void> persistLatest(String threadId) {
        return cache.readThread(threadId).thenCompose(store::upsertThread);
    }

    /**
     * Chains {@code write} behind the pending store write of the same thread. A
     * failed predecessor has already failed its own caller and does not block
     * the next write.
     */
    private CompletableFuture<Void> serializeWrite(String threadId, Supplier<CompletableFuture<Void>> write) {
        CompletableFuture<Void> tail = writeTails.compute(threadId, (id, previous) -> {
            CompletableFuture<Void> ready = previous == null
                    ? CompletableFuture.completedFuture(null)
                    : previous.exceptionally(error -> null);
            return ready.thenCompose(ignored -> write.get());
        });
        tail.whenComplete((ignored, error) -> writeTails.remove(threadId, tail));
        return tail;
    }

    private CompletableFuture<Void> writeEntries(ConversationThread thread, int count) {
        List<ConversationMessage> messages = thread.getMessages();
        List<ConversationMessage> appended = messages.subList(messages.size() - count, messages.size());
        Instant now = clock.instant();
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (ConversationMessage message : appended) {
            MemoryEntry entry = MemoryEntry.builder()
                    .threadId(thread.getId())
                    .message(message)
                    .recordedAt(now)
                    .build();
            chain = chain.thenCompose(ignored -> store.appendEntry(entry));
        }
        return chain;
    }

    private static <T> CompletableFuture<T> recoverNotFound(CompletableFuture<T> primary,
            Supplier<CompletableFuture<T>> fallback) {
        return primary
                .handle((value, error) -> {
                    if (error == null) {
                        return CompletableFuture.completedFuture(value);
                    }
                    Throwable cause = unwrap(error);
                    if (isNotFound(cause)) {
                        return fallback.get();
                    }
                    return CompletableFuture.<T>failedFuture(cause);
                })
                .thenCompose(future -> future);
    }

    private static boolean isNotFound(Throwable error) {
        return error instanceof MemoryException memoryException
                && memoryException.getKind() == MemoryException.Kind.NOT_FOUND;
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}

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
import me.golemcore.agentcore.domain.model.LlmProvider;
import me.golemcore.agentcore.domain.model.MemoryEntry;
import me.golemcore.agentcore.domain.model.Message;
import me.golemcore.agentcore.port.outbound.MemoryPort;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Process-local conversation memory. The whole thread map is one immutable
 * snapshot swapped with compare-and-set, so readers never see a half-applied
 * append.
 */
@Slf4j
public class InMemoryConversationMemory implements MemoryPort {

    private final AtomicReference<Map<String, ConversationThread>> threads = new AtomicReference<>(Map.of());
    private final Clock clock;
    private final TokenCounter tokenCounter;
    private final LlmProvider provider;

    public InMemoryConversationMemory(Clock clock, TokenCounter tokenCounter, LlmProvider provider) {
        this.clock = clock;
        this.tokenCounter = tokenCounter;
        this.provider = provider;
    }

    @Override
    public CompletableFuture<ConversationThread> append(String threadId, Message message) {
        return appendAll(threadId, List.of(message));
    }

    @Override
    public CompletableFuture<ConversationThread> appendAll(String threadId, List<Message> messages) {
        if (threadId == null || threadId.isBlank()) {
            return CompletableFuture.failedFuture(MemoryException.invalidInput("Thread id must not be blank"));
        }
        Instant now = clock.instant();
        List<ConversationMessage> converted = messages.stream()
                .map(message -> ConversationMessage.fromMessage(message, now,
                        tokenCounter.countMessage(provider, message.getContent()), Map.of()))
                .toList();

        ConversationThread updated = update(threadId, existing -> {
            ConversationThread base = existing != null ? existing : ConversationThread.create(threadId, now);
            return base.appendAll(converted, base.getState());
        });
        log.debug("[Memory] Appended {} message(s) to thread {}", converted.size(), threadId);
        return CompletableFuture.completedFuture(updated);
    }

    @Override
    public CompletableFuture<List<ConversationMessage>> read(String threadId) {
        return readThread(threadId).thenApply(ConversationThread::getMessages);
    }

    @Override
    public CompletableFuture<ConversationThread> readThread(String threadId) {
        ConversationThread thread = threads.get().get(threadId);
        if (thread == null) {
            return CompletableFuture.failedFuture(MemoryException.notFound(threadId));
        }
        return CompletableFuture.completedFuture(thread);
    }

    @Override
    public CompletableFuture<ConversationThread> upsert(ConversationThread thread) {
        if (thread == null || thread.getId() == null || thread.getId().isBlank()) {
            return CompletableFuture.failedFuture(MemoryException.invalidInput("Thread id must not be blank"));
        }
        update(thread.getId(), existing -> thread);
        return CompletableFuture.completedFuture(thread);
    }

    @Override
    public CompletableFuture<ConversationThread> fork(String fromThreadId, String newThreadId) {
        ConversationThread source = threads.get().get(fromThreadId);
        if (source == null) {
            return CompletableFuture.failedFuture(MemoryException.notFound(fromThreadId));
        }
        ConversationThread forked = source.fork(newThreadId, clock.instant());
        update(newThreadId, existing -> forked);
        log.debug("[Memory] Forked thread {} into {}", fromThreadId, newThreadId);
        return CompletableFuture.completedFuture(forked);
    }

    @Override
    public CompletableFuture<List<MemoryEntry>> search(String query, int limit) {
        if (query == null || query.isBlank()) {
            return CompletableFuture.failedFuture(MemoryException.invalidInput("Search query must be non-empty"));
        }
        if (limit <= 0) {
            return CompletableFuture.failedFuture(MemoryException.invalidInput("Search limit must be positive"));
        }
        String normalized = query.toLowerCase(Locale.ROOT);
        List<MemoryEntry> entries = threads.get().values().stream()
                .flatMap(thread -> thread.getMessages().stream()
                        .filter(message -> message.getContent() != null
                                && message.getContent().toLowerCase(Locale.ROOT).contains(normalized))
                        .map(message -> MemoryEntry.builder()
                                .threadId(thread.getId())
                                .message(message)
                                .recordedAt(message.getTimestamp())
                                .build()))
                .sorted(Comparator.comparing(MemoryEntry::getRecordedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(limit)
                .toList();
        return CompletableFuture.completedFuture(entries);
    }

    private ConversationThread update(String threadId, UnaryOperator<ConversationThread> change) {
        while (true) {
            Map<String, ConversationThread> current = threads.get();
            ConversationThread next = change.apply(current.get(threadId));
            Map<String, ConversationThread> updated = new HashMap<>(current);
            updated.put(threadId, next);
            if (threads.compareAndSet(current, Map.copyOf(updated))) {
                return next;
            }
        }
    }
}

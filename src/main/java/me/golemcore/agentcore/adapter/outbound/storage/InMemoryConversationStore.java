package me.golemcore.agentcore.adapter.outbound.storage;

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
import me.golemcore.agentcore.domain.model.ConversationThread;
import me.golemcore.agentcore.domain.model.MemoryEntry;
import me.golemcore.agentcore.port.outbound.ConversationStorePort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Map-backed {@link ConversationStorePort}. Threads and entry logs share one
 * snapshot so a delete removes both at once. Enabled with
 * {@code agentcore.memory.store=in-memory}.
 */
@Component
@ConditionalOnProperty(prefix = "agentcore.memory", name = "store", havingValue = "in-memory")
@Slf4j
public class InMemoryConversationStore implements ConversationStorePort {

    private final AtomicReference<Snapshot> state = new AtomicReference<>(new Snapshot(Map.of(), Map.of()));

    @Override
    public CompletableFuture<Void> upsertThread(ConversationThread thread) {
        update(snapshot -> snapshot.withThread(thread));
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Optional<ConversationThread>> loadThread(String threadId) {
        return CompletableFuture.completedFuture(Optional.ofNullable(state.get().threads().get(threadId)));
    }

    @Override
    public CompletableFuture<Void> appendEntry(MemoryEntry entry) {
        update(snapshot -> snapshot.withEntry(entry));
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<List<MemoryEntry>> searchEntries(String query, int limit) {
        if (query == null || query.isBlank() || limit <= 0) {
            return CompletableFuture.failedFuture(
                    MemoryException.invalidInput("Search needs a non-empty query and a positive limit"));
        }
        String normalized = query.toLowerCase(Locale.ROOT);
        List<MemoryEntry> matches = state.get().entries().values().stream()
                .flatMap(List::stream)
                .filter(entry -> entry.getMessage().getContent() != null
                        && entry.getMessage().getContent().toLowerCase(Locale.ROOT).contains(normalized))
                .sorted(Comparator.comparing(MemoryEntry::getRecordedAt).reversed())
                .limit(limit)
                .toList();
        return CompletableFuture.completedFuture(matches);
    }

    @Override
    public CompletableFuture<List<ConversationThread>> listThreads() {
        List<ConversationThread> threads = state.get().threads().values().stream()
                .sorted(Comparator.comparing(ConversationThread::getUpdatedAt).reversed())
                .toList();
        return CompletableFuture.completedFuture(threads);
    }

    @Override
    public CompletableFuture<Void> deleteThread(String threadId) {
        while (true) {
            Snapshot current = state.get();
            if (!current.threads().containsKey(threadId)) {
                return CompletableFuture.failedFuture(MemoryException.notFound(threadId));
            }
            if (state.compareAndSet(current, current.without(threadId))) {
                log.debug("[Storage] Deleted thread {}", threadId);
                return CompletableFuture.completedFuture(null);
            }
        }
    }

    private void update(UnaryOperator<Snapshot> change) {
        while (true) {
            Snapshot current = state.get();
            if (state.compareAndSet(current, change.apply(current))) {
                return;
            }
        }
    }

    private record Snapshot(Map<String, ConversationThread> threads, Map<String, List<MemoryEntry>> entries) {

        Snapshot withThread(ConversationThread thread) {
            Map<String, ConversationThread> updated = new HashMap<>(threads);
            updated.put(thread.getId(), thread);
            return new Snapshot(Map.copyOf(updated), entries);
        }

        Snapshot withEntry(MemoryEntry entry) {
            List<MemoryEntry> threadLog = new ArrayList<>(entries.getOrDefault(entry.getThreadId(), List.of()));
            threadLog.add(entry);
            Map<String, List<MemoryEntry>> updated = new HashMap<>(entries);
            updated.put(entry.getThreadId(), List.copyOf(threadLog));
            return new Snapshot(threads, Map.copyOf(updated));
        }

        Snapshot without(String threadId) {
            Map<String, ConversationThread> remainingThreads = new HashMap<>(threads);
            remainingThreads.remove(threadId);
            Map<String, List<MemoryEntry>> remainingEntries = new HashMap<>(entries);
            remainingEntries.remove(threadId);
            return new Snapshot(Map.copyOf(remainingThreads), Map.copyOf(remainingEntries));
        }
    }
}

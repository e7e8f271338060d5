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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentcore.domain.exception.MemoryException;
import me.golemcore.agentcore.domain.model.ConversationThread;
import me.golemcore.agentcore.domain.model.MemoryEntry;
import me.golemcore.agentcore.infrastructure.config.AgentCoreProperties;
import me.golemcore.agentcore.port.outbound.ConversationStorePort;
import me.golemcore.agentcore.port.outbound.StoragePort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * {@link ConversationStorePort} on top of the workspace {@link StoragePort}.
 * Enabled with {@code agentcore.memory.store=local}.
 *
 * <p>
 * Layout inside the memory directory:
 * <ul>
 * <li>{@code threads/<id>.json} - the whole thread, written atomically</li>
 * <li>{@code entries/<id>.jsonl} - one recorded message per line</li>
 * </ul>
 * Thread ids are URL-encoded into file names.
 */
@Component
@ConditionalOnProperty(prefix = "agentcore.memory", name = "store", havingValue = "local")
@RequiredArgsConstructor
@Slf4j
public class StorageConversationStoreAdapter implements ConversationStorePort {

    private static final String THREADS_PREFIX = "threads";
    private static final String ENTRIES_PREFIX = "entries";
    private static final String THREAD_SUFFIX = ".json";
    private static final String ENTRIES_SUFFIX = ".jsonl";
    private static final String NEWLINE = "\n";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final AgentCoreProperties properties;

    @Override
    public CompletableFuture<Void> upsertThread(ConversationThread thread) {
        return guard(thread.getId(), "save thread", () -> storagePort.putTextAtomic(directory(),
                threadPath(thread.getId()), toJson(thread.getId(), thread), false));
    }

    @Override
    public CompletableFuture<Optional<ConversationThread>> loadThread(String threadId) {
        return guard(threadId, "load thread", () -> storagePort.getText(directory(), threadPath(threadId))
                .thenApply(json -> Optional.ofNullable(json).map(text -> parseThread(threadId, text))));
    }

    @Override
    public CompletableFuture<Void> appendEntry(MemoryEntry entry) {
        return guard(entry.getThreadId(), "append entry", () -> storagePort.appendText(directory(),
                entriesPath(entry.getThreadId()), toJson(entry.getThreadId(), entry) + NEWLINE));
    }

    @Override
    public CompletableFuture<List<MemoryEntry>> searchEntries(String query, int limit) {
        if (query == null || query.isBlank() || limit <= 0) {
            return CompletableFuture.failedFuture(
                    MemoryException.invalidInput("Search needs a non-empty query and a positive limit"));
        }
        String normalized = query.toLowerCase(Locale.ROOT);
        return guard(null, "search entries", () -> readAll(ENTRIES_PREFIX, ENTRIES_SUFFIX)
                .thenApply(files -> {
                    List<MemoryEntry> matches = new ArrayList<>();
                    for (String content : files) {
                        for (MemoryEntry entry : parseEntries(content)) {
                            String text = entry.getMessage() != null ? entry.getMessage().getContent() : null;
                            if (text != null && text.toLowerCase(Locale.ROOT).contains(normalized)) {
                                matches.add(entry);
                            }
                        }
                    }
                    return matches.stream()
                            .sorted(Comparator.comparing(MemoryEntry::getRecordedAt,
                                    Comparator.nullsLast(Comparator.reverseOrder())))
                            .limit(limit)
                            .toList();
                }));
    }

    @Override
    public CompletableFuture<List<ConversationThread>> listThreads() {
        return guard(null, "list threads", () -> readAll(THREADS_PREFIX, THREAD_SUFFIX)
                .thenApply(files -> files.stream()
                        .map(json -> parseThread(null, json))
                        .sorted(Comparator.comparing(ConversationThread::getUpdatedAt,
                                Comparator.nullsLast(Comparator.reverseOrder())))
                        .toList()));
    }

    @Override
    public CompletableFuture<Void> deleteThread(String threadId) {
        return guard(threadId, "delete thread", () -> storagePort.exists(directory(), threadPath(threadId))
                .thenCompose(exists -> {
                    if (!Boolean.TRUE.equals(exists)) {
                        throw MemoryException.notFound(threadId);
                    }
                    return storagePort.deleteObject(directory(), threadPath(threadId))
                            .thenCompose(ignored -> storagePort.deleteObject(directory(), entriesPath(threadId)));
                })
                .thenRun(() -> log.debug("[Storage] Deleted thread {}", threadId)));
    }

    private CompletableFuture<List<String>> readAll(String prefix, String suffix) {
        return storagePort.listObjects(directory(), prefix)
                .thenCompose(paths -> {
                    List<CompletableFuture<String>> reads = paths.stream()
                            .filter(path -> path.endsWith(suffix))
                            .map(path -> storagePort.getText(directory(), path))
                            .toList();
                    return CompletableFuture.allOf(reads.toArray(new CompletableFuture[0]))
                            .thenApply(ignored -> reads.stream()
                                    .map(CompletableFuture::join)
                                    .filter(content -> content != null && !content.isBlank())
                                    .toList());
                });
    }

    private List<MemoryEntry> parseEntries(String content) {
        List<MemoryEntry> entries = new ArrayList<>();
        for (String line : content.split(NEWLINE)) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                entries.add(objectMapper.readValue(trimmed, MemoryEntry.class));
            } catch (JsonProcessingException e) {
                log.warn("[Storage] Skipping malformed memory entry: {}", e.getOriginalMessage());
            }
        }
        return entries;
    }

    private ConversationThread parseThread(String threadId, String json) {
        try {
            return objectMapper.readValue(json, ConversationThread.class);
        } catch (JsonProcessingException e) {
            throw MemoryException.persistenceFailed(threadId, "Corrupted thread file: " + e.getOriginalMessage(), e);
        }
    }

    private String toJson(String threadId, Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw MemoryException.persistenceFailed(threadId, "Failed to serialize: " + e.getOriginalMessage(), e);
        }
    }

    private <T> CompletableFuture<T> guard(String threadId, String operation, Supplier<CompletableFuture<T>> action) {
        CompletableFuture<T> future;
        try {
            future = action.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(toMemoryException(threadId, operation, e));
        }
        return future.handle((value, error) -> {
            if (error != null) {
                throw toMemoryException(threadId, operation, error);
            }
            return value;
        });
    }

    private static MemoryException toMemoryException(String threadId, String operation, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof MemoryException memoryException) {
            return memoryException;
        }
        log.error("[Storage] Failed to {} {}: {}", operation, threadId != null ? threadId : "", cause.getMessage());
        return MemoryException.persistenceFailed(threadId, "Failed to " + operation + ": " + cause.getMessage(),
                cause);
    }

    private String directory() {
        return properties.getMemory().getDirectory();
    }

    static String threadPath(String threadId) {
        return THREADS_PREFIX + "/" + encode(threadId) + THREAD_SUFFIX;
    }

    static String entriesPath(String threadId) {
        return ENTRIES_PREFIX + "/" + encode(threadId) + ENTRIES_SUFFIX;
    }

    static String encode(String threadId) {
        return URLEncoder.encode(threadId, StandardCharsets.UTF_8);
    }
}

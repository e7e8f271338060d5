package me.golemcore.agentcore.port.outbound;

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

import me.golemcore.agentcore.domain.model.ConversationThread;
import me.golemcore.agentcore.domain.model.MemoryEntry;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Durable store behind the persistent conversation memory. Failures are
 * {@code MemoryException}s.
 */
public interface ConversationStorePort {

    CompletableFuture<Void> upsertThread(ConversationThread thread);

    CompletableFuture<Optional<ConversationThread>> loadThread(String threadId);

    CompletableFuture<Void> appendEntry(MemoryEntry entry);

    /**
     * Case-insensitive substring search over recorded entries, newest first.
     */
    CompletableFuture<List<MemoryEntry>> searchEntries(String query, int limit);

    /**
     * Stored threads, most recently updated first.
     */
    CompletableFuture<List<ConversationThread>> listThreads();

    /**
     * Removes a thread and its entry log, failing with {@code NOT_FOUND} if it is
     * not stored.
     */
    CompletableFuture<Void> deleteThread(String threadId);
}

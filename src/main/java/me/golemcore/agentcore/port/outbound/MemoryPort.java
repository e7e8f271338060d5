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

import me.golemcore.agentcore.domain.model.ConversationMessage;
import me.golemcore.agentcore.domain.model.ConversationThread;
import me.golemcore.agentcore.domain.model.MemoryEntry;
import me.golemcore.agentcore.domain.model.Message;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Append-only conversation memory keyed by thread id. All failures are
 * {@code MemoryException}s delivered through the returned futures.
 */
public interface MemoryPort {

    /**
     * Appends one message, creating the thread when it does not exist yet.
     */
    CompletableFuture<ConversationThread> append(String threadId, Message message);

    CompletableFuture<ConversationThread> appendAll(String threadId, List<Message> messages);

    /**
     * Returns the messages of a thread, failing with {@code NOT_FOUND} for an
     * unknown id.
     */
    CompletableFuture<List<ConversationMessage>> read(String threadId);

    CompletableFuture<ConversationThread> readThread(String threadId);

    /**
     * Stores the whole thread, replacing any previous version.
     */
    CompletableFuture<ConversationThread> upsert(ConversationThread thread);

    /**
     * Copies the history of {@code fromThreadId} into a new thread whose parent is
     * the source.
     */
    CompletableFuture<ConversationThread> fork(String fromThreadId, String newThreadId);

    /**
     * Case-insensitive substring search across all threads, newest first.
     * A blank query or a non-positive limit fails with {@code INVALID_INPUT}.
     */
    CompletableFuture<List<MemoryEntry>> search(String query, int limit);
}

package me.golemcore.agentcore.domain.model;

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

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * An ordered, append-only conversation history. Threads are immutable: every
 * mutation returns a new instance, which lets registries swap whole snapshots
 * atomically.
 *
 * <p>
 * {@code updatedAt} never moves backwards, even when a message carries an older
 * timestamp than the thread.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ConversationThread {

    String id;

    /**
     * Id of the thread this one was forked from, null for root threads.
     */
    String parentId;

    @Builder.Default
    List<ConversationMessage> messages = List.of();

    @Builder.Default
    ConversationState state = ConversationState.IN_PROGRESS;

    @Builder.Default
    List<ConversationCheckpoint> checkpoints = List.of();

    @Builder.Default
    Map<String, String> metadata = Map.of();

    Instant createdAt;
    Instant updatedAt;

    public static ConversationThread create(String id, Instant at, Map<String, String> metadata) {
        return ConversationThread.builder()
                .id(id)
                .metadata(metadata != null ? Map.copyOf(metadata) : Map.of())
                .createdAt(at)
                .updatedAt(at)
                .build();
    }

    public static ConversationThread create(String id, Instant at) {
        return create(id, at, Map.of());
    }

    public ConversationThread append(ConversationMessage message) {
        return append(message, state);
    }

    public ConversationThread append(ConversationMessage message, ConversationState newState) {
        return appendAll(List.of(message), newState);
    }

    public ConversationThread appendAll(List<ConversationMessage> newMessages, ConversationState newState) {
        List<ConversationMessage> combined = new ArrayList<>(messages);
        Instant latest = updatedAt;
        for (ConversationMessage message : newMessages) {
            combined.add(message);
            latest = later(latest, message.getTimestamp());
        }
        return toBuilder()
                .messages(List.copyOf(combined))
                .state(newState)
                .updatedAt(latest)
                .build();
    }

    public ConversationThread withState(ConversationState newState, Instant at) {
        return toBuilder()
                .state(newState)
                .updatedAt(later(updatedAt, at))
                .build();
    }

    public ConversationThread checkpoint(Instant at, String note) {
        ConversationCheckpoint checkpoint = ConversationCheckpoint.builder()
                .id(UUID.randomUUID().toString())
                .state(state)
                .messageCount(messages.size())
                .createdAt(at)
                .note(note)
                .build();

        List<ConversationCheckpoint> updated = new ArrayList<>(checkpoints);
        updated.add(checkpoint);
        return toBuilder()
                .checkpoints(List.copyOf(updated))
                .updatedAt(later(updatedAt, at))
                .build();
    }

    /**
     * Starts a new branch from this thread. History is copied, checkpoints are
     * not carried over.
     */
    public ConversationThread fork(String newId, Instant at) {
        return toBuilder()
                .id(newId)
                .parentId(id)
                .messages(List.copyOf(messages))
                .state(ConversationState.IN_PROGRESS)
                .checkpoints(List.of())
                .createdAt(at)
                .updatedAt(at)
                .build();
    }

    private static Instant later(Instant current, Instant candidate) {
        if (current == null) {
            return candidate;
        }
        if (candidate == null || candidate.isBefore(current)) {
            return current;
        }
        return candidate;
    }
}

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A {@link Message} recorded inside a {@link ConversationThread}, enriched with
 * bookkeeping used for windowing and accounting: id, timestamp, token count,
 * optional model and cost, metadata and the {@code important} flag that
 * priority-based trimming preserves.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ConversationMessage {

    public static final String SUMMARY_KEY = "summary";

    String id;
    MessageRole role;
    String content;
    String toolCallId;
    String toolName;
    Instant timestamp;
    int tokens;
    String model;
    Double costUsd;

    @Builder.Default
    Map<String, String> metadata = Map.of();

    boolean important;

    /**
     * Wraps a core message. System and tool messages are marked important so that
     * priority trimming keeps instructions and tool evidence.
     */
    public static ConversationMessage fromMessage(Message message, Instant timestamp, int tokens,
            Map<String, String> metadata) {
        return ConversationMessage.builder()
                .id(UUID.randomUUID().toString())
                .role(message.getRole())
                .content(message.getContent())
                .toolCallId(message.getToolCallId())
                .toolName(message.getToolName())
                .timestamp(timestamp)
                .tokens(tokens)
                .metadata(metadata != null ? Map.copyOf(metadata) : Map.of())
                .important(message.getRole() == MessageRole.SYSTEM || message.getRole() == MessageRole.TOOL)
                .build();
    }

    public Message toMessage() {
        return Message.builder()
                .role(role)
                .content(content)
                .toolCallId(toolCallId)
                .toolName(toolName)
                .build();
    }

    @JsonIgnore
    public boolean isSummary() {
        return metadata != null && "true".equals(metadata.get(SUMMARY_KEY));
    }

    @JsonIgnore
    public boolean isSystemMessage() {
        return role == MessageRole.SYSTEM;
    }
}

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

/**
 * A single immutable chat message as exchanged with the language model. Carries
 * the role, text content and, for tool results, the correlating tool call id
 * and tool name.
 */
@Value
@Builder
@Jacksonized
public class Message {

    MessageRole role;
    String content;
    String toolCallId; // For tool response messages
    String toolName;

    public static Message system(String content) {
        return Message.builder().role(MessageRole.SYSTEM).content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role(MessageRole.USER).content(content).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role(MessageRole.ASSISTANT).content(content).build();
    }

    public static Message tool(String toolCallId, String toolName, String content) {
        return Message.builder()
                .role(MessageRole.TOOL)
                .toolCallId(toolCallId)
                .toolName(toolName)
                .content(content)
                .build();
    }

    /**
     * Checks if this is a system message.
     */
    @JsonIgnore
    public boolean isSystemMessage() {
        return role == MessageRole.SYSTEM;
    }

    /**
     * Checks if this is a tool result message.
     */
    @JsonIgnore
    public boolean isToolMessage() {
        return role == MessageRole.TOOL;
    }
}

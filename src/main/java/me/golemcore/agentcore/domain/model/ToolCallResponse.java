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

import java.util.List;

/**
 * Model answer to a tool-enabled request: either final text or a list of tool
 * calls to run before asking again.
 */
@Value
@Builder
public class ToolCallResponse {

    String content;

    @Builder.Default
    List<ToolCall> toolCalls = List.of();

    String finishReason;
    LlmUsage usage;

    public boolean requestsTools() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public static ToolCallResponse text(String content) {
        return ToolCallResponse.builder()
                .content(content)
                .finishReason("stop")
                .build();
    }

    public static ToolCallResponse toolCalls(String content, List<ToolCall> calls) {
        return ToolCallResponse.builder()
                .content(content)
                .toolCalls(List.copyOf(calls))
                .finishReason("tool_calls")
                .build();
    }
}

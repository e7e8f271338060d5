package me.golemcore.agentcore.domain.system.toolloop;

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
import me.golemcore.agentcore.domain.model.ConversationState;
import me.golemcore.agentcore.domain.model.ConversationThread;
import me.golemcore.agentcore.domain.model.LlmProvider;
import me.golemcore.agentcore.domain.model.Message;
import me.golemcore.agentcore.domain.model.ToolCall;
import me.golemcore.agentcore.domain.model.ToolCallResponse;
import me.golemcore.agentcore.domain.service.TokenCounter;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Default implementation: converts each message into a
 * {@link ConversationMessage} stamped with the clock and the estimated token
 * count.
 */
public class DefaultHistoryWriter implements HistoryWriter {

    static final String TOOL_CALL_ID_KEY = "toolCallId";
    static final String TOOL_NAME_KEY = "toolName";
    static final String ERROR_KEY = "error";
    static final String TOOL_CALLS_KEY = "toolCalls";
    static final String FINISH_REASON_KEY = "finishReason";

    private final Clock clock;
    private final TokenCounter tokenCounter;
    private final LlmProvider provider;

    public DefaultHistoryWriter(Clock clock, TokenCounter tokenCounter, LlmProvider provider) {
        this.clock = clock;
        this.tokenCounter = tokenCounter;
        this.provider = provider;
    }

    @Override
    public ConversationThread appendUserPrompt(ConversationThread thread, String prompt) {
        return thread.append(toConversationMessage(Message.user(prompt), Map.of()), ConversationState.IN_PROGRESS);
    }

    @Override
    public ConversationThread appendAssistantToolCalls(ConversationThread thread, ToolCallResponse response) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(TOOL_CALLS_KEY, response.getToolCalls().stream()
                .map(ToolCall::getName)
                .collect(Collectors.joining(",")));
        putFinishReason(metadata, response);
        Message assistant = Message.assistant(response.getContent() != null ? response.getContent() : "");
        return thread.append(toConversationMessage(assistant, metadata), ConversationState.WAITING_FOR_TOOL);
    }

    @Override
    public ConversationThread appendToolResult(ConversationThread thread, ToolExecutionOutcome outcome) {
        Map<String, String> metadata = new LinkedHashMap<>();
        if (outcome.toolCallId() != null) {
            metadata.put(TOOL_CALL_ID_KEY, outcome.toolCallId());
        }
        if (outcome.toolName() != null) {
            metadata.put(TOOL_NAME_KEY, outcome.toolName());
        }
        if (outcome.failed() && outcome.toolResult().getError() != null) {
            metadata.put(ERROR_KEY, outcome.toolResult().getError());
        }
        Message toolMessage = Message.tool(outcome.toolCallId(), outcome.toolName(), outcome.messageContent());
        return thread.append(toConversationMessage(toolMessage, metadata));
    }

    @Override
    public ConversationThread appendFinalAssistantAnswer(ConversationThread thread, ToolCallResponse response) {
        Map<String, String> metadata = new LinkedHashMap<>();
        putFinishReason(metadata, response);
        Message assistant = Message.assistant(response.getContent() != null ? response.getContent() : "");
        return thread.append(toConversationMessage(assistant, metadata), ConversationState.COMPLETED);
    }

    private ConversationMessage toConversationMessage(Message message, Map<String, String> metadata) {
        return ConversationMessage.fromMessage(message, clock.instant(),
                tokenCounter.countMessage(provider, message.getContent()), metadata);
    }

    private static void putFinishReason(Map<String, String> metadata, ToolCallResponse response) {
        if (response.getFinishReason() != null) {
            metadata.put(FINISH_REASON_KEY, response.getFinishReason());
        }
    }
}

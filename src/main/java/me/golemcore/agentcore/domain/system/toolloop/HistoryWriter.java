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

import me.golemcore.agentcore.domain.model.ConversationThread;
import me.golemcore.agentcore.domain.model.ToolCallResponse;

/**
 * Single point of mutation for the conversation thread during a tool loop
 * turn. Every method returns the updated thread.
 */
public interface HistoryWriter {

    ConversationThread appendUserPrompt(ConversationThread thread, String prompt);

    /**
     * Appends the assistant message that requested tools and moves the thread to
     * {@code WAITING_FOR_TOOL}.
     */
    ConversationThread appendAssistantToolCalls(ConversationThread thread, ToolCallResponse response);

    ConversationThread appendToolResult(ConversationThread thread, ToolExecutionOutcome outcome);

    /**
     * Appends the final answer and marks the thread {@code COMPLETED}.
     */
    ConversationThread appendFinalAssistantAnswer(ConversationThread thread, ToolCallResponse response);
}

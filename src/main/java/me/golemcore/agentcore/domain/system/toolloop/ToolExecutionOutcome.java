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

import me.golemcore.agentcore.domain.model.ToolCall;
import me.golemcore.agentcore.domain.model.ToolFailureKind;
import me.golemcore.agentcore.domain.model.ToolResult;

/**
 * Result of a single tool execution (real or synthetic).
 *
 * @param toolCallId
 *            id of the call as provided by the model
 * @param toolName
 *            tool name written into history
 * @param toolResult
 *            raw result (success/failure and structured data)
 * @param messageContent
 *            content of the TOOL message
 * @param synthetic
 *            whether the result was produced without running the tool
 */
public record ToolExecutionOutcome(String toolCallId, String toolName, ToolResult toolResult, String messageContent,
        boolean synthetic) {

    public static ToolExecutionOutcome of(ToolCall toolCall, ToolResult result) {
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), result, result.toMessageContent(),
                false);
    }

    public static ToolExecutionOutcome synthetic(ToolCall toolCall, ToolFailureKind kind, String reason) {
        ToolResult result = ToolResult.failure(kind, reason);
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), result, result.toMessageContent(),
                true);
    }

    public boolean failed() {
        return toolResult != null && !toolResult.isSuccess();
    }
}

package me.golemcore.agentcore.domain.exception;

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

import lombok.Getter;
import me.golemcore.agentcore.domain.model.ConversationThread;

/**
 * Aborted tool conversation turn. The thread as it stood when the turn stopped
 * is attached, already marked {@code FAILED}.
 */
@Getter
public class ToolLoopException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        ITERATIONS_EXHAUSTED, TOOL_FAILED, TOOL_DENIED, INVALID_CONFIGURATION
    }

    private final Reason reason;
    private final transient ConversationThread thread;

    public ToolLoopException(Reason reason, String message, ConversationThread thread) {
        super(message);
        this.reason = reason;
        this.thread = thread;
    }
}

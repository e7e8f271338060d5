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

/**
 * Failure of a conversation memory or store operation.
 */
@Getter
public class MemoryException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        NOT_FOUND, PERSISTENCE_FAILED, INVALID_INPUT
    }

    private final Kind kind;
    private final String threadId;

    public MemoryException(Kind kind, String threadId, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.threadId = threadId;
    }

    public static MemoryException notFound(String threadId) {
        return new MemoryException(Kind.NOT_FOUND, threadId, "Thread not found: " + threadId, null);
    }

    public static MemoryException persistenceFailed(String threadId, String message, Throwable cause) {
        return new MemoryException(Kind.PERSISTENCE_FAILED, threadId, message, cause);
    }

    public static MemoryException invalidInput(String message) {
        return new MemoryException(Kind.INVALID_INPUT, null, message, null);
    }

    public static MemoryException invalidInput(String message, Throwable cause) {
        return new MemoryException(Kind.INVALID_INPUT, null, message, cause);
    }
}

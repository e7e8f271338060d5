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
 * Failure raised while validating, routing or running agents. {@code agent} is
 * set for {@link Kind#EXECUTION} and {@link Kind#NOT_FOUND}.
 */
@Getter
public class AgentException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        VALIDATION, EXECUTION, ROUTING, NOT_FOUND, CONFLICT
    }

    private final Kind kind;
    private final String agent;

    public AgentException(Kind kind, String agent, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.agent = agent;
    }

    public static AgentException validation(String message) {
        return new AgentException(Kind.VALIDATION, null, message, null);
    }

    public static AgentException execution(String agent, String message, Throwable cause) {
        return new AgentException(Kind.EXECUTION, agent, "Agent '" + agent + "' failed: " + message, cause);
    }

    public static AgentException routing(String message) {
        return new AgentException(Kind.ROUTING, null, message, null);
    }

    public static AgentException notFound(String agent) {
        return new AgentException(Kind.NOT_FOUND, agent, "Agent not found: " + agent, null);
    }

    public static AgentException conflict(String message) {
        return new AgentException(Kind.CONFLICT, null, message, null);
    }
}

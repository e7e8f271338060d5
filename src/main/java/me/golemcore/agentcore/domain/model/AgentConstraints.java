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

import java.util.Set;

/**
 * Limits applied to an {@link AgentContext} before each agent call.
 */
@Value
@Builder
public class AgentConstraints {

    public static final int DEFAULT_MAX_CONTEXT_MESSAGES = 40;
    public static final int DEFAULT_MAX_ESTIMATED_TOKENS = 12_000;

    @Builder.Default
    int maxContextMessages = DEFAULT_MAX_CONTEXT_MESSAGES;

    @Builder.Default
    int maxEstimatedTokens = DEFAULT_MAX_ESTIMATED_TOKENS;

    @Builder.Default
    Set<String> allowedTools = Set.of();

    boolean enforceAllowedTools;

    public static AgentConstraints defaults() {
        return AgentConstraints.builder().build();
    }
}

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

import java.util.Map;

/**
 * Output of a single agent invocation. A non-null {@link #handoff} asks the
 * coordinator to continue in another agent; {@link #statePatch} entries are
 * merged into the context state before that happens.
 */
@Value
@Builder
public class AgentResult {

    String agent;
    String content;
    AgentHandoff handoff;

    @Builder.Default
    Map<String, Object> statePatch = Map.of();

    @Builder.Default
    Map<String, String> metadata = Map.of();

    public boolean hasHandoff() {
        return handoff != null;
    }

    public static AgentResult of(String agent, String content) {
        return AgentResult.builder().agent(agent).content(content).build();
    }
}

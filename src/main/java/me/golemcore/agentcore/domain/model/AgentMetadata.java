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
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Describes an agent for routing: its name, the capability tags it serves, a
 * semantic version and a priority used to break ties (higher wins).
 */
@Value
@Builder
public class AgentMetadata {

    String name;

    @Singular
    Set<String> capabilities;

    @Builder.Default
    String version = "1.0.0";

    String description;

    @Builder.Default
    int priority = 0;

    public boolean hasCapability(String capability) {
        return capabilities != null && capabilities.contains(capability);
    }
}

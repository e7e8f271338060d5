package me.golemcore.agentcore.routing;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentcore.domain.component.AgentComponent;
import me.golemcore.agentcore.domain.exception.AgentException;
import me.golemcore.agentcore.domain.model.AgentMetadata;
import me.golemcore.agentcore.domain.model.ConflictResolution;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Picks the agent that serves a capability.
 *
 * <p>
 * Enabled agents declaring the capability are candidates. A single candidate
 * is returned directly; several are resolved with the requested
 * {@link ConflictResolution}.
 */
@Component
@Slf4j
public class AgentRouter {

    private static final Comparator<AgentComponent> BY_PRIORITY = Comparator
            .comparingInt((AgentComponent agent) -> agent.getMetadata().getPriority())
            .thenComparing(agent -> agent.getMetadata().getName());

    private static final Comparator<AgentComponent> BY_VERSION = Comparator
            .comparingLong((AgentComponent agent) -> SemanticVersion.score(agent.getMetadata().getVersion()))
            .thenComparing(agent -> agent.getMetadata().getName());

    /**
     * @throws AgentException
     *             {@code ROUTING} when no agent has the capability,
     *             {@code CONFLICT} when several do and the strategy is
     *             {@link ConflictResolution#FAIL_ON_CONFLICT}
     */
    public AgentComponent route(String capability, List<AgentComponent> agents, ConflictResolution strategy) {
        List<AgentComponent> candidates = agents.stream()
                .filter(AgentComponent::isEnabled)
                .filter(agent -> agent.getMetadata().hasCapability(capability))
                .toList();

        if (candidates.isEmpty()) {
            throw AgentException.routing("No agent available for capability: " + capability);
        }
        if (candidates.size() == 1) {
            return candidates.get(0);
        }

        AgentComponent selected = switch (strategy) {
        case HIGHEST_PRIORITY -> candidates.stream().max(BY_PRIORITY).orElseThrow();
        case NEWEST_VERSION -> candidates.stream().max(BY_VERSION).orElseThrow();
        case FIRST_REGISTERED -> candidates.get(0);
        case FAIL_ON_CONFLICT -> throw AgentException.conflict("Multiple agents claim capability '" + capability
                + "': " + candidates.stream().map(AgentComponent::getMetadata).map(AgentMetadata::getName)
                        .collect(Collectors.joining(", ")));
        };
        log.debug("[Agents] Routed '{}' to {} among {} candidates ({})", capability, selected.getName(),
                candidates.size(), strategy);
        return selected;
    }
}

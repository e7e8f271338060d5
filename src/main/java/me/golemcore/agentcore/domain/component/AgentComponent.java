package me.golemcore.agentcore.domain.component;

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

import me.golemcore.agentcore.domain.exception.AgentException;
import me.golemcore.agentcore.domain.model.AgentContext;
import me.golemcore.agentcore.domain.model.AgentMetadata;
import me.golemcore.agentcore.domain.model.AgentResult;

import java.util.concurrent.CompletableFuture;

/**
 * A routable unit of work. Agents advertise capabilities through their metadata
 * and answer an input within a trimmed {@link AgentContext}; a result may hand
 * the task over to another agent.
 */
public interface AgentComponent extends Component {

    @Override
    default String getComponentType() {
        return "agent";
    }

    AgentMetadata getMetadata();

    /**
     * Runs the agent. Failures are delivered through the returned future.
     *
     * @param input
     *            the user or handoff input
     * @param context
     *            the context after trimming
     * @return a future with the agent's result
     */
    CompletableFuture<AgentResult> execute(String input, AgentContext context);

    default String getName() {
        return getMetadata().getName();
    }

    /**
     * Checks the metadata an agent must carry to be registered or routed to.
     *
     * @throws AgentException
     *             with kind {@code VALIDATION} when the name is blank or no
     *             capability is declared
     */
    static void validate(AgentComponent agent) {
        AgentMetadata metadata = agent.getMetadata();
        if (metadata == null || metadata.getName() == null || metadata.getName().isBlank()) {
            throw AgentException.validation("Agent name must not be blank");
        }
        if (metadata.getCapabilities() == null || metadata.getCapabilities().isEmpty()) {
            throw AgentException.validation("Agent '" + metadata.getName() + "' declares no capabilities");
        }
    }
}

package me.golemcore.agentcore.domain.service;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentcore.domain.component.AgentComponent;
import me.golemcore.agentcore.domain.exception.AgentException;
import me.golemcore.agentcore.domain.model.ConflictResolution;
import me.golemcore.agentcore.routing.AgentRouter;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Agents known to the runtime, in registration order. Agent beans present in
 * the application context are registered on startup.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentRegistryService {

    private final AgentRouter router;
    private final ObjectProvider<AgentComponent> agentBeans;

    private final AtomicReference<List<AgentComponent>> agents = new AtomicReference<>(List.of());

    @PostConstruct
    public void init() {
        agentBeans.orderedStream().forEach(this::register);
        log.info("[Agents] Registered {} agent(s)", agents.get().size());
    }

    /**
     * @throws AgentException
     *             {@code VALIDATION} for invalid metadata or a name that is
     *             already taken
     */
    public void register(AgentComponent agent) {
        AgentComponent.validate(agent);
        String name = agent.getName();
        while (true) {
            List<AgentComponent> current = agents.get();
            if (current.stream().anyMatch(existing -> existing.getName().equalsIgnoreCase(name))) {
                throw AgentException.validation("Agent already registered: " + name);
            }
            List<AgentComponent> updated = new ArrayList<>(current);
            updated.add(agent);
            if (agents.compareAndSet(current, List.copyOf(updated))) {
                log.debug("[Agents] Registered agent {} with capabilities {}", name,
                        agent.getMetadata().getCapabilities());
                return;
            }
        }
    }

    public boolean unregister(String name) {
        while (true) {
            List<AgentComponent> current = agents.get();
            List<AgentComponent> updated = current.stream()
                    .filter(agent -> !agent.getName().equalsIgnoreCase(name))
                    .toList();
            if (updated.size() == current.size()) {
                return false;
            }
            if (agents.compareAndSet(current, updated)) {
                log.debug("[Agents] Unregistered agent {}", name);
                return true;
            }
        }
    }

    public Optional<AgentComponent> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return agents.get().stream()
                .filter(agent -> agent.getName().equalsIgnoreCase(name))
                .findFirst();
    }

    public List<AgentComponent> list() {
        return agents.get();
    }

    public AgentComponent route(String capability, ConflictResolution strategy) {
        return router.route(capability, agents.get(), strategy);
    }
}

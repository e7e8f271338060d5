package me.golemcore.agentcore;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Main application class for the GolemCore agent runtime.
 *
 * <p>
 * An in-process runtime in which independent agents cooperate on a shared
 * task.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Capability Routing</b> - agents are selected by capability with
 * priority, version or first-registered conflict resolution</li>
 * <li><b>Handoff and Fan-out</b> - bounded handoff chains and parallel agent
 * execution</li>
 * <li><b>Context Windows</b> - provider-aware token budgets with FIFO, sliding,
 * priority and summarizing strategies</li>
 * <li><b>Conversation Memory</b> - append-only threads with fork, search and
 * write-through persistence</li>
 * <li><b>Prompt Registry</b> - versioned templates with rollback, composition
 * and deterministic variants</li>
 * <li><b>Tool Loop</b> - multi-turn tool calling on a conversation thread</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Domain Layer       → AgentCoordinator, ToolLoopSystem, Services
 * Ports              → LlmPort, MemoryPort, ConversationStorePort, StoragePort
 * Infrastructure     → Storage adapters, configuration
 * </pre>
 *
 * <p>
 * Configuration is managed via {@code application.properties} under the
 * {@code agentcore.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableAsync
public class AgentCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentCoreApplication.class, args);
    }
}

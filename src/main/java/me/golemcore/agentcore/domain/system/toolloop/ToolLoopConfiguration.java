package me.golemcore.agentcore.domain.system.toolloop;

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

import me.golemcore.agentcore.domain.service.TokenCounter;
import me.golemcore.agentcore.domain.service.ToolRegistryService;
import me.golemcore.agentcore.infrastructure.config.AgentCoreProperties;
import me.golemcore.agentcore.port.outbound.LlmPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/** Spring wiring for ToolLoopSystem (domain orchestrator + ports). */
@Configuration
public class ToolLoopConfiguration {

    @Bean
    public ToolExecutorPort toolExecutorPort(ToolRegistryService toolRegistryService) {
        return new RegistryToolExecutor(toolRegistryService);
    }

    @Bean
    public HistoryWriter toolLoopHistoryWriter(Clock clock, TokenCounter tokenCounter,
            AgentCoreProperties properties) {
        return new DefaultHistoryWriter(clock, tokenCounter, properties.getContext().getProvider());
    }

    @Bean
    public ToolLoopSystem toolLoopSystem(LlmPort llmPort, ToolExecutorPort toolExecutorPort,
            HistoryWriter historyWriter, AgentCoreProperties properties, Clock clock) {
        return new DefaultToolLoopSystem(llmPort, toolExecutorPort, historyWriter, properties.getToolLoop(), clock);
    }
}

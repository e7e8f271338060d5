package me.golemcore.agentcore.infrastructure.config;

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
import me.golemcore.agentcore.adapter.outbound.llm.NoOpLlmAdapter;
import me.golemcore.agentcore.port.outbound.LlmPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Falls back to {@link NoOpLlmAdapter} when no provider adapter is registered.
 */
@Configuration
@Slf4j
public class LlmConfiguration {

    @Bean
    @ConditionalOnMissingBean(LlmPort.class)
    public LlmPort noOpLlmPort(AgentCoreProperties properties) {
        log.warn("No LlmPort bean found, using NoOpLlmAdapter");
        return new NoOpLlmAdapter(properties.getContext().getProvider());
    }
}

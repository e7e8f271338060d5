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
import me.golemcore.agentcore.domain.service.InMemoryConversationMemory;
import me.golemcore.agentcore.domain.service.PersistentConversationMemory;
import me.golemcore.agentcore.domain.service.TokenCounter;
import me.golemcore.agentcore.port.outbound.ConversationStorePort;
import me.golemcore.agentcore.port.outbound.MemoryPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Memory wiring: in-memory only, or write-through persistent memory when a
 * {@link ConversationStorePort} is enabled via {@code agentcore.memory.store}.
 */
@Configuration
@Slf4j
public class MemoryConfiguration {

    @Bean
    public MemoryPort memoryPort(Clock clock, TokenCounter tokenCounter, AgentCoreProperties properties,
            ObjectProvider<ConversationStorePort> storeProvider) {
        InMemoryConversationMemory cache = new InMemoryConversationMemory(clock, tokenCounter,
                properties.getContext().getProvider());
        ConversationStorePort store = storeProvider.getIfAvailable();
        if (store == null) {
            log.info("[Memory] Using in-memory conversation memory");
            return cache;
        }
        log.info("[Memory] Using persistent conversation memory backed by {}", store.getClass().getSimpleName());
        return new PersistentConversationMemory(cache, store, clock);
    }
}

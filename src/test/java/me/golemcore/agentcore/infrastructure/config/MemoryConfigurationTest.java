package me.golemcore.agentcore.infrastructure.config;

import me.golemcore.agentcore.adapter.outbound.storage.InMemoryConversationStore;
import me.golemcore.agentcore.domain.service.DefaultTokenCounter;
import me.golemcore.agentcore.domain.service.InMemoryConversationMemory;
import me.golemcore.agentcore.domain.service.PersistentConversationMemory;
import me.golemcore.agentcore.port.outbound.ConversationStorePort;
import me.golemcore.agentcore.port.outbound.MemoryPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.mockito.Mockito.when;

class MemoryConfigurationTest {

    @Mock
    private ObjectProvider<ConversationStorePort> storeProvider;

    private final MemoryConfiguration configuration = new MemoryConfiguration();
    private final Clock clock = Clock.fixed(Instant.parse("2026-02-14T00:00:00Z"), ZoneId.of("UTC"));

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    void shouldUseInMemoryMemoryWithoutStore() {
        when(storeProvider.getIfAvailable()).thenReturn(null);

        MemoryPort memory = configuration.memoryPort(clock, new DefaultTokenCounter(), new AgentCoreProperties(),
                storeProvider);

        assertInstanceOf(InMemoryConversationMemory.class, memory);
    }

    @Test
    void shouldUsePersistentMemoryWhenStoreIsEnabled() {
        when(storeProvider.getIfAvailable()).thenReturn(new InMemoryConversationStore());

        MemoryPort memory = configuration.memoryPort(clock, new DefaultTokenCounter(), new AgentCoreProperties(),
                storeProvider);

        assertInstanceOf(PersistentConversationMemory.class, memory);
    }
}

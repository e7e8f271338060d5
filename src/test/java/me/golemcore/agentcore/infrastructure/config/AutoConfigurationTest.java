package me.golemcore.agentcore.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agentcore.domain.model.ConversationThread;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AutoConfigurationTest {

    @Test
    void shouldLogSettingsOnInit() {
        AutoConfiguration autoConfiguration = new AutoConfiguration(new AgentCoreProperties());

        assertDoesNotThrow(autoConfiguration::init);
    }

    @Test
    void shouldWriteInstantsAsIsoStrings() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        String json = mapper.writeValueAsString(
                ConversationThread.create("t-1", Instant.parse("2026-02-14T00:00:00Z")));

        assertTrue(json.contains("\"createdAt\":\"2026-02-14T00:00:00Z\""));
    }

    @Test
    void shouldIgnoreUnknownProperties() throws Exception {
        ConversationThread thread = AutoConfiguration.objectMapper()
                .readValue("{\"id\":\"t-1\",\"futureField\":true}", ConversationThread.class);

        assertEquals("t-1", thread.getId());
    }
}

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.golemcore.agentcore.domain.exception.MemoryException;
import me.golemcore.agentcore.domain.model.ConversationThread;
import org.springframework.stereotype.Component;

/**
 * JSON export and import of whole conversation threads.
 */
@Component
@RequiredArgsConstructor
public class ConversationCodec {

    private final ObjectMapper objectMapper;

    public String exportJson(ConversationThread thread) {
        try {
            return objectMapper.writeValueAsString(thread);
        } catch (JsonProcessingException e) {
            throw MemoryException.invalidInput("Failed to export thread " + thread.getId(), e);
        }
    }

    public ConversationThread importJson(String json) {
        if (json == null || json.isBlank()) {
            throw MemoryException.invalidInput("Thread JSON must not be empty");
        }
        try {
            ConversationThread thread = objectMapper.readValue(json, ConversationThread.class);
            if (thread.getId() == null || thread.getId().isBlank()) {
                throw MemoryException.invalidInput("Thread JSON has no id");
            }
            return thread;
        } catch (JsonProcessingException e) {
            throw MemoryException.invalidInput("Malformed thread JSON: " + e.getOriginalMessage(), e);
        }
    }
}

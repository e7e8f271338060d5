package me.golemcore.agentcore.port.outbound;

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

import me.golemcore.agentcore.domain.model.LlmChunk;
import me.golemcore.agentcore.domain.model.LlmProvider;
import me.golemcore.agentcore.domain.model.LlmResponse;
import me.golemcore.agentcore.domain.model.Message;
import me.golemcore.agentcore.domain.model.ToolCallResponse;
import me.golemcore.agentcore.domain.model.ToolDefinition;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Port to the language-model service. Provider adapters live outside this
 * module; failures are delivered as {@code LlmException} through the returned
 * futures and fluxes.
 */
public interface LlmPort {

    LlmProvider getProvider();

    CompletableFuture<LlmResponse> execute(String prompt);

    CompletableFuture<LlmResponse> executeWithHistory(List<Message> history);

    /**
     * Streams a completion. Default implementation emits the full response as a
     * single final chunk.
     */
    default Flux<LlmChunk> executeStream(String prompt) {
        return Mono.fromFuture(() -> execute(prompt)).flux()
                .map(response -> LlmChunk.builder()
                        .text(response.getContent())
                        .done(true)
                        .usage(response.getUsage())
                        .build());
    }

    /**
     * Sends a prompt together with the callable tools. The response either
     * carries final content or requests tool calls.
     */
    CompletableFuture<ToolCallResponse> executeWithTools(String prompt, List<ToolDefinition> tools);

    /**
     * Asks for output conforming to a JSON schema and decodes it into
     * {@code type}. Decoding failures complete with {@code LlmException(PARSE)}.
     */
    <T> CompletableFuture<T> executeStructured(String prompt, Map<String, Object> schema, Class<T> type);

    boolean isAvailable();
}

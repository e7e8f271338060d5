package me.golemcore.agentcore.adapter.outbound.llm;

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
import me.golemcore.agentcore.domain.exception.LlmException;
import me.golemcore.agentcore.domain.model.LlmProvider;
import me.golemcore.agentcore.domain.model.LlmResponse;
import me.golemcore.agentcore.domain.model.LlmUsage;
import me.golemcore.agentcore.domain.model.Message;
import me.golemcore.agentcore.domain.model.ToolCallResponse;
import me.golemcore.agentcore.domain.model.ToolDefinition;
import me.golemcore.agentcore.port.outbound.LlmPort;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Placeholder model port used when the application provides no provider
 * adapter. Text requests get a fixed answer; structured requests fail with
 * {@code CONFIG}.
 */
@Slf4j
public class NoOpLlmAdapter implements LlmPort {

    static final String PLACEHOLDER = "[No LLM configured]";

    private final LlmProvider provider;

    public NoOpLlmAdapter(LlmProvider provider) {
        this.provider = provider;
    }

    @Override
    public LlmProvider getProvider() {
        return provider;
    }

    @Override
    public CompletableFuture<LlmResponse> execute(String prompt) {
        log.warn("NoOpLlmAdapter: execute() called - no LLM configured");
        return CompletableFuture.completedFuture(placeholder());
    }

    @Override
    public CompletableFuture<LlmResponse> executeWithHistory(List<Message> history) {
        log.warn("NoOpLlmAdapter: executeWithHistory() called - no LLM configured");
        return CompletableFuture.completedFuture(placeholder());
    }

    @Override
    public CompletableFuture<ToolCallResponse> executeWithTools(String prompt, List<ToolDefinition> tools) {
        log.warn("NoOpLlmAdapter: executeWithTools() called - no LLM configured");
        return CompletableFuture.completedFuture(ToolCallResponse.text(PLACEHOLDER));
    }

    @Override
    public <T> CompletableFuture<T> executeStructured(String prompt, Map<String, Object> schema, Class<T> type) {
        return CompletableFuture.failedFuture(
                new LlmException(LlmException.Kind.CONFIG, "No LLM configured for structured output"));
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    private static LlmResponse placeholder() {
        return LlmResponse.builder()
                .content(PLACEHOLDER)
                .model("none")
                .finishReason("stop")
                .usage(LlmUsage.of(0, 0))
                .build();
    }
}

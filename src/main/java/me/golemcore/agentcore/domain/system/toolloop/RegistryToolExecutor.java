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

import me.golemcore.agentcore.domain.model.ToolCall;
import me.golemcore.agentcore.domain.service.ToolRegistryService;

import java.util.concurrent.CompletableFuture;

/**
 * {@link ToolExecutorPort} backed by the {@link ToolRegistryService}.
 */
public class RegistryToolExecutor implements ToolExecutorPort {

    private final ToolRegistryService toolRegistry;

    public RegistryToolExecutor(ToolRegistryService toolRegistry) {
        this.toolRegistry = toolRegistry;
    }

    @Override
    public CompletableFuture<ToolExecutionOutcome> execute(ToolCall toolCall) {
        return toolRegistry.execute(toolCall.getName(), toolCall.getArguments())
                .thenApply(result -> ToolExecutionOutcome.of(toolCall, result));
    }
}

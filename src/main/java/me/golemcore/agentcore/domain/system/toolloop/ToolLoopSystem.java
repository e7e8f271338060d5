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

import me.golemcore.agentcore.domain.model.ConversationThread;
import me.golemcore.agentcore.domain.model.ToolDefinition;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Executes the model -> tools -> model loop for one user turn on a
 * conversation thread.
 */
public interface ToolLoopSystem {

    /**
     * Runs one turn with the configured iteration limit.
     */
    CompletableFuture<ToolLoopTurnResult> processTurn(String prompt, ConversationThread thread,
            List<ToolDefinition> tools);

    /**
     * Runs one turn. Each iteration is one model call; the turn fails with
     * {@code ITERATIONS_EXHAUSTED} when the model still requests tools after
     * {@code maxIterations} calls.
     */
    CompletableFuture<ToolLoopTurnResult> processTurn(String prompt, ConversationThread thread,
            List<ToolDefinition> tools, int maxIterations);
}

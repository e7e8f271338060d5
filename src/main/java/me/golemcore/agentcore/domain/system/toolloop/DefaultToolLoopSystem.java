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

import me.golemcore.agentcore.domain.exception.ToolLoopException;
import me.golemcore.agentcore.domain.model.ConversationMessage;
import me.golemcore.agentcore.domain.model.ConversationState;
import me.golemcore.agentcore.domain.model.ConversationThread;
import me.golemcore.agentcore.domain.model.ToolCall;
import me.golemcore.agentcore.domain.model.ToolDefinition;
import me.golemcore.agentcore.domain.model.ToolFailureKind;
import me.golemcore.agentcore.infrastructure.config.AgentCoreProperties;
import me.golemcore.agentcore.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

/**
 * Tool loop orchestrator.
 *
 * <p>
 * Contract: the prompt is appended, the model sees the transcript and the
 * tools, requested tools run one after another with their results appended as
 * TOOL messages, and the model is asked again until it answers without tool
 * calls. Model failures propagate unchanged.
 */
public class DefaultToolLoopSystem implements ToolLoopSystem {

    private static final Logger log = LoggerFactory.getLogger(DefaultToolLoopSystem.class);

    private final LlmPort llmPort;
    private final ToolExecutorPort toolExecutor;
    private final HistoryWriter historyWriter;
    private final AgentCoreProperties.ToolLoopProperties settings;
    private final Clock clock;

    public DefaultToolLoopSystem(LlmPort llmPort, ToolExecutorPort toolExecutor, HistoryWriter historyWriter,
            AgentCoreProperties.ToolLoopProperties settings, Clock clock) {
        this.llmPort = llmPort;
        this.toolExecutor = toolExecutor;
        this.historyWriter = historyWriter;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public CompletableFuture<ToolLoopTurnResult> processTurn(String prompt, ConversationThread thread,
            List<ToolDefinition> tools) {
        int maxIterations = settings != null ? settings.getMaxIterations() : 8;
        return processTurn(prompt, thread, tools, maxIterations);
    }

    @Override
    public CompletableFuture<ToolLoopTurnResult> processTurn(String prompt, ConversationThread thread,
            List<ToolDefinition> tools, int maxIterations) {
        if (maxIterations <= 0) {
            return CompletableFuture.failedFuture(new ToolLoopException(
                    ToolLoopException.Reason.INVALID_CONFIGURATION,
                    "maxIterations must be > 0, got " + maxIterations,
                    thread.withState(ConversationState.FAILED, clock.instant())));
        }
        ConversationThread started = historyWriter.appendUserPrompt(thread, prompt);
        return iterate(new LoopState(started, 0, 0), tools, maxIterations);
    }

    private CompletableFuture<ToolLoopTurnResult> iterate(LoopState state, List<ToolDefinition> tools,
            int maxIterations) {
        if (state.llmCalls() >= maxIterations) {
            log.warn("[ToolLoop] Thread {} still requests tools after {} model calls", state.thread().getId(),
                    state.llmCalls());
            return CompletableFuture.failedFuture(fail(ToolLoopException.Reason.ITERATIONS_EXHAUSTED,
                    "Tool loop exceeded " + maxIterations + " iterations", state.thread()));
        }

        return llmPort.executeWithTools(renderTranscript(state.thread()), tools)
                .thenCompose(response -> {
                    int llmCalls = state.llmCalls() + 1;
                    if (!response.requestsTools()) {
                        ConversationThread done = historyWriter.appendFinalAssistantAnswer(state.thread(), response);
                        log.debug("[ToolLoop] Thread {} completed after {} model call(s), {} tool execution(s)",
                                done.getId(), llmCalls, state.toolExecutions());
                        return CompletableFuture.completedFuture(
                                new ToolLoopTurnResult(done, response, llmCalls, state.toolExecutions()));
                    }

                    log.debug("[ToolLoop] Model requested {} tool call(s): {}", response.getToolCalls().size(),
                            response.getToolCalls().stream().map(ToolCall::getName)
                                    .collect(Collectors.joining(", ")));
                    ConversationThread waiting = historyWriter.appendAssistantToolCalls(state.thread(), response);
                    return executeCalls(new LoopState(waiting, llmCalls, state.toolExecutions()),
                            response.getToolCalls(), 0)
                            .thenCompose(after -> iterate(new LoopState(
                                    after.thread().withState(ConversationState.IN_PROGRESS, clock.instant()),
                                    after.llmCalls(), after.toolExecutions()), tools, maxIterations));
                });
    }

    private CompletableFuture<LoopState> executeCalls(LoopState state, List<ToolCall> calls, int index) {
        if (index >= calls.size()) {
            return CompletableFuture.completedFuture(state);
        }
        ToolCall call = calls.get(index);
        return executeOne(call).thenCompose(outcome -> {
            ConversationThread updated = historyWriter.appendToolResult(state.thread(), outcome);
            LoopState next = new LoopState(updated, state.llmCalls(), state.toolExecutions() + 1);

            if (outcome.failed()) {
                ToolFailureKind kind = outcome.toolResult().getFailureKind();
                if (kind == ToolFailureKind.POLICY_DENIED && settings != null && settings.isStopOnToolPolicyDenied()) {
                    throw fail(ToolLoopException.Reason.TOOL_DENIED,
                            "Tool denied by policy: " + outcome.toolName(), updated);
                }
                if (settings != null && settings.isStopOnToolFailure()) {
                    throw fail(ToolLoopException.Reason.TOOL_FAILED,
                            "Tool failure (" + outcome.toolName() + "): " + outcome.toolResult().getError(), updated);
                }
            }
            return executeCalls(next, calls, index + 1);
        });
    }

    private CompletableFuture<ToolExecutionOutcome> executeOne(ToolCall call) {
        CompletableFuture<ToolExecutionOutcome> future;
        try {
            future = toolExecutor.execute(call);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(syntheticFailure(call, e));
        }
        return future.handle((outcome, error) -> {
            if (error != null) {
                return syntheticFailure(call, error);
            }
            return outcome != null ? outcome
                    : ToolExecutionOutcome.synthetic(call, ToolFailureKind.EXECUTION_FAILED, "Tool returned no result");
        });
    }

    private ToolExecutionOutcome syntheticFailure(ToolCall call, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        log.warn("[ToolLoop] Tool {} failed: {}", call.getName(), cause.getMessage());
        return ToolExecutionOutcome.synthetic(call, ToolFailureKind.EXECUTION_FAILED,
                "Tool execution failed: " + cause.getMessage());
    }

    private ToolLoopException fail(ToolLoopException.Reason reason, String message, ConversationThread thread) {
        return new ToolLoopException(reason, message, thread.withState(ConversationState.FAILED, clock.instant()));
    }

    static String renderTranscript(ConversationThread thread) {
        return thread.getMessages().stream()
                .map(DefaultToolLoopSystem::renderLine)
                .collect(Collectors.joining("\n"));
    }

    private static String renderLine(ConversationMessage message) {
        String content = message.getContent() != null ? message.getContent() : "";
        return message.getRole().getValue() + ": " + content;
    }

    private record LoopState(ConversationThread thread, int llmCalls, int toolExecutions) {
    }
}

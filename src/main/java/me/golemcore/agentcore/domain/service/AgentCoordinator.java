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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentcore.domain.component.AgentComponent;
import me.golemcore.agentcore.domain.exception.AgentException;
import me.golemcore.agentcore.domain.model.AgentContext;
import me.golemcore.agentcore.domain.model.AgentHandoff;
import me.golemcore.agentcore.domain.model.AgentResult;
import me.golemcore.agentcore.domain.model.ContextTrimStrategy;
import me.golemcore.agentcore.infrastructure.config.AgentCoreProperties;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

/**
 * Runs agents: sequential handoff chains and parallel fan-out.
 *
 * <p>
 * A handoff chain is a state machine over (agent, depth). Before every call
 * the context is trimmed. When a result names a handoff target, the state patch
 * is applied, the context forks to {@code <threadId>:handoff:<depth>} and the
 * next agent receives the original input plus a rendered handoff note. A step
 * at depth {@code maxDepth} or deeper fails with {@code VALIDATION}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentCoordinator {

    public static final String PARALLEL_AGENT = "parallel-coordinator";
    public static final String AGENTS_EXECUTED_KEY = "agents_executed";

    private final AgentCoreProperties properties;
    private final ObjectMapper objectMapper;

    public CompletableFuture<AgentResult> executeWithHandoff(String input, AgentComponent initialAgent,
            AgentContext context, List<AgentComponent> agents) {
        return executeWithHandoff(input, initialAgent, context, agents,
                properties.getCoordinator().getMaxHandoffDepth());
    }

    public CompletableFuture<AgentResult> executeWithHandoff(String input, AgentComponent initialAgent,
            AgentContext context, List<AgentComponent> agents, int maxDepth) {
        if (maxDepth <= 0) {
            return CompletableFuture.failedFuture(AgentException.validation("maxDepth must be > 0"));
        }
        return step(input, initialAgent, context, agents, 0, maxDepth);
    }

    public CompletableFuture<AgentResult> executeParallel(String input, AgentContext context,
            List<AgentComponent> agents) {
        return executeParallel(input, context, agents, AgentCoordinator::aggregate);
    }

    /**
     * Invokes every agent concurrently on the same trimmed context. Any failure
     * fails the whole fan-out.
     */
    public CompletableFuture<AgentResult> executeParallel(String input, AgentContext context,
            List<AgentComponent> agents, Function<List<AgentResult>, AgentResult> aggregator) {
        AgentContext trimmed = context.trim(trimStrategy());
        List<CompletableFuture<AgentResult>> calls = agents.stream()
                .map(agent -> invoke(agent, input, trimmed))
                .toList();

        return CompletableFuture.allOf(calls.toArray(new CompletableFuture[0]))
                .handle((ignored, error) -> {
                    if (error != null) {
                        throw new CompletionException(unwrap(error));
                    }
                    List<AgentResult> results = calls.stream().map(CompletableFuture::join).toList();
                    log.debug("[Agents] Parallel execution finished for {} agent(s)", results.size());
                    return aggregator.apply(results);
                });
    }

    /**
     * Default fan-out aggregation: one {@code [agent] content} line per result,
     * metadata merged in result order (later wins) plus the number of agents run.
     */
    public static AgentResult aggregate(List<AgentResult> results) {
        StringBuilder content = new StringBuilder();
        Map<String, String> metadata = new LinkedHashMap<>();
        for (AgentResult result : results) {
            if (!content.isEmpty()) {
                content.append('\n');
            }
            content.append('[').append(result.getAgent()).append("] ").append(result.getContent());
            metadata.putAll(result.getMetadata());
        }
        metadata.put(AGENTS_EXECUTED_KEY, String.valueOf(results.size()));
        return AgentResult.builder()
                .agent(PARALLEL_AGENT)
                .content(content.toString())
                .metadata(Map.copyOf(metadata))
                .build();
    }

    private CompletableFuture<AgentResult> step(String input, AgentComponent agent, AgentContext context,
            List<AgentComponent> agents, int depth, int maxDepth) {
        if (depth >= maxDepth) {
            return CompletableFuture.failedFuture(
                    AgentException.validation("Handoff depth exceeded limit: " + maxDepth));
        }

        log.debug("[Agents] Executing {} at depth {}", agent.getName(), depth);
        return invoke(agent, input, context.trim(trimStrategy()))
                .thenCompose(result -> {
                    if (!result.hasHandoff()) {
                        return CompletableFuture.completedFuture(result);
                    }
                    AgentHandoff handoff = result.getHandoff();
                    AgentComponent target = agents.stream()
                            .filter(candidate -> candidate.getName().equals(handoff.getTargetAgent()))
                            .findFirst()
                            .orElseThrow(() -> AgentException.notFound(handoff.getTargetAgent()));

                    int nextDepth = depth + 1;
                    AgentContext nextContext = context
                            .applyStatePatch(result.getStatePatch())
                            .fork(context.getThreadId() + ":handoff:" + nextDepth);
                    log.info("[Agents] Handoff {} -> {} (depth {}): {}", result.getAgent(), target.getName(),
                            nextDepth, handoff.getReason());
                    return step(renderHandoffInput(input, result, handoff), target, nextContext, agents, nextDepth,
                            maxDepth);
                });
    }

    String renderHandoffInput(String input, AgentResult result, AgentHandoff handoff) {
        return input + "\n\n"
                + "Handoff from " + result.getAgent() + " to " + handoff.getTargetAgent() + "\n"
                + "Reason: " + handoff.getReason() + "\n"
                + "Payload: " + payloadJson(handoff.getPayload()) + "\n\n"
                + "Continue based on this handoff context.\n";
    }

    private String payloadJson(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload != null ? payload : Map.of());
        } catch (JsonProcessingException e) {
            throw AgentException.validation("Handoff payload is not serializable: " + e.getOriginalMessage());
        }
    }

    private static CompletableFuture<AgentResult> invoke(AgentComponent agent, String input, AgentContext context) {
        CompletableFuture<AgentResult> call;
        try {
            call = agent.execute(input, context);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(toAgentException(agent, e));
        }
        if (call == null) {
            return CompletableFuture.failedFuture(
                    AgentException.execution(agent.getName(), "no result returned", null));
        }
        return call.handle((result, error) -> {
            if (error != null) {
                throw toAgentException(agent, unwrap(error));
            }
            if (result == null) {
                throw AgentException.execution(agent.getName(), "no result returned", null);
            }
            return result;
        });
    }

    private static AgentException toAgentException(AgentComponent agent, Throwable error) {
        if (error instanceof AgentException agentException) {
            return agentException;
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return AgentException.execution(agent.getName(), message, error);
    }

    private ContextTrimStrategy trimStrategy() {
        return properties.getContext().getTrimStrategy();
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}

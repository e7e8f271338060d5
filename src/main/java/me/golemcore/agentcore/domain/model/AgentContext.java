package me.golemcore.agentcore.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Per-call execution context handed to an agent: the conversational branch it
 * works on, the message history it sees, the tools it may use, the limits that
 * bound that history and a free-form state map shared along a handoff chain.
 *
 * <p>
 * Contexts are immutable. {@link #trim(ContextTrimStrategy)} is applied before
 * every agent call; {@link #fork(String)} opens a new branch on handoff.
 */
@Value
@Builder(toBuilder = true)
public class AgentContext {

    String threadId;
    String parentThreadId;

    @Builder.Default
    List<Message> history = List.of();

    @Builder.Default
    List<ToolDefinition> availableTools = List.of();

    @Builder.Default
    AgentConstraints constraints = AgentConstraints.defaults();

    @Builder.Default
    Map<String, Object> state = Map.of();

    public static AgentContext empty(String threadId) {
        return AgentContext.builder().threadId(threadId).build();
    }

    public AgentContext addMessage(Message message) {
        return addMessages(List.of(message));
    }

    public AgentContext addMessages(List<Message> messages) {
        List<Message> combined = new ArrayList<>(history);
        combined.addAll(messages);
        return toBuilder().history(List.copyOf(combined)).build();
    }

    public AgentContext putState(String key, Object value) {
        Map<String, Object> updated = new HashMap<>(state);
        updated.put(key, value);
        return toBuilder().state(Map.copyOf(updated)).build();
    }

    public AgentContext applyStatePatch(Map<String, Object> patch) {
        if (patch == null || patch.isEmpty()) {
            return this;
        }
        Map<String, Object> updated = new HashMap<>(state);
        updated.putAll(patch);
        return toBuilder().state(Map.copyOf(updated)).build();
    }

    public Optional<Object> getState(String key) {
        return Optional.ofNullable(state.get(key));
    }

    public int estimatedTokens() {
        return TokenEstimator.estimate(history);
    }

    /**
     * Opens a child branch: same history and state, new thread id, parent set to
     * this context's thread.
     */
    public AgentContext fork(String newThreadId) {
        return toBuilder()
                .threadId(newThreadId)
                .parentThreadId(threadId)
                .build();
    }

    /**
     * Tools visible to the agent. The allowlist applies only when enforcement is
     * on and the allowlist is not empty.
     */
    public List<ToolDefinition> filteredTools() {
        Set<String> allowed = constraints.getAllowedTools();
        if (!constraints.isEnforceAllowedTools() || allowed == null || allowed.isEmpty()) {
            return availableTools;
        }
        return availableTools.stream()
                .filter(tool -> allowed.contains(tool.getName()))
                .collect(Collectors.toList());
    }

    /**
     * Applies the message-count cap first, then the estimated-token cap.
     */
    public AgentContext trim(ContextTrimStrategy strategy) {
        int maxMessages = Math.max(1, constraints.getMaxContextMessages());
        int budget = Math.max(1, constraints.getMaxEstimatedTokens());

        List<Message> byCount = trimToMessageCount(history, maxMessages, strategy);
        List<Message> byTokens = trimToTokenBudget(byCount, budget, strategy);
        return toBuilder().history(List.copyOf(byTokens)).build();
    }

    private static List<Message> trimToMessageCount(List<Message> messages, int maxMessages,
            ContextTrimStrategy strategy) {
        if (messages.size() <= maxMessages) {
            return messages;
        }
        if (strategy == ContextTrimStrategy.KEEP_LATEST) {
            return messages.subList(messages.size() - maxMessages, messages.size());
        }

        long systemCount = messages.stream().filter(Message::isSystemMessage).count();
        int slotsForOthers = (int) Math.max(0, maxMessages - systemCount);
        List<Message> kept = new ArrayList<>();
        int othersSeen = 0;
        for (int i = messages.size() - 1; i >= 0; i--) {
            Message message = messages.get(i);
            if (message.isSystemMessage()) {
                kept.add(0, message);
            } else if (othersSeen < slotsForOthers) {
                kept.add(0, message);
                othersSeen++;
            }
        }
        if (kept.size() > maxMessages) {
            return kept.subList(kept.size() - maxMessages, kept.size());
        }
        return kept;
    }

    private static List<Message> trimToTokenBudget(List<Message> messages, int budget, ContextTrimStrategy strategy) {
        if (strategy == ContextTrimStrategy.KEEP_LATEST) {
            return consumeReverse(messages, budget);
        }

        List<Message> systemMessages = messages.stream().filter(Message::isSystemMessage).toList();
        int systemCost = TokenEstimator.estimate(systemMessages);
        if (systemCost >= budget) {
            return consumeReverse(systemMessages, budget);
        }

        List<Message> others = messages.stream().filter(m -> !m.isSystemMessage()).toList();
        List<Message> latestOthers = consumeReverse(others, budget - systemCost);
        List<Message> merged = new ArrayList<>();
        for (Message message : messages) {
            if (message.isSystemMessage() || containsInstance(latestOthers, message)) {
                merged.add(message);
            }
        }
        return merged;
    }

    // Walks from the newest message, keeping every message that still fits.
    private static List<Message> consumeReverse(List<Message> messages, int budget) {
        List<Message> kept = new ArrayList<>();
        int used = 0;
        for (int i = messages.size() - 1; i >= 0; i--) {
            Message message = messages.get(i);
            int cost = TokenEstimator.estimateMessage(message);
            if (used + cost <= budget) {
                used += cost;
                kept.add(0, message);
            }
        }
        return kept;
    }

    private static boolean containsInstance(List<Message> messages, Message candidate) {
        for (Message message : messages) {
            if (message == candidate) {
                return true;
            }
        }
        return false;
    }
}

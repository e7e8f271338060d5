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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentcore.domain.model.ContextLimits;
import me.golemcore.agentcore.domain.model.ContextTrimmingStrategy;
import me.golemcore.agentcore.domain.model.ContextWindow;
import me.golemcore.agentcore.domain.model.ConversationMessage;
import me.golemcore.agentcore.domain.model.LlmProvider;
import me.golemcore.agentcore.domain.model.MessageRole;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Fits a conversation into a token budget before it is sent to a model.
 *
 * <p>
 * The message-count cap is applied first, then the strategy spends the token
 * budget. Kept messages retain their input order. When a strategy keeps nothing
 * from a non-empty input, the most recent message that fits alone is kept, or
 * failing that the last message; that fallback is the only case in which the
 * result can exceed the budget.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextWindowService {

    private static final int SUMMARY_SNIPPET_CHARS = 80;

    private final TokenCounter tokenCounter;

    public ContextWindow applyWindow(List<ConversationMessage> messages, LlmProvider provider, ContextLimits limits,
            ContextTrimmingStrategy strategy) {
        if (limits == null || limits.getMaxTokens() < 1) {
            throw new IllegalArgumentException("maxTokens must be at least 1");
        }
        if (messages == null || messages.isEmpty()) {
            return new ContextWindow(List.of(), 0, false);
        }

        List<ConversationMessage> capped = applyMessageCap(messages, limits.getMaxMessages());
        int budget = limits.getMaxTokens();

        List<ConversationMessage> kept = switch (strategy.getKind()) {
        case DROP_OLDEST_FIFO -> fittingSuffix(capped, provider, budget);
        case SLIDING_WINDOW -> preserveThenFill(capped, provider, budget, ConversationMessage::isSystemMessage);
        case PRIORITY_BASED -> preserveThenFill(capped, provider, budget, ContextWindowService::isPriority);
        case SUMMARIZE_OLD_MESSAGES -> summarizeOld(capped, provider, budget, strategy.getSummaryTargetTokens());
        };

        if (kept.isEmpty()) {
            kept = fallback(capped, provider, budget);
        }

        int total = totalCost(kept, provider);
        boolean trimmed = !kept.equals(messages);
        if (trimmed) {
            log.debug("[Context] {} trimmed {} -> {} messages ({} tokens, budget {})",
                    strategy.getKind(), messages.size(), kept.size(), total, budget);
        }
        return new ContextWindow(List.copyOf(kept), total, trimmed);
    }

    private static List<ConversationMessage> applyMessageCap(List<ConversationMessage> messages, Integer maxMessages) {
        if (maxMessages == null) {
            return messages;
        }
        int cap = Math.max(1, maxMessages);
        if (messages.size() <= cap) {
            return messages;
        }
        return messages.subList(messages.size() - cap, messages.size());
    }

    private List<ConversationMessage> fittingSuffix(List<ConversationMessage> messages, LlmProvider provider,
            int budget) {
        int used = 0;
        int start = messages.size();
        for (int i = messages.size() - 1; i >= 0; i--) {
            int cost = tokenCounter.cost(provider, messages.get(i));
            if (used + cost > budget) {
                break;
            }
            used += cost;
            start = i;
        }
        return messages.subList(start, messages.size());
    }

    private List<ConversationMessage> preserveThenFill(List<ConversationMessage> messages, LlmProvider provider,
            int budget, Predicate<ConversationMessage> preserved) {
        List<ConversationMessage> keep = messages.stream().filter(preserved).toList();
        List<ConversationMessage> rest = messages.stream().filter(preserved.negate()).toList();

        int preservedCost = totalCost(keep, provider);
        if (preservedCost > budget) {
            return fittingSuffix(keep, provider, budget);
        }

        List<ConversationMessage> filler = fittingSuffix(rest, provider, budget - preservedCost);
        Set<ConversationMessage> selected = Collections.newSetFromMap(new IdentityHashMap<>());
        selected.addAll(keep);
        selected.addAll(filler);
        return messages.stream().filter(selected::contains).toList();
    }

    private List<ConversationMessage> summarizeOld(List<ConversationMessage> messages, LlmProvider provider,
            int budget, int summaryTargetTokens) {
        if (totalCost(messages, provider) <= budget) {
            return messages;
        }

        int reserve = Math.min(Math.max(0, summaryTargetTokens), budget);
        if (tokenCounter.countMessage(provider, "") > reserve) {
            // not even an empty summary fits the reserve
            return fittingSuffix(messages, provider, budget);
        }
        List<ConversationMessage> recent = fittingSuffix(messages, provider, budget - reserve);
        List<ConversationMessage> older = messages.subList(0, messages.size() - recent.size());
        if (older.isEmpty()) {
            return recent;
        }

        List<ConversationMessage> result = new ArrayList<>();
        result.add(buildSummary(older, provider, reserve));
        result.addAll(recent);
        return result;
    }

    private ConversationMessage buildSummary(List<ConversationMessage> older, LlmProvider provider, int maxTokens) {
        StringBuilder text = new StringBuilder("Summary of ").append(older.size()).append(" earlier messages:");
        for (ConversationMessage message : older) {
            String content = message.getContent() != null ? message.getContent() : "";
            if (content.length() > SUMMARY_SNIPPET_CHARS) {
                content = content.substring(0, SUMMARY_SNIPPET_CHARS) + "...";
            }
            text.append('\n').append(message.getRole().getValue()).append(": ").append(content);
        }

        String content = fitToTokens(text.toString(), provider, maxTokens);
        int tokens = tokenCounter.countMessage(provider, content);

        Map<String, String> metadata = new HashMap<>();
        metadata.put(ConversationMessage.SUMMARY_KEY, "true");
        metadata.put("summarizedMessages", String.valueOf(older.size()));

        return ConversationMessage.builder()
                .id(UUID.randomUUID().toString())
                .role(MessageRole.SYSTEM)
                .content(content)
                .timestamp(older.get(older.size() - 1).getTimestamp())
                .tokens(Math.max(1, tokens))
                .metadata(Map.copyOf(metadata))
                .important(true)
                .build();
    }

    private String fitToTokens(String text, LlmProvider provider, int maxTokens) {
        if (tokenCounter.countMessage(provider, text) <= maxTokens) {
            return text;
        }
        int low = 0;
        int high = text.length();
        while (low < high) {
            int mid = (low + high + 1) / 2;
            if (tokenCounter.countMessage(provider, text.substring(0, mid)) <= maxTokens) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return text.substring(0, low);
    }

    private List<ConversationMessage> fallback(List<ConversationMessage> messages, LlmProvider provider, int budget) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (tokenCounter.cost(provider, messages.get(i)) <= budget) {
                return List.of(messages.get(i));
            }
        }
        log.warn("[Context] No message fits budget {}, keeping the last one", budget);
        return List.of(messages.get(messages.size() - 1));
    }

    private int totalCost(List<ConversationMessage> messages, LlmProvider provider) {
        int total = 0;
        for (ConversationMessage message : messages) {
            total += tokenCounter.cost(provider, message);
        }
        return total;
    }

    private static boolean isPriority(ConversationMessage message) {
        return message.isImportant() || message.getRole() == MessageRole.TOOL;
    }
}

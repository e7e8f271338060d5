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

import me.golemcore.agentcore.domain.model.ConversationMessage;
import me.golemcore.agentcore.domain.model.LlmProvider;

/**
 * Provider-aware token estimation. Implementations never call a tokenizer.
 */
public interface TokenCounter {

    int countText(LlmProvider provider, String text);

    /**
     * Estimated cost of a message body including the fixed per-message overhead.
     */
    int countMessage(LlmProvider provider, String content);

    /**
     * Cost used for windowing: the recorded token count when positive, otherwise
     * the estimate.
     */
    default int cost(LlmProvider provider, ConversationMessage message) {
        if (message.getTokens() > 0) {
            return message.getTokens();
        }
        return countMessage(provider, message.getContent());
    }
}

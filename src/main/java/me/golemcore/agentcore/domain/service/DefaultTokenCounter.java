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

import me.golemcore.agentcore.domain.model.LlmProvider;
import org.springframework.stereotype.Component;

/**
 * Character-density estimator: {@code ceil(chars / charsPerToken)} plus a fixed
 * overhead per message for role and framing tokens.
 */
@Component
public class DefaultTokenCounter implements TokenCounter {

    public static final int MESSAGE_OVERHEAD = 4;

    @Override
    public int countText(LlmProvider provider, String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        LlmProvider effective = provider != null ? provider : LlmProvider.GENERIC;
        return (int) Math.ceil(text.length() / effective.getCharsPerToken());
    }

    @Override
    public int countMessage(LlmProvider provider, String content) {
        return countText(provider, content) + MESSAGE_OVERHEAD;
    }
}

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

import java.util.Collection;

/**
 * Provider-agnostic word-based token approximation used for agent context
 * constraints. Each message costs {@code floor(words * 1.35) + 4}.
 */
public final class TokenEstimator {

    private static final double TOKENS_PER_WORD = 1.35;
    private static final int MESSAGE_OVERHEAD = 4;

    private TokenEstimator() {
    }

    public static int estimate(Collection<Message> messages) {
        if (messages == null) {
            return 0;
        }
        int total = 0;
        for (Message message : messages) {
            total += estimateMessage(message);
        }
        return total;
    }

    public static int estimateMessage(Message message) {
        String content = message.getContent();
        if (content == null || content.isBlank()) {
            return MESSAGE_OVERHEAD;
        }
        int words = content.trim().split("\\s+").length;
        return (int) (words * TOKENS_PER_WORD) + MESSAGE_OVERHEAD;
    }
}

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

import lombok.Value;

/**
 * Strategy used by {@code ContextWindowService} to fit a message sequence into
 * a budget.
 */
@Value
public class ContextTrimmingStrategy {

    public enum Kind {
        DROP_OLDEST_FIFO, SLIDING_WINDOW, PRIORITY_BASED, SUMMARIZE_OLD_MESSAGES
    }

    Kind kind;

    /**
     * Upper bound for the synthetic summary message. Only meaningful for
     * {@link Kind#SUMMARIZE_OLD_MESSAGES}.
     */
    int summaryTargetTokens;

    public static ContextTrimmingStrategy dropOldestFifo() {
        return new ContextTrimmingStrategy(Kind.DROP_OLDEST_FIFO, 0);
    }

    public static ContextTrimmingStrategy slidingWindow() {
        return new ContextTrimmingStrategy(Kind.SLIDING_WINDOW, 0);
    }

    public static ContextTrimmingStrategy priorityBased() {
        return new ContextTrimmingStrategy(Kind.PRIORITY_BASED, 0);
    }

    public static ContextTrimmingStrategy summarizeOldMessages(int summaryTargetTokens) {
        return new ContextTrimmingStrategy(Kind.SUMMARIZE_OLD_MESSAGES, summaryTargetTokens);
    }
}

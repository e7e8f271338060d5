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

/**
 * Model service families with distinct tokenization density. Used only for
 * token estimation.
 */
public enum LlmProvider {

    OPENAI(4.0),
    ANTHROPIC(3.5),
    GEMINI(4.0),
    MISTRAL(3.8),
    OLLAMA(3.6),
    GENERIC(3.5);

    private final double charsPerToken;

    LlmProvider(double charsPerToken) {
        this.charsPerToken = charsPerToken;
    }

    public double getCharsPerToken() {
        return charsPerToken;
    }
}

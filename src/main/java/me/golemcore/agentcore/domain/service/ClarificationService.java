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
import me.golemcore.agentcore.domain.exception.LlmException;
import me.golemcore.agentcore.infrastructure.config.AgentCoreProperties;
import me.golemcore.agentcore.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Re-asks the model when its answer cannot be parsed.
 *
 * <p>
 * The parser signals a bad answer by throwing {@link LlmException} with kind
 * {@code PARSE}. Each retry sends the original prompt with the previous answer
 * and the parse error appended. After the configured number of attempts the
 * last parse error is returned. Any other failure propagates at once.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClarificationService {

    private final LlmPort llmPort;
    private final AgentCoreProperties properties;

    public <T> CompletableFuture<T> executeWithClarification(String prompt, Function<String, T> parser) {
        int maxAttempts = Math.max(1, properties.getClarification().getMaxAttempts());
        return attempt(prompt, prompt, parser, 1, maxAttempts);
    }

    private <T> CompletableFuture<T> attempt(String originalPrompt, String prompt, Function<String, T> parser,
            int attempt, int maxAttempts) {
        return llmPort.execute(prompt).thenCompose(response -> {
            String content = response.getContent();
            try {
                return CompletableFuture.completedFuture(parser.apply(content));
            } catch (LlmException e) {
                if (e.getKind() != LlmException.Kind.PARSE) {
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    log.warn("[Clarification] Giving up after {} attempt(s): {}", attempt, e.getMessage());
                    throw e;
                }
                log.debug("[Clarification] Attempt {} unparseable, asking again: {}", attempt, e.getMessage());
                return attempt(originalPrompt, clarificationPrompt(originalPrompt, content, e.getMessage()),
                        parser, attempt + 1, maxAttempts);
            }
        });
    }

    static String clarificationPrompt(String originalPrompt, String previousAnswer, String error) {
        return originalPrompt + "\n\n"
                + "Your previous response could not be parsed.\n"
                + "Previous response: " + previousAnswer + "\n"
                + "Parse error: " + error + "\n"
                + "Please answer again in the expected format.";
    }
}

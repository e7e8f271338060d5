package me.golemcore.agentcore.infrastructure.config;

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

import lombok.Data;
import me.golemcore.agentcore.domain.model.ContextTrimStrategy;
import me.golemcore.agentcore.domain.model.LlmProvider;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration of the agent runtime, bound from application.properties.
 *
 * <p>
 * All settings live under the {@code agentcore.*} prefix:
 * <ul>
 * <li>{@link ContextProperties} - default agent context limits</li>
 * <li>{@link CoordinatorProperties} - handoff chain bounds</li>
 * <li>{@link ToolLoopProperties} - tool conversation loop</li>
 * <li>{@link MemoryProperties} - conversation memory and durable store</li>
 * <li>{@link PromptsProperties} - prompt template loading</li>
 * <li>{@link ClarificationProperties} - parse-failure clarification</li>
 * <li>{@link StorageProperties} - workspace location</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "agentcore")
@Data
public class AgentCoreProperties {

    private ContextProperties context = new ContextProperties();
    private CoordinatorProperties coordinator = new CoordinatorProperties();
    private ToolLoopProperties toolLoop = new ToolLoopProperties();
    private MemoryProperties memory = new MemoryProperties();
    private PromptsProperties prompts = new PromptsProperties();
    private ClarificationProperties clarification = new ClarificationProperties();
    private StorageProperties storage = new StorageProperties();

    @Data
    public static class ContextProperties {
        private LlmProvider provider = LlmProvider.OPENAI;
        private int maxContextMessages = 40;
        private int maxEstimatedTokens = 12_000;
        private ContextTrimStrategy trimStrategy = ContextTrimStrategy.KEEP_SYSTEM_AND_LATEST;
    }

    @Data
    public static class CoordinatorProperties {
        private int maxHandoffDepth = 4;
    }

    @Data
    public static class ToolLoopProperties {
        private int maxIterations = 8;
        private boolean stopOnToolFailure = false;
        private boolean stopOnToolPolicyDenied = false;
    }

    @Data
    public static class MemoryProperties {
        /**
         * Durable store behind the memory: {@code none}, {@code in-memory} or
         * {@code local}.
         */
        private String store = "none";
        private int defaultSearchLimit = 20;
        private String directory = "conversations";
    }

    @Data
    public static class PromptsProperties {
        private boolean enabled = true;
        private String directory = "prompts";
    }

    @Data
    public static class ClarificationProperties {
        private int maxAttempts = 3;
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/agentcore";
    }
}

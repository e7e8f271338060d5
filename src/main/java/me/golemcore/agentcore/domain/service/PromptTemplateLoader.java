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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentcore.domain.model.PromptTemplate;
import me.golemcore.agentcore.infrastructure.config.AgentCoreProperties;
import me.golemcore.agentcore.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Loads prompt templates from YAML files in the workspace prompts directory
 * into the {@link PromptRegistryService}.
 *
 * <p>
 * A file holds either one template or a {@code templates} list:
 *
 * <pre>
 * name: greeting
 * version: 2
 * description: Greets the user
 * template: Hi {{name}}
 * </pre>
 *
 * Unreadable files and rejected templates are logged and skipped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PromptTemplateLoader {

    private final StoragePort storagePort;
    private final AgentCoreProperties properties;
    private final PromptRegistryService registry;
    private final Clock clock;

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory()).registerModule(new JavaTimeModule());

    @PostConstruct
    public void init() {
        if (properties.getPrompts().isEnabled()) {
            reload();
        }
    }

    /**
     * Scans the prompts directory and registers every template found.
     *
     * @return number of templates registered
     */
    public int reload() {
        String directory = properties.getPrompts().getDirectory();
        List<String> files = storagePort.listObjects(directory, "").join();
        int registered = 0;
        for (String file : files) {
            String lower = file.toLowerCase(Locale.ROOT);
            if (lower.endsWith(".yml") || lower.endsWith(".yaml")) {
                registered += loadFile(directory, file);
            }
        }
        log.info("[Prompts] Loaded {} prompt templates from {}", registered, directory);
        return registered;
    }

    private int loadFile(String directory, String file) {
        List<PromptTemplate> parsed;
        try {
            String content = storagePort.getText(directory, file).join();
            parsed = parse(content);
        } catch (IOException | RuntimeException e) {
            log.warn("[Prompts] Skipping unreadable prompt file {}: {}", file, e.getMessage());
            return 0;
        }

        int registered = 0;
        for (PromptTemplate template : parsed) {
            try {
                registry.register(template);
                registered++;
            } catch (RuntimeException e) {
                log.warn("[Prompts] Skipping template from {}: {}", file, e.getMessage());
            }
        }
        return registered;
    }

    List<PromptTemplate> parse(String content) throws IOException {
        if (content == null || content.isBlank()) {
            return List.of();
        }
        JsonNode root = yamlMapper.readTree(content);
        List<PromptTemplate> result = new ArrayList<>();
        JsonNode list = root.get("templates");
        if (list != null && list.isArray()) {
            for (JsonNode node : list) {
                result.add(toTemplate(node));
            }
        } else {
            result.add(toTemplate(root));
        }
        return result;
    }

    private PromptTemplate toTemplate(JsonNode node) throws IOException {
        PromptTemplate template = yamlMapper.treeToValue(node, PromptTemplate.class);
        if (template.getCreatedAt() == null) {
            return template.toBuilder().createdAt(clock.instant()).build();
        }
        return template;
    }
}

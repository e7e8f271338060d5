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

import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Substitutes {@code {{key}}} placeholders in prompt templates. Keys match
 * literally, so any variable name works and {@code {{ key }}} with inner spaces
 * is not a placeholder for {@code key}. Unresolved placeholders are left intact
 * so templates can be rendered in several passes.
 */
@Component
public class PromptTemplateEngine {

    /**
     * Renders content by substituting placeholders with values from the variable
     * map.
     *
     * @param content
     *            the template body
     * @param variables
     *            the variable name-to-value mapping
     * @return the rendered content
     */
    public String render(String content, Map<String, String> variables) {
        if (content == null) {
            return null;
        }
        if (variables == null || variables.isEmpty()) {
            return content;
        }

        String result = content;
        for (Map.Entry<String, String> variable : variables.entrySet()) {
            if (variable.getValue() != null) {
                result = result.replace("{{" + variable.getKey() + "}}", variable.getValue());
            }
        }
        return result;
    }
}

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
 * Reference to a prompt template.
 *
 * @param name
 *            template name
 * @param version
 *            exact version, or null for "the served version"
 */
public record PromptTemplateRef(String name, Integer version) {

    public static PromptTemplateRef of(String name) {
        return new PromptTemplateRef(name, null);
    }

    public static PromptTemplateRef of(String name, int version) {
        return new PromptTemplateRef(name, version);
    }

    @Override
    public String toString() {
        return version != null ? name + "@" + version : name;
    }
}

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
import me.golemcore.agentcore.domain.exception.PromptRegistryException;
import me.golemcore.agentcore.domain.model.PromptTemplate;
import me.golemcore.agentcore.domain.model.PromptTemplateRef;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Versioned prompt templates keyed by name.
 *
 * <p>
 * Without an explicit version, a reference resolves to the highest active
 * version, or to the highest version when none is active. Registered versions
 * are never removed; {@link #rollback(String, int)} only moves the active flag.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PromptRegistryService {

    private static final Comparator<PromptTemplate> BY_VERSION = Comparator.comparingInt(PromptTemplate::getVersion);

    private final PromptTemplateEngine templateEngine;

    private final AtomicReference<Map<String, List<PromptTemplate>>> templates = new AtomicReference<>(Map.of());

    public PromptTemplate register(PromptTemplate template) {
        if (template == null || template.getName() == null || template.getName().isBlank()) {
            throw new PromptRegistryException(PromptRegistryException.Kind.INVALID_TEMPLATE,
                    "Prompt template name must not be blank");
        }
        if (template.getTemplate() == null) {
            throw new PromptRegistryException(PromptRegistryException.Kind.INVALID_TEMPLATE,
                    "Prompt template '" + template.getName() + "' has no body");
        }

        while (true) {
            Map<String, List<PromptTemplate>> current = templates.get();
            List<PromptTemplate> versions = current.getOrDefault(template.getName(), List.of());
            boolean duplicate = versions.stream().anyMatch(existing -> existing.getVersion() == template.getVersion());
            if (duplicate) {
                throw new PromptRegistryException(PromptRegistryException.Kind.DUPLICATE_VERSION,
                        "Prompt " + template.getName() + "@" + template.getVersion() + " is already registered");
            }
            List<PromptTemplate> updatedVersions = new ArrayList<>(versions);
            updatedVersions.add(template);
            updatedVersions.sort(BY_VERSION);
            if (templates.compareAndSet(current, withEntry(current, template.getName(), updatedVersions))) {
                log.debug("[Prompts] Registered {}@{}", template.getName(), template.getVersion());
                return template;
            }
        }
    }

    public PromptTemplate resolve(PromptTemplateRef ref) {
        List<PromptTemplate> versions = templates.get().get(ref.name());
        if (versions == null || versions.isEmpty()) {
            throw notFound("Prompt not found: " + ref.name());
        }
        if (ref.version() != null) {
            return versions.stream()
                    .filter(template -> template.getVersion() == ref.version())
                    .findFirst()
                    .orElseThrow(() -> notFound("Prompt version not found: " + ref));
        }
        return versions.stream()
                .filter(PromptTemplate::isActive)
                .max(BY_VERSION)
                .orElseGet(() -> versions.get(versions.size() - 1));
    }

    public String render(PromptTemplateRef ref, Map<String, String> variables) {
        return templateEngine.render(resolve(ref).getTemplate(), variables);
    }

    /**
     * Renders every reference with the same variables and joins the results with
     * a blank line.
     */
    public String compose(List<PromptTemplateRef> refs, Map<String, String> variables) {
        return refs.stream()
                .map(ref -> render(ref, variables))
                .collect(Collectors.joining("\n\n"));
    }

    /**
     * Makes {@code toVersion} the only active version of {@code name}.
     */
    public PromptTemplate rollback(String name, int toVersion) {
        while (true) {
            Map<String, List<PromptTemplate>> current = templates.get();
            List<PromptTemplate> versions = current.get(name);
            if (versions == null || versions.isEmpty()) {
                throw notFound("Prompt not found: " + name);
            }
            if (versions.stream().noneMatch(template -> template.getVersion() == toVersion)) {
                throw notFound("Prompt version not found: " + PromptTemplateRef.of(name, toVersion));
            }
            List<PromptTemplate> updatedVersions = versions.stream()
                    .map(template -> template.toBuilder().active(template.getVersion() == toVersion).build())
                    .toList();
            if (templates.compareAndSet(current, withEntry(current, name, updatedVersions))) {
                log.info("[Prompts] Rolled back {} to version {}", name, toVersion);
                return updatedVersions.stream()
                        .filter(template -> template.getVersion() == toVersion)
                        .findFirst()
                        .orElseThrow();
            }
        }
    }

    /**
     * Deterministically assigns {@code key} to one of the variants. The same
     * experiment, key and variant list always give the same answer.
     */
    public String chooseVariant(String experiment, List<String> variantNames, String key) {
        if (variantNames == null || variantNames.isEmpty()) {
            throw new PromptRegistryException(PromptRegistryException.Kind.EMPTY_VARIANTS,
                    "Experiment '" + experiment + "' has no variants");
        }
        int hash = (experiment + ":" + key).hashCode();
        int index = (hash == Integer.MIN_VALUE ? 0 : Math.abs(hash)) % variantNames.size();
        return variantNames.get(index);
    }

    /**
     * Registered templates sorted by name and version, optionally restricted to
     * one name.
     */
    public List<PromptTemplate> list(Optional<String> name) {
        return templates.get().values().stream()
                .flatMap(List::stream)
                .filter(template -> name.map(template.getName()::equals).orElse(true))
                .sorted(Comparator.comparing(PromptTemplate::getName).thenComparing(BY_VERSION))
                .toList();
    }

    private static Map<String, List<PromptTemplate>> withEntry(Map<String, List<PromptTemplate>> current,
            String name, List<PromptTemplate> versions) {
        Map<String, List<PromptTemplate>> updated = new HashMap<>(current);
        updated.put(name, List.copyOf(versions));
        return Map.copyOf(updated);
    }

    private static PromptRegistryException notFound(String message) {
        return new PromptRegistryException(PromptRegistryException.Kind.NOT_FOUND, message);
    }
}

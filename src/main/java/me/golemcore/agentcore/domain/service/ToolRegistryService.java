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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentcore.domain.component.ToolComponent;
import me.golemcore.agentcore.domain.model.ToolDefinition;
import me.golemcore.agentcore.domain.model.ToolFailureKind;
import me.golemcore.agentcore.domain.model.ToolResult;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Name-keyed registry of callable tools. Tool beans are registered on startup.
 *
 * <p>
 * {@link #execute(String, Map)} never fails its future: unknown or disabled
 * tools yield a {@code POLICY_DENIED} result and tool errors an
 * {@code EXECUTION_FAILED} result, both of which are reported back to the
 * model.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ToolRegistryService {

    private final ObjectProvider<ToolComponent> toolBeans;

    private final AtomicReference<Map<String, ToolComponent>> tools = new AtomicReference<>(Map.of());

    @PostConstruct
    public void init() {
        toolBeans.orderedStream().forEach(this::register);
        log.info("[Tools] Registered {} tool(s)", tools.get().size());
    }

    /**
     * @throws IllegalArgumentException
     *             when the name is blank or already registered
     */
    public void register(ToolComponent tool) {
        String name = tool.getToolName();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank");
        }
        while (true) {
            Map<String, ToolComponent> current = tools.get();
            if (current.containsKey(name)) {
                throw new IllegalArgumentException("Tool already registered: " + name);
            }
            Map<String, ToolComponent> updated = new HashMap<>(current);
            updated.put(name, tool);
            if (tools.compareAndSet(current, Map.copyOf(updated))) {
                log.debug("[Tools] Registered tool {}", name);
                return;
            }
        }
    }

    public boolean unregister(String name) {
        while (true) {
            Map<String, ToolComponent> current = tools.get();
            if (!current.containsKey(name)) {
                return false;
            }
            Map<String, ToolComponent> updated = new HashMap<>(current);
            updated.remove(name);
            if (tools.compareAndSet(current, Map.copyOf(updated))) {
                return true;
            }
        }
    }

    public Optional<ToolComponent> find(String name) {
        return Optional.ofNullable(name).map(tools.get()::get);
    }

    public List<ToolComponent> list() {
        return tools.get().values().stream()
                .sorted(Comparator.comparing(ToolComponent::getToolName))
                .toList();
    }

    public List<ToolDefinition> definitions() {
        return list().stream()
                .filter(ToolComponent::isEnabled)
                .map(ToolComponent::getDefinition)
                .toList();
    }

    public CompletableFuture<ToolResult> execute(String name, Map<String, Object> arguments) {
        ToolComponent tool = tools.get().get(name);
        if (tool == null) {
            String available = String.join(", ", tools.get().keySet().stream().sorted().toList());
            return CompletableFuture.completedFuture(ToolResult.failure(ToolFailureKind.POLICY_DENIED,
                    "Unknown tool: " + name + ". Available tools: " + available));
        }
        if (!tool.isEnabled()) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.POLICY_DENIED, "Tool is disabled: " + name));
        }

        CompletableFuture<ToolResult> call;
        try {
            call = tool.execute(arguments != null ? arguments : Map.of());
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(executionFailed(name, e));
        }
        return call.handle((result, error) -> {
            if (error != null) {
                return executionFailed(name, error);
            }
            if (result == null) {
                return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool returned no result: " + name);
            }
            return result;
        });
    }

    private static ToolResult executionFailed(String name, Throwable error) {
        log.warn("[Tools] Tool {} failed: {}", name, safeCauseMessage(error));
        return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool execution failed: " + safeCauseMessage(error));
    }

    private static String safeCauseMessage(Throwable error) {
        Throwable cursor = error;
        while (cursor instanceof CompletionException && cursor.getCause() != null) {
            cursor = cursor.getCause();
        }
        String message = cursor.getMessage();
        return message != null && !message.isBlank() ? message : cursor.getClass().getSimpleName();
    }
}

package me.golemcore.agentcore.domain.service;

import me.golemcore.agentcore.domain.component.ToolComponent;
import me.golemcore.agentcore.domain.model.ToolDefinition;
import me.golemcore.agentcore.domain.model.ToolFailureKind;
import me.golemcore.agentcore.domain.model.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.beans.factory.ObjectProvider;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

class ToolRegistryServiceTest {

    @Mock
    private ObjectProvider<ToolComponent> toolBeans;

    private ToolRegistryService registry;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(toolBeans.orderedStream()).thenReturn(Stream.empty());
        registry = new ToolRegistryService(toolBeans);
    }

    private static ToolComponent tool(String name, boolean enabled,
            Function<Map<String, Object>, CompletableFuture<ToolResult>> body) {
        return new ToolComponent() {
            @Override
            public ToolDefinition getDefinition() {
                return ToolDefinition.simple(name, "Test tool " + name);
            }

            @Override
            public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
                return body.apply(parameters);
            }

            @Override
            public boolean isEnabled() {
                return enabled;
            }
        };
    }

    private static ToolComponent echo() {
        return tool("echo", true,
                args -> CompletableFuture.completedFuture(ToolResult.success(String.valueOf(args.get("text")))));
    }

    // ==================== registration ====================

    @Test
    void shouldRegisterToolBeansOnInit() {
        when(toolBeans.orderedStream()).thenReturn(Stream.of(echo()));

        registry.init();

        assertTrue(registry.find("echo").isPresent());
    }

    @Test
    void shouldRejectDuplicateTool() {
        registry.register(echo());

        assertThrows(IllegalArgumentException.class, () -> registry.register(echo()));
    }

    @Test
    void shouldListSortedAndExposeOnlyEnabledDefinitions() {
        registry.register(tool("zeta", true, args -> CompletableFuture.completedFuture(ToolResult.success("z"))));
        registry.register(tool("alpha", false, args -> CompletableFuture.completedFuture(ToolResult.success("a"))));
        registry.register(echo());

        assertEquals(List.of("alpha", "echo", "zeta"), registry.list().stream().map(ToolComponent::getToolName)
                .toList());
        assertEquals(List.of("echo", "zeta"), registry.definitions().stream().map(ToolDefinition::getName).toList());
    }

    @Test
    void shouldUnregisterTool() {
        registry.register(echo());

        assertTrue(registry.unregister("echo"));
        assertFalse(registry.unregister("echo"));
        assertFalse(registry.find("echo").isPresent());
    }

    // ==================== execution ====================

    @Test
    void shouldExecuteRegisteredTool() {
        registry.register(echo());

        ToolResult result = registry.execute("echo", Map.of("text", "hello")).join();

        assertTrue(result.isSuccess());
        assertEquals("hello", result.getOutput());
    }

    @Test
    void shouldDenyUnknownTool() {
        registry.register(echo());

        ToolResult result = registry.execute("shell", Map.of()).join();

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.POLICY_DENIED, result.getFailureKind());
        assertEquals("Unknown tool: shell. Available tools: echo", result.getError());
    }

    @Test
    void shouldDenyDisabledTool() {
        registry.register(tool("off", false, args -> CompletableFuture.completedFuture(ToolResult.success("x"))));

        ToolResult result = registry.execute("off", null).join();

        assertEquals(ToolFailureKind.POLICY_DENIED, result.getFailureKind());
    }

    @Test
    void shouldReportFailedFutureAsExecutionFailure() {
        registry.register(tool("flaky", true,
                args -> CompletableFuture.failedFuture(new IllegalStateException("disk full"))));

        ToolResult result = registry.execute("flaky", Map.of()).join();

        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
        assertEquals("Tool execution failed: disk full", result.getError());
        assertEquals("Error: Tool execution failed: disk full", result.toMessageContent());
    }

    @Test
    void shouldReportThrowingToolAsExecutionFailure() {
        registry.register(tool("throwing", true, args -> {
            throw new IllegalArgumentException("bad args");
        }));

        ToolResult result = registry.execute("throwing", Map.of()).join();

        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
        assertEquals("Tool execution failed: bad args", result.getError());
    }

    @Test
    void shouldReportMissingResultAsExecutionFailure() {
        registry.register(tool("silent", true, args -> CompletableFuture.completedFuture(null)));

        ToolResult result = registry.execute("silent", Map.of()).join();

        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
    }
}

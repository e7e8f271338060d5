package me.golemcore.agentcore.domain.system.toolloop;

import me.golemcore.agentcore.domain.component.ToolComponent;
import me.golemcore.agentcore.domain.exception.LlmException;
import me.golemcore.agentcore.domain.exception.ToolLoopException;
import me.golemcore.agentcore.domain.model.ConversationMessage;
import me.golemcore.agentcore.domain.model.ConversationState;
import me.golemcore.agentcore.domain.model.ConversationThread;
import me.golemcore.agentcore.domain.model.LlmProvider;
import me.golemcore.agentcore.domain.model.MessageRole;
import me.golemcore.agentcore.domain.model.ToolCall;
import me.golemcore.agentcore.domain.model.ToolCallResponse;
import me.golemcore.agentcore.domain.model.ToolDefinition;
import me.golemcore.agentcore.domain.model.ToolResult;
import me.golemcore.agentcore.domain.service.DefaultTokenCounter;
import me.golemcore.agentcore.domain.service.ToolRegistryService;
import me.golemcore.agentcore.infrastructure.config.AgentCoreProperties;
import me.golemcore.agentcore.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultToolLoopSystemTest {

    private static final Instant NOW = Instant.parse("2026-02-14T00:00:00Z");
    private static final String PROMPT = "Say hi through the echo tool";
    private static final List<ToolDefinition> TOOLS = List.of(ToolDefinition.simple("echo", "Echoes text"));

    @Mock
    private LlmPort llmPort;

    private Clock clock;
    private ToolRegistryService toolRegistry;
    private AgentCoreProperties.ToolLoopProperties settings;
    private DefaultToolLoopSystem system;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        MockitoAnnotations.openMocks(this);
        clock = Clock.fixed(NOW, ZoneId.of("UTC"));
        toolRegistry = new ToolRegistryService(mock(ObjectProvider.class));
        toolRegistry.register(new ToolComponent() {
            @Override
            public ToolDefinition getDefinition() {
                return TOOLS.get(0);
            }

            @Override
            public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
                return CompletableFuture.completedFuture(ToolResult.success("echo: " + parameters.get("text")));
            }
        });
        settings = new AgentCoreProperties.ToolLoopProperties();
        system = new DefaultToolLoopSystem(llmPort, new RegistryToolExecutor(toolRegistry),
                new DefaultHistoryWriter(clock, new DefaultTokenCounter(), LlmProvider.OPENAI), settings, clock);
    }

    private static ToolCallResponse callTool(String id, String name) {
        return ToolCallResponse.toolCalls("", List.of(ToolCall.builder()
                .id(id)
                .name(name)
                .arguments(Map.of("text", "hi"))
                .build()));
    }

    private static ConversationThread emptyThread() {
        return ConversationThread.create("thread-1", NOW);
    }

    private static ToolLoopException loopFailure(CompletableFuture<?> future) {
        ExecutionException error = assertThrows(ExecutionException.class, future::get);
        return assertInstanceOf(ToolLoopException.class, error.getCause());
    }

    // ==================== happy path ====================

    @Test
    void shouldCompleteWithoutToolsWhenModelAnswersDirectly() throws Exception {
        when(llmPort.executeWithTools(anyString(), anyList()))
                .thenReturn(CompletableFuture.completedFuture(ToolCallResponse.text("hello")));

        ToolLoopTurnResult result = system.processTurn(PROMPT, emptyThread(), TOOLS).get();

        assertEquals(ConversationState.COMPLETED, result.thread().getState());
        assertEquals(List.of(MessageRole.USER, MessageRole.ASSISTANT), roles(result.thread()));
        assertEquals(1, result.llmCalls());
        assertEquals(0, result.toolExecutions());
    }

    @Test
    void shouldRunRequestedToolAndAskModelAgain() throws Exception {
        when(llmPort.executeWithTools(anyString(), anyList()))
                .thenReturn(CompletableFuture.completedFuture(callTool("call-1", "echo")))
                .thenReturn(CompletableFuture.completedFuture(ToolCallResponse.text("done")));

        ToolLoopTurnResult result = system.processTurn(PROMPT, emptyThread(), TOOLS).get();

        ConversationThread thread = result.thread();
        assertEquals(ConversationState.COMPLETED, thread.getState());
        assertEquals(List.of(MessageRole.USER, MessageRole.ASSISTANT, MessageRole.TOOL, MessageRole.ASSISTANT),
                roles(thread));
        ConversationMessage toolMessage = thread.getMessages().get(2);
        assertEquals("echo: hi", toolMessage.getContent());
        assertEquals("call-1", toolMessage.getToolCallId());
        assertEquals("done", thread.getMessages().get(3).getContent());
        assertEquals(2, result.llmCalls());
        assertEquals(1, result.toolExecutions());

        ArgumentCaptor<String> transcripts = ArgumentCaptor.forClass(String.class);
        verify(llmPort, times(2)).executeWithTools(transcripts.capture(), any());
        assertTrue(transcripts.getAllValues().get(1).contains("tool: echo: hi"));
    }

    @Test
    void shouldReportUnknownToolToModelAndContinue() throws Exception {
        when(llmPort.executeWithTools(anyString(), anyList()))
                .thenReturn(CompletableFuture.completedFuture(callTool("call-1", "shell")))
                .thenReturn(CompletableFuture.completedFuture(ToolCallResponse.text("sorry")));

        ToolLoopTurnResult result = system.processTurn(PROMPT, emptyThread(), TOOLS).get();

        ConversationMessage toolMessage = result.thread().getMessages().get(2);
        assertTrue(toolMessage.getContent().startsWith("Error: Unknown tool: shell"));
        assertEquals(ConversationState.COMPLETED, result.thread().getState());
    }

    @Test
    void shouldTurnExecutorErrorsIntoSyntheticFailures() throws Exception {
        ToolExecutorPort brokenExecutor = call -> CompletableFuture.failedFuture(new IllegalStateException("lost"));
        DefaultToolLoopSystem brokenSystem = new DefaultToolLoopSystem(llmPort, brokenExecutor,
                new DefaultHistoryWriter(clock, new DefaultTokenCounter(), LlmProvider.OPENAI), settings, clock);
        when(llmPort.executeWithTools(anyString(), anyList()))
                .thenReturn(CompletableFuture.completedFuture(callTool("call-1", "echo")))
                .thenReturn(CompletableFuture.completedFuture(ToolCallResponse.text("ok")));

        ToolLoopTurnResult result = brokenSystem.processTurn(PROMPT, emptyThread(), TOOLS).get();

        assertEquals("Error: Tool execution failed: lost", result.thread().getMessages().get(2).getContent());
    }

    // ==================== limits and stops ====================

    @Test
    void shouldFailWhenIterationsAreExhausted() {
        when(llmPort.executeWithTools(anyString(), anyList()))
                .thenReturn(CompletableFuture.completedFuture(callTool("call-1", "echo")));

        ToolLoopException error = loopFailure(system.processTurn(PROMPT, emptyThread(), TOOLS, 2));

        assertEquals(ToolLoopException.Reason.ITERATIONS_EXHAUSTED, error.getReason());
        assertEquals(ConversationState.FAILED, error.getThread().getState());
        verify(llmPort, times(2)).executeWithTools(anyString(), anyList());
    }

    @Test
    void shouldRejectNonPositiveIterationLimitWithoutCallingModel() {
        ToolLoopException error = loopFailure(system.processTurn(PROMPT, emptyThread(), TOOLS, 0));

        assertEquals(ToolLoopException.Reason.INVALID_CONFIGURATION, error.getReason());
        assertEquals(ConversationState.FAILED, error.getThread().getState());
        verify(llmPort, never()).executeWithTools(anyString(), anyList());
    }

    @Test
    void shouldStopOnPolicyDenialWhenConfigured() {
        settings.setStopOnToolPolicyDenied(true);
        when(llmPort.executeWithTools(anyString(), anyList()))
                .thenReturn(CompletableFuture.completedFuture(callTool("call-1", "shell")));

        ToolLoopException error = loopFailure(system.processTurn(PROMPT, emptyThread(), TOOLS));

        assertEquals(ToolLoopException.Reason.TOOL_DENIED, error.getReason());
        assertEquals(MessageRole.TOOL, error.getThread().getMessages().get(2).getRole());
        verify(llmPort, times(1)).executeWithTools(anyString(), anyList());
    }

    @Test
    void shouldStopOnToolFailureWhenConfigured() {
        settings.setStopOnToolFailure(true);
        toolRegistry.register(new ToolComponent() {
            @Override
            public ToolDefinition getDefinition() {
                return ToolDefinition.simple("broken", "Always fails");
            }

            @Override
            public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
                return CompletableFuture.completedFuture(ToolResult.failure("no disk"));
            }
        });
        when(llmPort.executeWithTools(anyString(), anyList()))
                .thenReturn(CompletableFuture.completedFuture(callTool("call-1", "broken")));

        ToolLoopException error = loopFailure(system.processTurn(PROMPT, emptyThread(), TOOLS));

        assertEquals(ToolLoopException.Reason.TOOL_FAILED, error.getReason());
        assertTrue(error.getMessage().contains("no disk"));
    }

    @Test
    void shouldPropagateModelFailureUnchanged() {
        LlmException failure = new LlmException(LlmException.Kind.TIMEOUT, "timed out");
        when(llmPort.executeWithTools(anyString(), anyList())).thenReturn(CompletableFuture.failedFuture(failure));

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> system.processTurn(PROMPT, emptyThread(), TOOLS).get());

        assertSame(failure, error.getCause());
    }

    @Test
    void shouldRenderTranscriptAsRoleLines() throws Exception {
        when(llmPort.executeWithTools(anyString(), anyList()))
                .thenReturn(CompletableFuture.completedFuture(ToolCallResponse.text("hello")));

        ToolLoopTurnResult result = system.processTurn(PROMPT, emptyThread(), TOOLS).get();

        assertEquals("user: " + PROMPT + "\nassistant: hello", DefaultToolLoopSystem.renderTranscript(result.thread()));
    }

    private static List<MessageRole> roles(ConversationThread thread) {
        return thread.getMessages().stream().map(ConversationMessage::getRole).toList();
    }
}

package me.golemcore.agentcore.routing;

import me.golemcore.agentcore.domain.component.AgentComponent;
import me.golemcore.agentcore.domain.exception.AgentException;
import me.golemcore.agentcore.domain.model.AgentResult;
import me.golemcore.agentcore.domain.model.ConflictResolution;
import me.golemcore.agentcore.testsupport.StubAgent;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentRouterTest {

    private static final String CAPABILITY = "search";

    private final AgentRouter router = new AgentRouter();

    private static StubAgent agent(String name, int priority, String version) {
        return new StubAgent(StubAgent.metadata(name, CAPABILITY, priority, version),
                (input, context) -> CompletableFuture.completedFuture(AgentResult.of(name, "ok")));
    }

    @Test
    void shouldReturnSingleCandidate() {
        StubAgent only = agent("only", 0, "1.0.0");
        StubAgent other = new StubAgent(StubAgent.metadata("other", "write", 9, "9.0.0"),
                (input, context) -> CompletableFuture.completedFuture(AgentResult.of("other", "x")));

        assertSame(only, router.route(CAPABILITY, List.of(other, only), ConflictResolution.FAIL_ON_CONFLICT));
    }

    @Test
    void shouldFailWhenNoAgentHasCapability() {
        List<AgentComponent> agents = List.of(agent("a", 0, "1.0.0"));

        AgentException error = assertThrows(AgentException.class,
                () -> router.route("translate", agents, ConflictResolution.HIGHEST_PRIORITY));

        assertEquals(AgentException.Kind.ROUTING, error.getKind());
    }

    @Test
    void shouldPickHighestPriority() {
        StubAgent low = agent("low", 1, "3.0.0");
        StubAgent high = agent("high", 5, "1.0.0");

        assertSame(high, router.route(CAPABILITY, List.of(low, high), ConflictResolution.HIGHEST_PRIORITY));
    }

    @Test
    void shouldBreakPriorityTieByName() {
        StubAgent alpha = agent("alpha", 2, "1.0.0");
        StubAgent beta = agent("beta", 2, "1.0.0");

        assertSame(beta, router.route(CAPABILITY, List.of(beta, alpha), ConflictResolution.HIGHEST_PRIORITY));
    }

    @Test
    void shouldPickNewestVersion() {
        StubAgent older = agent("older", 9, "1.10.0");
        StubAgent newer = agent("newer", 0, "2.0.0");

        assertSame(newer, router.route(CAPABILITY, List.of(older, newer), ConflictResolution.NEWEST_VERSION));
    }

    @Test
    void shouldPickFirstRegistered() {
        StubAgent first = agent("first", 0, "1.0.0");
        StubAgent second = agent("second", 10, "9.0.0");

        assertSame(first, router.route(CAPABILITY, List.of(first, second), ConflictResolution.FIRST_REGISTERED));
    }

    @Test
    void shouldFailOnConflictWhenRequested() {
        List<AgentComponent> agents = List.of(agent("a", 0, "1.0.0"), agent("b", 0, "1.0.0"));

        AgentException error = assertThrows(AgentException.class,
                () -> router.route(CAPABILITY, agents, ConflictResolution.FAIL_ON_CONFLICT));

        assertEquals(AgentException.Kind.CONFLICT, error.getKind());
        assertTrue(error.getMessage().contains("a, b"));
    }

    @Test
    void shouldSkipDisabledAgents() {
        StubAgent disabled = new StubAgent(StubAgent.metadata("disabled", CAPABILITY, 99, "1.0.0"),
                (input, context) -> CompletableFuture.completedFuture(AgentResult.of("disabled", "x"))) {
            @Override
            public boolean isEnabled() {
                return false;
            }
        };
        StubAgent enabled = agent("enabled", 0, "1.0.0");

        assertSame(enabled, router.route(CAPABILITY, List.of(disabled, enabled), ConflictResolution.HIGHEST_PRIORITY));
    }

    // ==================== version scores ====================

    @Test
    void shouldScoreVersionsNumerically() {
        assertEquals(1_002_003L, SemanticVersion.score("1.2.3"));
        assertTrue(SemanticVersion.score("1.10.0") > SemanticVersion.score("1.9.9"));
        assertEquals(2_000_000L, SemanticVersion.score("2rc1"));
        assertEquals(1_000L, SemanticVersion.score("x.1"));
        assertEquals(0L, SemanticVersion.score(null));
    }
}

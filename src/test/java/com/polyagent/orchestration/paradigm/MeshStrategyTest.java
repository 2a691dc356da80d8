package com.polyagent.orchestration.paradigm;

import com.polyagent.agent.TestAgent;
import com.polyagent.orchestration.CollaborationErrorKind;
import com.polyagent.orchestration.CollaborationException;
import com.polyagent.orchestration.OrchestrationFixture;
import com.polyagent.orchestration.model.MeshPayload;
import com.polyagent.orchestration.model.MeshTurn;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MeshStrategyTest {

    private final OrchestrationFixture fixture = new OrchestrationFixture();

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void testTurnsRunInRingOrderForEachRound() {
        TestAgent a = TestAgent.replying("a", "idea from a");
        TestAgent b = TestAgent.replying("b", "idea from b");

        MeshPayload payload = (MeshPayload) fixture.meshStrategy.run(fixture.scope("m1"), "task", List.of(a, b));

        assertEquals(2, payload.rounds());
        assertEquals(List.of("a", "b", "a", "b"),
                payload.conversations().stream().map(MeshTurn::agentId).toList());
        assertEquals(List.of(1, 1, 2, 2),
                payload.conversations().stream().map(MeshTurn::round).toList());
        assertTrue(payload.finalContext().contains("idea from a"));
        assertTrue(payload.finalContext().contains("idea from b"));
    }

    @Test
    void testEachTurnSeesPriorTurns() {
        TestAgent a = TestAgent.replying("a", "first thought");
        TestAgent b = TestAgent.echoing("b");

        fixture.meshStrategy.run(fixture.scope("m2"), "task", List.of(a, b));

        assertEquals("", a.contexts().get(0));
        assertTrue(b.contexts().get(0).contains("first thought"));
        assertTrue(a.contexts().get(1).contains("b received:"));
    }

    @Test
    void testFailedTurnIsSkipped() {
        TestAgent a = TestAgent.replying("a", "still here");
        TestAgent broken = TestAgent.failing("broken");

        MeshPayload payload = (MeshPayload) fixture.meshStrategy.run(fixture.scope("m3"), "task", List.of(a, broken));

        assertEquals(2, payload.conversations().size());
        assertEquals(List.of("broken"), payload.failedAgents());
    }

    @Test
    void testRoundWithoutAnswersFails() {
        CollaborationException ex = assertThrows(CollaborationException.class,
                () -> fixture.meshStrategy.run(fixture.scope("m4"), "task", List.of(TestAgent.failing("x"))));
        assertEquals(CollaborationErrorKind.PARADIGM_EXECUTION_ERROR, ex.getKind());
    }
}

package com.polyagent.orchestration.paradigm;

import com.polyagent.agent.TestAgent;
import com.polyagent.orchestration.CollaborationErrorKind;
import com.polyagent.orchestration.CollaborationException;
import com.polyagent.orchestration.OrchestrationFixture;
import com.polyagent.orchestration.model.EmergentPattern;
import com.polyagent.orchestration.model.SwarmPayload;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SwarmStrategyTest {

    private final OrchestrationFixture fixture = new OrchestrationFixture();

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void testIdenticalOutputsProducePatterns() {
        String shared = "Use a streaming tokenizer and a recursive printer.";
        TestAgent a = TestAgent.replying("a", shared);
        TestAgent b = TestAgent.replying("b", shared);

        SwarmPayload payload = (SwarmPayload) fixture.swarmStrategy.run(fixture.scope("w1"), "task", List.of(a, b));

        assertEquals(2, payload.responses().size());
        assertFalse(payload.emergentPatterns().isEmpty());
        EmergentPattern top = payload.emergentPatterns().get(0);
        assertEquals(List.of("a", "b"), top.agents());
        assertTrue(payload.emergentPatterns().stream().anyMatch(pattern -> pattern.theme().equals("tokenizer")));
    }

    @Test
    void testIdenticalShortRepliesProducePattern() {
        SwarmPayload payload = (SwarmPayload) fixture.swarmStrategy.run(fixture.scope("w6"), "task",
                List.of(TestAgent.replying("a", "OK"), TestAgent.replying("b", "OK")));

        assertEquals(1, payload.emergentPatterns().size());
        assertEquals("ok", payload.emergentPatterns().get(0).theme());
        assertEquals(List.of("a", "b"), payload.emergentPatterns().get(0).agents());
    }

    @Test
    void testAgentsWorkWithoutSharedContext() {
        TestAgent a = TestAgent.echoing("a");
        TestAgent b = TestAgent.echoing("b");

        fixture.swarmStrategy.run(fixture.scope("w2"), "task", List.of(a, b));

        assertEquals(List.of(""), a.contexts());
        assertEquals(List.of(""), b.contexts());
    }

    @Test
    void testSingleAgentHasNoPatterns() {
        SwarmPayload payload = (SwarmPayload) fixture.swarmStrategy.run(fixture.scope("w3"), "task",
                List.of(TestAgent.replying("solo", "tokenizer tokenizer printer")));

        assertEquals(1, payload.responses().size());
        assertTrue(payload.emergentPatterns().isEmpty());
    }

    @Test
    void testPartialFailureIsAbsorbed() {
        SwarmPayload payload = (SwarmPayload) fixture.swarmStrategy.run(fixture.scope("w4"), "task",
                List.of(TestAgent.replying("a", "answer"), TestAgent.failing("broken")));

        assertEquals(1, payload.responses().size());
        assertEquals(List.of("broken"), payload.failedAgents());
    }

    @Test
    void testAllAgentsFailing() {
        CollaborationException ex = assertThrows(CollaborationException.class,
                () -> fixture.swarmStrategy.run(fixture.scope("w5"), "task",
                        List.of(TestAgent.failing("x"), TestAgent.failing("y"))));
        assertEquals(CollaborationErrorKind.PARADIGM_EXECUTION_ERROR, ex.getKind());
    }
}

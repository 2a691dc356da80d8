package com.polyagent.orchestration.paradigm;

import com.polyagent.agent.AgentHandle;
import com.polyagent.agent.TestAgent;
import com.polyagent.orchestration.CollaborationErrorKind;
import com.polyagent.orchestration.CollaborationException;
import com.polyagent.orchestration.OrchestrationFixture;
import com.polyagent.orchestration.model.AgentContribution;
import com.polyagent.orchestration.model.OrchestraPayload;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OrchestraStrategyTest {

    private final OrchestrationFixture fixture = new OrchestrationFixture();

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void testMembersReceiveConductorGuidance() {
        TestAgent conductor = TestAgent.replying("a", "Split the work into parser and printer.").withPriority(10);
        TestAgent b = TestAgent.echoing("b");
        TestAgent c = TestAgent.echoing("c");

        OrchestraPayload payload = (OrchestraPayload) fixture.orchestraStrategy.run(fixture.scope("o1"),
                "Build a JSON formatter", List.of(conductor, b, c));

        assertEquals("a", payload.conductorAgent());
        assertEquals("Split the work into parser and printer.", payload.conductorGuidance());
        assertEquals(2, payload.contributions().size());
        for (AgentContribution contribution : payload.contributions()) {
            assertTrue(contribution.response().contains("Split the work into parser and printer."));
            assertTrue(contribution.response().contains("Conductor guidance from a"));
        }
        assertTrue(payload.failedAgents().isEmpty());
        assertEquals(1, conductor.invocations());
    }

    @Test
    void testConductorIsHighestPriorityThenRequestOrder() {
        AgentHandle low = TestAgent.replying("low", "low guidance").withPriority(1);
        AgentHandle first = TestAgent.replying("first", "first guidance").withPriority(5);
        AgentHandle second = TestAgent.replying("second", "second guidance").withPriority(5);

        OrchestraPayload payload = (OrchestraPayload) fixture.orchestraStrategy.run(fixture.scope("o2"),
                "task", List.of(low, first, second));

        assertEquals("first", payload.conductorAgent());
        assertEquals(List.of("low", "second"),
                payload.contributions().stream().map(AgentContribution::agentId).toList());
    }

    @Test
    void testFailedConductorIsReplaced() {
        AgentHandle broken = TestAgent.failing("broken").withPriority(9);
        AgentHandle backup = TestAgent.replying("backup", "backup guidance").withPriority(3);
        AgentHandle member = TestAgent.echoing("member");

        OrchestraPayload payload = (OrchestraPayload) fixture.orchestraStrategy.run(fixture.scope("o3"),
                "task", List.of(broken, backup, member));

        assertEquals("backup", payload.conductorAgent());
        assertEquals(List.of("broken"), payload.failedAgents());
        assertEquals(1, payload.contributions().size());
        assertEquals("member", payload.contributions().get(0).agentId());
    }

    @Test
    void testFailedMemberIsReported() {
        AgentHandle conductor = TestAgent.replying("lead", "guidance").withPriority(2);
        AgentHandle broken = TestAgent.failing("broken");
        AgentHandle member = TestAgent.replying("member", "done");

        OrchestraPayload payload = (OrchestraPayload) fixture.orchestraStrategy.run(fixture.scope("o4"),
                "task", List.of(conductor, broken, member));

        assertEquals(List.of("broken"), payload.failedAgents());
        assertEquals(1, payload.contributions().size());
    }

    @Test
    void testSingleAgentOnlyConducts() {
        OrchestraPayload payload = (OrchestraPayload) fixture.orchestraStrategy.run(fixture.scope("o5"),
                "task", List.of(TestAgent.replying("solo", "plan")));

        assertEquals("solo", payload.conductorAgent());
        assertTrue(payload.contributions().isEmpty());
    }

    @Test
    void testNoConductorAvailable() {
        CollaborationException ex = assertThrows(CollaborationException.class,
                () -> fixture.orchestraStrategy.run(fixture.scope("o6"), "task",
                        List.of(TestAgent.failing("x"), TestAgent.failing("y"))));
        assertEquals(CollaborationErrorKind.PARADIGM_EXECUTION_ERROR, ex.getKind());
        assertEquals("o6", ex.getSessionId());
    }
}

package com.polyagent.api;

import com.polyagent.agent.AgentDescriptor;
import com.polyagent.config.PolyAgentProperties;
import com.polyagent.orchestration.CollaborationErrorKind;
import com.polyagent.orchestration.CollaborationException;
import com.polyagent.orchestration.CollaborationOrchestrator;
import com.polyagent.orchestration.model.AgentContribution;
import com.polyagent.orchestration.model.CollaborationResult;
import com.polyagent.orchestration.model.EmergentPattern;
import com.polyagent.orchestration.model.SwarmPayload;
import com.polyagent.orchestration.paradigm.Paradigm;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CollaborationController.class)
class CollaborationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private CollaborationOrchestrator orchestrator;

    @MockitoBean
    private PolyAgentProperties properties;

    @MockitoBean(name = "collaborationExecutor")
    private ExecutorService collaborationExecutor;

    private static CollaborationResult swarmResult(String sessionId, List<String> agents) {
        SwarmPayload payload = new SwarmPayload(
                List.of(new AgentContribution("gemini", "use a token bucket")),
                List.of(new EmergentPattern("bucket", List.of("gemini", "claude"))),
                List.of());
        return new CollaborationResult(sessionId, Paradigm.SWARM, "task", agents, payload, Instant.now(), Instant.now());
    }

    @Test
    void testGetParadigms() throws Exception {
        when(orchestrator.listParadigms()).thenReturn(Arrays.asList(Paradigm.values()));

        mockMvc.perform(get("/api/collaboration/paradigms"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(5))
                .andExpect(jsonPath("$[0].id").value("orchestra"))
                .andExpect(jsonPath("$[0].features").isArray());
    }

    @Test
    void testGetAgents() throws Exception {
        when(orchestrator.listAgents()).thenReturn(List.of(
                new AgentDescriptor("gemini", "Gemini", "GOOGLE", "gemini-2.5-flash", 10, null, List.of("analysis"))));

        mockMvc.perform(get("/api/collaboration/agents"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("gemini"))
                .andExpect(jsonPath("$[0].priority").value(10));
    }

    @Test
    void testCollaborate() throws Exception {
        List<String> agents = List.of("gemini", "claude");
        when(orchestrator.collaborate(eq("s1"), eq("swarm"), eq("Write a limiter"), eq(agents), isNull()))
                .thenReturn(swarmResult("s1", agents));

        mockMvc.perform(post("/api/collaboration/collaborate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\":\"s1\",\"paradigm\":\"swarm\",\"task\":\"Write a limiter\",\"agents\":[\"gemini\",\"claude\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sessionId").value("s1"))
                .andExpect(jsonPath("$.paradigm").value("swarm"))
                .andExpect(jsonPath("$.agents[1]").value("claude"))
                .andExpect(jsonPath("$.payload.paradigm").value("swarm"))
                .andExpect(jsonPath("$.payload.emergentPatterns[0].theme").value("bucket"));
    }

    @Test
    void testCollaborateUsesDefaultAgents() throws Exception {
        List<String> defaults = List.of("gemini", "claude");
        when(properties.getDefaultAgents()).thenReturn(defaults);
        when(orchestrator.collaborate(eq("s2"), eq("swarm"), eq("task"), eq(defaults), isNull()))
                .thenReturn(swarmResult("s2", defaults));

        mockMvc.perform(post("/api/collaboration/collaborate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\":\"s2\",\"paradigm\":\"swarm\",\"task\":\"task\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.agents.length()").value(2));
    }

    @Test
    void testCollaborateUnknownParadigm() throws Exception {
        when(orchestrator.collaborate(anyString(), anyString(), anyString(), anyList(), any()))
                .thenThrow(new CollaborationException(CollaborationErrorKind.UNKNOWN_PARADIGM, "Unknown paradigm: choir."));

        mockMvc.perform(post("/api/collaboration/collaborate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\":\"s3\",\"paradigm\":\"choir\",\"task\":\"task\",\"agents\":[\"gemini\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("UNKNOWN_PARADIGM"))
                .andExpect(jsonPath("$.retryable").value(false));
    }

    @Test
    void testCollaborateBusySession() throws Exception {
        when(orchestrator.collaborate(anyString(), anyString(), anyString(), anyList(), any()))
                .thenThrow(new CollaborationException(CollaborationErrorKind.SESSION_BUSY, "s4", "Session s4 is already running."));

        mockMvc.perform(post("/api/collaboration/collaborate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\":\"s4\",\"paradigm\":\"mesh\",\"task\":\"task\",\"agents\":[\"gemini\"]}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.kind").value("SESSION_BUSY"))
                .andExpect(jsonPath("$.sessionId").value("s4"))
                .andExpect(jsonPath("$.retryable").value(true));
    }

    @Test
    void testCollaborateRejectsBlankTask() throws Exception {
        mockMvc.perform(post("/api/collaboration/collaborate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\":\"s5\",\"paradigm\":\"mesh\",\"task\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("INVALID_REQUEST"));
    }

    @Test
    void testCollaborateStreamIsAccepted() throws Exception {
        mockMvc.perform(post("/api/collaboration/collaborate/stream")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\":\"s6\",\"paradigm\":\"weaver\",\"task\":\"task\",\"agents\":[\"gemini\"]}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.sessionId").value("s6"))
                .andExpect(jsonPath("$.streamPath").value("/ws/collaboration?sessionId=s6"));

        verify(orchestrator).openSession("s6", "weaver", List.of("gemini"));
        verify(collaborationExecutor).execute(any(Runnable.class));
    }

    @Test
    void testGetUnknownSession() throws Exception {
        when(orchestrator.getSession("missing"))
                .thenThrow(new CollaborationException(CollaborationErrorKind.SESSION_NOT_FOUND, "missing", "Session not found: missing"));

        mockMvc.perform(get("/api/collaboration/sessions/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind").value("SESSION_NOT_FOUND"));
    }

    @Test
    void testResetSession() throws Exception {
        mockMvc.perform(delete("/api/collaboration/sessions/s7"))
                .andExpect(status().isNoContent());

        verify(orchestrator).resetSession("s7");
    }
}

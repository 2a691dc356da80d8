package com.polyagent.stream;

import static com.polyagent.orchestration.OrchestrationConstants.EVENT_AGENT_RESULT;
import static com.polyagent.orchestration.OrchestrationConstants.EVENT_ERROR;
import static com.polyagent.orchestration.OrchestrationConstants.EVENT_SESSION_COMPLETE;
import static com.polyagent.orchestration.OrchestrationConstants.EVENT_SESSION_START;

import com.polyagent.orchestration.CollaborationErrorKind;
import com.polyagent.orchestration.model.AgentInvocationResult;
import com.polyagent.orchestration.model.CollaborationResult;
import com.polyagent.orchestration.paradigm.Paradigm;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
public class CollaborationStreamService {

    private final CollaborationStreamHub hub;

    public CollaborationStreamService(CollaborationStreamHub hub) {
        this.hub = hub;
    }

    public void openStream(String sessionId) {
        hub.open(sessionId);
    }

    public void discardStream(String sessionId) {
        hub.discard(sessionId);
    }

    public void emitSessionStart(String sessionId, Paradigm paradigm, String task, List<String> agents) {
        hub.emit(sessionId, EVENT_SESSION_START, Map.of(
                "paradigm", paradigm.id(),
                "task", task,
                "agents", agents
        ));
    }

    public void emitAgentResult(String sessionId, String purpose, AgentInvocationResult result) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("agentId", result.agentId());
        payload.put("purpose", purpose);
        payload.put("success", result.succeeded());
        payload.put("durationMs", result.record().duration().toMillis());
        if (result.output() != null) {
            payload.put("output", result.output());
        }
        if (result.record().errorKind() != null) {
            payload.put("errorKind", result.record().errorKind().name());
            payload.put("error", result.record().errorMessage());
        }
        hub.emit(sessionId, EVENT_AGENT_RESULT, payload);
    }

    public void emitSessionComplete(String sessionId, CollaborationResult result) {
        hub.emit(sessionId, EVENT_SESSION_COMPLETE, Map.of(
                "paradigm", result.paradigm().id(),
                "result", result
        ));
    }

    public void emitError(String sessionId, CollaborationErrorKind kind, String message) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("kind", kind.name());
        payload.put("retryable", kind.retryable());
        payload.put("message", message);
        hub.emit(sessionId, EVENT_ERROR, payload);
    }
}

package com.polyagent.bridge;

import static com.polyagent.orchestration.OrchestrationConstants.BRIDGE_NOT_CONFIGURED_MESSAGE;
import static com.polyagent.orchestration.OrchestrationConstants.BRIDGE_SESSION_PREFIX;
import static com.polyagent.orchestration.OrchestrationConstants.BRIDGE_UNAVAILABLE_MESSAGE;

import com.polyagent.config.PolyAgentProperties;
import com.polyagent.orchestration.CollaborationOrchestrator;
import com.polyagent.orchestration.model.CollaborationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Optional augmentation layered on top of collaboration. Bridge failures never escape this class;
 * they only mark the bridge unavailable and suppress augmentation.
 */
@Service
@Slf4j
public class BridgeService {

    private static final String DEFAULT_LANGUAGE = "python";
    private static final String CODE_REQUIRED_MESSAGE = "Code is required";
    private static final String DEBUG_INPUT_REQUIRED_MESSAGE = "Code and error message are required";

    private final BridgeGateway gateway;
    private final CollaborationOrchestrator orchestrator;
    private final PolyAgentProperties properties;

    private BridgeState state = BridgeState.UNINITIALIZED;
    private String lastError;
    private Instant lastCheckedAt;

    public BridgeService(BridgeGateway gateway, CollaborationOrchestrator orchestrator, PolyAgentProperties properties) {
        this.gateway = gateway;
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    /**
     * Checks the bridge health endpoint. Returns at once when the bridge is already available.
     */
    public synchronized BridgeInitResult initializeBridges() {
        if (state == BridgeState.AVAILABLE) {
            return new BridgeInitResult(true, null);
        }
        PolyAgentProperties.BridgeConfig bridge = properties.getBridge();
        if (!bridge.isEnabled()) {
            markUnavailable(BRIDGE_NOT_CONFIGURED_MESSAGE);
            return new BridgeInitResult(false, BRIDGE_NOT_CONFIGURED_MESSAGE);
        }
        try {
            BridgeResponse response = gateway.call(bridge.getHealthEndpoint(), Map.of("check", "health"), bridge.getTimeout());
            if (!response.isSuccessful()) {
                String error = "Bridge health check returned HTTP " + response.status() + ".";
                markUnavailable(error);
                return new BridgeInitResult(false, error);
            }
            state = BridgeState.AVAILABLE;
            lastError = null;
            lastCheckedAt = Instant.now();
            log.info("Bridge gateway available at {}.", bridge.getBaseUrl());
            return new BridgeInitResult(true, null);
        } catch (BridgeException ex) {
            markUnavailable(ex.getMessage());
            return new BridgeInitResult(false, ex.getMessage());
        }
    }

    public synchronized BridgeStatus status() {
        return new BridgeStatus(state, properties.getBridge().isEnabled(), lastError, lastCheckedAt);
    }

    /**
     * Collaborates on a code-generation prompt with the default agents, then asks the bridge to turn the
     * result into code. Never throws.
     */
    public CodeGenerationResult generateCodeWithBridges(String prompt, @Nullable String language, String paradigm) {
        String targetLanguage = StringUtils.hasText(language) ? language : DEFAULT_LANGUAGE;
        CollaborationResult collaboration;
        try {
            String sessionId = BRIDGE_SESSION_PREFIX + UUID.randomUUID();
            collaboration = orchestrator.collaborate(sessionId, paradigm, codeTask(prompt, targetLanguage),
                    properties.getDefaultAgents());
        } catch (RuntimeException ex) {
            log.warn("Code generation collaboration failed: {}", ex.getMessage());
            return new CodeGenerationResult(false, null, ex.getMessage(), isAvailable(), null);
        }

        if (!isAvailable() && !initializeBridges().success()) {
            return new CodeGenerationResult(false, null, BRIDGE_UNAVAILABLE_MESSAGE, false, collaboration);
        }
        PolyAgentProperties.BridgeConfig bridge = properties.getBridge();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("prompt", prompt);
        payload.put("language", targetLanguage);
        payload.put("paradigm", collaboration.paradigm().id());
        payload.put("context", collaboration.payload().summaryText());
        try {
            BridgeResponse response = gateway.call(bridge.getGenerateEndpoint(), payload, bridge.getTimeout());
            if (!response.isSuccessful()) {
                String error = "Bridge returned HTTP " + response.status() + ".";
                markFailedStatus(response, error);
                return new CodeGenerationResult(false, null, error, isAvailable(), collaboration);
            }
            Object code = response.body().get("code");
            if (code == null || !StringUtils.hasText(code.toString())) {
                return new CodeGenerationResult(false, null, "Bridge response contained no code.", true, collaboration);
            }
            return new CodeGenerationResult(true, code.toString(), null, true, collaboration);
        } catch (BridgeException ex) {
            markUnavailable(ex.getMessage());
            return new CodeGenerationResult(false, null, BRIDGE_UNAVAILABLE_MESSAGE + ": " + ex.getMessage(),
                    false, collaboration);
        } catch (RuntimeException ex) {
            log.warn("Unexpected bridge failure: {}", ex.getMessage());
            return new CodeGenerationResult(false, null, ex.getMessage(), isAvailable(), collaboration);
        }
    }

    public BridgeTaskResult analyzeCode(String code, @Nullable String language) {
        if (!StringUtils.hasText(code)) {
            return BridgeTaskResult.failed(CODE_REQUIRED_MESSAGE);
        }
        return runTask("analysis", properties.getBridge().getAnalyzeEndpoint(), codePayload(code, language));
    }

    public BridgeTaskResult optimizeCode(String code, @Nullable String language) {
        if (!StringUtils.hasText(code)) {
            return BridgeTaskResult.failed(CODE_REQUIRED_MESSAGE);
        }
        return runTask("optimization", properties.getBridge().getOptimizeEndpoint(), codePayload(code, language));
    }

    public BridgeTaskResult debugCode(String code, String errorMessage, @Nullable String language) {
        if (!StringUtils.hasText(code) || !StringUtils.hasText(errorMessage)) {
            return BridgeTaskResult.failed(DEBUG_INPUT_REQUIRED_MESSAGE);
        }
        Map<String, Object> payload = codePayload(code, language);
        payload.put("error_message", errorMessage);
        return runTask("debugging", properties.getBridge().getDebugEndpoint(), payload);
    }

    /**
     * Sends one code task straight to the bridge, initializing it on first use. Never throws.
     */
    private BridgeTaskResult runTask(String operation, String endpoint, Map<String, Object> payload) {
        if (!isAvailable() && !initializeBridges().success()) {
            return BridgeTaskResult.failed(BRIDGE_UNAVAILABLE_MESSAGE);
        }
        try {
            BridgeResponse response = gateway.call(endpoint, payload, properties.getBridge().getTimeout());
            if (!response.isSuccessful()) {
                String error = "Bridge returned HTTP " + response.status() + " during code " + operation + ".";
                markFailedStatus(response, error);
                return BridgeTaskResult.failed(error);
            }
            return new BridgeTaskResult(true, response.body(), null);
        } catch (BridgeException ex) {
            markUnavailable(ex.getMessage());
            return BridgeTaskResult.failed(BRIDGE_UNAVAILABLE_MESSAGE + ": " + ex.getMessage());
        } catch (RuntimeException ex) {
            log.warn("Unexpected bridge failure during code {}: {}", operation, ex.getMessage());
            return BridgeTaskResult.failed(ex.getMessage());
        }
    }

    private Map<String, Object> codePayload(String code, @Nullable String language) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("code", code);
        payload.put("language", StringUtils.hasText(language) ? language : DEFAULT_LANGUAGE);
        return payload;
    }

    // A 4xx means the bridge rejected this request, not that it is down
    private void markFailedStatus(BridgeResponse response, String error) {
        if (response.status() >= 500) {
            markUnavailable(error);
        } else {
            log.warn("Bridge rejected request: {}", error);
        }
    }

    private synchronized boolean isAvailable() {
        return state == BridgeState.AVAILABLE;
    }

    private synchronized void markUnavailable(String error) {
        if (state != BridgeState.UNAVAILABLE) {
            log.warn("Bridge gateway unavailable: {}", error);
        }
        state = BridgeState.UNAVAILABLE;
        lastError = error;
        lastCheckedAt = Instant.now();
    }

    private String codeTask(String prompt, String language) {
        return "Generate " + language + " code for the following request:\n" + prompt;
    }
}

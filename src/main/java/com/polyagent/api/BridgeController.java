package com.polyagent.api;

import com.polyagent.bridge.BridgeInitResult;
import com.polyagent.bridge.BridgeService;
import com.polyagent.bridge.BridgeStatus;
import com.polyagent.bridge.BridgeTaskResult;
import com.polyagent.bridge.CodeGenerationResult;
import com.polyagent.orchestration.paradigm.Paradigm;
import jakarta.validation.Valid;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/bridges")
public class BridgeController {

    private final BridgeService bridgeService;

    public BridgeController(BridgeService bridgeService) {
        this.bridgeService = bridgeService;
    }

    @GetMapping("/status")
    public BridgeStatus status() {
        return bridgeService.status();
    }

    @PostMapping("/initialize")
    public BridgeInitResult initialize() {
        return bridgeService.initializeBridges();
    }

    @PostMapping("/generate-code")
    public CodeGenerationResult generateCode(@Valid @RequestBody GenerateCodeRequest request) {
        String paradigm = StringUtils.hasText(request.paradigm()) ? request.paradigm() : Paradigm.ORCHESTRA.id();
        return bridgeService.generateCodeWithBridges(request.prompt(), request.language(), paradigm);
    }

    @PostMapping("/analyze-code")
    public BridgeTaskResult analyzeCode(@Valid @RequestBody CodeTaskRequest request) {
        return bridgeService.analyzeCode(request.code(), request.language());
    }

    @PostMapping("/optimize-code")
    public BridgeTaskResult optimizeCode(@Valid @RequestBody CodeTaskRequest request) {
        return bridgeService.optimizeCode(request.code(), request.language());
    }

    @PostMapping("/debug-code")
    public BridgeTaskResult debugCode(@Valid @RequestBody DebugCodeRequest request) {
        return bridgeService.debugCode(request.code(), request.errorMessage(), request.language());
    }
}

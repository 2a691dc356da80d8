package com.polyagent.bridge;

import java.util.Map;

public record BridgeResponse(
        int status,
        Map<String, Object> body
) {
    public BridgeResponse {
        body = body != null ? body : Map.of();
    }

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }
}

package com.polyagent.bridge;

public class BridgeException extends Exception {

    public enum Reason {
        NETWORK, TIMEOUT, HTTP_STATUS
    }

    private final Reason reason;

    public BridgeException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public BridgeException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}

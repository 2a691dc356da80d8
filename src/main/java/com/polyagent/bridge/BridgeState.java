package com.polyagent.bridge;

public enum BridgeState {
    UNINITIALIZED, AVAILABLE, UNAVAILABLE
}

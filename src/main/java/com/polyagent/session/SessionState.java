package com.polyagent.session;

public enum SessionState {
    IDLE, RUNNING, COMPLETED, FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}

package com.eainde.analysis.state;

public enum RunStatus {
    PENDING,
    RUNNING,
    COMPLETE,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }
}

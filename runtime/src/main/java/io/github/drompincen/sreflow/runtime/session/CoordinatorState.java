package io.github.drompincen.sreflow.runtime.session;

public enum CoordinatorState {
    IDLE,
    RUNNING,
    AWAITING_DECISION,
    HANDOFF_PENDING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}

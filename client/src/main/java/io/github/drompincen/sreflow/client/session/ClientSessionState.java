package io.github.drompincen.sreflow.client.session;

public enum ClientSessionState {
    DISCONNECTED,
    CONNECTING,
    /** Channel open and {@code start} sent; waiting for the first frame. */
    STARTING,
    STREAMING,
    AWAITING_DECISION,
    DECISION_SENT,
    COMPLETED,
    FAILED,
    CLOSED
}

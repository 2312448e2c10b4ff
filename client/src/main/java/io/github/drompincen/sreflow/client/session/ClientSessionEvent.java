package io.github.drompincen.sreflow.client.session;

import io.github.drompincen.sreflow.protocol.ws.ServerFrame;

public enum ClientSessionEvent {
    CONNECT,
    CHANNEL_OPENED,
    DIAGNOSTIC,
    HISTORY,
    DECISION_REQUESTED,
    DECISION_SENT,
    HANDOFF,
    COMPLETE,
    ERROR,
    TRANSPORT_ERROR,
    CHANNEL_CLOSED,
    CLOSE;

    public static ClientSessionEvent of(ServerFrame frame) {
        return switch (frame.type()) {
            case DIAGNOSTIC -> DIAGNOSTIC;
            case HISTORY -> HISTORY;
            case AWAITING_APPROVAL, HANDOFF_APPROVAL, RESUME_AVAILABLE -> DECISION_REQUESTED;
            case HANDOFF -> HANDOFF;
            case COMPLETE -> COMPLETE;
            case ERROR -> ERROR;
            default -> throw new IllegalArgumentException("Not a server frame: " + frame.type());
        };
    }
}

package io.github.drompincen.sreflow.protocol.ws;

import io.github.drompincen.sreflow.protocol.model.DecisionKind;

public enum FrameType {
    // Client -> Server ("type" tag)
    START("start"),
    INTERVENE("intervene"),
    RESUME("resume"),

    // Server -> Client ("event" tag)
    DIAGNOSTIC("diagnostic"),
    HISTORY("history"),
    AWAITING_APPROVAL("awaiting_approval"),
    HANDOFF_APPROVAL("handoff_approval"),
    RESUME_AVAILABLE("resume_available"),
    HANDOFF("handoff"),
    COMPLETE("complete"),
    ERROR("error");

    private final String wireName;

    FrameType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }

    public boolean isClientFrame() {
        return this == START || this == INTERVENE || this == RESUME;
    }

    /** The three approval-gate tags all carry an {@code awaiting_approval} frame. */
    public boolean isDecisionRequest() {
        return this == AWAITING_APPROVAL || this == HANDOFF_APPROVAL || this == RESUME_AVAILABLE;
    }

    public static FrameType forDecision(DecisionKind kind) {
        return switch (kind) {
            case AWAITING_APPROVAL -> AWAITING_APPROVAL;
            case HANDOFF_APPROVAL -> HANDOFF_APPROVAL;
            case RESUME_AVAILABLE -> RESUME_AVAILABLE;
        };
    }

    public static FrameType fromWire(String value) {
        if (value == null) return null;
        for (FrameType t : values()) {
            if (t.wireName.equals(value)) return t;
        }
        return null;
    }
}

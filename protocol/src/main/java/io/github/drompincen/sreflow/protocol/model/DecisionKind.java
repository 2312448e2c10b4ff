package io.github.drompincen.sreflow.protocol.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** What an outstanding human decision is about. */
public enum DecisionKind {
    AWAITING_APPROVAL("awaiting_approval"),
    HANDOFF_APPROVAL("handoff_approval"),
    RESUME_AVAILABLE("resume_available");

    private final String wireName;

    DecisionKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() { return wireName; }

    @JsonCreator
    public static DecisionKind fromWire(String value) {
        if (value == null) return null;
        for (DecisionKind k : values()) {
            if (k.wireName.equals(value)) return k;
        }
        return null;
    }
}

package io.github.drompincen.sreflow.protocol.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum NextAction {
    CONTINUE("continue"),
    AWAIT_USER_APPROVAL("await_user_approval"),
    HANDOFF_TO_SOLUTION_AGENT("handoff_to_solution_agent");

    private final String wireName;

    NextAction(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() { return wireName; }

    /** Unknown values decode to {@code null} so a bad field never rejects the whole snapshot. */
    @JsonCreator
    public static NextAction fromWire(String value) {
        if (value == null) return null;
        for (NextAction a : values()) {
            if (a.wireName.equals(value)) return a;
        }
        return null;
    }
}

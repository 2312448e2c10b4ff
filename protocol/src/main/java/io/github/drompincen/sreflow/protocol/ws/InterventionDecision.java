package io.github.drompincen.sreflow.protocol.ws;

public enum InterventionDecision {
    APPROVE("approve"),
    DENY("deny"),
    HANDOFF("handoff");

    private final String wireName;

    InterventionDecision(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }

    public static InterventionDecision fromWire(String value) {
        for (InterventionDecision d : values()) {
            if (d.wireName.equals(value)) return d;
        }
        return null;
    }
}

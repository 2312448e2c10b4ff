package io.github.drompincen.sreflow.protocol.ws;

public enum ResumeDecision {
    YES("yes"),
    NO("no");

    private final String wireName;

    ResumeDecision(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }

    public static ResumeDecision fromWire(String value) {
        for (ResumeDecision d : values()) {
            if (d.wireName.equals(value)) return d;
        }
        return null;
    }
}

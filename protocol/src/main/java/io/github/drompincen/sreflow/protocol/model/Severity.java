package io.github.drompincen.sreflow.protocol.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    CRITICAL("Critical", 0),
    HIGH("High", 1),
    WARNING("Warning", 2),
    INFO("Info", 3);

    private final String wireName;
    private final int rank;

    Severity(String wireName, int rank) {
        this.wireName = wireName;
        this.rank = rank;
    }

    @JsonValue
    public String wireName() { return wireName; }

    /** Lower ranks sort first. */
    public int rank() { return rank; }

    @JsonCreator
    public static Severity fromWire(String value) {
        if (value == null) return null;
        for (Severity s : values()) {
            if (s.wireName.equalsIgnoreCase(value)) return s;
        }
        return null;
    }
}

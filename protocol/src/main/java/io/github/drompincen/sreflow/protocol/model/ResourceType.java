package io.github.drompincen.sreflow.protocol.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ResourceType {
    POD("Pod"),
    NODE("Node"),
    DEPLOYMENT("Deployment"),
    OTHER("Other");

    private final String wireName;

    ResourceType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() { return wireName; }

    @JsonCreator
    public static ResourceType fromWire(String value) {
        if (value == null) return OTHER;
        for (ResourceType t : values()) {
            if (t.wireName.equalsIgnoreCase(value)) return t;
        }
        return OTHER;
    }
}

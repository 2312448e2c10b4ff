package io.github.drompincen.sreflow.protocol.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * An entry of a diagnostic or solution thread log. {@code text} is usually the
 * agent's JSON output but may be free text.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MessageItem(
        String role,
        String text,
        @JsonProperty("created_at") Instant createdAt
) {
    public static MessageItem assistant(String text, Instant createdAt) {
        return new MessageItem("assistant", text, createdAt);
    }
}

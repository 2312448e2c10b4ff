package io.github.drompincen.sreflow.protocol.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One step of the diagnostic agent's ReAct loop as it crosses the wire.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentStateSnapshot(
        String thought,
        String action,
        @JsonProperty("action_input") String actionInput,
        @JsonProperty("next_action") NextAction nextAction,
        @JsonProperty("root_cause") String rootCause
) {
    public static AgentStateSnapshot thinking(String thought) {
        return new AgentStateSnapshot(thought, null, null, NextAction.CONTINUE, null);
    }
}

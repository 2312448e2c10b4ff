package io.github.drompincen.sreflow.runtime.agent;

/**
 * Failure inside the diagnostic or solution agent, including a step that ran past
 * its timeout. Fatal for the workflow thread, never for the process.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}

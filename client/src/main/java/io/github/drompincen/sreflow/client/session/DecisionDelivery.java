package io.github.drompincen.sreflow.client.session;

/** Outcome of handing an operator decision to the session. */
public enum DecisionDelivery {
    SENT,
    NO_PENDING_DECISION,
    DECISION_IN_FLIGHT,
    CHANNEL_CLOSED
}

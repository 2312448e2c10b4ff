package io.github.drompincen.sreflow.protocol.model;

/** An outstanding request for a human decision; at most one per session. */
public record PendingDecision(String question, DecisionKind kind) {}

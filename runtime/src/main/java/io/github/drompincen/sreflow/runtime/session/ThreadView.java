package io.github.drompincen.sreflow.runtime.session;

import io.github.drompincen.sreflow.protocol.model.PendingDecision;

/** Read-only projection of a workflow thread for the HTTP API. */
public record ThreadView(
        String issueKey,
        String diagThreadId,
        String solThreadId,
        CoordinatorState state,
        PendingDecision pendingDecision,
        boolean decisionInFlight,
        String rootCause,
        int steps,
        int subscribers
) {}

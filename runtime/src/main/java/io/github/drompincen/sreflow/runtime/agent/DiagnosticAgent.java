package io.github.drompincen.sreflow.runtime.agent;

import io.github.drompincen.sreflow.protocol.model.AgentStateSnapshot;
import io.github.drompincen.sreflow.protocol.model.Issue;

public interface DiagnosticAgent {

    /** Opens a diagnostic thread on the agent platform and returns its id. */
    String openThread(Issue issue);

    /** Runs exactly one think/act step. */
    AgentStateSnapshot step(DiagnosticRequest request);
}

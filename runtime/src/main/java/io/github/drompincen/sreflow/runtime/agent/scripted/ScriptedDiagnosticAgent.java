package io.github.drompincen.sreflow.runtime.agent.scripted;

import io.github.drompincen.sreflow.protocol.model.AgentStateSnapshot;
import io.github.drompincen.sreflow.protocol.model.Issue;
import io.github.drompincen.sreflow.runtime.agent.DiagnosticAgent;
import io.github.drompincen.sreflow.runtime.agent.DiagnosticRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Deterministic diagnostic agent for demos and tests without an agent platform.
 * Walks the {@link DiagnosticProfile} script for the issue; steps past the end repeat
 * the final (handoff) step.
 *
 * Activate with: SREFLOW_AGENT_PROVIDER=scripted (the default)
 */
@Service
@ConditionalOnProperty(name = "sreflow.agent.provider", havingValue = "scripted", matchIfMissing = true)
public class ScriptedDiagnosticAgent implements DiagnosticAgent {

    private static final Logger log = LoggerFactory.getLogger(ScriptedDiagnosticAgent.class);

    @Override
    public String openThread(Issue issue) {
        String threadId = "diag-" + UUID.randomUUID();
        log.debug("[SCRIPTED] opened {} for {} ({})", threadId, issue.key(), DiagnosticProfile.forIssue(issue));
        return threadId;
    }

    @Override
    public AgentStateSnapshot step(DiagnosticRequest request) {
        List<AgentStateSnapshot> script = DiagnosticProfile.forIssue(request.issue()).script(request.issue());
        int index = Math.min(Math.max(request.stepNo(), 1), script.size()) - 1;
        AgentStateSnapshot scripted = script.get(index);
        if (!request.hasHint()) {
            return scripted;
        }
        return new AgentStateSnapshot(
                "Operator hint: " + request.hint().trim() + ". " + scripted.thought(),
                scripted.action(), scripted.actionInput(), scripted.nextAction(), scripted.rootCause());
    }
}

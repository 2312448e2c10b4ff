package io.github.drompincen.sreflow.runtime.agent.scripted;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.sreflow.protocol.model.Issue;
import io.github.drompincen.sreflow.runtime.agent.AgentException;
import io.github.drompincen.sreflow.runtime.agent.SolutionAgent;
import io.github.drompincen.sreflow.runtime.agent.SolutionRequest;
import io.github.drompincen.sreflow.runtime.agent.SolutionResult;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.UUID;

/**
 * Deterministic solution agent: a structured recommended fix for problems the cluster
 * owner can correct, an escalation email for registry credentials.
 */
@Service
@ConditionalOnProperty(name = "sreflow.agent.provider", havingValue = "scripted", matchIfMissing = true)
public class ScriptedSolutionAgent implements SolutionAgent {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public SolutionResult solve(SolutionRequest request) {
        Issue issue = request.issue();
        ObjectNode solution = switch (DiagnosticProfile.forIssue(issue)) {
            case IMAGE_PULL -> escalation(issue, request.rootCause());
            case CRASHLOOP -> fix(request.rootCause(),
                    "kubectl -n %s edit configmap %s-config   # add DATABASE_URL"
                            .formatted(issue.namespaceOrDefault(), issue.resourceName()),
                    "kubectl -n %s delete pod %s".formatted(issue.namespaceOrDefault(), issue.resourceName()),
                    "The pod is recreated by its controller and picks up the new ConfigMap on start.");
            case GENERIC -> fix(request.rootCause(),
                    "kubectl -n %s describe pod %s | grep -A5 Readiness"
                            .formatted(issue.namespaceOrDefault(), issue.resourceName()),
                    "kubectl -n %s rollout undo deployment/%s"
                            .formatted(issue.namespaceOrDefault(), issue.resourceName()),
                    "Roll back first, then raise initialDelaySeconds on the readiness probe before redeploying.");
        };
        try {
            return new SolutionResult("sol-" + UUID.randomUUID(), objectMapper.writeValueAsString(solution));
        } catch (JsonProcessingException e) {
            throw new AgentException("Failed to render scripted solution", e);
        }
    }

    private ObjectNode fix(String rootCause, String first, String second, String notes) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("summary", rootCause);
        ObjectNode fix = node.putObject("recommended_fix");
        fix.putArray("steps").add(first).add(second);
        fix.put("notes", notes);
        return node;
    }

    private ObjectNode escalation(Issue issue, String rootCause) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("summary", rootCause);
        ObjectNode esc = node.putObject("escalation");
        esc.put("reason", "Registry credentials for %s must be issued by the platform team".formatted(issue.resourceName()));
        esc.put("severity", issue.severity() != null ? issue.severity().wireName().toLowerCase(Locale.ROOT) : "high");
        esc.put("email_draft", """
                Subject: Image pull failing for %s in %s
                Hi platform team,

                %s
                Please add a pull secret for the private registry to the namespace service account.
                """.formatted(issue.resourceName(), issue.namespaceOrDefault(), rootCause));
        return node;
    }
}

package io.github.drompincen.sreflow.runtime.agent.scripted;

import io.github.drompincen.sreflow.protocol.model.AgentStateSnapshot;
import io.github.drompincen.sreflow.protocol.model.Issue;
import io.github.drompincen.sreflow.protocol.model.NextAction;

import java.util.List;
import java.util.Locale;

/**
 * Canned investigations keyed off the issue type. Every script gates one tool call on
 * operator approval, then reports a root cause and asks for the handoff.
 */
public enum DiagnosticProfile {

    CRASHLOOP {
        @Override
        List<AgentStateSnapshot> script(String name, String namespace) {
            String target = target(name, namespace);
            return List.of(
                    step("Pod %s is restarting repeatedly. I need the restart count and the last exit reason."
                            .formatted(name), "get_pod_diagnostics", target, NextAction.CONTINUE, null),
                    step("Last exit code is 1 with reason Error after 3 restarts. Checking recent events for back-off.",
                            "get_pod_events", target, NextAction.CONTINUE, null),
                    step("Previous logs show java.lang.NullPointerException at com.app.Main.init. Reading the mounted "
                            + "ConfigMap touches application settings, so I need approval.",
                            "get_configmap", target, NextAction.AWAIT_USER_APPROVAL, null),
                    step("The ConfigMap has no DATABASE_URL entry; Main.init dereferences it on startup.",
                            null, null, NextAction.HANDOFF_TO_SOLUTION_AGENT,
                            "Container of pod %s crashes on startup with a NullPointerException because the required "
                                    .formatted(name) + "DATABASE_URL setting is missing from its ConfigMap."));
        }
    },

    IMAGE_PULL {
        @Override
        List<AgentStateSnapshot> script(String name, String namespace) {
            String target = target(name, namespace);
            return List.of(
                    step("Pod %s never started. Checking phase and last exit reason.".formatted(name),
                            "get_pod_diagnostics", target, NextAction.CONTINUE, null),
                    step("Phase is ImagePullBackOff with ErrImagePull. Filtering events related to image pulls.",
                            "get_image_pull_events", target, NextAction.CONTINUE, null),
                    step("The registry rejects the pull as unauthorized. Inspecting the service account's "
                            + "imagePullSecrets requires approval.",
                            "get_service_account_details", target, NextAction.AWAIT_USER_APPROVAL, null),
                    step("The service account references no imagePullSecrets for the private registry.",
                            null, null, NextAction.HANDOFF_TO_SOLUTION_AGENT,
                            "Pod %s cannot pull its image from the private registry because its service account "
                                    .formatted(name) + "has no imagePullSecrets configured."));
        }
    },

    GENERIC {
        @Override
        List<AgentStateSnapshot> script(String name, String namespace) {
            String target = target(name, namespace);
            return List.of(
                    step("Resource %s is unhealthy. Collecting status and recent logs.".formatted(name),
                            "get_pod_diagnostics", target, NextAction.CONTINUE, null),
                    step("Logs report a failing readiness probe and a high error rate. Pulling events needs approval.",
                            "get_pod_events", target, NextAction.AWAIT_USER_APPROVAL, null),
                    step("Events show repeated readiness probe failures right after each rollout.",
                            null, null, NextAction.HANDOFF_TO_SOLUTION_AGENT,
                            "Readiness probe of %s fails after rollout, so the resource never becomes ready."
                                    .formatted(name)));
        }
    };

    abstract List<AgentStateSnapshot> script(String name, String namespace);

    public List<AgentStateSnapshot> script(Issue issue) {
        String namespace = issue.namespaceOrDefault();
        return script(issue.resourceName(), namespace);
    }

    public static DiagnosticProfile forIssue(Issue issue) {
        String type = issue.issueType() != null ? issue.issueType().toLowerCase(Locale.ROOT) : "";
        if (type.contains("crashloop")) return CRASHLOOP;
        if (type.contains("imagepull") || type.contains("errimage")) return IMAGE_PULL;
        return GENERIC;
    }

    private static String target(String name, String namespace) {
        return "{\"name\":\"%s\",\"namespace\":\"%s\"}".formatted(name, namespace);
    }

    private static AgentStateSnapshot step(String thought, String action, String input,
                                           NextAction next, String rootCause) {
        return new AgentStateSnapshot(thought, action, action != null ? input : null, next, rootCause);
    }
}

package io.github.drompincen.sreflow.protocol.ws;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.sreflow.protocol.model.AgentStateSnapshot;
import io.github.drompincen.sreflow.protocol.model.DecisionKind;
import io.github.drompincen.sreflow.protocol.model.Issue;
import io.github.drompincen.sreflow.protocol.model.MessageItem;
import io.github.drompincen.sreflow.protocol.model.NextAction;
import io.github.drompincen.sreflow.protocol.model.ResourceType;
import io.github.drompincen.sreflow.protocol.model.Severity;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class FrameCodecTest {

    private final FrameCodec codec = new FrameCodec();

    private Issue issue() {
        return new Issue("CrashLoopBackOff", Severity.CRITICAL, ResourceType.POD, "payments",
                "api-7f9c", "api", "02h 15m", 8100, "Back-off restarting failed container");
    }

    @Test
    void startFrameCarriesIssueUnderTypeTag() throws Exception {
        String json = codec.encode(new ClientFrame.Start(issue()));

        JsonNode node = codec.objectMapper().readTree(json);
        assertThat(node.path("type").asText()).isEqualTo("start");
        assertThat(node.path("issue").path("severity").asText()).isEqualTo("Critical");
        assertThat(node.path("issue").path("resourceType").asText()).isEqualTo("Pod");
        assertThat(node.path("issue").path("unhealthyTimespan").asLong()).isEqualTo(8100);
    }

    @Test
    void decodesStartFrameBackIntoIssue() {
        Optional<ClientFrame> frame = codec.decodeClient(codec.encode(new ClientFrame.Start(issue())));

        assertThat(frame).containsInstanceOf(ClientFrame.Start.class);
        assertThat(((ClientFrame.Start) frame.get()).issue().key()).isEqualTo("payments:Pod:api-7f9c:api");
    }

    @Test
    void interveneOmitsBlankHint() {
        String json = codec.encode(new ClientFrame.Intervene(InterventionDecision.APPROVE, "  "));

        assertThat(json).contains("\"decision\":\"approve\"").doesNotContain("hint");
    }

    @Test
    void decodesDenyWithHint() {
        Optional<ClientFrame> frame = codec.decodeClient(
                "{\"type\":\"intervene\",\"decision\":\"deny\",\"hint\":\"check the configmap\"}");

        assertThat(frame).hasValueSatisfying(f -> {
            ClientFrame.Intervene i = (ClientFrame.Intervene) f;
            assertThat(i.decision()).isEqualTo(InterventionDecision.DENY);
            assertThat(i.hint()).isEqualTo("check the configmap");
        });
    }

    @Test
    void resumeWithoutDecisionMeansYes() {
        Optional<ClientFrame> frame = codec.decodeClient("{\"type\":\"resume\"}");

        assertThat(frame).hasValue(new ClientFrame.Resume(ResumeDecision.YES));
    }

    @Test
    void unknownDecisionIsDropped() {
        assertThat(codec.decodeClient("{\"type\":\"intervene\",\"decision\":\"maybe\"}")).isEmpty();
    }

    @Test
    void malformedAndUnknownFramesAreDropped() {
        assertThat(codec.decodeClient("not json")).isEmpty();
        assertThat(codec.decodeClient("[1,2]")).isEmpty();
        assertThat(codec.decodeClient("{\"type\":\"shutdown\"}")).isEmpty();
        assertThat(codec.decodeClient("{\"type\":\"start\"}")).isEmpty();
        assertThat(codec.decodeServer("{\"event\":\"telemetry\"}")).isEmpty();
        assertThat(codec.decodeServer("{\"event\":\"diagnostic\",\"state\":\"oops\"}")).isEmpty();
        assertThat(codec.decodeServer("{\"event\":\"start\"}")).isEmpty();
        assertThat(codec.decodeServer(null)).isEmpty();
    }

    @Test
    void diagnosticFrameUsesSnakeCaseFields() throws Exception {
        var state = new AgentStateSnapshot("pod restarts", "get_pod_events", "{\"name\":\"api\"}",
                NextAction.AWAIT_USER_APPROVAL, null);

        JsonNode node = codec.objectMapper().readTree(codec.encode(new ServerFrame.Diagnostic(state, "diag-1")));

        assertThat(node.path("event").asText()).isEqualTo("diagnostic");
        assertThat(node.path("diag_thread_id").asText()).isEqualTo("diag-1");
        assertThat(node.path("state").path("next_action").asText()).isEqualTo("await_user_approval");
        assertThat(node.path("state").path("action_input").asText()).isEqualTo("{\"name\":\"api\"}");
        assertThat(node.path("state").has("root_cause")).isFalse();
    }

    @Test
    void decodesDiagnosticWithUnknownNextActionAsNull() {
        Optional<ServerFrame> frame = codec.decodeServer(
                "{\"event\":\"diagnostic\",\"diag_thread_id\":\"d1\",\"state\":{\"thought\":\"t\",\"next_action\":\"dance\"}}");

        assertThat(frame).hasValueSatisfying(f -> {
            ServerFrame.Diagnostic d = (ServerFrame.Diagnostic) f;
            assertThat(d.state().thought()).isEqualTo("t");
            assertThat(d.state().nextAction()).isNull();
        });
    }

    @Test
    void awaitingApprovalTagFollowsDecisionKind() {
        String json = codec.encode(new ServerFrame.AwaitingApproval("Hand off?", DecisionKind.HANDOFF_APPROVAL));

        assertThat(json).contains("\"event\":\"handoff_approval\"");
        assertThat(codec.decodeServer(json))
                .hasValue(new ServerFrame.AwaitingApproval("Hand off?", DecisionKind.HANDOFF_APPROVAL));
        assertThat(codec.decodeServer("{\"event\":\"resume_available\",\"question\":\"Resume?\"}"))
                .hasValue(new ServerFrame.AwaitingApproval("Resume?", DecisionKind.RESUME_AVAILABLE));
    }

    @Test
    void historyAcceptsObjectsAndBareStrings() {
        Optional<ServerFrame> frame = codec.decodeServer("""
                {"event":"history","diag_thread_id":"d1",
                 "diag_history":[{"role":"assistant","text":"{\\"thought\\":\\"t1\\"}","created_at":"2025-01-15T10:00:00Z"},"plain text"],
                 "sol_history":[]}""");

        assertThat(frame).hasValueSatisfying(f -> {
            ServerFrame.History h = (ServerFrame.History) f;
            assertThat(h.diagHistory()).extracting(MessageItem::text).containsExactly("{\"thought\":\"t1\"}", "plain text");
            assertThat(h.diagHistory().get(0).createdAt()).isEqualTo(Instant.parse("2025-01-15T10:00:00Z"));
            assertThat(h.solHistory()).isEmpty();
            assertThat(h.solThreadId()).isNull();
        });
    }

    @Test
    void historyOmitsMissingSolutionThread() {
        String json = codec.encode(new ServerFrame.History(List.of(), null, "d1", null));

        assertThat(json).contains("\"sol_history\":[]").doesNotContain("sol_thread_id");
    }

    @Test
    void errorFrameFallsBackToErrorField() {
        assertThat(codec.decodeServer("{\"event\":\"error\",\"error\":\"WebSocket connection error\"}"))
                .hasValue(new ServerFrame.Error("WebSocket connection error"));
    }

    @Test
    void handoffKeepsStructuredState() {
        JsonNode state = codec.readObject("{\"recommended_fix\":\"kubectl rollout undo deploy/api\"}");
        String json = codec.encode(new ServerFrame.Handoff("sol-1", state));

        ServerFrame.Handoff decoded = (ServerFrame.Handoff) codec.decodeServer(json).orElseThrow();
        assertThat(decoded.solThreadId()).isEqualTo("sol-1");
        assertThat(decoded.state().path("recommended_fix").asText()).isEqualTo("kubectl rollout undo deploy/api");
    }
}

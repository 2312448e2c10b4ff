package io.github.drompincen.sreflow.client.conversation;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.sreflow.protocol.model.AgentStateSnapshot;
import io.github.drompincen.sreflow.protocol.model.DecisionKind;
import io.github.drompincen.sreflow.protocol.model.MessageItem;
import io.github.drompincen.sreflow.protocol.model.NextAction;
import io.github.drompincen.sreflow.protocol.ws.FrameCodec;
import io.github.drompincen.sreflow.protocol.ws.ServerFrame;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConversationMergerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private ConversationMerger merger;

    @BeforeEach
    void setUp() {
        merger = new ConversationMerger(new FrameCodec(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static ServerFrame.Diagnostic diagnostic(String thought, String action, NextAction next, String rootCause) {
        return new ServerFrame.Diagnostic(new AgentStateSnapshot(thought, action, null, next, rootCause), "diag-1");
    }

    @Test
    void diagnosticAppendsMessageAndProgress() {
        ConversationSnapshot s = merger.apply(ConversationSnapshot.empty(),
                diagnostic("Checking restarts", "get_pod_logs", NextAction.CONTINUE, null));

        assertThat(s.getDiagThreadId()).isEqualTo("diag-1");
        assertThat(s.getDiagnosticLog()).hasSize(1);
        assertThat(s.getDiagnosticLog().get(0).text()).contains("\"thought\":\"Checking restarts\"");
        assertThat(s.getThoughts()).containsExactly("Checking restarts");
        assertThat(s.getActions()).containsExactly("get_pod_logs");
        assertThat(s.getSteps()).extracting(Step::thought).containsExactly("Checking restarts");
        assertThat(s.getState().nextAction()).isEqualTo(NextAction.CONTINUE);
    }

    @Test
    void repeatedStepIsNotDuplicated() {
        ConversationSnapshot s = ConversationSnapshot.empty();
        s = merger.apply(s, diagnostic("Checking restarts", "get_pod_logs", NextAction.CONTINUE, null));
        s = merger.apply(s, diagnostic("Checking restarts", "get_pod_logs", NextAction.CONTINUE, null));
        s = merger.apply(s, diagnostic("Checking restarts", "describe_pod", NextAction.CONTINUE, null));

        assertThat(s.getThoughts()).containsExactly("Checking restarts");
        assertThat(s.getActions()).containsExactly("get_pod_logs", "describe_pod");
        assertThat(s.getSteps()).hasSize(2);
        assertThat(s.getDiagnosticLog()).hasSize(3);
    }

    @Test
    void rootCauseIsSticky() {
        ConversationSnapshot s = ConversationSnapshot.empty();
        s = merger.apply(s, diagnostic("a", null, NextAction.CONTINUE, "Missing DATABASE_URL"));
        s = merger.apply(s, diagnostic("b", null, NextAction.CONTINUE, null));
        s = merger.apply(s, diagnostic("c", null, NextAction.CONTINUE, "  "));

        assertThat(s.getRootCause()).isEqualTo("Missing DATABASE_URL");
    }

    @Test
    void diagnosticClearsPendingDecision() {
        ConversationSnapshot s = merger.apply(ConversationSnapshot.empty(),
                new ServerFrame.AwaitingApproval("Approve?", DecisionKind.AWAITING_APPROVAL));
        s = merger.markDecisionSent(s);
        assertThat(s.isDecisionInFlight()).isTrue();

        s = merger.apply(s, diagnostic("next", null, NextAction.CONTINUE, null));

        assertThat(s.getPendingDecision()).isNull();
        assertThat(s.isDecisionInFlight()).isFalse();
    }

    @Test
    void historyRebuildsFromMixedMessages() {
        Instant t1 = Instant.parse("2024-05-01T09:00:00Z");
        Instant t2 = Instant.parse("2024-05-01T09:01:00Z");
        ServerFrame.History history = new ServerFrame.History(
                List.of(MessageItem.assistant("{\"thought\":\"t1\"}", t1),
                        MessageItem.assistant("plain text", t2)),
                List.of(), "diag-1", null);

        ConversationSnapshot s = merger.apply(ConversationSnapshot.empty(), history);

        assertThat(s.getThoughts()).containsExactly("t1", "plain text");
        assertThat(s.getActions()).isEmpty();
        assertThat(s.getSteps()).containsExactly(new Step("t1", null, t1), new Step("plain text", null, t2));
        assertThat(s.getDiagnosticLog()).hasSize(2);
    }

    @Test
    void replayingHistoryIsIdempotent() {
        ServerFrame.History history = new ServerFrame.History(
                List.of(MessageItem.assistant("{\"thought\":\"t1\",\"root_cause\":\"OOM\"}", NOW),
                        MessageItem.assistant("{\"thought\":\"t2\",\"next_action\":\"await_user_approval\"}", NOW)),
                List.of(), "diag-1", null);

        ConversationSnapshot once = merger.apply(ConversationSnapshot.empty(), history);
        ConversationSnapshot twice = merger.apply(once, history);

        assertThat(twice).isEqualTo(once);
        assertThat(once.getRootCause()).isEqualTo("OOM");
        assertThat(once.getState().nextAction()).isEqualTo(NextAction.AWAIT_USER_APPROVAL);
    }

    @Test
    void historyReplacesLiveLog() {
        ConversationSnapshot s = merger.apply(ConversationSnapshot.empty(),
                diagnostic("live only", null, NextAction.CONTINUE, null));
        ServerFrame.History history = new ServerFrame.History(
                List.of(MessageItem.assistant("{\"thought\":\"server\"}", NOW)), List.of(), "diag-1", null);

        s = merger.apply(s, history);

        assertThat(s.getThoughts()).containsExactly("server");
        assertThat(s.getDiagnosticLog()).hasSize(1);
    }

    @Test
    void historyDecodesLastSolutionMessage() {
        ServerFrame.History history = new ServerFrame.History(
                List.of(MessageItem.assistant("{\"thought\":\"t1\"}", NOW)),
                List.of(MessageItem.assistant("{\"recommended_fix\":\"Restore the secret\"}", NOW)),
                "diag-1", "sol-1");

        ConversationSnapshot s = merger.apply(ConversationSnapshot.empty(), history);

        assertThat(s.getSolThreadId()).isEqualTo("sol-1");
        assertThat(s.getSolutionState().kind()).isEqualTo(SolutionState.Kind.RECOMMENDED_FIX);
        assertThat(s.getSolutionState().fixText()).isEqualTo("Restore the secret");
    }

    @Test
    void handoffSetsSolutionThreadOnce() {
        ObjectNode state = JsonNodeFactory.instance.objectNode().put("summary", "Roll back");
        ConversationSnapshot s = merger.apply(ConversationSnapshot.empty(), new ServerFrame.Handoff("sol-1", state));
        s = merger.apply(s, new ServerFrame.Handoff("sol-2", null));

        assertThat(s.getSolThreadId()).isEqualTo("sol-1");
        assertThat(s.getSolutionState().summary()).isEqualTo("Roll back");
        assertThat(s.getSolutionLog()).hasSize(1);
    }

    @Test
    void transportErrorKeepsPendingDecision() {
        ConversationSnapshot s = merger.apply(ConversationSnapshot.empty(),
                new ServerFrame.AwaitingApproval("Hand off?", DecisionKind.HANDOFF_APPROVAL));
        s = merger.markDecisionSent(s);

        s = merger.applyTransportError(s, "WebSocket connection error");

        assertThat(s.getPendingDecision().kind()).isEqualTo(DecisionKind.HANDOFF_APPROVAL);
        assertThat(s.isDecisionInFlight()).isFalse();
        assertThat(s.getLastError()).isEqualTo("WebSocket connection error");
    }

    @Test
    void serverErrorClearsPendingDecision() {
        ConversationSnapshot s = merger.apply(ConversationSnapshot.empty(),
                new ServerFrame.AwaitingApproval("Approve?", DecisionKind.AWAITING_APPROVAL));

        s = merger.apply(s, new ServerFrame.Error("Agent step timed out"));

        assertThat(s.getPendingDecision()).isNull();
        assertThat(s.getLastError()).isEqualTo("Agent step timed out");
    }

    @Test
    void connectingClearsLastErrorAndSetsLoading() {
        ConversationSnapshot s = merger.applyTransportError(ConversationSnapshot.empty(), "boom");

        s = merger.markConnecting(s);

        assertThat(s.isLoading()).isTrue();
        assertThat(s.getLastError()).isNull();
        assertThat(s.hasConversation()).isTrue();
    }
}

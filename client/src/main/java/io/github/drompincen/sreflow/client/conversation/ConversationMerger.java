package io.github.drompincen.sreflow.client.conversation;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.sreflow.protocol.model.AgentStateSnapshot;
import io.github.drompincen.sreflow.protocol.model.MessageItem;
import io.github.drompincen.sreflow.protocol.model.NextAction;
import io.github.drompincen.sreflow.protocol.model.PendingDecision;
import io.github.drompincen.sreflow.protocol.ws.FrameCodec;
import io.github.drompincen.sreflow.protocol.ws.ServerFrame;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Folds server frames into a {@link ConversationSnapshot}. All operations are pure
 * and total: a payload that cannot be parsed degrades to plain text, nothing throws.
 */
public class ConversationMerger {

    private final FrameCodec codec;
    private final SolutionDecoder solutionDecoder;
    private final Clock clock;

    public ConversationMerger(FrameCodec codec) {
        this(codec, Clock.systemUTC());
    }

    public ConversationMerger(FrameCodec codec, Clock clock) {
        this.codec = codec;
        this.solutionDecoder = new SolutionDecoder(codec);
        this.clock = clock;
    }

    public ConversationSnapshot apply(ConversationSnapshot snapshot, ServerFrame frame) {
        if (frame instanceof ServerFrame.Diagnostic d) return applyDiagnostic(snapshot, d);
        if (frame instanceof ServerFrame.History h) return applyHistory(snapshot, h);
        if (frame instanceof ServerFrame.AwaitingApproval a) return applyAwaitingApproval(snapshot, a);
        if (frame instanceof ServerFrame.Handoff h) return applyHandoff(snapshot, h);
        if (frame instanceof ServerFrame.Complete c) return applyComplete(snapshot, c);
        if (frame instanceof ServerFrame.Error e) return applyError(snapshot, e);
        return snapshot;
    }

    /**
     * Records one agent step. Thoughts, actions and steps are deduplicated by value; a
     * newer step supersedes any open decision.
     */
    public ConversationSnapshot applyDiagnostic(ConversationSnapshot snapshot, ServerFrame.Diagnostic frame) {
        ConversationSnapshot next = snapshot.withDiagThreadId(frame.diagThreadId());
        AgentStateSnapshot state = frame.state();
        if (state != null) {
            Instant now = clock.instant();
            next = next.withState(state)
                    .withDiagnosticMessage(MessageItem.assistant(codec.write(state), now))
                    .withProgress(state.thought(), state.action(), now)
                    .withRootCause(state.rootCause());
        }
        return next.withPendingDecision(null)
                .withDecisionInFlight(false)
                .withLoading(false);
    }

    /**
     * Rebuilds every derived value from the replayed logs. Replaying the same history
     * twice yields an equal snapshot.
     */
    public ConversationSnapshot applyHistory(ConversationSnapshot snapshot, ServerFrame.History frame) {
        List<String> thoughts = new ArrayList<>();
        List<String> actions = new ArrayList<>();
        List<Step> steps = new ArrayList<>();
        String rootCause = null;
        AgentStateSnapshot latest = null;

        for (MessageItem message : frame.diagHistory()) {
            String text = message.text();
            JsonNode node = codec.readObject(text);
            if (node != null) {
                AgentStateSnapshot parsed = snapshotOf(node);
                ConversationSnapshot.fold(thoughts, actions, steps, parsed.thought(), parsed.action(),
                        message.createdAt());
                if (rootCause == null && parsed.rootCause() != null && !parsed.rootCause().isBlank()) {
                    rootCause = parsed.rootCause();
                }
                latest = parsed;
            } else {
                ConversationSnapshot.fold(thoughts, actions, steps, text, null, message.createdAt());
            }
        }

        ConversationSnapshot next = snapshot
                .withReplayedLogs(frame.diagHistory(), frame.solHistory(), thoughts, actions, steps)
                .withDiagThreadId(frame.diagThreadId())
                .withSolThreadId(frame.solThreadId())
                .withRootCause(rootCause)
                .withPendingDecision(null)
                .withDecisionInFlight(false)
                .withLoading(false);
        if (latest != null) {
            next = next.withState(latest);
        }
        if (!frame.solHistory().isEmpty()) {
            MessageItem last = frame.solHistory().get(frame.solHistory().size() - 1);
            SolutionState solution = solutionDecoder.decodeText(last.text());
            if (solution != null) next = next.withSolutionState(solution);
        }
        return next;
    }

    public ConversationSnapshot applyAwaitingApproval(ConversationSnapshot snapshot, ServerFrame.AwaitingApproval frame) {
        return snapshot.withPendingDecision(new PendingDecision(frame.question(), frame.kind()))
                .withDecisionInFlight(false)
                .withLoading(false);
    }

    public ConversationSnapshot applyHandoff(ConversationSnapshot snapshot, ServerFrame.Handoff frame) {
        ConversationSnapshot next = snapshot.withSolThreadId(frame.solThreadId());
        SolutionState solution = solutionDecoder.decode(frame.state());
        if (solution != null) {
            next = next.withSolutionState(solution)
                    .withSolutionMessage(MessageItem.assistant(codec.write(frame.state()), clock.instant()));
        }
        return next.withPendingDecision(null)
                .withDecisionInFlight(false)
                .withLoading(false);
    }

    public ConversationSnapshot applyComplete(ConversationSnapshot snapshot, ServerFrame.Complete frame) {
        return snapshot.withDiagThreadId(frame.diagThreadId())
                .withSolThreadId(frame.solThreadId())
                .withPendingDecision(null)
                .withDecisionInFlight(false)
                .withLoading(false);
    }

    public ConversationSnapshot applyError(ConversationSnapshot snapshot, ServerFrame.Error frame) {
        return snapshot.withLastError(frame.message())
                .withPendingDecision(null)
                .withDecisionInFlight(false)
                .withLoading(false);
    }

    // ---- local events ----

    /** The channel broke; the conversation so far, including an open decision, is kept. */
    public ConversationSnapshot applyTransportError(ConversationSnapshot snapshot, String message) {
        return snapshot.withLastError(message)
                .withDecisionInFlight(false)
                .withLoading(false);
    }

    public ConversationSnapshot markConnecting(ConversationSnapshot snapshot) {
        return snapshot.withLoading(true).withLastError(null);
    }

    public ConversationSnapshot markDecisionSent(ConversationSnapshot snapshot) {
        return snapshot.withDecisionInFlight(true);
    }

    /** A declined resume offer gets no answer from the server. */
    public ConversationSnapshot withdrawDecision(ConversationSnapshot snapshot) {
        return snapshot.withPendingDecision(null).withDecisionInFlight(false);
    }

    public ConversationSnapshot markIdle(ConversationSnapshot snapshot) {
        return snapshot.withLoading(false);
    }

    private static AgentStateSnapshot snapshotOf(JsonNode node) {
        return new AgentStateSnapshot(
                text(node, "thought"),
                text(node, "action"),
                text(node, "action_input"),
                NextAction.fromWire(text(node, "next_action")),
                text(node, "root_cause"));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }
}

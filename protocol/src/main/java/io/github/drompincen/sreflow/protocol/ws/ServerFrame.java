package io.github.drompincen.sreflow.protocol.ws;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.sreflow.protocol.model.AgentStateSnapshot;
import io.github.drompincen.sreflow.protocol.model.DecisionKind;
import io.github.drompincen.sreflow.protocol.model.MessageItem;

import java.util.List;

/**
 * Events streamed by the session coordinator, tagged on the wire by {@code event}.
 */
public interface ServerFrame {

    FrameType type();

    record Diagnostic(AgentStateSnapshot state, String diagThreadId) implements ServerFrame {
        @Override
        public FrameType type() { return FrameType.DIAGNOSTIC; }
    }

    record History(List<MessageItem> diagHistory,
                   List<MessageItem> solHistory,
                   String diagThreadId,
                   String solThreadId) implements ServerFrame {
        public History {
            diagHistory = diagHistory != null ? List.copyOf(diagHistory) : List.of();
            solHistory = solHistory != null ? List.copyOf(solHistory) : List.of();
        }

        @Override
        public FrameType type() { return FrameType.HISTORY; }
    }

    record AwaitingApproval(String question, DecisionKind kind) implements ServerFrame {
        @Override
        public FrameType type() { return FrameType.forDecision(kind); }
    }

    /** {@code state} is the solution agent's structured output, when it produced one. */
    record Handoff(String solThreadId, JsonNode state) implements ServerFrame {
        @Override
        public FrameType type() { return FrameType.HANDOFF; }
    }

    record Complete(String diagThreadId, String solThreadId) implements ServerFrame {
        @Override
        public FrameType type() { return FrameType.COMPLETE; }
    }

    record Error(String message) implements ServerFrame {
        @Override
        public FrameType type() { return FrameType.ERROR; }
    }
}

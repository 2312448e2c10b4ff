package io.github.drompincen.sreflow.protocol.ws;

import io.github.drompincen.sreflow.protocol.model.Issue;

/**
 * Control frames sent by the operator's client.
 */
public interface ClientFrame {

    FrameType type();

    record Start(Issue issue) implements ClientFrame {
        @Override
        public FrameType type() { return FrameType.START; }
    }

    record Intervene(InterventionDecision decision, String hint) implements ClientFrame {
        @Override
        public FrameType type() { return FrameType.INTERVENE; }

        public boolean hasHint() {
            return hint != null && !hint.isBlank();
        }
    }

    record Resume(ResumeDecision decision) implements ClientFrame {
        @Override
        public FrameType type() { return FrameType.RESUME; }
    }
}

package io.github.drompincen.sreflow.client.conversation;

import java.time.Instant;
import java.util.Objects;

/**
 * One card of the diagnostic pipeline. Two steps are duplicates when their
 * {@code (thought, action)} pair is equal; the timestamp does not take part.
 */
public record Step(String thought, String action, Instant timestamp) {

    public boolean sameContent(Step other) {
        return Objects.equals(thought, other.thought) && Objects.equals(action, other.action);
    }
}

package io.github.drompincen.sreflow.runtime.agent;

import io.github.drompincen.sreflow.protocol.model.Issue;
import io.github.drompincen.sreflow.protocol.model.MessageItem;

import java.util.List;

/**
 * Input for one ReAct step. {@code stepNo} starts at 1 and counts every step taken on
 * the thread; {@code hint} carries operator guidance after a denial, otherwise null.
 */
public record DiagnosticRequest(
        String threadId,
        Issue issue,
        int stepNo,
        String hint,
        List<MessageItem> history
) {
    public boolean hasHint() {
        return hint != null && !hint.isBlank();
    }
}

package io.github.drompincen.sreflow.runtime.agent;

import io.github.drompincen.sreflow.protocol.model.Issue;
import io.github.drompincen.sreflow.protocol.model.MessageItem;

import java.util.List;

public record SolutionRequest(
        Issue issue,
        String diagThreadId,
        String rootCause,
        List<MessageItem> diagHistory
) {}

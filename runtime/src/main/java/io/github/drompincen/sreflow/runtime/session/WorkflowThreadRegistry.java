package io.github.drompincen.sreflow.runtime.session;

import io.github.drompincen.sreflow.protocol.model.Issue;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Workflow threads keyed by issue key. In memory only; threads do not survive a restart.
 */
@Component
public class WorkflowThreadRegistry {

    private final Map<String, WorkflowThread> threads = new ConcurrentHashMap<>();

    public Optional<WorkflowThread> find(String issueKey) {
        return Optional.ofNullable(threads.get(issueKey));
    }

    /** Returns the existing thread for the issue or registers a new {@code IDLE} one. */
    public WorkflowThread getOrCreate(Issue issue) {
        return threads.computeIfAbsent(issue.key(), k -> new WorkflowThread(issue));
    }

    /** Removes the entry only if it still maps to {@code thread}. */
    public boolean remove(WorkflowThread thread) {
        return threads.remove(thread.getIssueKey(), thread);
    }

    public Collection<WorkflowThread> all() {
        return List.copyOf(threads.values());
    }

    public int size() {
        return threads.size();
    }
}

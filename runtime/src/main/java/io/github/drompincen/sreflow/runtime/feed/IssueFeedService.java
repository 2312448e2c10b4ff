package io.github.drompincen.sreflow.runtime.feed;

import io.github.drompincen.sreflow.protocol.model.Issue;
import io.github.drompincen.sreflow.protocol.model.IssueOrdering;
import io.github.drompincen.sreflow.runtime.session.SessionCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Polls the {@link IssueFeed}, keeps the snapshot served to clients (grouped by
 * namespace, severity order within a namespace) and tells the coordinator which
 * issues went away and which reported new signal. Polls never overlap.
 */
@Service
public class IssueFeedService {

    private static final Logger log = LoggerFactory.getLogger(IssueFeedService.class);

    private final IssueFeed feed;
    private final SessionCoordinator coordinator;
    private final AtomicReference<List<Issue>> snapshot = new AtomicReference<>();

    public IssueFeedService(IssueFeed feed, SessionCoordinator coordinator) {
        this.feed = feed;
        this.coordinator = coordinator;
    }

    @Scheduled(fixedDelayString = "${sreflow.feed.poll-interval-ms:30000}")
    public synchronized void refresh() {
        List<Issue> fetched;
        try {
            fetched = feed.fetchIssues();
        } catch (RuntimeException e) {
            log.warn("Issue feed poll failed, keeping previous snapshot: {}", e.getMessage());
            return;
        }
        List<Issue> ordered = List.copyOf(IssueOrdering.grouped(fetched));
        List<Issue> previous = snapshot.getAndSet(ordered);

        Set<String> liveKeys = new LinkedHashSet<>();
        ordered.forEach(issue -> liveKeys.add(issue.key()));
        coordinator.prune(liveKeys);

        if (previous == null) {
            log.info("Issue feed loaded {} issue(s)", ordered.size());
            return;
        }
        Map<String, Issue> previousByKey = new HashMap<>();
        previous.forEach(issue -> previousByKey.put(issue.key(), issue));
        for (Issue issue : ordered) {
            Issue before = previousByKey.get(issue.key());
            if (before != null && signalChanged(before, issue)) {
                log.debug("Issue {} changed: {} -> {}", issue.key(), before.message(), issue.message());
                coordinator.offerResume(issue);
            }
        }
    }

    /** The ordered snapshot, polling once if nothing has been fetched yet. */
    public List<Issue> currentIssues() {
        if (snapshot.get() == null) {
            refreshIfEmpty();
        }
        List<Issue> current = snapshot.get();
        return current != null ? current : List.of();
    }

    private synchronized void refreshIfEmpty() {
        if (snapshot.get() == null) {
            refresh();
        }
    }

    // the age fields move on every poll and are not new signal
    static boolean signalChanged(Issue before, Issue after) {
        return !Objects.equals(before.issueType(), after.issueType())
                || before.severity() != after.severity()
                || !Objects.equals(before.message(), after.message());
    }
}

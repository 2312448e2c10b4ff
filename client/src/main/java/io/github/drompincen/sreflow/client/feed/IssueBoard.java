package io.github.drompincen.sreflow.client.feed;

import io.github.drompincen.sreflow.client.session.SessionRegistry;
import io.github.drompincen.sreflow.client.status.DisplayStatus;
import io.github.drompincen.sreflow.protocol.model.Issue;
import io.github.drompincen.sreflow.protocol.model.IssueOrdering;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * The operator's issue list: polls the feed, keeps issues grouped by namespace and
 * ordered by severity, and prunes sessions of issues that went away.
 */
public class IssueBoard {

    private static final Logger log = LoggerFactory.getLogger(IssueBoard.class);

    private final IssueFeedClient feedClient;
    private final SessionRegistry sessions;
    private volatile List<Issue> issues = List.of();
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> polling;

    public IssueBoard(IssueFeedClient feedClient, SessionRegistry sessions) {
        this.feedClient = feedClient;
        this.sessions = sessions;
    }

    /** Polls once. A failed poll keeps the previous snapshot and prunes nothing. */
    public boolean refresh() {
        List<Issue> fetched;
        try {
            fetched = feedClient.fetchIssues();
        } catch (IOException e) {
            log.warn("Issue feed refresh failed: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        issues = List.copyOf(IssueOrdering.sorted(fetched));
        sessions.prune(issues);
        log.debug("Issue board refreshed: {} issue(s)", issues.size());
        return true;
    }

    public List<Issue> issues() {
        return issues;
    }

    public Map<String, List<Issue>> byNamespace() {
        return IssueOrdering.byNamespace(issues);
    }

    /** Status badge of every listed issue, in board order. */
    public Map<String, DisplayStatus> statuses() {
        Map<String, DisplayStatus> result = new LinkedHashMap<>();
        for (Issue issue : issues) {
            result.put(issue.key(), sessions.statusOf(issue.key()));
        }
        return result;
    }

    public synchronized void startPolling(Duration interval) {
        if (polling != null) return;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "issue-board");
            t.setDaemon(true);
            return t;
        });
        polling = scheduler.scheduleWithFixedDelay(this::refresh, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Polling {} every {}", feedClient.issuesUri(), interval);
    }

    public synchronized void stopPolling() {
        if (polling == null) return;
        polling.cancel(false);
        scheduler.shutdownNow();
        polling = null;
        scheduler = null;
    }
}

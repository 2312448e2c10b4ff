package io.github.drompincen.sreflow.client.feed;

import io.github.drompincen.sreflow.client.session.SessionRegistry;
import io.github.drompincen.sreflow.client.status.DisplayStatus;
import io.github.drompincen.sreflow.protocol.model.Issue;
import io.github.drompincen.sreflow.protocol.model.ResourceType;
import io.github.drompincen.sreflow.protocol.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class IssueBoardTest {

    private static final Issue LOW = new Issue("PendingPod", Severity.INFO, ResourceType.POD,
            "batch", "job-1", null, "00h 01m", 60, "Unschedulable");
    private static final Issue CRITICAL = new Issue("CrashLoopBackOff", Severity.CRITICAL, ResourceType.POD,
            "payments", "api-7d9", "api", "01h 02m", 3720, "Back-off restarting failed container");

    @Mock private IssueFeedClient feedClient;
    @Mock private SessionRegistry sessions;

    private IssueBoard board;

    @BeforeEach
    void setUp() {
        board = new IssueBoard(feedClient, sessions);
        when(sessions.statusOf(anyString())).thenReturn(DisplayStatus.NOT_STARTED);
    }

    @Test
    void refreshSortsAndPrunes() throws Exception {
        when(feedClient.fetchIssues()).thenReturn(List.of(LOW, CRITICAL));

        assertThat(board.refresh()).isTrue();

        assertThat(board.issues()).containsExactly(CRITICAL, LOW);
        assertThat(board.byNamespace()).containsOnlyKeys("payments", "batch");
        verify(sessions).prune(List.of(CRITICAL, LOW));
    }

    @Test
    void failedRefreshKeepsSnapshotAndPrunesNothing() throws Exception {
        when(feedClient.fetchIssues()).thenReturn(List.of(CRITICAL));
        board.refresh();
        clearInvocations(sessions);
        when(feedClient.fetchIssues()).thenThrow(new IOException("connection refused"));

        assertThat(board.refresh()).isFalse();

        assertThat(board.issues()).containsExactly(CRITICAL);
        verify(sessions, never()).prune(any());
    }

    @Test
    void statusesInBoardOrder() throws Exception {
        when(feedClient.fetchIssues()).thenReturn(List.of(LOW, CRITICAL));
        when(sessions.statusOf(CRITICAL.key())).thenReturn(DisplayStatus.IN_PROGRESS);
        board.refresh();

        assertThat(board.statuses()).containsExactly(
                entry(CRITICAL.key(), DisplayStatus.IN_PROGRESS),
                entry(LOW.key(), DisplayStatus.NOT_STARTED));
    }
}

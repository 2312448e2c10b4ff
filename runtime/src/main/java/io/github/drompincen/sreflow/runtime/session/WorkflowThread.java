package io.github.drompincen.sreflow.runtime.session;

import io.github.drompincen.sreflow.protocol.model.AgentStateSnapshot;
import io.github.drompincen.sreflow.protocol.model.Issue;
import io.github.drompincen.sreflow.protocol.model.MessageItem;
import io.github.drompincen.sreflow.protocol.model.PendingDecision;
import io.github.drompincen.sreflow.protocol.ws.ServerFrame;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Server-side state of one issue's diagnostic workflow.
 *
 * <p>Not thread-safe on its own: {@link SessionCoordinator} guards every read and
 * write with this object's monitor. The sink set is concurrent so a transport can
 * detach without taking the lock.
 */
public class WorkflowThread {

    private final String issueKey;
    private Issue issue;
    private String diagThreadId;
    private String solThreadId;
    private CoordinatorState state = CoordinatorState.IDLE;
    private PendingDecision pendingDecision;
    private boolean decisionInFlight;
    private boolean agentCallInProgress;
    private String pendingHint;
    private int stepsSinceGate;
    private AgentStateSnapshot lastSnapshot;
    private String rootCause;
    private final List<MessageItem> diagHistory = new ArrayList<>();
    private final List<MessageItem> solHistory = new ArrayList<>();
    private final Set<FrameSink> sinks = new CopyOnWriteArraySet<>();

    public WorkflowThread(Issue issue) {
        this.issueKey = issue.key();
        this.issue = issue;
    }

    void assignDiagThread(String threadId) {
        if (diagThreadId != null) {
            throw new IllegalStateException("Diagnostic thread already assigned for " + issueKey);
        }
        this.diagThreadId = threadId;
    }

    void assignSolThread(String threadId) {
        if (solThreadId != null && !solThreadId.equals(threadId)) {
            throw new IllegalStateException("Solution thread already assigned for " + issueKey);
        }
        this.solThreadId = threadId;
    }

    void recordStep(AgentStateSnapshot snapshot, MessageItem message) {
        diagHistory.add(message);
        lastSnapshot = snapshot;
        stepsSinceGate++;
        if (snapshot.rootCause() != null && !snapshot.rootCause().isBlank()) {
            rootCause = snapshot.rootCause();
        }
    }

    void recordSolution(MessageItem message) {
        solHistory.add(message);
    }

    void openDecision(PendingDecision decision) {
        this.pendingDecision = decision;
        this.decisionInFlight = false;
        this.stepsSinceGate = 0;
        this.state = CoordinatorState.AWAITING_DECISION;
    }

    void clearDecision() {
        this.pendingDecision = null;
        this.decisionInFlight = false;
    }

    String takeHint() {
        String hint = pendingHint;
        pendingHint = null;
        return hint;
    }

    ServerFrame.History history() {
        return new ServerFrame.History(diagHistory, solHistory, diagThreadId, solThreadId);
    }

    ThreadView view() {
        return new ThreadView(issueKey, diagThreadId, solThreadId, state, pendingDecision,
                decisionInFlight, rootCause, diagHistory.size(), sinks.size());
    }

    int nextStepNo() {
        return diagHistory.size() + 1;
    }

    List<MessageItem> diagHistorySnapshot() {
        return List.copyOf(diagHistory);
    }

    // Getters and setters
    public String getIssueKey() { return issueKey; }

    public Issue getIssue() { return issue; }
    void setIssue(Issue issue) { this.issue = issue; }

    public String getDiagThreadId() { return diagThreadId; }
    public String getSolThreadId() { return solThreadId; }

    public CoordinatorState getState() { return state; }
    void setState(CoordinatorState state) { this.state = state; }

    public PendingDecision getPendingDecision() { return pendingDecision; }

    public boolean isDecisionInFlight() { return decisionInFlight; }
    void setDecisionInFlight(boolean decisionInFlight) { this.decisionInFlight = decisionInFlight; }

    public boolean isAgentCallInProgress() { return agentCallInProgress; }
    void setAgentCallInProgress(boolean agentCallInProgress) { this.agentCallInProgress = agentCallInProgress; }

    void setPendingHint(String pendingHint) { this.pendingHint = pendingHint; }

    public int getStepsSinceGate() { return stepsSinceGate; }
    void resetStepsSinceGate() { this.stepsSinceGate = 0; }

    public AgentStateSnapshot getLastSnapshot() { return lastSnapshot; }
    public String getRootCause() { return rootCause; }

    public Set<FrameSink> getSinks() { return sinks; }
}

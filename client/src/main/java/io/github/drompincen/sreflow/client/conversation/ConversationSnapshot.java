package io.github.drompincen.sreflow.client.conversation;

import io.github.drompincen.sreflow.protocol.model.AgentStateSnapshot;
import io.github.drompincen.sreflow.protocol.model.MessageItem;
import io.github.drompincen.sreflow.protocol.model.PendingDecision;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Everything the client knows about one issue's conversation. Immutable: every
 * {@code withX} returns a modified copy, so a snapshot handed to a listener never
 * changes underneath it.
 */
public class ConversationSnapshot {

    private AgentStateSnapshot state;
    private List<MessageItem> diagnosticLog;
    private List<MessageItem> solutionLog;
    private List<String> thoughts;
    private List<String> actions;
    private List<Step> steps;
    private String rootCause;
    private SolutionState solutionState;
    private PendingDecision pendingDecision;
    private boolean decisionInFlight;
    private boolean loading;
    private String diagThreadId;
    private String solThreadId;
    private String lastError;

    private ConversationSnapshot() {
        this.diagnosticLog = new ArrayList<>();
        this.solutionLog = new ArrayList<>();
        this.thoughts = new ArrayList<>();
        this.actions = new ArrayList<>();
        this.steps = new ArrayList<>();
    }

    public static ConversationSnapshot empty() {
        return new ConversationSnapshot();
    }

    public ConversationSnapshot withState(AgentStateSnapshot state) {
        ConversationSnapshot copy = copy();
        copy.state = state;
        return copy;
    }

    public ConversationSnapshot withDiagnosticMessage(MessageItem message) {
        ConversationSnapshot copy = copy();
        copy.diagnosticLog.add(message);
        return copy;
    }

    public ConversationSnapshot withSolutionMessage(MessageItem message) {
        ConversationSnapshot copy = copy();
        copy.solutionLog.add(message);
        return copy;
    }

    /** Replaces the logs and every value derived from them. */
    ConversationSnapshot withReplayedLogs(List<MessageItem> diagnostic, List<MessageItem> solution,
                                          List<String> thoughts, List<String> actions, List<Step> steps) {
        ConversationSnapshot copy = copy();
        copy.diagnosticLog = new ArrayList<>(diagnostic);
        copy.solutionLog = new ArrayList<>(solution);
        copy.thoughts = new ArrayList<>(thoughts);
        copy.actions = new ArrayList<>(actions);
        copy.steps = new ArrayList<>(steps);
        return copy;
    }

    /** Appends the thought, the action and their step, each unless already present. */
    public ConversationSnapshot withProgress(String thought, String action, Instant at) {
        ConversationSnapshot copy = copy();
        fold(copy.thoughts, copy.actions, copy.steps, thought, action, at);
        return copy;
    }

    /** Sticky: a null or blank root cause never replaces a known one. */
    public ConversationSnapshot withRootCause(String rootCause) {
        if (rootCause == null || rootCause.isBlank()) return this;
        ConversationSnapshot copy = copy();
        copy.rootCause = rootCause;
        return copy;
    }

    public ConversationSnapshot withSolutionState(SolutionState solutionState) {
        ConversationSnapshot copy = copy();
        copy.solutionState = solutionState;
        return copy;
    }

    public ConversationSnapshot withPendingDecision(PendingDecision pendingDecision) {
        ConversationSnapshot copy = copy();
        copy.pendingDecision = pendingDecision;
        return copy;
    }

    public ConversationSnapshot withDecisionInFlight(boolean decisionInFlight) {
        ConversationSnapshot copy = copy();
        copy.decisionInFlight = decisionInFlight;
        return copy;
    }

    public ConversationSnapshot withLoading(boolean loading) {
        ConversationSnapshot copy = copy();
        copy.loading = loading;
        return copy;
    }

    public ConversationSnapshot withDiagThreadId(String diagThreadId) {
        if (diagThreadId == null || Objects.equals(diagThreadId, this.diagThreadId)) return this;
        ConversationSnapshot copy = copy();
        copy.diagThreadId = diagThreadId;
        return copy;
    }

    /** The solution thread id is assigned at most once. */
    public ConversationSnapshot withSolThreadId(String solThreadId) {
        if (solThreadId == null || this.solThreadId != null) return this;
        ConversationSnapshot copy = copy();
        copy.solThreadId = solThreadId;
        return copy;
    }

    public ConversationSnapshot withLastError(String lastError) {
        ConversationSnapshot copy = copy();
        copy.lastError = lastError;
        return copy;
    }

    static void fold(List<String> thoughts, List<String> actions, List<Step> steps,
                     String thought, String action, Instant at) {
        String t = blankToNull(thought);
        String a = blankToNull(action);
        if (t == null && a == null) return;
        if (t != null && !thoughts.contains(t)) thoughts.add(t);
        if (a != null && !actions.contains(a)) actions.add(a);
        Step step = new Step(t, a, at);
        if (steps.stream().noneMatch(step::sameContent)) steps.add(step);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }

    private ConversationSnapshot copy() {
        ConversationSnapshot s = new ConversationSnapshot();
        s.state = this.state;
        s.diagnosticLog = new ArrayList<>(this.diagnosticLog);
        s.solutionLog = new ArrayList<>(this.solutionLog);
        s.thoughts = new ArrayList<>(this.thoughts);
        s.actions = new ArrayList<>(this.actions);
        s.steps = new ArrayList<>(this.steps);
        s.rootCause = this.rootCause;
        s.solutionState = this.solutionState;
        s.pendingDecision = this.pendingDecision;
        s.decisionInFlight = this.decisionInFlight;
        s.loading = this.loading;
        s.diagThreadId = this.diagThreadId;
        s.solThreadId = this.solThreadId;
        s.lastError = this.lastError;
        return s;
    }

    // Getters
    public AgentStateSnapshot getState() { return state; }
    public List<MessageItem> getDiagnosticLog() { return Collections.unmodifiableList(diagnosticLog); }
    public List<MessageItem> getSolutionLog() { return Collections.unmodifiableList(solutionLog); }
    public List<String> getThoughts() { return Collections.unmodifiableList(thoughts); }
    public List<String> getActions() { return Collections.unmodifiableList(actions); }
    public List<Step> getSteps() { return Collections.unmodifiableList(steps); }
    public String getRootCause() { return rootCause; }
    public SolutionState getSolutionState() { return solutionState; }
    public PendingDecision getPendingDecision() { return pendingDecision; }
    public boolean isDecisionInFlight() { return decisionInFlight; }
    public boolean isLoading() { return loading; }
    public String getDiagThreadId() { return diagThreadId; }
    public String getSolThreadId() { return solThreadId; }
    public String getLastError() { return lastError; }

    /** True once anything was streamed, replayed or requested for this issue. */
    public boolean hasConversation() {
        return loading || state != null || !diagnosticLog.isEmpty() || !steps.isEmpty()
                || pendingDecision != null || solutionState != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConversationSnapshot that)) return false;
        return decisionInFlight == that.decisionInFlight
                && loading == that.loading
                && Objects.equals(state, that.state)
                && diagnosticLog.equals(that.diagnosticLog)
                && solutionLog.equals(that.solutionLog)
                && thoughts.equals(that.thoughts)
                && actions.equals(that.actions)
                && steps.equals(that.steps)
                && Objects.equals(rootCause, that.rootCause)
                && Objects.equals(solutionState, that.solutionState)
                && Objects.equals(pendingDecision, that.pendingDecision)
                && Objects.equals(diagThreadId, that.diagThreadId)
                && Objects.equals(solThreadId, that.solThreadId)
                && Objects.equals(lastError, that.lastError);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, diagnosticLog, solutionLog, thoughts, actions, steps, rootCause,
                solutionState, pendingDecision, decisionInFlight, loading, diagThreadId, solThreadId, lastError);
    }

    @Override
    public String toString() {
        return "ConversationSnapshot{diagThreadId=" + diagThreadId + ", steps=" + steps.size()
                + ", rootCause=" + rootCause + ", pending=" + pendingDecision
                + ", inFlight=" + decisionInFlight + ", loading=" + loading + "}";
    }
}

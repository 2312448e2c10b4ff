package io.github.drompincen.sreflow.runtime.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.sreflow.protocol.model.AgentStateSnapshot;
import io.github.drompincen.sreflow.protocol.model.DecisionKind;
import io.github.drompincen.sreflow.protocol.model.Issue;
import io.github.drompincen.sreflow.protocol.model.MessageItem;
import io.github.drompincen.sreflow.protocol.model.NextAction;
import io.github.drompincen.sreflow.protocol.model.PendingDecision;
import io.github.drompincen.sreflow.protocol.ws.ClientFrame;
import io.github.drompincen.sreflow.protocol.ws.FrameCodec;
import io.github.drompincen.sreflow.protocol.ws.InterventionDecision;
import io.github.drompincen.sreflow.protocol.ws.ResumeDecision;
import io.github.drompincen.sreflow.protocol.ws.ServerFrame;
import io.github.drompincen.sreflow.runtime.agent.AgentException;
import io.github.drompincen.sreflow.runtime.agent.DiagnosticAgent;
import io.github.drompincen.sreflow.runtime.agent.DiagnosticRequest;
import io.github.drompincen.sreflow.runtime.agent.SolutionAgent;
import io.github.drompincen.sreflow.runtime.agent.SolutionRequest;
import io.github.drompincen.sreflow.runtime.agent.SolutionResult;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Drives one diagnostic workflow per issue:
 * {@code IDLE -> RUNNING -> AWAITING_DECISION -> (RUNNING | HANDOFF_PENDING) -> COMPLETED},
 * with {@code FAILED} reachable from any non-terminal state.
 *
 * <p>Every state change and every frame emission happens under the workflow thread's
 * monitor, so all subscribers see frames in the same order. Agent calls run outside
 * the monitor on the loop executor, one loop per thread at a time.
 */
@Service
public class SessionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(SessionCoordinator.class);

    static final String DENIED_WITHOUT_HINT = "The operator denied the previous request.";

    private final WorkflowThreadRegistry registry;
    private final DiagnosticAgent diagnosticAgent;
    private final SolutionAgent solutionAgent;
    private final Executor loopExecutor;
    private final ExecutorService stepExecutor;
    private final Duration stepTimeout;
    private final int maxSteps;
    private final FrameCodec codec;

    @Autowired
    public SessionCoordinator(WorkflowThreadRegistry registry,
                              DiagnosticAgent diagnosticAgent,
                              SolutionAgent solutionAgent,
                              FrameCodec codec,
                              @Value("${sreflow.session.step-timeout:PT2M}") Duration stepTimeout,
                              @Value("${sreflow.session.max-steps:25}") int maxSteps) {
        this(registry, diagnosticAgent, solutionAgent, codec, daemonPool("workflow-loop"), stepTimeout, maxSteps);
    }

    /**
     * @param stepTimeout bound for a single agent call; {@code null} or zero runs the
     *                    call on the loop thread without a timeout
     * @param maxSteps    consecutive {@code continue} steps before the loop asks the
     *                    operator to approve further work; zero disables the guard
     */
    public SessionCoordinator(WorkflowThreadRegistry registry,
                              DiagnosticAgent diagnosticAgent,
                              SolutionAgent solutionAgent,
                              FrameCodec codec,
                              Executor loopExecutor,
                              Duration stepTimeout,
                              int maxSteps) {
        this.registry = registry;
        this.diagnosticAgent = diagnosticAgent;
        this.solutionAgent = solutionAgent;
        this.codec = codec;
        this.loopExecutor = loopExecutor;
        boolean bounded = stepTimeout != null && !stepTimeout.isZero() && !stepTimeout.isNegative();
        this.stepTimeout = bounded ? stepTimeout : null;
        this.stepExecutor = bounded ? daemonPool("agent-step") : null;
        this.maxSteps = maxSteps;
    }

    // ---- client frames ----

    /**
     * Starts the workflow for {@code issue}, or attaches {@code sink} to the existing
     * one and replays its history. Never runs a second loop for the same issue.
     * The diagnostic thread is opened on the loop executor, bounded by the step timeout.
     */
    public void start(Issue issue, FrameSink sink) {
        WorkflowThread thread = registry.getOrCreate(issue);
        synchronized (thread) {
            if (thread.getState() != CoordinatorState.IDLE) {
                replay(thread, sink);
                return;
            }
            thread.getSinks().add(sink);
            if (thread.isAgentCallInProgress()) {
                log.debug("Diagnostic thread for {} is already opening; attached {}", issue.key(), sink.id());
                return;
            }
            thread.setAgentCallInProgress(true);
        }
        submit(thread, () -> openAndRun(thread, issue));
    }

    /**
     * Applies an operator decision. Returns {@code false} without touching state when
     * there is no matching pending decision or one is already being processed.
     */
    public boolean intervene(String issueKey, ClientFrame.Intervene frame) {
        WorkflowThread thread = registry.find(issueKey).orElse(null);
        if (thread == null) {
            log.warn("Ignoring intervene({}) for unknown issue {}", frame.decision().wireName(), issueKey);
            return false;
        }
        boolean handoff;
        synchronized (thread) {
            PendingDecision pending = thread.getPendingDecision();
            if (thread.getState() != CoordinatorState.AWAITING_DECISION || pending == null
                    || thread.isDecisionInFlight() || pending.kind() == DecisionKind.RESUME_AVAILABLE) {
                log.warn("Ignoring intervene({}) for {}: no matching pending decision (state {})",
                        frame.decision().wireName(), issueKey, thread.getState());
                return false;
            }
            thread.setDecisionInFlight(true);
            handoff = frame.decision() == InterventionDecision.HANDOFF
                    || (frame.decision() == InterventionDecision.APPROVE
                        && pending.kind() == DecisionKind.HANDOFF_APPROVAL);
            if (handoff) {
                thread.setState(CoordinatorState.HANDOFF_PENDING);
            } else {
                if (frame.decision() == InterventionDecision.DENY) {
                    thread.setPendingHint(frame.hasHint() ? frame.hint().trim() : DENIED_WITHOUT_HINT);
                }
                thread.resetStepsSinceGate();
                thread.setState(CoordinatorState.RUNNING);
            }
            log.info("Operator chose {} on {} ({})", frame.decision().wireName(), issueKey, pending.kind().wireName());
        }
        if (handoff) {
            submit(thread, () -> runHandoff(thread));
        } else {
            submit(thread, () -> runLoop(thread));
        }
        return true;
    }

    /** Answers a {@code resume_available} offer; ignored for any other pending decision. */
    public boolean resume(String issueKey, ClientFrame.Resume frame) {
        WorkflowThread thread = registry.find(issueKey).orElse(null);
        if (thread == null) {
            log.warn("Ignoring resume({}) for unknown issue {}", frame.decision().wireName(), issueKey);
            return false;
        }
        synchronized (thread) {
            PendingDecision pending = thread.getPendingDecision();
            if (thread.getState() != CoordinatorState.AWAITING_DECISION || pending == null
                    || pending.kind() != DecisionKind.RESUME_AVAILABLE || thread.isDecisionInFlight()) {
                log.warn("Ignoring resume({}) for {}: no resume offer outstanding (state {})",
                        frame.decision().wireName(), issueKey, thread.getState());
                return false;
            }
            if (frame.decision() == ResumeDecision.NO) {
                thread.clearDecision();
                log.info("Operator declined to resume {}", issueKey);
                return true;
            }
            thread.setDecisionInFlight(true);
            thread.resetStepsSinceGate();
            thread.setState(CoordinatorState.RUNNING);
            log.info("Resuming diagnostic thread {} for {}", thread.getDiagThreadId(), issueKey);
        }
        submit(thread, () -> runLoop(thread));
        return true;
    }

    /** Stops delivering frames to {@code sink}; running agent work is not cancelled. */
    public void detach(FrameSink sink) {
        for (WorkflowThread thread : registry.all()) {
            thread.getSinks().remove(sink);
        }
    }

    // ---- issue feed signals ----

    /**
     * Offers {@code resume_available} for a stalled thread whose issue reported new
     * signal. A thread is stalled when it failed or when it waits with no decision open.
     */
    public boolean offerResume(Issue updated) {
        WorkflowThread thread = registry.find(updated.key()).orElse(null);
        if (thread == null) return false;
        synchronized (thread) {
            thread.setIssue(updated);
            boolean stalled = thread.getState() == CoordinatorState.FAILED
                    || (thread.getState() == CoordinatorState.AWAITING_DECISION && thread.getPendingDecision() == null);
            if (!stalled) return false;
            openDecision(thread, DecisionKind.RESUME_AVAILABLE,
                    "New signal for %s: %s. Resume the diagnosis?".formatted(updated.resourceName(), updated.message()));
            log.info("Offered resume for {} after upstream change", updated.key());
            return true;
        }
    }

    /**
     * Forgets threads whose issue is no longer reported. A thread with an agent call in
     * flight is kept and retried on the next call.
     */
    public List<String> prune(Set<String> liveIssueKeys) {
        List<String> pruned = new ArrayList<>();
        for (WorkflowThread thread : registry.all()) {
            if (liveIssueKeys.contains(thread.getIssueKey())) continue;
            synchronized (thread) {
                if (thread.isAgentCallInProgress()) {
                    log.debug("Deferring prune of {}: agent call in progress", thread.getIssueKey());
                    continue;
                }
                thread.getSinks().clear();
                // a loop queued but not yet started must find the thread retired
                thread.setState(CoordinatorState.FAILED);
                registry.remove(thread);
                pruned.add(thread.getIssueKey());
            }
        }
        if (!pruned.isEmpty()) {
            log.info("Pruned {} workflow thread(s) for resolved issues: {}", pruned.size(), pruned);
        }
        return pruned;
    }

    // ---- queries ----

    public Collection<ThreadView> views() {
        List<ThreadView> views = new ArrayList<>();
        for (WorkflowThread thread : registry.all()) {
            synchronized (thread) {
                views.add(thread.view());
            }
        }
        return views;
    }

    public Optional<ThreadView> view(String issueKey) {
        return registry.find(issueKey).map(thread -> {
            synchronized (thread) {
                return thread.view();
            }
        });
    }

    public Optional<ServerFrame.History> history(String issueKey) {
        return registry.find(issueKey).map(thread -> {
            synchronized (thread) {
                return thread.history();
            }
        });
    }

    // ---- step loop ----

    private void runLoop(WorkflowThread thread) {
        while (true) {
            DiagnosticRequest request;
            synchronized (thread) {
                if (thread.getState() != CoordinatorState.RUNNING || thread.isAgentCallInProgress()) return;
                if (maxSteps > 0 && thread.getStepsSinceGate() >= maxSteps) {
                    gateStepLimit(thread);
                    return;
                }
                request = new DiagnosticRequest(thread.getDiagThreadId(), thread.getIssue(),
                        thread.nextStepNo(), thread.takeHint(), thread.diagHistorySnapshot());
                thread.setAgentCallInProgress(true);
            }

            AgentStateSnapshot snapshot;
            try {
                snapshot = callAgent(() -> diagnosticAgent.step(request), "Diagnostic step");
                if (snapshot == null) {
                    throw new AgentException("Diagnostic agent returned no state");
                }
            } catch (AgentException e) {
                synchronized (thread) {
                    thread.setAgentCallInProgress(false);
                    fail(thread, e.getMessage());
                }
                return;
            }

            synchronized (thread) {
                thread.setAgentCallInProgress(false);
                if (thread.getState() != CoordinatorState.RUNNING) return;
                thread.recordStep(snapshot, MessageItem.assistant(codec.write(snapshot), Instant.now()));
                thread.clearDecision();
                broadcast(thread, new ServerFrame.Diagnostic(snapshot, thread.getDiagThreadId()));
                log.debug("Step {} of {}: next_action={}", request.stepNo(), thread.getDiagThreadId(),
                        snapshot.nextAction());
                if (snapshot.nextAction() == NextAction.AWAIT_USER_APPROVAL) {
                    openDecision(thread, DecisionKind.AWAITING_APPROVAL, approvalQuestion(snapshot));
                    return;
                }
                if (snapshot.nextAction() == NextAction.HANDOFF_TO_SOLUTION_AGENT) {
                    openDecision(thread, DecisionKind.HANDOFF_APPROVAL, handoffQuestion(thread.getRootCause()));
                    return;
                }
            }
        }
    }

    private void openAndRun(WorkflowThread thread, Issue issue) {
        String diagThreadId;
        try {
            diagThreadId = callAgent(() -> diagnosticAgent.openThread(issue), "Diagnostic agent");
            if (diagThreadId == null || diagThreadId.isBlank()) {
                throw new AgentException("Diagnostic agent returned no thread id");
            }
        } catch (AgentException e) {
            synchronized (thread) {
                thread.setAgentCallInProgress(false);
                log.warn("Could not open diagnostic thread for {}: {}", issue.key(), e.getMessage());
                broadcast(thread, new ServerFrame.Error("Failed to open diagnostic thread: " + e.getMessage()));
                // stays IDLE; the next start retries with a fresh subscriber set
                thread.getSinks().clear();
            }
            return;
        }
        synchronized (thread) {
            thread.setAgentCallInProgress(false);
            if (thread.getState() != CoordinatorState.IDLE) return;
            thread.assignDiagThread(diagThreadId);
            thread.setState(CoordinatorState.RUNNING);
            log.info("Started diagnostic thread {} for {}", diagThreadId, issue.key());
        }
        runLoop(thread);
    }

    private void runHandoff(WorkflowThread thread) {
        SolutionRequest request;
        synchronized (thread) {
            if (thread.getState() != CoordinatorState.HANDOFF_PENDING || thread.isAgentCallInProgress()) return;
            request = new SolutionRequest(thread.getIssue(), thread.getDiagThreadId(),
                    thread.getRootCause(), thread.diagHistorySnapshot());
            thread.setAgentCallInProgress(true);
        }

        SolutionResult result;
        try {
            result = callAgent(() -> solutionAgent.solve(request), "Solution agent");
            if (result == null || result.solThreadId() == null) {
                throw new AgentException("Solution agent returned no thread id");
            }
        } catch (AgentException e) {
            synchronized (thread) {
                thread.setAgentCallInProgress(false);
                fail(thread, e.getMessage());
            }
            return;
        }

        synchronized (thread) {
            thread.setAgentCallInProgress(false);
            if (thread.getState() != CoordinatorState.HANDOFF_PENDING) return;
            thread.assignSolThread(result.solThreadId());
            thread.recordSolution(MessageItem.assistant(result.text(), Instant.now()));
            thread.clearDecision();
            broadcast(thread, new ServerFrame.Handoff(result.solThreadId(), solutionState(result.text())));
            thread.setState(CoordinatorState.COMPLETED);
            broadcast(thread, new ServerFrame.Complete(thread.getDiagThreadId(), thread.getSolThreadId()));
            log.info("Handed off {} to solution thread {}", thread.getIssueKey(), result.solThreadId());
        }
    }

    private <T> T callAgent(Supplier<T> call, String what) {
        if (stepExecutor == null) {
            try {
                return call.get();
            } catch (AgentException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new AgentException(what + " failed: " + e.getMessage(), e);
            }
        }
        Callable<T> task = call::get;
        Future<T> future = stepExecutor.submit(task);
        try {
            return future.get(stepTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new AgentException("Agent step timed out after " + stepTimeout, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AgentException agentException) throw agentException;
            throw new AgentException(what + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new AgentException(what + " interrupted", e);
        }
    }

    // ---- helpers, callers hold the thread monitor ----

    private void replay(WorkflowThread thread, FrameSink sink) {
        thread.getSinks().add(sink);
        send(thread, sink, thread.history());
        PendingDecision pending = thread.getPendingDecision();
        if (pending != null && !thread.isDecisionInFlight()) {
            send(thread, sink, new ServerFrame.AwaitingApproval(pending.question(), pending.kind()));
        } else if (thread.getState() == CoordinatorState.COMPLETED) {
            send(thread, sink, new ServerFrame.Complete(thread.getDiagThreadId(), thread.getSolThreadId()));
        }
        log.info("Replayed history of {} to {} (state {})", thread.getIssueKey(), sink.id(), thread.getState());
    }

    /** The gate follows a diagnostic asking for approval, as any agent-requested gate does. */
    private void gateStepLimit(WorkflowThread thread) {
        AgentStateSnapshot limit = new AgentStateSnapshot(
                "Reached the limit of %d steps without a decision.".formatted(maxSteps),
                null, null, NextAction.AWAIT_USER_APPROVAL, null);
        thread.recordStep(limit, MessageItem.assistant(codec.write(limit), Instant.now()));
        broadcast(thread, new ServerFrame.Diagnostic(limit, thread.getDiagThreadId()));
        log.info("Workflow for {} reached {} steps; asking the operator to continue", thread.getIssueKey(), maxSteps);
        openDecision(thread, DecisionKind.AWAITING_APPROVAL,
                "The agent ran %d steps without reaching a decision. Continue the investigation?".formatted(maxSteps));
    }

    private void openDecision(WorkflowThread thread, DecisionKind kind, String question) {
        thread.openDecision(new PendingDecision(question, kind));
        broadcast(thread, new ServerFrame.AwaitingApproval(question, kind));
    }

    private void fail(WorkflowThread thread, String message) {
        log.warn("Workflow for {} failed in state {}: {}", thread.getIssueKey(), thread.getState(), message);
        thread.clearDecision();
        thread.setState(CoordinatorState.FAILED);
        broadcast(thread, new ServerFrame.Error(message != null ? message : "Unknown agent error"));
    }

    private void broadcast(WorkflowThread thread, ServerFrame frame) {
        for (FrameSink sink : thread.getSinks()) {
            send(thread, sink, frame);
        }
    }

    private void send(WorkflowThread thread, FrameSink sink, ServerFrame frame) {
        if (!sink.isOpen()) {
            thread.getSinks().remove(sink);
            return;
        }
        try {
            sink.send(frame);
        } catch (IOException | RuntimeException e) {
            log.warn("Detaching {} from {} after send failure: {}", sink.id(), thread.getIssueKey(), e.getMessage());
            thread.getSinks().remove(sink);
        }
    }

    private void submit(WorkflowThread thread, Runnable task) {
        try {
            loopExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            synchronized (thread) {
                thread.setAgentCallInProgress(false);
                fail(thread, "Workflow executor rejected the task");
            }
        }
    }

    private JsonNode solutionState(String text) {
        JsonNode parsed = codec.readObject(text);
        if (parsed != null) return parsed;
        return text != null && !text.isBlank() ? TextNode.valueOf(text) : null;
    }

    static String approvalQuestion(AgentStateSnapshot snapshot) {
        if (snapshot.action() == null) {
            return "Approve the next diagnostic step?";
        }
        return snapshot.actionInput() != null
                ? "Approve action '%s' with input %s?".formatted(snapshot.action(), snapshot.actionInput())
                : "Approve action '%s'?".formatted(snapshot.action());
    }

    static String handoffQuestion(String rootCause) {
        return rootCause != null
                ? "Root cause identified: %s Hand off to the solution agent?".formatted(withPeriod(rootCause))
                : "Hand off to the solution agent?";
    }

    private static String withPeriod(String text) {
        String trimmed = text.trim();
        return trimmed.endsWith(".") ? trimmed : trimmed + ".";
    }

    private static ExecutorService daemonPool(String name) {
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        if (stepExecutor != null) stepExecutor.shutdownNow();
        if (loopExecutor instanceof ExecutorService service) service.shutdownNow();
    }
}

package io.github.drompincen.sreflow.client.status;

import io.github.drompincen.sreflow.client.conversation.ConversationSnapshot;
import io.github.drompincen.sreflow.client.conversation.SolutionState;
import io.github.drompincen.sreflow.protocol.model.DecisionKind;
import io.github.drompincen.sreflow.protocol.model.NextAction;
import io.github.drompincen.sreflow.protocol.model.PendingDecision;

/**
 * Badge shown next to an issue. The rules overlap, so they are evaluated in order and
 * the first match wins:
 * <ol>
 *   <li>no session and no conversation: {@link DisplayStatus#NOT_STARTED}</li>
 *   <li>handoff decision in flight: {@link DisplayStatus#HANDING_OFF}</li>
 *   <li>resume decision in flight: {@link DisplayStatus#RESUMING}</li>
 *   <li>solution thread or solution present: {@link DisplayStatus#HANDOFF}</li>
 *   <li>agent waits for tool approval: {@link DisplayStatus#AWAIT_USER_APPROVAL}</li>
 *   <li>agent asks for the handoff: {@link DisplayStatus#AWAIT_HANDOFF_APPROVAL}</li>
 *   <li>otherwise {@link DisplayStatus#IN_PROGRESS}</li>
 * </ol>
 */
public final class StatusDerivation {

    private StatusDerivation() {}

    public static DisplayStatus derive(boolean hasSession,
                                       boolean hasConversation,
                                       boolean decisionInFlight,
                                       DecisionKind pendingKind,
                                       String solThreadId,
                                       SolutionState solutionState,
                                       NextAction nextAction) {
        if (!hasSession && !hasConversation) return DisplayStatus.NOT_STARTED;
        if (decisionInFlight && pendingKind == DecisionKind.HANDOFF_APPROVAL) return DisplayStatus.HANDING_OFF;
        if (decisionInFlight && pendingKind == DecisionKind.RESUME_AVAILABLE) return DisplayStatus.RESUMING;
        if (solThreadId != null || solutionState != null) return DisplayStatus.HANDOFF;
        if (nextAction == NextAction.AWAIT_USER_APPROVAL) return DisplayStatus.AWAIT_USER_APPROVAL;
        if (nextAction == NextAction.HANDOFF_TO_SOLUTION_AGENT) return DisplayStatus.AWAIT_HANDOFF_APPROVAL;
        return DisplayStatus.IN_PROGRESS;
    }

    /**
     * Derives the status of a tracked conversation. A session counts as started once the
     * server assigned its diagnostic thread; {@code null} means the issue is untracked.
     */
    public static DisplayStatus derive(ConversationSnapshot snapshot) {
        if (snapshot == null) return DisplayStatus.NOT_STARTED;
        PendingDecision pending = snapshot.getPendingDecision();
        return derive(
                snapshot.getDiagThreadId() != null,
                snapshot.hasConversation(),
                snapshot.isDecisionInFlight(),
                pending != null ? pending.kind() : null,
                snapshot.getSolThreadId(),
                snapshot.getSolutionState(),
                snapshot.getState() != null ? snapshot.getState().nextAction() : null);
    }
}

package io.github.drompincen.sreflow.client.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

import static io.github.drompincen.sreflow.client.session.ClientSessionEvent.*;
import static io.github.drompincen.sreflow.client.session.ClientSessionState.*;

/**
 * Lifecycle of one client session as an explicit transition table. Events without a
 * transition from the current state are ignored and leave the state unchanged.
 */
public class ClientSessionMachine {

    private static final Logger log = LoggerFactory.getLogger(ClientSessionMachine.class);

    private static final Map<ClientSessionState, Map<ClientSessionEvent, ClientSessionState>> TRANSITIONS =
            new EnumMap<>(ClientSessionState.class);

    static {
        on(DISCONNECTED, CONNECT, CONNECTING);

        on(CONNECTING, CHANNEL_OPENED, STARTING);
        on(CONNECTING, TRANSPORT_ERROR, FAILED);
        on(CONNECTING, CHANNEL_CLOSED, DISCONNECTED);

        for (ClientSessionState live : new ClientSessionState[]{STARTING, STREAMING, AWAITING_DECISION, ClientSessionState.DECISION_SENT}) {
            on(live, DIAGNOSTIC, STREAMING);
            on(live, HISTORY, STREAMING);
            on(live, HANDOFF, STREAMING);
            on(live, DECISION_REQUESTED, AWAITING_DECISION);
            on(live, COMPLETE, COMPLETED);
            on(live, ERROR, FAILED);
            on(live, TRANSPORT_ERROR, FAILED);
            on(live, CHANNEL_CLOSED, DISCONNECTED);
        }
        on(AWAITING_DECISION, ClientSessionEvent.DECISION_SENT, ClientSessionState.DECISION_SENT);

        on(COMPLETED, HISTORY, COMPLETED);
        on(COMPLETED, COMPLETE, COMPLETED);
        on(COMPLETED, CHANNEL_CLOSED, COMPLETED);
        on(COMPLETED, TRANSPORT_ERROR, COMPLETED);

        // a failed run may be offered a resume on the same channel
        on(FAILED, DECISION_REQUESTED, AWAITING_DECISION);
        on(FAILED, HISTORY, FAILED);
        on(FAILED, ERROR, FAILED);
        on(FAILED, CHANNEL_CLOSED, FAILED);
        on(FAILED, TRANSPORT_ERROR, FAILED);

        for (ClientSessionState state : ClientSessionState.values()) {
            if (state == CLOSED) continue;
            on(state, CONNECT, CONNECTING);
            on(state, CLOSE, CLOSED);
        }
    }

    private static void on(ClientSessionState from, ClientSessionEvent event, ClientSessionState to) {
        TRANSITIONS.computeIfAbsent(from, k -> new EnumMap<>(ClientSessionEvent.class)).put(event, to);
    }

    private final String name;
    private ClientSessionState state = DISCONNECTED;

    public ClientSessionMachine(String name) {
        this.name = name;
    }

    /** Applies {@code event}; returns {@code false} when the current state has no transition for it. */
    public boolean dispatch(ClientSessionEvent event) {
        ClientSessionState next = TRANSITIONS.getOrDefault(state, Map.of()).get(event);
        if (next == null) {
            log.debug("[{}] ignoring {} in state {}", name, event, state);
            return false;
        }
        if (next != state) {
            log.debug("[{}] {} --{}--> {}", name, state, event, next);
        }
        state = next;
        return true;
    }

    public ClientSessionState state() {
        return state;
    }

    static boolean allows(ClientSessionState from, ClientSessionEvent event) {
        return TRANSITIONS.getOrDefault(from, Map.of()).containsKey(event);
    }
}

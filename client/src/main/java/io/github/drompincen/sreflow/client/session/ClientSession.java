package io.github.drompincen.sreflow.client.session;

import io.github.drompincen.sreflow.client.conversation.ConversationMerger;
import io.github.drompincen.sreflow.client.conversation.ConversationSnapshot;
import io.github.drompincen.sreflow.protocol.model.DecisionKind;
import io.github.drompincen.sreflow.protocol.model.Issue;
import io.github.drompincen.sreflow.protocol.model.PendingDecision;
import io.github.drompincen.sreflow.protocol.ws.ClientFrame;
import io.github.drompincen.sreflow.protocol.ws.FrameCodec;
import io.github.drompincen.sreflow.protocol.ws.InterventionDecision;
import io.github.drompincen.sreflow.protocol.ws.ResumeDecision;
import io.github.drompincen.sreflow.protocol.ws.ServerFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Client side of one issue's workflow: owns at most one live channel, feeds every
 * decoded frame through the {@link ConversationMerger} and the {@link ClientSessionMachine}.
 *
 * <p>Every state change happens under the session monitor, so frames of a channel are
 * handled one at a time and in order. Callbacks from a channel that was replaced or closed are ignored.
 * Listeners are called in update order after the monitor is released, so they may
 * call back into this session or its {@link SessionRegistry}.
 */
public class ClientSession {

    private static final Logger log = LoggerFactory.getLogger(ClientSession.class);

    static final String TRANSPORT_ERROR_MESSAGE = "WebSocket connection error";

    private final Issue issue;
    private final String issueKey;
    private final ChannelConnector connector;
    private final FrameCodec codec;
    private final ConversationMerger merger;
    private final ClientSessionMachine machine;
    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();
    private final Queue<Update> updates = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean delivering = new AtomicBoolean();

    private WorkflowChannel channel;
    private long generation;
    private ConversationSnapshot snapshot = ConversationSnapshot.empty();

    public ClientSession(Issue issue, ChannelConnector connector, FrameCodec codec, ConversationMerger merger) {
        this.issue = issue;
        this.issueKey = issue.key();
        this.connector = connector;
        this.codec = codec;
        this.merger = merger;
        this.machine = new ClientSessionMachine(issueKey);
    }

    public void addListener(SessionListener listener) {
        listeners.add(listener);
    }

    /**
     * Opens a fresh channel and sends {@code start} once it is open. An existing channel
     * is closed first, so there is never more than one per issue.
     */
    public void connect() {
        if (!tryConnect()) {
            throw new IllegalStateException("Session for " + issueKey + " is closed");
        }
    }

    /** Like {@link #connect()}, but answers {@code false} for a closed session. */
    boolean tryConnect() {
        synchronized (this) {
            if (machine.state() == ClientSessionState.CLOSED) return false;
            closeChannel();
            machine.dispatch(ClientSessionEvent.CONNECT);
            snapshot = merger.markConnecting(snapshot);
            long gen = ++generation;
            try {
                WorkflowChannel opened = connector.connect(new Callbacks(gen));
                if (gen == generation && machine.state() != ClientSessionState.CLOSED) {
                    channel = opened;
                } else {
                    opened.close();
                }
            } catch (RuntimeException e) {
                log.warn("[{}] could not open workflow channel: {}", issueKey, e.getMessage());
                transportFailed(gen);
            }
            stageUpdate();
        }
        publishUpdates();
        return true;
    }

    /**
     * Sends an {@code intervene} frame for the outstanding approval or handoff question.
     * Nothing is sent unless a decision is pending, none is in flight and the channel is open.
     */
    public DecisionDelivery intervene(InterventionDecision decision, String hint) {
        DecisionDelivery delivery;
        synchronized (this) {
            delivery = checkDeliverable(false);
            if (delivery == null) {
                delivery = deliver(new ClientFrame.Intervene(decision, hint));
            }
        }
        publishUpdates();
        return delivery;
    }

    /** Answers a {@code resume_available} offer. */
    public DecisionDelivery resume(ResumeDecision decision) {
        DecisionDelivery delivery;
        synchronized (this) {
            delivery = checkDeliverable(true);
            if (delivery == null) {
                delivery = deliver(new ClientFrame.Resume(decision));
                if (delivery == DecisionDelivery.SENT && decision == ResumeDecision.NO) {
                    snapshot = merger.withdrawDecision(snapshot);
                    stageUpdate();
                }
            }
        }
        publishUpdates();
        return delivery;
    }

    /** Closes the channel and retires the session. Safe to call more than once. */
    public void close() {
        synchronized (this) {
            if (machine.state() == ClientSessionState.CLOSED) return;
            closeChannel();
            generation++;
            machine.dispatch(ClientSessionEvent.CLOSE);
            snapshot = merger.markIdle(snapshot);
            log.debug("[{}] session closed", issueKey);
            stageUpdate();
        }
        publishUpdates();
    }

    public synchronized ConversationSnapshot snapshot() {
        return snapshot;
    }

    public synchronized ClientSessionState state() {
        return machine.state();
    }

    public synchronized boolean isChannelOpen() {
        return channel != null && channel.isOpen();
    }

    public Issue issue() {
        return issue;
    }

    public String issueKey() {
        return issueKey;
    }

    // ---- internals, caller holds the monitor ----

    private DecisionDelivery checkDeliverable(boolean resume) {
        if (channel == null || !channel.isOpen()) return DecisionDelivery.CHANNEL_CLOSED;
        PendingDecision pending = snapshot.getPendingDecision();
        boolean resumeOffer = pending != null && pending.kind() == DecisionKind.RESUME_AVAILABLE;
        if (pending == null || resume != resumeOffer) return DecisionDelivery.NO_PENDING_DECISION;
        if (snapshot.isDecisionInFlight()) return DecisionDelivery.DECISION_IN_FLIGHT;
        return null;
    }

    private DecisionDelivery deliver(ClientFrame frame) {
        try {
            channel.send(codec.encode(frame));
        } catch (IOException e) {
            log.warn("[{}] failed to send {}: {}", issueKey, frame.type().wireName(), e.getMessage());
            transportFailed(generation);
            stageUpdate();
            return DecisionDelivery.CHANNEL_CLOSED;
        }
        snapshot = merger.markDecisionSent(snapshot);
        machine.dispatch(ClientSessionEvent.DECISION_SENT);
        log.debug("[{}] sent {}", issueKey, frame);
        stageUpdate();
        return DecisionDelivery.SENT;
    }

    private void closeChannel() {
        if (channel != null) {
            WorkflowChannel old = channel;
            channel = null;
            generation++;
            old.close();
        }
    }

    private void transportFailed(long gen) {
        if (gen != generation) return;
        snapshot = merger.applyTransportError(snapshot, TRANSPORT_ERROR_MESSAGE);
        machine.dispatch(ClientSessionEvent.TRANSPORT_ERROR);
        closeChannel();
        // a channel still being handed back by the connector must not be adopted
        generation++;
    }

    private void stageUpdate() {
        updates.add(new Update(machine.state(), snapshot));
    }

    // ---- listener delivery, never under the monitor ----

    /**
     * Delivers staged updates on one thread at a time. A thread that finds delivery
     * already running leaves its update to that thread; the outer loop rechecks the
     * queue after releasing the flag so no update is stranded.
     */
    private void publishUpdates() {
        while (!updates.isEmpty()) {
            if (!delivering.compareAndSet(false, true)) return;
            try {
                Update update;
                while ((update = updates.poll()) != null) {
                    fire(update);
                }
            } finally {
                delivering.set(false);
            }
        }
    }

    private void fire(Update update) {
        for (SessionListener listener : listeners) {
            try {
                listener.onUpdate(issueKey, update.state(), update.snapshot());
            } catch (RuntimeException e) {
                log.warn("[{}] session listener failed: {}", issueKey, e.getMessage());
            }
        }
    }

    private record Update(ClientSessionState state, ConversationSnapshot snapshot) {}

    private final class Callbacks implements ChannelListener {

        private final long gen;

        Callbacks(long gen) {
            this.gen = gen;
        }

        @Override
        public void onOpen(WorkflowChannel opened) {
            synchronized (ClientSession.this) {
                if (gen != generation) return;
                machine.dispatch(ClientSessionEvent.CHANNEL_OPENED);
                try {
                    opened.send(codec.encode(new ClientFrame.Start(issue)));
                    log.debug("[{}] channel open, start sent", issueKey);
                } catch (IOException e) {
                    log.warn("[{}] failed to send start: {}", issueKey, e.getMessage());
                    transportFailed(gen);
                }
                stageUpdate();
            }
            publishUpdates();
        }

        @Override
        public void onText(String text) {
            synchronized (ClientSession.this) {
                if (gen != generation) return;
                Optional<ServerFrame> decoded = codec.decodeServer(text);
                if (decoded.isEmpty()) {
                    log.debug("[{}] dropped unreadable frame", issueKey);
                    return;
                }
                ServerFrame frame = decoded.get();
                // frames the lifecycle rejects must not reach the conversation either
                if (!machine.dispatch(ClientSessionEvent.of(frame))) return;
                snapshot = merger.apply(snapshot, frame);
                stageUpdate();
            }
            publishUpdates();
        }

        @Override
        public void onTransportError(Throwable error) {
            synchronized (ClientSession.this) {
                if (gen != generation) return;
                log.warn("[{}] transport error: {}", issueKey, error.getMessage());
                transportFailed(gen);
                stageUpdate();
            }
            publishUpdates();
        }

        @Override
        public void onClosed() {
            synchronized (ClientSession.this) {
                if (gen != generation) return;
                channel = null;
                generation++;
                machine.dispatch(ClientSessionEvent.CHANNEL_CLOSED);
                snapshot = merger.markIdle(snapshot);
                stageUpdate();
            }
            publishUpdates();
        }
    }
}

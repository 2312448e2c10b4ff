package io.github.drompincen.sreflow.client.session;

import io.github.drompincen.sreflow.client.conversation.ConversationMerger;
import io.github.drompincen.sreflow.client.status.DisplayStatus;
import io.github.drompincen.sreflow.client.status.StatusDerivation;
import io.github.drompincen.sreflow.protocol.model.Issue;
import io.github.drompincen.sreflow.protocol.ws.FrameCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Owns every {@link ClientSession} of the client, keyed by issue key. Lookups are
 * lock-free and no session is connected or closed while a registry lock is held, so
 * session listeners may query the registry from any thread.
 */
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final ChannelConnector connector;
    private final FrameCodec codec;
    private final ConversationMerger merger;
    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();
    private final ConcurrentMap<String, ClientSession> sessions = new ConcurrentHashMap<>();

    public SessionRegistry(ChannelConnector connector) {
        this(connector, new FrameCodec());
    }

    public SessionRegistry(ChannelConnector connector, FrameCodec codec) {
        this(connector, codec, new ConversationMerger(codec));
    }

    public SessionRegistry(ChannelConnector connector, FrameCodec codec, ConversationMerger merger) {
        this.connector = connector;
        this.codec = codec;
        this.merger = merger;
    }

    /** Listeners are attached to sessions created after this call. */
    public void addListener(SessionListener listener) {
        listeners.add(listener);
    }

    /**
     * The operator picked an issue: creates its session if needed and (re)connects it.
     * Reconnecting an existing session replaces its channel and replays history.
     */
    public ClientSession select(Issue issue) {
        while (true) {
            ClientSession session = sessions.computeIfAbsent(issue.key(), key -> track(issue));
            if (session.tryConnect()) return session;
            // closed by a concurrent prune that has not removed it yet
            sessions.remove(issue.key(), session);
        }
    }

    public Optional<ClientSession> find(String issueKey) {
        return Optional.ofNullable(sessions.get(issueKey));
    }

    /** Closes the session's channel, then forgets the session and its conversation. */
    public boolean close(String issueKey) {
        ClientSession session = sessions.get(issueKey);
        if (session == null) return false;
        session.close();
        return sessions.remove(issueKey, session);
    }

    /** Closes and forgets every session whose issue is absent from {@code latest}. */
    public List<String> prune(Collection<Issue> latest) {
        Set<String> live = new HashSet<>();
        latest.forEach(issue -> live.add(issue.key()));
        List<String> pruned = new ArrayList<>();
        for (String key : List.copyOf(sessions.keySet())) {
            if (!live.contains(key) && close(key)) {
                pruned.add(key);
            }
        }
        if (!pruned.isEmpty()) {
            log.info("Pruned {} session(s) for issues no longer reported: {}", pruned.size(), pruned);
        }
        return pruned;
    }

    public DisplayStatus statusOf(String issueKey) {
        ClientSession session = sessions.get(issueKey);
        return StatusDerivation.derive(session != null ? session.snapshot() : null);
    }

    public Set<String> keys() {
        return Set.copyOf(sessions.keySet());
    }

    public int size() {
        return sessions.size();
    }

    /** Closes everything, e.g. on shutdown. */
    public void closeAll() {
        for (String key : List.copyOf(sessions.keySet())) {
            close(key);
        }
    }

    private ClientSession track(Issue issue) {
        ClientSession session = new ClientSession(issue, connector, codec, merger);
        listeners.forEach(session::addListener);
        log.debug("Tracking session for {}", issue.key());
        return session;
    }
}

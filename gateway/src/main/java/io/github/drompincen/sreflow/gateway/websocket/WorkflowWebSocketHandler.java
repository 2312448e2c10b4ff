package io.github.drompincen.sreflow.gateway.websocket;

import io.github.drompincen.sreflow.protocol.ws.ClientFrame;
import io.github.drompincen.sreflow.protocol.ws.FrameCodec;
import io.github.drompincen.sreflow.runtime.session.SessionCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Workflow endpoint: one connection follows one issue. {@code start} binds the
 * connection to the issue; {@code intervene} and {@code resume} act on the bound issue.
 * Frames that cannot be decoded are dropped.
 */
@Component
public class WorkflowWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(WorkflowWebSocketHandler.class);

    private final SessionCoordinator coordinator;
    private final FrameCodec codec;
    private final Map<String, WebSocketFrameSink> sinks = new ConcurrentHashMap<>();
    private final Map<String, String> boundIssues = new ConcurrentHashMap<>();

    public WorkflowWebSocketHandler(SessionCoordinator coordinator, FrameCodec codec) {
        this.coordinator = coordinator;
        this.codec = codec;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        sinks.put(session.getId(), new WebSocketFrameSink(session, codec));
        log.debug("Workflow connection {} opened", session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        WebSocketFrameSink sink = sinks.remove(session.getId());
        String issueKey = boundIssues.remove(session.getId());
        if (sink != null) {
            coordinator.detach(sink);
        }
        log.debug("Workflow connection {} closed ({}) for {}", session.getId(), status, issueKey);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        Optional<ClientFrame> decoded = codec.decodeClient(message.getPayload());
        if (decoded.isEmpty()) {
            log.debug("Dropped unreadable frame on {}", session.getId());
            return;
        }
        ClientFrame frame = decoded.get();
        WebSocketFrameSink sink = sinks.computeIfAbsent(session.getId(), id -> new WebSocketFrameSink(session, codec));

        if (frame instanceof ClientFrame.Start start) {
            String issueKey = start.issue().key();
            String previous = boundIssues.put(session.getId(), issueKey);
            if (previous != null && !previous.equals(issueKey)) {
                coordinator.detach(sink);
            }
            coordinator.start(start.issue(), sink);
        } else if (frame instanceof ClientFrame.Intervene intervene) {
            String issueKey = boundIssue(session, frame);
            if (issueKey != null) coordinator.intervene(issueKey, intervene);
        } else if (frame instanceof ClientFrame.Resume resume) {
            String issueKey = boundIssue(session, frame);
            if (issueKey != null) coordinator.resume(issueKey, resume);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on workflow connection {}: {}", session.getId(), exception.getMessage());
    }

    private String boundIssue(WebSocketSession session, ClientFrame frame) {
        String issueKey = boundIssues.get(session.getId());
        if (issueKey == null) {
            log.warn("Ignoring {} on {}: no start received", frame.type().wireName(), session.getId());
        }
        return issueKey;
    }
}

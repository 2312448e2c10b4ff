package io.github.drompincen.sreflow.gateway.websocket;

import io.github.drompincen.sreflow.protocol.ws.FrameCodec;
import io.github.drompincen.sreflow.protocol.ws.ServerFrame;
import io.github.drompincen.sreflow.runtime.session.FrameSink;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * Delivers coordinator frames to one WebSocket connection. The step loop and a replay
 * can write at the same time, and a container session accepts one send at a time.
 */
class WebSocketFrameSink implements FrameSink {

    private final WebSocketSession session;
    private final FrameCodec codec;

    WebSocketFrameSink(WebSocketSession session, FrameCodec codec) {
        this.session = session;
        this.codec = codec;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void send(ServerFrame frame) throws IOException {
        TextMessage message = new TextMessage(codec.encode(frame));
        synchronized (session) {
            session.sendMessage(message);
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public String toString() {
        return "ws:" + session.getId();
    }
}

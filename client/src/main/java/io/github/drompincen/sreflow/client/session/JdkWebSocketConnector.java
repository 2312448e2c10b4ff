package io.github.drompincen.sreflow.client.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

/**
 * Opens workflow channels with the JDK WebSocket client.
 */
public class JdkWebSocketConnector implements ChannelConnector {

    private static final Logger log = LoggerFactory.getLogger(JdkWebSocketConnector.class);

    public static final String WORKFLOW_PATH = "/api/workflow/ws";

    private final HttpClient httpClient;
    private final URI endpoint;

    public JdkWebSocketConnector(URI endpoint) {
        this(HttpClient.newHttpClient(), endpoint);
    }

    public JdkWebSocketConnector(HttpClient httpClient, URI endpoint) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
    }

    /** {@code http://host:8080} becomes {@code ws://host:8080/api/workflow/ws}. */
    public static URI endpointFor(String baseUrl) {
        String trimmed = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return URI.create(trimmed.replace("http://", "ws://").replace("https://", "wss://") + WORKFLOW_PATH);
    }

    @Override
    public WorkflowChannel connect(ChannelListener listener) {
        JdkChannel channel = new JdkChannel(listener);
        httpClient.newWebSocketBuilder()
                .buildAsync(endpoint, channel)
                .whenComplete((ws, error) -> {
                    if (error != null) {
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause() : error;
                        log.debug("WebSocket handshake with {} failed: {}", endpoint, cause.getMessage());
                        listener.onTransportError(cause);
                    }
                });
        return channel;
    }

    static final class JdkChannel implements WorkflowChannel, WebSocket.Listener {

        private final ChannelListener listener;
        private final StringBuilder buffer = new StringBuilder();
        private volatile WebSocket webSocket;
        private volatile boolean closed;

        JdkChannel(ChannelListener listener) {
            this.listener = listener;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            this.webSocket = webSocket;
            if (closed) {
                webSocket.abort();
                return;
            }
            listener.onOpen(this);
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            buffer.append(data);
            if (last) {
                String text = buffer.toString();
                buffer.setLength(0);
                listener.onText(text);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            closed = true;
            listener.onClosed();
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            closed = true;
            listener.onTransportError(error);
        }

        @Override
        public boolean isOpen() {
            WebSocket ws = webSocket;
            return ws != null && !closed && !ws.isOutputClosed();
        }

        @Override
        public void send(String text) throws IOException {
            if (!isOpen()) {
                throw new IOException("WebSocket is not open");
            }
            try {
                webSocket.sendText(text, true).join();
            } catch (CompletionException e) {
                throw new IOException("WebSocket send failed", e.getCause() != null ? e.getCause() : e);
            }
        }

        @Override
        public void close() {
            if (closed) return;
            closed = true;
            WebSocket ws = webSocket;
            if (ws != null && !ws.isOutputClosed()) {
                ws.sendClose(WebSocket.NORMAL_CLOSURE, "client closed")
                        .exceptionally(e -> {
                            ws.abort();
                            return null;
                        });
            }
        }
    }
}

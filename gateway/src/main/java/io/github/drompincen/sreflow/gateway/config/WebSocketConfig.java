package io.github.drompincen.sreflow.gateway.config;

import io.github.drompincen.sreflow.gateway.websocket.WorkflowWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String WORKFLOW_PATH = "/api/workflow/ws";

    private final WorkflowWebSocketHandler handler;

    public WebSocketConfig(WorkflowWebSocketHandler handler) {
        this.handler = handler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, WORKFLOW_PATH).setAllowedOrigins("*");
    }
}

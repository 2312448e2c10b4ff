package io.github.drompincen.sreflow.gateway.websocket;

import io.github.drompincen.sreflow.protocol.model.Issue;
import io.github.drompincen.sreflow.protocol.model.ResourceType;
import io.github.drompincen.sreflow.protocol.model.Severity;
import io.github.drompincen.sreflow.protocol.ws.ClientFrame;
import io.github.drompincen.sreflow.protocol.ws.FrameCodec;
import io.github.drompincen.sreflow.protocol.ws.InterventionDecision;
import io.github.drompincen.sreflow.protocol.ws.ResumeDecision;
import io.github.drompincen.sreflow.protocol.ws.ServerFrame;
import io.github.drompincen.sreflow.runtime.session.FrameSink;
import io.github.drompincen.sreflow.runtime.session.SessionCoordinator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class WorkflowWebSocketHandlerTest {

    private static final Issue API = new Issue("CrashLoopBackOff", Severity.CRITICAL, ResourceType.POD,
            "payments", "api-7d9", "api", "01h 02m", 3720, "Back-off restarting failed container");
    private static final Issue WORKER = new Issue("ImagePullBackOff", Severity.HIGH, ResourceType.POD,
            "payments", "worker-1", "worker", "00h 18m", 1080, "Back-off pulling image");

    @Mock private SessionCoordinator coordinator;
    @Mock private WebSocketSession wsSession;

    private final FrameCodec codec = new FrameCodec();
    private WorkflowWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        handler = new WorkflowWebSocketHandler(coordinator, codec);
        when(wsSession.getId()).thenReturn("ws-1");
        when(wsSession.isOpen()).thenReturn(true);
    }

    private void receive(ClientFrame frame) {
        handler.handleTextMessage(wsSession, new TextMessage(codec.encode(frame)));
    }

    private FrameSink startedSink() {
        ArgumentCaptor<FrameSink> captor = ArgumentCaptor.forClass(FrameSink.class);
        verify(coordinator).start(eq(API), captor.capture());
        return captor.getValue();
    }

    @Test
    void startHandsIssueAndSinkToCoordinator() {
        handler.afterConnectionEstablished(wsSession);

        receive(new ClientFrame.Start(API));

        FrameSink sink = startedSink();
        assertThat(sink.id()).isEqualTo("ws-1");
        assertThat(sink.isOpen()).isTrue();
    }

    @Test
    void sinkWritesEncodedFrames() throws Exception {
        handler.afterConnectionEstablished(wsSession);
        receive(new ClientFrame.Start(API));

        startedSink().send(new ServerFrame.Error("Agent step timed out after PT2M"));

        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(wsSession).sendMessage(captor.capture());
        String payload = captor.getValue().getPayload();
        assertThat(payload).contains("\"event\":\"error\"");
        assertThat(payload).contains("Agent step timed out after PT2M");
    }

    @Test
    void interveneRoutesToBoundIssue() {
        handler.afterConnectionEstablished(wsSession);
        receive(new ClientFrame.Start(API));

        receive(new ClientFrame.Intervene(InterventionDecision.DENY, "look at the events"));

        ArgumentCaptor<ClientFrame.Intervene> captor = ArgumentCaptor.forClass(ClientFrame.Intervene.class);
        verify(coordinator).intervene(eq(API.key()), captor.capture());
        assertThat(captor.getValue().decision()).isEqualTo(InterventionDecision.DENY);
        assertThat(captor.getValue().hint()).isEqualTo("look at the events");
    }

    @Test
    void resumeRoutesToBoundIssue() {
        handler.afterConnectionEstablished(wsSession);
        receive(new ClientFrame.Start(API));

        receive(new ClientFrame.Resume(ResumeDecision.YES));

        verify(coordinator).resume(API.key(), new ClientFrame.Resume(ResumeDecision.YES));
    }

    @Test
    void controlFrameBeforeStartIsIgnored() {
        handler.afterConnectionEstablished(wsSession);

        receive(new ClientFrame.Intervene(InterventionDecision.APPROVE, null));
        receive(new ClientFrame.Resume(ResumeDecision.YES));

        verify(coordinator, never()).intervene(any(), any());
        verify(coordinator, never()).resume(any(), any());
    }

    @Test
    void unreadableFramesAreDropped() {
        handler.afterConnectionEstablished(wsSession);

        handler.handleTextMessage(wsSession, new TextMessage("{not json"));
        handler.handleTextMessage(wsSession, new TextMessage("{\"type\":\"reboot\"}"));
        handler.handleTextMessage(wsSession, new TextMessage("{\"type\":\"intervene\",\"decision\":\"maybe\"}"));

        verifyNoInteractions(coordinator);
    }

    @Test
    void switchingIssueDetachesFromPreviousThread() {
        handler.afterConnectionEstablished(wsSession);
        receive(new ClientFrame.Start(API));
        FrameSink sink = startedSink();

        receive(new ClientFrame.Start(WORKER));

        verify(coordinator).detach(sink);
        verify(coordinator).start(WORKER, sink);
    }

    @Test
    void closeDetachesSink() {
        handler.afterConnectionEstablished(wsSession);
        receive(new ClientFrame.Start(API));
        FrameSink sink = startedSink();

        handler.afterConnectionClosed(wsSession, CloseStatus.NORMAL);

        verify(coordinator).detach(sink);
    }

    @Test
    void closeWithoutStartStillDetaches() {
        handler.afterConnectionEstablished(wsSession);

        handler.afterConnectionClosed(wsSession, CloseStatus.GOING_AWAY);

        verify(coordinator).detach(any());
        verify(coordinator, never()).start(any(), any());
    }
}

package io.github.drompincen.sreflow.runtime.agent.remote;

import io.github.drompincen.sreflow.protocol.model.AgentStateSnapshot;
import io.github.drompincen.sreflow.protocol.model.Issue;
import io.github.drompincen.sreflow.protocol.model.NextAction;
import io.github.drompincen.sreflow.protocol.model.ResourceType;
import io.github.drompincen.sreflow.protocol.model.Severity;
import io.github.drompincen.sreflow.runtime.agent.AgentException;
import io.github.drompincen.sreflow.runtime.agent.DiagnosticRequest;
import io.github.drompincen.sreflow.runtime.agent.SolutionRequest;
import io.github.drompincen.sreflow.runtime.agent.SolutionResult;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class RemoteAgentClientTest {

    private static final String BASE = "http://agents.test/api";
    private static final Issue ISSUE = new Issue("CrashLoopBackOff", Severity.CRITICAL, ResourceType.POD,
            "payments", "api-7d9", "api", "01h 02m", 3720, "Back-off restarting failed container");

    private MockRestServiceServer server;
    private RemoteAgentClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new RemoteAgentClient(builder, BASE);
    }

    @Test
    void openThreadPostsIssueAndReturnsThreadId() {
        server.expect(requestTo(BASE + "/threads"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.agent").value("diagnostic"))
                .andExpect(jsonPath("$.issue.resourceName").value("api-7d9"))
                .andRespond(withSuccess("{\"thread_id\":\"t-42\"}", MediaType.APPLICATION_JSON));

        assertThat(client.openThread(ISSUE)).isEqualTo("t-42");
        server.verify();
    }

    @Test
    void stepSendsHintAndParsesSnapshot() {
        server.expect(requestTo(BASE + "/threads/t-42/steps"))
                .andExpect(jsonPath("$.step_no").value(3))
                .andExpect(jsonPath("$.hint").value("check secrets"))
                .andRespond(withSuccess("""
                        {"thought":"Looking at secrets","action":"get_secret","action_input":"{}",
                         "next_action":"await_user_approval","extra":1}
                        """, MediaType.APPLICATION_JSON));

        AgentStateSnapshot snapshot = client.step(new DiagnosticRequest("t-42", ISSUE, 3, "check secrets", List.of()));

        assertThat(snapshot.action()).isEqualTo("get_secret");
        assertThat(snapshot.nextAction()).isEqualTo(NextAction.AWAIT_USER_APPROVAL);
    }

    @Test
    void solveReturnsSolutionThreadAndText() {
        server.expect(requestTo(BASE + "/solutions"))
                .andExpect(jsonPath("$.diag_thread_id").value("t-42"))
                .andExpect(jsonPath("$.root_cause").value("missing env"))
                .andRespond(withSuccess("{\"thread_id\":\"s-7\",\"text\":\"{\\\"summary\\\":\\\"ok\\\"}\"}",
                        MediaType.APPLICATION_JSON));

        SolutionResult result = client.solve(new SolutionRequest(ISSUE, "t-42", "missing env", List.of()));

        assertThat(result.solThreadId()).isEqualTo("s-7");
        assertThat(result.text()).isEqualTo("{\"summary\":\"ok\"}");
    }

    @Test
    void platformErrorsBecomeAgentExceptions() {
        server.expect(requestTo(BASE + "/threads")).andRespond(withServerError());

        assertThatThrownBy(() -> client.openThread(ISSUE))
                .isInstanceOf(AgentException.class)
                .hasMessageContaining("/threads");
    }

    @Test
    void missingThreadIdIsRejected() {
        server.expect(requestTo(BASE + "/threads"))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.openThread(ISSUE))
                .isInstanceOf(AgentException.class)
                .hasMessageContaining("no thread id");
    }

    @Test
    void unresponsivePlatformFailsAfterReadTimeout() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        HttpServer platform = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        platform.createContext("/api/threads", exchange -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            exchange.sendResponseHeaders(500, -1);
            exchange.close();
        });
        platform.start();
        try {
            RemoteAgentClient slow = new RemoteAgentClient(RestClient.builder(),
                    "http://127.0.0.1:" + platform.getAddress().getPort() + "/api",
                    Duration.ofSeconds(1), Duration.ofMillis(200));

            long started = System.nanoTime();
            assertThatThrownBy(() -> slow.openThread(ISSUE))
                    .isInstanceOf(AgentException.class)
                    .hasMessageContaining("/threads");
            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(3));
        } finally {
            release.countDown();
            platform.stop(0);
        }
    }
}

package io.github.drompincen.sreflow.runtime.agent.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.drompincen.sreflow.protocol.model.AgentStateSnapshot;
import io.github.drompincen.sreflow.protocol.model.Issue;
import io.github.drompincen.sreflow.runtime.agent.AgentException;
import io.github.drompincen.sreflow.runtime.agent.DiagnosticAgent;
import io.github.drompincen.sreflow.runtime.agent.DiagnosticRequest;
import io.github.drompincen.sreflow.runtime.agent.SolutionAgent;
import io.github.drompincen.sreflow.runtime.agent.SolutionRequest;
import io.github.drompincen.sreflow.runtime.agent.SolutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP adapter to an external agent platform hosting the diagnostic and solution agents.
 *
 * <pre>
 * POST {base}/threads                 {"agent":"diagnostic","issue":{...}}      -> {"thread_id":"..."}
 * POST {base}/threads/{id}/steps      {"issue":{...},"step_no":n,"hint":"..."} -> AgentStateSnapshot
 * POST {base}/solutions               {"issue","diag_thread_id","root_cause"}  -> {"thread_id","text"}
 * </pre>
 *
 * Activate with: SREFLOW_AGENT_PROVIDER=remote
 */
@Component
@ConditionalOnProperty(name = "sreflow.agent.provider", havingValue = "remote")
public class RemoteAgentClient implements DiagnosticAgent, SolutionAgent {

    private static final Logger log = LoggerFactory.getLogger(RemoteAgentClient.class);

    private final RestClient restClient;

    @Autowired
    public RemoteAgentClient(RestClient.Builder builder,
                             @Value("${sreflow.agent.remote.base-url:http://localhost:8090/api/agents}") String baseUrl,
                             @Value("${sreflow.agent.remote.connect-timeout:PT5S}") Duration connectTimeout,
                             @Value("${sreflow.agent.remote.read-timeout:PT90S}") Duration readTimeout) {
        this(builder.requestFactory(requestFactory(connectTimeout, readTimeout)), baseUrl);
        log.info("Remote agent timeouts: connect {}, read {}", connectTimeout, readTimeout);
    }

    RemoteAgentClient(RestClient.Builder builder, String baseUrl) {
        this.restClient = builder.baseUrl(baseUrl).build();
        log.info("Using remote agent platform at {}", baseUrl);
    }

    static SimpleClientHttpRequestFactory requestFactory(Duration connectTimeout, Duration readTimeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) connectTimeout.toMillis());
        factory.setReadTimeout((int) readTimeout.toMillis());
        return factory;
    }

    @Override
    public String openThread(Issue issue) {
        ThreadResponse response = post("/threads", Map.of("agent", "diagnostic", "issue", issue), ThreadResponse.class);
        if (response == null || response.threadId() == null) {
            throw new AgentException("Agent platform returned no thread id for " + issue.key());
        }
        return response.threadId();
    }

    @Override
    public AgentStateSnapshot step(DiagnosticRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("issue", request.issue());
        body.put("step_no", request.stepNo());
        if (request.hasHint()) body.put("hint", request.hint());
        AgentStateSnapshot snapshot = post("/threads/" + request.threadId() + "/steps", body, AgentStateSnapshot.class);
        if (snapshot == null) {
            throw new AgentException("Agent platform returned an empty step for thread " + request.threadId());
        }
        return snapshot;
    }

    @Override
    public SolutionResult solve(SolutionRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("issue", request.issue());
        body.put("diag_thread_id", request.diagThreadId());
        if (request.rootCause() != null) body.put("root_cause", request.rootCause());
        SolutionResponse response = post("/solutions", body, SolutionResponse.class);
        if (response == null || response.threadId() == null) {
            throw new AgentException("Agent platform returned no solution thread for " + request.diagThreadId());
        }
        return new SolutionResult(response.threadId(), response.text() != null ? response.text() : "");
    }

    private <T> T post(String path, Object body, Class<T> type) {
        try {
            return restClient.post()
                    .uri(path)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(type);
        } catch (RestClientException e) {
            throw new AgentException("Agent platform call " + path + " failed: " + e.getMessage(), e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ThreadResponse(@JsonProperty("thread_id") String threadId) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SolutionResponse(@JsonProperty("thread_id") String threadId, String text) {}
}

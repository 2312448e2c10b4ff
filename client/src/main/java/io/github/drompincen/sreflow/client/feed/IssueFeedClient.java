package io.github.drompincen.sreflow.client.feed;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.sreflow.protocol.model.Issue;
import io.github.drompincen.sreflow.protocol.ws.FrameCodec;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

/**
 * Reads the gateway's issue snapshot ({@code GET /api/health/issues}).
 */
public class IssueFeedClient {

    public static final String ISSUES_PATH = "/api/health/issues";

    private static final TypeReference<List<Issue>> ISSUE_LIST = new TypeReference<>() {};

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final URI issuesUri;

    public IssueFeedClient(String baseUrl) {
        this(HttpClient.newHttpClient(), FrameCodec.defaultMapper(), baseUrl);
    }

    public IssueFeedClient(HttpClient httpClient, ObjectMapper mapper, String baseUrl) {
        this.httpClient = httpClient;
        this.mapper = mapper;
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.issuesUri = URI.create(base + ISSUES_PATH);
    }

    public List<Issue> fetchIssues() throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(issuesUri)
                .header("Accept", "application/json")
                .timeout(Duration.ofSeconds(30))
                .GET()
                .build();
        HttpResponse<String> resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new IOException("Issue feed " + issuesUri + " returned HTTP " + resp.statusCode());
        }
        List<Issue> issues = mapper.readValue(resp.body(), ISSUE_LIST);
        return issues != null ? issues : List.of();
    }

    public URI issuesUri() {
        return issuesUri;
    }
}

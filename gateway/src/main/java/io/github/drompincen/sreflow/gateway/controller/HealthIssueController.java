package io.github.drompincen.sreflow.gateway.controller;

import io.github.drompincen.sreflow.protocol.model.Issue;
import io.github.drompincen.sreflow.runtime.feed.IssueFeedService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
public class HealthIssueController {

    private final IssueFeedService issueFeedService;

    public HealthIssueController(IssueFeedService issueFeedService) {
        this.issueFeedService = issueFeedService;
    }

    /** Current issues, grouped by namespace and sorted by severity within each namespace. */
    @GetMapping("/api/health/issues")
    public List<Issue> issues() {
        return issueFeedService.currentIssues();
    }

    @GetMapping("/healthz")
    public Map<String, String> healthz() {
        return Map.of("status", "ok");
    }
}

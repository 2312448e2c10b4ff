package io.github.drompincen.sreflow.gateway.controller;

import io.github.drompincen.sreflow.protocol.ws.FrameCodec;
import io.github.drompincen.sreflow.runtime.session.SessionCoordinator;
import io.github.drompincen.sreflow.runtime.session.ThreadView;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Comparator;
import java.util.List;

@RestController
@RequestMapping("/api/workflow/threads")
public class WorkflowController {

    private final SessionCoordinator coordinator;
    private final FrameCodec codec;

    public WorkflowController(SessionCoordinator coordinator, FrameCodec codec) {
        this.coordinator = coordinator;
        this.codec = codec;
    }

    @GetMapping
    public List<ThreadView> list() {
        return coordinator.views().stream()
                .sorted(Comparator.comparing(ThreadView::issueKey))
                .toList();
    }

    @GetMapping("/{issueKey}")
    public ResponseEntity<?> get(@PathVariable String issueKey) {
        return coordinator.view(issueKey)
                .map(v -> ResponseEntity.ok(v))
                .orElse(ResponseEntity.notFound().build());
    }

    /** The {@code history} frame a reconnecting client would be sent. */
    @GetMapping("/{issueKey}/history")
    public ResponseEntity<String> history(@PathVariable String issueKey) {
        return coordinator.history(issueKey)
                .map(h -> ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(codec.encode(h)))
                .orElse(ResponseEntity.notFound().build());
    }
}

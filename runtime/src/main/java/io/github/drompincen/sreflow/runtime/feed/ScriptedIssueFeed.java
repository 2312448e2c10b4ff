package io.github.drompincen.sreflow.runtime.feed;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.sreflow.protocol.model.Issue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Issue feed backed by a JSON array on the classpath, or on the filesystem when no
 * classpath resource has that name. Re-read on every poll.
 */
@Component
@ConditionalOnProperty(name = "sreflow.feed.provider", havingValue = "scripted", matchIfMissing = true)
public class ScriptedIssueFeed implements IssueFeed {

    private static final Logger log = LoggerFactory.getLogger(ScriptedIssueFeed.class);
    private static final TypeReference<List<Issue>> ISSUE_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final String resourcePath;

    public ScriptedIssueFeed(ObjectMapper objectMapper,
                             @Value("${sreflow.feed.resource:mock-issues.json}") String resourcePath) {
        this.objectMapper = objectMapper;
        this.resourcePath = resourcePath;
    }

    @Override
    public List<Issue> fetchIssues() {
        try (InputStream is = open()) {
            if (is == null) {
                log.warn("Issue feed resource {} not found; reporting no issues", resourcePath);
                return List.of();
            }
            List<Issue> issues = objectMapper.readValue(is, ISSUE_LIST);
            return issues != null ? issues : List.of();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read issue feed " + resourcePath, e);
        }
    }

    private InputStream open() throws IOException {
        InputStream is = getClass().getClassLoader().getResourceAsStream(resourcePath);
        if (is != null) return is;
        File file = new File(resourcePath);
        return file.isFile() ? new FileInputStream(file) : null;
    }
}

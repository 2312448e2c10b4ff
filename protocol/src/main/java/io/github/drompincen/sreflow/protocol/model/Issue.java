package io.github.drompincen.sreflow.protocol.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One unhealthy resource reported by the issue feed.
 *
 * <p>{@code unhealthySince} is the duration string formatted by the metrics source
 * (e.g. {@code "02h 15m"}); {@code unhealthyTimespan} is the same duration in seconds.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Issue(
        String issueType,
        Severity severity,
        ResourceType resourceType,
        String namespace,
        String resourceName,
        String container,
        String unhealthySince,
        long unhealthyTimespan,
        String message
) {
    public static final String DEFAULT_NAMESPACE = "default";

    /**
     * Correlation key: {@code namespace:resourceType:resourceName:container}, with an
     * empty segment for a missing container.
     */
    @JsonIgnore
    public String key() {
        return keyOf(namespace, resourceType, resourceName, container);
    }

    @JsonIgnore
    public String namespaceOrDefault() {
        return namespace == null || namespace.isBlank() ? DEFAULT_NAMESPACE : namespace;
    }

    public static String keyOf(String namespace, ResourceType resourceType, String resourceName, String container) {
        return nullToEmpty(namespace) + ":"
                + (resourceType != null ? resourceType.wireName() : "") + ":"
                + nullToEmpty(resourceName) + ":"
                + nullToEmpty(container);
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }
}

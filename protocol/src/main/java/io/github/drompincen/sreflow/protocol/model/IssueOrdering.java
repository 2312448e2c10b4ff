package io.github.drompincen.sreflow.protocol.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public final class IssueOrdering {

    /** Severity first (unknown last), then the longest-unhealthy issue first. */
    public static final Comparator<Issue> BY_SEVERITY_THEN_TIMESPAN = Comparator
            .comparingInt((Issue i) -> i.severity() != null ? i.severity().rank() : 99)
            .thenComparing(Comparator.comparingLong(Issue::unhealthyTimespan).reversed());

    private IssueOrdering() {}

    public static List<Issue> sorted(Collection<Issue> issues) {
        List<Issue> copy = new ArrayList<>(issues);
        copy.sort(BY_SEVERITY_THEN_TIMESPAN);
        return copy;
    }

    /**
     * Groups issues by namespace (alphabetical), each group sorted with
     * {@link #BY_SEVERITY_THEN_TIMESPAN}.
     */
    public static Map<String, List<Issue>> byNamespace(Collection<Issue> issues) {
        Map<String, List<Issue>> grouped = new TreeMap<>();
        for (Issue issue : issues) {
            grouped.computeIfAbsent(issue.namespaceOrDefault(), k -> new ArrayList<>()).add(issue);
        }
        Map<String, List<Issue>> result = new LinkedHashMap<>();
        grouped.forEach((ns, list) -> result.put(ns, sorted(list)));
        return result;
    }

    /** The {@link #byNamespace} order as one list, namespace by namespace. */
    public static List<Issue> grouped(Collection<Issue> issues) {
        List<Issue> flat = new ArrayList<>(issues.size());
        byNamespace(issues).values().forEach(flat::addAll);
        return flat;
    }
}

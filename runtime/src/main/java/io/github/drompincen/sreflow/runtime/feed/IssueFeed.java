package io.github.drompincen.sreflow.runtime.feed;

import io.github.drompincen.sreflow.protocol.model.Issue;

import java.util.List;

/**
 * Source of the current unhealthy-resource snapshot. Detection logic lives upstream;
 * implementations only fetch.
 */
public interface IssueFeed {

    List<Issue> fetchIssues();
}

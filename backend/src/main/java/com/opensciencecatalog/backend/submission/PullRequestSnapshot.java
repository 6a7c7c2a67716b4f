package com.opensciencecatalog.backend.submission;

import java.time.Instant;

/** The raw pull request fields needed to rebuild a submission. */
public record PullRequestSnapshot(
    int number, String body, String htmlUrl, Instant createdAt, String rawState, Instant mergedAt) {}

package com.opensciencecatalog.backend.submission;

public record PullRequestRef(int number, String htmlUrl) {}

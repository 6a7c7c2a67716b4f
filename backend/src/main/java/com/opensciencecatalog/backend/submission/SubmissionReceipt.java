package com.opensciencecatalog.backend.submission;

public record SubmissionReceipt(String branch, int pullRequestNumber, String pullRequestUrl) {}

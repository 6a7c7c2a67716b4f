package com.opensciencecatalog.backend.submission;

import com.fasterxml.jackson.annotation.JsonValue;
import java.time.Instant;

/** Lifecycle of a submission, always derived from the pull request that carries it. */
public enum SubmissionStatus {
  PENDING("Pending"),
  MERGED("Merged"),
  REJECTED("Rejected");

  private final String displayName;

  SubmissionStatus(String displayName) {
    this.displayName = displayName;
  }

  @JsonValue
  public String displayName() {
    return displayName;
  }

  /**
   * Maps the raw pull request fields onto a status. {@code mergedAt} is authoritative for closed
   * pull requests; the server-side "merged" flag costs an extra request and is not consulted.
   */
  public static SubmissionStatus resolve(String rawState, Instant mergedAt) {
    if ("open".equalsIgnoreCase(rawState)) {
      return PENDING;
    }
    return mergedAt != null ? MERGED : REJECTED;
  }
}

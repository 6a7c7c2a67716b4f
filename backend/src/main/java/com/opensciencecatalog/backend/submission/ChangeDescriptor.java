package com.opensciencecatalog.backend.submission;

import java.time.Instant;
import java.util.Objects;

/**
 * One proposed catalog mutation. {@code status}, {@code url} and {@code createdAt} belong to the
 * pull request and are null until the descriptor is read back from one.
 */
public record ChangeDescriptor(
    String filename,
    String itemType,
    ChangeKind changeKind,
    SubmissionStatus status,
    String url,
    Instant createdAt,
    String user,
    boolean dataOwner) {

  public ChangeDescriptor {
    Objects.requireNonNull(filename, "filename");
    Objects.requireNonNull(itemType, "itemType");
    Objects.requireNonNull(changeKind, "changeKind");
    Objects.requireNonNull(user, "user");
  }

  public static ChangeDescriptor proposed(
      String filename, String itemType, ChangeKind changeKind, String user, boolean dataOwner) {
    return new ChangeDescriptor(filename, itemType, changeKind, null, null, null, user, dataOwner);
  }

  public ChangeDescriptor withPullRequest(SubmissionStatus status, String url, Instant createdAt) {
    return new ChangeDescriptor(
        filename, itemType, changeKind, status, url, createdAt, user, dataOwner);
  }
}

package com.opensciencecatalog.backend.item.api;

import com.opensciencecatalog.backend.submission.ChangeDescriptor;
import com.opensciencecatalog.backend.submission.ChangeKind;
import com.opensciencecatalog.backend.submission.SubmissionStatus;
import java.time.Instant;

public record SubmissionResponse(
    String filename,
    String itemType,
    ChangeKind changeType,
    SubmissionStatus status,
    String url,
    Instant createdAt,
    String user,
    boolean dataOwner) {

  public static SubmissionResponse from(ChangeDescriptor descriptor) {
    return new SubmissionResponse(
        descriptor.filename(),
        descriptor.itemType(),
        descriptor.changeKind(),
        descriptor.status(),
        descriptor.url(),
        descriptor.createdAt(),
        descriptor.user(),
        descriptor.dataOwner());
  }
}

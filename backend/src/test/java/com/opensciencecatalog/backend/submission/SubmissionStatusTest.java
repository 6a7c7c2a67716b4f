package com.opensciencecatalog.backend.submission;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SubmissionStatusTest {

  private static final Instant MERGED_AT = Instant.parse("2024-06-01T12:00:00Z");

  @Test
  void openPullRequestIsPendingEvenWithMergeTimestamp() {
    assertThat(SubmissionStatus.resolve("open", null)).isEqualTo(SubmissionStatus.PENDING);
    assertThat(SubmissionStatus.resolve("open", MERGED_AT)).isEqualTo(SubmissionStatus.PENDING);
    assertThat(SubmissionStatus.resolve("OPEN", null)).isEqualTo(SubmissionStatus.PENDING);
  }

  @ParameterizedTest
  @ValueSource(strings = {"closed", "merged", "unexpected"})
  void closedPullRequestWithMergeTimestampIsMerged(String state) {
    assertThat(SubmissionStatus.resolve(state, MERGED_AT)).isEqualTo(SubmissionStatus.MERGED);
  }

  @ParameterizedTest
  @ValueSource(strings = {"closed", "merged", "unexpected"})
  void closedPullRequestWithoutMergeTimestampIsRejected(String state) {
    assertThat(SubmissionStatus.resolve(state, null)).isEqualTo(SubmissionStatus.REJECTED);
  }

  @Test
  void displayNamesMatchApiValues() {
    assertThat(SubmissionStatus.PENDING.displayName()).isEqualTo("Pending");
    assertThat(SubmissionStatus.MERGED.displayName()).isEqualTo("Merged");
    assertThat(SubmissionStatus.REJECTED.displayName()).isEqualTo("Rejected");
  }
}

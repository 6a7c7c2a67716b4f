package com.opensciencecatalog.backend.submission;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

/**
 * Reads submissions back from the pull request list. Pull requests whose body is not a change
 * descriptor were opened outside this workflow and are skipped.
 */
@Service
public class SubmissionLister {

  private static final Logger log = LoggerFactory.getLogger(SubmissionLister.class);

  private final CatalogRepositoryGateway gateway;
  private final ChangeDescriptorCodec codec;
  private final Counter skippedCounter;

  public SubmissionLister(
      CatalogRepositoryGateway gateway,
      ChangeDescriptorCodec codec,
      @Nullable MeterRegistry meterRegistry) {
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.codec = Objects.requireNonNull(codec, "codec");
    MeterRegistry registry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
    this.skippedCounter = registry.counter("catalog_submission_foreign_pull_requests_total");
  }

  /**
   * Lazily decodes every pull request. The stream wraps a paged remote iterator: close it, and do
   * not expect a second call to see the same results.
   */
  public Stream<ChangeDescriptor> listFor(Optional<String> user) {
    Objects.requireNonNull(user, "user");
    return gateway
        .listPullRequests()
        .flatMap(pullRequest -> decode(pullRequest).stream())
        .filter(descriptor -> user.map(descriptor.user()::equals).orElse(true));
  }

  private Optional<ChangeDescriptor> decode(PullRequestSnapshot pullRequest) {
    try {
      return Optional.of(
          codec.decode(
              pullRequest.body(),
              SubmissionStatus.resolve(pullRequest.rawState(), pullRequest.mergedAt()),
              pullRequest.htmlUrl(),
              pullRequest.createdAt()));
    } catch (DescriptorDecodeException ex) {
      skippedCounter.increment();
      log.info(
          "Ignoring pull request #{} without a change descriptor: {}",
          pullRequest.number(),
          ex.getMessage());
      return Optional.empty();
    }
  }
}

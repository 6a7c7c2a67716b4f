package com.opensciencecatalog.backend.submission;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

/**
 * Turns a change into a branch, at most one file write, at most one file delete and a pull request
 * into the main branch. Nothing is rolled back on failure: a branch that was already created stays
 * behind and is reported in the failure log so it can be removed out of band.
 */
@Service
public class SubmissionOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(SubmissionOrchestrator.class);

  private final CatalogRepositoryGateway gateway;
  private final BranchAllocator branchAllocator;
  private final ContentLocator contentLocator;
  private final Counter successCounter;
  private final Counter failureCounter;

  public SubmissionOrchestrator(
      CatalogRepositoryGateway gateway,
      BranchAllocator branchAllocator,
      ContentLocator contentLocator,
      @Nullable MeterRegistry meterRegistry) {
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.branchAllocator = Objects.requireNonNull(branchAllocator, "branchAllocator");
    this.contentLocator = Objects.requireNonNull(contentLocator, "contentLocator");
    MeterRegistry registry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
    this.successCounter = registry.counter("catalog_submission_success_total");
    this.failureCounter = registry.counter("catalog_submission_failure_total");
  }

  public SubmissionReceipt submit(SubmissionRequest request) {
    Objects.requireNonNull(request, "request");
    log.info(
        "catalog.submission.start title='{}' create={} delete={}",
        request.title(),
        request.fileToCreate() != null ? request.fileToCreate().path() : null,
        request.fileToDelete());

    String branch = null;
    try {
      branch = branchAllocator.allocate(request.branchBaseName());

      if (request.fileToCreate() != null) {
        String path = request.fileToCreate().path();
        ContentToken expected = contentLocator.locate(path);
        gateway.writeFile(
            branch,
            path,
            request.fileToCreate().content(),
            expected,
            "Add " + path + " for pull request submission");
      }

      if (request.fileToDelete() != null) {
        String path = request.fileToDelete();
        ContentToken expected = contentLocator.locate(path);
        if (!(expected instanceof ContentToken.Existing existing)) {
          throw new ContentConflictException(
              path, "Cannot delete " + path + ": it does not exist on " + gateway.mainBranch());
        }
        gateway.deleteFile(branch, path, existing, "Delete " + path + " for pull request submission");
      }

      PullRequestRef pullRequest =
          gateway.createPullRequest(branch, gateway.mainBranch(), request.title(), request.body());
      if (!request.labels().isEmpty()) {
        gateway.setLabels(pullRequest.number(), request.labels());
      }

      successCounter.increment();
      log.info(
          "catalog.submission.open_pull_request success branch={} pr={} url={}",
          branch,
          pullRequest.number(),
          pullRequest.htmlUrl());
      return new SubmissionReceipt(branch, pullRequest.number(), pullRequest.htmlUrl());
    } catch (RuntimeException ex) {
      failureCounter.increment();
      if (branch != null) {
        log.warn(
            "catalog.submission.failed branch={} left in place for cleanup: {}",
            branch,
            ex.getMessage());
      } else {
        log.warn("catalog.submission.failed before a branch was created: {}", ex.getMessage());
      }
      throw ex;
    }
  }
}

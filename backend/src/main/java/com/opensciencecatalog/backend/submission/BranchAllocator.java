package com.opensciencecatalog.backend.submission;

import com.opensciencecatalog.backend.config.GitHubBackendProperties;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Creates a fresh branch off the main branch tip. Taken names are retried as {@code base-2},
 * {@code base-3}, ... up to the configured retry bound.
 */
@Component
public class BranchAllocator {

  private static final Logger log = LoggerFactory.getLogger(BranchAllocator.class);

  private final CatalogRepositoryGateway gateway;
  private final GitHubBackendProperties properties;

  public BranchAllocator(CatalogRepositoryGateway gateway, GitHubBackendProperties properties) {
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  public String allocate(String baseName) {
    if (!StringUtils.hasText(baseName)) {
      throw new InvalidSubmissionException("Branch base name must not be blank");
    }
    String base = baseName.trim();
    String tipSha = gateway.mainBranchTip();
    int maxAttempts = Math.max(0, properties.getBranchMaxRetries()) + 1;

    for (int suffix = 1; suffix <= maxAttempts; suffix++) {
      String candidate = suffix == 1 ? base : base + "-" + suffix;
      try {
        gateway.createBranch(candidate, tipSha);
        log.info(
            "catalog.submission.create_branch success branch={} sourceSha={} attempt={}",
            candidate,
            tipSha,
            suffix);
        return candidate;
      } catch (BranchAlreadyExistsException ex) {
        log.debug("Branch {} is taken, trying next suffix", candidate);
      }
    }
    throw new BranchAllocationExhaustedException(base, maxAttempts);
  }
}

package com.opensciencecatalog.backend.submission;

public class BranchAllocationExhaustedException extends RuntimeException {

  private final String baseName;
  private final int attempts;

  public BranchAllocationExhaustedException(String baseName, int attempts) {
    super(
        "Could not allocate a branch for '%s' after %d attempts; every candidate name was taken"
            .formatted(baseName, attempts));
    this.baseName = baseName;
    this.attempts = attempts;
  }

  public String getBaseName() {
    return baseName;
  }

  public int getAttempts() {
    return attempts;
  }
}

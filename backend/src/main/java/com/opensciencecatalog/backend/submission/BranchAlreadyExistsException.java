package com.opensciencecatalog.backend.submission;

/** Raised by the gateway when a branch name is already taken. */
public class BranchAlreadyExistsException extends RuntimeException {

  private final String branchName;

  public BranchAlreadyExistsException(String branchName, Throwable cause) {
    super("Branch " + branchName + " already exists", cause);
    this.branchName = branchName;
  }

  public String getBranchName() {
    return branchName;
  }
}

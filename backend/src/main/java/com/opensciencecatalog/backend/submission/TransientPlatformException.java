package com.opensciencecatalog.backend.submission;

/** The hosting platform could not be reached or failed the call. */
public class TransientPlatformException extends RuntimeException {

  private final String operation;
  private final String target;

  public TransientPlatformException(String operation, String target, String message, Throwable cause) {
    super(message, cause);
    this.operation = operation;
    this.target = target;
  }

  public String getOperation() {
    return operation;
  }

  public String getTarget() {
    return target;
  }
}

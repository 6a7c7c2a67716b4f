package com.opensciencecatalog.backend.submission;

/**
 * A conditional write or delete was rejected because the path no longer holds the expected
 * content. Recomputing the token and resubmitting is up to the caller.
 */
public class ContentConflictException extends RuntimeException {

  private final String path;

  public ContentConflictException(String path, String message) {
    super(message);
    this.path = path;
  }

  public ContentConflictException(String path, String message, Throwable cause) {
    super(message, cause);
    this.path = path;
  }

  public String getPath() {
    return path;
  }
}

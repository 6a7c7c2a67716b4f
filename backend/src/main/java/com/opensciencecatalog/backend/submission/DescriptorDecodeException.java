package com.opensciencecatalog.backend.submission;

/** A pull request body that does not carry a change descriptor. */
public class DescriptorDecodeException extends RuntimeException {

  public DescriptorDecodeException(String message) {
    super(message);
  }

  public DescriptorDecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}

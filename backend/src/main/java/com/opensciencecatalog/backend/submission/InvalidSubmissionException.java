package com.opensciencecatalog.backend.submission;

public class InvalidSubmissionException extends RuntimeException {

  public InvalidSubmissionException(String message) {
    super(message);
  }
}

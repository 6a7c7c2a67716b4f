package com.opensciencecatalog.backend.common.exception;

import com.opensciencecatalog.backend.submission.BranchAllocationExhaustedException;
import com.opensciencecatalog.backend.submission.ContentConflictException;
import com.opensciencecatalog.backend.submission.InvalidSubmissionException;
import com.opensciencecatalog.backend.submission.TransientPlatformException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleUnexpectedException(Exception ex) {
    log.error("Unhandled exception", ex);
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Unexpected error");
    problem.setDetail("An unexpected error occurred. Please retry the request later.");
    return ResponseEntity.internalServerError().body(problem);
  }

  @ExceptionHandler({
    InvalidSubmissionException.class,
    MissingServletRequestParameterException.class,
    MethodArgumentTypeMismatchException.class,
    HttpMessageNotReadableException.class
  })
  public ResponseEntity<ProblemDetail> handleInvalidInput(Exception ex) {
    return problem(HttpStatus.BAD_REQUEST, "Invalid request", ex.getMessage());
  }

  @ExceptionHandler(ContentConflictException.class)
  public ResponseEntity<ProblemDetail> handleContentConflict(ContentConflictException ex) {
    log.info("Submission conflict on {}: {}", ex.getPath(), ex.getMessage());
    ResponseEntity<ProblemDetail> response =
        problem(HttpStatus.CONFLICT, "Content changed concurrently", ex.getMessage());
    response.getBody().setProperty("path", ex.getPath());
    return response;
  }

  @ExceptionHandler(BranchAllocationExhaustedException.class)
  public ResponseEntity<ProblemDetail> handleBranchAllocationExhausted(
      BranchAllocationExhaustedException ex) {
    log.warn(
        "Branch allocation exhausted for {} after {} attempts", ex.getBaseName(), ex.getAttempts());
    return problem(HttpStatus.CONFLICT, "No free branch name", ex.getMessage());
  }

  @ExceptionHandler(TransientPlatformException.class)
  public ResponseEntity<ProblemDetail> handleTransientPlatformError(TransientPlatformException ex) {
    log.warn(
        "Repository platform failure operation={} target={}", ex.getOperation(), ex.getTarget(), ex);
    ResponseEntity<ProblemDetail> response =
        problem(HttpStatus.BAD_GATEWAY, "Repository platform unavailable", ex.getMessage());
    response.getBody().setProperty("operation", ex.getOperation());
    return response;
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ProblemDetail> handleResponseStatusException(ResponseStatusException ex) {
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }

  private static ResponseEntity<ProblemDetail> problem(HttpStatus status, String title, String detail) {
    ProblemDetail problem = ProblemDetail.forStatus(status);
    problem.setTitle(title);
    problem.setDetail(detail);
    return ResponseEntity.status(status).body(problem);
  }
}

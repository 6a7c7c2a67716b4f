package com.opensciencecatalog.backend.github;

import com.opensciencecatalog.backend.submission.TransientPlatformException;
import java.io.IOException;
import java.util.Objects;
import org.kohsuke.github.GitHub;
import org.kohsuke.github.HttpException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs one GitHub call with a freshly authenticated client. I/O failures that the call does not
 * translate itself become {@link TransientPlatformException} naming the operation and target.
 */
@Component
class GitHubClientExecutor {

  private static final Logger log = LoggerFactory.getLogger(GitHubClientExecutor.class);
  private static final int MAX_ERROR_DETAIL = 300;

  private final GitHubClientFactory clientFactory;
  private final GitHubTokenManager tokenManager;

  GitHubClientExecutor(GitHubClientFactory clientFactory, GitHubTokenManager tokenManager) {
    this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
    this.tokenManager = Objects.requireNonNull(tokenManager, "tokenManager");
  }

  <T> T execute(String operation, String target, GitHubCall<T> call) {
    Objects.requireNonNull(call, "call");
    try {
      GitHub client = clientFactory.createTokenClient(tokenManager.currentToken());
      return call.apply(client);
    } catch (IOException ex) {
      log.warn("github.call.failed operation={} target={}: {}", operation, target, ex.getMessage());
      throw failure(operation, target, ex);
    }
  }

  static TransientPlatformException failure(String operation, String target, IOException cause) {
    StringBuilder message =
        new StringBuilder("GitHub call ").append(operation).append(" failed for ").append(target);
    if (cause instanceof HttpException httpException && httpException.getResponseCode() > 0) {
      message.append(" (status ").append(httpException.getResponseCode()).append(")");
    } else if (cause.getMessage() != null) {
      String detail = cause.getMessage();
      if (detail.length() > MAX_ERROR_DETAIL) {
        detail = detail.substring(0, MAX_ERROR_DETAIL) + "...";
      }
      message.append(": ").append(detail);
    }
    return new TransientPlatformException(operation, target, message.toString(), cause);
  }

  @FunctionalInterface
  interface GitHubCall<T> {
    T apply(GitHub github) throws IOException;
  }
}

package com.opensciencecatalog.backend.submission;

/** A slash-separated file path split into its parent directory and final segment. */
record RepositoryPath(String parent, String name) {

  static RepositoryPath parse(String path) {
    if (path == null) {
      throw new InvalidSubmissionException("Path must not be null");
    }
    String normalized = path.strip();
    while (normalized.startsWith("/")) {
      normalized = normalized.substring(1);
    }
    while (normalized.endsWith("/")) {
      normalized = normalized.substring(0, normalized.length() - 1);
    }
    if (normalized.isEmpty()) {
      throw new InvalidSubmissionException("Path must not be blank");
    }
    int separator = normalized.lastIndexOf('/');
    if (separator < 0) {
      return new RepositoryPath("", normalized);
    }
    return new RepositoryPath(normalized.substring(0, separator), normalized.substring(separator + 1));
  }
}

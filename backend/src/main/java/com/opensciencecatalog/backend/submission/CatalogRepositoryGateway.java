package com.opensciencecatalog.backend.submission;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Operations the submission workflow needs from the repository-hosting platform. Every method is
 * a blocking remote call; I/O failures surface as {@link TransientPlatformException}.
 */
public interface CatalogRepositoryGateway {

  String mainBranch();

  /** Commit sha at the tip of the main branch. */
  String mainBranchTip();

  /**
   * Creates {@code name} pointing at {@code fromSha}.
   *
   * @throws BranchAlreadyExistsException when the name is taken
   */
  void createBranch(String name, String fromSha);

  /** Children of {@code path} at {@code ref}, or empty when the directory does not exist. */
  Optional<List<DirectoryEntry>> listDirectory(String ref, String path);

  /**
   * Creates or replaces a file on {@code branch}.
   *
   * @throws ContentConflictException when {@code expected} no longer matches the stored content
   */
  void writeFile(String branch, String path, byte[] content, ContentToken expected, String message);

  /**
   * Removes a file from {@code branch}.
   *
   * @throws ContentConflictException when the stored content is not {@code expected}
   */
  void deleteFile(String branch, String path, ContentToken.Existing expected, String message);

  PullRequestRef createPullRequest(String branch, String base, String title, String body);

  void setLabels(int pullRequestNumber, Set<String> labels);

  /** Open and closed pull requests, fetched page by page as the stream is consumed. */
  Stream<PullRequestSnapshot> listPullRequests();
}

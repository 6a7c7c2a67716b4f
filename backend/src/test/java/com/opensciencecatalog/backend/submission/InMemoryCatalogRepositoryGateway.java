package com.opensciencecatalog.backend.submission;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/** Repository fake holding the main branch as a flat path → content map. */
class InMemoryCatalogRepositoryGateway implements CatalogRepositoryGateway {

  static final String MAIN = "main";
  static final String TIP_SHA = "0000000000000000000000000000000000000001";

  final Set<String> branches = new LinkedHashSet<>(List.of(MAIN));
  final List<String> createBranchAttempts = new ArrayList<>();
  final Map<String, StoredFile> mainFiles = new LinkedHashMap<>();
  final List<FileWrite> writes = new ArrayList<>();
  final List<FileDelete> deletes = new ArrayList<>();
  final List<PullRequestSnapshot> pullRequests = new ArrayList<>();
  final Map<Integer, Set<String>> labels = new LinkedHashMap<>();
  private final AtomicInteger shaSequence = new AtomicInteger();
  private final AtomicInteger pullRequestSequence = new AtomicInteger(100);

  boolean alwaysCollide;
  RuntimeException createBranchFailure;

  void commitToMain(String path, String content) {
    mainFiles.put(path, new StoredFile(content.getBytes(), "blob-" + shaSequence.incrementAndGet()));
  }

  String shaOf(String path) {
    return mainFiles.get(path).sha();
  }

  void addPullRequest(String body, String state, Instant mergedAt) {
    int number = pullRequestSequence.incrementAndGet();
    pullRequests.add(
        new PullRequestSnapshot(
            number,
            body,
            "https://github.example/catalog/pull/" + number,
            Instant.parse("2024-05-01T10:00:00Z"),
            state,
            mergedAt));
  }

  @Override
  public String mainBranch() {
    return MAIN;
  }

  @Override
  public String mainBranchTip() {
    return TIP_SHA;
  }

  @Override
  public void createBranch(String name, String fromSha) {
    createBranchAttempts.add(name);
    if (createBranchFailure != null) {
      throw createBranchFailure;
    }
    if (alwaysCollide || !branches.add(name)) {
      throw new BranchAlreadyExistsException(name, null);
    }
  }

  @Override
  public Optional<List<DirectoryEntry>> listDirectory(String ref, String path) {
    List<DirectoryEntry> entries = new ArrayList<>();
    String prefix = path.isEmpty() ? "" : path + "/";
    mainFiles.forEach(
        (filePath, file) -> {
          if (filePath.startsWith(prefix) && filePath.indexOf('/', prefix.length()) < 0) {
            entries.add(new DirectoryEntry(filePath.substring(prefix.length()), file.sha()));
          }
        });
    return entries.isEmpty() && !path.isEmpty() ? Optional.empty() : Optional.of(entries);
  }

  @Override
  public void writeFile(
      String branch, String path, byte[] content, ContentToken expected, String message) {
    StoredFile current = mainFiles.get(path);
    boolean matches =
        expected instanceof ContentToken.Existing existing
            ? current != null && current.sha().equals(existing.sha())
            : current == null;
    if (!matches) {
      throw new ContentConflictException(path, "stale token for " + path);
    }
    writes.add(new FileWrite(branch, path, content, expected, message));
  }

  @Override
  public void deleteFile(
      String branch, String path, ContentToken.Existing expected, String message) {
    StoredFile current = mainFiles.get(path);
    if (current == null || !current.sha().equals(expected.sha())) {
      throw new ContentConflictException(path, "stale token for " + path);
    }
    deletes.add(new FileDelete(branch, path, expected, message));
  }

  @Override
  public PullRequestRef createPullRequest(String branch, String base, String title, String body) {
    int number = pullRequestSequence.incrementAndGet();
    String url = "https://github.example/catalog/pull/" + number;
    pullRequests.add(new PullRequestSnapshot(number, body, url, Instant.now(), "open", null));
    return new PullRequestRef(number, url);
  }

  @Override
  public void setLabels(int pullRequestNumber, Set<String> labelNames) {
    labels.put(pullRequestNumber, Set.copyOf(labelNames));
  }

  @Override
  public Stream<PullRequestSnapshot> listPullRequests() {
    return List.copyOf(pullRequests).stream();
  }

  record StoredFile(byte[] content, String sha) {}

  record FileWrite(String branch, String path, byte[] content, ContentToken expected, String message) {}

  record FileDelete(String branch, String path, ContentToken.Existing expected, String message) {}
}

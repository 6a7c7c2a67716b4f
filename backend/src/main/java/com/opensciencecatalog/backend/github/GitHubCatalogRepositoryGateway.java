package com.opensciencecatalog.backend.github;

import com.opensciencecatalog.backend.config.GitHubBackendProperties;
import com.opensciencecatalog.backend.submission.BranchAlreadyExistsException;
import com.opensciencecatalog.backend.submission.CatalogRepositoryGateway;
import com.opensciencecatalog.backend.submission.ContentConflictException;
import com.opensciencecatalog.backend.submission.ContentToken;
import com.opensciencecatalog.backend.submission.DirectoryEntry;
import com.opensciencecatalog.backend.submission.PullRequestRef;
import com.opensciencecatalog.backend.submission.PullRequestSnapshot;
import java.io.IOException;
import java.net.URL;
import java.time.Instant;
import java.util.Date;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.kohsuke.github.GHContent;
import org.kohsuke.github.GHContentBuilder;
import org.kohsuke.github.GHException;
import org.kohsuke.github.GHFileNotFoundException;
import org.kohsuke.github.GHIssueState;
import org.kohsuke.github.GHPullRequest;
import org.kohsuke.github.GHRepository;
import org.kohsuke.github.GHTree;
import org.kohsuke.github.GitHub;
import org.kohsuke.github.HttpException;
import org.kohsuke.github.PagedIterable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/** {@link CatalogRepositoryGateway} backed by the GitHub REST API of the configured repository. */
@Component
class GitHubCatalogRepositoryGateway implements CatalogRepositoryGateway {

  private static final Logger log = LoggerFactory.getLogger(GitHubCatalogRepositoryGateway.class);
  private static final int PULL_REQUEST_PAGE_SIZE = 100;

  private final GitHubClientExecutor executor;
  private final GitHubBackendProperties properties;

  GitHubCatalogRepositoryGateway(GitHubClientExecutor executor, GitHubBackendProperties properties) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  @Override
  public String mainBranch() {
    return properties.getMainBranch().trim();
  }

  @Override
  public String mainBranchTip() {
    String branch = mainBranch();
    return executor.execute(
        "get_branch_tip",
        branch,
        github -> repository(github).getRef("heads/" + branch).getObject().getSha());
  }

  @Override
  public void createBranch(String name, String fromSha) {
    executor.execute(
        "create_branch",
        name,
        github -> {
          try {
            repository(github).createRef("refs/heads/" + name, fromSha);
            return null;
          } catch (HttpException ex) {
            // GitHub answers 422 "Reference already exists"; some proxies turn it into 409
            if (ex.getResponseCode() == 422 || ex.getResponseCode() == 409) {
              throw new BranchAlreadyExistsException(name, ex);
            }
            throw ex;
          }
        });
  }

  @Override
  public Optional<List<DirectoryEntry>> listDirectory(String ref, String path) {
    String treeRef = StringUtils.hasText(path) ? ref + ":" + path : ref;
    return executor.execute(
        "list_directory",
        treeRef,
        github -> {
          try {
            // the client percent-encodes the ref itself
            GHTree tree = repository(github).getTree(treeRef);
            return Optional.of(
                tree.getTree().stream()
                    .map(entry -> new DirectoryEntry(entry.getPath(), entry.getSha()))
                    .toList());
          } catch (GHFileNotFoundException ex) {
            log.debug("No tree found for {}", treeRef);
            return Optional.empty();
          } catch (HttpException ex) {
            if (ex.getResponseCode() == 404) {
              log.debug("No tree found for {}", treeRef);
              return Optional.empty();
            }
            throw ex;
          }
        });
  }

  @Override
  public void writeFile(
      String branch, String path, byte[] content, ContentToken expected, String message) {
    Objects.requireNonNull(expected, "expected");
    executor.execute(
        "write_file",
        branch + ":" + path,
        github -> {
          GHContentBuilder builder =
              repository(github)
                  .createContent()
                  .path(path)
                  .content(content)
                  .message(message)
                  .branch(branch);
          if (expected instanceof ContentToken.Existing existing) {
            builder.sha(existing.sha());
          }
          try {
            builder.commit();
          } catch (HttpException ex) {
            if (isConflict(ex)) {
              throw new ContentConflictException(
                  path, "Content of " + path + " changed since it was read", ex);
            }
            throw ex;
          }
          log.info(
              "github.write.file success branch={} path={} update={}",
              branch,
              path,
              expected instanceof ContentToken.Existing);
          return null;
        });
  }

  @Override
  public void deleteFile(
      String branch, String path, ContentToken.Existing expected, String message) {
    Objects.requireNonNull(expected, "expected");
    executor.execute(
        "delete_file",
        branch + ":" + path,
        github -> {
          try {
            GHContent current = repository(github).getFileContent(path, branch);
            if (!expected.sha().equals(current.getSha())) {
              throw new ContentConflictException(
                  path, "Content of " + path + " changed since it was read");
            }
            current.delete(message, branch);
          } catch (GHFileNotFoundException ex) {
            throw new ContentConflictException(path, path + " no longer exists on " + branch, ex);
          } catch (HttpException ex) {
            if (isConflict(ex) || ex.getResponseCode() == 404) {
              throw new ContentConflictException(
                  path, "Content of " + path + " changed since it was read", ex);
            }
            throw ex;
          }
          log.info("github.write.delete_file success branch={} path={}", branch, path);
          return null;
        });
  }

  @Override
  public PullRequestRef createPullRequest(String branch, String base, String title, String body) {
    return executor.execute(
        "create_pull_request",
        branch,
        github -> {
          GHPullRequest pullRequest =
              repository(github).createPullRequest(title, branch, base, body, true);
          return new PullRequestRef(pullRequest.getNumber(), toExternalForm(pullRequest.getHtmlUrl()));
        });
  }

  @Override
  public void setLabels(int pullRequestNumber, Set<String> labels) {
    executor.execute(
        "set_labels",
        "#" + pullRequestNumber,
        github -> {
          repository(github).getPullRequest(pullRequestNumber).setLabels(labels.toArray(String[]::new));
          return null;
        });
  }

  @Override
  public Stream<PullRequestSnapshot> listPullRequests() {
    String target = properties.requireRepository();
    PagedIterable<GHPullRequest> pages =
        executor.execute(
            "list_pull_requests",
            target,
            github ->
                repository(github)
                    .queryPullRequests()
                    .state(GHIssueState.ALL)
                    .list()
                    .withPageSize(PULL_REQUEST_PAGE_SIZE));
    Iterator<GHPullRequest> iterator = new PlatformIterator<>(pages.iterator(), target);
    return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
            false)
        .map(pullRequest -> toSnapshot(pullRequest, target));
  }

  private GHRepository repository(GitHub github) throws IOException {
    return github.getRepository(properties.requireRepository());
  }

  private PullRequestSnapshot toSnapshot(GHPullRequest pullRequest, String target) {
    try {
      return new PullRequestSnapshot(
          pullRequest.getNumber(),
          pullRequest.getBody(),
          toExternalForm(pullRequest.getHtmlUrl()),
          toInstant(pullRequest.getCreatedAt()),
          pullRequest.getState() != null ? pullRequest.getState().name().toLowerCase(Locale.ROOT) : null,
          toInstant(pullRequest.getMergedAt()));
    } catch (IOException ex) {
      throw GitHubClientExecutor.failure("list_pull_requests", target, ex);
    }
  }

  private static boolean isConflict(HttpException ex) {
    // 409: sha does not match; 422: sha missing for a file that now exists
    return ex.getResponseCode() == 409 || ex.getResponseCode() == 422;
  }

  private static Instant toInstant(Date date) {
    return date != null ? date.toInstant() : null;
  }

  private static String toExternalForm(URL url) {
    return url != null ? url.toExternalForm() : null;
  }

  /** Rethrows paging failures, which the GitHub client reports unchecked, as platform errors. */
  private static final class PlatformIterator<T> implements Iterator<T> {

    private final Iterator<T> delegate;
    private final String target;

    PlatformIterator(Iterator<T> delegate, String target) {
      this.delegate = delegate;
      this.target = target;
    }

    @Override
    public boolean hasNext() {
      try {
        return delegate.hasNext();
      } catch (GHException ex) {
        throw failure(ex);
      }
    }

    @Override
    public T next() {
      try {
        return delegate.next();
      } catch (GHException ex) {
        throw failure(ex);
      }
    }

    private RuntimeException failure(GHException ex) {
      if (ex.getCause() instanceof IOException io) {
        return GitHubClientExecutor.failure("list_pull_requests", target, io);
      }
      return GitHubClientExecutor.failure("list_pull_requests", target, new IOException(ex.getMessage(), ex));
    }
  }
}

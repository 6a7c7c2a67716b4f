package com.opensciencecatalog.backend.submission;

import java.util.Arrays;
import java.util.Objects;
import java.util.Set;
import org.springframework.lang.Nullable;

/**
 * Input of {@link SubmissionOrchestrator#submit}. Either file operation may be absent; with
 * neither, the pull request carries no changes.
 */
public record SubmissionRequest(
    String branchBaseName,
    String title,
    String body,
    @Nullable FileToCreate fileToCreate,
    @Nullable String fileToDelete,
    Set<String> labels) {

  public SubmissionRequest {
    Objects.requireNonNull(title, "title");
    Objects.requireNonNull(body, "body");
    labels = labels == null ? Set.of() : Set.copyOf(labels);
  }

  public record FileToCreate(String path, byte[] content) {

    public FileToCreate {
      Objects.requireNonNull(path, "path");
      content = content == null ? new byte[0] : content.clone();
    }

    @Override
    public byte[] content() {
      return content.clone();
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof FileToCreate that
          && path.equals(that.path)
          && Arrays.equals(content, that.content);
    }

    @Override
    public int hashCode() {
      return 31 * path.hashCode() + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
      return "FileToCreate[path=" + path + ", bytes=" + content.length + "]";
    }
  }
}

package com.opensciencecatalog.backend.submission;

import java.util.Objects;

/**
 * Expected prior content of a path, used as the optimistic-concurrency precondition of a write or
 * delete.
 */
public interface ContentToken {

  static ContentToken newFile() {
    return NewFile.INSTANCE;
  }

  static ContentToken existing(String sha) {
    return new Existing(sha);
  }

  /** Nothing is stored at the path yet. */
  record NewFile() implements ContentToken {
    static final NewFile INSTANCE = new NewFile();
  }

  /** The path currently holds the blob with this sha. */
  record Existing(String sha) implements ContentToken {
    public Existing {
      Objects.requireNonNull(sha, "sha");
      if (sha.isBlank()) {
        throw new IllegalArgumentException("sha must not be blank");
      }
    }
  }
}

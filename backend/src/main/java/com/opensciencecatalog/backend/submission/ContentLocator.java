package com.opensciencecatalog.backend.submission;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Resolves the blob sha currently stored at a path on the main branch. */
@Component
public class ContentLocator {

  private static final Logger log = LoggerFactory.getLogger(ContentLocator.class);

  private final CatalogRepositoryGateway gateway;

  public ContentLocator(CatalogRepositoryGateway gateway) {
    this.gateway = Objects.requireNonNull(gateway, "gateway");
  }

  public ContentToken locate(String path) {
    RepositoryPath repositoryPath = RepositoryPath.parse(path);
    Optional<List<DirectoryEntry>> listing =
        gateway.listDirectory(gateway.mainBranch(), repositoryPath.parent());
    if (listing.isEmpty()) {
      log.debug("Directory '{}' does not exist, {} is a new file", repositoryPath.parent(), path);
      return ContentToken.newFile();
    }
    return listing.get().stream()
        .filter(entry -> repositoryPath.name().equals(entry.name()))
        .findFirst()
        .map(entry -> ContentToken.existing(entry.sha()))
        .orElseGet(ContentToken::newFile);
  }
}

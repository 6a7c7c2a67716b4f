package com.opensciencecatalog.backend.submission;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ContentLocatorTest {

  private InMemoryCatalogRepositoryGateway gateway;
  private ContentLocator locator;

  @BeforeEach
  void setUp() {
    gateway = new InMemoryCatalogRepositoryGateway();
    locator = new ContentLocator(gateway);
  }

  @Test
  void missingParentDirectoryMeansNewFile() {
    assertThat(locator.locate("alice/foo.json")).isEqualTo(ContentToken.newFile());
  }

  @Test
  void committedFileYieldsItsBlobSha() {
    gateway.commitToMain("alice/foo.json", "{}");

    ContentToken token = locator.locate("alice/foo.json");

    assertThat(token).isInstanceOf(ContentToken.Existing.class);
    assertThat(((ContentToken.Existing) token).sha()).isEqualTo(gateway.shaOf("alice/foo.json"));
  }

  @Test
  void siblingWithDifferentNameDoesNotMatch() {
    gateway.commitToMain("alice/bar.json", "{}");
    gateway.commitToMain("alice/foo.json.bak", "{}");

    assertThat(locator.locate("alice/foo.json")).isEqualTo(ContentToken.newFile());
  }

  @Test
  void rootLevelFileListsRootDirectory() {
    gateway.commitToMain("README.md", "# catalog");

    assertThat(locator.locate("README.md")).isEqualTo(ContentToken.existing(gateway.shaOf("README.md")));
  }
}

package com.opensciencecatalog.backend.config;

import java.time.Duration;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

@ConfigurationProperties(prefix = "github.backend")
public class GitHubBackendProperties implements InitializingBean {

  private String baseUrl = "https://api.github.com";
  private String personalAccessToken;
  private String appId;
  private Long installationId;
  private String privateKeyBase64;
  private Duration appJwtTtl = Duration.ofMinutes(8);
  private Duration tokenRefreshSkew = Duration.ofMinutes(1);
  private String repository;
  private String mainBranch = "main";
  private Duration connectTimeout = Duration.ofSeconds(10);
  private Duration readTimeout = Duration.ofSeconds(30);
  private int branchMaxRetries = 15;

  @Override
  public void afterPropertiesSet() {
    if (StringUtils.hasText(repository)) {
      String[] parts = repository.trim().split("/");
      if (parts.length != 2 || !StringUtils.hasText(parts[0]) || !StringUtils.hasText(parts[1])) {
        throw new IllegalStateException(
            "github.backend.repository must be in the form owner/name, got '" + repository + "'");
      }
    }
    if (!StringUtils.hasText(mainBranch)) {
      throw new IllegalStateException("github.backend.main-branch must not be blank");
    }
    if (branchMaxRetries < 0) {
      throw new IllegalStateException("github.backend.branch-max-retries must not be negative");
    }
  }

  /** Repository id as {@code owner/name}. */
  public String requireRepository() {
    if (!StringUtils.hasText(repository)) {
      throw new IllegalStateException("github.backend.repository must be configured");
    }
    return repository.trim();
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public String getPersonalAccessToken() {
    return personalAccessToken;
  }

  public void setPersonalAccessToken(String personalAccessToken) {
    this.personalAccessToken = personalAccessToken;
  }

  public String getAppId() {
    return appId;
  }

  public void setAppId(String appId) {
    this.appId = appId;
  }

  public Long getInstallationId() {
    return installationId;
  }

  public void setInstallationId(Long installationId) {
    this.installationId = installationId;
  }

  public String getPrivateKeyBase64() {
    return privateKeyBase64;
  }

  public void setPrivateKeyBase64(String privateKeyBase64) {
    this.privateKeyBase64 = privateKeyBase64;
  }

  public Duration getAppJwtTtl() {
    return appJwtTtl;
  }

  public void setAppJwtTtl(Duration appJwtTtl) {
    this.appJwtTtl = appJwtTtl;
  }

  public Duration getTokenRefreshSkew() {
    return tokenRefreshSkew;
  }

  public void setTokenRefreshSkew(Duration tokenRefreshSkew) {
    this.tokenRefreshSkew = tokenRefreshSkew;
  }

  public String getRepository() {
    return repository;
  }

  public void setRepository(String repository) {
    this.repository = repository;
  }

  public String getMainBranch() {
    return mainBranch;
  }

  public void setMainBranch(String mainBranch) {
    this.mainBranch = mainBranch;
  }

  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  public void setConnectTimeout(Duration connectTimeout) {
    this.connectTimeout = connectTimeout;
  }

  public Duration getReadTimeout() {
    return readTimeout;
  }

  public void setReadTimeout(Duration readTimeout) {
    this.readTimeout = readTimeout;
  }

  public int getBranchMaxRetries() {
    return branchMaxRetries;
  }

  public void setBranchMaxRetries(int branchMaxRetries) {
    this.branchMaxRetries = branchMaxRetries;
  }
}

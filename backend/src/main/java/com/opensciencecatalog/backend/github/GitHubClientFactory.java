package com.opensciencecatalog.backend.github;

import com.opensciencecatalog.backend.config.GitHubBackendProperties;
import java.io.IOException;
import java.net.HttpURLConnection;
import java.net.URL;
import java.time.Duration;
import java.util.Objects;
import org.kohsuke.github.AbuseLimitHandler;
import org.kohsuke.github.GitHub;
import org.kohsuke.github.GitHubBuilder;
import org.kohsuke.github.HttpConnector;
import org.kohsuke.github.RateLimitHandler;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
class GitHubClientFactory {

  private final GitHubBackendProperties properties;
  private final HttpConnector connector;

  GitHubClientFactory(GitHubBackendProperties properties) {
    this.properties = Objects.requireNonNull(properties, "properties");
    this.connector =
        new TimeoutHttpConnector(
            orDefault(properties.getConnectTimeout(), Duration.ofSeconds(10)),
            orDefault(properties.getReadTimeout(), Duration.ofSeconds(30)));
  }

  /** Client authenticated with a personal access token or an installation token. */
  GitHub createTokenClient(String token) throws IOException {
    if (!StringUtils.hasText(token)) {
      throw new IllegalArgumentException("token must not be blank");
    }
    return configure(new GitHubBuilder()).withOAuthToken(token.trim()).build();
  }

  GitHub createAppClient(String jwtToken) throws IOException {
    if (!StringUtils.hasText(jwtToken)) {
      throw new IllegalArgumentException("jwtToken must not be blank");
    }
    return configure(new GitHubBuilder()).withJwtToken(jwtToken.trim()).build();
  }

  /** Rate and abuse limits fail the call; the client never sleeps on them. */
  private GitHubBuilder configure(GitHubBuilder builder) {
    builder.withConnector(connector);
    builder.withRateLimitHandler(RateLimitHandler.FAIL);
    builder.withAbuseLimitHandler(AbuseLimitHandler.FAIL);
    if (StringUtils.hasText(properties.getBaseUrl())) {
      builder.withEndpoint(properties.getBaseUrl().trim());
    }
    return builder;
  }

  private static Duration orDefault(Duration value, Duration fallback) {
    return value != null && !value.isNegative() && !value.isZero() ? value : fallback;
  }

  /** Applies the configured timeouts to every connection the GitHub client opens. */
  private static final class TimeoutHttpConnector implements HttpConnector {

    private final int connectTimeoutMillis;
    private final int readTimeoutMillis;

    TimeoutHttpConnector(Duration connectTimeout, Duration readTimeout) {
      this.connectTimeoutMillis = (int) Math.min(Integer.MAX_VALUE, connectTimeout.toMillis());
      this.readTimeoutMillis = (int) Math.min(Integer.MAX_VALUE, readTimeout.toMillis());
    }

    @Override
    public HttpURLConnection connect(URL url) throws IOException {
      HttpURLConnection connection = (HttpURLConnection) url.openConnection();
      connection.setConnectTimeout(connectTimeoutMillis);
      connection.setReadTimeout(readTimeoutMillis);
      return connection;
    }
  }
}

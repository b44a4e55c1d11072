package com.policyguard.backend.github;

import com.policyguard.backend.config.GitHubAppProperties;
import java.io.IOException;
import java.util.Objects;
import org.kohsuke.github.AbuseLimitHandler;
import org.kohsuke.github.GitHub;
import org.kohsuke.github.GitHubBuilder;
import org.kohsuke.github.RateLimitHandler;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
class GitHubClientFactory {

  private final GitHubAppProperties properties;

  GitHubClientFactory(GitHubAppProperties properties) {
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  GitHub createTokenClient(String accessToken) throws IOException {
    if (!StringUtils.hasText(accessToken)) {
      throw new IllegalArgumentException("accessToken must not be blank");
    }
    return configure(newBuilder()).withOAuthToken(accessToken.trim()).build();
  }

  GitHub createAppClient(String jwtToken) throws IOException {
    if (!StringUtils.hasText(jwtToken)) {
      throw new IllegalArgumentException("jwtToken must not be blank");
    }
    return configure(newBuilder()).withJwtToken(jwtToken.trim()).build();
  }

  private GitHubBuilder newBuilder() {
    return new GitHubBuilder();
  }

  // Rate limits surface as HttpException so callers decide about retries.
  private GitHubBuilder configure(GitHubBuilder builder) {
    builder.withRateLimitHandler(RateLimitHandler.FAIL);
    builder.withAbuseLimitHandler(AbuseLimitHandler.FAIL);
    if (StringUtils.hasText(properties.getBaseUrl())) {
      builder.withEndpoint(properties.getBaseUrl().trim());
    }
    return builder;
  }
}

package com.policyguard.backend.github;

import java.io.IOException;
import java.util.Objects;
import org.kohsuke.github.GitHub;
import org.springframework.stereotype.Component;

/**
 * Runs an operation against an installation-authenticated client. Calls are refused once the
 * calling thread has been interrupted so a cancelled scan stops issuing remote requests.
 */
@Component
class GitHubClientExecutor {

  private final GitHubClientFactory clientFactory;
  private final GitHubTokenManager tokenManager;

  GitHubClientExecutor(GitHubClientFactory clientFactory, GitHubTokenManager tokenManager) {
    this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
    this.tokenManager = Objects.requireNonNull(tokenManager, "tokenManager");
  }

  <T> T execute(String description, GitHubCall<T> operation) {
    Objects.requireNonNull(operation, "operation");
    ensureNotCancelled(description);
    String token = tokenManager.getServiceToken();
    try {
      GitHub client = clientFactory.createTokenClient(token);
      return operation.apply(client);
    } catch (IOException ex) {
      throw GitHubClientException.from("Failed to " + description, ex);
    }
  }

  void executeVoid(String description, GitHubVoidCall operation) {
    execute(
        description,
        gh -> {
          operation.accept(gh);
          return null;
        });
  }

  static void ensureNotCancelled(String description) {
    if (Thread.currentThread().isInterrupted()) {
      throw new GitHubClientException(
          "Cancelled before attempting to " + description, GitHubErrorKind.CANCELLED, -1);
    }
  }

  @FunctionalInterface
  interface GitHubCall<T> {
    T apply(GitHub github) throws IOException;
  }

  @FunctionalInterface
  interface GitHubVoidCall {
    void accept(GitHub github) throws IOException;
  }
}

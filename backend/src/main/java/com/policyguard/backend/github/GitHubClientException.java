package com.policyguard.backend.github;

import java.io.IOException;
import java.io.InterruptedIOException;
import org.kohsuke.github.GHFileNotFoundException;
import org.kohsuke.github.HttpException;

/** Typed failure of a GitHub API call. Absence is never reported through this type by reads. */
public class GitHubClientException extends RuntimeException {

  private final GitHubErrorKind kind;
  private final int statusCode;

  public GitHubClientException(String message, GitHubErrorKind kind, int statusCode) {
    super(message);
    this.kind = kind;
    this.statusCode = statusCode;
  }

  public GitHubClientException(
      String message, GitHubErrorKind kind, int statusCode, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.statusCode = statusCode;
  }

  public GitHubErrorKind getKind() {
    return kind;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public boolean isNotFound() {
    return kind == GitHubErrorKind.NOT_FOUND;
  }

  static GitHubClientException from(String message, IOException cause) {
    if (cause instanceof GHFileNotFoundException) {
      return new GitHubClientException(message, GitHubErrorKind.NOT_FOUND, 404, cause);
    }
    if (cause instanceof HttpException httpException) {
      int status = httpException.getResponseCode();
      GitHubErrorKind kind = GitHubErrorKind.fromStatus(status, httpException.getMessage());
      return new GitHubClientException(
          message + " (status " + status + ")", kind, status, cause);
    }
    if (cause instanceof InterruptedIOException || Thread.currentThread().isInterrupted()) {
      return new GitHubClientException(message, GitHubErrorKind.CANCELLED, -1, cause);
    }
    return new GitHubClientException(message, GitHubErrorKind.TRANSPORT, -1, cause);
  }
}

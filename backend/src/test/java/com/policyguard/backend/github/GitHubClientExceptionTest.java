package com.policyguard.backend.github;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.InterruptedIOException;
import org.junit.jupiter.api.Test;
import org.kohsuke.github.GHFileNotFoundException;
import org.kohsuke.github.HttpException;

class GitHubClientExceptionTest {

  @Test
  void fileNotFoundIsClassifiedAsNotFound() {
    GitHubClientException ex =
        GitHubClientException.from("read AGENTS.md", new GHFileNotFoundException("Not Found"));

    assertThat(ex.isNotFound()).isTrue();
    assertThat(ex.getStatusCode()).isEqualTo(404);
  }

  @Test
  void forbiddenWithRateLimitMessageIsRateLimited() {
    HttpException cause =
        new HttpException(
            "{\"message\":\"API rate limit exceeded\"}", 403, "Forbidden", "https://api.github.com/x");

    assertThat(GitHubClientException.from("list repos", cause).getKind())
        .isEqualTo(GitHubErrorKind.RATE_LIMITED);
  }

  @Test
  void plainForbiddenStaysForbidden() {
    HttpException cause =
        new HttpException(
            "{\"message\":\"Must have admin rights\"}", 403, "Forbidden", "https://api.github.com/x");

    GitHubClientException ex = GitHubClientException.from("archive", cause);

    assertThat(ex.getKind()).isEqualTo(GitHubErrorKind.FORBIDDEN);
    assertThat(ex.getMessage()).contains("status 403");
  }

  @Test
  void unauthorizedAndServerErrorsAreDistinguished() {
    assertThat(GitHubErrorKind.fromStatus(401, "Bad credentials"))
        .isEqualTo(GitHubErrorKind.UNAUTHORIZED);
    assertThat(GitHubErrorKind.fromStatus(429, null)).isEqualTo(GitHubErrorKind.RATE_LIMITED);
    assertThat(GitHubErrorKind.fromStatus(502, "Bad gateway")).isEqualTo(GitHubErrorKind.OTHER);
  }

  @Test
  void interruptedIoIsCancelledAndOtherIoIsTransport() {
    assertThat(GitHubClientException.from("call", new InterruptedIOException()).getKind())
        .isEqualTo(GitHubErrorKind.CANCELLED);
    assertThat(GitHubClientException.from("call", new IOException("reset")).getKind())
        .isEqualTo(GitHubErrorKind.TRANSPORT);
  }
}

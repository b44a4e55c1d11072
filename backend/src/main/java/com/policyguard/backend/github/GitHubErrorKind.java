package com.policyguard.backend.github;

import java.util.Locale;

public enum GitHubErrorKind {
  UNAUTHORIZED,
  FORBIDDEN,
  NOT_FOUND,
  RATE_LIMITED,
  TRANSPORT,
  CANCELLED,
  OTHER;

  static GitHubErrorKind fromStatus(int status, String message) {
    if (status == 401) {
      return UNAUTHORIZED;
    }
    if (status == 403) {
      boolean rateLimited = message != null && message.toLowerCase(Locale.ROOT).contains("rate limit");
      return rateLimited ? RATE_LIMITED : FORBIDDEN;
    }
    if (status == 404) {
      return NOT_FOUND;
    }
    if (status == 429) {
      return RATE_LIMITED;
    }
    return OTHER;
  }
}

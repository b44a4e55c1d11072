package com.policyguard.backend.webhook;

/** What one pull request re-evaluation did. */
public record PullRequestEvaluation(int violations, int checksPublished, int commentsPosted) {

  static final PullRequestEvaluation SKIPPED = new PullRequestEvaluation(0, 0, 0);
}

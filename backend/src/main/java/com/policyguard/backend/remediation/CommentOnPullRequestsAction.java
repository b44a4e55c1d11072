package com.policyguard.backend.remediation;

import com.policyguard.backend.github.GitHubClientException;
import com.policyguard.backend.github.RemotePullRequest;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Posts the policy message on every open pull request that has not received it from a bot yet. */
@Component
class CommentOnPullRequestsAction implements RemediationAction {

  private static final Logger log = LoggerFactory.getLogger(CommentOnPullRequestsAction.class);

  private final PullRequestFeedback feedback;

  CommentOnPullRequestsAction(PullRequestFeedback feedback) {
    this.feedback = feedback;
  }

  @Override
  public String actionType() {
    return RemediationActionTypes.COMMENT_ON_PRS;
  }

  @Override
  public ActionResult apply(RemediationContext context) {
    String message =
        PullRequestFeedback.commentMessage(context.policyConfig(), context.policyName());
    try {
      List<RemotePullRequest> pullRequests =
          feedback.openPullRequests(context.githubRepositoryId());
      if (pullRequests.isEmpty()) {
        return ActionResult.skipped("No open pull requests");
      }
      int commented = 0;
      for (RemotePullRequest pullRequest : pullRequests) {
        if (feedback.commentOnce(context.githubRepositoryId(), pullRequest.number(), message)) {
          commented++;
        }
      }
      if (commented == 0) {
        return ActionResult.skipped(
            "All %d open pull requests already carry the comment".formatted(pullRequests.size()));
      }
      log.info(
          "Commented on {} pull request(s) in {} for policy '{}'",
          commented,
          context.repositoryName(),
          context.policyKey());
      return ActionResult.success(
          "Commented on %d of %d open pull requests".formatted(commented, pullRequests.size()));
    } catch (GitHubClientException ex) {
      log.warn(
          "Commenting on pull requests in {} failed: {}", context.repositoryName(), ex.getMessage());
      return ActionResult.failed(
          "Pull request comment failed (%s): %s".formatted(ex.getKind(), ex.getMessage()));
    }
  }
}

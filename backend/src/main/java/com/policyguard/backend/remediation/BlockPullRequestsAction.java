package com.policyguard.backend.remediation;

import com.policyguard.backend.github.GitHubClientException;
import com.policyguard.backend.github.RemotePullRequest;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Marks the head commit of every open pull request with a failing check run. Branch protection
 * that requires the check then blocks the merge. The pull request webhook flips the check back to
 * success once the repository complies.
 */
@Component
class BlockPullRequestsAction implements RemediationAction {

  private static final Logger log = LoggerFactory.getLogger(BlockPullRequestsAction.class);

  private final PullRequestFeedback feedback;

  BlockPullRequestsAction(PullRequestFeedback feedback) {
    this.feedback = feedback;
  }

  @Override
  public String actionType() {
    return RemediationActionTypes.BLOCK_PRS;
  }

  @Override
  public ActionResult apply(RemediationContext context) {
    String checkName = PullRequestFeedback.checkName(context.policyConfig());
    try {
      List<RemotePullRequest> pullRequests =
          feedback.openPullRequests(context.githubRepositoryId());
      if (pullRequests.isEmpty()) {
        return ActionResult.skipped("No open pull requests");
      }
      int created = 0;
      int updated = 0;
      for (RemotePullRequest pullRequest : pullRequests) {
        if (feedback.publishCheck(
            context.githubRepositoryId(), pullRequest.headSha(), checkName, false)) {
          created++;
        } else {
          updated++;
        }
      }
      log.info(
          "Blocked {} pull request(s) in {} with check '{}'",
          pullRequests.size(),
          context.repositoryName(),
          checkName);
      return ActionResult.success(
          "Check '%s' failing on %d pull requests (%d created, %d updated)"
              .formatted(checkName, pullRequests.size(), created, updated));
    } catch (GitHubClientException ex) {
      log.warn("Blocking pull requests in {} failed: {}", context.repositoryName(), ex.getMessage());
      return ActionResult.failed(
          "Status check update failed (%s): %s".formatted(ex.getKind(), ex.getMessage()));
    }
  }
}

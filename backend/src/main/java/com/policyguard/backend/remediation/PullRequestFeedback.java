package com.policyguard.backend.remediation;

import com.policyguard.backend.configuration.PolicyConfig;
import com.policyguard.backend.github.RemoteCheckRun;
import com.policyguard.backend.github.RemotePullRequest;
import com.policyguard.backend.github.RepositoryGateway;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Pull request side effects shared by the scan-time actions and webhook re-evaluation: the policy
 * comment and the compliance check run.
 */
@Component
public class PullRequestFeedback {

  public static final String DEFAULT_CHECK_NAME = "Policy Compliance Check";

  private final RepositoryGateway repositoryGateway;

  public PullRequestFeedback(RepositoryGateway repositoryGateway) {
    this.repositoryGateway = Objects.requireNonNull(repositoryGateway, "repositoryGateway");
  }

  public List<RemotePullRequest> openPullRequests(long githubRepositoryId) {
    return repositoryGateway.listOpenPullRequests(githubRepositoryId);
  }

  /**
   * Posts {@code message} unless a bot comment starting with it is already there.
   *
   * @return true when a comment was posted
   */
  public boolean commentOnce(long githubRepositoryId, int pullRequestNumber, String message) {
    boolean alreadyCommented =
        repositoryGateway.listPullRequestComments(githubRepositoryId, pullRequestNumber).stream()
            .anyMatch(
                comment ->
                    comment.isFromBot()
                        && comment.body() != null
                        && comment.body().startsWith(message));
    if (alreadyCommented) {
      return false;
    }
    repositoryGateway.commentOnPullRequest(githubRepositoryId, pullRequestNumber, message);
    return true;
  }

  /**
   * Sets the named check run on {@code headSha} to success or failure, reusing an existing run with
   * the same name.
   *
   * @return true when a new run was created, false when an existing one was updated
   */
  public boolean publishCheck(
      long githubRepositoryId, String headSha, String checkName, boolean passed) {
    Optional<RemoteCheckRun> existing =
        repositoryGateway.listCheckRuns(githubRepositoryId, headSha).stream()
            .filter(run -> checkName.equals(run.name()))
            .findFirst();
    if (existing.isPresent()) {
      repositoryGateway.updateCheckRun(githubRepositoryId, existing.get().id(), passed);
      return false;
    }
    repositoryGateway.createCheckRun(githubRepositoryId, headSha, checkName, passed);
    return true;
  }

  public static String checkName(Optional<PolicyConfig> policyConfig) {
    return policyConfig
        .map(PolicyConfig::blockPrsDetails)
        .map(PolicyConfig.BlockPrsDetails::statusCheckName)
        .filter(StringUtils::hasText)
        .orElse(DEFAULT_CHECK_NAME);
  }

  public static String commentMessage(Optional<PolicyConfig> policyConfig, String policyName) {
    return policyConfig
        .map(PolicyConfig::prCommentDetails)
        .map(PolicyConfig.PrCommentDetails::message)
        .filter(StringUtils::hasText)
        .orElseGet(
            () ->
                "This repository violates the compliance policy **%s**. Please resolve it before merging."
                    .formatted(policyName));
  }
}

package com.policyguard.backend.github;

import java.util.List;
import java.util.Optional;

/**
 * Capability view of the remote API used by evaluators and remediation.
 *
 * <p>A "not found" answer is reported as absence ({@code false}, {@link Optional#empty()} or an empty
 * list) by every query. Every other failure surfaces as {@link GitHubClientException} and is never
 * retried here.
 */
public interface RepositoryGateway {

  List<RemoteRepository> listActiveRepositories();

  boolean fileExists(long repositoryId, String path);

  /** Decoded UTF-8 content of a file, or empty when the file does not exist. */
  Optional<String> readFile(long repositoryId, String path);

  Optional<RemoteRepository> getSettings(long repositoryId);

  /**
   * Default {@code GITHUB_TOKEN} permission for workflows, or empty when Actions are disabled or the
   * setting is not reported.
   */
  Optional<String> getDefaultWorkflowPermission(long repositoryId);

  RemoteIssue createIssue(long repositoryId, String title, String body, List<String> labels);

  void archiveRepository(long repositoryId);

  List<RemoteIssue> listOpenIssues(long repositoryId, String label);

  boolean isUserInTeam(String userToken, String organization, String teamSlug);

  List<RemotePullRequest> listOpenPullRequests(long repositoryId);

  List<RemoteComment> listPullRequestComments(long repositoryId, int pullRequestNumber);

  void commentOnPullRequest(long repositoryId, int pullRequestNumber, String body);

  List<RemoteCheckRun> listCheckRuns(long repositoryId, String headSha);

  void createCheckRun(long repositoryId, String headSha, String name, boolean passed);

  void updateCheckRun(long repositoryId, long checkRunId, boolean passed);
}

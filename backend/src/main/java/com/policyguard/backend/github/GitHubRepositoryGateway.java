package com.policyguard.backend.github;

import com.policyguard.backend.config.GitHubAppProperties;
import com.policyguard.backend.config.ScanProperties;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.kohsuke.github.GHCheckRun;
import org.kohsuke.github.GHCheckRunBuilder;
import org.kohsuke.github.GHContent;
import org.kohsuke.github.GHFileNotFoundException;
import org.kohsuke.github.GHIssue;
import org.kohsuke.github.GHIssueBuilder;
import org.kohsuke.github.GHIssueComment;
import org.kohsuke.github.GHIssueState;
import org.kohsuke.github.GHLabel;
import org.kohsuke.github.GHMyself;
import org.kohsuke.github.GHPullRequest;
import org.kohsuke.github.GHRepository;
import org.kohsuke.github.GHTeam;
import org.kohsuke.github.GHUser;
import org.kohsuke.github.GitHub;
import org.kohsuke.github.PagedIterable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
class GitHubRepositoryGateway implements RepositoryGateway {

  private static final Logger log = LoggerFactory.getLogger(GitHubRepositoryGateway.class);

  private static final int PAGE_SIZE = 100;

  private final GitHubClientExecutor executor;
  private final GitHubTokenManager tokenManager;
  private final WorkflowPermissionsClient workflowPermissionsClient;
  private final GitHubAppProperties properties;
  private final ScanProperties scanProperties;

  GitHubRepositoryGateway(
      GitHubClientExecutor executor,
      GitHubTokenManager tokenManager,
      WorkflowPermissionsClient workflowPermissionsClient,
      GitHubAppProperties properties,
      ScanProperties scanProperties) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.tokenManager = Objects.requireNonNull(tokenManager, "tokenManager");
    this.workflowPermissionsClient =
        Objects.requireNonNull(workflowPermissionsClient, "workflowPermissionsClient");
    this.properties = Objects.requireNonNull(properties, "properties");
    this.scanProperties = Objects.requireNonNull(scanProperties, "scanProperties");
  }

  @Override
  public List<RemoteRepository> listActiveRepositories() {
    String organization = requireOrganization();
    return executor.execute(
        "list repositories of " + organization,
        github -> {
          List<GHRepository> repositories =
              github
                  .getOrganization(organization)
                  .listRepositories()
                  .withPageSize(PAGE_SIZE)
                  .toList();
          List<RemoteRepository> result = new ArrayList<>();
          for (GHRepository repository : repositories) {
            if (!scanProperties.isIncludeArchived() && repository.isArchived()) {
              continue;
            }
            result.add(toRemoteRepository(repository));
          }
          return List.copyOf(result);
        });
  }

  @Override
  public boolean fileExists(long repositoryId, String path) {
    return readContent(repositoryId, path, false).isPresent();
  }

  @Override
  public Optional<String> readFile(long repositoryId, String path) {
    return readContent(repositoryId, path, true);
  }

  private Optional<String> readContent(long repositoryId, String path, boolean decode) {
    String description = "read %s in repository %d".formatted(path, repositoryId);
    return executor.execute(
        description,
        github -> {
          try {
            GHContent content = github.getRepositoryById(repositoryId).getFileContent(path);
            if (content == null || !content.isFile()) {
              return Optional.empty();
            }
            if (!decode) {
              return Optional.of("");
            }
            try (InputStream stream = content.read()) {
              return Optional.of(new String(stream.readAllBytes(), StandardCharsets.UTF_8));
            }
          } catch (GHFileNotFoundException ex) {
            return Optional.empty();
          }
        });
  }

  @Override
  public Optional<RemoteRepository> getSettings(long repositoryId) {
    return executor.execute(
        "read settings of repository " + repositoryId,
        github -> {
          try {
            return Optional.of(toRemoteRepository(github.getRepositoryById(repositoryId)));
          } catch (GHFileNotFoundException ex) {
            return Optional.empty();
          }
        });
  }

  @Override
  public Optional<String> getDefaultWorkflowPermission(long repositoryId) {
    return workflowPermissionsClient.defaultWorkflowPermission(repositoryId);
  }

  @Override
  public RemoteIssue createIssue(
      long repositoryId, String title, String body, List<String> labels) {
    if (!StringUtils.hasText(title)) {
      throw new IllegalArgumentException("Issue title must not be blank");
    }
    return executor.execute(
        "create issue in repository " + repositoryId,
        github -> {
          GHIssueBuilder builder = github.getRepositoryById(repositoryId).createIssue(title.trim());
          if (StringUtils.hasText(body)) {
            builder.body(body);
          }
          if (labels != null) {
            for (String label : labels) {
              if (StringUtils.hasText(label)) {
                builder.label(label.trim());
              }
            }
          }
          return toRemoteIssue(builder.create());
        });
  }

  @Override
  public void archiveRepository(long repositoryId) {
    executor.executeVoid(
        "archive repository " + repositoryId,
        github -> github.getRepositoryById(repositoryId).archive());
  }

  @Override
  public List<RemoteIssue> listOpenIssues(long repositoryId, String label) {
    return executor.execute(
        "list open issues in repository " + repositoryId,
        github -> {
          try {
            GHRepository repository = github.getRepositoryById(repositoryId);
            PagedIterable<GHIssue> issues =
                StringUtils.hasText(label)
                    ? repository
                        .queryIssues()
                        .label(label.trim())
                        .state(GHIssueState.OPEN)
                        .list()
                        .withPageSize(PAGE_SIZE)
                    : repository
                        .queryIssues()
                        .state(GHIssueState.OPEN)
                        .list()
                        .withPageSize(PAGE_SIZE);
            List<RemoteIssue> result = new ArrayList<>();
            // the issues endpoint also returns pull requests
            for (GHIssue issue : issues.toList()) {
              if (!issue.isPullRequest()) {
                result.add(toRemoteIssue(issue));
              }
            }
            return List.copyOf(result);
          } catch (GHFileNotFoundException ex) {
            log.warn("Could not retrieve issues for repository {}", repositoryId);
            return List.of();
          }
        });
  }

  @Override
  public boolean isUserInTeam(String userToken, String organization, String teamSlug) {
    GitHub userClient = tokenManager.getUserScopedClient(userToken);
    try {
      GHTeam team = userClient.getOrganization(organization).getTeamBySlug(teamSlug);
      if (team == null) {
        return false;
      }
      GHMyself user = userClient.getMyself();
      return team.hasMember(user);
    } catch (GHFileNotFoundException ex) {
      log.warn(
          "Could not verify team membership for {}/{}. The team may not exist or the user may not see it.",
          organization,
          teamSlug);
      return false;
    } catch (IOException ex) {
      throw GitHubClientException.from(
          "Failed to check membership of %s/%s".formatted(organization, teamSlug), ex);
    }
  }

  @Override
  public List<RemotePullRequest> listOpenPullRequests(long repositoryId) {
    return executor.execute(
        "list open pull requests in repository " + repositoryId,
        github -> {
          try {
            List<RemotePullRequest> result = new ArrayList<>();
            for (GHPullRequest pr :
                github.getRepositoryById(repositoryId).getPullRequests(GHIssueState.OPEN)) {
              String headSha = pr.getHead() != null ? pr.getHead().getSha() : null;
              result.add(new RemotePullRequest(pr.getNumber(), headSha));
            }
            return List.copyOf(result);
          } catch (GHFileNotFoundException ex) {
            return List.of();
          }
        });
  }

  @Override
  public List<RemoteComment> listPullRequestComments(long repositoryId, int pullRequestNumber) {
    return executor.execute(
        "list comments of pull request #%d in repository %d"
            .formatted(pullRequestNumber, repositoryId),
        github -> {
          try {
            GHPullRequest pr = github.getRepositoryById(repositoryId).getPullRequest(pullRequestNumber);
            List<RemoteComment> result = new ArrayList<>();
            for (GHIssueComment comment : pr.getComments()) {
              GHUser author = comment.getUser();
              result.add(
                  new RemoteComment(
                      author != null ? author.getLogin() : null,
                      author != null ? author.getType() : null,
                      comment.getBody()));
            }
            return List.copyOf(result);
          } catch (GHFileNotFoundException ex) {
            return List.of();
          }
        });
  }

  @Override
  public void commentOnPullRequest(long repositoryId, int pullRequestNumber, String body) {
    executor.executeVoid(
        "comment on pull request #%d in repository %d".formatted(pullRequestNumber, repositoryId),
        github -> github.getRepositoryById(repositoryId).getPullRequest(pullRequestNumber).comment(body));
  }

  @Override
  public List<RemoteCheckRun> listCheckRuns(long repositoryId, String headSha) {
    return executor.execute(
        "list check runs for %s in repository %d".formatted(headSha, repositoryId),
        github -> {
          try {
            List<RemoteCheckRun> result = new ArrayList<>();
            for (GHCheckRun run :
                github.getRepositoryById(repositoryId).getCheckRuns(headSha).withPageSize(PAGE_SIZE)) {
              result.add(new RemoteCheckRun(run.getId(), run.getName()));
            }
            return List.copyOf(result);
          } catch (GHFileNotFoundException ex) {
            return List.of();
          }
        });
  }

  @Override
  public void createCheckRun(long repositoryId, String headSha, String name, boolean passed) {
    executor.executeVoid(
        "create check run %s in repository %d".formatted(name, repositoryId),
        github -> {
          GHCheckRunBuilder builder =
              github.getRepositoryById(repositoryId).createCheckRun(name, headSha);
          complete(builder, passed).create();
        });
  }

  @Override
  public void updateCheckRun(long repositoryId, long checkRunId, boolean passed) {
    executor.executeVoid(
        "update check run %d in repository %d".formatted(checkRunId, repositoryId),
        github -> {
          GHCheckRunBuilder builder =
              github.getRepositoryById(repositoryId).updateCheckRun(checkRunId);
          complete(builder, passed).create();
        });
  }

  private static GHCheckRunBuilder complete(GHCheckRunBuilder builder, boolean passed) {
    return builder
        .withStatus(GHCheckRun.Status.COMPLETED)
        .withConclusion(passed ? GHCheckRun.Conclusion.SUCCESS : GHCheckRun.Conclusion.FAILURE);
  }

  private String requireOrganization() {
    String organization = properties.getOrganization();
    if (!StringUtils.hasText(organization)) {
      throw new IllegalStateException("github.app.organization must be configured");
    }
    return organization.trim();
  }

  private static RemoteRepository toRemoteRepository(GHRepository repository) {
    return new RemoteRepository(
        repository.getId(),
        repository.getName(),
        repository.getFullName(),
        repository.isArchived());
  }

  private static RemoteIssue toRemoteIssue(GHIssue issue) {
    List<String> labels = new ArrayList<>();
    for (GHLabel label : issue.getLabels()) {
      labels.add(label.getName());
    }
    String htmlUrl = issue.getHtmlUrl() != null ? issue.getHtmlUrl().toString() : null;
    return new RemoteIssue(issue.getNumber(), issue.getTitle(), htmlUrl, labels);
  }
}

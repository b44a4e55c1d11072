package com.policyguard.backend.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.policyguard.backend.config.GitHubAppProperties;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/** Reads {@code /repositories/{id}/actions/permissions/workflow}, which github-api does not model. */
@Component
class WorkflowPermissionsClient {

  private final WebClient gitHubWebClient;
  private final GitHubTokenManager tokenManager;
  private final GitHubAppProperties properties;

  WorkflowPermissionsClient(
      WebClient gitHubWebClient, GitHubTokenManager tokenManager, GitHubAppProperties properties) {
    this.gitHubWebClient = Objects.requireNonNull(gitHubWebClient, "gitHubWebClient");
    this.tokenManager = Objects.requireNonNull(tokenManager, "tokenManager");
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  Optional<String> defaultWorkflowPermission(long repositoryId) {
    GitHubClientExecutor.ensureNotCancelled("read workflow permissions");
    String token = tokenManager.getServiceToken();
    return gitHubWebClient
        .get()
        .uri("/repositories/{id}/actions/permissions/workflow", repositoryId)
        .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
        .retrieve()
        .bodyToMono(WorkflowPermissions.class)
        .timeout(properties.getReadTimeout())
        .onErrorResume(WebClientResponseException.NotFound.class, ex -> Mono.empty())
        .onErrorMap(ex -> !(ex instanceof GitHubClientException), ex -> translate(repositoryId, ex))
        .blockOptional()
        .map(WorkflowPermissions::defaultWorkflowPermissions);
  }

  private GitHubClientException translate(long repositoryId, Throwable ex) {
    String message = "Failed to read workflow permissions for repository " + repositoryId;
    if (ex instanceof WebClientResponseException responseException) {
      int status = responseException.getStatusCode().value();
      return new GitHubClientException(
          message + " (status " + status + ")",
          GitHubErrorKind.fromStatus(status, responseException.getResponseBodyAsString()),
          status,
          ex);
    }
    if (ex instanceof WebClientRequestException || ex instanceof TimeoutException) {
      return new GitHubClientException(message, GitHubErrorKind.TRANSPORT, -1, ex);
    }
    return new GitHubClientException(message, GitHubErrorKind.OTHER, -1, ex);
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record WorkflowPermissions(
      @JsonProperty("default_workflow_permissions") String defaultWorkflowPermissions,
      @JsonProperty("can_approve_pull_request_reviews") boolean canApprovePullRequestReviews) {}
}

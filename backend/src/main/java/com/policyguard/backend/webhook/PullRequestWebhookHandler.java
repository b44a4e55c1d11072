package com.policyguard.backend.webhook;

import com.policyguard.backend.configuration.AppConfig;
import com.policyguard.backend.configuration.ConfigurationProvider;
import com.policyguard.backend.configuration.PolicyConfig;
import com.policyguard.backend.github.RemoteRepository;
import com.policyguard.backend.github.RepositoryGateway;
import com.policyguard.backend.policy.PolicyEvaluationService;
import com.policyguard.backend.policy.PolicyFinding;
import com.policyguard.backend.policy.PolicyTypes;
import com.policyguard.backend.remediation.PullRequestFeedback;
import com.policyguard.backend.remediation.RemediationActionTypes;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Re-evaluates a repository when one of its pull requests changes and updates that pull request:
 * the policy comment for violated {@code comment-on-prs} policies, and the compliance check for
 * every {@code block-prs} policy, passing when the repository complies.
 *
 * <p>Policies sharing a check name share one check run, which passes only when all of them pass.
 * A failed GitHub call does not stop the remaining updates; the first failure is rethrown at the
 * end so the job is retried. Both updates are idempotent.
 */
@Service
public class PullRequestWebhookHandler {

  private static final Logger log = LoggerFactory.getLogger(PullRequestWebhookHandler.class);

  private final RepositoryGateway repositoryGateway;
  private final ConfigurationProvider configurationProvider;
  private final PolicyEvaluationService evaluationService;
  private final PullRequestFeedback feedback;
  private final MeterRegistry meterRegistry;

  public PullRequestWebhookHandler(
      RepositoryGateway repositoryGateway,
      ConfigurationProvider configurationProvider,
      PolicyEvaluationService evaluationService,
      PullRequestFeedback feedback,
      MeterRegistry meterRegistry) {
    this.repositoryGateway = Objects.requireNonNull(repositoryGateway, "repositoryGateway");
    this.configurationProvider =
        Objects.requireNonNull(configurationProvider, "configurationProvider");
    this.evaluationService = Objects.requireNonNull(evaluationService, "evaluationService");
    this.feedback = Objects.requireNonNull(feedback, "feedback");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
  }

  public PullRequestEvaluation handle(PullRequestEvent event) {
    Optional<RemoteRepository> repository = repositoryGateway.getSettings(event.repositoryId());
    if (repository.isEmpty()) {
      log.warn(
          "Repository {} from delivery {} is not visible to the app; skipping pull request #{}",
          event.repositoryId(),
          event.deliveryId(),
          event.pullRequestNumber());
      return PullRequestEvaluation.SKIPPED;
    }
    AppConfig config = configurationProvider.getConfig(false);
    List<PolicyFinding> findings =
        evaluationService.evaluateRepository(repository.get(), config.policies());
    Set<String> violatedTypes =
        findings.stream().map(PolicyFinding::policyType).collect(Collectors.toSet());

    Map<String, Boolean> checks = new LinkedHashMap<>();
    Set<String> comments = new LinkedHashSet<>();
    for (PolicyConfig policy : config.policies()) {
      boolean compliant = !violatedTypes.contains(PolicyTypes.normalize(policy.type()));
      for (String action : policy.actions()) {
        String normalized = RemediationActionTypes.normalize(action);
        if (RemediationActionTypes.BLOCK_PRS.equals(normalized)) {
          checks.merge(
              PullRequestFeedback.checkName(Optional.of(policy)), compliant, Boolean::logicalAnd);
        } else if (RemediationActionTypes.COMMENT_ON_PRS.equals(normalized) && !compliant) {
          comments.add(PullRequestFeedback.commentMessage(Optional.of(policy), policy.name()));
        }
      }
    }

    RuntimeException failure = null;
    int checksPublished = 0;
    for (Map.Entry<String, Boolean> check : checks.entrySet()) {
      try {
        feedback.publishCheck(
            event.repositoryId(), event.headSha(), check.getKey(), check.getValue());
        checksPublished++;
      } catch (RuntimeException ex) {
        log.error(
            "Publishing check '{}' on {}#{} failed",
            check.getKey(),
            repository.get().fullName(),
            event.pullRequestNumber(),
            ex);
        failure = accumulate(failure, ex);
      }
    }
    int commentsPosted = 0;
    for (String message : comments) {
      try {
        if (feedback.commentOnce(event.repositoryId(), event.pullRequestNumber(), message)) {
          commentsPosted++;
        }
      } catch (RuntimeException ex) {
        log.error(
            "Commenting on {}#{} failed", repository.get().fullName(), event.pullRequestNumber(), ex);
        failure = accumulate(failure, ex);
      }
    }

    meterRegistry
        .counter(
            "policy_guard.webhook.pull_requests",
            "result",
            findings.isEmpty() ? "compliant" : "violating")
        .increment();
    log.info(
        "Evaluated {}#{} at {}: {} violation(s), {} check(s) published, {} comment(s) posted",
        repository.get().fullName(),
        event.pullRequestNumber(),
        event.headSha(),
        findings.size(),
        checksPublished,
        commentsPosted);
    if (failure != null) {
      throw failure;
    }
    return new PullRequestEvaluation(findings.size(), checksPublished, commentsPosted);
  }

  private static RuntimeException accumulate(RuntimeException first, RuntimeException next) {
    if (first == null) {
      return next;
    }
    first.addSuppressed(next);
    return first;
  }
}

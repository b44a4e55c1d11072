package com.policyguard.backend.remediation;

import com.policyguard.backend.configuration.PolicyConfig;
import com.policyguard.backend.github.GitHubClientException;
import com.policyguard.backend.github.RemoteIssue;
import com.policyguard.backend.github.RepositoryGateway;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Files an issue for the violation unless an open issue with the same title already carries the
 * primary label.
 */
@Component
class CreateIssueAction implements RemediationAction {

  static final List<String> DEFAULT_LABELS = List.of("policy-violation", "compliance");

  private static final Logger log = LoggerFactory.getLogger(CreateIssueAction.class);

  private final RepositoryGateway repositoryGateway;

  CreateIssueAction(RepositoryGateway repositoryGateway) {
    this.repositoryGateway = repositoryGateway;
  }

  @Override
  public String actionType() {
    return RemediationActionTypes.CREATE_ISSUE;
  }

  @Override
  public ActionResult apply(RemediationContext context) {
    Optional<PolicyConfig.IssueDetails> details =
        context.policyConfig().map(PolicyConfig::issueDetails);
    String title =
        details
            .map(PolicyConfig.IssueDetails::title)
            .filter(StringUtils::hasText)
            .orElse("Compliance Violation: " + context.policyName());
    String body =
        details
            .map(PolicyConfig.IssueDetails::body)
            .filter(StringUtils::hasText)
            .orElseGet(() -> defaultBody(context));
    List<String> labels =
        details
            .map(PolicyConfig.IssueDetails::labels)
            .filter(list -> !list.isEmpty())
            .orElse(DEFAULT_LABELS);

    try {
      String primaryLabel = labels.get(0);
      Optional<RemoteIssue> existing =
          repositoryGateway.listOpenIssues(context.githubRepositoryId(), primaryLabel).stream()
              .filter(issue -> sameTitle(issue.title(), title))
              .findFirst();
      if (existing.isPresent()) {
        RemoteIssue issue = existing.get();
        return ActionResult.skipped(
            "Open issue #%d already tracks this violation: %s"
                .formatted(issue.number(), issue.htmlUrl()));
      }
      RemoteIssue created =
          repositoryGateway.createIssue(context.githubRepositoryId(), title, body, labels);
      log.info(
          "Created issue #{} in {} for policy '{}'",
          created.number(),
          context.repositoryName(),
          context.policyKey());
      return ActionResult.success(
          "Created issue #%d: %s".formatted(created.number(), created.htmlUrl()));
    } catch (GitHubClientException ex) {
      log.warn(
          "Unable to file issue in {} for policy '{}': {}",
          context.repositoryName(),
          context.policyKey(),
          ex.getMessage());
      return ActionResult.failed("Issue creation failed (%s): %s".formatted(ex.getKind(), ex.getMessage()));
    }
  }

  private static boolean sameTitle(String left, String right) {
    if (left == null || right == null) {
      return false;
    }
    return left.trim().toLowerCase(Locale.ROOT).equals(right.trim().toLowerCase(Locale.ROOT));
  }

  private static String defaultBody(RemediationContext context) {
    StringBuilder body =
        new StringBuilder()
            .append("This repository does not comply with the policy **")
            .append(context.policyName())
            .append("** (`")
            .append(context.policyKey())
            .append("`).");
    if (StringUtils.hasText(context.violationDetail())) {
      body.append("\n\n").append(context.violationDetail());
    }
    body.append("\n\nThis issue was filed automatically by the compliance scanner.");
    return body.toString();
  }
}

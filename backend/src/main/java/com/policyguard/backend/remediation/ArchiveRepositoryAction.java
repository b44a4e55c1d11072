package com.policyguard.backend.remediation;

import com.policyguard.backend.github.GitHubClientException;
import com.policyguard.backend.github.GitHubErrorKind;
import com.policyguard.backend.github.RemoteRepository;
import com.policyguard.backend.github.RepositoryGateway;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Archives the repository; an already archived repository is left alone. */
@Component
class ArchiveRepositoryAction implements RemediationAction {

  private static final Logger log = LoggerFactory.getLogger(ArchiveRepositoryAction.class);

  private final RepositoryGateway repositoryGateway;

  ArchiveRepositoryAction(RepositoryGateway repositoryGateway) {
    this.repositoryGateway = repositoryGateway;
  }

  @Override
  public String actionType() {
    return RemediationActionTypes.ARCHIVE_REPO;
  }

  @Override
  public ActionResult apply(RemediationContext context) {
    try {
      Optional<RemoteRepository> settings =
          repositoryGateway.getSettings(context.githubRepositoryId());
      if (settings.isEmpty()) {
        log.warn("Repository {} was not found; cannot archive it", context.repositoryName());
        return ActionResult.failed("Repository not found");
      }
      if (settings.get().archived()) {
        return ActionResult.skipped("Repository is already archived");
      }
      repositoryGateway.archiveRepository(context.githubRepositoryId());
      log.info(
          "Archived {} for violating policy '{}'", context.repositoryName(), context.policyKey());
      return ActionResult.success("Repository archived");
    } catch (GitHubClientException ex) {
      if (ex.getKind() == GitHubErrorKind.NOT_FOUND || ex.getKind() == GitHubErrorKind.FORBIDDEN) {
        log.warn(
            "Archiving {} was rejected ({}): {}",
            context.repositoryName(),
            ex.getKind(),
            ex.getMessage());
        return ActionResult.failed("Archive rejected (%s): %s".formatted(ex.getKind(), ex.getMessage()));
      }
      log.error("Archiving {} failed", context.repositoryName(), ex);
      return ActionResult.failed("Archive failed (%s): %s".formatted(ex.getKind(), ex.getMessage()));
    }
  }
}

package com.policyguard.backend.remediation;

import com.policyguard.backend.compliance.persistence.ActionLogRepository;
import java.time.Clock;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** Appends audit rows, each in its own short transaction. */
@Component
public class ActionLogWriter {

  private static final int MAX_DETAILS_LENGTH = 2048;

  private final ActionLogRepository actionLogRepository;
  private final Clock clock;

  public ActionLogWriter(ActionLogRepository actionLogRepository, Clock clock) {
    this.actionLogRepository = actionLogRepository;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public boolean alreadyLogged(RemediationContext context, String actionType) {
    return actionLogRepository.existsByScanIdAndRepositoryIdAndPolicyIdAndActionType(
        context.scanId(), context.repositoryId(), context.policyId(), actionType);
  }

  /**
   * @return {@code false} when a concurrent run already logged the same action for this scan
   */
  @Transactional
  public boolean record(RemediationContext context, String actionType, ActionResult result) {
    String details = result.details();
    if (details != null && details.length() > MAX_DETAILS_LENGTH) {
      details = details.substring(0, MAX_DETAILS_LENGTH);
    }
    return actionLogRepository.insertIfAbsent(
            context.scanId(),
            context.repositoryId(),
            context.policyId(),
            actionType,
            result.outcome().name(),
            details,
            clock.instant())
        > 0;
  }
}

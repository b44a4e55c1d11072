package com.policyguard.backend.remediation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
class LogOnlyAction implements RemediationAction {

  private static final Logger log = LoggerFactory.getLogger(LogOnlyAction.class);

  @Override
  public String actionType() {
    return RemediationActionTypes.LOG_ONLY;
  }

  @Override
  public ActionResult apply(RemediationContext context) {
    log.info(
        "Repository {} violates policy '{}' (log only)", context.repositoryName(), context.policyKey());
    return ActionResult.success(
        context.violationDetail() != null ? context.violationDetail() : "Violation recorded");
  }
}

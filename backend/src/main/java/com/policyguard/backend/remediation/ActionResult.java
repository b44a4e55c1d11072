package com.policyguard.backend.remediation;

import com.policyguard.backend.compliance.domain.ActionOutcome;

public record ActionResult(ActionOutcome outcome, String details) {

  public static ActionResult success(String details) {
    return new ActionResult(ActionOutcome.SUCCESS, details);
  }

  public static ActionResult skipped(String details) {
    return new ActionResult(ActionOutcome.SKIPPED, details);
  }

  public static ActionResult failed(String details) {
    return new ActionResult(ActionOutcome.FAILED, details);
  }
}

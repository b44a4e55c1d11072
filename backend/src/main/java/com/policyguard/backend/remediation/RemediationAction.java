package com.policyguard.backend.remediation;

/** One kind of corrective step, bound to a single action name such as {@code create-issue}. */
public interface RemediationAction {

  String actionType();

  /**
   * Applies the action. Expected remote conditions are reported through the returned result;
   * unexpected exceptions are recorded as a failed action by the executor.
   */
  ActionResult apply(RemediationContext context);
}

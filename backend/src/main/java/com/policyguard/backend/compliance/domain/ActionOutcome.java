package com.policyguard.backend.compliance.domain;

public enum ActionOutcome {
  SUCCESS,
  FAILED,
  SKIPPED
}

package com.policyguard.backend.compliance.domain;

public enum JobType {
  SCAN,
  REMEDIATION,
  PULL_REQUEST_EVALUATION
}

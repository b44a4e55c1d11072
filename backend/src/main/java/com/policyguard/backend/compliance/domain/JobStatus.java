package com.policyguard.backend.compliance.domain;

public enum JobStatus {
  PENDING,
  RUNNING,
  SUCCEEDED,
  FAILED
}

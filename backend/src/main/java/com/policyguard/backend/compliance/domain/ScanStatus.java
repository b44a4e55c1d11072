package com.policyguard.backend.compliance.domain;

public enum ScanStatus {
  IN_PROGRESS,
  COMPLETED,
  FAILED
}

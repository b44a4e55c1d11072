package com.policyguard.backend.compliance.domain;

public enum ComplianceStatus {
  PENDING,
  COMPLIANT,
  NON_COMPLIANT
}

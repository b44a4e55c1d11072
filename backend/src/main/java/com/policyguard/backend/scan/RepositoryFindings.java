package com.policyguard.backend.scan;

import com.policyguard.backend.policy.PolicyFinding;
import java.util.List;

/** Evaluation result for one tracked repository. */
public record RepositoryFindings(long repositoryId, List<PolicyFinding> findings) {

  public RepositoryFindings {
    findings = findings == null ? List.of() : List.copyOf(findings);
  }

  public boolean compliant() {
    return findings.isEmpty();
  }
}

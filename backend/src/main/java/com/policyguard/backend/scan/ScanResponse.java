package com.policyguard.backend.scan;

import com.policyguard.backend.compliance.domain.Scan;
import com.policyguard.backend.compliance.domain.ScanStatus;
import java.time.Instant;

public record ScanResponse(
    Long id,
    ScanStatus status,
    Instant startedAt,
    Instant completedAt,
    int repositoriesScanned,
    int violationCount,
    String failureReason) {

  public static ScanResponse from(Scan scan) {
    return new ScanResponse(
        scan.getId(),
        scan.getStatus(),
        scan.getStartedAt(),
        scan.getCompletedAt(),
        scan.getRepositoriesScanned(),
        scan.getViolationCount(),
        scan.getFailureReason());
  }
}

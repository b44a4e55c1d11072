package com.policyguard.backend.scan;

import com.policyguard.backend.compliance.domain.ScanStatus;

public record ScanOutcome(
    long scanId,
    ScanStatus status,
    int repositoriesScanned,
    int violationCount,
    boolean remediationScheduled) {}

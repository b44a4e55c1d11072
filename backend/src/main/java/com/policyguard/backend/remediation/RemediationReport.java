package com.policyguard.backend.remediation;

public record RemediationReport(
    long scanId, int violations, int succeeded, int failed, int skipped, int alreadyProcessed) {}

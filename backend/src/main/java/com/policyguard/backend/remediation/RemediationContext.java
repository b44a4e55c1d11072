package com.policyguard.backend.remediation;

import com.policyguard.backend.configuration.PolicyConfig;
import java.util.Optional;

/**
 * Everything an action needs about one violation. {@code policyConfig} is absent when the policy
 * has since been removed from the configuration; actions then fall back to their defaults.
 */
public record RemediationContext(
    long scanId,
    long repositoryId,
    long githubRepositoryId,
    String repositoryName,
    long policyId,
    String policyKey,
    String policyName,
    String violationDetail,
    Optional<PolicyConfig> policyConfig) {}

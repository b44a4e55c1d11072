package com.policyguard.backend.configuration;

import com.policyguard.backend.policy.PolicyTypes;
import java.util.List;
import java.util.Optional;

/** Validated, immutable organization configuration consumed by the scanning core. */
public record AppConfig(String authorizedTeam, List<PolicyConfig> policies) {

  public AppConfig {
    policies = policies == null ? List.of() : List.copyOf(policies);
  }

  public Optional<PolicyConfig> findPolicy(String type) {
    String normalized = PolicyTypes.normalize(type);
    return policies.stream()
        .filter(policy -> PolicyTypes.normalize(policy.type()).equals(normalized))
        .findFirst();
  }
}

package com.policyguard.backend.policy.evaluator;

import com.policyguard.backend.github.RemoteRepository;
import com.policyguard.backend.github.RepositoryGateway;
import com.policyguard.backend.policy.PolicyEvaluator;
import com.policyguard.backend.policy.PolicyFinding;
import java.util.Objects;
import java.util.Optional;

/** Compliant iff {@code path} exists at the repository root. */
abstract class FilePresenceEvaluator implements PolicyEvaluator {

  private final RepositoryGateway gateway;
  private final String policyType;
  private final String path;

  FilePresenceEvaluator(RepositoryGateway gateway, String policyType, String path) {
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.policyType = policyType;
    this.path = path;
  }

  @Override
  public String policyType() {
    return policyType;
  }

  @Override
  public Optional<PolicyFinding> evaluate(RemoteRepository repository) {
    if (gateway.fileExists(repository.id(), path)) {
      return Optional.empty();
    }
    return Optional.of(
        new PolicyFinding(policyType, "%s is missing from the repository root".formatted(path)));
  }
}

package com.policyguard.backend.policy.evaluator;

import com.policyguard.backend.github.RemoteRepository;
import com.policyguard.backend.github.RepositoryGateway;
import com.policyguard.backend.policy.PolicyEvaluator;
import com.policyguard.backend.policy.PolicyFinding;
import com.policyguard.backend.policy.PolicyTypes;
import java.util.Objects;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Requires the default workflow {@code GITHUB_TOKEN} permission to be exactly {@code read}. A
 * repository that reports no value (Actions disabled) complies.
 */
@Component
class CorrectWorkflowPermissionsEvaluator implements PolicyEvaluator {

  static final String REQUIRED_PERMISSION = "read";

  private final RepositoryGateway gateway;

  CorrectWorkflowPermissionsEvaluator(RepositoryGateway gateway) {
    this.gateway = Objects.requireNonNull(gateway, "gateway");
  }

  @Override
  public String policyType() {
    return PolicyTypes.CORRECT_WORKFLOW_PERMISSIONS;
  }

  @Override
  public Optional<PolicyFinding> evaluate(RemoteRepository repository) {
    Optional<String> permission = gateway.getDefaultWorkflowPermission(repository.id());
    if (permission.isEmpty() || REQUIRED_PERMISSION.equals(permission.get())) {
      return Optional.empty();
    }
    return Optional.of(
        new PolicyFinding(
            policyType(),
            "Default workflow permission is '%s', expected '%s'"
                .formatted(permission.get(), REQUIRED_PERMISSION)));
  }
}

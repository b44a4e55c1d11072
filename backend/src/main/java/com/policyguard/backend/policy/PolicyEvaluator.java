package com.policyguard.backend.policy;

import com.policyguard.backend.github.RemoteRepository;
import java.util.Optional;

/**
 * Check strategy for exactly one policy type. Implementations must not have side effects and must
 * not depend on other evaluators. Content problems (missing fields, unparsable files) are reported as
 * findings; transport failures propagate.
 */
public interface PolicyEvaluator {

  String policyType();

  /** Returns a finding when the repository violates the policy, empty when it complies. */
  Optional<PolicyFinding> evaluate(RemoteRepository repository);
}

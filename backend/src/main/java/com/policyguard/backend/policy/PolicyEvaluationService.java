package com.policyguard.backend.policy;

import com.policyguard.backend.configuration.PolicyConfig;
import com.policyguard.backend.github.RemoteRepository;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs every configured policy that has a registered evaluator against one repository. Policies
 * without an evaluator are skipped; evaluator exceptions propagate to the caller.
 */
@Service
public class PolicyEvaluationService {

  private static final Logger log = LoggerFactory.getLogger(PolicyEvaluationService.class);

  private final PolicyEvaluatorRegistry registry;

  public PolicyEvaluationService(PolicyEvaluatorRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  public List<PolicyFinding> evaluateRepository(
      RemoteRepository repository, List<PolicyConfig> policies) {
    Objects.requireNonNull(repository, "repository");
    if (policies == null || policies.isEmpty()) {
      return List.of();
    }
    Set<String> evaluatedTypes = new LinkedHashSet<>();
    List<PolicyFinding> findings = new ArrayList<>();
    for (PolicyConfig policy : policies) {
      Optional<PolicyEvaluator> evaluator = registry.find(policy.type());
      if (evaluator.isEmpty()) {
        log.debug("No evaluator registered for policy type '{}'; skipping", policy.type());
        continue;
      }
      if (!evaluatedTypes.add(PolicyTypes.normalize(policy.type()))) {
        continue;
      }
      evaluator.get().evaluate(repository).ifPresent(findings::add);
    }
    return List.copyOf(findings);
  }
}

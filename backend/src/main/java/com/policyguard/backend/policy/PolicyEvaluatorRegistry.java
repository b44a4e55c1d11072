package com.policyguard.backend.policy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Explicit type-tag to evaluator map, fixed at startup. */
@Component
public class PolicyEvaluatorRegistry {

  private static final Logger log = LoggerFactory.getLogger(PolicyEvaluatorRegistry.class);

  private final Map<String, PolicyEvaluator> evaluators;

  public PolicyEvaluatorRegistry(List<PolicyEvaluator> evaluators) {
    Map<String, PolicyEvaluator> byType = new LinkedHashMap<>();
    for (PolicyEvaluator evaluator : evaluators) {
      String key = PolicyTypes.normalize(evaluator.policyType());
      if (key.isEmpty()) {
        throw new IllegalStateException(
            "Evaluator " + evaluator.getClass().getName() + " declares a blank policy type");
      }
      PolicyEvaluator previous = byType.putIfAbsent(key, evaluator);
      if (previous != null) {
        throw new IllegalStateException(
            "Policy type '%s' is registered by both %s and %s"
                .formatted(key, previous.getClass().getName(), evaluator.getClass().getName()));
      }
    }
    this.evaluators = Collections.unmodifiableMap(byType);
    log.info("Registered policy evaluators: {}", this.evaluators.keySet());
  }

  public Optional<PolicyEvaluator> find(String policyType) {
    return Optional.ofNullable(evaluators.get(PolicyTypes.normalize(policyType)));
  }

  public Set<String> registeredTypes() {
    return evaluators.keySet();
  }
}

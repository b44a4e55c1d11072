package com.policyguard.backend.policy.evaluator;

import com.policyguard.backend.github.RepositoryGateway;
import com.policyguard.backend.policy.PolicyTypes;
import org.springframework.stereotype.Component;

@Component
class HasAgentsMdEvaluator extends FilePresenceEvaluator {

  static final String PATH = "AGENTS.md";

  HasAgentsMdEvaluator(RepositoryGateway gateway) {
    super(gateway, PolicyTypes.HAS_AGENTS_MD, PATH);
  }
}

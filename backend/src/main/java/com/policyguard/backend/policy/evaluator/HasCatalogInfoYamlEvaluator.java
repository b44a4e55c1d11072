package com.policyguard.backend.policy.evaluator;

import com.policyguard.backend.github.RepositoryGateway;
import com.policyguard.backend.policy.PolicyTypes;
import org.springframework.stereotype.Component;

@Component
class HasCatalogInfoYamlEvaluator extends FilePresenceEvaluator {

  static final String PATH = "catalog-info.yaml";

  HasCatalogInfoYamlEvaluator(RepositoryGateway gateway) {
    super(gateway, PolicyTypes.HAS_CATALOG_INFO_YAML, PATH);
  }
}

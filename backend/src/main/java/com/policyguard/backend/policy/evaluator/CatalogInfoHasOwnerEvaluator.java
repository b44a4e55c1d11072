package com.policyguard.backend.policy.evaluator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.policyguard.backend.github.RemoteRepository;
import com.policyguard.backend.github.RepositoryGateway;
import com.policyguard.backend.policy.PolicyEvaluator;
import com.policyguard.backend.policy.PolicyFinding;
import com.policyguard.backend.policy.PolicyTypes;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Requires a non-blank {@code spec.owner} in {@code catalog-info.yaml}. A missing file complies
 * (presence has its own policy); an unparsable file is a violation, not an error.
 */
@Component
class CatalogInfoHasOwnerEvaluator implements PolicyEvaluator {

  private static final Logger log = LoggerFactory.getLogger(CatalogInfoHasOwnerEvaluator.class);
  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

  static final String PATH = "catalog-info.yaml";

  private final RepositoryGateway gateway;

  CatalogInfoHasOwnerEvaluator(RepositoryGateway gateway) {
    this.gateway = Objects.requireNonNull(gateway, "gateway");
  }

  @Override
  public String policyType() {
    return PolicyTypes.CATALOG_INFO_HAS_OWNER;
  }

  @Override
  public Optional<PolicyFinding> evaluate(RemoteRepository repository) {
    Optional<String> content = gateway.readFile(repository.id(), PATH);
    if (content.isEmpty()) {
      return Optional.empty();
    }
    String yaml = content.get();
    if (yaml.isBlank()) {
      log.warn("{} in repository {} is empty", PATH, repository.fullName());
      return violation(PATH + " is empty");
    }

    JsonNode root;
    try {
      root = YAML_MAPPER.readTree(yaml);
    } catch (JsonProcessingException ex) {
      log.warn(
          "Failed to parse {} in repository {}: {}", PATH, repository.fullName(), ex.getOriginalMessage());
      return violation(PATH + " could not be parsed");
    }

    JsonNode spec = root != null ? root.get("spec") : null;
    if (spec == null || !spec.isObject()) {
      log.warn("{} in repository {} has no 'spec' section", PATH, repository.fullName());
      return violation(PATH + " has no 'spec' section");
    }
    JsonNode owner = spec.get("owner");
    if (owner == null || owner.isNull() || !owner.isValueNode() || owner.asText().isBlank()) {
      log.warn("{} in repository {} has no 'spec.owner'", PATH, repository.fullName());
      return violation(PATH + " has no 'spec.owner'");
    }
    return Optional.empty();
  }

  private Optional<PolicyFinding> violation(String detail) {
    return Optional.of(new PolicyFinding(policyType(), detail));
  }
}

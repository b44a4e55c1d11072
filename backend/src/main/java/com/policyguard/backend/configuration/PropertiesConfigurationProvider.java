package com.policyguard.backend.configuration;

import com.policyguard.backend.configuration.PolicyConfig.BlockPrsDetails;
import com.policyguard.backend.configuration.PolicyConfig.IssueDetails;
import com.policyguard.backend.configuration.PolicyConfig.PrCommentDetails;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/** Builds the {@link AppConfig} from the bound {@code policy-guard.config} properties. */
@Component
public class PropertiesConfigurationProvider implements ConfigurationProvider {

  private static final Logger log = LoggerFactory.getLogger(PropertiesConfigurationProvider.class);

  private final PolicyGuardConfigProperties properties;
  private final AtomicReference<AppConfig> cached = new AtomicReference<>();

  public PropertiesConfigurationProvider(PolicyGuardConfigProperties properties) {
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  @Override
  public AppConfig getConfig(boolean forceRefresh) {
    AppConfig snapshot = cached.get();
    if (!forceRefresh && snapshot != null) {
      return snapshot;
    }
    synchronized (cached) {
      snapshot = cached.get();
      if (!forceRefresh && snapshot != null) {
        return snapshot;
      }
      AppConfig built = build();
      cached.set(built);
      log.info(
          "Loaded policy configuration with {} policies (authorizedTeam={})",
          built.policies().size(),
          built.authorizedTeam());
      return built;
    }
  }

  private AppConfig build() {
    List<PolicyGuardConfigProperties.Policy> rawPolicies = properties.getPolicies();
    if (rawPolicies == null || rawPolicies.isEmpty()) {
      throw new ConfigurationNotFoundException(
          "No policies are configured under policy-guard.config.policies");
    }
    PolicyGuardConfigProperties.AccessControl accessControl = properties.getAccessControl();
    String authorizedTeam = accessControl != null ? accessControl.getAuthorizedTeam() : null;
    if (!StringUtils.hasText(authorizedTeam)) {
      throw new InvalidConfigurationException(
          "Configuration is invalid: access-control.authorized-team must be set");
    }

    List<PolicyConfig> policies = new ArrayList<>(rawPolicies.size());
    for (int i = 0; i < rawPolicies.size(); i++) {
      PolicyGuardConfigProperties.Policy raw = rawPolicies.get(i);
      if (raw == null || !StringUtils.hasText(raw.getType())) {
        throw new InvalidConfigurationException(
            "Configuration is invalid: policies[%d].type must be set".formatted(i));
      }
      policies.add(
          new PolicyConfig(
              raw.getName(),
              raw.getType(),
              raw.getActions(),
              toIssueDetails(raw.getIssueDetails()),
              StringUtils.hasText(raw.getPrCommentMessage())
                  ? new PrCommentDetails(raw.getPrCommentMessage().trim())
                  : null,
              StringUtils.hasText(raw.getStatusCheckName())
                  ? new BlockPrsDetails(raw.getStatusCheckName().trim())
                  : null));
    }
    return new AppConfig(authorizedTeam.trim(), policies);
  }

  private IssueDetails toIssueDetails(PolicyGuardConfigProperties.IssueDetails raw) {
    if (raw == null) {
      return null;
    }
    return new IssueDetails(raw.getTitle(), raw.getBody(), raw.getLabels());
  }
}

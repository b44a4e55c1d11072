package com.policyguard.backend.remediation;

import com.policyguard.backend.compliance.domain.ActionOutcome;
import com.policyguard.backend.compliance.domain.Policy;
import com.policyguard.backend.compliance.domain.PolicyViolation;
import com.policyguard.backend.compliance.domain.TrackedRepository;
import com.policyguard.backend.compliance.persistence.PolicyViolationRepository;
import com.policyguard.backend.configuration.AppConfig;
import com.policyguard.backend.configuration.ConfigurationNotFoundException;
import com.policyguard.backend.configuration.ConfigurationProvider;
import com.policyguard.backend.configuration.InvalidConfigurationException;
import com.policyguard.backend.configuration.PolicyConfig;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Applies the configured actions to every violation of a scan. Each action runs on its own: a
 * failure is written to the audit trail and the remaining actions still run. An action that already
 * has an audit row for the scan is not repeated, so a redelivered job does not act twice.
 */
@Service
public class RemediationExecutor {

  private static final Logger log = LoggerFactory.getLogger(RemediationExecutor.class);

  private final PolicyViolationRepository violationRepository;
  private final ConfigurationProvider configurationProvider;
  private final ActionLogWriter actionLogWriter;
  private final MeterRegistry meterRegistry;
  private final Map<String, RemediationAction> actions;

  public RemediationExecutor(
      PolicyViolationRepository violationRepository,
      ConfigurationProvider configurationProvider,
      ActionLogWriter actionLogWriter,
      MeterRegistry meterRegistry,
      List<RemediationAction> actions) {
    this.violationRepository = violationRepository;
    this.configurationProvider = configurationProvider;
    this.actionLogWriter = actionLogWriter;
    this.meterRegistry = meterRegistry;
    Map<String, RemediationAction> byType = new LinkedHashMap<>();
    for (RemediationAction action : actions) {
      String key = RemediationActionTypes.normalize(action.actionType());
      if (byType.putIfAbsent(key, action) != null) {
        throw new IllegalStateException("Remediation action '%s' is registered twice".formatted(key));
      }
    }
    this.actions = Collections.unmodifiableMap(byType);
  }

  public RemediationReport processActionsForScan(long scanId) {
    List<PolicyViolation> violations = violationRepository.findByScanIdWithDetails(scanId);
    if (violations.isEmpty()) {
      log.info("Scan {} has no violations to remediate", scanId);
      return new RemediationReport(scanId, 0, 0, 0, 0, 0);
    }
    AppConfig config = loadConfig(scanId);
    log.info("Remediating {} violations of scan {}", violations.size(), scanId);

    int succeeded = 0;
    int failed = 0;
    int skipped = 0;
    int alreadyProcessed = 0;
    for (PolicyViolation violation : violations) {
      if (Thread.currentThread().isInterrupted()) {
        throw new CancellationException("Remediation of scan %d was cancelled".formatted(scanId));
      }
      RemediationContext context;
      Set<String> actionTypes;
      try {
        context = toContext(scanId, violation, config);
        actionTypes = actionsFor(violation.getPolicy());
      } catch (RuntimeException ex) {
        log.error("Skipping unreadable violation {} of scan {}", violation.getId(), scanId, ex);
        failed++;
        continue;
      }
      for (String actionType : actionTypes) {
        Optional<ActionOutcome> outcome;
        try {
          outcome = remediate(context, actionType);
        } catch (RuntimeException ex) {
          log.error(
              "Recording action '{}' for {} (policy '{}') failed",
              actionType,
              context.repositoryName(),
              context.policyKey(),
              ex);
          failed++;
          continue;
        }
        if (outcome.isEmpty()) {
          alreadyProcessed++;
        } else if (outcome.get() == ActionOutcome.SUCCESS) {
          succeeded++;
        } else if (outcome.get() == ActionOutcome.SKIPPED) {
          skipped++;
        } else {
          failed++;
        }
      }
    }
    log.info(
        "Remediation of scan {} finished: {} succeeded, {} failed, {} skipped, {} already processed",
        scanId,
        succeeded,
        failed,
        skipped,
        alreadyProcessed);
    return new RemediationReport(
        scanId, violations.size(), succeeded, failed, skipped, alreadyProcessed);
  }

  /** Runs one action and writes its audit row; empty when another run already logged it. */
  private Optional<ActionOutcome> remediate(RemediationContext context, String actionType) {
    if (actionLogWriter.alreadyLogged(context, actionType)) {
      return Optional.empty();
    }
    ActionResult result = runIsolated(context, actionType);
    if (!actionLogWriter.record(context, actionType, result)) {
      return Optional.empty();
    }
    meterRegistry
        .counter(
            "policy_guard.remediation.actions",
            "action",
            actionType,
            "outcome",
            result.outcome().name().toLowerCase(Locale.ROOT))
        .increment();
    return Optional.of(result.outcome());
  }

  private ActionResult runIsolated(RemediationContext context, String actionType) {
    RemediationAction action = actions.get(actionType);
    if (action == null) {
      log.warn(
          "Policy '{}' names unknown remediation action '{}'", context.policyKey(), actionType);
      return ActionResult.failed("Unknown remediation action '%s'".formatted(actionType));
    }
    try {
      return action.apply(context);
    } catch (RuntimeException ex) {
      log.error(
          "Action '{}' failed for {} (policy '{}')",
          actionType,
          context.repositoryName(),
          context.policyKey(),
          ex);
      String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
      return ActionResult.failed("Unexpected error: " + message);
    }
  }

  private static Set<String> actionsFor(Policy policy) {
    Set<String> normalized = new LinkedHashSet<>();
    for (String action : policy.getActionList()) {
      String key = RemediationActionTypes.normalize(action);
      if (!key.isEmpty()) {
        normalized.add(key);
      }
    }
    if (normalized.isEmpty()) {
      normalized.add(RemediationActionTypes.LOG_ONLY);
    }
    return normalized;
  }

  private static RemediationContext toContext(
      long scanId, PolicyViolation violation, AppConfig config) {
    TrackedRepository repository = violation.getRepository();
    Policy policy = violation.getPolicy();
    Optional<PolicyConfig> policyConfig =
        config != null ? config.findPolicy(policy.getPolicyKey()) : Optional.empty();
    return new RemediationContext(
        scanId,
        repository.getId(),
        repository.getGithubRepositoryId(),
        repository.getName(),
        policy.getId(),
        policy.getPolicyKey(),
        policy.getDescription(),
        violation.getDetail(),
        policyConfig);
  }

  private AppConfig loadConfig(long scanId) {
    try {
      return configurationProvider.getConfig(false);
    } catch (ConfigurationNotFoundException | InvalidConfigurationException ex) {
      log.warn(
          "Configuration unavailable while remediating scan {}; using action defaults: {}",
          scanId,
          ex.getMessage());
      return null;
    }
  }
}

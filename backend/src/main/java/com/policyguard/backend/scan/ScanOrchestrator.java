package com.policyguard.backend.scan;

import com.policyguard.backend.compliance.domain.Policy;
import com.policyguard.backend.compliance.domain.Scan;
import com.policyguard.backend.compliance.domain.ScanStatus;
import com.policyguard.backend.compliance.domain.TrackedRepository;
import com.policyguard.backend.config.ScanProperties;
import com.policyguard.backend.configuration.AppConfig;
import com.policyguard.backend.configuration.ConfigurationProvider;
import com.policyguard.backend.github.RemoteRepository;
import com.policyguard.backend.github.RepositoryGateway;
import com.policyguard.backend.policy.PolicyEvaluationService;
import com.policyguard.backend.policy.PolicyFinding;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one compliance scan end to end: configuration, catalog reconciliation, evaluation and the
 * transactional write phase that also schedules remediation.
 *
 * <p>Evaluation is fail-fast. The first unrecovered exception or error marks the scan Failed and is
 * rethrown to the caller, which owns any retry.
 */
@Service
public class ScanOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(ScanOrchestrator.class);

  private final ConfigurationProvider configurationProvider;
  private final RepositoryGateway repositoryGateway;
  private final PolicyEvaluationService evaluationService;
  private final CatalogReconciliationService reconciliationService;
  private final ScanRecordService scanRecordService;
  private final ScanPersistenceService persistenceService;
  private final ScanProperties scanProperties;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  public ScanOrchestrator(
      ConfigurationProvider configurationProvider,
      RepositoryGateway repositoryGateway,
      PolicyEvaluationService evaluationService,
      CatalogReconciliationService reconciliationService,
      ScanRecordService scanRecordService,
      ScanPersistenceService persistenceService,
      ScanProperties scanProperties,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.configurationProvider = configurationProvider;
    this.repositoryGateway = repositoryGateway;
    this.evaluationService = evaluationService;
    this.reconciliationService = reconciliationService;
    this.scanRecordService = scanRecordService;
    this.persistenceService = persistenceService;
    this.scanProperties = scanProperties;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  public ScanOutcome performScan() {
    Scan scan = scanRecordService.startScan();
    long scanId = scan.getId();
    Instant startedAt = scan.getStartedAt();
    Instant deadline = startedAt.plus(scanProperties.getMaxDuration());
    log.info("Scan {} started", scanId);

    try {
      AppConfig config = configurationProvider.getConfig(false);
      checkpoint(scanId, deadline);

      Map<String, Policy> policies = reconciliationService.reconcilePolicies(config.policies());
      checkpoint(scanId, deadline);

      List<RemoteRepository> remoteRepositories = repositoryGateway.listActiveRepositories();
      checkpoint(scanId, deadline);
      RepositoryReconciliation reconciliation =
          reconciliationService.reconcileRepositories(remoteRepositories);
      log.info(
          "Scan {} reconciled {} repositories ({} new, {} renamed, {} removed)",
          scanId,
          reconciliation.repositories().size(),
          reconciliation.created(),
          reconciliation.renamed(),
          reconciliation.deleted());

      Map<Long, RemoteRepository> remoteById =
          remoteRepositories.stream()
              .collect(Collectors.toMap(RemoteRepository::id, Function.identity(), (a, b) -> a));
      List<RepositoryFindings> results = new ArrayList<>(reconciliation.repositories().size());
      for (TrackedRepository repository : reconciliation.repositories()) {
        checkpoint(scanId, deadline);
        RemoteRepository remote = remoteById.get(repository.getGithubRepositoryId());
        List<PolicyFinding> findings =
            evaluationService.evaluateRepository(remote, config.policies());
        results.add(new RepositoryFindings(repository.getId(), findings));
      }
      checkpoint(scanId, deadline);

      ScanOutcome outcome =
          persistenceService.completeScan(scanId, results, policies, clock.instant());
      recordCompletion(outcome, startedAt);
      log.info(
          "Scan {} completed: {} repositories, {} violations, remediation {}",
          scanId,
          outcome.repositoriesScanned(),
          outcome.violationCount(),
          outcome.remediationScheduled() ? "scheduled" : "not needed");
      return outcome;
    } catch (Throwable ex) {
      log.error("Scan {} failed", scanId, ex);
      markFailed(scanId, ex);
      meterRegistry.counter("policy_guard.scan.completed", "status", "failed").increment();
      throw ex;
    }
  }

  private void markFailed(long scanId, Throwable cause) {
    // JDBC calls on an interrupted thread are unreliable; restore the flag afterwards
    boolean interrupted = Thread.interrupted();
    try {
      scanRecordService.markFailed(scanId, cause);
    } catch (RuntimeException recordFailure) {
      cause.addSuppressed(recordFailure);
      log.error("Unable to mark scan {} as failed", scanId, recordFailure);
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private void checkpoint(long scanId, Instant deadline) {
    if (Thread.currentThread().isInterrupted()) {
      throw new ScanAbortedException("Scan %d was cancelled".formatted(scanId));
    }
    if (clock.instant().isAfter(deadline)) {
      throw new ScanAbortedException(
          "Scan %d exceeded its maximum duration of %s"
              .formatted(scanId, scanProperties.getMaxDuration()));
    }
  }

  private void recordCompletion(ScanOutcome outcome, Instant startedAt) {
    String status = outcome.status() == ScanStatus.COMPLETED ? "completed" : "failed";
    meterRegistry.counter("policy_guard.scan.completed", "status", status).increment();
    meterRegistry.counter("policy_guard.scan.violations").increment(outcome.violationCount());
    meterRegistry
        .timer("policy_guard.scan.duration")
        .record(Duration.between(startedAt, clock.instant()));
  }
}

package com.policyguard.backend.scan;

import com.policyguard.backend.compliance.domain.ComplianceStatus;
import com.policyguard.backend.compliance.domain.Policy;
import com.policyguard.backend.compliance.domain.Scan;
import com.policyguard.backend.compliance.domain.ScanStatus;
import com.policyguard.backend.compliance.domain.TrackedRepository;
import com.policyguard.backend.compliance.persistence.PolicyViolationRepository;
import com.policyguard.backend.compliance.persistence.ScanRepository;
import com.policyguard.backend.compliance.persistence.TrackedRepositoryRepository;
import com.policyguard.backend.job.JobScheduler;
import com.policyguard.backend.policy.PolicyFinding;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Write phase of a scan. Violations, repository statuses, the terminal scan state and the
 * remediation job all commit together or not at all.
 */
@Service
public class ScanPersistenceService {

  private static final Logger log = LoggerFactory.getLogger(ScanPersistenceService.class);

  private final ScanRepository scanRepository;
  private final TrackedRepositoryRepository trackedRepositoryRepository;
  private final PolicyViolationRepository violationRepository;
  private final JobScheduler jobScheduler;

  public ScanPersistenceService(
      ScanRepository scanRepository,
      TrackedRepositoryRepository trackedRepositoryRepository,
      PolicyViolationRepository violationRepository,
      JobScheduler jobScheduler) {
    this.scanRepository = Objects.requireNonNull(scanRepository, "scanRepository");
    this.trackedRepositoryRepository =
        Objects.requireNonNull(trackedRepositoryRepository, "trackedRepositoryRepository");
    this.violationRepository = Objects.requireNonNull(violationRepository, "violationRepository");
    this.jobScheduler = Objects.requireNonNull(jobScheduler, "jobScheduler");
  }

  @Transactional
  public ScanOutcome completeScan(
      long scanId,
      List<RepositoryFindings> results,
      Map<String, Policy> policiesByKey,
      Instant completedAt) {
    Scan scan =
        scanRepository
            .findById(scanId)
            .orElseThrow(() -> new IllegalStateException("Scan %d does not exist".formatted(scanId)));
    if (scan.isTerminal()) {
      throw new IllegalStateException(
          "Scan %d is already %s and cannot be completed".formatted(scanId, scan.getStatus()));
    }

    int violationCount = 0;
    for (RepositoryFindings result : results) {
      for (PolicyFinding finding : result.findings()) {
        Policy policy = policiesByKey.get(finding.policyType());
        if (policy == null) {
          throw new IllegalStateException(
              "No policy row for evaluated type '%s'".formatted(finding.policyType()));
        }
        int inserted =
            violationRepository.insertIfAbsent(
                scanId, result.repositoryId(), policy.getId(), finding.detail(), completedAt);
        if (inserted == 0) {
          log.debug(
              "Violation of '{}' for repository {} already recorded in scan {}",
              policy.getPolicyKey(),
              result.repositoryId(),
              scanId);
        }
        violationCount++;
      }
      updateRepositoryStatus(result, completedAt);
    }

    scan.complete(completedAt, results.size(), violationCount);
    scanRepository.save(scan);

    boolean remediationScheduled = false;
    if (violationCount > 0) {
      jobScheduler.enqueueRemediation(scanId);
      remediationScheduled = true;
    }
    return new ScanOutcome(
        scanId, ScanStatus.COMPLETED, results.size(), violationCount, remediationScheduled);
  }

  private void updateRepositoryStatus(RepositoryFindings result, Instant scannedAt) {
    TrackedRepository repository =
        trackedRepositoryRepository
            .findById(result.repositoryId())
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "Repository %d vanished during the scan".formatted(result.repositoryId())));
    repository.setComplianceStatus(
        result.compliant() ? ComplianceStatus.COMPLIANT : ComplianceStatus.NON_COMPLIANT);
    repository.setLastScannedAt(scannedAt);
    trackedRepositoryRepository.save(repository);
  }
}

package com.policyguard.backend.job;

import com.policyguard.backend.config.JobWorkerProperties;
import com.policyguard.backend.config.ScanProperties;
import com.policyguard.backend.scan.ScanRecordService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Releases work left behind by workers that died mid-run: RUNNING jobs go back through the retry
 * path and IN_PROGRESS scans are failed. Runs once right after startup, then periodically.
 */
@Component
@ConditionalOnProperty(
    prefix = "policy-guard.jobs",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class StaleWorkReclaimer {

  private static final Logger log = LoggerFactory.getLogger(StaleWorkReclaimer.class);

  private final PostgresJobScheduler jobScheduler;
  private final ScanRecordService scanRecordService;
  private final JobWorkerProperties properties;

  public StaleWorkReclaimer(
      PostgresJobScheduler jobScheduler,
      ScanRecordService scanRecordService,
      JobWorkerProperties properties,
      ScanProperties scanProperties) {
    this.jobScheduler = jobScheduler;
    this.scanRecordService = scanRecordService;
    this.properties = properties;
    if (properties.getLeaseTimeout().compareTo(scanProperties.getMaxDuration()) <= 0) {
      log.warn(
          "policy-guard.jobs.lease-timeout ({}) does not exceed policy-guard.scan.max-duration ({});"
              + " healthy scans may be reclaimed while still running",
          properties.getLeaseTimeout(),
          scanProperties.getMaxDuration());
    }
  }

  @Scheduled(
      initialDelayString = "PT0S",
      fixedDelayString = "${policy-guard.jobs.reclaim-delay:PT1M}")
  public void reclaimStaleWork() {
    try {
      int jobs = jobScheduler.reclaimExpiredJobs();
      int scans = scanRecordService.failAbandonedScans(properties.getLeaseTimeout());
      if (jobs > 0 || scans > 0) {
        log.info("Reclaimed {} expired jobs and {} abandoned scans", jobs, scans);
      }
    } catch (RuntimeException ex) {
      log.warn("Unable to reclaim stale work; will retry on the next run", ex);
    }
  }
}

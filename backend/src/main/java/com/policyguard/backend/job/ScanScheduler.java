package com.policyguard.backend.job;

import com.policyguard.backend.compliance.domain.JobStatus;
import com.policyguard.backend.compliance.domain.JobType;
import com.policyguard.backend.compliance.persistence.ScheduledJobRepository;
import java.util.EnumSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Enqueues time-triggered scans. A tick is skipped while another scan job is still waiting or
 * running.
 */
@Component
@ConditionalOnProperty(
    prefix = "policy-guard.scan",
    name = "scheduled-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class ScanScheduler {

  private static final Logger log = LoggerFactory.getLogger(ScanScheduler.class);

  private final JobScheduler jobScheduler;
  private final ScheduledJobRepository scheduledJobRepository;

  public ScanScheduler(JobScheduler jobScheduler, ScheduledJobRepository scheduledJobRepository) {
    this.jobScheduler = jobScheduler;
    this.scheduledJobRepository = scheduledJobRepository;
  }

  @Scheduled(cron = "${policy-guard.scan.cron:0 0 * * * *}", zone = "UTC")
  public void enqueueScheduledScan() {
    if (scheduledJobRepository.existsByJobTypeAndStatusIn(
        JobType.SCAN, EnumSet.of(JobStatus.PENDING, JobStatus.RUNNING))) {
      log.info("Skipping periodic compliance scan: a scan job is already queued or running");
      return;
    }
    log.info("Scheduling periodic compliance scan");
    jobScheduler.enqueueScan();
  }
}

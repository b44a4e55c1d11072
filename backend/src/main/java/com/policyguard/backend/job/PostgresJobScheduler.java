package com.policyguard.backend.job;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.policyguard.backend.compliance.domain.JobStatus;
import com.policyguard.backend.compliance.domain.JobType;
import com.policyguard.backend.compliance.domain.ScheduledJob;
import com.policyguard.backend.compliance.persistence.ScheduledJobRepository;
import com.policyguard.backend.config.JobWorkerProperties;
import com.policyguard.backend.webhook.PullRequestEvent;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class PostgresJobScheduler implements JobScheduler {

  private static final Logger log = LoggerFactory.getLogger(PostgresJobScheduler.class);
  private static final int MAX_ERROR_LENGTH = 2048;

  private final ScheduledJobRepository scheduledJobRepository;
  private final JobWorkerProperties properties;
  private final Clock clock;
  private final ObjectMapper objectMapper;

  public PostgresJobScheduler(
      ScheduledJobRepository scheduledJobRepository,
      JobWorkerProperties properties,
      Clock clock,
      ObjectMapper objectMapper) {
    this.scheduledJobRepository =
        Objects.requireNonNull(scheduledJobRepository, "scheduledJobRepository");
    this.properties = Objects.requireNonNull(properties, "properties");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  @Override
  @Transactional
  public ScheduledJob enqueueScan() {
    ScheduledJob job = scheduledJobRepository.save(new ScheduledJob(JobType.SCAN, null, clock.instant()));
    log.info("Enqueued scan job {}", job.getId());
    return job;
  }

  @Override
  @Transactional
  public ScheduledJob enqueueRemediation(long scanId) {
    ScheduledJob job =
        scheduledJobRepository.save(new ScheduledJob(JobType.REMEDIATION, scanId, clock.instant()));
    log.info("Enqueued remediation job {} for scan {}", job.getId(), scanId);
    return job;
  }

  @Override
  @Transactional
  public ScheduledJob enqueuePullRequestEvaluation(PullRequestEvent event) {
    ScheduledJob job =
        scheduledJobRepository.save(
            ScheduledJob.withPayload(
                JobType.PULL_REQUEST_EVALUATION,
                objectMapper.valueToTree(event),
                clock.instant()));
    log.info(
        "Enqueued pull request evaluation job {} for #{} in repository {}",
        job.getId(),
        event.pullRequestNumber(),
        event.repositoryId());
    return job;
  }

  @Transactional
  public Optional<ScheduledJob> lockNextPending(String workerId) {
    Instant now = clock.instant();
    Optional<ScheduledJob> jobOptional = scheduledJobRepository.lockNextJob(JobStatus.PENDING, now);
    jobOptional.ifPresent(
        job -> {
          job.setStatus(JobStatus.RUNNING);
          job.setAttempt(job.getAttempt() + 1);
          job.setLockedAt(now);
          job.setLockedBy(workerId);
          scheduledJobRepository.save(job);
        });
    return jobOptional;
  }

  @Transactional
  public void markSucceeded(long jobId) {
    scheduledJobRepository
        .findById(jobId)
        .ifPresent(
            job -> {
              job.setStatus(JobStatus.SUCCEEDED);
              job.setLastError(null);
              scheduledJobRepository.save(job);
            });
  }

  /**
   * Records a failed run. Retryable failures go back to PENDING with a linear backoff until the
   * attempt budget is spent.
   *
   * @return the status the job ended up in
   */
  @Transactional
  public JobStatus markFailed(long jobId, Throwable failure, boolean retryable) {
    ScheduledJob job = scheduledJobRepository.findById(jobId).orElse(null);
    if (job == null) {
      log.warn("Job {} disappeared before its failure could be recorded", jobId);
      return JobStatus.FAILED;
    }
    return fail(job, truncate(failure), retryable);
  }

  /**
   * Returns RUNNING jobs whose lock is older than the lease timeout to the retry path. Covers
   * workers that died without recording an outcome.
   *
   * @return number of reclaimed jobs
   */
  @Transactional
  public int reclaimExpiredJobs() {
    Instant cutoff = clock.instant().minus(properties.getLeaseTimeout());
    List<ScheduledJob> expired = scheduledJobRepository.lockExpiredRunningJobs(cutoff);
    for (ScheduledJob job : expired) {
      log.warn(
          "Reclaiming {} job {} locked by {} since {}",
          job.getJobType(),
          job.getId(),
          job.getLockedBy(),
          job.getLockedAt());
      fail(
          job,
          "Lease expired: worker %s did not finish within %s"
              .formatted(job.getLockedBy(), properties.getLeaseTimeout()),
          true);
    }
    return expired.size();
  }

  private JobStatus fail(ScheduledJob job, String error, boolean retryable) {
    job.setLastError(error);
    job.setLockedAt(null);
    job.setLockedBy(null);
    if (retryable && job.getAttempt() < properties.getMaxAttempts()) {
      Duration backoff = properties.getRetryBackoff().multipliedBy(job.getAttempt());
      job.setStatus(JobStatus.PENDING);
      job.setScheduledAt(clock.instant().plus(backoff));
      log.warn(
          "Job {} ({}) failed on attempt {}; retrying in {}",
          job.getId(),
          job.getJobType(),
          job.getAttempt(),
          backoff);
    } else {
      job.setStatus(JobStatus.FAILED);
      log.error(
          "Job {} ({}) failed permanently after {} attempt(s)",
          job.getId(),
          job.getJobType(),
          job.getAttempt());
    }
    scheduledJobRepository.save(job);
    return job.getStatus();
  }

  private static String truncate(Throwable failure) {
    String text =
        failure == null
            ? "unknown failure"
            : failure.getClass().getSimpleName()
                + (failure.getMessage() != null ? ": " + failure.getMessage() : "");
    return text.length() <= MAX_ERROR_LENGTH ? text : text.substring(0, MAX_ERROR_LENGTH);
  }
}

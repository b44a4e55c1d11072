package com.policyguard.backend.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.policyguard.backend.compliance.domain.JobStatus;
import com.policyguard.backend.compliance.domain.ScheduledJob;
import com.policyguard.backend.config.JobWorkerProperties;
import com.policyguard.backend.configuration.ConfigurationNotFoundException;
import com.policyguard.backend.configuration.InvalidConfigurationException;
import com.policyguard.backend.remediation.RemediationExecutor;
import com.policyguard.backend.scan.ScanOrchestrator;
import com.policyguard.backend.webhook.PullRequestEvent;
import com.policyguard.backend.webhook.PullRequestWebhookHandler;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/** Polls the job table and runs scan, remediation and pull request jobs on the worker pool. */
@Component
@ConditionalOnProperty(
    prefix = "policy-guard.jobs",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class JobWorker {

  private static final Logger log = LoggerFactory.getLogger(JobWorker.class);

  private final PostgresJobScheduler jobScheduler;
  private final ScanOrchestrator scanOrchestrator;
  private final RemediationExecutor remediationExecutor;
  private final PullRequestWebhookHandler pullRequestHandler;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;
  private final ExecutorService executorService;
  private final Semaphore slots;
  private final String workerIdPrefix;

  public JobWorker(
      PostgresJobScheduler jobScheduler,
      ScanOrchestrator scanOrchestrator,
      RemediationExecutor remediationExecutor,
      PullRequestWebhookHandler pullRequestHandler,
      ObjectMapper objectMapper,
      JobWorkerProperties properties,
      MeterRegistry meterRegistry,
      @Qualifier("jobWorkerExecutor") ExecutorService executorService) {
    this.jobScheduler = jobScheduler;
    this.scanOrchestrator = scanOrchestrator;
    this.remediationExecutor = remediationExecutor;
    this.pullRequestHandler = pullRequestHandler;
    this.objectMapper = objectMapper;
    this.meterRegistry = meterRegistry;
    this.executorService = executorService;
    this.slots = new Semaphore(properties.getMaxConcurrency());
    this.workerIdPrefix =
        StringUtils.hasText(properties.getWorkerIdPrefix())
            ? properties.getWorkerIdPrefix()
            : resolveDefaultWorkerId();
  }

  @Scheduled(fixedDelayString = "${policy-guard.jobs.poll-delay:PT1S}")
  public void pollQueue() {
    if (!slots.tryAcquire()) {
      return;
    }
    try {
      executorService.submit(
          () -> {
            try {
              processNext();
            } finally {
              slots.release();
            }
          });
    } catch (RuntimeException ex) {
      slots.release();
      log.warn("Job worker pool rejected a poll", ex);
    }
  }

  /** Locks and runs at most one pending job. */
  boolean processNext() {
    String workerId = workerIdPrefix + "-" + Thread.currentThread().getName();
    long start = System.nanoTime();
    String result = "empty";
    try {
      Optional<ScheduledJob> jobOptional = jobScheduler.lockNextPending(workerId);
      if (jobOptional.isEmpty()) {
        log.trace("Worker {} polled queue: no pending jobs", workerId);
        return false;
      }
      result = run(jobOptional.get(), workerId);
      return true;
    } catch (RuntimeException ex) {
      result = "error";
      log.error("Worker {} failed to poll the job queue", workerId, ex);
      return false;
    } finally {
      long elapsed = System.nanoTime() - start;
      meterRegistry.counter("policy_guard.jobs.poll", "result", result).increment();
      meterRegistry
          .timer("policy_guard.jobs.poll.duration", "result", result)
          .record(Duration.ofNanos(elapsed));
    }
  }

  private String run(ScheduledJob job, String workerId) {
    log.debug("Worker {} running {} job {}", workerId, job.getJobType(), job.getId());
    try {
      switch (job.getJobType()) {
        case SCAN -> scanOrchestrator.performScan();
        case REMEDIATION -> {
          if (job.getScanId() == null) {
            throw new IllegalStateException("Remediation job %d has no scan id".formatted(job.getId()));
          }
          remediationExecutor.processActionsForScan(job.getScanId());
        }
        case PULL_REQUEST_EVALUATION -> pullRequestHandler.handle(readPullRequestEvent(job));
      }
      jobScheduler.markSucceeded(job.getId());
      return "processed";
    } catch (Throwable ex) {
      if (ex instanceof Error) {
        log.error("Worker {} aborted {} job {}", workerId, job.getJobType(), job.getId(), ex);
      }
      JobStatus status = jobScheduler.markFailed(job.getId(), ex, isRetryable(ex));
      return status == JobStatus.PENDING ? "retry" : "failed";
    }
  }

  private PullRequestEvent readPullRequestEvent(ScheduledJob job) {
    if (job.getPayload() == null || job.getPayload().isNull()) {
      throw new IllegalStateException("Pull request job %d has no payload".formatted(job.getId()));
    }
    try {
      return objectMapper.treeToValue(job.getPayload(), PullRequestEvent.class);
    } catch (JsonProcessingException | IllegalArgumentException ex) {
      throw new IllegalStateException(
          "Pull request job %d has an unreadable payload".formatted(job.getId()), ex);
    }
  }

  static boolean isRetryable(Throwable ex) {
    return !(ex instanceof Error
        || ex instanceof ConfigurationNotFoundException
        || ex instanceof InvalidConfigurationException
        || ex instanceof IllegalStateException);
  }

  private String resolveDefaultWorkerId() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.warn("Unable to resolve hostname for worker id, falling back to default", ex);
      return "policy-job-worker";
    }
  }

  @PreDestroy
  public void shutdown() {
    executorService.shutdown();
    try {
      if (!executorService.awaitTermination(5, TimeUnit.SECONDS)) {
        // interrupts running scans; they mark themselves failed
        executorService.shutdownNow();
      }
    } catch (InterruptedException interruptedException) {
      Thread.currentThread().interrupt();
      executorService.shutdownNow();
    }
  }
}

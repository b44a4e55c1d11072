package com.policyguard.backend.job;

import static com.policyguard.backend.support.TestFields.setField;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.policyguard.backend.compliance.domain.JobStatus;
import com.policyguard.backend.compliance.domain.JobType;
import com.policyguard.backend.compliance.domain.ScheduledJob;
import com.policyguard.backend.config.JobWorkerProperties;
import com.policyguard.backend.configuration.ConfigurationNotFoundException;
import com.policyguard.backend.github.GitHubClientException;
import com.policyguard.backend.github.GitHubErrorKind;
import com.policyguard.backend.remediation.RemediationExecutor;
import com.policyguard.backend.scan.ScanOrchestrator;
import com.policyguard.backend.webhook.PullRequestEvent;
import com.policyguard.backend.webhook.PullRequestWebhookHandler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class JobWorkerTest {

  @Mock private PostgresJobScheduler jobScheduler;
  @Mock private ScanOrchestrator scanOrchestrator;
  @Mock private RemediationExecutor remediationExecutor;
  @Mock private PullRequestWebhookHandler pullRequestHandler;

  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private final ObjectMapper objectMapper = new ObjectMapper();
  private JobWorker worker;

  @BeforeEach
  void setUp() {
    MockitoAnnotations.openMocks(this);
    JobWorkerProperties properties = new JobWorkerProperties();
    properties.setWorkerIdPrefix("test-worker");
    worker =
        new JobWorker(
            jobScheduler,
            scanOrchestrator,
            remediationExecutor,
            pullRequestHandler,
            objectMapper,
            properties,
            meterRegistry,
            mock(ExecutorService.class));
  }

  @Test
  void emptyQueueReportsNothingProcessed() {
    when(jobScheduler.lockNextPending(anyString())).thenReturn(Optional.empty());

    assertThat(worker.processNext()).isFalse();
    verifyNoInteractions(scanOrchestrator, remediationExecutor);
    assertThat(meterRegistry.counter("policy_guard.jobs.poll", "result", "empty").count())
        .isEqualTo(1.0);
  }

  @Test
  void remediationJobRunsExecutorForItsScan() {
    ScheduledJob job = job(JobType.REMEDIATION, 42L);
    when(jobScheduler.lockNextPending(anyString())).thenReturn(Optional.of(job));

    assertThat(worker.processNext()).isTrue();

    verify(remediationExecutor).processActionsForScan(42L);
    verify(jobScheduler).markSucceeded(1L);
  }

  @Test
  void transientScanFailureIsRetried() {
    ScheduledJob job = job(JobType.SCAN, null);
    GitHubClientException rateLimited =
        new GitHubClientException("API rate limit exceeded", GitHubErrorKind.RATE_LIMITED, 403);
    when(jobScheduler.lockNextPending(anyString())).thenReturn(Optional.of(job));
    when(scanOrchestrator.performScan()).thenThrow(rateLimited);
    when(jobScheduler.markFailed(1L, rateLimited, true)).thenReturn(JobStatus.PENDING);

    worker.processNext();

    verify(jobScheduler).markFailed(1L, rateLimited, true);
    assertThat(meterRegistry.counter("policy_guard.jobs.poll", "result", "retry").count())
        .isEqualTo(1.0);
  }

  @Test
  void configurationFailureIsNotRetried() {
    ScheduledJob job = job(JobType.SCAN, null);
    ConfigurationNotFoundException missing = new ConfigurationNotFoundException("no policies");
    when(jobScheduler.lockNextPending(anyString())).thenReturn(Optional.of(job));
    when(scanOrchestrator.performScan()).thenThrow(missing);
    when(jobScheduler.markFailed(eq(1L), eq(missing), eq(false))).thenReturn(JobStatus.FAILED);

    worker.processNext();

    verify(jobScheduler).markFailed(1L, missing, false);
  }

  @Test
  void errorInsideJobIsRecordedAsPermanentFailure() {
    ScheduledJob job = job(JobType.SCAN, null);
    NoClassDefFoundError linkageError = new NoClassDefFoundError("org/yaml/snakeyaml/Yaml");
    when(jobScheduler.lockNextPending(anyString())).thenReturn(Optional.of(job));
    when(scanOrchestrator.performScan()).thenThrow(linkageError);
    when(jobScheduler.markFailed(1L, linkageError, false)).thenReturn(JobStatus.FAILED);

    assertThat(worker.processNext()).isTrue();

    verify(jobScheduler).markFailed(1L, linkageError, false);
    verify(jobScheduler, never()).markSucceeded(anyLong());
    assertThat(meterRegistry.counter("policy_guard.jobs.poll", "result", "failed").count())
        .isEqualTo(1.0);
  }

  @Test
  void pullRequestJobHandsItsEventToTheHandler() {
    PullRequestEvent event = new PullRequestEvent(7L, 12, "abc123", "synchronize", "delivery-1");
    ScheduledJob job =
        ScheduledJob.withPayload(
            JobType.PULL_REQUEST_EVALUATION,
            objectMapper.valueToTree(event),
            Instant.parse("2024-05-01T00:00:00Z"));
    setField(job, "id", 1L);
    when(jobScheduler.lockNextPending(anyString())).thenReturn(Optional.of(job));

    assertThat(worker.processNext()).isTrue();

    verify(pullRequestHandler).handle(event);
    verify(jobScheduler).markSucceeded(1L);
  }

  @Test
  void pullRequestJobWithUnreadablePayloadFailsPermanently() {
    ScheduledJob job =
        ScheduledJob.withPayload(
            JobType.PULL_REQUEST_EVALUATION,
            JsonNodeFactory.instance.objectNode().put("repositoryId", 7L),
            Instant.parse("2024-05-01T00:00:00Z"));
    setField(job, "id", 1L);
    when(jobScheduler.lockNextPending(anyString())).thenReturn(Optional.of(job));
    when(jobScheduler.markFailed(eq(1L), any(IllegalStateException.class), eq(false)))
        .thenReturn(JobStatus.FAILED);

    worker.processNext();

    verify(jobScheduler).markFailed(eq(1L), any(IllegalStateException.class), eq(false));
    verifyNoInteractions(pullRequestHandler);
  }

  private static ScheduledJob job(JobType type, Long scanId) {
    ScheduledJob job = new ScheduledJob(type, scanId, Instant.parse("2024-05-01T00:00:00Z"));
    setField(job, "id", 1L);
    return job;
  }
}

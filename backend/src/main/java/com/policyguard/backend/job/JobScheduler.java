package com.policyguard.backend.job;

import com.policyguard.backend.compliance.domain.ScheduledJob;
import com.policyguard.backend.webhook.PullRequestEvent;

/**
 * Deferred, at-least-once units of work. Enqueue calls join the caller's transaction, so work
 * scheduled from inside a transaction only becomes visible when it commits.
 */
public interface JobScheduler {

  ScheduledJob enqueueScan();

  ScheduledJob enqueueRemediation(long scanId);

  ScheduledJob enqueuePullRequestEvaluation(PullRequestEvent event);
}

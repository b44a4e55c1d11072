package com.policyguard.backend.config;

import jakarta.validation.constraints.Min;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "policy-guard.jobs")
public class JobWorkerProperties {

  private boolean enabled = true;
  private Duration pollDelay = Duration.ofSeconds(1);

  @Min(1)
  private int maxConcurrency = 1;

  @Min(1)
  private int maxAttempts = 5;

  private Duration retryBackoff = Duration.ofSeconds(30);
  private String workerIdPrefix;

  /** How long a RUNNING job or IN_PROGRESS scan may go untouched before it is reclaimed. */
  private Duration leaseTimeout = Duration.ofMinutes(45);

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public Duration getPollDelay() {
    return pollDelay;
  }

  public void setPollDelay(Duration pollDelay) {
    if (pollDelay != null && !pollDelay.isNegative() && !pollDelay.isZero()) {
      this.pollDelay = pollDelay;
    }
  }

  public int getMaxConcurrency() {
    return Math.max(1, maxConcurrency);
  }

  public void setMaxConcurrency(int maxConcurrency) {
    this.maxConcurrency = Math.max(1, maxConcurrency);
  }

  public int getMaxAttempts() {
    return Math.max(1, maxAttempts);
  }

  public void setMaxAttempts(int maxAttempts) {
    this.maxAttempts = Math.max(1, maxAttempts);
  }

  public Duration getRetryBackoff() {
    return retryBackoff;
  }

  public void setRetryBackoff(Duration retryBackoff) {
    if (retryBackoff != null && !retryBackoff.isNegative()) {
      this.retryBackoff = retryBackoff;
    }
  }

  public String getWorkerIdPrefix() {
    return workerIdPrefix;
  }

  public void setWorkerIdPrefix(String workerIdPrefix) {
    this.workerIdPrefix = workerIdPrefix;
  }

  public Duration getLeaseTimeout() {
    return leaseTimeout;
  }

  public void setLeaseTimeout(Duration leaseTimeout) {
    if (leaseTimeout != null && !leaseTimeout.isNegative() && !leaseTimeout.isZero()) {
      this.leaseTimeout = leaseTimeout;
    }
  }
}

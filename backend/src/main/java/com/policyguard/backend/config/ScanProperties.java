package com.policyguard.backend.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "policy-guard.scan")
public class ScanProperties {

  private boolean scheduledEnabled = true;
  private String cron = "0 0 * * * *";
  private Duration maxDuration = Duration.ofMinutes(30);
  private boolean includeArchived = true;

  public boolean isScheduledEnabled() {
    return scheduledEnabled;
  }

  public void setScheduledEnabled(boolean scheduledEnabled) {
    this.scheduledEnabled = scheduledEnabled;
  }

  public String getCron() {
    return cron;
  }

  public void setCron(String cron) {
    this.cron = cron;
  }

  public Duration getMaxDuration() {
    return maxDuration;
  }

  public void setMaxDuration(Duration maxDuration) {
    if (maxDuration != null && !maxDuration.isNegative() && !maxDuration.isZero()) {
      this.maxDuration = maxDuration;
    }
  }

  public boolean isIncludeArchived() {
    return includeArchived;
  }

  public void setIncludeArchived(boolean includeArchived) {
    this.includeArchived = includeArchived;
  }
}

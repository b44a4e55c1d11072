package com.policyguard.backend.compliance.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "scan")
public class Scan {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 32)
  private ScanStatus status;

  @Column(name = "started_at", nullable = false, updatable = false)
  private Instant startedAt;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Column(name = "repositories_scanned", nullable = false)
  private int repositoriesScanned;

  @Column(name = "violation_count", nullable = false)
  private int violationCount;

  @Column(name = "failure_reason", length = 1024)
  private String failureReason;

  protected Scan() {}

  public Scan(Instant startedAt) {
    this.status = ScanStatus.IN_PROGRESS;
    this.startedAt = startedAt;
  }

  public Long getId() {
    return id;
  }

  public ScanStatus getStatus() {
    return status;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public int getRepositoriesScanned() {
    return repositoriesScanned;
  }

  public int getViolationCount() {
    return violationCount;
  }

  public String getFailureReason() {
    return failureReason;
  }

  public boolean isTerminal() {
    return status != ScanStatus.IN_PROGRESS;
  }

  public void complete(Instant completedAt, int repositoriesScanned, int violationCount) {
    requireInProgress();
    this.status = ScanStatus.COMPLETED;
    this.completedAt = completedAt;
    this.repositoriesScanned = repositoriesScanned;
    this.violationCount = violationCount;
  }

  public void fail(Instant completedAt, String failureReason) {
    requireInProgress();
    this.status = ScanStatus.FAILED;
    this.completedAt = completedAt;
    this.failureReason = failureReason;
  }

  private void requireInProgress() {
    if (isTerminal()) {
      throw new IllegalStateException("Scan %s is already %s".formatted(id, status));
    }
  }
}

package com.policyguard.backend.compliance.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;

/** Local record of a remote repository, identified by its immutable GitHub id. */
@Entity
@Table(name = "tracked_repository")
public class TrackedRepository {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "github_repository_id", nullable = false, unique = true, updatable = false)
  private long githubRepositoryId;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Enumerated(EnumType.STRING)
  @Column(name = "compliance_status", nullable = false, length = 32)
  private ComplianceStatus complianceStatus = ComplianceStatus.PENDING;

  @Column(name = "last_scanned_at")
  private Instant lastScannedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected TrackedRepository() {}

  public TrackedRepository(long githubRepositoryId, String name) {
    this.githubRepositoryId = githubRepositoryId;
    this.name = name;
  }

  @PrePersist
  void onPersist() {
    Instant now = Instant.now();
    createdAt = now;
    updatedAt = now;
  }

  @PreUpdate
  void onUpdate() {
    updatedAt = Instant.now();
  }

  public Long getId() {
    return id;
  }

  public long getGithubRepositoryId() {
    return githubRepositoryId;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public ComplianceStatus getComplianceStatus() {
    return complianceStatus;
  }

  public void setComplianceStatus(ComplianceStatus complianceStatus) {
    this.complianceStatus = complianceStatus;
  }

  public Instant getLastScannedAt() {
    return lastScannedAt;
  }

  public void setLastScannedAt(Instant lastScannedAt) {
    this.lastScannedAt = lastScannedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}

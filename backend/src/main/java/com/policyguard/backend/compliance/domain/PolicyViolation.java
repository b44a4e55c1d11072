package com.policyguard.backend.compliance.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

/** At most one row per (scan, repository, policy); rows are written once and never updated. */
@Entity
@Immutable
@Table(
    name = "policy_violation",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uq_policy_violation_scan_repo_policy",
            columnNames = {"scan_id", "repository_id", "policy_id"}))
public class PolicyViolation {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "scan_id", nullable = false)
  @OnDelete(action = OnDeleteAction.CASCADE)
  private Scan scan;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "repository_id", nullable = false)
  @OnDelete(action = OnDeleteAction.CASCADE)
  private TrackedRepository repository;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "policy_id", nullable = false)
  @OnDelete(action = OnDeleteAction.CASCADE)
  private Policy policy;

  @Column(name = "detail", length = 1024)
  private String detail;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected PolicyViolation() {}

  public Long getId() {
    return id;
  }

  public Scan getScan() {
    return scan;
  }

  public TrackedRepository getRepository() {
    return repository;
  }

  public Policy getPolicy() {
    return policy;
  }

  public String getDetail() {
    return detail;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}

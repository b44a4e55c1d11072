package com.policyguard.backend.compliance.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import java.time.Instant;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

/** Append-only audit record of one remediation attempt. */
@Entity
@Immutable
@Table(name = "action_log")
public class ActionLog {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "scan_id")
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

  @Column(name = "action_type", nullable = false, length = 64)
  private String actionType;

  @Enumerated(EnumType.STRING)
  @Column(name = "outcome", nullable = false, length = 16)
  private ActionOutcome outcome;

  @Column(name = "details", length = 2048)
  private String details;

  @Column(name = "logged_at", nullable = false, updatable = false)
  private Instant loggedAt;

  protected ActionLog() {}

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

  public String getActionType() {
    return actionType;
  }

  public ActionOutcome getOutcome() {
    return outcome;
  }

  public String getDetails() {
    return details;
  }

  public Instant getLoggedAt() {
    return loggedAt;
  }
}

package com.policyguard.backend.compliance.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

@Entity
@Table(name = "policy")
public class Policy {

  private static final String ACTION_SEPARATOR = ",";

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "policy_key", nullable = false, unique = true, updatable = false, length = 128)
  private String policyKey;

  @Column(name = "description", nullable = false, length = 512)
  private String description;

  @Column(name = "actions", nullable = false, length = 512)
  private String actions = "";

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Policy() {}

  public Policy(String policyKey, String description) {
    this.policyKey = policyKey;
    this.description = description;
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

  public String getPolicyKey() {
    return policyKey;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public List<String> getActionList() {
    if (actions == null || actions.isBlank()) {
      return List.of();
    }
    return Arrays.stream(actions.split(ACTION_SEPARATOR))
        .map(String::trim)
        .filter(action -> !action.isEmpty())
        .toList();
  }

  public void setActionList(List<String> actionList) {
    this.actions = actionList == null ? "" : String.join(ACTION_SEPARATOR, actionList);
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}

package com.policyguard.backend.compliance.persistence;

import com.policyguard.backend.compliance.domain.ActionLog;
import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ActionLogRepository extends JpaRepository<ActionLog, Long> {

  /** Appends an audit row unless the same scan already logged this action for the pair. */
  @Modifying
  @Query(
      value =
          """
          INSERT INTO action_log
            (scan_id, repository_id, policy_id, action_type, outcome, details, logged_at)
          VALUES (:scanId, :repositoryId, :policyId, :actionType, :outcome, :details, :loggedAt)
          ON CONFLICT (scan_id, repository_id, policy_id, action_type) DO NOTHING
          """,
      nativeQuery = true)
  int insertIfAbsent(
      @Param("scanId") Long scanId,
      @Param("repositoryId") long repositoryId,
      @Param("policyId") long policyId,
      @Param("actionType") String actionType,
      @Param("outcome") String outcome,
      @Param("details") String details,
      @Param("loggedAt") Instant loggedAt);

  boolean existsByScanIdAndRepositoryIdAndPolicyIdAndActionType(
      Long scanId, Long repositoryId, Long policyId, String actionType);

  List<ActionLog> findByScanIdOrderByIdAsc(Long scanId);

  long countByRepositoryId(long repositoryId);
}

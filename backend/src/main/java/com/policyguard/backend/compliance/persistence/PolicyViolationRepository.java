package com.policyguard.backend.compliance.persistence;

import com.policyguard.backend.compliance.domain.PolicyViolation;
import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PolicyViolationRepository extends JpaRepository<PolicyViolation, Long> {

  /** Inserts the violation unless the (scan, repository, policy) triple is already recorded. */
  @Modifying
  @Query(
      value =
          """
          INSERT INTO policy_violation (scan_id, repository_id, policy_id, detail, created_at)
          VALUES (:scanId, :repositoryId, :policyId, :detail, :createdAt)
          ON CONFLICT (scan_id, repository_id, policy_id) DO NOTHING
          """,
      nativeQuery = true)
  int insertIfAbsent(
      @Param("scanId") long scanId,
      @Param("repositoryId") long repositoryId,
      @Param("policyId") long policyId,
      @Param("detail") String detail,
      @Param("createdAt") Instant createdAt);

  @Query(
      """
      SELECT v FROM PolicyViolation v
      JOIN FETCH v.repository
      JOIN FETCH v.policy
      WHERE v.scan.id = :scanId
      ORDER BY v.id
      """)
  List<PolicyViolation> findByScanIdWithDetails(@Param("scanId") long scanId);

  long countByScanId(long scanId);

  long countByRepositoryId(long repositoryId);
}

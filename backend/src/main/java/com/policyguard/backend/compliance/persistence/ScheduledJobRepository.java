package com.policyguard.backend.compliance.persistence;

import com.policyguard.backend.compliance.domain.JobStatus;
import com.policyguard.backend.compliance.domain.JobType;
import com.policyguard.backend.compliance.domain.ScheduledJob;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ScheduledJobRepository extends JpaRepository<ScheduledJob, Long> {

  @Query(
      value =
          """
          SELECT j.*
          FROM scheduled_job j
          WHERE j.status = :status
            AND j.scheduled_at <= :now
          ORDER BY j.scheduled_at, j.id
          FOR UPDATE SKIP LOCKED
          LIMIT 1
          """,
      nativeQuery = true)
  Optional<ScheduledJob> lockNextJob(@Param("status") String statusValue, @Param("now") Instant now);

  default Optional<ScheduledJob> lockNextJob(JobStatus status, Instant now) {
    return lockNextJob(status.name(), now);
  }

  @Query(
      value =
          """
          SELECT j.*
          FROM scheduled_job j
          WHERE j.status = 'RUNNING'
            AND j.locked_at < :cutoff
          ORDER BY j.locked_at, j.id
          FOR UPDATE SKIP LOCKED
          """,
      nativeQuery = true)
  List<ScheduledJob> lockExpiredRunningJobs(@Param("cutoff") Instant cutoff);

  boolean existsByJobTypeAndStatusIn(JobType jobType, Collection<JobStatus> statuses);

  List<ScheduledJob> findByScanIdOrderByIdAsc(Long scanId);
}

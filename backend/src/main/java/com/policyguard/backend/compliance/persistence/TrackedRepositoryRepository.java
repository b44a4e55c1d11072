package com.policyguard.backend.compliance.persistence;

import com.policyguard.backend.compliance.domain.TrackedRepository;
import java.util.Collection;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TrackedRepositoryRepository extends JpaRepository<TrackedRepository, Long> {

  Optional<TrackedRepository> findByGithubRepositoryId(long githubRepositoryId);

  // Violations and action logs go with the repository through ON DELETE CASCADE.
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("DELETE FROM TrackedRepository r WHERE r.id IN :ids")
  int deleteAllByIdIn(@Param("ids") Collection<Long> ids);
}

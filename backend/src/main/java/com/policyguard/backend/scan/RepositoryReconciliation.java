package com.policyguard.backend.scan;

import com.policyguard.backend.compliance.domain.TrackedRepository;
import java.util.List;

/** Local catalog after aligning it with the remote organization. */
public record RepositoryReconciliation(
    List<TrackedRepository> repositories, int created, int renamed, int deleted) {

  public RepositoryReconciliation {
    repositories = repositories == null ? List.of() : List.copyOf(repositories);
  }
}

package com.policyguard.backend.scan;

import com.policyguard.backend.compliance.domain.Policy;
import com.policyguard.backend.compliance.domain.TrackedRepository;
import com.policyguard.backend.compliance.persistence.PolicyRepository;
import com.policyguard.backend.compliance.persistence.TrackedRepositoryRepository;
import com.policyguard.backend.configuration.PolicyConfig;
import com.policyguard.backend.github.RemoteRepository;
import com.policyguard.backend.policy.PolicyTypes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Aligns the local policy and repository catalog with the configuration and the organization. */
@Service
public class CatalogReconciliationService {

  private static final Logger log = LoggerFactory.getLogger(CatalogReconciliationService.class);

  private final PolicyRepository policyRepository;
  private final TrackedRepositoryRepository trackedRepositoryRepository;

  public CatalogReconciliationService(
      PolicyRepository policyRepository, TrackedRepositoryRepository trackedRepositoryRepository) {
    this.policyRepository = Objects.requireNonNull(policyRepository, "policyRepository");
    this.trackedRepositoryRepository =
        Objects.requireNonNull(trackedRepositoryRepository, "trackedRepositoryRepository");
  }

  /**
   * Upserts one policy row per configured type tag and returns them keyed by normalized tag.
   * Policies missing from the configuration are left untouched so older scans keep their
   * references.
   */
  @Transactional
  public Map<String, Policy> reconcilePolicies(List<PolicyConfig> configured) {
    Map<String, Policy> result = new LinkedHashMap<>();
    for (PolicyConfig config : configured) {
      String key = PolicyTypes.normalize(config.type());
      if (result.containsKey(key)) {
        log.warn("Policy type '{}' is configured more than once; using the first entry", key);
        continue;
      }
      Policy policy =
          policyRepository
              .findByPolicyKey(key)
              .orElseGet(
                  () -> {
                    log.info("Registering policy '{}'", key);
                    return new Policy(key, config.name());
                  });
      policy.setDescription(config.name());
      policy.setActionList(config.actions());
      result.put(key, policyRepository.save(policy));
    }
    return Collections.unmodifiableMap(result);
  }

  /**
   * Creates unseen repositories, follows renames by remote id and deletes local repositories that
   * are no longer present remotely. Deleting a repository removes its violations and action logs.
   */
  @Transactional
  public RepositoryReconciliation reconcileRepositories(List<RemoteRepository> remoteRepositories) {
    Map<Long, RemoteRepository> remoteById =
        remoteRepositories.stream()
            .collect(
                Collectors.toMap(
                    RemoteRepository::id,
                    Function.identity(),
                    (first, second) -> first,
                    LinkedHashMap::new));

    List<TrackedRepository> known = trackedRepositoryRepository.findAll();
    List<Long> staleIds = new ArrayList<>();
    Map<Long, TrackedRepository> knownByRemoteId = new LinkedHashMap<>();
    for (TrackedRepository repository : known) {
      if (remoteById.containsKey(repository.getGithubRepositoryId())) {
        knownByRemoteId.put(repository.getGithubRepositoryId(), repository);
      } else {
        staleIds.add(repository.getId());
      }
    }

    int deleted = 0;
    if (!staleIds.isEmpty()) {
      deleted = trackedRepositoryRepository.deleteAllByIdIn(staleIds);
      log.info("Removed {} repositories no longer present in the organization", deleted);
      // the bulk delete cleared the persistence context
      knownByRemoteId.replaceAll(
          (remoteId, repository) ->
              trackedRepositoryRepository.findById(repository.getId()).orElseThrow());
    }

    int created = 0;
    int renamed = 0;
    List<TrackedRepository> reconciled = new ArrayList<>(remoteById.size());
    for (RemoteRepository remote : remoteById.values()) {
      TrackedRepository local = knownByRemoteId.get(remote.id());
      if (local == null) {
        local = new TrackedRepository(remote.id(), remote.name());
        created++;
      } else if (!Objects.equals(local.getName(), remote.name())) {
        log.info(
            "Repository {} renamed from '{}' to '{}'", remote.id(), local.getName(), remote.name());
        local.setName(remote.name());
        renamed++;
      }
      reconciled.add(trackedRepositoryRepository.save(local));
    }
    if (created > 0) {
      log.info("Tracking {} new repositories", created);
    }
    return new RepositoryReconciliation(reconciled, created, renamed, deleted);
  }
}

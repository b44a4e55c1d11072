package com.policyguard.backend.compliance.persistence;

import com.policyguard.backend.compliance.domain.Policy;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PolicyRepository extends JpaRepository<Policy, Long> {

  Optional<Policy> findByPolicyKey(String policyKey);
}

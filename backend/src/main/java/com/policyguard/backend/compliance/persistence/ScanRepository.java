package com.policyguard.backend.compliance.persistence;

import com.policyguard.backend.compliance.domain.Scan;
import com.policyguard.backend.compliance.domain.ScanStatus;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ScanRepository extends JpaRepository<Scan, Long> {

  Optional<Scan> findFirstByOrderByStartedAtDescIdDesc();

  List<Scan> findByStatusAndStartedAtBefore(ScanStatus status, Instant cutoff);
}

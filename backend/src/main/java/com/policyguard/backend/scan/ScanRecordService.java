package com.policyguard.backend.scan;

import com.policyguard.backend.compliance.domain.Scan;
import com.policyguard.backend.compliance.domain.ScanStatus;
import com.policyguard.backend.compliance.persistence.ScanRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Scan lifecycle writes that must commit on their own, independent of whatever transaction the
 * caller is running in.
 */
@Service
public class ScanRecordService {

  private static final Logger log = LoggerFactory.getLogger(ScanRecordService.class);
  private static final int MAX_REASON_LENGTH = 1024;

  private final ScanRepository scanRepository;
  private final Clock clock;

  public ScanRecordService(ScanRepository scanRepository, Clock clock) {
    this.scanRepository = Objects.requireNonNull(scanRepository, "scanRepository");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public Scan startScan() {
    return scanRepository.save(new Scan(clock.instant()));
  }

  /** Moves the scan to Failed unless it already reached a terminal state. */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public void markFailed(long scanId, Throwable cause) {
    Scan scan = scanRepository.findById(scanId).orElse(null);
    if (scan == null) {
      log.warn("Scan {} disappeared before it could be marked failed", scanId);
      return;
    }
    if (scan.isTerminal()) {
      log.debug("Scan {} is already {}; not marking failed", scanId, scan.getStatus());
      return;
    }
    scan.fail(clock.instant(), describe(cause));
    scanRepository.save(scan);
  }

  /**
   * Fails scans still IN_PROGRESS that started before {@code now - maxAge}. Their worker is gone,
   * so nothing else will ever finish them.
   *
   * @return number of scans moved to Failed
   */
  @Transactional
  public int failAbandonedScans(Duration maxAge) {
    Instant now = clock.instant();
    List<Scan> abandoned =
        scanRepository.findByStatusAndStartedAtBefore(ScanStatus.IN_PROGRESS, now.minus(maxAge));
    for (Scan scan : abandoned) {
      log.warn(
          "Scan {} started at {} was abandoned; marking failed", scan.getId(), scan.getStartedAt());
      scan.fail(now, "Abandoned: no progress recorded within " + maxAge);
      scanRepository.save(scan);
    }
    return abandoned.size();
  }

  static String describe(Throwable cause) {
    if (cause == null) {
      return "unknown failure";
    }
    String message = cause.getMessage();
    String reason =
        message == null || message.isBlank()
            ? cause.getClass().getSimpleName()
            : cause.getClass().getSimpleName() + ": " + message;
    return reason.length() <= MAX_REASON_LENGTH ? reason : reason.substring(0, MAX_REASON_LENGTH);
  }
}

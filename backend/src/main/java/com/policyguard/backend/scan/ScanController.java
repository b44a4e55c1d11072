package com.policyguard.backend.scan;

import com.policyguard.backend.auth.TeamAuthorizationService;
import com.policyguard.backend.compliance.domain.ScheduledJob;
import com.policyguard.backend.compliance.persistence.ScanRepository;
import com.policyguard.backend.job.JobScheduler;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/scans")
public class ScanController {

  private static final String BEARER_PREFIX = "Bearer ";

  private final JobScheduler jobScheduler;
  private final ScanRepository scanRepository;
  private final TeamAuthorizationService authorizationService;

  public ScanController(
      JobScheduler jobScheduler,
      ScanRepository scanRepository,
      TeamAuthorizationService authorizationService) {
    this.jobScheduler = jobScheduler;
    this.scanRepository = scanRepository;
    this.authorizationService = authorizationService;
  }

  /** Queues an on-demand scan for a member of the authorized team. */
  @PostMapping
  public ResponseEntity<Map<String, Object>> triggerScan(
      @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
    if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
      throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "GitHub user token required");
    }
    String userToken = authorization.substring(BEARER_PREFIX.length()).trim();
    if (!authorizationService.isUserAuthorized(userToken)) {
      throw new ResponseStatusException(HttpStatus.FORBIDDEN, "User is not in the authorized team");
    }
    ScheduledJob job = jobScheduler.enqueueScan();
    return ResponseEntity.accepted().body(Map.of("jobId", job.getId(), "status", job.getStatus()));
  }

  @GetMapping("/{scanId}")
  public ScanResponse getScan(@PathVariable long scanId) {
    return scanRepository
        .findById(scanId)
        .map(ScanResponse::from)
        .orElseThrow(
            () -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Scan " + scanId + " not found"));
  }

  @GetMapping("/latest")
  public ResponseEntity<ScanResponse> latestScan() {
    return scanRepository
        .findFirstByOrderByStartedAtDescIdDesc()
        .map(ScanResponse::from)
        .map(ResponseEntity::ok)
        .orElse(ResponseEntity.noContent().build());
  }
}

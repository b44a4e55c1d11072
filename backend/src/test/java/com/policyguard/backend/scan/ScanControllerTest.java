package com.policyguard.backend.scan;

import static com.policyguard.backend.support.TestFields.setField;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.policyguard.backend.auth.TeamAuthorizationService;
import com.policyguard.backend.compliance.domain.JobType;
import com.policyguard.backend.compliance.domain.Scan;
import com.policyguard.backend.compliance.domain.ScheduledJob;
import com.policyguard.backend.compliance.persistence.ScanRepository;
import com.policyguard.backend.job.JobScheduler;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class ScanControllerTest {

  @Mock private JobScheduler jobScheduler;
  @Mock private ScanRepository scanRepository;
  @Mock private TeamAuthorizationService authorizationService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    MockitoAnnotations.openMocks(this);
    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new ScanController(jobScheduler, scanRepository, authorizationService))
            .build();
  }

  @Test
  void authorizedUserQueuesScan() throws Exception {
    ScheduledJob job = new ScheduledJob(JobType.SCAN, null, Instant.parse("2024-05-01T00:00:00Z"));
    setField(job, "id", 8L);
    when(authorizationService.isUserAuthorized("gho_user")).thenReturn(true);
    when(jobScheduler.enqueueScan()).thenReturn(job);

    mockMvc
        .perform(post("/api/scans").header("Authorization", "Bearer gho_user"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId").value(8))
        .andExpect(jsonPath("$.status").value("PENDING"));
  }

  @Test
  void userOutsideTeamIsForbidden() throws Exception {
    when(authorizationService.isUserAuthorized("gho_user")).thenReturn(false);

    mockMvc
        .perform(post("/api/scans").header("Authorization", "Bearer gho_user"))
        .andExpect(status().isForbidden());
    verify(jobScheduler, never()).enqueueScan();
  }

  @Test
  void missingTokenIsUnauthorized() throws Exception {
    mockMvc.perform(post("/api/scans")).andExpect(status().isUnauthorized());
  }

  @Test
  void reportsScanState() throws Exception {
    Scan scan = new Scan(Instant.parse("2024-05-01T00:00:00Z"));
    setField(scan, "id", 3L);
    when(scanRepository.findById(3L)).thenReturn(Optional.of(scan));

    mockMvc
        .perform(get("/api/scans/3"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.id").value(3))
        .andExpect(jsonPath("$.status").value("IN_PROGRESS"));
  }

  @Test
  void unknownScanIsNotFound() throws Exception {
    when(scanRepository.findById(4L)).thenReturn(Optional.empty());

    mockMvc.perform(get("/api/scans/4")).andExpect(status().isNotFound());
  }

  @Test
  void noScansYieldsNoContent() throws Exception {
    when(scanRepository.findFirstByOrderByStartedAtDescIdDesc()).thenReturn(Optional.empty());

    mockMvc.perform(get("/api/scans/latest")).andExpect(status().isNoContent());
  }
}

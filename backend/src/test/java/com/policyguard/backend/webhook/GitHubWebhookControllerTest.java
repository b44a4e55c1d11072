package com.policyguard.backend.webhook;

import static com.policyguard.backend.support.TestFields.setField;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.policyguard.backend.compliance.domain.JobType;
import com.policyguard.backend.compliance.domain.ScheduledJob;
import com.policyguard.backend.config.GitHubAppProperties;
import com.policyguard.backend.job.JobScheduler;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class GitHubWebhookControllerTest {

  private static final String SECRET = "webhook-secret";
  private static final String PULL_REQUEST_BODY =
      """
      {
        "action": "synchronize",
        "pull_request": {"number": 12, "head": {"sha": "abc123"}},
        "repository": {"id": 7, "full_name": "acme/widgets"}
      }
      """;

  @Mock private JobScheduler jobScheduler;

  private GitHubAppProperties properties;
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    MockitoAnnotations.openMocks(this);
    properties = new GitHubAppProperties();
    properties.setWebhookSecret(SECRET);
    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new GitHubWebhookController(
                    new WebhookSignatureVerifier(properties), jobScheduler, new ObjectMapper()))
            .build();
  }

  @Test
  void pullRequestEventIsQueued() throws Exception {
    ScheduledJob job =
        ScheduledJob.withPayload(
            JobType.PULL_REQUEST_EVALUATION, null, Instant.parse("2024-05-01T00:00:00Z"));
    setField(job, "id", 31L);
    PullRequestEvent expected = new PullRequestEvent(7L, 12, "abc123", "synchronize", "d-1");
    when(jobScheduler.enqueuePullRequestEvaluation(expected)).thenReturn(job);

    mockMvc
        .perform(signed("pull_request", PULL_REQUEST_BODY))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId").value(31))
        .andExpect(jsonPath("$.status").value("PENDING"));

    verify(jobScheduler).enqueuePullRequestEvaluation(expected);
  }

  @Test
  void pingIsAnswered() throws Exception {
    mockMvc
        .perform(signed("ping", "{\"zen\":\"Design for failure.\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.message").value("pong"));
    verifyNoInteractions(jobScheduler);
  }

  @Test
  void otherEventsAreAcknowledgedWithoutWork() throws Exception {
    mockMvc
        .perform(signed("push", "{\"ref\":\"refs/heads/main\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.received").value(true));
    verifyNoInteractions(jobScheduler);
  }

  @Test
  void closedPullRequestIsIgnored() throws Exception {
    mockMvc
        .perform(signed("pull_request", PULL_REQUEST_BODY.replace("synchronize", "closed")))
        .andExpect(status().isOk());
    verifyNoInteractions(jobScheduler);
  }

  @Test
  void invalidSignatureIsRejected() throws Exception {
    mockMvc
        .perform(
            delivery("pull_request", PULL_REQUEST_BODY)
                .header(GitHubWebhookController.SIGNATURE_HEADER, "sha256=" + "0".repeat(64)))
        .andExpect(status().isUnauthorized());
    verifyNoInteractions(jobScheduler);
  }

  @Test
  void missingSignatureIsRejected() throws Exception {
    mockMvc
        .perform(delivery("pull_request", PULL_REQUEST_BODY))
        .andExpect(status().isUnauthorized());
    verifyNoInteractions(jobScheduler);
  }

  @Test
  void unconfiguredSecretRejectsEverything() throws Exception {
    MockHttpServletRequestBuilder request = signed("ping", "{}");
    properties.setWebhookSecret(null);

    mockMvc.perform(request).andExpect(status().isUnauthorized());
  }

  @Test
  void malformedPullRequestPayloadIsABadRequest() throws Exception {
    mockMvc.perform(signed("pull_request", "{not json")).andExpect(status().isBadRequest());
    mockMvc
        .perform(signed("pull_request", "{\"action\":\"opened\",\"repository\":{\"id\":7}}"))
        .andExpect(status().isBadRequest());
    verify(jobScheduler, never()).enqueuePullRequestEvaluation(any());
  }

  private static MockHttpServletRequestBuilder signed(String event, String body) {
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    return delivery(event, body)
        .header(
            GitHubWebhookController.SIGNATURE_HEADER,
            WebhookSignatureVerifier.signatureHeader(bytes, SECRET));
  }

  private static MockHttpServletRequestBuilder delivery(String event, String body) {
    return post("/api/webhooks/github")
        .contentType(MediaType.APPLICATION_JSON)
        .header(GitHubWebhookController.EVENT_HEADER, event)
        .header(GitHubWebhookController.DELIVERY_HEADER, "d-1")
        .content(body.getBytes(StandardCharsets.UTF_8));
  }
}

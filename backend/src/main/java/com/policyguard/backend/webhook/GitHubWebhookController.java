package com.policyguard.backend.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.policyguard.backend.compliance.domain.ScheduledJob;
import com.policyguard.backend.job.JobScheduler;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * Receives GitHub App deliveries. Signatures are checked against the raw body before anything is
 * parsed; pull request events are queued for re-evaluation and acknowledged immediately.
 */
@RestController
@RequestMapping("/api/webhooks/github")
public class GitHubWebhookController {

  private static final Logger log = LoggerFactory.getLogger(GitHubWebhookController.class);

  static final String EVENT_HEADER = "X-GitHub-Event";
  static final String DELIVERY_HEADER = "X-GitHub-Delivery";
  static final String SIGNATURE_HEADER = "X-Hub-Signature-256";

  private final WebhookSignatureVerifier signatureVerifier;
  private final JobScheduler jobScheduler;
  private final ObjectMapper objectMapper;

  public GitHubWebhookController(
      WebhookSignatureVerifier signatureVerifier,
      JobScheduler jobScheduler,
      ObjectMapper objectMapper) {
    this.signatureVerifier = signatureVerifier;
    this.jobScheduler = jobScheduler;
    this.objectMapper = objectMapper;
  }

  @PostMapping
  public ResponseEntity<Map<String, Object>> receive(
      @RequestHeader(name = EVENT_HEADER, required = false) String event,
      @RequestHeader(name = DELIVERY_HEADER, required = false) String deliveryId,
      @RequestHeader(name = SIGNATURE_HEADER, required = false) String signature,
      @RequestBody(required = false) byte[] body) {
    if (!signatureVerifier.isConfigured()) {
      throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Webhook secret not configured");
    }
    if (signature == null || signature.isBlank()) {
      throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Missing signature");
    }
    byte[] payload = body == null ? new byte[0] : body;
    if (!signatureVerifier.isValid(payload, signature)) {
      log.warn("Rejected webhook delivery {} with an invalid signature", deliveryId);
      throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Invalid signature");
    }
    log.debug("Received webhook delivery {} for event '{}'", deliveryId, event);

    if ("ping".equals(event)) {
      return ResponseEntity.ok(Map.of("message", "pong"));
    }
    if (!"pull_request".equals(event)) {
      return ResponseEntity.ok(Map.of("received", true));
    }

    JsonNode root;
    try {
      root = objectMapper.readTree(payload);
    } catch (IOException ex) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Malformed payload", ex);
    }
    Optional<PullRequestEvent> pullRequest = PullRequestEvent.fromPayload(root, deliveryId);
    if (pullRequest.isEmpty()) {
      throw new ResponseStatusException(
          HttpStatus.BAD_REQUEST, "Payload lacks repository id, pull request number or head sha");
    }
    if ("closed".equals(pullRequest.get().action())) {
      return ResponseEntity.ok(Map.of("received", true, "ignored", "closed"));
    }
    ScheduledJob job = jobScheduler.enqueuePullRequestEvaluation(pullRequest.get());
    log.info(
        "Queued evaluation of pull request #{} in repository {} as job {} (delivery {})",
        pullRequest.get().pullRequestNumber(),
        pullRequest.get().repositoryId(),
        job.getId(),
        deliveryId);
    return ResponseEntity.accepted().body(Map.of("jobId", job.getId(), "status", job.getStatus()));
  }
}

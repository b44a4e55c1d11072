package com.policyguard.backend.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

/** The slice of a GitHub {@code pull_request} delivery that re-evaluation needs. */
public record PullRequestEvent(
    long repositoryId, int pullRequestNumber, String headSha, String action, String deliveryId) {

  public PullRequestEvent {
    if (repositoryId <= 0) {
      throw new IllegalArgumentException("repositoryId must be positive");
    }
    if (pullRequestNumber <= 0) {
      throw new IllegalArgumentException("pullRequestNumber must be positive");
    }
    if (headSha == null || headSha.isBlank()) {
      throw new IllegalArgumentException("headSha must not be blank");
    }
  }

  /** Reads the event from a delivery body; empty when a required field is missing. */
  public static Optional<PullRequestEvent> fromPayload(JsonNode payload, String deliveryId) {
    if (payload == null) {
      return Optional.empty();
    }
    long repositoryId = payload.path("repository").path("id").asLong(0);
    int number = payload.path("pull_request").path("number").asInt(0);
    String headSha = payload.path("pull_request").path("head").path("sha").asText("");
    if (repositoryId <= 0 || number <= 0 || headSha.isBlank()) {
      return Optional.empty();
    }
    String action = payload.path("action").asText(null);
    return Optional.of(new PullRequestEvent(repositoryId, number, headSha, action, deliveryId));
  }
}

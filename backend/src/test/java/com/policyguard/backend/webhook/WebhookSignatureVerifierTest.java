package com.policyguard.backend.webhook;

import static org.assertj.core.api.Assertions.assertThat;

import com.policyguard.backend.config.GitHubAppProperties;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WebhookSignatureVerifierTest {

  private static final byte[] BODY = "{\"zen\":\"Keep it logically awesome.\"}"
      .getBytes(StandardCharsets.UTF_8);

  private GitHubAppProperties properties;
  private WebhookSignatureVerifier verifier;

  @BeforeEach
  void setUp() {
    properties = new GitHubAppProperties();
    properties.setWebhookSecret("It's a Secret to Everybody");
    verifier = new WebhookSignatureVerifier(properties);
  }

  @Test
  void matchesGitHubsPublishedExample() {
    byte[] body = "Hello, World!".getBytes(StandardCharsets.UTF_8);

    assertThat(
            verifier.isValid(
                body,
                "sha256=757107ea0eb2509fc211221cce984b8a37570b6d7586c22c46f4379c8b043e17"))
        .isTrue();
  }

  @Test
  void acceptsSignatureOfTheExactBody() {
    String header = WebhookSignatureVerifier.signatureHeader(BODY, "It's a Secret to Everybody");

    assertThat(verifier.isValid(BODY, header)).isTrue();
  }

  @Test
  void rejectsTamperedBodyWrongSecretAndMalformedHeaders() {
    String header = WebhookSignatureVerifier.signatureHeader(BODY, "It's a Secret to Everybody");
    byte[] tampered = "{\"zen\":\"changed\"}".getBytes(StandardCharsets.UTF_8);

    assertThat(verifier.isValid(tampered, header)).isFalse();
    assertThat(verifier.isValid(BODY, WebhookSignatureVerifier.signatureHeader(BODY, "other")))
        .isFalse();
    assertThat(verifier.isValid(BODY, header.substring("sha256=".length()))).isFalse();
    assertThat(verifier.isValid(BODY, "sha256=not-hex")).isFalse();
    assertThat(verifier.isValid(BODY, "sha1=" + header.substring("sha256=".length()))).isFalse();
    assertThat(verifier.isValid(BODY, null)).isFalse();
  }

  @Test
  void nothingIsValidWithoutASecret() {
    String header = WebhookSignatureVerifier.signatureHeader(BODY, "previous-secret");
    properties.setWebhookSecret(" ");

    assertThat(verifier.isConfigured()).isFalse();
    assertThat(verifier.isValid(BODY, header)).isFalse();
  }
}

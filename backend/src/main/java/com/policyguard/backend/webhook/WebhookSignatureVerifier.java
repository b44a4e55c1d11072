package com.policyguard.backend.webhook;

import com.policyguard.backend.config.GitHubAppProperties;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Objects;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/** Checks {@code X-Hub-Signature-256} against an HMAC-SHA256 of the raw body. */
@Component
public class WebhookSignatureVerifier {

  static final String SIGNATURE_PREFIX = "sha256=";
  private static final String ALGORITHM = "HmacSHA256";

  private final GitHubAppProperties properties;

  public WebhookSignatureVerifier(GitHubAppProperties properties) {
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  public boolean isConfigured() {
    return StringUtils.hasText(properties.getWebhookSecret());
  }

  public boolean isValid(byte[] body, String signatureHeader) {
    if (!isConfigured() || body == null || signatureHeader == null) {
      return false;
    }
    if (!signatureHeader.startsWith(SIGNATURE_PREFIX)) {
      return false;
    }
    byte[] expected = sign(body, properties.getWebhookSecret());
    byte[] provided;
    try {
      provided = HexFormat.of().parseHex(signatureHeader.substring(SIGNATURE_PREFIX.length()));
    } catch (IllegalArgumentException ex) {
      return false;
    }
    return MessageDigest.isEqual(expected, provided);
  }

  static byte[] sign(byte[] body, String secret) {
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
      return mac.doFinal(body);
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("HmacSHA256 is not available", ex);
    }
  }

  static String signatureHeader(byte[] body, String secret) {
    return SIGNATURE_PREFIX + HexFormat.of().formatHex(sign(body, secret));
  }
}

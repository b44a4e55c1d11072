package com.policyguard.backend.github;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTCreationException;
import com.policyguard.backend.config.GitHubAppProperties;
import com.policyguard.backend.github.InstallationTokenExchanger.IssuedToken;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.interfaces.RSAPrivateKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.kohsuke.github.GitHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Owns the GitHub App identity. Installation tokens are cached in memory and refreshed once they
 * come within {@code github.app.token-refresh-skew} of their reported expiry; user-delegated clients
 * are built per call and never touch the cache.
 */
@Component
public class GitHubTokenManager {

  private static final Logger log = LoggerFactory.getLogger(GitHubTokenManager.class);

  private static final Duration MAX_JWT_TTL = Duration.ofMinutes(10);
  private static final Duration DEFAULT_TOKEN_LIFETIME = Duration.ofHours(1);
  // DER prefix wrapping a PKCS#1 RSA key into PKCS#8 (AlgorithmIdentifier rsaEncryption + NULL).
  private static final byte[] RSA_ALGORITHM_IDENTIFIER = {
    0x30, 0x0d, 0x06, 0x09, 0x2a, (byte) 0x86, 0x48, (byte) 0x86, (byte) 0xf7, 0x0d, 0x01, 0x01,
    0x01, 0x05, 0x00
  };

  private final GitHubAppProperties properties;
  private final InstallationTokenExchanger tokenExchanger;
  private final GitHubClientFactory clientFactory;
  private final Clock clock;
  private final AtomicReference<CachedToken> cachedToken = new AtomicReference<>();
  private final Object tokenLock = new Object();
  private final AtomicReference<PrivateKey> cachedPrivateKey = new AtomicReference<>();

  GitHubTokenManager(
      GitHubAppProperties properties,
      InstallationTokenExchanger tokenExchanger,
      GitHubClientFactory clientFactory,
      Clock clock) {
    this.properties = Objects.requireNonNull(properties, "properties");
    this.tokenExchanger = Objects.requireNonNull(tokenExchanger, "tokenExchanger");
    this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** Returns an installation token valid for at least the configured refresh skew. */
  public String getServiceToken() {
    String pat = properties.getPersonalAccessToken();
    if (StringUtils.hasText(pat)) {
      return pat.trim();
    }
    ensureAppCredentials();

    CachedToken snapshot = cachedToken.get();
    if (snapshot != null && snapshot.isFresh(clock.instant(), refreshSkew())) {
      return snapshot.value();
    }
    synchronized (tokenLock) {
      snapshot = cachedToken.get();
      if (snapshot != null && snapshot.isFresh(clock.instant(), refreshSkew())) {
        return snapshot.value();
      }
      CachedToken refreshed = refreshInstallationToken();
      cachedToken.set(refreshed);
      return refreshed.value();
    }
  }

  /** Builds a client acting as the user who owns {@code userToken}. */
  public GitHub getUserScopedClient(String userToken) {
    if (!StringUtils.hasText(userToken)) {
      throw new IllegalArgumentException("userToken must not be blank");
    }
    try {
      return clientFactory.createTokenClient(userToken);
    } catch (IOException ex) {
      throw GitHubClientException.from("Failed to create user-scoped GitHub client", ex);
    }
  }

  private CachedToken refreshInstallationToken() {
    String jwt = generateAppJwt();
    long installationId = requireInstallationId();
    try {
      IssuedToken token = tokenExchanger.exchange(jwt, installationId);
      if (token == null || !StringUtils.hasText(token.value())) {
        throw new CredentialException(
            "GitHub returned an empty installation token (installationId=%s)"
                .formatted(installationId));
      }
      Instant expiresAt =
          token.expiresAt() != null
              ? token.expiresAt()
              : clock.instant().plus(DEFAULT_TOKEN_LIFETIME);
      log.debug(
          "Generated GitHub installation token; expires at {} (installationId={})",
          expiresAt,
          installationId);
      return new CachedToken(token.value(), expiresAt);
    } catch (IOException ex) {
      throw new CredentialException("Failed to refresh GitHub installation token", ex);
    }
  }

  private String generateAppJwt() {
    String appId = properties.getAppId();
    if (!StringUtils.hasText(appId)) {
      throw new CredentialException("GitHub App ID must be provided when using app authentication");
    }
    RSAPrivateKey privateKey = castToRsa(resolvePrivateKey());
    Instant now = clock.instant();
    Duration skew =
        properties.getJwtClockSkew() != null ? properties.getJwtClockSkew() : Duration.ofSeconds(60);
    Instant issuedAt = now.minus(skew);
    Duration ttl =
        properties.getAppJwtTtl() != null ? properties.getAppJwtTtl() : Duration.ofMinutes(9);
    if (ttl.compareTo(MAX_JWT_TTL) > 0) {
      ttl = MAX_JWT_TTL;
    }
    Instant expiresAt = now.plus(ttl);
    try {
      return JWT.create()
          .withIssuer(appId.trim())
          .withIssuedAt(Date.from(issuedAt))
          .withExpiresAt(Date.from(expiresAt))
          .sign(Algorithm.RSA256(null, privateKey));
    } catch (JWTCreationException ex) {
      throw new CredentialException("Failed to sign GitHub App assertion", ex);
    }
  }

  private RSAPrivateKey castToRsa(PrivateKey privateKey) {
    if (privateKey instanceof RSAPrivateKey rsa) {
      return rsa;
    }
    throw new CredentialException("GitHub App private key must be an RSA private key");
  }

  private PrivateKey resolvePrivateKey() {
    PrivateKey cached = cachedPrivateKey.get();
    if (cached != null) {
      return cached;
    }
    synchronized (cachedPrivateKey) {
      cached = cachedPrivateKey.get();
      if (cached != null) {
        return cached;
      }
      PrivateKey parsed = parsePrivateKey(properties.getPrivateKeyBase64());
      cachedPrivateKey.set(parsed);
      return parsed;
    }
  }

  private PrivateKey parsePrivateKey(String base64Input) {
    if (!StringUtils.hasText(base64Input)) {
      throw new CredentialException("GitHub App private key (Base64) must be provided");
    }
    try {
      byte[] decoded = Base64.getDecoder().decode(base64Input.trim());
      String pem = new String(decoded, StandardCharsets.UTF_8);
      boolean pkcs1 = pem.contains("BEGIN RSA PRIVATE KEY");
      String sanitized = pem.replaceAll("-----(BEGIN|END)[A-Z ]*-----", "").replaceAll("\\s+", "");
      byte[] keyBytes = Base64.getDecoder().decode(sanitized);
      if (pkcs1) {
        keyBytes = wrapPkcs1(keyBytes);
      }
      KeyFactory keyFactory = KeyFactory.getInstance("RSA");
      return keyFactory.generatePrivate(new PKCS8EncodedKeySpec(keyBytes));
    } catch (IllegalArgumentException | GeneralSecurityException ex) {
      throw new CredentialException("Failed to parse GitHub App private key", ex);
    }
  }

  // GitHub issues PKCS#1 keys; the JDK only reads PKCS#8.
  private static byte[] wrapPkcs1(byte[] pkcs1) {
    ByteArrayOutputStream body = new ByteArrayOutputStream();
    body.writeBytes(new byte[] {0x02, 0x01, 0x00});
    body.writeBytes(RSA_ALGORITHM_IDENTIFIER);
    body.write(0x04);
    body.writeBytes(derLength(pkcs1.length));
    body.writeBytes(pkcs1);
    byte[] content = body.toByteArray();

    ByteArrayOutputStream sequence = new ByteArrayOutputStream();
    sequence.write(0x30);
    sequence.writeBytes(derLength(content.length));
    sequence.writeBytes(content);
    return sequence.toByteArray();
  }

  private static byte[] derLength(int length) {
    if (length < 0x80) {
      return new byte[] {(byte) length};
    }
    if (length <= 0xff) {
      return new byte[] {(byte) 0x81, (byte) length};
    }
    if (length <= 0xffff) {
      return new byte[] {(byte) 0x82, (byte) (length >> 8), (byte) length};
    }
    return new byte[] {(byte) 0x83, (byte) (length >> 16), (byte) (length >> 8), (byte) length};
  }

  private long requireInstallationId() {
    Long installationId = properties.getInstallationId();
    if (installationId == null || installationId <= 0) {
      throw new CredentialException("GitHub App installation ID must be provided");
    }
    return installationId;
  }

  private void ensureAppCredentials() {
    if (!StringUtils.hasText(properties.getAppId())
        || !StringUtils.hasText(properties.getPrivateKeyBase64())
        || properties.getInstallationId() == null) {
      throw new CredentialException(
          "GitHub App credentials are not fully configured. Provide appId, installationId and private key.");
    }
  }

  private Duration refreshSkew() {
    Duration skew = properties.getTokenRefreshSkew();
    return skew != null ? skew : Duration.ofMinutes(5);
  }

  private record CachedToken(String value, Instant expiresAt) {

    boolean isFresh(Instant now, Duration refreshSkew) {
      return now.isBefore(expiresAt.minus(refreshSkew));
    }
  }
}

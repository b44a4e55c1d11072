package com.policyguard.backend.github;

import java.io.IOException;
import java.time.Instant;
import java.util.Objects;
import org.kohsuke.github.GHApp;
import org.kohsuke.github.GHAppInstallation;
import org.kohsuke.github.GHAppInstallationToken;
import org.kohsuke.github.GitHub;
import org.springframework.stereotype.Component;

/** Exchanges a signed App assertion for an installation-scoped access token. */
@Component
class InstallationTokenExchanger {

  private final GitHubClientFactory clientFactory;

  InstallationTokenExchanger(GitHubClientFactory clientFactory) {
    this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
  }

  IssuedToken exchange(String appJwt, long installationId) throws IOException {
    GitHub appClient = clientFactory.createAppClient(appJwt);
    GHApp app = appClient.getApp();
    GHAppInstallation installation = app.getInstallationById(installationId);
    if (installation == null) {
      throw new CredentialException(
          "GitHub App installation not found for id %s".formatted(installationId));
    }
    GHAppInstallationToken token = installation.createToken().create();
    Instant expiresAt = token.getExpiresAt() != null ? token.getExpiresAt().toInstant() : null;
    return new IssuedToken(token.getToken(), expiresAt);
  }

  record IssuedToken(String value, Instant expiresAt) {}
}

package com.policyguard.backend.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "github.app")
public class GitHubAppProperties {

  private String baseUrl = "https://api.github.com";
  private String organization;
  private String appId;
  private Long installationId;
  private String privateKeyBase64;
  private String personalAccessToken;
  private Duration appJwtTtl = Duration.ofMinutes(9);
  private Duration jwtClockSkew = Duration.ofSeconds(60);
  private Duration tokenRefreshSkew = Duration.ofMinutes(5);
  private Duration connectTimeout = Duration.ofSeconds(10);
  private Duration readTimeout = Duration.ofSeconds(30);
  private String userAgent = "policy-guard/0.1";
  private String webhookSecret;

  public String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public String getOrganization() {
    return organization;
  }

  public void setOrganization(String organization) {
    this.organization = organization;
  }

  public String getAppId() {
    return appId;
  }

  public void setAppId(String appId) {
    this.appId = appId;
  }

  public Long getInstallationId() {
    return installationId;
  }

  public void setInstallationId(Long installationId) {
    this.installationId = installationId;
  }

  public String getPrivateKeyBase64() {
    return privateKeyBase64;
  }

  public void setPrivateKeyBase64(String privateKeyBase64) {
    this.privateKeyBase64 = privateKeyBase64;
  }

  public String getPersonalAccessToken() {
    return personalAccessToken;
  }

  public void setPersonalAccessToken(String personalAccessToken) {
    this.personalAccessToken = personalAccessToken;
  }

  public Duration getAppJwtTtl() {
    return appJwtTtl;
  }

  public void setAppJwtTtl(Duration appJwtTtl) {
    this.appJwtTtl = appJwtTtl;
  }

  public Duration getJwtClockSkew() {
    return jwtClockSkew;
  }

  public void setJwtClockSkew(Duration jwtClockSkew) {
    this.jwtClockSkew = jwtClockSkew;
  }

  public Duration getTokenRefreshSkew() {
    return tokenRefreshSkew;
  }

  public void setTokenRefreshSkew(Duration tokenRefreshSkew) {
    this.tokenRefreshSkew = tokenRefreshSkew;
  }

  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  public void setConnectTimeout(Duration connectTimeout) {
    this.connectTimeout = connectTimeout;
  }

  public Duration getReadTimeout() {
    return readTimeout;
  }

  public void setReadTimeout(Duration readTimeout) {
    this.readTimeout = readTimeout;
  }

  public String getUserAgent() {
    return userAgent;
  }

  public void setUserAgent(String userAgent) {
    this.userAgent = userAgent;
  }

  public String getWebhookSecret() {
    return webhookSecret;
  }

  public void setWebhookSecret(String webhookSecret) {
    this.webhookSecret = webhookSecret;
  }
}

package com.policyguard.backend.support;

import org.junit.jupiter.api.Assumptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.PostgreSQLContainer;

/**
 * Shared PostgreSQL instance for persistence tests. Starts once per test JVM when Docker is
 * available; tests call {@link #assumeDockerAvailable()} so they are skipped otherwise.
 */
public final class PostgresTestContainer {

  private static final Logger log = LoggerFactory.getLogger(PostgresTestContainer.class);

  private static final boolean DOCKER_AVAILABLE = isDockerAvailable();
  private static final PostgreSQLContainer<?> POSTGRES = startContainer();

  private PostgresTestContainer() {}

  public static void assumeDockerAvailable() {
    Assumptions.assumeTrue(
        DOCKER_AVAILABLE, "Docker is required to run Postgres-backed integration tests");
  }

  public static void register(DynamicPropertyRegistry registry) {
    if (!DOCKER_AVAILABLE || POSTGRES == null) {
      throw new IllegalStateException("Docker is required to configure Postgres test container");
    }
    registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
    registry.add("spring.datasource.username", POSTGRES::getUsername);
    registry.add("spring.datasource.password", POSTGRES::getPassword);
    registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
    registry.add("spring.datasource.hikari.maximum-pool-size", () -> "4");
    registry.add("policy-guard.jobs.enabled", () -> "false");
    registry.add("policy-guard.scan.scheduled-enabled", () -> "false");
  }

  private static PostgreSQLContainer<?> startContainer() {
    if (!DOCKER_AVAILABLE) {
      return null;
    }
    PostgreSQLContainer<?> container =
        new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("policy_guard_test")
            .withUsername("policy_guard")
            .withPassword("policy_guard");
    container.start();
    return container;
  }

  private static boolean isDockerAvailable() {
    try {
      DockerClientFactory.instance().client();
      return true;
    } catch (Throwable ex) {
      log.warn("Docker is not available for Testcontainers: {}", ex.getMessage());
      return false;
    }
  }
}

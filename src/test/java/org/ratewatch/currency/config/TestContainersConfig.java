package org.ratewatch.currency.config;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.context.annotation.Bean;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Centralized TestContainers configuration for all integration tests.
 *
 * <p>Provides all infrastructure Docker containers:
 *
 * <ul>
 *   <li>PostgreSQL container for the ban table with Flyway migrations
 *   <li>Redis container for the rate cache
 * </ul>
 *
 * <p>Uses Spring Boot {@code @ServiceConnection} for automatic container property binding.
 *
 * <p>Container reuse is enabled via testcontainers.reuse.enable=true system property for faster
 * test execution during development.
 *
 * <p><b>Note:</b> This configuration only manages Docker containers via TestContainers. For the
 * WireMock server standing in for the rate host and forecast service, see {@link WireMockConfig}.
 *
 * @see org.springframework.boot.testcontainers.service.connection.ServiceConnection
 * @see WireMockConfig
 */
@TestConfiguration(proxyBeanMethods = false)
public class TestContainersConfig {

  /**
   * PostgreSQL container for the ban table.
   *
   * <p>Flyway migrations are applied on startup and the schema is validated by Hibernate.
   */
  static PostgreSQLContainer<?> postgresContainer =
      new PostgreSQLContainer<>(DockerImageName.parse("postgres:15-alpine"))
          .withCommand(
              "postgres", "-c", "max_connections=50") // prevent tests from overflowing hikari
          .withDatabaseName("currency_test")
          .withUsername("test")
          .withPassword("test")
          .withReuse(true);

  /**
   * Redis container for the rate cache.
   *
   * <p>Holds the {@code available} list and the {@code rate:collection} and {@code
   * time:collection} hashes.
   */
  static GenericContainer<?> redisContainer =
      new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
          .withExposedPorts(6379)
          .withReuse(true);

  @Bean
  @ServiceConnection
  PostgreSQLContainer<?> postgresContainer() {
    return postgresContainer;
  }

  @Bean
  @ServiceConnection(name = "redis")
  GenericContainer<?> redisContainer() {
    return redisContainer;
  }
}

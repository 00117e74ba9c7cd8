package org.ratewatch.currency.config;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;

/**
 * WireMock server standing in for the rate host and the forecast service.
 *
 * <p>Server lifecycle:
 *
 * <ul>
 *   <li>Started in static initializer to ensure availability before Spring context loads
 *   <li>Runs on dynamic port to avoid conflicts
 *   <li>Stopped automatically via bean {@code destroyMethod}
 * </ul>
 *
 * <p>Tests point the service URLs at the server with {@code @DynamicPropertySource} and reset stubs
 * in {@code @BeforeEach}. See {@code AbstractWireMockTest}.
 *
 * @see TestContainersConfig
 */
@TestConfiguration(proxyBeanMethods = false)
public class WireMockConfig {

  private static final WireMockServer wireMockServer;

  static {
    // Must be running before @DynamicPropertySource is evaluated in test classes
    wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
    wireMockServer.start();
  }

  @Bean(destroyMethod = "stop")
  WireMockServer wireMockServer() {
    return wireMockServer;
  }

  /**
   * Returns the static WireMock server instance for use in {@code @DynamicPropertySource}.
   *
   * @return WireMock server instance
   */
  public static WireMockServer getWireMockServer() {
    return wireMockServer;
  }
}

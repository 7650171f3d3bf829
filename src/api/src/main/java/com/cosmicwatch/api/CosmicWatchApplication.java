package com.cosmicwatch.api;

import com.cosmicwatch.api.config.CosmicWatchProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main Spring Boot entrypoint for the Cosmic Watch API service.
 *
 * <p>The application proxies NASA NeoWs feed/lookup data with risk scoring and hosts the live
 * chat channel used by the frontend.
 */
@SpringBootApplication
@EnableConfigurationProperties(CosmicWatchProperties.class)
public class CosmicWatchApplication {
  /**
   * Starts the API application.
   *
   * @param args standard Spring Boot startup arguments
   */
  public static void main(String[] args) {
    SpringApplication.run(CosmicWatchApplication.class, args);
  }
}

package com.cosmicwatch.api.config;

import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration for the REST endpoints consumed by the frontend.
 *
 * <p>CORS is only registered when an allowlist is configured.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {
  private static final String[] CORS_PATHS = {"/api/**", "/feed", "/lookup/**", "/health"};

  private final CosmicWatchProperties properties;

  /**
   * Creates Web MVC config with typed application properties.
   *
   * @param properties application configuration tree
   */
  public WebConfig(CosmicWatchProperties properties) {
    this.properties = properties;
  }

  /**
   * Registers CORS mappings for every public read route.
   *
   * @param registry Spring CORS registry
   */
  @Override
  public void addCorsMappings(CorsRegistry registry) {
    List<String> allowedOrigins = properties.getApi().getCors().getAllowedOrigins().stream()
        .filter(origin -> origin != null && !origin.isBlank())
        .toList();
    if (allowedOrigins.isEmpty()) {
      return;
    }

    for (String path : CORS_PATHS) {
      registry
          .addMapping(path)
          .allowedMethods("GET", "OPTIONS")
          .allowedHeaders("*")
          .allowedOrigins(allowedOrigins.toArray(String[]::new))
          .allowCredentials(true)
          .maxAge(600);
    }
  }
}

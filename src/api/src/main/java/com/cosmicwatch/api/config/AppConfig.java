package com.cosmicwatch.api.config;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {
  @Bean
  public HttpClient httpClient(CosmicWatchProperties properties) {
    return HttpClient.newBuilder()
        .connectTimeout(Duration.ofMillis(Math.max(1_000, properties.getNasa().getTimeoutMs())))
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}

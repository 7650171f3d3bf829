package com.cosmicwatch.api.config;

import com.cosmicwatch.api.chat.ChatWebSocketHandler;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/** Registers the live chat endpoint at {@code /ws/chat}. */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {
  private final ChatWebSocketHandler chatWebSocketHandler;
  private final CosmicWatchProperties properties;

  public WebSocketConfig(ChatWebSocketHandler chatWebSocketHandler, CosmicWatchProperties properties) {
    this.chatWebSocketHandler = chatWebSocketHandler;
    this.properties = properties;
  }

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    List<String> allowedOrigins = properties.getChat().getAllowedOrigins().stream()
        .filter(origin -> origin != null && !origin.isBlank())
        .toList();
    if (allowedOrigins.isEmpty()) {
      registry.addHandler(chatWebSocketHandler, "/ws/chat").setAllowedOriginPatterns("*");
      return;
    }
    registry.addHandler(chatWebSocketHandler, "/ws/chat")
        .setAllowedOrigins(allowedOrigins.toArray(String[]::new));
  }
}

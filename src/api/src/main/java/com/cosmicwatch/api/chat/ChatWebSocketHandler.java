package com.cosmicwatch.api.chat;

import com.cosmicwatch.api.config.CosmicWatchProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * WebSocket adapter for {@code /ws/chat}.
 *
 * <p>Each session is wrapped in a {@link ConcurrentWebSocketSessionDecorator} so a slow peer
 * buffers (and is eventually dropped) instead of stalling broadcasts to the others.
 */
@Component
public class ChatWebSocketHandler extends TextWebSocketHandler {
  private static final Logger log = LoggerFactory.getLogger(ChatWebSocketHandler.class);

  private final ChatBroadcaster broadcaster;
  private final ObjectMapper objectMapper;
  private final CosmicWatchProperties.Chat properties;
  private final Map<String, ChatConnection> connections = new ConcurrentHashMap<>();

  public ChatWebSocketHandler(
      ChatBroadcaster broadcaster, ObjectMapper objectMapper, CosmicWatchProperties properties) {
    this.broadcaster = broadcaster;
    this.objectMapper = objectMapper;
    this.properties = properties.getChat();
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) {
    WebSocketSession guarded = new ConcurrentWebSocketSessionDecorator(
        session, properties.getSendTimeLimitMs(), properties.getSendBufferSizeLimit());
    ChatConnection connection = new WebSocketChatConnection(guarded, objectMapper);
    connections.put(session.getId(), connection);
    broadcaster.connect(connection);
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message) {
    ChatConnection connection = connections.get(session.getId());
    if (connection == null) {
      return;
    }
    broadcaster.handleFrame(connection, message.getPayload());
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    log.debug("Chat transport error on session {}: {}", session.getId(), exception.toString());
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    ChatConnection connection = connections.remove(session.getId());
    if (connection != null) {
      broadcaster.disconnect(connection);
    }
  }
}

package com.cosmicwatch.api.chat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

/** {@link ChatConnection} backed by a Spring WebSocket session. */
final class WebSocketChatConnection implements ChatConnection {
  private final WebSocketSession session;
  private final ObjectMapper objectMapper;

  WebSocketChatConnection(WebSocketSession session, ObjectMapper objectMapper) {
    this.session = session;
    this.objectMapper = objectMapper;
  }

  @Override
  public String id() {
    return session.getId();
  }

  @Override
  public void send(ChatEvent event) throws IOException {
    if (!session.isOpen()) {
      throw new IOException("session closed");
    }
    session.sendMessage(new TextMessage(objectMapper.writeValueAsString(event)));
  }
}

package com.cosmicwatch.api.chat;

import java.io.IOException;

/** Transport-neutral handle of one live chat connection. */
public interface ChatConnection {
  /**
   * Returns a stable identifier, unique among live connections.
   *
   * @return connection id
   */
  String id();

  /**
   * Delivers one event to the peer.
   *
   * @param event outbound event
   * @throws IOException when the transport can no longer deliver
   */
  void send(ChatEvent event) throws IOException;
}

package com.cosmicwatch.api.chat;

import com.cosmicwatch.api.config.CosmicWatchProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Live chat registry and fan-out.
 *
 * <p>Tracks connected peers with their display names and broadcasts system/chat events to all of
 * them. A connection whose send fails is pruned after the current fan-out without a "left" event;
 * only an explicit disconnect announces the departure.
 */
@Service
public class ChatBroadcaster {
  private static final Logger log = LoggerFactory.getLogger(ChatBroadcaster.class);
  static final String CONNECTED_MESSAGE = "Connected to Cosmic Watch live chat.";
  static final String EMPTY_NAME_MESSAGE = "Display name cannot be empty.";
  static final String INVALID_JSON_MESSAGE = "Invalid JSON payload.";
  static final String UNKNOWN_ACTION_MESSAGE = "Unknown chat action.";
  static final String DEFAULT_NAME = "Guest";

  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final int maxNameLength;
  private final int maxMessageLength;
  // Guarded by itself.
  private final Map<String, Member> members = new LinkedHashMap<>();

  public ChatBroadcaster(
      ObjectMapper objectMapper,
      Clock clock,
      CosmicWatchProperties properties,
      MeterRegistry meterRegistry) {
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.maxNameLength = Math.max(1, properties.getChat().getMaxNameLength());
    this.maxMessageLength = Math.max(1, properties.getChat().getMaxMessageLength());
    Gauge.builder("cosmicwatch.chat.connections.active", this, ChatBroadcaster::activeCount)
        .description("Live chat connections")
        .register(meterRegistry);
  }

  /**
   * Registers a new connection under a generated guest name, greets it privately and announces
   * it to everyone.
   *
   * @param connection newly accepted connection
   */
  public void connect(ChatConnection connection) {
    String name = guestName(connection.id());
    int count;
    synchronized (members) {
      members.put(connection.id(), new Member(connection, name));
      count = members.size();
    }
    log.debug("Chat connection {} joined as {}", connection.id(), name);
    sendPrivate(connection, ChatEvent.system(CONNECTED_MESSAGE, now(), count));
    broadcast(ChatEvent.system(name + " joined chat.", now(), activeCount()));
  }

  /**
   * Removes a connection and announces the departure when it was still registered.
   *
   * @param connection closed connection
   */
  public void disconnect(ChatConnection connection) {
    Member removed;
    int count;
    synchronized (members) {
      removed = members.remove(connection.id());
      count = members.size();
    }
    if (removed == null) {
      return;
    }
    log.debug("Chat connection {} ({}) left", connection.id(), removed.name());
    broadcast(ChatEvent.system(removed.name() + " left chat.", now(), count));
  }

  /**
   * Dispatches one inbound text frame ({@code set_name} or {@code chat}).
   *
   * <p>Malformed frames and unknown actions are answered with a private error event.
   *
   * @param connection sender
   * @param frame raw frame text
   */
  public void handleFrame(ChatConnection connection, String frame) {
    JsonNode payload;
    try {
      payload = objectMapper.readTree(frame == null ? "" : frame);
    } catch (JsonProcessingException ex) {
      payload = null;
    }
    if (payload == null || !payload.isObject()) {
      sendPrivate(connection, ChatEvent.error(INVALID_JSON_MESSAGE, now()));
      return;
    }

    String action = payload.path("type").asText("");
    switch (action) {
      case "set_name" -> rename(connection, fieldText(payload, "name"));
      case "chat" -> message(connection, fieldText(payload, "text"));
      default -> sendPrivate(connection, ChatEvent.error(UNKNOWN_ACTION_MESSAGE, now()));
    }
  }

  /**
   * Changes the display name of a connection, registering it again if it was pruned.
   *
   * @param connection requester
   * @param proposedName requested name, trimmed and truncated before use
   */
  public void rename(ChatConnection connection, String proposedName) {
    String candidate = clip(proposedName, maxNameLength);
    if (candidate.isEmpty()) {
      sendPrivate(connection, ChatEvent.error(EMPTY_NAME_MESSAGE, now()));
      return;
    }

    String previous;
    synchronized (members) {
      Member member = members.get(connection.id());
      previous = member == null ? DEFAULT_NAME : member.name();
      // Also re-registers a connection pruned after a failed send.
      members.put(connection.id(), new Member(connection, candidate));
    }
    if (!candidate.equals(previous)) {
      broadcast(ChatEvent.system(previous + " is now " + candidate + ".", now(), activeCount()));
    }
  }

  /**
   * Broadcasts a chat message under the sender's current name. Blank messages are dropped.
   *
   * @param connection sender
   * @param text message body, trimmed and truncated before use
   */
  public void message(ChatConnection connection, String text) {
    String body = clip(text, maxMessageLength);
    if (body.isEmpty()) {
      return;
    }
    broadcast(ChatEvent.chat(displayName(connection.id()), body, now(), activeCount()));
  }

  /**
   * Sends an event to every registered connection.
   *
   * <p>Failed deliveries never propagate; the failing connections are removed once the fan-out
   * completes.
   *
   * @param event outbound event
   */
  public void broadcast(ChatEvent event) {
    List<Member> snapshot;
    synchronized (members) {
      snapshot = List.copyOf(members.values());
    }

    Set<String> stale = new LinkedHashSet<>();
    for (Member member : snapshot) {
      try {
        member.connection().send(event);
      } catch (IOException | RuntimeException ex) {
        stale.add(member.connection().id());
        logDeliveryFailure(member.connection().id(), event.type(), ex);
      }
    }

    if (!stale.isEmpty()) {
      synchronized (members) {
        stale.forEach(members::remove);
      }
    }
  }

  public int activeCount() {
    synchronized (members) {
      return members.size();
    }
  }

  /**
   * Returns the current display name of a connection.
   *
   * @param connectionId connection id
   * @return registered name, or {@code Guest} when not registered
   */
  public String displayName(String connectionId) {
    synchronized (members) {
      Member member = members.get(connectionId);
      return member == null ? DEFAULT_NAME : member.name();
    }
  }

  private void sendPrivate(ChatConnection connection, ChatEvent event) {
    try {
      connection.send(event);
    } catch (IOException | RuntimeException ex) {
      synchronized (members) {
        members.remove(connection.id());
      }
      logDeliveryFailure(connection.id(), event.type(), ex);
    }
  }

  private void logDeliveryFailure(String connectionId, String eventType, Exception ex) {
    if (isExpectedClientDisconnect(ex)) {
      log.debug("Chat client {} disconnected during {} delivery: {}", connectionId, eventType, ex.toString());
      return;
    }
    log.warn("Chat delivery failed for connection={} event={}", connectionId, eventType, ex);
  }

  static boolean isExpectedClientDisconnect(Throwable error) {
    Throwable current = error;
    while (current != null) {
      String className = current.getClass().getName();
      if (className.endsWith("ClientAbortException") || className.endsWith("EofException")) {
        return true;
      }
      String message = current.getMessage();
      if (message != null) {
        String normalized = message.toLowerCase(Locale.ROOT);
        if (normalized.contains("broken pipe")
            || normalized.contains("connection reset")
            || normalized.contains("session closed")
            || normalized.contains("connection abort")) {
          return true;
        }
      }
      current = current.getCause() == current ? null : current.getCause();
    }
    return false;
  }

  static String guestName(String connectionId) {
    String id = connectionId == null ? "" : connectionId;
    return "Guest-" + (id.length() <= 4 ? id : id.substring(id.length() - 4));
  }

  /** Strips surrounding whitespace and keeps at most {@code maxCodePoints} code points. */
  static String clip(String value, int maxCodePoints) {
    if (value == null) {
      return "";
    }
    String stripped = value.strip();
    if (stripped.codePointCount(0, stripped.length()) <= maxCodePoints) {
      return stripped;
    }
    return stripped.substring(0, stripped.offsetByCodePoints(0, maxCodePoints));
  }

  private static String fieldText(JsonNode payload, String field) {
    JsonNode node = payload.path(field);
    if (node.isMissingNode() || node.isNull()) {
      return "";
    }
    return node.isValueNode() ? node.asText() : node.toString();
  }

  private String now() {
    return Instant.now(clock).toString();
  }

  private record Member(ChatConnection connection, String name) {}
}

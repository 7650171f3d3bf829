package com.cosmicwatch.api.chat;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outbound chat frame.
 *
 * @param type {@code system}, {@code chat} or {@code error}
 * @param user sender display name, chat events only
 * @param message human-readable text
 * @param timestamp event time (ISO-8601)
 * @param activeUsers live connection count, absent on error events
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatEvent(
    @JsonProperty("type") String type,
    @JsonProperty("user") String user,
    @JsonProperty("message") String message,
    @JsonProperty("timestamp") String timestamp,
    @JsonProperty("active_users") Integer activeUsers) {

  public static final String SYSTEM = "system";
  public static final String CHAT = "chat";
  public static final String ERROR = "error";

  public static ChatEvent system(String message, String timestamp, int activeUsers) {
    return new ChatEvent(SYSTEM, null, message, timestamp, activeUsers);
  }

  public static ChatEvent chat(String user, String message, String timestamp, int activeUsers) {
    return new ChatEvent(CHAT, user, message, timestamp, activeUsers);
  }

  public static ChatEvent error(String message, String timestamp) {
    return new ChatEvent(ERROR, null, message, timestamp, null);
  }
}

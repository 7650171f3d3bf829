package com.cosmicwatch.api.nasa;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Locale;

/**
 * Lenient readers for NeoWs JSON values.
 *
 * <p>NeoWs encodes most measurements as strings and may omit any field, so every reader returns
 * {@code null} instead of throwing.
 */
public final class JsonValues {
  private JsonValues() {}

  /**
   * Reads a finite number from a numeric or numeric-string node.
   *
   * @param node source node, possibly missing
   * @return parsed value, or null when absent, non-numeric or not finite
   */
  public static Double number(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return null;
    }
    if (node.isNumber()) {
      return finiteOrNull(node.asDouble());
    }
    if (!node.isTextual()) {
      return null;
    }
    try {
      return finiteOrNull(Double.parseDouble(node.asText().trim()));
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  /**
   * Reads a scalar as text.
   *
   * @param node source node, possibly missing
   * @return textual form of a scalar node, or null for missing/null/container nodes
   */
  public static String text(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode() || node.isContainerNode()) {
      return null;
    }
    return node.asText();
  }

  /**
   * Reads a boolean-ish flag.
   *
   * <p>Accepts JSON booleans, {@code "true"/"false"} strings and numbers (non-zero is true).
   *
   * @param node source node, possibly missing
   * @return parsed flag, or null when the value is not boolean-ish
   */
  public static Boolean flag(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return null;
    }
    if (node.isBoolean()) {
      return node.booleanValue();
    }
    if (node.isNumber()) {
      return node.asDouble() != 0.0;
    }
    if (node.isTextual()) {
      String normalized = node.asText().trim().toLowerCase(Locale.ROOT);
      if ("true".equals(normalized)) {
        return Boolean.TRUE;
      }
      if ("false".equals(normalized)) {
        return Boolean.FALSE;
      }
    }
    return null;
  }

  private static Double finiteOrNull(double value) {
    return Double.isFinite(value) ? value : null;
  }
}

package com.cosmicwatch.api.nasa;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * NeoWs feed body: asteroid records grouped by calendar date, plus provider pagination links.
 *
 * <p>Records are kept as raw JSON so the merged payload can be re-served as-is; they are mapped
 * to {@link RawAsteroidRecord} only during normalization.
 *
 * @param links provider pagination metadata
 * @param elementCount number of records in the payload
 * @param nearEarthObjects records keyed by ISO date, in upstream order
 */
public record RawFeedPayload(
    @JsonProperty("links") JsonNode links,
    @JsonProperty("element_count") int elementCount,
    @JsonProperty("near_earth_objects") Map<String, List<JsonNode>> nearEarthObjects) {

  public RawFeedPayload {
    links = links == null ? JsonNodeFactory.instance.objectNode() : links;
    Map<String, List<JsonNode>> copy = new LinkedHashMap<>();
    if (nearEarthObjects != null) {
      nearEarthObjects.forEach((day, rows) -> copy.put(day, rows == null ? List.of() : List.copyOf(rows)));
    }
    nearEarthObjects = Collections.unmodifiableMap(copy);
  }

  public static RawFeedPayload empty() {
    return new RawFeedPayload(JsonNodeFactory.instance.objectNode(), 0, Map.of());
  }

  /**
   * Reads a feed body. Missing sections become empty; non-array date buckets become empty lists.
   *
   * @param root parsed upstream body
   * @return feed payload
   */
  public static RawFeedPayload fromJson(JsonNode root) {
    JsonNode links = root.path("links");
    Map<String, List<JsonNode>> byDate = new LinkedHashMap<>();
    JsonNode neo = root.path("near_earth_objects");
    if (neo.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> fields = neo.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        List<JsonNode> rows = new ArrayList<>();
        if (field.getValue().isArray()) {
          field.getValue().forEach(rows::add);
        }
        byDate.put(field.getKey(), rows);
      }
    }
    int count = root.path("element_count").canConvertToInt()
        ? root.path("element_count").asInt()
        : countRecords(byDate);
    return new RawFeedPayload(links.isObject() ? links : null, count, byDate);
  }

  static int countRecords(Map<String, List<JsonNode>> byDate) {
    int total = 0;
    for (List<JsonNode> rows : byDate.values()) {
      total += rows.size();
    }
    return total;
  }
}

package com.cosmicwatch.api.nasa;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

import com.cosmicwatch.api.config.CosmicWatchProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FeedRangeMergerTest {
  private static final LocalDate D0 = LocalDate.of(2026, 1, 1);

  @Mock private NeoWsClient client;

  private FeedRangeMerger merger;

  @BeforeEach
  void setUp() {
    merger = new FeedRangeMerger(client, new CosmicWatchProperties());
  }

  @Test
  void endBeforeStartReturnsEmptyPayloadWithoutUpstreamCall() {
    RawFeedPayload payload = merger.fetchFeedRange(D0, D0.minusDays(1));

    assertThat(payload.elementCount()).isZero();
    assertThat(payload.nearEarthObjects()).isEmpty();
    assertThat(payload.links().isObject()).isTrue();
    assertThat(payload.links().size()).isZero();
    verify(client, never()).fetchFeed(any(), any());
  }

  @Test
  void shortRangeDelegatesToSingleFetch() {
    RawFeedPayload upstream = window("self-1", D0, 2);
    when(client.fetchFeed(D0, D0.plusDays(6))).thenReturn(upstream);

    assertThat(merger.fetchFeedRange(D0, D0.plusDays(6))).isSameAs(upstream);
    verify(client).fetchFeed(D0, D0.plusDays(6));
    verifyNoMoreInteractions(client);
  }

  @Test
  void longRangeWalksSevenDayWindowsSequentially() {
    LocalDate end = D0.plusDays(15);
    when(client.fetchFeed(D0, D0.plusDays(6))).thenReturn(window("self-1", D0, 1));
    when(client.fetchFeed(D0.plusDays(7), D0.plusDays(13))).thenReturn(window("self-2", D0.plusDays(7), 2));
    when(client.fetchFeed(D0.plusDays(14), end)).thenReturn(window("self-3", D0.plusDays(14), 3));

    RawFeedPayload merged = merger.fetchFeedRange(D0, end);

    InOrder order = inOrder(client);
    order.verify(client).fetchFeed(D0, D0.plusDays(6));
    order.verify(client).fetchFeed(D0.plusDays(7), D0.plusDays(13));
    order.verify(client).fetchFeed(D0.plusDays(14), end);
    assertThat(merged.links().path("self").asText()).isEqualTo("self-1");
    assertThat(merged.elementCount()).isEqualTo(6);
    assertThat(merged.nearEarthObjects().keySet())
        .containsExactly(D0.toString(), D0.plusDays(7).toString(), D0.plusDays(14).toString());
  }

  @Test
  void overlappingDatesAreConcatenated() {
    LocalDate end = D0.plusDays(8);
    String shared = D0.plusDays(6).toString();
    when(client.fetchFeed(D0, D0.plusDays(6))).thenReturn(payload(Map.of(shared, rows("a", "b"))));
    when(client.fetchFeed(D0.plusDays(7), end)).thenReturn(payload(Map.of(shared, rows("c"))));

    RawFeedPayload merged = merger.fetchFeedRange(D0, end);

    assertThat(merged.nearEarthObjects().get(shared))
        .extracting(node -> node.path("id").asText())
        .containsExactly("a", "b", "c");
    assertThat(merged.elementCount()).isEqualTo(3);
  }

  @Test
  void mergingTwoHalvesMatchesOneWideRange() {
    when(client.fetchFeed(any(), any())).thenAnswer(invocation -> stableUpstream(
        invocation.getArgument(0, LocalDate.class), invocation.getArgument(1, LocalDate.class)));

    RawFeedPayload firstHalf = merger.fetchFeedRange(D0, D0.plusDays(7));
    RawFeedPayload secondHalf = merger.fetchFeedRange(D0.plusDays(8), D0.plusDays(15));
    RawFeedPayload wide = merger.fetchFeedRange(D0, D0.plusDays(15));

    Map<String, List<JsonNode>> halves = new LinkedHashMap<>(firstHalf.nearEarthObjects());
    halves.putAll(secondHalf.nearEarthObjects());
    assertThat(wide.nearEarthObjects()).isEqualTo(halves);
    assertThat(wide.elementCount())
        .isEqualTo(wide.nearEarthObjects().values().stream().mapToInt(List::size).sum())
        .isEqualTo(firstHalf.elementCount() + secondHalf.elementCount());
  }

  @Test
  void failingWindowFailsWholeRange() {
    when(client.fetchFeed(D0, D0.plusDays(6))).thenReturn(window("self-1", D0, 1));
    when(client.fetchFeed(D0.plusDays(7), D0.plusDays(9)))
        .thenThrow(new UpstreamRateLimitedException(429));

    assertThatThrownBy(() -> merger.fetchFeedRange(D0, D0.plusDays(9)))
        .isInstanceOf(UpstreamRateLimitedException.class);
  }

  private static RawFeedPayload window(String self, LocalDate day, int count) {
    ObjectNode links = JsonNodeFactory.instance.objectNode().put("self", self);
    String[] ids = new String[count];
    for (int i = 0; i < count; i++) {
      ids[i] = day + "-" + i;
    }
    Map<String, List<JsonNode>> byDate = new LinkedHashMap<>();
    byDate.put(day.toString(), rows(ids));
    return new RawFeedPayload(links, count, byDate);
  }

  private static RawFeedPayload stableUpstream(LocalDate start, LocalDate end) {
    Map<String, List<JsonNode>> byDate = new LinkedHashMap<>();
    int total = 0;
    for (LocalDate day = start; !day.isAfter(end); day = day.plusDays(1)) {
      int count = day.getDayOfMonth() % 3 + 1;
      String[] ids = new String[count];
      for (int i = 0; i < count; i++) {
        ids[i] = day + "-" + i;
      }
      byDate.put(day.toString(), rows(ids));
      total += count;
    }
    return new RawFeedPayload(JsonNodeFactory.instance.objectNode().put("self", start.toString()), total, byDate);
  }

  private static RawFeedPayload payload(Map<String, List<JsonNode>> byDate) {
    return new RawFeedPayload(null, 0, byDate);
  }

  private static List<JsonNode> rows(String... ids) {
    return java.util.Arrays.stream(ids)
        .<JsonNode>map(id -> JsonNodeFactory.instance.objectNode().put("id", id))
        .toList();
  }
}

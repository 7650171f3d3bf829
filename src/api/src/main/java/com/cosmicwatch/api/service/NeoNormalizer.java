package com.cosmicwatch.api.service;

import com.cosmicwatch.api.model.NormalizedAsteroidDetail;
import com.cosmicwatch.api.model.NormalizedAsteroidItem;
import com.cosmicwatch.api.model.RiskAssessment;
import com.cosmicwatch.api.nasa.RawAsteroidRecord;
import com.cosmicwatch.api.nasa.RawCloseApproach;
import com.cosmicwatch.api.nasa.RawFeedPayload;
import com.cosmicwatch.api.nasa.RawOrbitalData;
import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Maps raw NeoWs records to normalized, risk-scored records.
 *
 * <p>Pure functions: missing or malformed measurements become null fields and never fail the
 * mapping.
 */
public final class NeoNormalizer {
  private NeoNormalizer() {}

  /**
   * Normalizes every record of a feed payload.
   *
   * @param payload raw feed payload
   * @return items sorted by risk score descending, ties in encounter order
   */
  public static List<NormalizedAsteroidItem> normalizeFeed(RawFeedPayload payload) {
    List<NormalizedAsteroidItem> items = new ArrayList<>();
    for (Map.Entry<String, List<JsonNode>> day : payload.nearEarthObjects().entrySet()) {
      for (JsonNode node : day.getValue()) {
        items.add(normalizeFeedItem(RawAsteroidRecord.from(node), day.getKey()));
      }
    }
    // List.sort is stable.
    items.sort(Comparator.comparingInt(NormalizedAsteroidItem::riskScore).reversed());
    return items;
  }

  /**
   * Normalizes one feed record.
   *
   * @param record raw record
   * @param approachDate feed date the record was listed under
   * @return normalized item
   */
  public static NormalizedAsteroidItem normalizeFeedItem(RawAsteroidRecord record, String approachDate) {
    CloseApproachSelector.Selection selection = CloseApproachSelector.pick(record, approachDate);
    RawCloseApproach approach = selection.entry();
    Double diameterM = averageDiameter(record.diameterMinM(), record.diameterMaxM());
    boolean hazardous = Boolean.TRUE.equals(record.potentiallyHazardous());
    RiskAssessment risk = RiskAnalysis.computeRisk(
        diameterM, approach.missDistanceKm(), approach.velocityKps(), hazardous);

    return new NormalizedAsteroidItem(
        record.id(),
        record.name(),
        record.nasaJplUrl(),
        approach.closeApproachDate() != null ? approach.closeApproachDate() : approachDate,
        approach.orbitingBody() != null ? approach.orbitingBody() : CloseApproachSelector.EARTH,
        round(diameterM, 3),
        diameterM == null ? null : round(diameterM / 1000, 6),
        round(approach.velocityKps(), 6),
        approach.velocityKps() == null ? null : round(approach.velocityKps() * 3600, 3),
        round(approach.missDistanceKm(), 3),
        hazardous,
        risk.score(),
        risk.category(),
        new NormalizedAsteroidItem.SourceRecord(record.neoReferenceId(), selection.index()));
  }

  /**
   * Normalizes a lookup record using its first close-approach entry.
   *
   * @param record raw lookup record
   * @return normalized detail with orbital elements
   */
  public static NormalizedAsteroidDetail normalizeLookup(RawAsteroidRecord record) {
    List<RawCloseApproach> entries = record.closeApproaches();
    RawCloseApproach approach = entries.isEmpty() ? RawCloseApproach.empty() : entries.get(0);
    Double diameterM = averageDiameter(record.diameterMinM(), record.diameterMaxM());
    boolean hazardous = Boolean.TRUE.equals(record.potentiallyHazardous());
    RiskAssessment risk = RiskAnalysis.computeRisk(
        diameterM, approach.missDistanceKm(), approach.velocityKps(), hazardous);

    return new NormalizedAsteroidDetail(
        record.id(),
        record.name(),
        record.nasaJplUrl(),
        approach.closeApproachDate(),
        approach.orbitingBody(),
        round(diameterM, 3),
        diameterM == null ? null : round(diameterM / 1000, 6),
        round(approach.velocityKps(), 6),
        approach.velocityKps() == null ? null : round(approach.velocityKps() * 3600, 3),
        round(approach.missDistanceKm(), 3),
        hazardous,
        risk.score(),
        risk.category(),
        entries.size(),
        orbitalElements(record.orbitalData()));
  }

  /**
   * Mean of min/max when both are known, otherwise whichever one is known.
   *
   * @param minM minimum estimate in meters
   * @param maxM maximum estimate in meters
   * @return average diameter, or null when neither bound is known
   */
  static Double averageDiameter(Double minM, Double maxM) {
    if (minM != null && maxM != null) {
      // Halves first so two bounds near Double.MAX_VALUE cannot overflow.
      return minM / 2 + maxM / 2;
    }
    return minM != null ? minM : maxM;
  }

  /** Rounds half-to-even on the exact binary value; null and non-finite values become null. */
  static Double round(Double value, int decimals) {
    if (value == null || !Double.isFinite(value)) {
      return null;
    }
    return new BigDecimal(value).setScale(decimals, RoundingMode.HALF_EVEN).doubleValue();
  }

  private static NormalizedAsteroidDetail.OrbitalElements orbitalElements(RawOrbitalData orbital) {
    if (orbital == null) {
      return new NormalizedAsteroidDetail.OrbitalElements(null, null, null, null, null, null, null, null);
    }
    return new NormalizedAsteroidDetail.OrbitalElements(
        orbital.semiMajorAxis(),
        orbital.eccentricity(),
        orbital.inclination(),
        orbital.ascendingNodeLongitude(),
        orbital.perihelionArgument(),
        orbital.meanAnomaly(),
        orbital.meanMotion(),
        orbital.epochOsculation());
  }
}

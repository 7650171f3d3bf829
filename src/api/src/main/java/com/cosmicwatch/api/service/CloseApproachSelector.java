package com.cosmicwatch.api.service;

import com.cosmicwatch.api.nasa.RawAsteroidRecord;
import com.cosmicwatch.api.nasa.RawCloseApproach;
import java.util.List;

/** Chooses which close-approach entry represents an asteroid in the feed. */
public final class CloseApproachSelector {
  static final String EARTH = "Earth";

  private CloseApproachSelector() {}

  /**
   * Picks, in order of preference: the Earth approach on {@code approachDate}, the first Earth
   * approach, the first approach, or an empty placeholder.
   *
   * @param record asteroid record
   * @param approachDate feed date the record was listed under
   * @return selected entry and its index (null index when the record has no entries)
   */
  public static Selection pick(RawAsteroidRecord record, String approachDate) {
    List<RawCloseApproach> entries = record.closeApproaches();
    for (int i = 0; i < entries.size(); i++) {
      RawCloseApproach entry = entries.get(i);
      if (approachDate != null
          && approachDate.equals(entry.closeApproachDate())
          && EARTH.equals(entry.orbitingBody())) {
        return new Selection(entry, i);
      }
    }
    for (int i = 0; i < entries.size(); i++) {
      if (EARTH.equals(entries.get(i).orbitingBody())) {
        return new Selection(entries.get(i), i);
      }
    }
    if (!entries.isEmpty()) {
      return new Selection(entries.get(0), 0);
    }
    return new Selection(RawCloseApproach.empty(), null);
  }

  /**
   * Selected close approach.
   *
   * @param entry selected entry, never null
   * @param index position in the upstream sequence, null for the placeholder
   */
  public record Selection(RawCloseApproach entry, Integer index) {}
}

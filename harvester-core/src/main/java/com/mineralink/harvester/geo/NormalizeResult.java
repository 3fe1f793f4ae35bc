package com.mineralink.harvester.geo;

import com.mineralink.harvester.ErrorKind;

/** What became of one raw feature. */
public sealed interface NormalizeResult {

  /**
   * The feature was kept.
   *
   * @param discardedParts extra paths or rings beyond the first that were left out
   */
  record Normalized(NormalizedFeature feature, int discardedParts) implements NormalizeResult {}

  /** The feature was dropped because its geometry could not be decoded or reprojected. */
  record Dropped(ErrorKind kind, String reason) implements NormalizeResult {}
}

package com.mineralink.harvester.writer;

import com.mineralink.harvester.ErrorKind;
import com.mineralink.harvester.crs.ResolvedCrs;
import com.mineralink.harvester.geo.NormalizedFeature;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * The normalized features of one layer with the provenance of the harvest that produced them.
 *
 * @param layer          layer name
 * @param sourceCrs      CRS the layer's raw coordinates were resolved to
 * @param endpoint       query endpoint the features came from
 * @param fetchedAt      when fetching started
 * @param complete       true only if every planned chunk or page was fetched
 * @param features       features in fetch order
 * @param dropped        features that could not be normalized, by reason
 * @param chunks         how the planned requests ended up
 * @param discardedParts extra paths and rings left out of kept features
 * @param axisSwapped    kept features that needed x and y swapped
 */
public record FeatureCollection(
  String layer,
  ResolvedCrs sourceCrs,
  String endpoint,
  Instant fetchedAt,
  boolean complete,
  List<NormalizedFeature> features,
  Map<ErrorKind, Long> dropped,
  ChunkCounts chunks,
  long discardedParts,
  long axisSwapped
) {

  public FeatureCollection {
    features = List.copyOf(features);
    dropped = Map.copyOf(dropped);
  }

  public int size() {
    return features.size();
  }

  public boolean isEmpty() {
    return features.isEmpty();
  }

  /** Counts of requests planned for a layer, by how they ended up. */
  public record ChunkCounts(int planned, int succeeded, int failed, int skipped) {}
}

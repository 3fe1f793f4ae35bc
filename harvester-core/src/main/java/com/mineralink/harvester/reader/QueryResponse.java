package com.mineralink.harvester.reader;

import java.util.List;
import java.util.Optional;

/**
 * The features decoded from one successful query response.
 *
 * @param features              features in response order
 * @param crs                   CRS code the response says its coordinates are in, if it says
 * @param exceededTransferLimit true if the service cut the response short at its maximum record count
 */
public record QueryResponse(List<RawFeature> features, Optional<String> crs, boolean exceededTransferLimit) {

  public QueryResponse {
    features = List.copyOf(features);
  }

  public int size() {
    return features.size();
  }

  public boolean isEmpty() {
    return features.isEmpty();
  }
}

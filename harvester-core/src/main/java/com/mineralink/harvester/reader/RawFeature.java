package com.mineralink.harvester.reader;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One feature from a query response: its wire geometry and attributes.
 *
 * @param geometry   shape to reconstruct
 * @param attributes attribute values, in the order the service returned them
 */
public record RawFeature(RawGeometry geometry, Map<String, Object> attributes) {

  public RawFeature {
    // attribute values may be null, so Map.copyOf will not do
    attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }
}

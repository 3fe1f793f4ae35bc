package com.mineralink.harvester.geo;

import java.util.Map;
import org.locationtech.jts.geom.Geometry;

/**
 * A feature with its geometry reconstructed and reprojected to WGS84 longitude/latitude.
 *
 * @param type        the kind of geometry
 * @param geometry    a {@code Point}, {@code LineString} or {@code Polygon} with every coordinate inside
 *                    {@link GeoUtils#WORLD_LAT_LON_BOUNDS}
 * @param attributes  attribute values from the service
 * @param axisSwapped true if x and y were swapped to bring the coordinates into range
 */
public record NormalizedFeature(
  GeometryType type,
  Geometry geometry,
  Map<String, Object> attributes,
  boolean axisSwapped
) {

  public NormalizedFeature {
    if (GeometryType.valueOf(geometry) != type) {
      throw new IllegalArgumentException("Expected " + type + " but got " + geometry.getGeometryType());
    }
  }
}

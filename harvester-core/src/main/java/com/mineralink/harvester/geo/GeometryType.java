package com.mineralink.harvester.geo;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

/** The canonical geometry shapes a harvested feature can have, and their GeoJSON type names. */
public enum GeometryType {
  POINT("Point", 1),
  LINE("LineString", 2),
  POLYGON("Polygon", 4);

  private final String geoJsonType;
  private final int minPoints;

  GeometryType(String geoJsonType, int minPoints) {
    this.geoJsonType = geoJsonType;
    this.minPoints = minPoints;
  }

  /**
   * Returns the tag for a JTS geometry.
   *
   * @throws IllegalArgumentException for anything other than a {@link Point}, {@link LineString} or {@link Polygon}
   */
  public static GeometryType valueOf(Geometry geom) {
    if (geom instanceof Point) {
      return POINT;
    } else if (geom instanceof Polygon) {
      return POLYGON;
    } else if (geom instanceof LineString && !(geom instanceof LinearRing)) {
      return LINE;
    }
    throw new IllegalArgumentException("Unsupported geometry: " + geom.getGeometryType());
  }

  /** Returns the {@code type} member of a GeoJSON geometry of this shape. */
  public String geoJsonType() {
    return geoJsonType;
  }

  /** Returns the fewest positions a geometry of this shape needs, counting the closing position of a ring. */
  public int minPoints() {
    return minPoints;
  }
}

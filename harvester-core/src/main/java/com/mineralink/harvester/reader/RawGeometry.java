package com.mineralink.harvester.reader;

import java.util.List;

/**
 * A geometry as it appeared on the wire, before it is reconstructed and reprojected.
 * <p>
 * Positions are {@code [x, y]} arrays in the coordinate system of the response. Any z or m values are dropped while
 * decoding.
 */
public sealed interface RawGeometry {

  /** Short description of the shape for log messages. */
  String describe();

  /** An Esri point ({@code {"x":..,"y":..}}) or GeoJSON {@code Point}. */
  record PointShape(double x, double y) implements RawGeometry {

    @Override
    public String describe() {
      return "point(" + x + " " + y + ")";
    }
  }

  /** An Esri polyline ({@code paths}) or GeoJSON {@code LineString}/{@code MultiLineString}. */
  record PathShape(List<List<double[]>> parts) implements RawGeometry {

    public PathShape {
      parts = List.copyOf(parts);
    }

    @Override
    public String describe() {
      return "paths(" + parts.size() + " parts)";
    }
  }

  /** An Esri polygon ({@code rings}) or GeoJSON {@code Polygon}/{@code MultiPolygon}, outer ring first. */
  record RingShape(List<List<double[]>> rings) implements RawGeometry {

    public RingShape {
      rings = List.copyOf(rings);
    }

    @Override
    public String describe() {
      return "rings(" + rings.size() + " rings)";
    }
  }

  /** Anything else: a missing geometry, a multipoint, or coordinates that could not be read. */
  record Unrecognized(String description) implements RawGeometry {

    @Override
    public String describe() {
      return description;
    }
  }
}

package com.mineralink.harvester.geo;

import java.util.List;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.impl.PackedCoordinateSequence;
import org.locationtech.jts.geom.impl.PackedCoordinateSequenceFactory;

/**
 * A collection of utilities for working with JTS data structures and longitude/latitude coordinates.
 */
public class GeoUtils {

  public static final GeometryFactory JTS_FACTORY = new GeometryFactory(PackedCoordinateSequenceFactory.DOUBLE_FACTORY);

  public static final double MIN_LON = -180;
  public static final double MAX_LON = 180;
  public static final double MIN_LAT = -90;
  public static final double MAX_LAT = 90;

  /** Bounds of valid WGS84 longitude/latitude coordinates. */
  public static final Envelope WORLD_LAT_LON_BOUNDS = new Envelope(MIN_LON, MAX_LON, MIN_LAT, MAX_LAT);

  // should not instantiate
  private GeoUtils() {}

  /** Returns true if {@code lon} and {@code lat} are finite and within WGS84 range. */
  public static boolean isValidLonLat(double lon, double lat) {
    return Double.isFinite(lon) && Double.isFinite(lat) &&
      lon >= MIN_LON && lon <= MAX_LON && lat >= MIN_LAT && lat <= MAX_LAT;
  }

  /** Returns true if every position in {@code coordinates} is a valid longitude/latitude. */
  public static boolean isValidLonLat(CoordinateSequence coordinates) {
    for (int i = 0; i < coordinates.size(); i++) {
      if (!isValidLonLat(coordinates.getX(i), coordinates.getY(i))) {
        return false;
      }
    }
    return true;
  }

  /** Returns a 2-dimensional coordinate sequence packed from {@code x, y} pairs. */
  public static CoordinateSequence coordinateSequence(double... coords) {
    return new PackedCoordinateSequence.Double(coords, 2, 0);
  }

  /** Returns a 2-dimensional coordinate sequence from a list of positions, ignoring any z or m values. */
  public static CoordinateSequence coordinateSequence(List<double[]> positions) {
    double[] packed = new double[positions.size() * 2];
    for (int i = 0; i < positions.size(); i++) {
      packed[i * 2] = positions.get(i)[0];
      packed[i * 2 + 1] = positions.get(i)[1];
    }
    return new PackedCoordinateSequence.Double(packed, 2, 0);
  }

  public static LineString createLineString(CoordinateSequence coordinates) {
    return JTS_FACTORY.createLineString(coordinates);
  }

  public static Polygon createPolygon(CoordinateSequence exteriorRing) {
    return JTS_FACTORY.createPolygon(exteriorRing);
  }
}

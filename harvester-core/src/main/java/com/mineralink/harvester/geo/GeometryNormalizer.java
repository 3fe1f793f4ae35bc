package com.mineralink.harvester.geo;

import com.mineralink.harvester.ErrorKind;
import com.mineralink.harvester.crs.Reprojector;
import com.mineralink.harvester.crs.ResolvedCrs;
import com.mineralink.harvester.reader.RawFeature;
import com.mineralink.harvester.reader.RawGeometry;
import com.mineralink.harvester.stats.Stats;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import javax.annotation.concurrent.NotThreadSafe;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reconstructs JTS geometries from wire geometries and reprojects them to WGS84 for one layer.
 * <p>
 * Only the first path of a polyline and the first ring of a polygon are kept, the rest are counted and discarded.
 * Features whose geometry cannot be decoded or reprojected into valid longitude/latitude are dropped and counted by
 * {@link ErrorKind}.
 * <p>
 * Builds one {@link Reprojector} per source CRS the layer's responses use and reuses it, so an instance must stay on
 * one thread. A response CRS that cannot be reprojected falls back to the layer CRS. {@link #sourceCrs()} reports the
 * CRS the kept features were actually reprojected from.
 */
@NotThreadSafe
public class GeometryNormalizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeometryNormalizer.class);

  private final String layer;
  private final ResolvedCrs layerCrs;
  private final boolean axisSwap;
  private final Stats stats;
  private final Function<String, Reprojector> reprojectorFactory;
  private final Map<String, Reprojector> reprojectors = new HashMap<>();
  private final Map<String, Long> keptBySourceCrs = new LinkedHashMap<>();
  private final Map<ErrorKind, Long> drops = new EnumMap<>(ErrorKind.class);
  private long discardedParts = 0;
  private long axisSwapped = 0;

  /**
   * @param layer    layer name, for logs
   * @param layerCrs CRS of coordinates in responses that do not report their own
   * @param axisSwap whether to try swapping x and y of a geometry that reprojects out of range
   * @throws IllegalArgumentException if {@code layerCrs} cannot be decoded
   */
  public GeometryNormalizer(String layer, ResolvedCrs layerCrs, boolean axisSwap, Stats stats) {
    this(layer, layerCrs, axisSwap, stats, Reprojector::toWgs84);
  }

  GeometryNormalizer(String layer, ResolvedCrs layerCrs, boolean axisSwap, Stats stats,
    Function<String, Reprojector> reprojectorFactory) {
    this.layer = layer;
    this.layerCrs = layerCrs;
    this.axisSwap = axisSwap;
    this.stats = stats;
    this.reprojectorFactory = reprojectorFactory;
    reprojectors.put(layerCrs.code(), reprojectorFactory.apply(layerCrs.code()));
  }

  /** Normalizes a feature whose coordinates are in the layer's CRS. */
  public NormalizeResult normalize(RawFeature feature) {
    return normalize(feature, null);
  }

  /**
   * Normalizes a feature from a response that reported its coordinates are in {@code responseCrs}.
   *
   * @param responseCrs CRS code from the response, or {@code null} to use the layer's CRS
   */
  public NormalizeResult normalize(RawFeature feature, String responseCrs) {
    try {
      Reprojector reprojector = reprojectorFor(responseCrs);
      Shape shape = decode(feature.geometry());
      CoordinateSequence coordinates = reprojector.transform(shape.coordinates);
      boolean swapped = false;
      if (!GeoUtils.isValidLonLat(coordinates)) {
        CoordinateSequence swappedCoordinates = axisSwap ? swapAxes(coordinates) : null;
        if (swappedCoordinates == null || !GeoUtils.isValidLonLat(swappedCoordinates)) {
          throw new GeometryException.Verbose(ErrorKind.REPROJECTION_ERROR, "out_of_range",
            "Reprojected " + feature.geometry().describe() + " from " + reprojector.source() +
              " is outside longitude/latitude range");
        }
        coordinates = swappedCoordinates;
        swapped = true;
        axisSwapped++;
      }
      Geometry geometry = switch (shape.type) {
        case POINT -> GeoUtils.JTS_FACTORY.createPoint(coordinates);
        case LINE -> GeoUtils.createLineString(coordinates);
        case POLYGON -> GeoUtils.createPolygon(coordinates);
      };
      discardedParts += shape.discardedParts;
      keptBySourceCrs.merge(reprojector.source(), 1L, Long::sum);
      return new NormalizeResult.Normalized(
        new NormalizedFeature(shape.type, geometry, feature.attributes(), swapped), shape.discardedParts);
    } catch (GeometryException e) {
      e.addDetails(() -> "attributes: " + feature.attributes())
        .log(stats, "normalize", "Dropping feature from " + layer);
      drops.merge(e.kind(), 1L, Long::sum);
      return new NormalizeResult.Dropped(e.kind(), e.getMessage());
    }
  }

  /**
   * Returns the CRS most kept features were reprojected from: the layer CRS, or the CRS responses reported when they
   * overrode it.
   */
  public ResolvedCrs sourceCrs() {
    return keptBySourceCrs.entrySet().stream()
      .max(Map.Entry.comparingByValue())
      .map(Map.Entry::getKey)
      .filter(code -> !code.equals(layerCrs.code()))
      .map(ResolvedCrs::fromResponse)
      .orElse(layerCrs);
  }

  /** Returns the number of kept features by the CRS they were reprojected from. */
  public Map<String, Long> keptBySourceCrs() {
    return Map.copyOf(keptBySourceCrs);
  }

  /** Returns the number of features dropped so far, by reason. */
  public Map<ErrorKind, Long> drops() {
    return Map.copyOf(drops);
  }

  /** Returns the number of extra paths and rings discarded from kept features so far. */
  public long discardedParts() {
    return discardedParts;
  }

  /** Returns the number of kept features that needed their axes swapped. */
  public long axisSwapped() {
    return axisSwapped;
  }

  private Reprojector reprojectorFor(String responseCrs) {
    if (responseCrs == null || responseCrs.isBlank()) {
      return reprojectors.get(layerCrs.code());
    }
    return reprojectors.computeIfAbsent(Reprojector.canonical(responseCrs), c -> {
      try {
        Reprojector reprojector = reprojectorFactory.apply(c);
        LOGGER.info("Response for {} is in {}, not {}, using the CRS the response reports", layer, c, layerCrs);
        return reprojector;
      } catch (IllegalArgumentException e) {
        LOGGER.warn("Response for {} is in {} which cannot be reprojected, using {}: {}", layer, c, layerCrs,
          e.getMessage());
        return reprojectors.get(layerCrs.code());
      }
    });
  }

  private static Shape decode(RawGeometry geometry) throws GeometryException {
    if (geometry instanceof RawGeometry.PointShape point) {
      checkFinite(point.x(), point.y());
      return new Shape(GeometryType.POINT, GeoUtils.coordinateSequence(point.x(), point.y()), 0);
    } else if (geometry instanceof RawGeometry.PathShape path) {
      List<double[]> first = firstPart(path.parts(), "path");
      if (first.size() < GeometryType.LINE.minPoints()) {
        throw new GeometryException(ErrorKind.GEOMETRY_DECODE_ERROR, "short_path",
          "Path needs at least 2 positions, got " + first.size());
      }
      return new Shape(GeometryType.LINE, positions(first), path.parts().size() - 1);
    } else if (geometry instanceof RawGeometry.RingShape polygon) {
      List<double[]> ring = firstPart(polygon.rings(), "ring");
      if (ring.size() < GeometryType.POLYGON.minPoints()) {
        throw new GeometryException(ErrorKind.GEOMETRY_DECODE_ERROR, "short_ring",
          "Ring needs at least 4 positions, got " + ring.size());
      }
      double[] start = ring.get(0);
      double[] end = ring.get(ring.size() - 1);
      if (start[0] != end[0] || start[1] != end[1]) {
        throw new GeometryException(ErrorKind.GEOMETRY_DECODE_ERROR, "open_ring", "Ring is not closed");
      }
      return new Shape(GeometryType.POLYGON, positions(ring), polygon.rings().size() - 1);
    } else if (geometry instanceof RawGeometry.Unrecognized unrecognized) {
      throw new GeometryException.Verbose(ErrorKind.GEOMETRY_DECODE_ERROR, "unrecognized",
        "Unsupported geometry: " + unrecognized.description());
    }
    throw new GeometryException(ErrorKind.GEOMETRY_DECODE_ERROR, "unrecognized", "Unsupported geometry: " + geometry);
  }

  private static List<double[]> firstPart(List<List<double[]>> parts, String name) throws GeometryException {
    if (parts.isEmpty()) {
      throw new GeometryException(ErrorKind.GEOMETRY_DECODE_ERROR, "empty_" + name, "Geometry has no " + name);
    }
    return parts.get(0);
  }

  private static CoordinateSequence positions(List<double[]> positions) throws GeometryException {
    for (double[] position : positions) {
      checkFinite(position[0], position[1]);
    }
    return GeoUtils.coordinateSequence(positions);
  }

  private static void checkFinite(double x, double y) throws GeometryException {
    if (!Double.isFinite(x) || !Double.isFinite(y)) {
      throw new GeometryException(ErrorKind.GEOMETRY_DECODE_ERROR, "not_finite",
        "Coordinate is not finite: " + x + "," + y);
    }
  }

  private static CoordinateSequence swapAxes(CoordinateSequence coordinates) {
    double[] packed = new double[coordinates.size() * 2];
    for (int i = 0; i < coordinates.size(); i++) {
      packed[i * 2] = coordinates.getY(i);
      packed[i * 2 + 1] = coordinates.getX(i);
    }
    return GeoUtils.coordinateSequence(packed);
  }

  private record Shape(GeometryType type, CoordinateSequence coordinates, int discardedParts) {}
}

package com.mineralink.harvester.crs;

import com.mineralink.harvester.ErrorKind;
import com.mineralink.harvester.geo.GeometryException;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import javax.annotation.concurrent.NotThreadSafe;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.impl.PackedCoordinateSequence;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.Proj4jException;
import org.locationtech.proj4j.ProjCoordinate;

/**
 * A fixed coordinate transform from one CRS to another, built once per layer and reused for every feature.
 * <p>
 * Coordinates are always in {@code x=longitude/easting, y=latitude/northing} order. Transforming between two codes that
 * are the same after {@link #canonical(String)} is the identity, so WGS84 input passes through untouched.
 * <p>
 * Instances reuse scratch coordinates, so use one per thread.
 */
@NotThreadSafe
public final class Reprojector {

  public static final String WGS84 = "EPSG:4326";
  public static final String WEB_MERCATOR = "EPSG:3857";

  private static final CRSFactory CRS_FACTORY = new CRSFactory();
  private static final CoordinateTransformFactory TRANSFORM_FACTORY = new CoordinateTransformFactory();
  private static final Map<String, CoordinateReferenceSystem> CRS_CACHE = new ConcurrentHashMap<>();
  private static final Map<String, String> ALIASES = Map.of(
    "CRS:84", WGS84,
    "OGC:CRS84", WGS84,
    "EPSG:102100", WEB_MERCATOR,
    "EPSG:102113", WEB_MERCATOR,
    "EPSG:900913", WEB_MERCATOR,
    "ESRI:102100", WEB_MERCATOR,
    "ESRI:102113", WEB_MERCATOR
  );

  private final String source;
  private final String target;
  private final CoordinateTransform transform;
  private final ProjCoordinate in = new ProjCoordinate();
  private final ProjCoordinate out = new ProjCoordinate();

  private Reprojector(String source, String target) {
    this.source = canonical(source);
    this.target = canonical(target);
    this.transform = this.source.equals(this.target) ? null :
      TRANSFORM_FACTORY.createTransform(decode(this.source), decode(this.target));
  }

  /**
   * Returns a transform from {@code sourceCrs} to WGS84 longitude/latitude.
   *
   * @throws IllegalArgumentException if {@code sourceCrs} is not a CRS code proj4j knows
   */
  public static Reprojector toWgs84(String sourceCrs) {
    return between(sourceCrs, WGS84);
  }

  /**
   * Returns a transform from {@code sourceCrs} to {@code targetCrs}.
   *
   * @throws IllegalArgumentException if either is not a CRS code proj4j knows
   */
  public static Reprojector between(String sourceCrs, String targetCrs) {
    try {
      return new Reprojector(sourceCrs, targetCrs);
    } catch (Proj4jException e) {
      throw new IllegalArgumentException("Cannot transform " + sourceCrs + " to " + targetCrs, e);
    }
  }

  /** Returns true if {@code code} can be decoded into a coordinate reference system. */
  public static boolean isSupported(String code) {
    try {
      decode(canonical(code));
      return true;
    } catch (IllegalArgumentException e) {
      return false;
    }
  }

  /**
   * Returns {@code code} upper-cased, with Esri and OGC aliases of WGS84 and Web Mercator replaced by their EPSG codes.
   */
  public static String canonical(String code) {
    if (code == null || code.isBlank()) {
      throw new IllegalArgumentException("Missing CRS code");
    }
    String upper = code.strip().toUpperCase(Locale.ROOT);
    if (upper.matches("^\\d+$")) {
      upper = "EPSG:" + upper;
    }
    return ALIASES.getOrDefault(upper, upper);
  }

  private static CoordinateReferenceSystem decode(String code) {
    return CRS_CACHE.computeIfAbsent(code, c -> {
      try {
        return CRS_FACTORY.createFromName(c);
      } catch (RuntimeException e) {
        throw new IllegalArgumentException("Unknown CRS " + c, e);
      }
    });
  }

  public String source() {
    return source;
  }

  public String target() {
    return target;
  }

  /** Returns the transform in the opposite direction. */
  public Reprojector inverse() {
    return between(target, source);
  }

  /**
   * Transforms a single {@code x, y} position.
   *
   * @throws GeometryException if the transform fails or produces a non-finite coordinate
   */
  public double[] transform(double x, double y) throws GeometryException {
    if (transform == null) {
      return new double[]{x, y};
    }
    in.x = x;
    in.y = y;
    try {
      transform.transform(in, out);
    } catch (Proj4jException e) {
      throw new GeometryException.Verbose(ErrorKind.REPROJECTION_ERROR, "transform_failed",
        "Cannot transform " + x + "," + y + " from " + source + " to " + target + ": " + e.getMessage(), e);
    }
    if (!Double.isFinite(out.x) || !Double.isFinite(out.y)) {
      throw new GeometryException.Verbose(ErrorKind.REPROJECTION_ERROR, "transform_not_finite",
        "Transforming " + x + "," + y + " from " + source + " to " + target + " gave " + out.x + "," + out.y);
    }
    return new double[]{out.x, out.y};
  }

  /**
   * Returns a new 2-dimensional sequence with every position of {@code coordinates} transformed.
   *
   * @throws GeometryException if any position fails to transform
   */
  public CoordinateSequence transform(CoordinateSequence coordinates) throws GeometryException {
    if (transform == null) {
      return coordinates.copy();
    }
    double[] packed = new double[coordinates.size() * 2];
    for (int i = 0; i < coordinates.size(); i++) {
      double[] result = transform(coordinates.getX(i), coordinates.getY(i));
      packed[i * 2] = result[0];
      packed[i * 2 + 1] = result[1];
    }
    return new PackedCoordinateSequence.Double(packed, 2, 0);
  }

  @Override
  public String toString() {
    return "Reprojector[" + source + " -> " + target + "]";
  }
}

package com.mineralink.harvester.geo;

import static org.junit.jupiter.api.Assertions.*;

import com.mineralink.harvester.ErrorKind;
import com.mineralink.harvester.crs.Reprojector;
import com.mineralink.harvester.crs.ResolvedCrs;
import com.mineralink.harvester.reader.RawFeature;
import com.mineralink.harvester.reader.RawGeometry;
import com.mineralink.harvester.stats.Stats;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

class GeometryNormalizerTest {

  private final Stats stats = Stats.inMemory();
  private final GeometryNormalizer wgs84 = new GeometryNormalizer("wells", ResolvedCrs.declared("EPSG:4326"), false,
    stats);

  private static RawFeature feature(RawGeometry geometry) {
    return new RawFeature(geometry, Map.of("id", 1L));
  }

  private static List<double[]> positions(double... coords) {
    return IntStream.range(0, coords.length / 2)
      .mapToObj(i -> new double[]{coords[i * 2], coords[i * 2 + 1]})
      .toList();
  }

  private static NormalizedFeature kept(NormalizeResult result) {
    return assertInstanceOf(NormalizeResult.Normalized.class, result).feature();
  }

  @Test
  void testPoint() {
    var feature = kept(wgs84.normalize(feature(new RawGeometry.PointShape(-80.5, 38.25))));
    assertEquals(GeometryType.POINT, feature.type());
    assertEquals(new Coordinate(-80.5, 38.25), feature.geometry().getCoordinate());
    assertEquals(Map.of("id", 1L), feature.attributes());
    assertFalse(feature.axisSwapped());
  }

  @Test
  void testReprojectsWebMercatorPoint() {
    var normalizer = new GeometryNormalizer("parcels", ResolvedCrs.declared("EPSG:3857"), false, stats);
    var point = (Point) kept(normalizer.normalize(feature(new RawGeometry.PointShape(-9203418.0, 4539833.0))))
      .geometry();
    assertEquals(-82.6757, point.getX(), 1e-3);
    assertEquals(37.7192, point.getY(), 1e-3);
  }

  @Test
  void testResponseCrsOverridesLayerCrs() {
    var point = (Point) kept(wgs84.normalize(feature(new RawGeometry.PointShape(-9203418.0, 4539833.0)),
      "EPSG:3857")).geometry();
    assertEquals(-82.6757, point.getX(), 1e-3);
    // later responses without a CRS still use the layer's
    var second = kept(wgs84.normalize(feature(new RawGeometry.PointShape(-80, 38))));
    assertEquals(new Coordinate(-80, 38), second.geometry().getCoordinate());
    assertEquals(Map.of("EPSG:3857", 1L, "EPSG:4326", 1L), wgs84.keptBySourceCrs());
  }

  @Test
  void testSourceCrsReportsResponseCrsThatTransformedMostFeatures() {
    assertEquals(ResolvedCrs.declared("EPSG:4326"), wgs84.sourceCrs());
    for (int i = 0; i < 2; i++) {
      kept(wgs84.normalize(feature(new RawGeometry.PointShape(-9203418.0, 4539833.0)), "EPSG:3857"));
    }
    kept(wgs84.normalize(feature(new RawGeometry.PointShape(-80, 38))));
    assertEquals(ResolvedCrs.fromResponse("EPSG:3857"), wgs84.sourceCrs());
  }

  @Test
  void testUnknownResponseCrsUsesLayerCrs() {
    var feature = kept(wgs84.normalize(feature(new RawGeometry.PointShape(-80, 38)), "EPSG:999999"));
    assertEquals(new Coordinate(-80, 38), feature.geometry().getCoordinate());
    assertEquals(ResolvedCrs.declared("EPSG:4326"), wgs84.sourceCrs());
  }

  @Test
  void testResponseCrsThatCannotBeReprojectedUsesLayerCrs() {
    var normalizer = new GeometryNormalizer("wells", ResolvedCrs.declared("EPSG:4326"), false, stats, code -> {
      if (code.equals("EPSG:32617")) {
        throw new IllegalArgumentException("Cannot transform " + code);
      }
      return Reprojector.toWgs84(code);
    });
    for (int i = 0; i < 2; i++) {
      var feature = kept(normalizer.normalize(feature(new RawGeometry.PointShape(-80, 38)), "EPSG:32617"));
      assertEquals(new Coordinate(-80, 38), feature.geometry().getCoordinate());
    }
    assertEquals(ResolvedCrs.declared("EPSG:4326"), normalizer.sourceCrs());
    assertTrue(normalizer.drops().isEmpty());
  }

  @Test
  void testKeepsFirstPathOnly() {
    var result = wgs84.normalize(feature(new RawGeometry.PathShape(List.of(
      positions(-80, 38, -80.1, 38.1, -80.2, 38.1),
      positions(-81, 39, -81.1, 39.1)
    ))));
    var normalized = assertInstanceOf(NormalizeResult.Normalized.class, result);
    assertEquals(GeometryType.LINE, normalized.feature().type());
    assertEquals(3, normalized.feature().geometry().getNumPoints());
    assertEquals(1, normalized.discardedParts());
    assertEquals(1, wgs84.discardedParts());
  }

  @Test
  void testKeepsExteriorRingOnly() {
    var result = wgs84.normalize(feature(new RawGeometry.RingShape(List.of(
      positions(-80, 38, -79, 38, -79, 39, -80, 39, -80, 38),
      positions(-79.8, 38.2, -79.2, 38.2, -79.2, 38.8, -79.8, 38.2),
      positions(-70, 30, -69, 30, -69, 31, -70, 30)
    ))));
    var normalized = assertInstanceOf(NormalizeResult.Normalized.class, result);
    var polygon = (Polygon) normalized.feature().geometry();
    assertEquals(0, polygon.getNumInteriorRing());
    assertEquals(5, polygon.getExteriorRing().getNumPoints());
    assertEquals(1, polygon.getArea(), 1e-9);
    assertEquals(2, normalized.discardedParts());
  }

  @Test
  void testDropsAndCountsBadGeometries() {
    List<RawGeometry> bad = List.of(
      new RawGeometry.PathShape(List.of(positions(-80, 38))),
      new RawGeometry.PathShape(List.of()),
      new RawGeometry.RingShape(List.of(positions(-80, 38, -79, 38, -80, 38))),
      new RawGeometry.RingShape(List.of(positions(-80, 38, -79, 38, -79, 39, -80, 39))),
      new RawGeometry.PointShape(Double.NaN, 38),
      new RawGeometry.Unrecognized("multipoint"),
      new RawGeometry.PointShape(-80, 138)
    );
    for (RawGeometry geometry : bad) {
      assertInstanceOf(NormalizeResult.Dropped.class, wgs84.normalize(feature(geometry)), geometry.describe());
    }
    assertEquals(Map.of(
      ErrorKind.GEOMETRY_DECODE_ERROR, 6L,
      ErrorKind.REPROJECTION_ERROR, 1L
    ), wgs84.drops());
    assertEquals(Map.of(
      "normalize_short_path", 1L,
      "normalize_empty_path", 1L,
      "normalize_short_ring", 1L,
      "normalize_open_ring", 1L,
      "normalize_not_finite", 1L,
      "normalize_unrecognized", 1L,
      "normalize_out_of_range", 1L
    ), stats.dataErrors());
  }

  @Test
  void testAxisSwapDisabledDropsFeature() {
    var result = wgs84.normalize(feature(new RawGeometry.PointShape(38.5, -100.5)));
    assertEquals(ErrorKind.REPROJECTION_ERROR, assertInstanceOf(NormalizeResult.Dropped.class, result).kind());
    assertEquals(0, wgs84.axisSwapped());
  }

  @Test
  void testAxisSwapEnabledFlagsFeature() {
    var normalizer = new GeometryNormalizer("wells", ResolvedCrs.declared("EPSG:4326"), true, stats);
    var feature = kept(normalizer.normalize(feature(new RawGeometry.PointShape(38.5, -100.5))));
    assertEquals(new Coordinate(-100.5, 38.5), feature.geometry().getCoordinate());
    assertTrue(feature.axisSwapped());
    assertEquals(1, normalizer.axisSwapped());

    // in-range coordinates are never swapped
    assertFalse(kept(normalizer.normalize(feature(new RawGeometry.PointShape(38.5, -80.5)))).axisSwapped());
  }

  @Test
  void testAxisSwapStillOutOfRangeIsDropped() {
    var normalizer = new GeometryNormalizer("wells", ResolvedCrs.declared("EPSG:4326"), true, stats);
    assertInstanceOf(NormalizeResult.Dropped.class,
      normalizer.normalize(feature(new RawGeometry.PointShape(200, 100))));
  }
}

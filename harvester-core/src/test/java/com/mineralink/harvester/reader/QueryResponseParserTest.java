package com.mineralink.harvester.reader;

import static org.junit.jupiter.api.Assertions.*;

import com.mineralink.harvester.ErrorKind;
import com.mineralink.harvester.fetch.FetchException;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class QueryResponseParserTest {

  private static RawGeometry esriGeometry(String geometry) throws FetchException {
    var response = QueryResponseParser.parse("{\"features\":[{\"attributes\":{},\"geometry\":" + geometry + "}]}",
      ResponseFormat.JSON);
    assertEquals(1, response.size());
    return response.features().get(0).geometry();
  }

  private static RawGeometry geoJsonGeometry(String geometry) throws FetchException {
    var response = QueryResponseParser.parse(
      "{\"type\":\"FeatureCollection\",\"features\":[{\"type\":\"Feature\",\"properties\":{},\"geometry\":" + geometry +
        "}]}", ResponseFormat.GEOJSON);
    return response.features().get(0).geometry();
  }

  @Test
  void testEsriPoint() throws FetchException {
    assertEquals(new RawGeometry.PointShape(-9203520.5, 4539408.25), esriGeometry("{\"x\":-9203520.5,\"y\":4539408.25}"));
  }

  @Test
  void testEsriPaths() throws FetchException {
    var paths = assertInstanceOf(RawGeometry.PathShape.class,
      esriGeometry("{\"paths\":[[[1,2],[3,4,5]],[[6,7],[8,9]]]}"));
    assertEquals(2, paths.parts().size());
    assertArrayEquals(new double[]{3, 4}, paths.parts().get(0).get(1));
  }

  @Test
  void testEsriRings() throws FetchException {
    var rings = assertInstanceOf(RawGeometry.RingShape.class,
      esriGeometry("{\"rings\":[[[0,0],[1,0],[1,1],[0,0]]]}"));
    assertEquals(1, rings.rings().size());
    assertEquals(4, rings.rings().get(0).size());
  }

  @ParameterizedTest
  @ValueSource(strings = {
    "null",
    "{}",
    "{\"x\":null,\"y\":null}",
    "{\"x\":\"NaN\",\"y\":1}",
    "{\"points\":[[1,2],[3,4]]}",
    "{\"curvePaths\":[]}",
    "{\"rings\":[[[0,0],[1]]]}",
    "{\"paths\":\"none\"}",
  })
  void testUnrecognizedEsriGeometry(String geometry) throws FetchException {
    assertInstanceOf(RawGeometry.Unrecognized.class, esriGeometry(geometry));
  }

  @Test
  void testGeoJsonGeometries() throws FetchException {
    assertEquals(new RawGeometry.PointShape(-80.5, 38.25),
      geoJsonGeometry("{\"type\":\"Point\",\"coordinates\":[-80.5,38.25,100]}"));
    assertEquals(1, assertInstanceOf(RawGeometry.PathShape.class,
      geoJsonGeometry("{\"type\":\"LineString\",\"coordinates\":[[0,0],[1,1]]}")).parts().size());
    assertEquals(2, assertInstanceOf(RawGeometry.PathShape.class,
      geoJsonGeometry("{\"type\":\"MultiLineString\",\"coordinates\":[[[0,0],[1,1]],[[2,2],[3,3]]]}")).parts().size());
    assertEquals(2, assertInstanceOf(RawGeometry.RingShape.class, geoJsonGeometry(
      "{\"type\":\"Polygon\",\"coordinates\":[[[0,0],[4,0],[4,4],[0,0]],[[1,1],[2,1],[2,2],[1,1]]]}")).rings().size());
    var multiPolygon = assertInstanceOf(RawGeometry.RingShape.class, geoJsonGeometry(
      "{\"type\":\"MultiPolygon\",\"coordinates\":[[[[0,0],[1,0],[1,1],[0,0]]],[[[5,5],[6,5],[6,6],[5,5]]]]}"));
    assertEquals(2, multiPolygon.rings().size());
    assertArrayEquals(new double[]{0, 0}, multiPolygon.rings().get(0).get(0));
  }

  @ParameterizedTest
  @ValueSource(strings = {
    "null",
    "{\"type\":\"MultiPoint\",\"coordinates\":[[0,0]]}",
    "{\"type\":\"GeometryCollection\",\"geometries\":[]}",
    "{\"type\":\"Point\",\"coordinates\":[1]}",
    "{\"type\":\"LineString\"}",
  })
  void testUnrecognizedGeoJsonGeometry(String geometry) throws FetchException {
    assertInstanceOf(RawGeometry.Unrecognized.class, geoJsonGeometry(geometry));
  }

  @Test
  void testAttributes() throws FetchException {
    var response = QueryResponseParser.parse("""
      {"features":[{"geometry":{"x":1,"y":2},"attributes":{
        "OBJECTID":12,
        "API":"4700100001",
        "depth":1520.5,
        "active":true,
        "operator":null,
        "big":123456789012345678901234567890,
        "nested":{"a":[1,2]}
      }}]}
      """, ResponseFormat.JSON);
    var attributes = response.features().get(0).attributes();
    assertEquals(List.of("OBJECTID", "API", "depth", "active", "operator", "big", "nested"),
      List.copyOf(attributes.keySet()));
    assertEquals(12L, attributes.get("OBJECTID"));
    assertEquals("4700100001", attributes.get("API"));
    assertEquals(1520.5, attributes.get("depth"));
    assertEquals(true, attributes.get("active"));
    assertTrue(attributes.containsKey("operator"));
    assertNull(attributes.get("operator"));
    assertEquals(new BigInteger("123456789012345678901234567890"), attributes.get("big"));
    assertEquals("{\"a\":[1,2]}", attributes.get("nested"));
  }

  @Test
  void testMissingAttributes() throws FetchException {
    var response = QueryResponseParser.parse("{\"features\":[{\"geometry\":{\"x\":1,\"y\":2}}]}", ResponseFormat.JSON);
    assertTrue(response.features().get(0).attributes().isEmpty());
  }

  @Test
  void testEmptyFeatures() throws FetchException {
    var response = QueryResponseParser.parse("{\"features\":[]}", ResponseFormat.JSON);
    assertTrue(response.isEmpty());
    assertEquals(Optional.empty(), response.crs());
    assertFalse(response.exceededTransferLimit());
  }

  @Test
  void testEsriSpatialReference() throws FetchException {
    assertEquals(Optional.of("EPSG:3857"), QueryResponseParser.parse(
      "{\"spatialReference\":{\"wkid\":102100,\"latestWkid\":3857},\"features\":[]}", ResponseFormat.JSON).crs());
    assertEquals(Optional.of("EPSG:3857"), QueryResponseParser.parse(
      "{\"spatialReference\":{\"wkid\":102100},\"features\":[]}", ResponseFormat.JSON).crs());
    assertEquals(Optional.of("EPSG:26917"), QueryResponseParser.parse(
      "{\"spatialReference\":{\"wkid\":26917},\"features\":[]}", ResponseFormat.JSON).crs());
  }

  @Test
  void testGeoJsonCrs() throws FetchException {
    assertEquals(Optional.of("EPSG:3857"), QueryResponseParser.parse(
      "{\"crs\":{\"type\":\"name\",\"properties\":{\"name\":\"urn:ogc:def:crs:EPSG::3857\"}},\"features\":[]}",
      ResponseFormat.GEOJSON).crs());
    assertEquals(Optional.empty(), QueryResponseParser.parse("{\"features\":[]}", ResponseFormat.GEOJSON).crs());
  }

  @Test
  void testExceededTransferLimit() throws FetchException {
    assertTrue(QueryResponseParser.parse("{\"exceededTransferLimit\":true,\"features\":[]}", ResponseFormat.JSON)
      .exceededTransferLimit());
    assertTrue(QueryResponseParser.parse("{\"properties\":{\"exceededTransferLimit\":true},\"features\":[]}",
      ResponseFormat.GEOJSON).exceededTransferLimit());
  }

  @ParameterizedTest
  @CsvSource(value = {
    "{\"error\":{\"code\":500,\"message\":\"Error performing query operation\"}}| SERVER_ERROR",
    "{\"error\":{\"code\":503,\"message\":\"busy\",\"details\":[\"try later\"]}}| SERVER_ERROR",
    "{\"error\":{\"message\":\"no code\"}}| SERVER_ERROR",
    "{\"error\":{\"code\":400,\"message\":\"Invalid query parameters\"}}| CLIENT_ERROR",
    "{\"error\":{\"code\":498,\"message\":\"Invalid token\"}}| CLIENT_ERROR",
    "<html>Bad gateway</html>| MALFORMED_RESPONSE",
    "''| MALFORMED_RESPONSE",
    "'   '| MALFORMED_RESPONSE",
    "[]| MALFORMED_RESPONSE",
    "{\"type\":\"FeatureCollection\"}| MALFORMED_RESPONSE",
    "{\"features\":{}}| MALFORMED_RESPONSE",
  }, delimiter = '|', emptyValue = "")
  void testErrors(String body, ErrorKind expected) {
    var exception = assertThrows(FetchException.class, () -> QueryResponseParser.parse(body, ResponseFormat.JSON));
    assertEquals(expected, exception.kind());
  }

  @Test
  void testMissingBody() {
    var exception = assertThrows(FetchException.class, () -> QueryResponseParser.parse(null, ResponseFormat.GEOJSON));
    assertEquals(ErrorKind.MALFORMED_RESPONSE, exception.kind());
  }

  @Test
  void testWkidToCode() {
    assertEquals("EPSG:3857", QueryResponseParser.wkidToCode(102100));
    assertEquals("EPSG:3857", QueryResponseParser.wkidToCode(102113));
    assertEquals("EPSG:3857", QueryResponseParser.wkidToCode(900913));
    assertEquals("EPSG:4326", QueryResponseParser.wkidToCode(4326));
  }
}

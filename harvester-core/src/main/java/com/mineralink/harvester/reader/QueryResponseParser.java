package com.mineralink.harvester.reader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mineralink.harvester.ErrorKind;
import com.mineralink.harvester.fetch.FetchException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes the body of a map-service {@code query} response into {@link RawFeature RawFeatures}.
 * <p>
 * Services report some failures with HTTP 200 and an {@code {"error":{"code":..}}} body, so this also classifies those
 * into a {@link FetchException}: codes 500 and above are treated as server errors worth retrying, anything lower as a
 * client error.
 */
public class QueryResponseParser {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  // urn:ogc:def:crs:EPSG::3857, EPSG:3857, http://www.opengis.net/def/crs/EPSG/0/3857
  private static final Pattern EPSG_NAME = Pattern.compile("EPSG(?::+|/0/)(\\d+)$", Pattern.CASE_INSENSITIVE);

  private QueryResponseParser() {}

  /**
   * Parses {@code body} encoded as {@code format}.
   *
   * @throws FetchException with {@link ErrorKind#MALFORMED_RESPONSE} if the body is not a JSON object with a
   *                        {@code features} array, or {@link ErrorKind#SERVER_ERROR}/{@link ErrorKind#CLIENT_ERROR} if
   *                        it is a service error document
   */
  public static QueryResponse parse(String body, ResponseFormat format) throws FetchException {
    if (body == null) {
      throw new FetchException(ErrorKind.MALFORMED_RESPONSE, "Response has no body");
    }
    JsonNode root;
    try {
      root = MAPPER.readTree(body);
    } catch (JsonProcessingException e) {
      throw new FetchException(ErrorKind.MALFORMED_RESPONSE, "Response is not JSON: " + e.getOriginalMessage(), e);
    }
    if (root == null || !root.isObject()) {
      throw new FetchException(ErrorKind.MALFORMED_RESPONSE, "Response is not a JSON object");
    }
    checkServiceError(root);
    JsonNode features = root.get("features");
    if (features == null || !features.isArray()) {
      throw new FetchException(ErrorKind.MALFORMED_RESPONSE, "Response has no features array");
    }
    List<RawFeature> result = new ArrayList<>(features.size());
    for (JsonNode feature : features) {
      result.add(format == ResponseFormat.GEOJSON ? geoJsonFeature(feature) : esriFeature(feature));
    }
    Optional<String> crs = format == ResponseFormat.GEOJSON ? geoJsonCrs(root) :
      wkid(root.path("spatialReference")).stream().mapToObj(QueryResponseParser::wkidToCode).findFirst();
    boolean exceeded = root.path("exceededTransferLimit").asBoolean(false) ||
      root.path("properties").path("exceededTransferLimit").asBoolean(false);
    return new QueryResponse(result, crs, exceeded);
  }

  /**
   * Returns the well-known ID of an Esri {@code spatialReference} object, preferring {@code latestWkid} over
   * {@code wkid}.
   */
  public static OptionalInt wkid(JsonNode spatialReference) {
    for (String field : List.of("latestWkid", "wkid")) {
      JsonNode value = spatialReference.path(field);
      if (value.canConvertToInt() && value.isIntegralNumber() && value.intValue() > 0) {
        return OptionalInt.of(value.intValue());
      }
    }
    return OptionalInt.empty();
  }

  /** Returns the {@code EPSG:<id>} code for an Esri well-known ID. */
  public static String wkidToCode(int wkid) {
    return switch (wkid) {
      case 102100, 102113, 900913 -> "EPSG:3857";
      default -> "EPSG:" + wkid;
    };
  }

  private static void checkServiceError(JsonNode root) throws FetchException {
    JsonNode error = root.get("error");
    if (error == null || error.isNull()) {
      return;
    }
    int code = error.path("code").asInt(500);
    String message = "Service error " + code + ": " + error.path("message").asText("");
    JsonNode details = error.path("details");
    if (details.isArray() && !details.isEmpty()) {
      message += " " + details;
    }
    throw new FetchException(code >= 500 ? ErrorKind.SERVER_ERROR : ErrorKind.CLIENT_ERROR, message);
  }

  private static RawFeature esriFeature(JsonNode feature) {
    return new RawFeature(esriGeometry(feature.get("geometry")), attributes(feature.get("attributes")));
  }

  private static RawFeature geoJsonFeature(JsonNode feature) {
    return new RawFeature(geoJsonGeometry(feature.get("geometry")), attributes(feature.get("properties")));
  }

  private static RawGeometry esriGeometry(JsonNode geometry) {
    if (geometry == null || !geometry.isObject()) {
      return new RawGeometry.Unrecognized("no geometry");
    }
    if (geometry.has("x") && geometry.has("y")) {
      JsonNode x = geometry.get("x");
      JsonNode y = geometry.get("y");
      return x.isNumber() && y.isNumber() ? new RawGeometry.PointShape(x.doubleValue(), y.doubleValue()) :
        new RawGeometry.Unrecognized("empty point");
    } else if (geometry.has("rings")) {
      List<List<double[]>> rings = partList(geometry.get("rings"));
      return rings == null ? new RawGeometry.Unrecognized("invalid rings") : new RawGeometry.RingShape(rings);
    } else if (geometry.has("paths")) {
      List<List<double[]>> paths = partList(geometry.get("paths"));
      return paths == null ? new RawGeometry.Unrecognized("invalid paths") : new RawGeometry.PathShape(paths);
    } else if (geometry.has("points")) {
      return new RawGeometry.Unrecognized("multipoint");
    }
    return new RawGeometry.Unrecognized(geometry.isEmpty() ? "empty geometry" :
      "unknown geometry " + geometry.fieldNames().next());
  }

  private static RawGeometry geoJsonGeometry(JsonNode geometry) {
    if (geometry == null || !geometry.isObject()) {
      return new RawGeometry.Unrecognized("no geometry");
    }
    String type = geometry.path("type").asText("");
    JsonNode coordinates = geometry.get("coordinates");
    RawGeometry result = switch (type) {
      case "Point" -> {
        double[] position = position(coordinates);
        yield position == null ? null : new RawGeometry.PointShape(position[0], position[1]);
      }
      case "LineString" -> {
        List<double[]> line = positions(coordinates);
        yield line == null ? null : new RawGeometry.PathShape(List.of(line));
      }
      case "MultiLineString" -> {
        List<List<double[]>> lines = partList(coordinates);
        yield lines == null ? null : new RawGeometry.PathShape(lines);
      }
      case "Polygon" -> {
        List<List<double[]>> rings = partList(coordinates);
        yield rings == null ? null : new RawGeometry.RingShape(rings);
      }
      case "MultiPolygon" -> {
        List<List<double[]>> rings = new ArrayList<>();
        if (coordinates != null && coordinates.isArray()) {
          for (JsonNode polygon : coordinates) {
            List<List<double[]>> polygonRings = partList(polygon);
            if (polygonRings == null) {
              rings = null;
              break;
            }
            rings.addAll(polygonRings);
          }
        }
        yield rings == null ? null : new RawGeometry.RingShape(rings);
      }
      default -> new RawGeometry.Unrecognized("unsupported geometry type " + type);
    };
    return result == null ? new RawGeometry.Unrecognized("invalid " + type + " coordinates") : result;
  }

  private static List<List<double[]>> partList(JsonNode node) {
    if (node == null || !node.isArray()) {
      return null;
    }
    List<List<double[]>> result = new ArrayList<>(node.size());
    for (JsonNode part : node) {
      List<double[]> positions = positions(part);
      if (positions == null) {
        return null;
      }
      result.add(positions);
    }
    return result;
  }

  private static List<double[]> positions(JsonNode node) {
    if (node == null || !node.isArray()) {
      return null;
    }
    List<double[]> result = new ArrayList<>(node.size());
    for (JsonNode item : node) {
      double[] position = position(item);
      if (position == null) {
        return null;
      }
      result.add(position);
    }
    return result;
  }

  private static double[] position(JsonNode node) {
    if (node != null && node.isArray() && node.size() >= 2 && node.get(0).isNumber() && node.get(1).isNumber()) {
      return new double[]{node.get(0).doubleValue(), node.get(1).doubleValue()};
    }
    return null;
  }

  private static Map<String, Object> attributes(JsonNode node) {
    Map<String, Object> result = new LinkedHashMap<>();
    if (node != null && node.isObject()) {
      var fields = node.fields();
      while (fields.hasNext()) {
        var field = fields.next();
        result.put(field.getKey(), attributeValue(field.getValue()));
      }
    }
    return result;
  }

  private static Object attributeValue(JsonNode value) {
    if (value.isNull() || value.isMissingNode()) {
      return null;
    } else if (value.isTextual()) {
      return value.textValue();
    } else if (value.isBoolean()) {
      return value.booleanValue();
    } else if (value.isIntegralNumber()) {
      return value.canConvertToLong() ? value.longValue() : value.bigIntegerValue();
    } else if (value.isNumber()) {
      return value.doubleValue();
    }
    // nested objects and arrays are kept as their JSON text
    return value.toString();
  }

  private static Optional<String> geoJsonCrs(JsonNode root) {
    String name = root.path("crs").path("properties").path("name").asText("");
    Matcher matcher = EPSG_NAME.matcher(name);
    if (matcher.find()) {
      return Optional.of(wkidToCode(Integer.parseInt(matcher.group(1))));
    }
    return Optional.empty();
  }
}

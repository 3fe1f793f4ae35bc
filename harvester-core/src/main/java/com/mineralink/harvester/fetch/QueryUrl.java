package com.mineralink.harvester.fetch;

import com.mineralink.harvester.config.LayerDescriptor;
import com.mineralink.harvester.util.Format;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds map-service request URLs.
 */
public class QueryUrl {

  private QueryUrl() {}

  /**
   * Returns the {@code query} URL for {@code chunk} of {@code layer}.
   *
   * @param outSr {@code outSR} parameter, or blank to leave it out and get coordinates in the layer's own CRS
   */
  public static URI forChunk(LayerDescriptor layer, ChunkRequest chunk, String outSr) {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("where", "1=1");
    if (chunk.isSpatial()) {
      params.put("geometry", Format.envelope(chunk.envelope()));
      params.put("geometryType", "esriGeometryEnvelope");
      params.put("inSR", "4326");
      params.put("spatialRel", "esriSpatialRelIntersects");
    }
    params.put("outFields", "*");
    params.put("returnGeometry", "true");
    params.put("f", layer.format().id());
    if (outSr != null && !outSr.isBlank()) {
      params.put("outSR", outSr.strip());
    }
    if (!chunk.isSpatial()) {
      params.put("resultOffset", Long.toString(chunk.offset()));
      params.put("resultRecordCount", Integer.toString(chunk.pageSize()));
    }
    return withParams(layer.url(), params);
  }

  /** Returns the metadata URL of the layer that {@code queryUrl} queries. */
  public static URI metadata(String queryUrl) {
    return withParams(baseUrl(queryUrl), Map.of("f", "json"));
  }

  /** Returns {@code queryUrl} without its parameters and trailing {@code /query}. */
  public static String baseUrl(String queryUrl) {
    String result = queryUrl.strip();
    int question = result.indexOf('?');
    if (question >= 0) {
      result = result.substring(0, question);
    }
    result = result.replaceAll("/+$", "");
    return result.endsWith("/query") ? result.substring(0, result.length() - "/query".length()) : result;
  }

  private static URI withParams(String url, Map<String, String> params) {
    String query = params.entrySet().stream()
      .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
      .collect(Collectors.joining("&"));
    String separator = url.contains("?") ? (url.endsWith("?") || url.endsWith("&") ? "" : "&") : "?";
    return URI.create(url.strip() + separator + query);
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}

package com.mineralink.harvester.crs;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mineralink.harvester.ErrorKind;
import com.mineralink.harvester.config.HarvesterConfig;
import com.mineralink.harvester.config.LayerDescriptor;
import com.mineralink.harvester.fetch.QueryClient;
import com.mineralink.harvester.fetch.QueryUrl;
import com.mineralink.harvester.reader.QueryResponseParser;
import com.mineralink.harvester.stats.Stats;
import com.mineralink.harvester.util.RunLog;
import java.io.IOException;
import java.net.URI;
import java.util.OptionalInt;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Determines the coordinate system of a layer's raw coordinates.
 * <p>
 * In order of priority:
 * <ol>
 * <li>the {@code crs} declared on the layer</li>
 * <li>the spatial reference in the layer's service metadata ({@code <layer url>?f=json})</li>
 * <li>the configured default</li>
 * </ol>
 * A rule that fails or produces a code that cannot be decoded is logged and the next one is tried, so
 * {@link #resolve(LayerDescriptor)} always produces a usable CRS.
 */
public class CrsResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(CrsResolver.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final HarvesterConfig config;
  private final QueryClient client;
  private final Stats stats;
  private final RunLog runLog;

  public CrsResolver(HarvesterConfig config, QueryClient client, Stats stats, RunLog runLog) {
    this.config = config;
    this.client = client;
    this.stats = stats;
    this.runLog = runLog;
  }

  public ResolvedCrs resolve(LayerDescriptor layer) {
    if (layer.crs() != null) {
      if (Reprojector.isSupported(layer.crs())) {
        return ResolvedCrs.declared(layer.crs());
      }
      LOGGER.warn("Ignoring unknown CRS {} declared on {}", layer.crs(), layer.name());
    }
    if (config.probeCrs()) {
      String reason;
      try {
        String probed = probe(layer);
        if (Reprojector.isSupported(probed)) {
          LOGGER.debug("Probed {} for {}", probed, layer.name());
          return ResolvedCrs.probed(probed);
        }
        reason = "unknown CRS " + probed;
      } catch (IOException e) {
        reason = ExceptionUtils.getRootCauseMessage(e);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        reason = "interrupted";
      }
      LOGGER.warn("Unable to probe CRS of {}, assuming {}: {}", layer.name(), config.defaultCrs(), reason);
      stats.dataError("crs_" + ErrorKind.CRS_PROBE_FAILURE.stat());
      runLog.append(layer.name(), "crs probe failed, assuming " + config.defaultCrs() + ": " + reason);
    }
    return ResolvedCrs.defaultCrs(config.defaultCrs());
  }

  /**
   * Requests the layer metadata and returns the CRS code of its spatial reference.
   *
   * @throws IOException if the request fails or the metadata has no spatial reference
   */
  String probe(LayerDescriptor layer) throws IOException, InterruptedException {
    URI uri = QueryUrl.metadata(layer.url());
    var response = client.get(uri, config.httpTimeout());
    if (!response.isSuccess() || response.body() == null) {
      throw new IOException("HTTP " + response.statusCode() + " from " + uri);
    }
    return spatialReferenceCode(MAPPER.readTree(response.body()));
  }

  /**
   * Returns the CRS code of {@code spatialReference}, or {@code extent.spatialReference} when the metadata only lists
   * it on the extent.
   *
   * @throws IOException if the document is a service error or has neither
   */
  static String spatialReferenceCode(JsonNode metadata) throws IOException {
    if (metadata == null || !metadata.isObject()) {
      throw new IOException("Metadata is not a JSON object");
    }
    if (metadata.hasNonNull("error")) {
      throw new IOException("Service error: " + metadata.get("error"));
    }
    for (JsonNode candidate : new JsonNode[]{
      metadata.path("spatialReference"),
      metadata.path("extent").path("spatialReference"),
      metadata.path("sourceSpatialReference")
    }) {
      OptionalInt wkid = QueryResponseParser.wkid(candidate);
      if (wkid.isPresent()) {
        return QueryResponseParser.wkidToCode(wkid.getAsInt());
      }
    }
    throw new IOException("Metadata has no spatial reference");
  }
}

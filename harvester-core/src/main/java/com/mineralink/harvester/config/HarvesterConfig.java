package com.mineralink.harvester.config;

import com.mineralink.harvester.crs.Reprojector;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Holder for the parameters that control a harvest run, read once from {@link Arguments} at startup.
 */
public record HarvesterConfig(
  Arguments arguments,
  Path catalog,
  Path outputDir,
  Path fallbackDir,
  Path tilesDir,
  Path runLog,
  int gridRows,
  int gridColumns,
  int pageSize,
  int maxPages,
  int maxConsecutivePageFailures,
  Duration layerBudget,
  String httpUserAgent,
  Duration httpTimeout,
  int httpRetries,
  Duration httpRetryWait,
  int fetchThreads,
  int layerThreads,
  double maxRequestsPerSecond,
  String defaultCrs,
  boolean probeCrs,
  String outSr,
  boolean axisSwap,
  int minzoom,
  int maxzoom,
  String tippecanoe,
  boolean skipTiles,
  boolean publish,
  String commitMessage
) {

  public static final int MIN_MINZOOM = 0;
  public static final int MAX_MAXZOOM = 24;
  public static final int DEFAULT_GRID_DIVISIONS = 5;

  public HarvesterConfig {
    if (gridRows < 1 || gridColumns < 1) {
      throw new IllegalArgumentException("Grid must be at least 1x1, was " + gridRows + "x" + gridColumns);
    }
    if (pageSize < 1) {
      throw new IllegalArgumentException("Page size must be >= 1, was " + pageSize);
    }
    if (maxPages < 1) {
      throw new IllegalArgumentException("Max pages must be >= 1, was " + maxPages);
    }
    if (maxConsecutivePageFailures < 1) {
      throw new IllegalArgumentException(
        "Max consecutive page failures must be >= 1, was " + maxConsecutivePageFailures);
    }
    if (httpRetries < 0) {
      throw new IllegalArgumentException("HTTP Retries must be >= 0, was " + httpRetries);
    }
    if (fetchThreads < 1 || layerThreads < 1) {
      throw new IllegalArgumentException("Thread counts must be >= 1");
    }
    if (maxRequestsPerSecond < 0) {
      throw new IllegalArgumentException("Max requests per second must be >= 0, was " + maxRequestsPerSecond);
    }
    if (minzoom > maxzoom) {
      throw new IllegalArgumentException("Minzoom cannot be greater than maxzoom");
    }
    if (minzoom < MIN_MINZOOM) {
      throw new IllegalArgumentException("Minzoom must be >= " + MIN_MINZOOM + ", was " + minzoom);
    }
    if (maxzoom > MAX_MAXZOOM) {
      throw new IllegalArgumentException("Max zoom must be <= " + MAX_MAXZOOM + ", was " + maxzoom);
    }
    if (!Reprojector.isSupported(defaultCrs)) {
      throw new IllegalArgumentException("Unknown default CRS " + defaultCrs);
    }
  }

  public static HarvesterConfig defaults() {
    return from(Arguments.of());
  }

  public static HarvesterConfig from(Arguments arguments) {
    int defaultGrid = arguments.getInteger("grid", "rows and columns of the spatial chunk grid",
      DEFAULT_GRID_DIVISIONS);
    return new HarvesterConfig(
      arguments,
      arguments.file("catalog", "YAML layer catalog, defaults to the bundled catalog", null),
      arguments.file("output_dir", "directory to write one .geojson file per layer to", Path.of("data", "geojson")),
      arguments.file("fallback_dir", "directory holding <layer>.geojson fallback datasets", Path.of("fallback_data")),
      arguments.file("tiles_dir", "directory to write tiles to, one subdirectory per layer", Path.of("tiles")),
      arguments.file("run_log", "append-only file to record run events in", null),
      arguments.getInteger("grid_rows", "rows in the spatial chunk grid", defaultGrid),
      arguments.getInteger("grid_columns", "columns in the spatial chunk grid", defaultGrid),
      arguments.getInteger("page_size", "features to request per page for layers without a bbox", 1000),
      arguments.getInteger("max_pages", "maximum pages to request for one layer", 10_000),
      arguments.getInteger("max_consecutive_page_failures",
        "stop paging a layer after this many failed pages in a row", 3),
      arguments.getDuration("layer_budget", "maximum wall-clock time to spend fetching one layer", "300s"),
      arguments.getString("http_user_agent", "User-Agent header to set on map-service requests",
        "MineraLink feature harvester"),
      arguments.getDuration("http_timeout", "Timeout for each map-service request", "45s"),
      arguments.getInteger("http_retries", "Retries for each chunk or page after a transient failure", 1),
      arguments.getDuration("http_retry_wait", "How long to wait before retrying a request", "2s"),
      arguments.getInteger("fetch_threads", "parallel chunk requests per layer", 4),
      arguments.getInteger("layer_threads", "layers to harvest in parallel", 1),
      arguments.getDouble("max_requests_per_second", "limit on requests per second across layers, 0 for no limit", 0),
      arguments.getString("default_crs", "CRS assumed when a layer declares none and the probe fails", "EPSG:4326"),
      arguments.getBoolean("probe_crs", "read the spatial reference from layer metadata", true),
      arguments.getString("out_sr", "outSR query parameter, empty to leave it out", "4326"),
      arguments.getBoolean("axis_swap",
        "swap x/y once when a reprojected coordinate falls outside longitude/latitude range", false),
      arguments.getInteger("minzoom", "minimum zoom level to build tiles for", 4),
      arguments.getInteger("maxzoom", "maximum zoom level to build tiles for", 14),
      arguments.getString("tippecanoe", "tippecanoe executable", "tippecanoe"),
      arguments.getBoolean("skip_tiles", "only harvest, do not hand off to the tile generator", false),
      arguments.getBoolean("publish", "hand the tiles directory to the publisher when done", false),
      arguments.getString("commit_message", "message to publish tiles with", "Update tiles")
    );
  }

  /** Returns where the feature collection for {@code layerName} is written. */
  public Path outputFile(String layerName) {
    return outputDir.resolve(layerName + ".geojson");
  }
}

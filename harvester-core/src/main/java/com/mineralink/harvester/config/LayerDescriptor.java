package com.mineralink.harvester.config;

import com.mineralink.harvester.reader.ResponseFormat;
import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Pattern;
import org.locationtech.jts.geom.Envelope;

/**
 * One layer to harvest, as listed in the catalog.
 *
 * @param name     unique name, also used as the output file name and tile layer name
 * @param url      map-service {@code query} endpoint
 * @param bbox     area of interest in WGS84, or {@code null} to page through the whole layer instead
 * @param crs      CRS the endpoint returns coordinates in, or {@code null} to probe for it
 * @param fallback pre-built feature collection to substitute when the live harvest yields nothing
 * @param format   encoding to request features in
 * @param grid     rows and columns of the chunk grid for this layer, or 0 to use the configured default
 */
public record LayerDescriptor(
  String name,
  String url,
  Envelope bbox,
  String crs,
  Path fallback,
  ResponseFormat format,
  int grid
) {

  private static final Pattern VALID_NAME = Pattern.compile("^[A-Za-z0-9_.-]+$");

  public LayerDescriptor {
    if (name == null || !VALID_NAME.matcher(name).matches()) {
      throw new IllegalArgumentException("Invalid layer name: " + name);
    }
    if (url == null || url.isBlank()) {
      throw new IllegalArgumentException("Layer " + name + " has no url");
    }
    if (bbox != null && (bbox.isNull() || bbox.getWidth() <= 0 || bbox.getHeight() <= 0)) {
      throw new IllegalArgumentException("Layer " + name + " has an empty bbox: " + bbox);
    }
    if (grid < 0) {
      throw new IllegalArgumentException("Layer " + name + " has a negative grid size: " + grid);
    }
    if (crs != null && crs.isBlank()) {
      crs = null;
    }
    format = Objects.requireNonNullElse(format, ResponseFormat.JSON);
    // JTS envelopes are mutable
    bbox = bbox == null ? null : new Envelope(bbox);
  }

  @Override
  public Envelope bbox() {
    return bbox == null ? null : new Envelope(bbox);
  }

  /** Returns a layer with only the required fields set, paging through the whole layer in Esri JSON. */
  public static LayerDescriptor of(String name, String url) {
    return new LayerDescriptor(name, url, null, null, null, ResponseFormat.JSON, 0);
  }

  public LayerDescriptor withBbox(Envelope newBbox) {
    return new LayerDescriptor(name, url, newBbox, crs, fallback, format, grid);
  }

  public LayerDescriptor withCrs(String newCrs) {
    return new LayerDescriptor(name, url, bbox, newCrs, fallback, format, grid);
  }

  public LayerDescriptor withFallback(Path newFallback) {
    return new LayerDescriptor(name, url, bbox, crs, newFallback, format, grid);
  }

  public LayerDescriptor withFormat(ResponseFormat newFormat) {
    return new LayerDescriptor(name, url, bbox, crs, fallback, newFormat, grid);
  }

  public LayerDescriptor withGrid(int newGrid) {
    return new LayerDescriptor(name, url, bbox, crs, fallback, format, newGrid);
  }

  /** Returns true if this layer is harvested in spatial chunks, false if it is paged through. */
  public boolean hasBbox() {
    return bbox != null;
  }
}

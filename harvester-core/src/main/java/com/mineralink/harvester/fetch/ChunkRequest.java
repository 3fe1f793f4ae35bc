package com.mineralink.harvester.fetch;

import com.mineralink.harvester.util.Format;
import org.locationtech.jts.geom.Envelope;

/**
 * One sub-query against a layer: either a spatial cell of the layer's bbox or one page of results.
 *
 * @param layer    name of the layer this request belongs to
 * @param index    position of the cell in the grid, or of the page in the layer
 * @param envelope cell to query in WGS84, or {@code null} for a page request
 * @param offset   {@code resultOffset} of a page request
 * @param pageSize {@code resultRecordCount} of a page request
 * @param attempt  1 for the first try, incremented on each retry
 */
public record ChunkRequest(String layer, int index, Envelope envelope, long offset, int pageSize, int attempt) {

  public ChunkRequest {
    envelope = envelope == null ? null : new Envelope(envelope);
  }

  /** Returns the first attempt at querying {@code envelope}. */
  public static ChunkRequest spatial(String layer, int index, Envelope envelope) {
    return new ChunkRequest(layer, index, envelope, 0, 0, 1);
  }

  /** Returns the first attempt at the page of {@code pageSize} features starting at {@code offset}. */
  public static ChunkRequest page(String layer, int index, long offset, int pageSize) {
    return new ChunkRequest(layer, index, null, offset, pageSize, 1);
  }

  @Override
  public Envelope envelope() {
    return envelope == null ? null : new Envelope(envelope);
  }

  public boolean isSpatial() {
    return envelope != null;
  }

  public ChunkRequest withAttempt(int newAttempt) {
    return new ChunkRequest(layer, index, envelope, offset, pageSize, newAttempt);
  }

  /** Returns a description of the request for logs, like {@code chunk 3 [-82.8,37,-81.78,37.72]}. */
  public String describe() {
    return isSpatial() ?
      "chunk " + index + " [" + Format.envelope(envelope) + "]" :
      "page " + index + " [offset=" + offset + " count=" + pageSize + "]";
  }
}

package com.mineralink.harvester.fetch;

import java.util.ArrayList;
import java.util.List;
import org.locationtech.jts.geom.Envelope;

/**
 * Splits a layer's area of interest into a grid of smaller queries so each stays under the service's maximum record
 * count.
 */
public class ChunkPlanner {

  private ChunkPlanner() {}

  /**
   * Returns {@code rows * columns} chunk requests that exactly tile {@code bbox}.
   * <p>
   * Requests are ordered column by column, west to east, and south to north within each column. Neighboring cells share
   * their edges exactly and the outermost edges equal the edges of {@code bbox}.
   *
   * @throws IllegalArgumentException if the grid is smaller than 1x1 or {@code bbox} has no area
   */
  public static List<ChunkRequest> plan(String layer, Envelope bbox, int rows, int columns) {
    if (rows < 1 || columns < 1) {
      throw new IllegalArgumentException("Grid must be at least 1x1, was " + rows + "x" + columns);
    }
    if (bbox == null || bbox.isNull() || bbox.getWidth() <= 0 || bbox.getHeight() <= 0) {
      throw new IllegalArgumentException("Cannot split empty bbox " + bbox + " for " + layer);
    }
    List<ChunkRequest> result = new ArrayList<>(rows * columns);
    for (int i = 0; i < columns; i++) {
      double x0 = edge(bbox.getMinX(), bbox.getMaxX(), columns, i);
      double x1 = edge(bbox.getMinX(), bbox.getMaxX(), columns, i + 1);
      for (int j = 0; j < rows; j++) {
        double y0 = edge(bbox.getMinY(), bbox.getMaxY(), rows, j);
        double y1 = edge(bbox.getMinY(), bbox.getMaxY(), rows, j + 1);
        result.add(ChunkRequest.spatial(layer, result.size(), new Envelope(x0, x1, y0, y1)));
      }
    }
    return result;
  }

  /** Returns the request for page {@code index} of a layer without a bbox. */
  public static ChunkRequest page(String layer, int index, int pageSize) {
    if (index < 0 || pageSize < 1) {
      throw new IllegalArgumentException("Invalid page " + index + " of size " + pageSize);
    }
    return ChunkRequest.page(layer, index, (long) index * pageSize, pageSize);
  }

  private static double edge(double min, double max, int divisions, int k) {
    // computing the last edge would accumulate rounding error
    return k == divisions ? max : min + (max - min) / divisions * k;
  }
}

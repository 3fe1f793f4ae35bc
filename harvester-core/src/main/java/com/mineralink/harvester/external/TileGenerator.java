package com.mineralink.harvester.external;

import java.nio.file.Path;

/** Builds a tile set from a harvested feature collection. */
@FunctionalInterface
public interface TileGenerator {

  /**
   * Builds tiles for one layer.
   *
   * @param features  feature collection file to tile
   * @param layer     name to give the layer inside the tiles
   * @param minzoom   lowest zoom level to build
   * @param maxzoom   highest zoom level to build
   * @param outputDir directory to write the tiles to
   * @return true if the tiles were built
   */
  boolean generate(Path features, String layer, int minzoom, int maxzoom, Path outputDir);
}

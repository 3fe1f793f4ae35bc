package com.mineralink.harvester.external;

import java.io.IOException;
import java.nio.file.Path;
import org.slf4j.LoggerFactory;

/** Publishes a directory of generated tiles. */
@FunctionalInterface
public interface TilePublisher {

  /** A publisher that only logs what it would publish. */
  TilePublisher LOGGING = (tilesDir, commitMessage) -> LoggerFactory.getLogger(TilePublisher.class)
    .info("Tiles in {} ready to publish: \"{}\"", tilesDir, commitMessage);

  /**
   * Publishes everything under {@code tilesDir}.
   *
   * @throws IOException if publishing fails
   */
  void publish(Path tilesDir, String commitMessage) throws IOException;
}

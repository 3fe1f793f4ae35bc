package com.mineralink.harvester.external;

import com.mineralink.harvester.config.LayerDescriptor;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/** Pre-built feature collections to substitute for layers that yield nothing live. */
public interface FallbackStore {

  /** Returns the fallback feature collection for {@code layer}, if there is one. */
  Optional<Path> find(LayerDescriptor layer);

  /**
   * Returns the number of features in a fallback feature collection.
   *
   * @throws IOException if the file cannot be read
   */
  long countFeatures(Path fallback) throws IOException;
}

package com.mineralink.harvester.external;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.mineralink.harvester.config.LayerDescriptor;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Fallback feature collections kept as {@code <fallback_dir>/<layer>.geojson} files, or wherever a layer's
 * {@code fallback} points.
 */
public class DirectoryFallbackStore implements FallbackStore {

  private final Path directory;

  public DirectoryFallbackStore(Path directory) {
    this.directory = directory;
  }

  @Override
  public Optional<Path> find(LayerDescriptor layer) {
    Path path = layer.fallback() != null ? layer.fallback() : directory.resolve(layer.name() + ".geojson");
    return Files.isRegularFile(path) ? Optional.of(path) : Optional.empty();
  }

  /**
   * Counts the {@code geometry} members of objects, descending only into {@code features} arrays, so the file is never
   * held in memory.
   */
  @Override
  public long countFeatures(Path fallback) throws IOException {
    try (InputStream is = Files.newInputStream(fallback)) {
      return count(is);
    }
  }

  static long count(InputStream inputStream) throws IOException {
    long count = 0;
    try (JsonParser parser = new JsonFactory().createParser(inputStream)) {
      JsonToken token;
      while ((token = parser.nextToken()) != null) {
        if (token == JsonToken.START_ARRAY) {
          parser.skipChildren();
        } else if (token == JsonToken.FIELD_NAME) {
          String name = parser.currentName();
          parser.nextToken();
          if ("geometry".equals(name)) {
            parser.skipChildren();
            count++;
          } else if (!"features".equals(name)) {
            parser.skipChildren();
          }
        }
      }
    }
    return count;
  }
}

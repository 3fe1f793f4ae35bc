package com.mineralink.harvester.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;

/**
 * Utility for parsing YAML files into java objects using snakeyaml to handle aliases and anchors and jackson to map
 * into java model objects.
 */
public class YAML {

  private YAML() {}

  private static final Load snakeYaml = new Load(LoadSettings.builder().build());
  public static final ObjectMapper jackson = new ObjectMapper()
    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

  public static <T> T load(Path file, Class<T> clazz) {
    try (var stream = Files.newInputStream(file)) {
      return load(stream, clazz);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static <T> T load(InputStream stream, Class<T> clazz) {
    try (stream) {
      return convertValue(snakeYaml.loadFromInputStream(stream), clazz);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static <T> T load(String config, Class<T> clazz) {
    return load(new ByteArrayInputStream(config.getBytes(StandardCharsets.UTF_8)), clazz);
  }

  /**
   * Loads a YAML file bundled on the classpath.
   *
   * @throws IllegalArgumentException if there is no resource named {@code resourceName}
   */
  public static <T> T loadResource(String resourceName, Class<T> clazz) {
    InputStream stream = YAML.class.getResourceAsStream(resourceName);
    if (stream == null) {
      throw new IllegalArgumentException("No resource " + resourceName);
    }
    return load(stream, clazz);
  }

  public static <T> T convertValue(Object parsed, Class<T> clazz) {
    return jackson.convertValue(parsed, clazz);
  }
}

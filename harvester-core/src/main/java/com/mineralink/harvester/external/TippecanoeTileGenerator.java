package com.mineralink.harvester.external;

import com.mineralink.harvester.util.FileUtils;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a directory of vector tiles by running the {@code tippecanoe} command line tool.
 */
public class TippecanoeTileGenerator implements TileGenerator {

  private static final Logger LOGGER = LoggerFactory.getLogger(TippecanoeTileGenerator.class);
  private final String executable;

  public TippecanoeTileGenerator(String executable) {
    this.executable = executable;
  }

  /** Returns the command line to build tiles for {@code layer}. */
  List<String> command(Path features, String layer, int minzoom, int maxzoom, Path outputDir) {
    return List.of(
      executable,
      "--output-to-directory", outputDir.toString(),
      "--layer", layer,
      "--force",
      "--minimum-zoom=" + minzoom,
      "--maximum-zoom=" + maxzoom,
      features.toString()
    );
  }

  @Override
  public boolean generate(Path features, String layer, int minzoom, int maxzoom, Path outputDir) {
    FileUtils.createDirectory(outputDir);
    var command = command(features, layer, minzoom, maxzoom, outputDir);
    LOGGER.info("Building tiles for {}: {}", layer, String.join(" ", command));
    try {
      Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
      try (
        var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))
      ) {
        String line;
        while ((line = reader.readLine()) != null) {
          LOGGER.debug("tippecanoe: {}", line);
        }
      }
      int exitCode = process.waitFor();
      if (exitCode != 0) {
        LOGGER.warn("tippecanoe failed for {} with exit code {}", layer, exitCode);
        return false;
      }
      LOGGER.info("Built tiles for {} in {}", layer, outputDir);
      return true;
    } catch (IOException e) {
      LOGGER.warn("Unable to run {} for {}: {}", executable, layer, e.toString());
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Interrupted while building tiles for {}", layer);
      return false;
    }
  }
}

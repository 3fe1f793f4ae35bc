package com.mineralink.harvester.writer;

import com.mineralink.harvester.config.HarvesterConfig;
import com.mineralink.harvester.config.LayerDescriptor;
import com.mineralink.harvester.crs.ResolvedCrs;
import com.mineralink.harvester.fetch.LayerFetchResult;
import com.mineralink.harvester.geo.GeometryNormalizer;
import com.mineralink.harvester.geo.NormalizeResult;
import com.mineralink.harvester.geo.NormalizedFeature;
import com.mineralink.harvester.reader.QueryResponse;
import com.mineralink.harvester.reader.RawFeature;
import com.mineralink.harvester.stats.Stats;
import com.mineralink.harvester.util.FileUtils;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns everything fetched for a layer into one feature collection file under {@code output_dir}.
 * <p>
 * The file is written next to its destination and moved into place, so a reader never sees a half-written collection
 * and a failed run leaves the previous one alone. A layer with no usable features gets no file at all: any file left
 * from an earlier run is deleted and the result is {@link Result.Empty}.
 */
public class LayerAssembler {

  private static final Logger LOGGER = LoggerFactory.getLogger(LayerAssembler.class);

  private final HarvesterConfig config;
  private final Stats stats;

  public LayerAssembler(HarvesterConfig config, Stats stats) {
    this.config = config;
    this.stats = stats;
  }

  /** Normalizes the fetched features of {@code layer}, then writes them out. */
  public Result assemble(LayerDescriptor layer, ResolvedCrs crs, Instant fetchedAt, LayerFetchResult fetched)
    throws IOException {
    return write(collect(layer, crs, fetchedAt, fetched));
  }

  /** Normalizes every fetched feature and stamps the result with its provenance. */
  public FeatureCollection collect(LayerDescriptor layer, ResolvedCrs crs, Instant fetchedAt,
    LayerFetchResult fetched) {
    var normalizer = new GeometryNormalizer(layer.name(), crs, config.axisSwap(), stats);
    List<NormalizedFeature> features = new ArrayList<>();
    for (QueryResponse response : fetched.responses()) {
      String responseCrs = response.crs().orElse(null);
      for (RawFeature raw : response.features()) {
        if (normalizer.normalize(raw, responseCrs) instanceof NormalizeResult.Normalized normalized) {
          features.add(normalized.feature());
        }
      }
    }
    if (!normalizer.drops().isEmpty()) {
      LOGGER.warn("Dropped features from {}: {}", layer.name(), normalizer.drops());
    }
    ResolvedCrs sourceCrs = normalizer.sourceCrs();
    if (!sourceCrs.equals(crs)) {
      LOGGER.info("Features of {} came in {} instead of {}: {}", layer.name(), sourceCrs, crs,
        normalizer.keptBySourceCrs());
    }
    return new FeatureCollection(
      layer.name(),
      sourceCrs,
      layer.url(),
      fetchedAt,
      fetched.complete(),
      features,
      normalizer.drops(),
      new FeatureCollection.ChunkCounts(fetched.planned(), fetched.succeeded(), fetched.failed(), fetched.skipped()),
      normalizer.discardedParts(),
      normalizer.axisSwapped()
    );
  }

  /**
   * Writes {@code collection} to {@code <output_dir>/<layer>.geojson}, or deletes that file if the collection is empty.
   *
   * @throws IOException if the file cannot be written
   */
  public Result write(FeatureCollection collection) throws IOException {
    Path output = config.outputFile(collection.layer());
    if (collection.isEmpty()) {
      if (Files.exists(output)) {
        LOGGER.info("Removing {} left over from an earlier run", output);
        FileUtils.deleteFile(output);
      }
      return new Result.Empty(collection);
    }
    Path tmp = FileUtils.inProgressPath(output);
    FileUtils.createParentDirectories(output);
    try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(tmp))) {
      GeoJsonWriter.write(collection, out);
    } catch (IOException e) {
      FileUtils.deleteFile(tmp);
      throw e;
    }
    FileUtils.replace(tmp, output);
    LOGGER.info("Wrote {} features to {} ({}, complete={})", collection.size(), output,
      collection.sourceCrs(), collection.complete());
    return new Result.Written(collection, output);
  }

  /** What {@link #write(FeatureCollection)} did. */
  public sealed interface Result {

    FeatureCollection collection();

    /** The collection was written to {@code path}. */
    record Written(FeatureCollection collection, Path path) implements Result {}

    /** The collection had no features, so nothing was written. */
    record Empty(FeatureCollection collection) implements Result {}
  }
}

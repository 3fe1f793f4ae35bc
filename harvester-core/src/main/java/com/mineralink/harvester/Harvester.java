package com.mineralink.harvester;

import com.mineralink.harvester.config.Arguments;
import com.mineralink.harvester.config.HarvesterConfig;
import com.mineralink.harvester.config.LayerCatalog;
import com.mineralink.harvester.config.LayerDescriptor;
import com.mineralink.harvester.crs.CrsResolver;
import com.mineralink.harvester.crs.ResolvedCrs;
import com.mineralink.harvester.external.DirectoryFallbackStore;
import com.mineralink.harvester.external.FallbackStore;
import com.mineralink.harvester.external.TileGenerator;
import com.mineralink.harvester.external.TilePublisher;
import com.mineralink.harvester.external.TippecanoeTileGenerator;
import com.mineralink.harvester.fetch.FeatureFetcher;
import com.mineralink.harvester.fetch.LayerFetchResult;
import com.mineralink.harvester.fetch.QueryClient;
import com.mineralink.harvester.stats.Stats;
import com.mineralink.harvester.util.FileUtils;
import com.mineralink.harvester.util.Format;
import com.mineralink.harvester.util.RunLog;
import com.mineralink.harvester.worker.Worker;
import com.mineralink.harvester.writer.LayerAssembler;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * High-level API for harvesting every layer in a catalog into feature collection files and handing them off to tiling.
 * <p>
 * Each layer goes {@code PENDING -> FETCHING -> (ASSEMBLED | EMPTY) -> [FALLBACK_SUBSTITUTED] -> DONE}. A layer that
 * yields nothing live is replaced by its fallback dataset where one exists. A run only fails, with
 * {@link NoUsableDataException}, when no layer produced any output at all.
 * <p>
 * To harvest the bundled catalog with collaborators set from command-line arguments:
 *
 * <pre>{@code
 * public static void main(String[] args) throws Exception {
 *   Harvester.create(Arguments.fromArgsOrConfigFile(args)).run();
 * }
 * }</pre>
 * <p>
 * Tests and embedding code replace the network, fallback and tiling collaborators with the {@code set*} methods.
 */
public class Harvester {

  private static final Logger LOGGER = LoggerFactory.getLogger(Harvester.class);

  private final HarvesterConfig config;
  private final Stats stats;
  private final Map<String, LayerState> states = new ConcurrentHashMap<>();
  private LayerCatalog catalog;
  private QueryClient client;
  private FallbackStore fallbacks;
  private TileGenerator tileGenerator;
  private TilePublisher publisher = TilePublisher.LOGGING;
  private RunLog runLog;
  private Clock clock = Clock.systemUTC();

  private Harvester(HarvesterConfig config, Stats stats) {
    this.config = config;
    this.stats = stats;
  }

  /** Returns a new harvester configured from {@code arguments}. */
  public static Harvester create(Arguments arguments) {
    return new Harvester(HarvesterConfig.from(arguments), arguments.getStats());
  }

  public static Harvester create(HarvesterConfig config, Stats stats) {
    return new Harvester(config, stats);
  }

  /** Sets the layers to harvest instead of loading them from {@code catalog} or the bundled catalog. */
  public Harvester setCatalog(LayerCatalog catalog) {
    this.catalog = catalog;
    return this;
  }

  public Harvester setQueryClient(QueryClient client) {
    this.client = client;
    return this;
  }

  public Harvester setFallbackStore(FallbackStore fallbacks) {
    this.fallbacks = fallbacks;
    return this;
  }

  public Harvester setTileGenerator(TileGenerator tileGenerator) {
    this.tileGenerator = tileGenerator;
    return this;
  }

  public Harvester setTilePublisher(TilePublisher publisher) {
    this.publisher = publisher;
    return this;
  }

  /** Sets where run events go instead of the {@code run_log} file. The caller stays responsible for closing it. */
  public Harvester setRunLog(RunLog runLog) {
    this.runLog = runLog;
    return this;
  }

  public Harvester setClock(Clock clock) {
    this.clock = clock;
    return this;
  }

  public HarvesterConfig config() {
    return config;
  }

  public Stats stats() {
    return stats;
  }

  /** Returns the state of {@code layer}, or {@code null} if it is not part of this run. */
  public LayerState state(String layer) {
    return states.get(layer);
  }

  /**
   * Harvests every layer in the catalog, then hands each usable layer to the tile generator and the tiles directory
   * to the publisher.
   *
   * @return the outcome of each layer, in catalog order
   * @throws NoUsableDataException if no layer produced output, live or fallback
   */
  public List<HarvestSummary> run() throws NoUsableDataException {
    LayerCatalog layers = catalog != null ? catalog : LayerCatalog.load(config);
    QueryClient queryClient = client != null ? client : QueryClient.create(config);
    FallbackStore fallbackStore = fallbacks != null ? fallbacks : new DirectoryFallbackStore(config.fallbackDir());
    boolean ownRunLog = runLog == null;
    RunLog log = !ownRunLog ? runLog : config.runLog() != null ? RunLog.toFile(config.runLog()) : RunLog.NONE;
    try {
      LOGGER.info("Harvesting {} layers into {}: {}", layers.size(), config.outputDir(),
        layers.layers().stream().map(LayerDescriptor::name).toList());
      for (LayerDescriptor layer : layers) {
        states.put(layer.name(), LayerState.PENDING);
      }
      var crsResolver = new CrsResolver(config, queryClient, stats, log);
      var fetcher = new FeatureFetcher(config, queryClient, stats, log);
      var assembler = new LayerAssembler(config, stats);
      List<HarvestSummary> summaries;
      try (Worker worker = new Worker("layer", config.layerThreads())) {
        List<CompletableFuture<HarvestSummary>> futures = layers.layers().stream()
          .map(layer -> worker.submit(() -> harvestLayer(layer, crsResolver, fetcher, assembler, fallbackStore, log)))
          .toList();
        summaries = Worker.awaitAll(futures);
      }
      logSummary(summaries);
      if (summaries.stream().noneMatch(HarvestSummary::usable)) {
        log.append("*", "no layer produced usable data");
        throw new NoUsableDataException(summaries);
      }
      summaries = handOff(summaries, log);
      stats.printSummary();
      return summaries;
    } finally {
      if (ownRunLog) {
        log.close();
      }
    }
  }

  HarvestSummary harvestLayer(LayerDescriptor layer, CrsResolver crsResolver, FeatureFetcher fetcher,
    LayerAssembler assembler, FallbackStore fallbackStore, RunLog log) {
    String name = layer.name();
    var stage = stats.startStage(name);
    try {
      transition(name, LayerState.FETCHING, log);
      Optional<HarvestSummary> assembled = fetchAndAssemble(layer, crsResolver, fetcher, assembler, log);
      if (assembled.isPresent()) {
        transition(name, LayerState.ASSEMBLED, log);
        transition(name, LayerState.DONE, log);
        return assembled.get();
      }
      transition(name, LayerState.EMPTY, log);
      HarvestSummary result = substituteFallback(layer, fallbackStore, log);
      if (result.fallbackSubstituted()) {
        transition(name, LayerState.FALLBACK_SUBSTITUTED, log);
      }
      transition(name, LayerState.DONE, log);
      return result;
    } finally {
      stage.stop();
    }
  }

  private Optional<HarvestSummary> fetchAndAssemble(LayerDescriptor layer, CrsResolver crsResolver,
    FeatureFetcher fetcher, LayerAssembler assembler, RunLog log) {
    try {
      ResolvedCrs crs = crsResolver.resolve(layer);
      LOGGER.info("Fetching {} from {} (source CRS {})", layer.name(), layer.url(), crs);
      Instant fetchedAt = clock.instant();
      LayerFetchResult fetched = fetcher.fetch(layer);
      if (fetched.featureCount() == 0) {
        LOGGER.warn("No features fetched for {}", layer.name());
      }
      if (assembler.assemble(layer, crs, fetchedAt, fetched) instanceof LayerAssembler.Result.Written written) {
        return Optional.of(HarvestSummary.assembled(layer.name(), written.collection().size(),
          written.collection().complete(), written.path()));
      }
      return Optional.empty();
    } catch (IOException | RuntimeException e) {
      LOGGER.error("Harvesting {} failed, treating it as empty", layer.name(), e);
      log.append(layer.name(), "failed: " + ExceptionUtils.getRootCauseMessage(e));
      return Optional.empty();
    }
  }

  private HarvestSummary substituteFallback(LayerDescriptor layer, FallbackStore fallbackStore, RunLog log) {
    Optional<Path> fallback = fallbackStore.find(layer);
    if (fallback.isEmpty()) {
      LOGGER.warn("No fallback for {}, skipping", layer.name());
      log.append(layer.name(), "empty with no fallback");
      stats.dataError("layer_" + ErrorKind.LAYER_EMPTY.stat());
      return HarvestSummary.failed(layer.name(), ErrorKind.LAYER_EMPTY);
    }
    Path output = config.outputFile(layer.name());
    try {
      long count = fallbackStore.countFeatures(fallback.get());
      FileUtils.copyReplacing(fallback.get(), output);
      LOGGER.info("Using fallback {} for {} ({} features)", fallback.get(), layer.name(), count);
      log.append(layer.name(), "substituted fallback " + fallback.get() + " with " + count + " features");
      return HarvestSummary.fallback(layer.name(), count, output);
    } catch (IOException | UncheckedIOException e) {
      LOGGER.error("Unable to use fallback {} for {}", fallback.get(), layer.name(), e);
      log.append(layer.name(), "fallback " + fallback.get() + " unusable: " + ExceptionUtils.getRootCauseMessage(e));
      stats.dataError("layer_" + ErrorKind.LAYER_EMPTY.stat());
      return HarvestSummary.failed(layer.name(), ErrorKind.LAYER_EMPTY);
    }
  }

  private void transition(String layer, LayerState next, RunLog log) {
    states.compute(layer, (name, current) -> {
      if (current == null || !current.canTransitionTo(next)) {
        throw new IllegalStateException("Layer " + name + " cannot go from " + current + " to " + next);
      }
      return next;
    });
    LOGGER.debug("{} -> {}", layer, next);
    log.append(layer, "state " + next);
  }

  private List<HarvestSummary> handOff(List<HarvestSummary> summaries, RunLog log) {
    if (config.skipTiles()) {
      LOGGER.info("Skipping tile generation");
      return summaries;
    }
    TileGenerator tiles = tileGenerator != null ? tileGenerator : new TippecanoeTileGenerator(config.tippecanoe());
    List<HarvestSummary> result = new ArrayList<>(summaries.size());
    for (HarvestSummary summary : summaries) {
      if (summary.usable()) {
        boolean built = tiles.generate(summary.output(), summary.layer(), config.minzoom(), config.maxzoom(),
          config.tilesDir().resolve(summary.layer()));
        log.append(summary.layer(), built ? "built tiles" : "tile generation failed");
        result.add(summary.withTilesBuilt(built));
      } else {
        result.add(summary);
      }
    }
    List<String> built = result.stream().filter(HarvestSummary::tilesBuilt).map(HarvestSummary::layer).toList();
    LOGGER.info("Tiles generated for: {}", built);
    if (config.publish() && !built.isEmpty()) {
      try {
        publisher.publish(config.tilesDir(), config.commitMessage());
        log.append("*", "published " + config.tilesDir());
      } catch (IOException e) {
        LOGGER.error("Publishing {} failed", config.tilesDir(), e);
        log.append("*", "publishing failed: " + ExceptionUtils.getRootCauseMessage(e));
      }
    }
    return result;
  }

  private static void logSummary(List<HarvestSummary> summaries) {
    int width = summaries.stream().mapToInt(s -> s.layer().length()).max().orElse(0);
    LOGGER.info("Harvest summary:");
    for (HarvestSummary summary : summaries) {
      String outcome;
      if (summary.fallbackSubstituted()) {
        outcome = summary.featureCount() + " features from fallback";
      } else if (summary.usable()) {
        outcome = summary.featureCount() + " features" + (summary.complete() ? "" : " (incomplete)");
      } else {
        outcome = "FAILED " + summary.error();
      }
      LOGGER.info("\t{} {}", Format.padRight(summary.layer(), width), outcome);
    }
  }
}

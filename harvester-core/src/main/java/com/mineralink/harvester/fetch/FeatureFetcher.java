package com.mineralink.harvester.fetch;

import com.mineralink.harvester.ErrorKind;
import com.mineralink.harvester.config.HarvesterConfig;
import com.mineralink.harvester.config.LayerDescriptor;
import com.mineralink.harvester.reader.QueryResponse;
import com.mineralink.harvester.reader.QueryResponseParser;
import com.mineralink.harvester.stats.Stats;
import com.mineralink.harvester.util.RunLog;
import com.mineralink.harvester.worker.Worker;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.LongSupplier;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches every feature of a layer from its map-service {@code query} endpoint.
 * <p>
 * A layer with a bbox is split into a grid of spatial chunks by {@link ChunkPlanner} and the chunks are fetched in
 * parallel. A layer without one is paged through sequentially with {@code resultOffset}. Either way:
 * <ul>
 * <li>network failures and server errors are retried up to {@code http_retries} times, other failures are not</li>
 * <li>a chunk that still fails is recorded and the rest of the layer continues without it</li>
 * <li>no request is started or retried once the layer has used up its {@code layer_budget}</li>
 * </ul>
 */
public class FeatureFetcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(FeatureFetcher.class);

  private final HarvesterConfig config;
  private final QueryClient client;
  private final Stats stats;
  private final RunLog runLog;
  private final LongSupplier nanoTime;

  public FeatureFetcher(HarvesterConfig config, QueryClient client, Stats stats, RunLog runLog) {
    this(config, client, stats, runLog, System::nanoTime);
  }

  FeatureFetcher(HarvesterConfig config, QueryClient client, Stats stats, RunLog runLog, LongSupplier nanoTime) {
    this.config = config;
    this.client = client;
    this.stats = stats;
    this.runLog = runLog;
    this.nanoTime = nanoTime;
  }

  /** Fetches all chunks or pages of {@code layer}, never throwing for a failed request. */
  public LayerFetchResult fetch(LayerDescriptor layer) {
    Deadline deadline = new Deadline(nanoTime.getAsLong() + config.layerBudget().toNanos());
    LayerFetchResult result = layer.hasBbox() ? fetchChunks(layer, deadline) : fetchPages(layer, deadline);
    LOGGER.info("Fetched {} features for {} ({}/{} requests succeeded, {} failed, {} skipped{})",
      result.featureCount(), layer.name(), result.succeeded(), result.planned(), result.failed(), result.skipped(),
      result.truncated() ? ", stopped paging early" : "");
    return result;
  }

  private LayerFetchResult fetchChunks(LayerDescriptor layer, Deadline deadline) {
    int rows = layer.grid() > 0 ? layer.grid() : config.gridRows();
    int columns = layer.grid() > 0 ? layer.grid() : config.gridColumns();
    List<ChunkRequest> chunks = ChunkPlanner.plan(layer.name(), layer.bbox(), rows, columns);
    LOGGER.debug("Fetching {} in {} chunks", layer.name(), chunks.size());
    try (Worker worker = new Worker("fetch-" + layer.name(), config.fetchThreads())) {
      List<CompletableFuture<ChunkOutcome>> futures = chunks.stream()
        .map(chunk -> worker.submit(() -> fetchWithRetries(layer, chunk, deadline)))
        .toList();
      return new LayerFetchResult(layer.name(), Worker.awaitAll(futures), false);
    }
  }

  private LayerFetchResult fetchPages(LayerDescriptor layer, Deadline deadline) {
    List<ChunkOutcome> outcomes = new ArrayList<>();
    int consecutiveFailures = 0;
    for (int page = 0; ; page++) {
      if (page >= config.maxPages()) {
        LOGGER.warn("Stopped paging {} after {} pages", layer.name(), page);
        runLog.append(layer.name(), "stopped after max_pages=" + config.maxPages());
        return new LayerFetchResult(layer.name(), outcomes, true);
      }
      ChunkOutcome outcome = fetchWithRetries(layer, ChunkPlanner.page(layer.name(), page, config.pageSize()), deadline);
      outcomes.add(outcome);
      if (outcome.isSuccess()) {
        consecutiveFailures = 0;
        if (outcome.featureCount() == 0) {
          // past the last feature
          return new LayerFetchResult(layer.name(), outcomes, false);
        }
      } else if (outcome.error() == ErrorKind.BUDGET_EXCEEDED || outcome.error() == ErrorKind.MALFORMED_RESPONSE) {
        return new LayerFetchResult(layer.name(), outcomes, false);
      } else if (++consecutiveFailures >= config.maxConsecutivePageFailures()) {
        LOGGER.warn("Stopped paging {} after {} failed pages in a row", layer.name(), consecutiveFailures);
        runLog.append(layer.name(), "stopped paging after " + consecutiveFailures + " failed pages in a row");
        return new LayerFetchResult(layer.name(), outcomes, false);
      }
    }
  }

  ChunkOutcome fetchWithRetries(LayerDescriptor layer, ChunkRequest chunk, Deadline deadline) {
    ChunkRequest request = chunk;
    for (int attempt = 1; ; attempt++) {
      request = chunk.withAttempt(attempt);
      if (deadline.passed()) {
        LOGGER.warn("Layer budget of {} used up, not starting {} attempt {}", config.layerBudget(),
          request.describe(), attempt);
        stats.dataError("fetch_" + ErrorKind.BUDGET_EXCEEDED.stat());
        runLog.append(layer.name(), request.describe() + " attempt " + attempt + " skipped: layer budget used up");
        return ChunkOutcome.skipped(request);
      }
      try {
        QueryResponse response = request(layer, request);
        if (response.exceededTransferLimit()) {
          LOGGER.warn("{} hit the service's record limit at {} features, use a finer grid to get the rest",
            request.describe(), response.size());
          stats.dataError("fetch_transfer_limit");
        }
        if (!response.isEmpty()) {
          LOGGER.info("  +{} features ({})", response.size(), request.describe());
        }
        return ChunkOutcome.succeeded(request, response);
      } catch (FetchException e) {
        boolean retry = e.isRetryable() && attempt <= config.httpRetries();
        LOGGER.warn("{} attempt {} failed with {}{}: {}", request.describe(), attempt, e.kind(),
          retry ? ", retrying" : "", e.getMessage());
        stats.dataError("fetch_" + e.kind().stat());
        runLog.append(layer.name(), request.describe() + " attempt " + attempt + " failed: " + e.kind() + " " +
          e.getMessage());
        if (!retry) {
          return ChunkOutcome.failed(request, e.kind());
        }
        try {
          retrySleep(config.httpRetryWait());
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          return ChunkOutcome.failed(request, e.kind());
        }
      }
    }
  }

  private QueryResponse request(LayerDescriptor layer, ChunkRequest chunk) throws FetchException {
    URI uri = QueryUrl.forChunk(layer, chunk, config.outSr());
    LOGGER.trace("GET {}", uri);
    QueryClient.Response response;
    try {
      response = client.get(uri, config.httpTimeout());
    } catch (IOException e) {
      throw new FetchException(ErrorKind.NETWORK_ERROR, ExceptionUtils.getRootCauseMessage(e), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new FetchException(ErrorKind.NETWORK_ERROR, "Interrupted", e);
    }
    int status = response.statusCode();
    if (status == 429 || status >= 500) {
      throw new FetchException(ErrorKind.SERVER_ERROR, "HTTP " + status);
    } else if (status >= 400) {
      throw new FetchException(ErrorKind.CLIENT_ERROR, "HTTP " + status);
    } else if (!response.isSuccess()) {
      throw new FetchException(ErrorKind.MALFORMED_RESPONSE, "Unexpected HTTP " + status);
    }
    return QueryResponseParser.parse(response.body(), layer.format());
  }

  void retrySleep(Duration wait) throws InterruptedException {
    Thread.sleep(wait.toMillis());
  }

  /** The point in time after which no new request for a layer may start. */
  final class Deadline {

    private final long nanos;

    private Deadline(long nanos) {
      this.nanos = nanos;
    }

    boolean passed() {
      return nanoTime.getAsLong() - nanos > 0;
    }
  }
}

package com.mineralink.harvester.stats;

import com.mineralink.harvester.util.LayerLogContext;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects counters and timings over a harvest run to report once it finishes.
 * <p>
 * Data errors are the observable side of everything the harvester absorbs instead of failing: dropped features, failed
 * chunks, probe fallbacks. Each is counted under a code like {@code normalize_geometry_decode} or
 * {@code fetch_server}.
 */
public interface Stats extends AutoCloseable {

  /** Returns a new stat collector that stores stats in-memory to report through {@link #printSummary()}. */
  static Stats inMemory() {
    return new InMemory();
  }

  /** Logs the time spent in each stage and the count of every data error recorded during the run. */
  default void printSummary() {
    Logger logger = LoggerFactory.getLogger(getClass());
    logger.info("-".repeat(40));
    timers().printSummary();
    var errors = dataErrors();
    if (!errors.isEmpty()) {
      logger.info("-".repeat(40));
      errors.forEach((code, count) -> logger.info("\t{}\t{}", code, count));
    }
    logger.info("-".repeat(40));
  }

  /**
   * Records that a long-running task with {@code name} has started and returns a handle to call when finished.
   * <p>
   * Stages are per layer, so this also tags the logs of the calling thread with {@code name} until it finishes.
   */
  default Timers.Finishable startStage(String name) {
    LayerLogContext.enter(name);
    var timer = timers().startTimer(name);
    return () -> {
      timer.stop();
      LayerLogContext.exit();
    };
  }

  /** Returns the timers for all stages started with {@link #startStage(String)}. */
  Timers timers();

  /** Records that an input was discarded where {@code errorCode} identifies the kind of failure. */
  void dataError(String errorCode);

  /** Returns the number of times each data error code has been recorded so far. */
  Map<String, Long> dataErrors();

  @Override
  default void close() {}

  /** A stat collector that stores everything in memory. */
  class InMemory implements Stats {

    /** use {@link #inMemory()} */
    private InMemory() {}

    private final Timers timers = new Timers();
    private final ConcurrentMap<String, Counter> dataErrors = new ConcurrentHashMap<>();

    @Override
    public Timers timers() {
      return timers;
    }

    @Override
    public void dataError(String errorCode) {
      dataErrors.computeIfAbsent(errorCode, code -> new Counter()).inc();
    }

    @Override
    public Map<String, Long> dataErrors() {
      Map<String, Long> result = new TreeMap<>();
      dataErrors.forEach((code, counter) -> result.put(code, counter.get()));
      return result;
    }
  }
}

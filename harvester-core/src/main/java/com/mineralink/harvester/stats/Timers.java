package com.mineralink.harvester.stats;

import com.google.common.base.Stopwatch;
import com.mineralink.harvester.util.Format;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.concurrent.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A registry of stages that are being timed, one per layer plus the hand-off steps.
 */
@ThreadSafe
public class Timers {

  private static final Logger LOGGER = LoggerFactory.getLogger(Timers.class);
  private static final Format FORMAT = Format.defaultInstance();
  private final Map<String, Stopwatch> timers = Collections.synchronizedMap(new LinkedHashMap<>());

  public void printSummary() {
    var all = all();
    int maxLength = (int) all.keySet().stream().mapToLong(String::length).max().orElse(0);
    for (var entry : all.entrySet()) {
      LOGGER.info("\t{} {}", Format.padRight(entry.getKey(), maxLength), FORMAT.duration(entry.getValue()));
    }
  }

  public Finishable startTimer(String name) {
    Stopwatch stopwatch = Stopwatch.createStarted();
    timers.put(name, stopwatch);
    LOGGER.debug("Starting {}", name);
    return () -> {
      stopwatch.stop();
      LOGGER.debug("Finished {} in {}", name, FORMAT.duration(stopwatch.elapsed()));
    };
  }

  /** Returns a snapshot of the elapsed time of every timer started so far. */
  public Map<String, Duration> all() {
    Map<String, Duration> result = new LinkedHashMap<>();
    synchronized (timers) {
      timers.forEach((name, stopwatch) -> result.put(name, stopwatch.elapsed()));
    }
    return result;
  }

  /** A handle that callers can use to indicate a task has finished. */
  public interface Finishable {

    void stop();
  }
}

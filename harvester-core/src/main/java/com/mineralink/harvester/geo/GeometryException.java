package com.mineralink.harvester.geo;

import com.mineralink.harvester.ErrorKind;
import com.mineralink.harvester.stats.Stats;
import java.util.ArrayList;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An error caused by an unexpected input geometry that should drop the feature instead of halting the harvest, since
 * map services in the wild are sure to return some.
 */
public class GeometryException extends Exception {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeometryException.class);

  private final ErrorKind kind;
  private final String stat;
  private final ArrayList<Supplier<String>> detailsSuppliers = new ArrayList<>();

  /**
   * Constructs a new exception with a detailed error message caused by {@code cause}.
   *
   * @param kind    whether the geometry could not be decoded or could not be reprojected
   * @param stat    string that uniquely defines this error that will be used to count number of occurrences in stats
   * @param message description of the error to log that should be detailed enough that you can find the offending
   *                feature from it
   * @param cause   the original exception that was thrown
   */
  public GeometryException(ErrorKind kind, String stat, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.stat = stat;
  }

  /** Constructs a new exception with a detailed error message. */
  public GeometryException(ErrorKind kind, String stat, String message) {
    super(message);
    this.kind = kind;
    this.stat = stat;
  }

  public GeometryException addDetails(Supplier<String> detailsSupplier) {
    this.detailsSuppliers.add(detailsSupplier);
    return this;
  }

  /** Returns whether the geometry failed to decode or to reproject. */
  public ErrorKind kind() {
    return kind;
  }

  /** Returns the unique code for this error condition to use for counting the number of occurrences in stats. */
  public String stat() {
    return stat;
  }

  /** Increments a stat counter for this error and logs it. */
  public void log(Stats stats, String statPrefix, String logPrefix) {
    stats.dataError(statPrefix + "_" + stat());
    log(logPrefix);
  }

  /** Prints the error but does not increment any stats. */
  public void log(String logContext) {
    StringBuilder log = new StringBuilder(logContext + ": " + getMessage());
    for (var details : detailsSuppliers) {
      log.append("\n").append(details.get());
    }
    logMessage(log.toString());
  }

  void logMessage(String log) {
    LOGGER.warn(log);
  }

  /**
   * An error that we expect to encounter often so should only be logged at {@code TRACE} level.
   */
  public static class Verbose extends GeometryException {

    public Verbose(ErrorKind kind, String stat, String message, Throwable cause) {
      super(kind, stat, message, cause);
    }

    public Verbose(ErrorKind kind, String stat, String message) {
      super(kind, stat, message);
    }

    @Override
    void logMessage(String log) {
      LOGGER.trace(log);
    }
  }
}

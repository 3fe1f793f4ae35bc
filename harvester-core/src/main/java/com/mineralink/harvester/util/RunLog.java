package com.mineralink.harvester.util;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Append-only record of run events: layer state changes, failed requests, fallback substitutions.
 * <p>
 * Every layer and fetch thread writes to the same run log, so implementations must be thread safe.
 */
@ThreadSafe
public interface RunLog extends Closeable {

  /** A run log that discards everything. */
  RunLog NONE = (layer, message) -> {
  };

  /** Appends one event about {@code layer}. */
  void append(String layer, String message);

  @Override
  default void close() {}

  /**
   * Returns a run log that appends lines of {@code timestamp<TAB>layer<TAB>message} to {@code path}.
   *
   * @throws UncheckedIOException if the file cannot be opened for writing
   */
  static RunLog toFile(Path path) {
    return toFile(path, Clock.systemUTC());
  }

  static RunLog toFile(Path path, Clock clock) {
    FileUtils.createParentDirectories(path);
    try {
      return new FileRunLog(Files.newBufferedWriter(path, StandardCharsets.UTF_8, StandardOpenOption.CREATE,
        StandardOpenOption.APPEND), clock);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to open run log " + path, e);
    }
  }

  /** Writes whole lines under a lock so events from concurrent layers never interleave. */
  class FileRunLog implements RunLog {

    private final ReentrantLock lock = new ReentrantLock();
    private final BufferedWriter writer;
    private final Clock clock;

    private FileRunLog(BufferedWriter writer, Clock clock) {
      this.writer = writer;
      this.clock = clock;
    }

    @Override
    public void append(String layer, String message) {
      String line = clock.instant() + "\t" + layer + "\t" + message.replace('\n', ' ');
      lock.lock();
      try {
        writer.write(line);
        writer.newLine();
        writer.flush();
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      } finally {
        lock.unlock();
      }
    }

    @Override
    public void close() {
      lock.lock();
      try {
        writer.close();
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      } finally {
        lock.unlock();
      }
    }
  }
}

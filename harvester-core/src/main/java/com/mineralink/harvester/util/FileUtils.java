package com.mineralink.harvester.util;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Convenience methods for working with the per-layer output files on disk.
 */
public class FileUtils {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileUtils.class);

  private FileUtils() {}

  /** Deletes a file if it exists or fails silently if it doesn't. */
  public static void deleteFile(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.error("Unable to delete " + path, e);
    }
  }

  /**
   * Ensures all parent directories of each path in {@code paths} exist.
   *
   * @throws IllegalStateException if an error occurs
   */
  public static void createParentDirectories(Path... paths) {
    for (var path : paths) {
      try {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
          Files.createDirectories(parent);
        }
      } catch (IOException e) {
        throw new IllegalStateException("Unable to create parent directories " + path, e);
      }
    }
  }

  /**
   * Ensures a directory and all parent directories exists.
   *
   * @throws IllegalStateException if an error occurs
   */
  public static void createDirectory(Path path) {
    try {
      Files.createDirectories(path);
    } catch (IOException e) {
      throw new IllegalStateException("Unable to create directories " + path, e);
    }
  }

  /** Returns a sibling of {@code output} to write to before moving it into place. */
  public static Path inProgressPath(Path output) {
    return output.resolveSibling(output.getFileName() + "_inprogress");
  }

  /**
   * Replaces {@code to} with {@code from}, atomically where the file system supports it.
   *
   * @throws UncheckedIOException if an error occurs
   */
  public static void replace(Path from, Path to) {
    try {
      try {
        Files.move(from, to, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /**
   * Copies {@code from} over {@code to} through an in-progress sibling file so readers never observe a partial copy.
   *
   * @throws UncheckedIOException if an error occurs
   */
  public static void copyReplacing(Path from, Path to) {
    Path tmp = inProgressPath(to);
    createParentDirectories(to);
    try {
      Files.copy(from, tmp, StandardCopyOption.REPLACE_EXISTING);
      replace(tmp, to);
    } catch (IOException e) {
      deleteFile(tmp);
      throw new UncheckedIOException(e);
    }
  }
}

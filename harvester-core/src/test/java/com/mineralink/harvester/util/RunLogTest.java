package com.mineralink.harvester.util;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RunLogTest {

  @TempDir
  Path tmpDir;

  private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

  @Test
  void testAppendsLines() throws IOException {
    Path path = tmpDir.resolve("logs").resolve("run.log");
    try (var log = RunLog.toFile(path, clock)) {
      log.append("wells", "state FETCHING");
      log.append("wells", "chunk 3 failed:\nSERVER_ERROR");
    }
    try (var log = RunLog.toFile(path, clock)) {
      log.append("*", "no layer produced usable data");
    }
    assertEquals(List.of(
      "2024-05-01T12:00:00Z\twells\tstate FETCHING",
      "2024-05-01T12:00:00Z\twells\tchunk 3 failed: SERVER_ERROR",
      "2024-05-01T12:00:00Z\t*\tno layer produced usable data"
    ), Files.readAllLines(path));
  }

  @Test
  void testConcurrentAppendsDoNotInterleave() throws IOException {
    Path path = tmpDir.resolve("run.log");
    try (var log = RunLog.toFile(path, clock)) {
      IntStream.range(0, 200).parallel().forEach(i -> log.append("layer" + (i % 4), "event " + i));
    }
    List<String> lines = Files.readAllLines(path);
    assertEquals(200, lines.size());
    for (String line : lines) {
      assertTrue(line.matches("^2024-05-01T12:00:00Z\tlayer\\d\tevent \\d+$"), line);
    }
  }

  @Test
  void testNoneDiscards() {
    RunLog.NONE.append("wells", "ignored");
    RunLog.NONE.close();
  }
}

package com.mineralink.harvester.config;

import static org.junit.jupiter.api.Assertions.*;

import com.mineralink.harvester.TestUtils;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ArgumentsTest {

  @Test
  void testEmpty() {
    assertEquals("fallback", Arguments.of().getString("key", "key", "fallback"));
  }

  @Test
  void testMapBased() {
    assertEquals("value", Arguments.of(
      "key", "value"
    ).getString("key", "key", "fallback"));
  }

  @Test
  void testOrElse() {
    Arguments args = Arguments.of("key1", "value1a", "key2", "value2a")
      .orElse(Arguments.of("key2", "value2b", "key3", "value3b"));

    assertEquals("value1a", args.getString("key1", "key", "fallback"));
    assertEquals("value2a", args.getString("key2", "key", "fallback"));
    assertEquals("value3b", args.getString("key3", "key", "fallback"));
    assertEquals("fallback", args.getString("key4", "key", "fallback"));
  }

  @Test
  void testConfigFileParsing() {
    Arguments args = Arguments.fromConfigFile(TestUtils.pathToResource("test.properties"));

    assertEquals("value1fromfile", args.getString("key1", "key", "fallback"));
    assertEquals("fallback", args.getString("key3", "key", "fallback"));
  }

  @Test
  void testGetConfigFileFromArgs() {
    Arguments args = Arguments.fromArgsOrConfigFile(
      "config=" + TestUtils.pathToResource("test.properties"),
      "key2=value2fromargs"
    );

    assertEquals("value1fromfile", args.getString("key1", "key", "fallback"));
    assertEquals("value2fromargs", args.getString("key2", "key", "fallback"));
    assertEquals("fallback", args.getString("key3", "key", "fallback"));
  }

  @Test
  void testDuration() {
    Arguments args = Arguments.of(
      "layer_budget", "5m"
    );

    assertEquals(Duration.ofMinutes(5), args.getDuration("layer_budget", "key", "300s"));
    assertEquals(Duration.ofSeconds(45), args.getDuration("http_timeout", "key", "45s"));
  }

  @Test
  void testIntegerAndDouble() {
    Arguments args = Arguments.of(
      "grid", "3",
      "max_requests_per_second", "2.5"
    );

    assertEquals(3, args.getInteger("grid", "key", 5));
    assertEquals(5, args.getInteger("grid2", "key", 5));
    assertEquals(2.5, args.getDouble("max_requests_per_second", "key", 0));
    assertEquals(0, args.getDouble("other", "key", 0));
  }

  @Test
  void testBoolean() {
    assertTrue(Arguments.of("boolean", "true").getBoolean("boolean", "list", false));
    assertFalse(Arguments.of("boolean", "false").getBoolean("boolean", "list", true));
    assertFalse(Arguments.of("boolean", "true1").getBoolean("boolean", "list", true));
    assertFalse(Arguments.of().getBoolean("boolean", "list", false));
  }

  @Test
  void testStats() {
    assertNotNull(Arguments.of().getStats());
  }

  @Test
  void testArgsKeyPresentImplies() {
    Arguments args = Arguments.fromArgs(
      "--skip-tiles"
    );

    assertTrue(args.getBoolean("skip_tiles", "skip", false));
  }

  @Test
  void testUnderscoreDashSame() {
    assertTrue(Arguments.fromArgs(
      "--probe-crs=true"
    ).getBoolean("probe_crs", "probe", false));
    assertTrue(Arguments.fromArgs(
      "--probe_crs=true"
    ).getBoolean("probe-crs", "probe", false));
  }

  @Test
  void testSpaceBetweenArgs() {
    Arguments args = Arguments.fromArgs(
      "--output_dir out --grid 3 --publish --skip_tiles".split("\\s+")
    );

    assertEquals("out", args.getString("output_dir", "key", null));
    assertEquals(3, args.getInteger("grid", "key", 5));
    assertTrue(args.getBoolean("publish", "publish", false));
    assertTrue(args.getBoolean("skip_tiles", "skip", false));
  }

  @Test
  void testConfigFileKeysAreNormalized() {
    Arguments args = Arguments.fromConfigFile(TestUtils.pathToResource("test.properties"));
    assertEquals("value1fromfile", args.getString("KEY1", "key", "fallback"));
    assertEquals("value2fromfile", args.getString("key-2|key2", "key", "fallback"));
  }

  @Test
  void testEnvironmentVariables() {
    Map<String, String> env = Map.of(
      "OTHER", "value",
      "HARVESTEROTHER", "VALUE",
      "HARVESTER_KEY1", "value1",
      "HARVESTER_HTTP_TIMEOUT", "10s"
    );
    Arguments args = Arguments.fromEnvironment(env::get, env::keySet);
    assertEquals("value1", args.getString("key1", "key", "fallback"));
    assertEquals(Duration.ofSeconds(10), args.getDuration("http_timeout", "timeout", "45s"));
    assertEquals("fallback", args.getString("other", "key", "fallback"));
    assertEquals("fallback", args.getString("harvesterother", "key", "fallback"));
  }

  @Test
  void testJvmProperties() {
    Map<String, String> jvm = Map.of(
      "OTHER", "value",
      "HARVESTER_KEY1", "value1",
      "harvester.key3", "value4",
      "harvester.fetch_threads", "6",
      "harvester.page.size", "10",
      "Harvester.Out-Sr", "3857"
    );
    Arguments args = Arguments.fromJvmProperties(jvm::get, jvm::keySet);
    assertEquals("value4", args.getString("key3", "key", "fallback"));
    assertEquals(6, args.getInteger("fetch_threads", "threads", 4));
    assertEquals(10, args.getInteger("page_size", "page size", 1000));
    assertEquals("3857", args.getString("out_sr", "out sr", "4326"));
    assertEquals("fallback", args.getString("key1", "key", "fallback"));
    assertEquals("fallback", args.getString("other", "key", "fallback"));
  }

  @Test
  void testCommandLineBeatsJvmPropertiesBeatsEnvironment() {
    Map<String, String> env = Map.of("HARVESTER_GRID", "2", "HARVESTER_FETCH_THREADS", "8", "HARVESTER_PAGE_SIZE", "10");
    Map<String, String> jvm = Map.of("harvester.grid", "3", "harvester.fetch_threads", "6");
    Arguments args = Arguments.fromArgs("grid=4")
      .orElse(Arguments.fromJvmProperties(jvm::get, jvm::keySet))
      .orElse(Arguments.fromEnvironment(env::get, env::keySet));

    assertEquals(4, args.getInteger("grid", "grid", 5));
    assertEquals(6, args.getInteger("fetch_threads", "threads", 4));
    assertEquals(10, args.getInteger("page_size", "page size", 1000));
  }

  @Test
  void testDeprecatedArgs() {
    assertEquals("newvalue",
      Arguments.of("oldkey", "oldvalue", "newkey", "newvalue")
        .getString("newkey|oldkey", "key", "fallback"));
    assertEquals("oldvalue",
      Arguments.of("oldkey", "oldvalue")
        .getString("newkey|oldkey", "key", "fallback"));
    assertEquals("fallback",
      Arguments.of()
        .getString("newkey|oldkey", "key", "fallback"));
  }
}

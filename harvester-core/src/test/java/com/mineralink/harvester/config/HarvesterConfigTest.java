package com.mineralink.harvester.config;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class HarvesterConfigTest {

  @Test
  void testDefaults() {
    var config = HarvesterConfig.defaults();
    assertEquals(5, config.gridRows());
    assertEquals(5, config.gridColumns());
    assertEquals(Duration.ofSeconds(300), config.layerBudget());
    assertEquals(Duration.ofSeconds(45), config.httpTimeout());
    assertEquals(1, config.httpRetries());
    assertEquals(1000, config.pageSize());
    assertEquals("EPSG:4326", config.defaultCrs());
    assertEquals("4326", config.outSr());
    assertFalse(config.axisSwap());
    assertEquals(4, config.minzoom());
    assertEquals(14, config.maxzoom());
    assertNull(config.catalog());
    assertNull(config.runLog());
  }

  @Test
  void testGridSetsRowsAndColumns() {
    var config = HarvesterConfig.from(Arguments.of("grid", "3"));
    assertEquals(3, config.gridRows());
    assertEquals(3, config.gridColumns());

    config = HarvesterConfig.from(Arguments.of("grid", "3", "grid_columns", "7"));
    assertEquals(3, config.gridRows());
    assertEquals(7, config.gridColumns());
  }

  @Test
  void testOutputFile() {
    var config = HarvesterConfig.from(Arguments.of("output_dir", "out"));
    assertEquals(Path.of("out", "WV_wells.geojson"), config.outputFile("WV_wells"));
  }

  @ParameterizedTest
  @CsvSource({
    "grid, 0",
    "page_size, 0",
    "max_pages, 0",
    "max_consecutive_page_failures, 0",
    "http_retries, -1",
    "fetch_threads, 0",
    "layer_threads, 0",
    "max_requests_per_second, -1",
    "minzoom, -1",
    "maxzoom, 25",
    "minzoom, 15",
    "default_crs, EPSG:999999",
    "default_crs, not-a-crs",
  })
  void testRejectsInvalid(String key, String value) {
    var arguments = Arguments.of(key, value);
    assertThrows(IllegalArgumentException.class, () -> HarvesterConfig.from(arguments));
  }
}

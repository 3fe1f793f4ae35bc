package com.mineralink.harvester.external;

import static org.junit.jupiter.api.Assertions.*;

import com.mineralink.harvester.TestUtils;
import com.mineralink.harvester.config.LayerDescriptor;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DirectoryFallbackStoreTest {

  @TempDir
  Path tmpDir;

  private static long count(String json) throws IOException {
    return DirectoryFallbackStore.count(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void testFindsFileNamedAfterLayer() throws IOException {
    var store = new DirectoryFallbackStore(tmpDir);
    var layer = LayerDescriptor.of("wells", "https://example.com/query");
    assertEquals(Optional.empty(), store.find(layer));

    Path file = TestUtils.writeGeoJsonPoints(tmpDir.resolve("wells.geojson"), 50);
    assertEquals(Optional.of(file), store.find(layer));
    assertEquals(50, store.countFeatures(file));
  }

  @Test
  void testLayerFallbackTakesPrecedence() throws IOException {
    var store = new DirectoryFallbackStore(tmpDir);
    TestUtils.writeGeoJsonPoints(tmpDir.resolve("wells.geojson"), 1);
    Path custom = TestUtils.writeGeoJsonPoints(tmpDir.resolve("custom").resolve("old-wells.geojson"), 2);
    var layer = LayerDescriptor.of("wells", "https://example.com/query").withFallback(custom);
    assertEquals(Optional.of(custom), store.find(layer));

    var missing = layer.withFallback(tmpDir.resolve("missing.geojson"));
    assertEquals(Optional.empty(), store.find(missing));
  }

  @Test
  void testDirectoryIsNotAFallback() throws IOException {
    Files.createDirectories(tmpDir.resolve("wells.geojson"));
    assertEquals(Optional.empty(),
      new DirectoryFallbackStore(tmpDir).find(LayerDescriptor.of("wells", "https://example.com/query")));
  }

  @Test
  void testCountIgnoresNestedGeometryMembers() throws IOException {
    assertEquals(2, count("""
      {
        "type": "FeatureCollection",
        "harvest": {"geometry": {"type": "Point"}},
        "bbox": [[0, 0], [1, 1]],
        "features": [
          {"type": "Feature", "properties": {"geometry": "not this one"}, "geometry": {"type": "Point", "coordinates": [1, 2]}},
          {"type": "Feature", "geometry": null, "properties": {"nested": [{"geometry": 1}]}}
        ]
      }
      """));
    assertEquals(0, count("{\"type\":\"FeatureCollection\",\"features\":[]}"));
  }
}

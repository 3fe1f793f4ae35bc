package com.mineralink.harvester.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mineralink.harvester.reader.ResponseFormat;
import com.mineralink.harvester.util.YAML;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The fixed list of layers a run harvests, loaded once at startup from YAML.
 * <p>
 * For example:
 * <pre>{@code
 * layers:
 * - name: WV_wells
 *   url: https://tagis.dep.wv.gov/arcgis/rest/services/WVDEP_enterprise/oil_gas/MapServer/0/query
 *   bbox: [-82.8, 37.0, -77.7, 40.6]
 *   crs: EPSG:4326    # optional, probed from layer metadata when missing
 *   fallback: fallback_data/WV_wells.geojson # optional
 *   format: json      # or geojson
 *   grid: 5           # optional chunk grid override
 * }</pre>
 */
public final class LayerCatalog implements Iterable<LayerDescriptor> {

  private static final Logger LOGGER = LoggerFactory.getLogger(LayerCatalog.class);
  public static final String DEFAULT_CATALOG_RESOURCE = "/default-catalog.yml";

  private final List<LayerDescriptor> layers;

  private LayerCatalog(List<LayerDescriptor> layers) {
    Set<String> names = new HashSet<>();
    for (var layer : layers) {
      if (!names.add(layer.name())) {
        throw new IllegalArgumentException("Duplicate layer name in catalog: " + layer.name());
      }
    }
    this.layers = List.copyOf(layers);
  }

  public static LayerCatalog of(List<LayerDescriptor> layers) {
    return new LayerCatalog(layers);
  }

  /**
   * Returns the catalog from the {@code catalog} file in {@code config}, or the bundled default catalog when none is
   * set.
   */
  public static LayerCatalog load(HarvesterConfig config) {
    if (config.catalog() != null) {
      LOGGER.info("Loading layer catalog from {}", config.catalog());
      return from(YAML.load(config.catalog(), CatalogFile.class), config);
    }
    LOGGER.info("Loading bundled layer catalog");
    return from(YAML.loadResource(DEFAULT_CATALOG_RESOURCE, CatalogFile.class), config);
  }

  /** Parses a catalog from YAML text, resolving default fallback paths against {@code config}. */
  public static LayerCatalog parse(String yaml, HarvesterConfig config) {
    return from(YAML.load(yaml, CatalogFile.class), config);
  }

  private static LayerCatalog from(CatalogFile file, HarvesterConfig config) {
    if (file == null || file.layers == null || file.layers.isEmpty()) {
      throw new IllegalArgumentException("Layer catalog has no layers");
    }
    List<LayerDescriptor> result = new ArrayList<>();
    for (var entry : file.layers) {
      result.add(entry.toDescriptor(config.fallbackDir()));
    }
    return new LayerCatalog(result);
  }

  public List<LayerDescriptor> layers() {
    return layers;
  }

  public int size() {
    return layers.size();
  }

  @Override
  public Iterator<LayerDescriptor> iterator() {
    return layers.iterator();
  }

  private record CatalogFile(@JsonProperty("layers") List<Entry> layers) {}

  private record Entry(
    @JsonProperty("name") String name,
    @JsonProperty("url") String url,
    @JsonProperty("bbox") List<Double> bbox,
    @JsonProperty("crs") String crs,
    @JsonProperty("fallback") String fallback,
    @JsonProperty("format") String format,
    @JsonProperty("grid") Integer grid
  ) {

    LayerDescriptor toDescriptor(Path fallbackDir) {
      Envelope envelope = null;
      if (bbox != null) {
        if (bbox.size() != 4) {
          throw new IllegalArgumentException("Layer " + name + " bbox must have 4 coordinates, got: " + bbox);
        }
        envelope = new Envelope(bbox.get(0), bbox.get(2), bbox.get(1), bbox.get(3));
      }
      Path fallbackPath = fallback != null ? Path.of(fallback) : fallbackDir.resolve(name + ".geojson");
      return new LayerDescriptor(name, url, envelope, crs, fallbackPath, ResponseFormat.from(format),
        grid == null ? 0 : grid);
    }
  }
}

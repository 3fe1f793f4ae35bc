package com.mineralink.harvester.writer;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mineralink.harvester.geo.NormalizedFeature;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

/**
 * Streams a {@link FeatureCollection} out as a GeoJSON {@code FeatureCollection}, with its provenance under a
 * top-level {@code harvest} member.
 */
public class GeoJsonWriter {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private GeoJsonWriter() {}

  public static void write(FeatureCollection collection, OutputStream out) throws IOException {
    try (JsonGenerator gen = MAPPER.getFactory().createGenerator(out, JsonEncoding.UTF8)) {
      gen.writeStartObject();
      gen.writeStringField("type", "FeatureCollection");
      writeProvenance(collection, gen);
      gen.writeArrayFieldStart("features");
      for (NormalizedFeature feature : collection.features()) {
        writeFeature(feature, gen);
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
  }

  private static void writeProvenance(FeatureCollection collection, JsonGenerator gen) throws IOException {
    gen.writeObjectFieldStart("harvest");
    gen.writeStringField("layer", collection.layer());
    gen.writeStringField("endpoint", collection.endpoint());
    gen.writeStringField("source_crs", collection.sourceCrs().code());
    gen.writeStringField("crs_source", collection.sourceCrs().source().name().toLowerCase(Locale.ROOT));
    gen.writeStringField("fetched_at", collection.fetchedAt().toString());
    gen.writeBooleanField("complete", collection.complete());
    gen.writeNumberField("feature_count", collection.size());
    var chunks = collection.chunks();
    gen.writeObjectFieldStart("chunks");
    gen.writeNumberField("planned", chunks.planned());
    gen.writeNumberField("succeeded", chunks.succeeded());
    gen.writeNumberField("failed", chunks.failed());
    gen.writeNumberField("skipped", chunks.skipped());
    gen.writeEndObject();
    gen.writeObjectFieldStart("dropped");
    Map<String, Long> dropped = new TreeMap<>();
    collection.dropped().forEach((kind, count) -> dropped.put(kind.stat(), count));
    for (var entry : dropped.entrySet()) {
      gen.writeNumberField(entry.getKey(), entry.getValue());
    }
    gen.writeEndObject();
    gen.writeNumberField("discarded_parts", collection.discardedParts());
    gen.writeNumberField("axis_swapped", collection.axisSwapped());
    gen.writeEndObject();
  }

  private static void writeFeature(NormalizedFeature feature, JsonGenerator gen) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("type", "Feature");
    gen.writeObjectFieldStart("geometry");
    gen.writeStringField("type", feature.type().geoJsonType());
    gen.writeFieldName("coordinates");
    switch (feature.type()) {
      case POINT -> writePosition(((Point) feature.geometry()).getCoordinateSequence(), 0, gen);
      case LINE -> writePositions(((LineString) feature.geometry()).getCoordinateSequence(), gen);
      case POLYGON -> {
        gen.writeStartArray();
        writePositions(((Polygon) feature.geometry()).getExteriorRing().getCoordinateSequence(), gen);
        gen.writeEndArray();
      }
    }
    gen.writeEndObject();
    gen.writeObjectFieldStart("properties");
    for (var entry : feature.attributes().entrySet()) {
      gen.writeObjectField(entry.getKey(), entry.getValue());
    }
    gen.writeEndObject();
    gen.writeEndObject();
  }

  private static void writePositions(CoordinateSequence coordinates, JsonGenerator gen) throws IOException {
    gen.writeStartArray();
    for (int i = 0; i < coordinates.size(); i++) {
      writePosition(coordinates, i, gen);
    }
    gen.writeEndArray();
  }

  private static void writePosition(CoordinateSequence coordinates, int i, JsonGenerator gen) throws IOException {
    gen.writeStartArray();
    gen.writeNumber(coordinates.getX(i));
    gen.writeNumber(coordinates.getY(i));
    gen.writeEndArray();
  }
}

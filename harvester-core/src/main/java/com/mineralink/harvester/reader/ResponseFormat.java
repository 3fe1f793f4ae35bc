package com.mineralink.harvester.reader;

import java.util.Locale;

/** Encoding a map-service query is asked to respond with through its {@code f} parameter. */
public enum ResponseFormat {
  /** Esri JSON: geometries as {@code x/y}, {@code paths} or {@code rings}, attributes under {@code attributes}. */
  JSON("json"),
  /** GeoJSON: RFC 7946 geometries, attributes under {@code properties}. */
  GEOJSON("geojson");

  private final String id;

  ResponseFormat(String id) {
    this.id = id;
  }

  /** Returns the value of the {@code f} query parameter. */
  public String id() {
    return id;
  }

  /**
   * Returns the format matching {@code id} case-insensitively, or {@link #JSON} when {@code id} is null.
   *
   * @throws IllegalArgumentException if {@code id} is not a known format
   */
  public static ResponseFormat from(String id) {
    if (id == null) {
      return JSON;
    }
    for (var format : values()) {
      if (format.id.equals(id.strip().toLowerCase(Locale.ROOT))) {
        return format;
      }
    }
    throw new IllegalArgumentException("Unknown response format: " + id);
  }
}

package com.mineralink.harvester.crs;

import java.util.Locale;

/**
 * The coordinate system a layer's raw coordinates are expressed in, and how it was determined.
 *
 * @param code   {@code EPSG:<id>} code
 * @param source which rule of the resolution policy produced it
 */
public record ResolvedCrs(String code, Source source) {

  public ResolvedCrs {
    code = Reprojector.canonical(code);
  }

  public static ResolvedCrs declared(String code) {
    return new ResolvedCrs(code, Source.DECLARED);
  }

  public static ResolvedCrs probed(String code) {
    return new ResolvedCrs(code, Source.PROBED);
  }

  public static ResolvedCrs defaultCrs(String code) {
    return new ResolvedCrs(code, Source.DEFAULT);
  }

  public static ResolvedCrs fromResponse(String code) {
    return new ResolvedCrs(code, Source.RESPONSE);
  }

  @Override
  public String toString() {
    return code + " (" + source.name().toLowerCase(Locale.ROOT) + ")";
  }

  /** Rules of the resolution policy, in priority order. */
  public enum Source {
    /** Set on the layer descriptor. */
    DECLARED,
    /** Read from the spatial reference in the layer's metadata. */
    PROBED,
    /** Neither of the above worked, so the configured default was assumed. */
    DEFAULT,
    /** Reported by the {@code spatialReference} of a query response. */
    RESPONSE
  }
}

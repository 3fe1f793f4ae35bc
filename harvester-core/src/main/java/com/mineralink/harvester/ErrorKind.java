package com.mineralink.harvester;

/**
 * Classification of everything that can go wrong while harvesting, from a single feature up to the whole run.
 * <p>
 * Feature and chunk level kinds are absorbed where they happen and only show up in counters and logs, layer level kinds
 * trigger fallback substitution, and {@link #NO_USABLE_DATA} is the only one that fails the run.
 */
public enum ErrorKind {
  /** Connection failure or timeout. */
  NETWORK_ERROR("network", true),
  /** HTTP 5xx, 429, or an error body with a 5xx code. */
  SERVER_ERROR("server", true),
  /** HTTP 4xx, or an error body with a 4xx code. */
  CLIENT_ERROR("client", false),
  /** Response body is not JSON or has no {@code features} array. */
  MALFORMED_RESPONSE("malformed_response", false),
  /** The layer budget ran out before the request could be started. */
  BUDGET_EXCEEDED("budget_exceeded", false),
  /** Geometry encoding did not match a point, path or ring shape. */
  GEOMETRY_DECODE_ERROR("geometry_decode", false),
  /** Coordinate transform threw or produced coordinates outside of longitude/latitude range. */
  REPROJECTION_ERROR("reprojection", false),
  /** Layer metadata could not be fetched or had no usable spatial reference. */
  CRS_PROBE_FAILURE("crs_probe", false),
  /** The layer produced no features. */
  LAYER_EMPTY("layer_empty", false),
  /** No layer produced usable output, live or fallback. */
  NO_USABLE_DATA("no_usable_data", false);

  private final String stat;
  private final boolean retryable;

  ErrorKind(String stat, boolean retryable) {
    this.stat = stat;
    this.retryable = retryable;
  }

  /** Returns the short name used for this kind in stats counters. */
  public String stat() {
    return stat;
  }

  /** Returns true if a request that failed this way is worth trying again. */
  public boolean isRetryable() {
    return retryable;
  }
}

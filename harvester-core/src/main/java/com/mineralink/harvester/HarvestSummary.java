package com.mineralink.harvester;

import java.nio.file.Path;

/**
 * How one layer turned out.
 *
 * @param layer               layer name
 * @param state               final state, {@link LayerState#DONE} once the run finishes
 * @param featureCount        features in the layer's output file, live or fallback
 * @param complete            true if the live harvest fetched every planned chunk or page
 * @param fallbackSubstituted true if the output is the layer's fallback dataset
 * @param error               why the layer produced nothing, or {@code null} if it produced output
 * @param output              the layer's feature collection file, or {@code null} if it produced nothing
 * @param tilesBuilt          true if tiles were built from the output
 */
public record HarvestSummary(
  String layer,
  LayerState state,
  long featureCount,
  boolean complete,
  boolean fallbackSubstituted,
  ErrorKind error,
  Path output,
  boolean tilesBuilt
) {

  public static HarvestSummary assembled(String layer, long featureCount, boolean complete, Path output) {
    return new HarvestSummary(layer, LayerState.DONE, featureCount, complete, false, null, output, false);
  }

  public static HarvestSummary fallback(String layer, long featureCount, Path output) {
    return new HarvestSummary(layer, LayerState.DONE, featureCount, false, true, null, output, false);
  }

  public static HarvestSummary failed(String layer, ErrorKind error) {
    return new HarvestSummary(layer, LayerState.DONE, 0, false, false, error, null, false);
  }

  /** Returns true if the layer has an output file to hand off to tiling. */
  public boolean usable() {
    return output != null;
  }

  public HarvestSummary withTilesBuilt(boolean built) {
    return new HarvestSummary(layer, state, featureCount, complete, fallbackSubstituted, error, output, built);
  }
}

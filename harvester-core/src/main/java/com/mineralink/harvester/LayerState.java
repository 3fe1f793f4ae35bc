package com.mineralink.harvester;

/**
 * Where a layer is in its harvest.
 * <p>
 * {@code PENDING -> FETCHING -> (ASSEMBLED | EMPTY) -> [FALLBACK_SUBSTITUTED] -> DONE}
 */
public enum LayerState {
  PENDING,
  FETCHING,
  /** Live features were written to the layer's output file. */
  ASSEMBLED,
  /** The live harvest produced no usable features. */
  EMPTY,
  /** The layer's fallback dataset was copied into its output file. */
  FALLBACK_SUBSTITUTED,
  DONE;

  /** Returns true if a layer in this state may move to {@code next}. */
  public boolean canTransitionTo(LayerState next) {
    return switch (this) {
      case PENDING -> next == FETCHING;
      case FETCHING -> next == ASSEMBLED || next == EMPTY;
      case ASSEMBLED, FALLBACK_SUBSTITUTED -> next == DONE;
      case EMPTY -> next == FALLBACK_SUBSTITUTED || next == DONE;
      case DONE -> false;
    };
  }
}

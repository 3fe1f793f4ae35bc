package com.mineralink.harvester;

import java.util.List;

/** Thrown when every layer in a run failed, live and fallback, so there is nothing to hand off. */
public class NoUsableDataException extends Exception {

  private final transient List<HarvestSummary> summaries;

  public NoUsableDataException(List<HarvestSummary> summaries) {
    super("No layer produced usable data: " + summaries.stream().map(HarvestSummary::layer).toList());
    this.summaries = List.copyOf(summaries);
  }

  /** Returns the outcome of every layer in the run. */
  public List<HarvestSummary> summaries() {
    return summaries;
  }

  public ErrorKind kind() {
    return ErrorKind.NO_USABLE_DATA;
  }
}

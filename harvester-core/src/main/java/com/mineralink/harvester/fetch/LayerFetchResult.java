package com.mineralink.harvester.fetch;

import com.mineralink.harvester.reader.QueryResponse;
import java.util.List;
import java.util.Optional;

/**
 * Everything fetched for one layer.
 *
 * @param layer     layer name
 * @param outcomes  one outcome per planned chunk or requested page, in plan order
 * @param truncated true if paging stopped before the service ran out of features
 */
public record LayerFetchResult(String layer, List<ChunkOutcome> outcomes, boolean truncated) {

  public LayerFetchResult {
    outcomes = List.copyOf(outcomes);
  }

  /** Returns the successful responses in plan order. */
  public List<QueryResponse> responses() {
    return outcomes.stream().map(ChunkOutcome::response).flatMap(Optional::stream).toList();
  }

  /**
   * Returns true if every planned chunk or page was fetched: nothing was skipped for lack of budget and nothing was
   * abandoned after exhausting its retries.
   */
  public boolean complete() {
    return !truncated && outcomes.stream().allMatch(ChunkOutcome::isSuccess);
  }

  public boolean budgetExceeded() {
    return outcomes.stream().anyMatch(ChunkOutcome::isSkipped);
  }

  public long featureCount() {
    return outcomes.stream().mapToLong(ChunkOutcome::featureCount).sum();
  }

  public int planned() {
    return outcomes.size();
  }

  public int succeeded() {
    return (int) outcomes.stream().filter(ChunkOutcome::isSuccess).count();
  }

  public int failed() {
    return (int) outcomes.stream().filter(ChunkOutcome::isFailure).count();
  }

  public int skipped() {
    return (int) outcomes.stream().filter(ChunkOutcome::isSkipped).count();
  }
}

package com.mineralink.harvester.fetch;

import com.mineralink.harvester.ErrorKind;
import com.mineralink.harvester.reader.QueryResponse;
import java.util.Optional;

/**
 * How one chunk or page ended up after all of its attempts.
 *
 * @param request  the last attempt made, or the first attempt that was never started
 * @param response features returned, empty unless the request succeeded
 * @param error    why the request was abandoned, {@code null} on success
 */
public record ChunkOutcome(ChunkRequest request, Optional<QueryResponse> response, ErrorKind error) {

  public static ChunkOutcome succeeded(ChunkRequest request, QueryResponse response) {
    return new ChunkOutcome(request, Optional.of(response), null);
  }

  public static ChunkOutcome failed(ChunkRequest request, ErrorKind error) {
    return new ChunkOutcome(request, Optional.empty(), error);
  }

  /** Returns an outcome for a request the layer budget did not leave time to start. */
  public static ChunkOutcome skipped(ChunkRequest request) {
    return failed(request, ErrorKind.BUDGET_EXCEEDED);
  }

  public boolean isSuccess() {
    return error == null;
  }

  public boolean isSkipped() {
    return error == ErrorKind.BUDGET_EXCEEDED;
  }

  public boolean isFailure() {
    return error != null && !isSkipped();
  }

  public int featureCount() {
    return response.map(QueryResponse::size).orElse(0);
  }
}

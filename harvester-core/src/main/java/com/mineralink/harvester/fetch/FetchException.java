package com.mineralink.harvester.fetch;

import com.mineralink.harvester.ErrorKind;

/**
 * A request for one chunk or page that did not produce usable features.
 * <p>
 * The {@link ErrorKind} decides whether the request is worth retrying.
 */
public class FetchException extends Exception {

  private final ErrorKind kind;

  public FetchException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public FetchException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind kind() {
    return kind;
  }

  public boolean isRetryable() {
    return kind.isRetryable();
  }
}

package io.changefeed.resilience;

import io.changefeed.ChangeFeedException;

/**
 * Raised when an operation does not complete within its time limit.
 */
public final class OperationTimeoutException extends ChangeFeedException {

  public OperationTimeoutException(String message) {
    super(message);
  }
}

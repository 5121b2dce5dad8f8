package io.changefeed;

/**
 * Root of the unchecked exceptions raised by changefeed.
 */
public class ChangeFeedException extends RuntimeException {

  public ChangeFeedException(String message) {
    super(message);
  }

  public ChangeFeedException(String message, Throwable cause) {
    super(message, cause);
  }
}

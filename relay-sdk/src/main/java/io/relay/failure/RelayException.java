package io.relay.failure;

/**
 * Base class for all exceptions thrown by Relay SDK.
 *
 * <p>Do not extend by the application code.
 */
public class RelayException extends RuntimeException {
  protected RelayException(String message, Throwable cause) {
    super(message, cause, false, true);
  }
}

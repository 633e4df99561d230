package io.relay.failure;

import io.temporal.api.failure.v1.Failure;
import javax.annotation.Nullable;

/**
 * Exceptions originated at the service.
 *
 * <p><b>This exception is expected to be thrown only by the Relay framework code.</b>
 */
public final class ServerFailure extends RelayFailure {
  private final boolean nonRetryable;

  public ServerFailure(String message, boolean nonRetryable) {
    this(message, nonRetryable, null);
  }

  public ServerFailure(String message, boolean nonRetryable, @Nullable Throwable cause) {
    this(message, nonRetryable, cause, null);
  }

  ServerFailure(
      String message, boolean nonRetryable, @Nullable Throwable cause, @Nullable Failure failure) {
    super(message, message, cause, failure);
    this.nonRetryable = nonRetryable;
  }

  public boolean isNonRetryable() {
    return nonRetryable;
  }
}

package io.relay.failure;

import io.temporal.api.failure.v1.Failure;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Failure received from the service with a failure info this SDK version doesn't know about. Only
 * the message and the raw {@link #getFailure() failure} are available.
 *
 * <p><b>This exception is expected to be thrown only by the Relay framework code.</b>
 */
public final class UnrecognizedFailure extends RelayFailure {

  UnrecognizedFailure(String message, @Nullable Throwable cause, Failure failure) {
    super(message, message, cause, Objects.requireNonNull(failure));
  }
}

package io.relay.failure;

import io.relay.common.converter.EncodedValues;
import io.relay.common.converter.Values;
import io.temporal.api.failure.v1.Failure;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Forced termination of a workflow execution.
 *
 * <p>The wire format has no slot for termination details, so {@link #getDetails()} is always empty
 * for a failure received from the service.
 *
 * <p><b>This exception is expected to be thrown only by the Relay framework code.</b>
 */
public final class TerminatedFailure extends RelayFailure {
  private final Values details;

  public TerminatedFailure(String message, Object... details) {
    this(message, new EncodedValues(details), null, null);
  }

  TerminatedFailure(
      String message, Values details, @Nullable Throwable cause, @Nullable Failure failure) {
    super(message, message, cause, failure);
    this.details = Objects.requireNonNull(details);
  }

  public Values getDetails() {
    return details;
  }
}

package io.relay.failure;

import io.temporal.api.failure.v1.Failure;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Represents failures that can cross workflow and activity boundaries.
 *
 * <p>Only exceptions that extend this class fail a workflow execution by default. Any other
 * exception thrown from workflow code fails the current workflow task, which is then retried.
 *
 * <p><b>Don't throw any subtype of this class except {@link ApplicationFailure}.</b> The other
 * subtypes are created by the SDK when a failure is received from the service.
 *
 * <p>Instances are immutable. A failure deserialized from the wire keeps the original {@link
 * Failure} so that it is re-emitted unchanged if workflow code rethrows it.
 */
public abstract class RelayFailure extends RelayException {
  private final String originalMessage;
  private final @Nullable Failure failure;

  RelayFailure(
      String message,
      @Nullable String originalMessage,
      @Nullable Throwable cause,
      @Nullable Failure failure) {
    super(message, cause);
    this.originalMessage = originalMessage == null ? "" : originalMessage;
    this.failure = failure;
  }

  /** Message without any decoration added to {@link #getMessage()}. */
  public String getOriginalMessage() {
    return originalMessage;
  }

  /** The wire failure this instance was created from, empty if it was created by user code. */
  public Optional<Failure> getFailure() {
    return Optional.ofNullable(failure);
  }
}

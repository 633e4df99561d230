package io.relay.failure;

import io.relay.common.converter.EncodedValues;
import io.relay.common.converter.Values;
import io.temporal.api.failure.v1.Failure;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Cooperative cancellation of a workflow or activity.
 *
 * <p>Use {@link FailureClassifier#isCancellation(Throwable)} to check for a cancellation instead
 * of an {@code instanceof} check, as cancellations also arrive wrapped in an {@link
 * ActivityFailure} or a {@link ChildWorkflowFailure}.
 */
public final class CanceledFailure extends RelayFailure {
  static final String DEFAULT_MESSAGE = "Cancelled";

  private final Values details;

  public CanceledFailure() {
    this(DEFAULT_MESSAGE);
  }

  public CanceledFailure(String message, Object... details) {
    this(message, new EncodedValues(details), null);
  }

  public CanceledFailure(String message, @Nonnull Values details, @Nullable Throwable cause) {
    this(message, details, cause, null);
  }

  CanceledFailure(
      String message, Values details, @Nullable Throwable cause, @Nullable Failure failure) {
    super(message, message, cause, failure);
    this.details = Objects.requireNonNull(details);
  }

  public Values getDetails() {
    return details;
  }
}

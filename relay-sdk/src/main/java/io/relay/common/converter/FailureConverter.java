package io.relay.common.converter;

import io.relay.failure.DefaultFailureConverter;
import io.relay.failure.RelayFailure;
import io.temporal.api.failure.v1.Failure;
import javax.annotation.Nonnull;

/**
 * Maps between wire {@link Failure} chains and exception chains. {@link DefaultFailureConverter}
 * is the implementation other SDKs can read; replacing it is rarely needed.
 */
public interface FailureConverter {

  /**
   * Builds the exception chain of {@code failure}, outermost first. Must accept any well-formed
   * failure, including failure info kinds added to the wire format after this code was written.
   *
   * @param dataConverter decodes {@code encoded_attributes} and the details of the failure info on
   *     demand
   * @throws NullPointerException if an argument is null
   */
  @Nonnull
  RuntimeException failureToException(
      @Nonnull Failure failure, @Nonnull DataConverter dataConverter);

  /**
   * Builds the wire form of {@code throwable} and its causes. A {@link RelayFailure} that was
   * itself built from a wire failure is expected to map back to exactly that failure.
   *
   * @param dataConverter encodes details and, when enabled, the common attributes
   * @throws NullPointerException if an argument is null
   */
  @Nonnull
  Failure exceptionToFailure(@Nonnull Throwable throwable, @Nonnull DataConverter dataConverter);
}

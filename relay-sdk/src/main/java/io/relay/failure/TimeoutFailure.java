package io.relay.failure;

import com.google.common.base.Strings;
import io.relay.common.converter.EncodedValues;
import io.relay.common.converter.Values;
import io.temporal.api.failure.v1.Failure;
import java.util.Objects;
import javax.annotation.Nullable;

/** <b>This exception is expected to be thrown only by the Relay framework code.</b> */
public final class TimeoutFailure extends RelayFailure {
  private final Values lastHeartbeatDetails;
  private final @Nullable TimeoutType timeoutType;

  /**
   * @param lastHeartbeatDetails details of the last heartbeat, only meaningful for a {@link
   *     TimeoutType#HEARTBEAT} timeout
   */
  public TimeoutFailure(
      String message, @Nullable TimeoutType timeoutType, Object... lastHeartbeatDetails) {
    this(message, new EncodedValues(lastHeartbeatDetails), timeoutType, null, null);
  }

  TimeoutFailure(
      String message,
      Values lastHeartbeatDetails,
      @Nullable TimeoutType timeoutType,
      @Nullable Throwable cause,
      @Nullable Failure failure) {
    super(getMessage(message, timeoutType), message, cause, failure);
    this.lastHeartbeatDetails = Objects.requireNonNull(lastHeartbeatDetails);
    this.timeoutType = timeoutType;
  }

  public Values getLastHeartbeatDetails() {
    return lastHeartbeatDetails;
  }

  /** Null if the timeout type is unknown to this version of the SDK. */
  @Nullable
  public TimeoutType getTimeoutType() {
    return timeoutType;
  }

  public static String getMessage(@Nullable String message, @Nullable TimeoutType timeoutType) {
    return (Strings.isNullOrEmpty(message) ? "" : "message='" + message + "', ")
        + "timeoutType="
        + timeoutType;
  }
}

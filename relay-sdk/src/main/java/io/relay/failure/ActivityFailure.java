package io.relay.failure;

import io.temporal.api.failure.v1.Failure;
import javax.annotation.Nullable;

/**
 * Contains information about an activity failure. Always contains the original reason for the
 * failure as its cause. For example if an activity timed out the cause is {@link TimeoutFailure}.
 *
 * <p><b>This exception is expected to be thrown only by the Relay framework code.</b>
 */
public final class ActivityFailure extends RelayFailure {

  private final long scheduledEventId;
  private final long startedEventId;
  private final String activityType;
  private final String activityId;
  private final String identity;
  private final @Nullable RetryState retryState;

  public ActivityFailure(
      String message,
      long scheduledEventId,
      long startedEventId,
      String activityType,
      String activityId,
      String identity,
      @Nullable RetryState retryState,
      @Nullable Throwable cause) {
    this(
        message,
        scheduledEventId,
        startedEventId,
        activityType,
        activityId,
        identity,
        retryState,
        cause,
        null);
  }

  ActivityFailure(
      String message,
      long scheduledEventId,
      long startedEventId,
      String activityType,
      String activityId,
      String identity,
      @Nullable RetryState retryState,
      @Nullable Throwable cause,
      @Nullable Failure failure) {
    super(
        getMessage(
            message,
            scheduledEventId,
            startedEventId,
            activityType,
            activityId,
            retryState,
            identity),
        message,
        cause,
        failure);
    this.scheduledEventId = scheduledEventId;
    this.startedEventId = startedEventId;
    this.activityType = activityType;
    this.activityId = activityId;
    this.identity = identity;
    this.retryState = retryState;
  }

  public long getScheduledEventId() {
    return scheduledEventId;
  }

  public long getStartedEventId() {
    return startedEventId;
  }

  public String getActivityType() {
    return activityType;
  }

  public String getActivityId() {
    return activityId;
  }

  public String getIdentity() {
    return identity;
  }

  @Nullable
  public RetryState getRetryState() {
    return retryState;
  }

  public static String getMessage(
      String originalMessage,
      long scheduledEventId,
      long startedEventId,
      String activityType,
      String activityId,
      @Nullable RetryState retryState,
      String identity) {
    return "Activity with activityType='"
        + activityType
        + "' failed: '"
        + originalMessage
        + "'. "
        + "scheduledEventId="
        + scheduledEventId
        + (startedEventId == -1 ? "" : ", startedEventId=" + startedEventId)
        + (activityId == null ? "" : ", activityId=" + activityId)
        + ", identity='"
        + identity
        + "', retryState="
        + retryState;
  }
}

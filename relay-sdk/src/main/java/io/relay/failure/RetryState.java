package io.relay.failure;

import javax.annotation.Nullable;

/**
 * Retry state of an activity or child workflow at the time it failed, as reported by the service.
 *
 * <p>Codes are part of the wire format and match {@link io.temporal.api.enums.v1.RetryState}.
 * Never renumber them.
 */
public enum RetryState {
  IN_PROGRESS(1),
  NON_RETRYABLE_FAILURE(2),
  TIMEOUT(3),
  MAXIMUM_ATTEMPTS_REACHED(4),
  RETRY_POLICY_NOT_SET(5),
  INTERNAL_SERVER_ERROR(6),
  CANCEL_REQUESTED(7);

  private final int code;

  RetryState(int code) {
    this.code = code;
  }

  public int getCode() {
    return code;
  }

  /**
   * @return the retry state with the given wire code, or null for the unspecified code and for
   *     codes unknown to this version
   */
  @Nullable
  public static RetryState fromCode(int code) {
    for (RetryState state : values()) {
      if (state.code == code) {
        return state;
      }
    }
    return null;
  }

  @Nullable
  public static RetryState fromProto(@Nullable io.temporal.api.enums.v1.RetryState proto) {
    if (proto == null || proto == io.temporal.api.enums.v1.RetryState.UNRECOGNIZED) {
      return null;
    }
    return fromCode(proto.getNumber());
  }

  public io.temporal.api.enums.v1.RetryState toProto() {
    return io.temporal.api.enums.v1.RetryState.forNumber(code);
  }

  /** Wire code of {@code state}, or the unspecified code 0 if it's null. */
  public static int toProtoValue(@Nullable RetryState state) {
    return state == null ? 0 : state.code;
  }
}

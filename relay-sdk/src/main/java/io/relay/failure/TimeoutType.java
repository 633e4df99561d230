package io.relay.failure;

import javax.annotation.Nullable;

/**
 * Type of timeout reported by a {@link TimeoutFailure}.
 *
 * <p>Codes are part of the wire format and match {@link io.temporal.api.enums.v1.TimeoutType}.
 * Never renumber them.
 */
public enum TimeoutType {
  START_TO_CLOSE(1),
  SCHEDULE_TO_START(2),
  SCHEDULE_TO_CLOSE(3),
  HEARTBEAT(4);

  private final int code;

  TimeoutType(int code) {
    this.code = code;
  }

  public int getCode() {
    return code;
  }

  /**
   * @return the timeout type with the given wire code, or null for the unspecified code and for
   *     codes unknown to this version
   */
  @Nullable
  public static TimeoutType fromCode(int code) {
    for (TimeoutType type : values()) {
      if (type.code == code) {
        return type;
      }
    }
    return null;
  }

  @Nullable
  public static TimeoutType fromProto(@Nullable io.temporal.api.enums.v1.TimeoutType proto) {
    if (proto == null || proto == io.temporal.api.enums.v1.TimeoutType.UNRECOGNIZED) {
      return null;
    }
    return fromCode(proto.getNumber());
  }

  public io.temporal.api.enums.v1.TimeoutType toProto() {
    return io.temporal.api.enums.v1.TimeoutType.forNumber(code);
  }

  /** Wire code of {@code type}, or the unspecified code 0 if it's null. */
  public static int toProtoValue(@Nullable TimeoutType type) {
    return type == null ? 0 : type.code;
  }
}

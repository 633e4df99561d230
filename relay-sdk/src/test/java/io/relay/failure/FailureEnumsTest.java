package io.relay.failure;

import static org.junit.Assert.*;

import org.junit.Test;

public class FailureEnumsTest {

  @Test
  public void timeoutTypeCodes() {
    assertEquals(1, TimeoutType.START_TO_CLOSE.getCode());
    assertEquals(2, TimeoutType.SCHEDULE_TO_START.getCode());
    assertEquals(3, TimeoutType.SCHEDULE_TO_CLOSE.getCode());
    assertEquals(4, TimeoutType.HEARTBEAT.getCode());
  }

  @Test
  public void timeoutTypeMatchesWireEnum() {
    assertEquals(
        io.temporal.api.enums.v1.TimeoutType.TIMEOUT_TYPE_START_TO_CLOSE,
        TimeoutType.START_TO_CLOSE.toProto());
    assertEquals(
        io.temporal.api.enums.v1.TimeoutType.TIMEOUT_TYPE_HEARTBEAT,
        TimeoutType.HEARTBEAT.toProto());
    for (TimeoutType type : TimeoutType.values()) {
      assertEquals(type.getCode(), type.toProto().getNumber());
      assertSame(type, TimeoutType.fromProto(type.toProto()));
      assertSame(type, TimeoutType.fromCode(type.getCode()));
    }
  }

  @Test
  public void unknownTimeoutTypes() {
    assertNull(TimeoutType.fromCode(0));
    assertNull(TimeoutType.fromCode(42));
    assertNull(TimeoutType.fromCode(-1));
    assertNull(TimeoutType.fromProto(io.temporal.api.enums.v1.TimeoutType.UNRECOGNIZED));
    assertNull(
        TimeoutType.fromProto(io.temporal.api.enums.v1.TimeoutType.TIMEOUT_TYPE_UNSPECIFIED));
    assertNull(TimeoutType.fromProto(null));
    assertEquals(0, TimeoutType.toProtoValue(null));
  }

  @Test
  public void retryStateCodes() {
    assertEquals(1, RetryState.IN_PROGRESS.getCode());
    assertEquals(2, RetryState.NON_RETRYABLE_FAILURE.getCode());
    assertEquals(3, RetryState.TIMEOUT.getCode());
    assertEquals(4, RetryState.MAXIMUM_ATTEMPTS_REACHED.getCode());
    assertEquals(5, RetryState.RETRY_POLICY_NOT_SET.getCode());
    assertEquals(6, RetryState.INTERNAL_SERVER_ERROR.getCode());
    assertEquals(7, RetryState.CANCEL_REQUESTED.getCode());
  }

  @Test
  public void retryStateMatchesWireEnum() {
    assertEquals(
        io.temporal.api.enums.v1.RetryState.RETRY_STATE_CANCEL_REQUESTED,
        RetryState.CANCEL_REQUESTED.toProto());
    for (RetryState state : RetryState.values()) {
      assertEquals(state.getCode(), state.toProto().getNumber());
      assertSame(state, RetryState.fromProto(state.toProto()));
      assertEquals(state.getCode(), RetryState.toProtoValue(state));
    }
  }

  @Test
  public void unknownRetryStates() {
    assertNull(RetryState.fromCode(0));
    assertNull(RetryState.fromCode(99));
    assertNull(RetryState.fromProto(io.temporal.api.enums.v1.RetryState.UNRECOGNIZED));
    assertNull(RetryState.fromProto(io.temporal.api.enums.v1.RetryState.RETRY_STATE_UNSPECIFIED));
    assertEquals(0, RetryState.toProtoValue(null));
  }
}

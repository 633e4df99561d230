package io.relay.failure;

import static org.junit.Assert.*;

import org.junit.Test;

public class FailureTaxonomyTest {

  @Test
  public void canceledFailureDefaults() {
    CanceledFailure failure = new CanceledFailure();
    assertEquals("Cancelled", failure.getMessage());
    assertEquals("Cancelled", failure.getOriginalMessage());
    assertEquals(0, failure.getDetails().getSize());
    assertNull(failure.getDetails().get(String.class));
    assertFalse(failure.getFailure().isPresent());
  }

  @Test
  public void canceledFailureDetails() {
    CanceledFailure failure = new CanceledFailure("user request", "ticket-12");
    assertEquals("user request", failure.getMessage());
    assertEquals(1, failure.getDetails().getSize());
    assertEquals("ticket-12", failure.getDetails().get(String.class));
  }

  @Test
  public void terminatedFailure() {
    TerminatedFailure failure = new TerminatedFailure("operator", "reason");
    assertEquals("operator", failure.getMessage());
    assertEquals("reason", failure.getDetails().get(String.class));
  }

  @Test
  public void timeoutFailureMessage() {
    TimeoutFailure failure = new TimeoutFailure("too slow", TimeoutType.HEARTBEAT, "progress");
    assertEquals("message='too slow', timeoutType=HEARTBEAT", failure.getMessage());
    assertEquals("too slow", failure.getOriginalMessage());
    assertEquals(TimeoutType.HEARTBEAT, failure.getTimeoutType());
    assertEquals("progress", failure.getLastHeartbeatDetails().get(String.class));
  }

  @Test
  public void timeoutFailureWithUnknownType() {
    TimeoutFailure failure = new TimeoutFailure("", null);
    assertNull(failure.getTimeoutType());
    assertEquals("timeoutType=null", failure.getMessage());
    assertEquals(0, failure.getLastHeartbeatDetails().getSize());
  }

  @Test
  public void serverFailure() {
    ServerFailure failure = new ServerFailure("internal", true);
    assertEquals("internal", failure.getMessage());
    assertTrue(failure.isNonRetryable());
    assertFalse(new ServerFailure("internal", false).isNonRetryable());
  }

  @Test
  public void activityFailureMessage() {
    ActivityFailure failure =
        new ActivityFailure(
            "activity error",
            5,
            6,
            "ChargeCard",
            "activity-1",
            "worker@host",
            RetryState.MAXIMUM_ATTEMPTS_REACHED,
            ApplicationFailure.newFailure("declined", "CardError"));
    assertEquals("activity error", failure.getOriginalMessage());
    assertTrue(failure.getMessage().startsWith("Activity with activityType='ChargeCard' failed"));
    assertTrue(failure.getMessage().contains("activityId=activity-1"));
    assertEquals(5, failure.getScheduledEventId());
    assertEquals(6, failure.getStartedEventId());
    assertEquals("worker@host", failure.getIdentity());
    assertEquals(RetryState.MAXIMUM_ATTEMPTS_REACHED, failure.getRetryState());
    assertTrue(failure.getCause() instanceof ApplicationFailure);
  }

  @Test
  public void childWorkflowFailureMessage() {
    ChildWorkflowFailure failure =
        new ChildWorkflowFailure(
            "child error",
            "default",
            "order-42",
            "run-1",
            "ShipOrder",
            7,
            8,
            null,
            new CanceledFailure());
    assertEquals("child error", failure.getOriginalMessage());
    assertTrue(failure.getMessage().startsWith("Child workflow with workflowType='ShipOrder'"));
    assertTrue(failure.getMessage().contains("workflowId='order-42'"));
    assertEquals("default", failure.getNamespace());
    assertEquals("run-1", failure.getRunId());
    assertEquals(7, failure.getInitiatedEventId());
    assertEquals(8, failure.getStartedEventId());
    assertNull(failure.getRetryState());
  }

  @Test
  public void workflowAlreadyStarted() {
    WorkflowAlreadyStartedFailure fromWorkflow =
        new WorkflowAlreadyStartedFailure("order-42", "ShipOrder", null);
    assertEquals("Workflow execution already started", fromWorkflow.getMessage());
    assertEquals("order-42", fromWorkflow.getWorkflowId());
    assertEquals("ShipOrder", fromWorkflow.getWorkflowType());
    assertNull(fromWorkflow.getRunId());

    WorkflowAlreadyStartedFailure fromClient =
        new WorkflowAlreadyStartedFailure("order-42", "ShipOrder", "run-9");
    assertEquals("run-9", fromClient.getRunId());
  }

  @Test
  public void causeIsAccessible() {
    IllegalArgumentException cause = new IllegalArgumentException("bad");
    ServerFailure failure = new ServerFailure("wrapped", false, cause);
    assertSame(cause, failure.getCause());
  }
}

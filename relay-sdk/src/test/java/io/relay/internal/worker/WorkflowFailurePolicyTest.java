package io.relay.internal.worker;

import static org.junit.Assert.*;

import ch.qos.logback.classic.Level;
import io.relay.common.converter.DefaultDataConverter;
import io.relay.failure.ApplicationFailure;
import io.relay.failure.CanceledFailure;
import io.relay.failure.DefaultFailureConverter;
import io.relay.testUtils.LoggerUtils;
import io.relay.worker.NonDeterministicException;
import io.relay.worker.WorkflowImplementationOptions;
import io.temporal.api.failure.v1.Failure;
import java.lang.reflect.InvocationTargetException;
import org.junit.Test;

public class WorkflowFailurePolicyTest {

  private static final String WORKFLOW_TYPE = "ShipOrder";

  private final WorkflowFailurePolicy defaultPolicy = WorkflowFailurePolicy.newBuilder().build();

  @Test
  public void relayFailureFailsWorkflow() throws Exception {
    ApplicationFailure failure = ApplicationFailure.newFailure("out of stock", "Inventory");
    assertTrue(defaultPolicy.isWorkflowFailure(WORKFLOW_TYPE, failure));

    WorkflowExecutionException e = expectExecutionFailure(defaultPolicy, failure);
    assertEquals("out of stock", e.getFailure().getMessage());
    assertEquals("Inventory", e.getFailure().getApplicationFailureInfo().getType());
    assertEquals("Workflow ShipOrder failed: out of stock", e.getMessage());
    assertEquals(WORKFLOW_TYPE, e.getWorkflowType());
  }

  @Test
  public void otherExceptionFailsWorkflowTask() {
    IllegalStateException bug = new IllegalStateException("bug");
    assertFalse(defaultPolicy.isWorkflowFailure(WORKFLOW_TYPE, bug));
    try {
      defaultPolicy.applyAndRethrow(WORKFLOW_TYPE, bug);
      fail("unreachable");
    } catch (WorkflowExecutionUnexpectedException e) {
      assertSame(bug, e.getCause());
      assertEquals(WORKFLOW_TYPE, e.getWorkflowType());
      assertEquals("bug", e.getFailure().getMessage());
      assertEquals(
          "java.lang.IllegalStateException", e.getFailure().getApplicationFailureInfo().getType());
    }
  }

  @Test
  public void defaultFailTypesIncludeSubclasses() throws Exception {
    WorkflowFailurePolicy policy =
        WorkflowFailurePolicy.newBuilder()
            .setDefaultOptions(
                WorkflowImplementationOptions.newBuilder()
                    .setFailWorkflowExceptionTypes(IllegalArgumentException.class)
                    .build())
            .build();
    NumberFormatException e = new NumberFormatException("not a number");
    assertTrue(policy.isWorkflowFailure("AnyWorkflow", e));
    assertEquals("not a number", expectExecutionFailure(policy, e).getFailure().getMessage());
  }

  @Test
  public void workflowTypeFailTypesApplyToThatTypeOnly() {
    WorkflowFailurePolicy policy =
        WorkflowFailurePolicy.newBuilder()
            .setWorkflowTypeOptions(
                WORKFLOW_TYPE,
                WorkflowImplementationOptions.newBuilder()
                    .setFailWorkflowExceptionTypes(NonDeterministicException.class)
                    .build())
            .build();
    NonDeterministicException e = new NonDeterministicException("unexpected command");
    assertTrue(policy.isWorkflowFailure(WORKFLOW_TYPE, e));
    assertFalse(policy.isWorkflowFailure("OtherWorkflow", e));
  }

  @Test
  public void workflowTypeFailTypesAddToDefaults() {
    WorkflowFailurePolicy policy =
        WorkflowFailurePolicy.newBuilder()
            .setDefaultOptions(
                WorkflowImplementationOptions.newBuilder()
                    .setFailWorkflowExceptionTypes(IllegalArgumentException.class)
                    .build())
            .setWorkflowTypeOptions(
                WORKFLOW_TYPE,
                WorkflowImplementationOptions.newBuilder()
                    .setFailWorkflowExceptionTypes(IllegalStateException.class)
                    .build())
            .build();
    assertTrue(policy.isWorkflowFailure(WORKFLOW_TYPE, new IllegalArgumentException()));
    assertTrue(policy.isWorkflowFailure(WORKFLOW_TYPE, new IllegalStateException()));
    assertFalse(policy.isWorkflowFailure("OtherWorkflow", new IllegalStateException()));
  }

  @Test
  public void reflectionWrapperIsUnwrapped() throws Exception {
    ApplicationFailure failure = ApplicationFailure.newFailure("inner", "T");
    InvocationTargetException wrapped = new InvocationTargetException(failure);
    assertTrue(defaultPolicy.isWorkflowFailure(WORKFLOW_TYPE, wrapped));
    assertEquals("inner", expectExecutionFailure(defaultPolicy, wrapped).getFailure().getMessage());
  }

  @Test
  public void cancellationIsNotLoggedAsWarning() throws Exception {
    try (LoggerUtils.CapturedLogs logs = LoggerUtils.captureLogs(WorkflowFailurePolicy.class)) {
      Failure failure = expectExecutionFailure(defaultPolicy, new CanceledFailure()).getFailure();
      assertTrue(failure.hasCanceledFailureInfo());
      assertTrue(logs.getEvents(Level.WARN).isEmpty());

      expectExecutionFailure(defaultPolicy, ApplicationFailure.newFailure("m", "T"));
      assertEquals(1, logs.getEvents(Level.WARN).size());
    }
  }

  @Test
  public void workflowTaskFailureIsLoggedAtDebug() {
    try (LoggerUtils.CapturedLogs logs = LoggerUtils.captureLogs(WorkflowFailurePolicy.class)) {
      try {
        defaultPolicy.applyAndRethrow(WORKFLOW_TYPE, new RuntimeException("bug"));
        fail("unreachable");
      } catch (WorkflowExecutionUnexpectedException e) {
        assertEquals(1, logs.getEvents(Level.DEBUG).size());
        assertTrue(logs.getEvents(Level.WARN).isEmpty());
      }
    }
  }

  @Test
  public void configuredDataConverterBuildsFailure() throws Exception {
    WorkflowFailurePolicy policy =
        WorkflowFailurePolicy.newBuilder()
            .setDataConverter(
                DefaultDataConverter.newDefaultInstance()
                    .withFailureConverter(new DefaultFailureConverter(true)))
            .build();
    try (LoggerUtils.SilenceLoggers sl = LoggerUtils.silenceLoggers(WorkflowFailurePolicy.class)) {
      WorkflowExecutionException e =
          expectExecutionFailure(policy, ApplicationFailure.newFailure("secret", "T"));
      assertEquals("Encoded failure", e.getFailure().getMessage());
      assertTrue(e.getFailure().hasEncodedAttributes());
    }
  }

  private static WorkflowExecutionException expectExecutionFailure(
      WorkflowFailurePolicy policy, Throwable e) throws WorkflowExecutionUnexpectedException {
    try (LoggerUtils.SilenceLoggers sl =
        LoggerUtils.silenceLoggers(DefaultFailureConverter.class)) {
      policy.applyAndRethrow(WORKFLOW_TYPE, e);
      fail("unreachable");
      return null;
    } catch (WorkflowExecutionException ex) {
      return ex;
    }
  }
}

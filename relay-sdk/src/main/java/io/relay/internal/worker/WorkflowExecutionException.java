package io.relay.internal.worker;

import io.temporal.api.failure.v1.Failure;

/**
 * Internal. Do not throw or catch in application level code.
 *
 * <p>Outcome of {@link WorkflowFailurePolicy#applyAndRethrow(String, Throwable)} when the workflow
 * execution has to be closed as failed. The {@link #getFailure() failure} is what gets recorded in
 * the workflow history.
 */
public final class WorkflowExecutionException extends RuntimeException {
  private final String workflowType;
  private final Failure failure;

  public WorkflowExecutionException(String workflowType, Failure failure) {
    super("Workflow " + workflowType + " failed: " + failure.getMessage());
    this.workflowType = workflowType;
    this.failure = failure;
  }

  public String getWorkflowType() {
    return workflowType;
  }

  public Failure getFailure() {
    return failure;
  }
}

package io.relay.failure;

import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Thrown when a workflow execution with the same ID is already running.
 *
 * <p>A client start call sets {@link #getRunId()} to the run ID of the running execution. Workflow
 * code attempting to start a child with a taken ID receives it without one.
 *
 * <p>This failure isn't produced from failures received in workflow or activity results.
 */
public final class WorkflowAlreadyStartedFailure extends RelayFailure {
  static final String MESSAGE = "Workflow execution already started";

  private final String workflowId;
  private final String workflowType;
  private final @Nullable String runId;

  public WorkflowAlreadyStartedFailure(
      String workflowId, String workflowType, @Nullable String runId) {
    this(workflowId, workflowType, runId, null);
  }

  public WorkflowAlreadyStartedFailure(
      String workflowId, String workflowType, @Nullable String runId, @Nullable Throwable cause) {
    super(MESSAGE, MESSAGE, cause, null);
    this.workflowId = Objects.requireNonNull(workflowId);
    this.workflowType = Objects.requireNonNull(workflowType);
    this.runId = runId;
  }

  public String getWorkflowId() {
    return workflowId;
  }

  public String getWorkflowType() {
    return workflowType;
  }

  /** Run ID of the running execution, null when not raised by a client call. */
  @Nullable
  public String getRunId() {
    return runId;
  }
}

package io.relay.worker;

/**
 * Thrown if history events from the service don't match commands issued by the execution or replay
 * of workflow code. This usually means that workflow code has changed in a way that is not
 * compatible with histories of already running executions.
 *
 * <p>By default this exception fails the workflow task, so the execution can make progress after a
 * fixed version of the code is deployed. Add it to {@link
 * WorkflowImplementationOptions.Builder#setFailWorkflowExceptionTypes(Class[])} to fail the
 * workflow execution instead.
 */
public class NonDeterministicException extends IllegalStateException {
  public NonDeterministicException(String message, Throwable cause) {
    super(message, cause);
  }

  public NonDeterministicException(String message) {
    super(message);
  }
}

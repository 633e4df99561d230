package io.relay.internal.worker;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import io.relay.common.converter.DataConverter;
import io.relay.common.converter.DefaultDataConverter;
import io.relay.failure.FailureClassifier;
import io.relay.failure.RelayFailure;
import io.relay.worker.WorkflowImplementationOptions;
import io.temporal.api.failure.v1.Failure;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.UndeclaredThrowableException;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether an exception thrown from workflow code fails the workflow execution or only the
 * current workflow task.
 *
 * <p>Any {@link RelayFailure} fails the execution. Other exceptions fail the execution only if
 * they extend one of the types configured through {@link
 * WorkflowImplementationOptions.Builder#setFailWorkflowExceptionTypes(Class[])}, either on the
 * worker wide options or on the options of the workflow type. Everything else fails the workflow
 * task, which the service retries.
 */
public final class WorkflowFailurePolicy {
  private static final Logger log = LoggerFactory.getLogger(WorkflowFailurePolicy.class);

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    private DataConverter dataConverter;
    private WorkflowImplementationOptions defaultOptions;
    private final Map<String, WorkflowImplementationOptions> workflowTypeOptions = new HashMap<>();

    private Builder() {}

    /** Converter used to build the failure reported to the service. Default is the standard one. */
    public Builder setDataConverter(DataConverter dataConverter) {
      this.dataConverter = Objects.requireNonNull(dataConverter);
      return this;
    }

    /** Options applied to every workflow type. */
    public Builder setDefaultOptions(WorkflowImplementationOptions defaultOptions) {
      this.defaultOptions = Objects.requireNonNull(defaultOptions);
      return this;
    }

    /** Options of a single workflow type, applied in addition to the default options. */
    public Builder setWorkflowTypeOptions(
        String workflowType, WorkflowImplementationOptions options) {
      workflowTypeOptions.put(
          Preconditions.checkNotNull(workflowType, "workflowType"),
          Objects.requireNonNull(options));
      return this;
    }

    public WorkflowFailurePolicy build() {
      return new WorkflowFailurePolicy(
          dataConverter == null ? DefaultDataConverter.STANDARD_INSTANCE : dataConverter,
          defaultOptions == null
              ? WorkflowImplementationOptions.getDefaultInstance()
              : defaultOptions,
          ImmutableMap.copyOf(workflowTypeOptions));
    }
  }

  private final DataConverter dataConverter;
  private final WorkflowImplementationOptions defaultOptions;
  private final ImmutableMap<String, WorkflowImplementationOptions> workflowTypeOptions;

  private WorkflowFailurePolicy(
      DataConverter dataConverter,
      WorkflowImplementationOptions defaultOptions,
      ImmutableMap<String, WorkflowImplementationOptions> workflowTypeOptions) {
    this.dataConverter = dataConverter;
    this.defaultOptions = defaultOptions;
    this.workflowTypeOptions = workflowTypeOptions;
  }

  /**
   * @return true if {@code e} thrown from a workflow of {@code workflowType} fails the workflow
   *     execution
   */
  public boolean isWorkflowFailure(@Nonnull String workflowType, @Nonnull Throwable e) {
    Throwable exception = unwrap(e);
    if (exception instanceof RelayFailure) {
      return true;
    }
    if (matches(defaultOptions, exception)) {
      return true;
    }
    WorkflowImplementationOptions typeOptions = workflowTypeOptions.get(workflowType);
    return typeOptions != null && matches(typeOptions, exception);
  }

  /**
   * Converts {@code e} to a {@link Failure} and rethrows it as the outcome of the workflow task.
   *
   * @throws WorkflowExecutionException if the workflow execution has to be failed
   * @throws WorkflowExecutionUnexpectedException if only the workflow task has to be failed
   */
  public void applyAndRethrow(@Nonnull String workflowType, @Nonnull Throwable e)
      throws WorkflowExecutionUnexpectedException {
    Preconditions.checkNotNull(workflowType, "workflowType");
    Preconditions.checkNotNull(e, "e");
    Throwable exception = unwrap(e);
    Failure failure = dataConverter.exceptionToFailure(exception);
    if (isWorkflowFailure(workflowType, exception)) {
      if (log.isWarnEnabled() && !FailureClassifier.isCancellation(exception)) {
        log.warn("Workflow execution failure WorkflowType='{}'", workflowType, exception);
      }
      throw new WorkflowExecutionException(workflowType, failure);
    }
    if (log.isDebugEnabled()) {
      log.debug(
          "Workflow task failure WorkflowType='{}', the task is going to be retried",
          workflowType,
          exception);
    }
    throw new WorkflowExecutionUnexpectedException(workflowType, failure, exception);
  }

  private static boolean matches(WorkflowImplementationOptions options, Throwable exception) {
    for (Class<? extends Throwable> failType : options.getFailWorkflowExceptionTypes()) {
      if (failType.isAssignableFrom(exception.getClass())) {
        return true;
      }
    }
    return false;
  }

  private static Throwable unwrap(Throwable e) {
    Throwable result = e;
    while ((result instanceof InvocationTargetException
            || result instanceof UndeclaredThrowableException)
        && result.getCause() != null) {
      result = result.getCause();
    }
    return result;
  }
}

/*
 * Copyright (C) 2022 Temporal Technologies, Inc. All Rights Reserved.
 *
 * Copyright (C) 2012-2016 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Modifications copyright (C) 2017 Uber Technologies, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this material except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.relay.worker;

import java.util.Arrays;

/** Options of a workflow implementation, or of all workflow implementations of a worker. */
public final class WorkflowImplementationOptions {

  private static final WorkflowImplementationOptions DEFAULT_INSTANCE;

  static {
    DEFAULT_INSTANCE = WorkflowImplementationOptions.newBuilder().build();
  }

  public static WorkflowImplementationOptions getDefaultInstance() {
    return DEFAULT_INSTANCE;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static Builder newBuilder(WorkflowImplementationOptions options) {
    return new Builder(options);
  }

  public static final class Builder {

    private Class<? extends Throwable>[] failWorkflowExceptionTypes;

    private Builder() {}

    private Builder(WorkflowImplementationOptions options) {
      if (options == null) {
        return;
      }
      this.failWorkflowExceptionTypes = options.failWorkflowExceptionTypes;
    }

    /**
     * Optional: Sets which exceptions thrown from the workflow code fail the workflow execution.
     *
     * <p>The default behavior is to fail workflow on {@link io.relay.failure.RelayFailure} or any
     * of its subclasses. Any other exceptions thrown from the workflow code are treated as bugs
     * that can be fixed by a new deployment. So workflow is not failed, but its workflow task is
     * failed and retried until the code stops throwing.
     *
     * <p>This option allows to specify specific exception types which should lead to workflow
     * failure instead of blockage. Any exception that extends the configured type considered
     * matched. For example to fail workflow on any exception pass {@link Throwable} class to this
     * method, to fail it on non-determinism pass {@link NonDeterministicException}.
     */
    @SafeVarargs
    public final Builder setFailWorkflowExceptionTypes(
        Class<? extends Throwable>... failWorkflowExceptionTypes) {
      this.failWorkflowExceptionTypes = failWorkflowExceptionTypes.clone();
      return this;
    }

    @SuppressWarnings("unchecked")
    public WorkflowImplementationOptions build() {
      return new WorkflowImplementationOptions(
          failWorkflowExceptionTypes == null ? new Class[0] : failWorkflowExceptionTypes);
    }
  }

  private final Class<? extends Throwable>[] failWorkflowExceptionTypes;

  private WorkflowImplementationOptions(Class<? extends Throwable>[] failWorkflowExceptionTypes) {
    this.failWorkflowExceptionTypes = failWorkflowExceptionTypes;
  }

  public Class<? extends Throwable>[] getFailWorkflowExceptionTypes() {
    return failWorkflowExceptionTypes.clone();
  }

  @Override
  public String toString() {
    return "WorkflowImplementationOptions{"
        + "failWorkflowExceptionTypes="
        + Arrays.toString(failWorkflowExceptionTypes)
        + '}';
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    WorkflowImplementationOptions that = (WorkflowImplementationOptions) o;
    return Arrays.equals(failWorkflowExceptionTypes, that.failWorkflowExceptionTypes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(failWorkflowExceptionTypes);
  }
}

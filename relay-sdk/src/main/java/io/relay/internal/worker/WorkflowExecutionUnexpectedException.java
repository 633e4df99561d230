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

package io.relay.internal.worker;

import io.relay.worker.WorkflowImplementationOptions;
import io.temporal.api.failure.v1.Failure;

/**
 * Internal. Do not throw or catch in application level code.
 *
 * <p>Outcome of {@link WorkflowFailurePolicy#applyAndRethrow(String, Throwable)} when workflow code
 * threw something that is neither a {@link io.relay.failure.RelayFailure} nor one of the types
 * listed by {@link WorkflowImplementationOptions.Builder#setFailWorkflowExceptionTypes(Class[])}.
 * Only the workflow task fails. The service retries it, so a fixed deployment can let the
 * execution continue.
 */
public class WorkflowExecutionUnexpectedException extends Exception {
  private final String workflowType;
  private final Failure failure;

  public WorkflowExecutionUnexpectedException(
      String workflowType, Failure failure, Throwable cause) {
    super("Workflow task of " + workflowType + " failed: " + failure.getMessage(), cause);
    this.workflowType = workflowType;
    this.failure = failure;
  }

  public String getWorkflowType() {
    return workflowType;
  }

  /** Failure reported with the failed workflow task. */
  public Failure getFailure() {
    return failure;
  }
}

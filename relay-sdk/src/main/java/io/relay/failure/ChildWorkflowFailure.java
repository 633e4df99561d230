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

package io.relay.failure;

import io.temporal.api.failure.v1.Failure;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Failure of a child workflow execution. The cause is the failure the child completed with, for
 * example {@link CanceledFailure} if the child was canceled.
 *
 * <p><b>This exception is expected to be thrown only by the Relay framework code.</b>
 */
public final class ChildWorkflowFailure extends RelayFailure {

  private final String namespace;
  private final String workflowId;
  private final String runId;
  private final String workflowType;
  private final long initiatedEventId;
  private final long startedEventId;
  private final @Nullable RetryState retryState;

  public ChildWorkflowFailure(
      String message,
      String namespace,
      String workflowId,
      String runId,
      String workflowType,
      long initiatedEventId,
      long startedEventId,
      @Nullable RetryState retryState,
      @Nullable Throwable cause) {
    this(
        message,
        namespace,
        workflowId,
        runId,
        workflowType,
        initiatedEventId,
        startedEventId,
        retryState,
        cause,
        null);
  }

  ChildWorkflowFailure(
      String message,
      String namespace,
      String workflowId,
      String runId,
      String workflowType,
      long initiatedEventId,
      long startedEventId,
      @Nullable RetryState retryState,
      @Nullable Throwable cause,
      @Nullable Failure failure) {
    super(
        getMessage(
            message,
            workflowId,
            runId,
            workflowType,
            initiatedEventId,
            startedEventId,
            namespace,
            retryState),
        message,
        cause,
        failure);
    this.namespace = namespace;
    this.workflowId = Objects.requireNonNull(workflowId);
    this.runId = runId;
    this.workflowType = Objects.requireNonNull(workflowType);
    this.initiatedEventId = initiatedEventId;
    this.startedEventId = startedEventId;
    this.retryState = retryState;
  }

  public String getNamespace() {
    return namespace;
  }

  public String getWorkflowId() {
    return workflowId;
  }

  public String getRunId() {
    return runId;
  }

  public String getWorkflowType() {
    return workflowType;
  }

  public long getInitiatedEventId() {
    return initiatedEventId;
  }

  public long getStartedEventId() {
    return startedEventId;
  }

  @Nullable
  public RetryState getRetryState() {
    return retryState;
  }

  public static String getMessage(
      String originalMessage,
      String workflowId,
      String runId,
      String workflowType,
      long initiatedEventId,
      long startedEventId,
      String namespace,
      @Nullable RetryState retryState) {
    return "Child workflow with workflowType='"
        + workflowType
        + "' failed: '"
        + originalMessage
        + "'. workflowId='"
        + workflowId
        + '\''
        + ", runId='"
        + runId
        + '\''
        + ", initiatedEventId="
        + initiatedEventId
        + ", startedEventId="
        + startedEventId
        + ", namespace='"
        + namespace
        + '\''
        + ", retryState="
        + retryState;
  }
}

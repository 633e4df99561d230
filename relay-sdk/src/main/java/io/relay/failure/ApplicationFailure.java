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

import com.google.common.base.Strings;
import io.relay.common.converter.EncodedValues;
import io.relay.common.converter.Values;
import io.temporal.api.failure.v1.Failure;
import java.time.Duration;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Application failure is used to communicate application specific failures between workflows and
 * activities.
 *
 * <p>This is the only failure type that application code is expected to throw. Throw it to fail a
 * workflow execution, or to fail an activity with full control over type, details and
 * retryability.
 *
 * <p>When {@code type} is set the exception message is {@code "<type>: <message>"}, so failures can
 * be bucketed by category without looking into details. {@link #getOriginalMessage()} always
 * returns the message as supplied.
 *
 * <p>{@code nonRetryable} only records what the thrower asked for. Whether a retry actually happens
 * is decided by the retry policy evaluated by the service.
 */
public final class ApplicationFailure extends RelayFailure {
  private final @Nullable String type;
  private final Values details;
  private final boolean nonRetryable;
  private final @Nullable Duration nextRetryDelay;

  /** Creates a new builder for {@link ApplicationFailure}. */
  public static ApplicationFailure.Builder newBuilder() {
    return new ApplicationFailure.Builder();
  }

  /** Creates a new builder for {@link ApplicationFailure} initialized with the provided failure. */
  public static ApplicationFailure.Builder newBuilder(ApplicationFailure options) {
    return new ApplicationFailure.Builder(options);
  }

  /**
   * New ApplicationFailure with {@link #isNonRetryable()} flag set to false.
   *
   * @param message error message
   * @param type optional error type
   * @param details optional details about the failure. They are serialized using the same approach
   *     as arguments and results.
   */
  public static ApplicationFailure newFailure(
      String message, @Nullable String type, Object... details) {
    return newFailureWithCause(message, type, null, details);
  }

  /**
   * New ApplicationFailure with {@link #isNonRetryable()} flag set to false.
   *
   * @param message error message
   * @param type optional error type
   * @param cause failure cause
   * @param details optional details about the failure
   */
  public static ApplicationFailure newFailureWithCause(
      String message, @Nullable String type, @Nullable Throwable cause, Object... details) {
    return new ApplicationFailure(
        message, type, false, new EncodedValues(details), cause, null, null);
  }

  /**
   * New ApplicationFailure with {@link #isNonRetryable()} flag set to false.
   *
   * @param message error message
   * @param type optional error type
   * @param cause failure cause
   * @param nextRetryDelay delay before the next retry attempt of the activity that throws it
   * @param details optional details about the failure
   */
  public static ApplicationFailure newFailureWithCauseAndDelay(
      String message,
      @Nullable String type,
      @Nullable Throwable cause,
      Duration nextRetryDelay,
      Object... details) {
    return new ApplicationFailure(
        message, type, false, new EncodedValues(details), cause, nextRetryDelay, null);
  }

  /**
   * New ApplicationFailure with {@link #isNonRetryable()} flag set to true.
   *
   * @param message error message
   * @param type optional error type
   * @param details optional details about the failure
   */
  public static ApplicationFailure newNonRetryableFailure(
      String message, @Nullable String type, Object... details) {
    return newNonRetryableFailureWithCause(message, type, null, details);
  }

  /**
   * New ApplicationFailure with {@link #isNonRetryable()} flag set to true.
   *
   * @param message error message
   * @param type optional error type
   * @param cause failure cause
   * @param details optional details about the failure
   */
  public static ApplicationFailure newNonRetryableFailureWithCause(
      String message, @Nullable String type, @Nullable Throwable cause, Object... details) {
    return new ApplicationFailure(
        message, type, true, new EncodedValues(details), cause, null, null);
  }

  ApplicationFailure(
      String message,
      @Nullable String type,
      boolean nonRetryable,
      Values details,
      @Nullable Throwable cause,
      @Nullable Duration nextRetryDelay,
      @Nullable Failure failure) {
    super(getMessage(message, type), message, cause, failure);
    this.type = Strings.emptyToNull(type);
    this.details = Objects.requireNonNull(details);
    this.nonRetryable = nonRetryable;
    this.nextRetryDelay = nextRetryDelay;
  }

  @Nullable
  public String getType() {
    return type;
  }

  public Values getDetails() {
    return details;
  }

  public boolean isNonRetryable() {
    return nonRetryable;
  }

  /** Delay before the next activity retry attempt, overriding the retry policy backoff. */
  @Nullable
  public Duration getNextRetryDelay() {
    return nextRetryDelay;
  }

  public static String getMessage(@Nullable String message, @Nullable String type) {
    String text = Strings.nullToEmpty(message);
    return Strings.isNullOrEmpty(type) ? text : type + ": " + text;
  }

  public static final class Builder {
    private String message;
    private String type;
    private Values details;
    private boolean nonRetryable;
    private Throwable cause;
    private Duration nextRetryDelay;

    private Builder() {}

    private Builder(ApplicationFailure options) {
      if (options == null) {
        return;
      }
      this.message = options.getOriginalMessage();
      this.type = options.type;
      this.details = options.details;
      this.nonRetryable = options.nonRetryable;
      this.cause = options.getCause();
      this.nextRetryDelay = options.nextRetryDelay;
    }

    /** Sets the error type of this failure. Used as the message prefix and by retry policies. */
    public Builder setType(String type) {
      this.type = type;
      return this;
    }

    /**
     * Set the optional error message.
     *
     * <p>Default is "".
     */
    public Builder setMessage(String message) {
      this.message = message;
      return this;
    }

    /**
     * Set the optional details of the failure.
     *
     * <p>Details are serialized using the same approach as arguments and results.
     */
    public Builder setDetails(Object... details) {
      this.details = new EncodedValues(details);
      return this;
    }

    public Builder setDetails(Values details) {
      this.details = details;
      return this;
    }

    /**
     * Set the non retryable flag on the failure.
     *
     * <p>Default is false.
     */
    public Builder setNonRetryable(boolean nonRetryable) {
      this.nonRetryable = nonRetryable;
      return this;
    }

    public Builder setCause(Throwable cause) {
      this.cause = cause;
      return this;
    }

    /**
     * Set the optional delay before the next retry attempt. Overrides the normal retry delay.
     *
     * <p>Default is null.
     */
    public Builder setNextRetryDelay(Duration nextRetryDelay) {
      this.nextRetryDelay = nextRetryDelay;
      return this;
    }

    public ApplicationFailure build() {
      return new ApplicationFailure(
          message,
          type,
          nonRetryable,
          details == null ? new EncodedValues() : details,
          cause,
          nextRetryDelay,
          null);
    }
  }
}

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

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Ints;
import io.relay.common.converter.DataConverter;
import io.relay.common.converter.DataConverterException;
import io.relay.common.converter.EncodedValues;
import io.relay.common.converter.FailureConverter;
import io.relay.common.converter.Values;
import io.relay.internal.common.ProtobufTimeUtils;
import io.temporal.api.common.v1.ActivityType;
import io.temporal.api.common.v1.Payload;
import io.temporal.api.common.v1.Payloads;
import io.temporal.api.common.v1.WorkflowExecution;
import io.temporal.api.common.v1.WorkflowType;
import io.temporal.api.failure.v1.ActivityFailureInfo;
import io.temporal.api.failure.v1.ApplicationFailureInfo;
import io.temporal.api.failure.v1.CanceledFailureInfo;
import io.temporal.api.failure.v1.ChildWorkflowExecutionFailureInfo;
import io.temporal.api.failure.v1.Failure;
import io.temporal.api.failure.v1.ServerFailureInfo;
import io.temporal.api.failure.v1.TerminatedFailureInfo;
import io.temporal.api.failure.v1.TimeoutFailureInfo;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link FailureConverter} that implements the default cross-language-compatible conversion
 * algorithm.
 *
 * <p>A {@link RelayFailure} produced by {@link #failureToException} keeps the {@link Failure} it
 * was built from, and {@link #exceptionToFailure} returns that stored failure as is. As failures
 * are immutable, rethrowing a received failure puts exactly the received bytes back on the wire.
 *
 * <p>With {@code encodeCommonAttributes} enabled, the message and stack trace of every serialized
 * failure are moved into {@code encoded_attributes}, so that a payload codec can encrypt them
 * together with the details. The message is replaced with {@code "Encoded failure"}.
 */
public final class DefaultFailureConverter implements FailureConverter {

  private static final Logger log = LoggerFactory.getLogger(DefaultFailureConverter.class);

  static final String JAVA_SDK = "JavaSDK";

  static final String ENCODED_FAILURE_MESSAGE = "Encoded failure";
  static final String MESSAGE_ATTRIBUTE = "message";
  static final String STACK_TRACE_ATTRIBUTE = "stack_trace";

  /** Used to parse a stack trace line. */
  private static final Pattern TRACE_ELEMENT_PATTERN =
      Pattern.compile(
          "((?<className>.*)\\.(?<methodName>.*))\\(((?<fileName>.*?)(:(?<lineNumber>\\d+))?)\\)");

  private final boolean encodeCommonAttributes;

  public DefaultFailureConverter() {
    this(false);
  }

  /**
   * @param encodeCommonAttributes move message and stack trace of serialized failures into {@code
   *     encoded_attributes}
   */
  public DefaultFailureConverter(boolean encodeCommonAttributes) {
    this.encodeCommonAttributes = encodeCommonAttributes;
  }

  @Override
  @Nonnull
  public RelayFailure failureToException(
      @Nonnull Failure failure, @Nonnull DataConverter dataConverter) {
    Preconditions.checkNotNull(failure, "failure");
    Preconditions.checkNotNull(dataConverter, "dataConverter");
    String message = failure.getMessage();
    String stackTrace = failure.getStackTrace();
    if (failure.hasEncodedAttributes()) {
      Map<String, Object> attributes =
          decodeAttributes(failure.getEncodedAttributes(), dataConverter);
      if (attributes.get(MESSAGE_ATTRIBUTE) instanceof String) {
        message = (String) attributes.get(MESSAGE_ATTRIBUTE);
      }
      if (attributes.get(STACK_TRACE_ATTRIBUTE) instanceof String) {
        stackTrace = (String) attributes.get(STACK_TRACE_ATTRIBUTE);
      }
    }
    RelayFailure result = failureToExceptionImpl(failure, message, dataConverter);
    if (failure.getSource().equals(JAVA_SDK) && !stackTrace.isEmpty()) {
      result.setStackTrace(parseStackTrace(stackTrace));
    }
    return result;
  }

  private RelayFailure failureToExceptionImpl(
      Failure failure, String message, DataConverter dataConverter) {
    RelayFailure cause =
        failure.hasCause() ? failureToException(failure.getCause(), dataConverter) : null;
    switch (failure.getFailureInfoCase()) {
      case APPLICATION_FAILURE_INFO:
        {
          ApplicationFailureInfo info = failure.getApplicationFailureInfo();
          Optional<Payloads> details =
              info.hasDetails() ? Optional.of(info.getDetails()) : Optional.empty();
          return new ApplicationFailure(
              message,
              info.getType(),
              info.getNonRetryable(),
              new EncodedValues(details, dataConverter),
              cause,
              info.hasNextRetryDelay()
                  ? ProtobufTimeUtils.toJavaDuration(info.getNextRetryDelay())
                  : null,
              failure);
        }
      case TIMEOUT_FAILURE_INFO:
        {
          TimeoutFailureInfo info = failure.getTimeoutFailureInfo();
          Optional<Payloads> lastHeartbeatDetails =
              info.hasLastHeartbeatDetails()
                  ? Optional.of(info.getLastHeartbeatDetails())
                  : Optional.empty();
          TimeoutFailure tf =
              new TimeoutFailure(
                  message,
                  new EncodedValues(lastHeartbeatDetails, dataConverter),
                  TimeoutType.fromCode(info.getTimeoutTypeValue()),
                  cause,
                  failure);
          tf.setStackTrace(new StackTraceElement[0]);
          return tf;
        }
      case CANCELED_FAILURE_INFO:
        {
          CanceledFailureInfo info = failure.getCanceledFailureInfo();
          Optional<Payloads> details =
              info.hasDetails() ? Optional.of(info.getDetails()) : Optional.empty();
          return new CanceledFailure(
              message, new EncodedValues(details, dataConverter), cause, failure);
        }
      case TERMINATED_FAILURE_INFO:
        return new TerminatedFailure(message, new EncodedValues(), cause, failure);
      case SERVER_FAILURE_INFO:
        {
          ServerFailureInfo info = failure.getServerFailureInfo();
          return new ServerFailure(message, info.getNonRetryable(), cause, failure);
        }
      case ACTIVITY_FAILURE_INFO:
        {
          ActivityFailureInfo info = failure.getActivityFailureInfo();
          return new ActivityFailure(
              message,
              info.getScheduledEventId(),
              info.getStartedEventId(),
              info.getActivityType().getName(),
              info.getActivityId(),
              info.getIdentity(),
              RetryState.fromCode(info.getRetryStateValue()),
              cause,
              failure);
        }
      case CHILD_WORKFLOW_EXECUTION_FAILURE_INFO:
        {
          ChildWorkflowExecutionFailureInfo info = failure.getChildWorkflowExecutionFailureInfo();
          return new ChildWorkflowFailure(
              message,
              info.getNamespace(),
              info.getWorkflowExecution().getWorkflowId(),
              info.getWorkflowExecution().getRunId(),
              info.getWorkflowType().getName(),
              info.getInitiatedEventId(),
              info.getStartedEventId(),
              RetryState.fromCode(info.getRetryStateValue()),
              cause,
              failure);
        }
      default:
        if (log.isDebugEnabled()) {
          log.debug(
              "Unsupported failure info {}, converting to UnrecognizedFailure",
              failure.getFailureInfoCase());
        }
        return new UnrecognizedFailure(message, cause, failure);
    }
  }

  @Override
  @Nonnull
  public Failure exceptionToFailure(
      @Nonnull Throwable throwable, @Nonnull DataConverter dataConverter) {
    Preconditions.checkNotNull(throwable, "throwable");
    Preconditions.checkNotNull(dataConverter, "dataConverter");
    Set<Throwable> visited = Collections.newSetFromMap(new IdentityHashMap<>());
    return exceptionToFailure(throwable, dataConverter, visited);
  }

  @Nonnull
  private Failure exceptionToFailure(
      Throwable throwable, DataConverter dataConverter, Set<Throwable> visited) {
    visited.add(throwable);
    String message;
    if (throwable instanceof RelayFailure) {
      RelayFailure rf = (RelayFailure) throwable;
      if (rf.getFailure().isPresent()) {
        return rf.getFailure().get();
      }
      message = rf.getOriginalMessage();
    } else {
      message = Strings.nullToEmpty(throwable.getMessage());
    }
    String stackTrace = serializeStackTrace(throwable);
    Failure.Builder failure =
        Failure.newBuilder().setSource(JAVA_SDK).setMessage(message).setStackTrace(stackTrace);
    Throwable cause = throwable.getCause();
    if (cause != null) {
      if (visited.contains(cause)) {
        log.warn(
            "Cause chain of {} loops back to {}, the rest of the chain is not serialized",
            throwable.getClass().getName(),
            cause.getClass().getName());
      } else {
        failure.setCause(exceptionToFailure(cause, dataConverter, visited));
      }
    }

    if (throwable instanceof ApplicationFailure) {
      ApplicationFailure ae = (ApplicationFailure) throwable;
      ApplicationFailureInfo.Builder info =
          ApplicationFailureInfo.newBuilder()
              .setType(Strings.nullToEmpty(ae.getType()))
              .setNonRetryable(ae.isNonRetryable());
      Optional<Payloads> details = toPayloads(ae.getDetails(), dataConverter);
      if (details.isPresent()) {
        info.setDetails(details.get());
      }
      if (ae.getNextRetryDelay() != null) {
        info.setNextRetryDelay(ProtobufTimeUtils.toProtoDuration(ae.getNextRetryDelay()));
      }
      failure.setApplicationFailureInfo(info);
    } else if (throwable instanceof TimeoutFailure) {
      TimeoutFailure te = (TimeoutFailure) throwable;
      TimeoutFailureInfo.Builder info =
          TimeoutFailureInfo.newBuilder()
              .setTimeoutTypeValue(TimeoutType.toProtoValue(te.getTimeoutType()));
      Optional<Payloads> details = toPayloads(te.getLastHeartbeatDetails(), dataConverter);
      if (details.isPresent()) {
        info.setLastHeartbeatDetails(details.get());
      }
      failure.setTimeoutFailureInfo(info);
    } else if (throwable instanceof CanceledFailure) {
      CanceledFailure ce = (CanceledFailure) throwable;
      CanceledFailureInfo.Builder info = CanceledFailureInfo.newBuilder();
      Optional<Payloads> details = toPayloads(ce.getDetails(), dataConverter);
      if (details.isPresent()) {
        info.setDetails(details.get());
      }
      failure.setCanceledFailureInfo(info);
    } else if (throwable instanceof TerminatedFailure) {
      failure.setTerminatedFailureInfo(TerminatedFailureInfo.getDefaultInstance());
    } else if (throwable instanceof ServerFailure) {
      ServerFailure se = (ServerFailure) throwable;
      failure.setServerFailureInfo(
          ServerFailureInfo.newBuilder().setNonRetryable(se.isNonRetryable()));
    } else if (throwable instanceof ActivityFailure) {
      ActivityFailure ae = (ActivityFailure) throwable;
      ActivityFailureInfo.Builder info =
          ActivityFailureInfo.newBuilder()
              .setActivityId(Strings.nullToEmpty(ae.getActivityId()))
              .setActivityType(
                  ActivityType.newBuilder().setName(Strings.nullToEmpty(ae.getActivityType())))
              .setIdentity(Strings.nullToEmpty(ae.getIdentity()))
              .setRetryStateValue(RetryState.toProtoValue(ae.getRetryState()))
              .setScheduledEventId(ae.getScheduledEventId())
              .setStartedEventId(ae.getStartedEventId());
      failure.setActivityFailureInfo(info);
    } else if (throwable instanceof ChildWorkflowFailure) {
      ChildWorkflowFailure ce = (ChildWorkflowFailure) throwable;
      ChildWorkflowExecutionFailureInfo.Builder info =
          ChildWorkflowExecutionFailureInfo.newBuilder()
              .setInitiatedEventId(ce.getInitiatedEventId())
              .setStartedEventId(ce.getStartedEventId())
              .setNamespace(Strings.nullToEmpty(ce.getNamespace()))
              .setRetryStateValue(RetryState.toProtoValue(ce.getRetryState()))
              .setWorkflowType(WorkflowType.newBuilder().setName(ce.getWorkflowType()))
              .setWorkflowExecution(
                  WorkflowExecution.newBuilder()
                      .setWorkflowId(ce.getWorkflowId())
                      .setRunId(Strings.nullToEmpty(ce.getRunId())));
      failure.setChildWorkflowExecutionFailureInfo(info);
    } else if (throwable instanceof CancellationException) {
      failure.setCanceledFailureInfo(CanceledFailureInfo.getDefaultInstance());
    } else {
      ApplicationFailureInfo.Builder info =
          ApplicationFailureInfo.newBuilder()
              .setType(throwable.getClass().getName())
              .setNonRetryable(false);
      failure.setApplicationFailureInfo(info);
    }

    if (encodeCommonAttributes) {
      Payload attributes =
          dataConverter
              .toPayload(
                  ImmutableMap.of(MESSAGE_ATTRIBUTE, message, STACK_TRACE_ATTRIBUTE, stackTrace))
              .get();
      failure
          .setEncodedAttributes(attributes)
          .setMessage(ENCODED_FAILURE_MESSAGE)
          .setStackTrace("");
    }
    return failure.build();
  }

  private static Optional<Payloads> toPayloads(Values values, DataConverter dataConverter) {
    if (values instanceof EncodedValues) {
      return ((EncodedValues) values).toPayloads(dataConverter);
    }
    Object[] result = new Object[values.getSize()];
    for (int i = 0; i < result.length; i++) {
      result[i] = values.get(i, Object.class);
    }
    return dataConverter.toPayloads(result);
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> decodeAttributes(
      Payload attributes, DataConverter dataConverter) {
    try {
      Map<String, Object> result = dataConverter.fromPayload(attributes, Map.class, Map.class);
      return result == null ? Collections.emptyMap() : result;
    } catch (DataConverterException e) {
      log.warn("Failed to decode failure encoded attributes, using plain message", e);
      return Collections.emptyMap();
    }
  }

  /** Parses stack trace serialized using {@link #serializeStackTrace(Throwable)}. */
  private StackTraceElement[] parseStackTrace(String stackTrace) {
    try {
      @SuppressWarnings("StringSplitter")
      String[] lines = stackTrace.split("\r\n|\n");
      ArrayList<StackTraceElement> result = new ArrayList<>(lines.length);
      for (String line : lines) {
        StackTraceElement elem = parseStackTraceElement(line);
        if (elem != null) {
          result.add(elem);
        }
      }
      return result.toArray(new StackTraceElement[0]);
    } catch (Exception e) {
      if (log.isWarnEnabled()) {
        log.warn("Failed to parse stack trace: " + stackTrace, e);
      }
      return new StackTraceElement[0];
    }
  }

  /**
   * See {@link StackTraceElement#toString()} for the input format.
   *
   * @param line line of stack trace.
   * @return StackTraceElement that contains data from that line, null if the line doesn't look
   *     like a stack trace element.
   */
  private StackTraceElement parseStackTraceElement(String line) {
    Matcher matcher = TRACE_ELEMENT_PATTERN.matcher(line);
    if (!matcher.matches()) {
      return null;
    }
    String declaringClass = matcher.group("className");
    String methodName = matcher.group("methodName");
    String fileName = matcher.group("fileName");
    String lns = matcher.group("lineNumber");
    Integer lineNumber = Strings.isNullOrEmpty(lns) ? null : Ints.tryParse(lns);
    return new StackTraceElement(
        declaringClass, methodName, fileName, lineNumber == null ? 0 : lineNumber);
  }

  private String serializeStackTrace(Throwable e) {
    StringWriter sw = new StringWriter();
    PrintWriter pw = new PrintWriter(sw);
    for (StackTraceElement element : e.getStackTrace()) {
      pw.println(element);
    }
    pw.flush();
    return sw.toString();
  }
}

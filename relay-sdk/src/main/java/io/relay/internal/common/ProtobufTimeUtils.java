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

package io.relay.internal.common;

import com.google.protobuf.util.Durations;
import java.time.Duration;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

public class ProtobufTimeUtils {

  static final long MAX_SECONDS = 315_576_000_000L;
  static final long MIN_SECONDS = -315_576_000_000L;
  static final int MAX_NANOS = 999_999_999;
  static final int MIN_NANOS = -999_999_999;
  static final int MILLIS_PER_NANO = 1_000_000;

  private ProtobufTimeUtils() {}

  /**
   * Converts a Protobuf Duration to a Java Duration with millisecond precision. Null inputs are
   * treated as zero.
   */
  @Nonnull
  public static Duration toJavaDuration(@Nullable com.google.protobuf.Duration d) {
    if (Objects.isNull(d)) {
      return Duration.ZERO;
    }
    // Durations.toMillis throws on values outside [MIN_SECONDS, MAX_SECONDS]. A failure received
    // from the wire must never fail to convert, so both parts are clipped to the valid range and
    // nanos are truncated toward zero to millisecond precision.
    final long saturatedSeconds = Math.min(MAX_SECONDS, Math.max(MIN_SECONDS, d.getSeconds()));
    final int saturatedNanos = Math.min(MAX_NANOS, Math.max(MIN_NANOS, d.getNanos()));
    final int roundedNanos = (saturatedNanos / MILLIS_PER_NANO) * MILLIS_PER_NANO;
    return Duration.ofSeconds(saturatedSeconds, roundedNanos);
  }

  /**
   * Converts a Java Duration to a Protobuf Duration with millisecond precision. Null inputs are
   * treated as zero. Durations beyond the Protobuf range are clipped to its bounds.
   */
  @Nonnull
  public static com.google.protobuf.Duration toProtoDuration(@Nullable Duration d) {
    if (Objects.isNull(d)) {
      return Durations.ZERO;
    }
    if (d.getSeconds() >= MAX_SECONDS) {
      return com.google.protobuf.Duration.newBuilder().setSeconds(MAX_SECONDS).build();
    }
    if (d.getSeconds() < MIN_SECONDS) {
      return com.google.protobuf.Duration.newBuilder().setSeconds(MIN_SECONDS).build();
    }
    long seconds = d.getSeconds();
    int nanos = d.getNano();
    // java.time keeps nanos non-negative, Protobuf wants them to share the sign of seconds
    if (seconds < 0 && nanos > 0) {
      seconds += 1;
      nanos -= 1_000_000_000;
    }
    return com.google.protobuf.Duration.newBuilder()
        .setSeconds(seconds)
        .setNanos((nanos / MILLIS_PER_NANO) * MILLIS_PER_NANO)
        .build();
  }
}

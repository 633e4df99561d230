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

package io.relay.common.converter;

import com.google.common.base.Utf8;
import io.temporal.api.common.v1.Payload;
import java.nio.charset.StandardCharsets;

/**
 * A detail value or failure attribute couldn't be encoded into a payload or decoded from one.
 *
 * <p>When decoding fails the message includes the payload encoding and the beginning of its data.
 */
public class DataConverterException extends RuntimeException {

  /** Maximum number of payload data bytes quoted in a message. */
  public static final int MESSAGE_TRUNCATION_SIZE = 255;

  public DataConverterException(String message) {
    super(message);
  }

  public DataConverterException(Throwable cause) {
    super(cause);
  }

  public DataConverterException(String message, Throwable cause) {
    super(message, cause);
  }

  public <T> DataConverterException(Payload payload, Class<T> valueType, Throwable cause) {
    super(decodingMessage(payload, valueType, cause.getMessage()), cause);
  }

  private static String decodingMessage(Payload payload, Class<?> valueType, String reason) {
    String encoding =
        payload.containsMetadata(EncodingKeys.METADATA_ENCODING_KEY)
            ? payload.getMetadataOrThrow(EncodingKeys.METADATA_ENCODING_KEY).toStringUtf8()
            : "<none>";
    StringBuilder result =
        new StringBuilder("Can't decode ")
            .append(encoding)
            .append(" payload into ")
            .append(valueType.getTypeName());
    if (reason != null && !reason.isEmpty()) {
      result.append(": ").append(reason);
    }
    return result.append(". data=\"").append(quote(payload)).append('"').toString();
  }

  private static String quote(Payload payload) {
    byte[] data = payload.getData().toByteArray();
    int length = Math.min(data.length, MESSAGE_TRUNCATION_SIZE);
    String quoted = new String(data, 0, length, StandardCharsets.UTF_8);
    if (length < data.length || !Utf8.isWellFormed(data, 0, length)) {
      return quoted + "...";
    }
    return quoted;
  }
}

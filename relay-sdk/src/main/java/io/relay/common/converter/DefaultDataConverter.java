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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.relay.failure.DefaultFailureConverter;
import io.temporal.api.common.v1.Payload;
import io.temporal.api.common.v1.Payloads;
import io.temporal.api.failure.v1.Failure;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * A {@link DataConverter} that delegates payload conversion to type specific {@link
 * PayloadConverter} instances, and delegates failure conversions to a {@link FailureConverter}.
 *
 * <p>Instances are immutable. The {@code with*} methods return modified copies.
 */
public final class DefaultDataConverter implements DataConverter {

  // Order is important as the first converter that can convert the payload is used.
  private static final List<PayloadConverter> STANDARD_PAYLOAD_CONVERTERS =
      ImmutableList.of(
          new NullPayloadConverter(),
          new ByteArrayPayloadConverter(),
          new JacksonJsonPayloadConverter());

  /** Converter with the standard payload converters and a {@link DefaultFailureConverter}. */
  public static final DataConverter STANDARD_INSTANCE = newDefaultInstance();

  private final List<PayloadConverter> converters;
  private final Map<String, PayloadConverter> convertersMap;
  private final FailureConverter failureConverter;

  /**
   * Creates a new instance of {@code DefaultDataConverter} populated with the default list of
   * payload converters and a default failure converter.
   */
  public static DefaultDataConverter newDefaultInstance() {
    return new DefaultDataConverter(STANDARD_PAYLOAD_CONVERTERS, new DefaultFailureConverter());
  }

  /**
   * Creates instance from ordered array of converters and a default failure converter. When
   * converting an object to payload the array of converters is iterated from the beginning until
   * one of the converters successfully converts the value.
   */
  public DefaultDataConverter(PayloadConverter... converters) {
    this(Arrays.asList(converters), new DefaultFailureConverter());
  }

  private DefaultDataConverter(
      List<PayloadConverter> converters, FailureConverter failureConverter) {
    this.converters = ImmutableList.copyOf(converters);
    this.convertersMap = createConvertersMap(this.converters);
    this.failureConverter = Preconditions.checkNotNull(failureConverter, "failureConverter");
  }

  /**
   * Returns a copy of this converter where every payload converter from {@code
   * overrideConverters} either replaces the existing payload converter with the same encoding
   * type, or is added to the end of payload converters list.
   */
  public DefaultDataConverter withPayloadConverterOverrides(
      PayloadConverter... overrideConverters) {
    List<PayloadConverter> newConverters = new ArrayList<>(converters);
    for (PayloadConverter overrideConverter : overrideConverters) {
      PayloadConverter existingConverter = convertersMap.get(overrideConverter.getEncodingType());
      if (existingConverter != null) {
        newConverters.set(newConverters.indexOf(existingConverter), overrideConverter);
      } else {
        newConverters.add(overrideConverter);
      }
    }
    return new DefaultDataConverter(newConverters, failureConverter);
  }

  /**
   * Returns a copy of this converter that uses {@code failureConverter}.
   *
   * <p>Most users should never need to override the default failure converter.
   *
   * @throws NullPointerException if failureConverter is null
   */
  @Nonnull
  public DefaultDataConverter withFailureConverter(@Nonnull FailureConverter failureConverter) {
    return new DefaultDataConverter(converters, failureConverter);
  }

  @Override
  public <T> Optional<Payload> toPayload(T value) throws DataConverterException {
    for (PayloadConverter converter : converters) {
      Optional<Payload> result = converter.toData(value);
      if (result.isPresent()) {
        return result;
      }
    }
    throw new DataConverterException(
        "No PayloadConverter is registered with this DataConverter that accepts value:" + value);
  }

  @Override
  public <T> T fromPayload(Payload payload, Class<T> valueClass, Type valueType)
      throws DataConverterException {
    try {
      String encoding =
          payload.getMetadataOrThrow(EncodingKeys.METADATA_ENCODING_KEY).toString(UTF_8);
      PayloadConverter converter = convertersMap.get(encoding);
      if (converter == null) {
        throw new DataConverterException(
            "No PayloadConverter is registered for an encoding: " + encoding);
      }
      return converter.fromData(payload, valueClass, valueType);
    } catch (DataConverterException e) {
      throw e;
    } catch (Exception e) {
      throw new DataConverterException(payload, valueClass, e);
    }
  }

  @Override
  public Optional<Payloads> toPayloads(Object... values) throws DataConverterException {
    if (values == null || values.length == 0) {
      return Optional.empty();
    }
    try {
      Payloads.Builder result = Payloads.newBuilder();
      for (Object value : values) {
        result.addPayloads(toPayload(value).get());
      }
      return Optional.of(result.build());
    } catch (DataConverterException e) {
      throw e;
    } catch (Throwable e) {
      throw new DataConverterException(e);
    }
  }

  @Override
  @Nonnull
  public RuntimeException failureToException(@Nonnull Failure failure) {
    Preconditions.checkNotNull(failure, "failure");
    return failureConverter.failureToException(failure, this);
  }

  @Override
  @Nonnull
  public Failure exceptionToFailure(@Nonnull Throwable throwable) {
    Preconditions.checkNotNull(throwable, "throwable");
    return failureConverter.exceptionToFailure(throwable, this);
  }

  private static Map<String, PayloadConverter> createConvertersMap(
      List<PayloadConverter> converters) {
    Map<String, PayloadConverter> newConverterMap = new LinkedHashMap<>();
    for (PayloadConverter converter : converters) {
      newConverterMap.put(converter.getEncodingType(), converter);
    }
    return ImmutableMap.copyOf(newConverterMap);
  }
}

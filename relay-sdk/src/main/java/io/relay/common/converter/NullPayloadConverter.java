package io.relay.common.converter;

import io.temporal.api.common.v1.Payload;
import java.lang.reflect.Type;
import java.util.Optional;

/**
 * Handles {@code null} details. The payload carries only the {@code binary/null} encoding and no
 * data, so any value type decodes to {@code null}.
 */
public final class NullPayloadConverter implements PayloadConverter {

  @Override
  public String getEncodingType() {
    return EncodingKeys.METADATA_ENCODING_NULL_NAME;
  }

  @Override
  public Optional<Payload> toData(Object value) {
    return value == null ? Optional.of(newPayloadBuilder().build()) : Optional.empty();
  }

  @Override
  public <T> T fromData(Payload content, Class<T> valueType, Type valueGenericType) {
    if (valueType.isPrimitive()) {
      throw new DataConverterException(
          "binary/null payload can't be decoded into a primitive " + valueType.getName());
    }
    return null;
  }
}

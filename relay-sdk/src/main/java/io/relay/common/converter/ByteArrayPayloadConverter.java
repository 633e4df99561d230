package io.relay.common.converter;

import com.google.protobuf.ByteString;
import io.temporal.api.common.v1.Payload;
import java.lang.reflect.Type;
import java.util.Optional;

/**
 * Passes binary details through untouched under the {@code binary/plain} encoding. Accepts {@code
 * byte[]} and {@link ByteString} values and decodes into either of them.
 */
public final class ByteArrayPayloadConverter implements PayloadConverter {

  @Override
  public String getEncodingType() {
    return EncodingKeys.METADATA_ENCODING_RAW_NAME;
  }

  @Override
  public Optional<Payload> toData(Object value) {
    ByteString data;
    if (value instanceof byte[]) {
      data = ByteString.copyFrom((byte[]) value);
    } else if (value instanceof ByteString) {
      data = (ByteString) value;
    } else {
      return Optional.empty();
    }
    return Optional.of(newPayloadBuilder().setData(data).build());
  }

  @Override
  public <T> T fromData(Payload content, Class<T> valueType, Type valueGenericType) {
    if (valueType == byte[].class || valueType == Object.class) {
      return valueType.cast(content.getData().toByteArray());
    }
    if (valueType == ByteString.class) {
      return valueType.cast(content.getData());
    }
    throw new DataConverterException(
        "binary/plain payload can't be decoded into " + valueType.getName());
  }
}

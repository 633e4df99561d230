package io.relay.common.converter;

import com.google.protobuf.ByteString;
import io.temporal.api.common.v1.Payload;
import java.lang.reflect.Type;
import java.util.Optional;

/**
 * Converts a single detail value to and from a {@link Payload}.
 *
 * <p>A {@link DefaultDataConverter} offers a value to its converters in order and keeps the first
 * payload returned. On the way back it picks the converter whose {@link #getEncodingType()} equals
 * the {@link EncodingKeys#METADATA_ENCODING_KEY} metadata of the payload.
 */
public interface PayloadConverter {

  /** Value of the {@code encoding} metadata entry on every payload this converter produces. */
  String getEncodingType();

  /**
   * @return a payload builder with the {@code encoding} metadata of this converter already set
   */
  default Payload.Builder newPayloadBuilder() {
    return Payload.newBuilder()
        .putMetadata(
            EncodingKeys.METADATA_ENCODING_KEY, ByteString.copyFromUtf8(getEncodingType()));
  }

  /**
   * @param value detail value, may be null
   * @return the encoded value, or empty if this converter doesn't handle values of this kind
   * @throws DataConverterException if the value is handled but can't be encoded
   */
  Optional<Payload> toData(Object value) throws DataConverterException;

  /**
   * @param content payload produced by {@link #toData(Object)} of a converter with the same
   *     encoding type, possibly in another process or language
   * @param valueType class of the expected value
   * @param valueGenericType generic type of the expected value
   * @throws DataConverterException if {@code content} can't be decoded into {@code valueType}
   */
  <T> T fromData(Payload content, Class<T> valueType, Type valueGenericType)
      throws DataConverterException;
}

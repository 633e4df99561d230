package io.relay.common.converter;

import com.google.common.base.Defaults;
import io.temporal.api.common.v1.Payload;
import io.temporal.api.common.v1.Payloads;
import io.temporal.api.failure.v1.Failure;
import java.lang.reflect.Type;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * Used by the framework to serialize/deserialize values that need to be sent over the wire, such
 * as failure details and heartbeat details.
 *
 * <p>Most users should never implement this interface. Register a custom {@link
 * PayloadConverter} on a {@link DefaultDataConverter} instead.
 */
public interface DataConverter {

  /**
   * @param value value to convert
   * @return a {@link Payload} which is a protobuf message containing byte-array serialized
   *     representation of {@code value}. Always filled; Optional is kept for symmetry with {@link
   *     PayloadConverter#toData(Object)}.
   * @throws DataConverterException if conversion fails
   */
  <T> Optional<Payload> toPayload(T value) throws DataConverterException;

  <T> T fromPayload(Payload payload, Class<T> valueClass, Type valueType)
      throws DataConverterException;

  /**
   * Implements conversion of a list of values.
   *
   * @param values Java values to convert.
   * @return converted value. Return empty Optional if values are empty.
   * @throws DataConverterException if conversion of the value passed as parameter failed for any
   *     reason.
   */
  Optional<Payloads> toPayloads(Object... values) throws DataConverterException;

  /**
   * Implements conversion of a single {@link Payload} from the serialized {@link Payloads}.
   *
   * @param index index of the value in the payloads
   * @param content serialized value to convert to Java objects.
   * @param valueType type of the value stored in the {@code content}
   * @param valueGenericType generic type of the value stored in the {@code content}
   * @return converted Java object, or the default value of {@code valueType} if there is no
   *     payload at {@code index}
   * @throws DataConverterException if conversion of the data passed as parameter failed for any
   *     reason.
   */
  default <T> T fromPayloads(
      int index, Optional<Payloads> content, Class<T> valueType, Type valueGenericType)
      throws DataConverterException {
    if (!content.isPresent() || index >= content.get().getPayloadsCount()) {
      return Defaults.defaultValue(valueType);
    }
    return fromPayload(content.get().getPayloads(index), valueType, valueGenericType);
  }

  /**
   * Instantiate an appropriate Java Exception from a serialized Failure object.
   *
   * @param failure Failure protobuf object to deserialize into an exception
   * @throws NullPointerException if failure is null
   */
  @Nonnull
  RuntimeException failureToException(@Nonnull Failure failure);

  /**
   * Serialize an existing Throwable object into a Failure object.
   *
   * @param throwable a Throwable object to serialize into a Failure protobuf object
   * @throws NullPointerException if throwable is null
   */
  @Nonnull
  Failure exceptionToFailure(@Nonnull Throwable throwable);
}

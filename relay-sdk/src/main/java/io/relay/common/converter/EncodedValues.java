package io.relay.common.converter;

import com.google.common.base.Defaults;
import com.google.common.base.Preconditions;
import io.temporal.api.common.v1.Payloads;
import java.lang.reflect.Type;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * {@link Values} backed either by plain Java objects supplied by user code or by {@link Payloads}
 * received over the wire. The content is never inspected: payloads are decoded only when a caller
 * asks for a value, and plain objects are encoded only when the owning failure is serialized.
 */
public final class EncodedValues implements Values {
  private static final Object[] NO_VALUES = new Object[0];

  private final @Nullable Optional<Payloads> payloads;
  private final @Nullable DataConverter converter;
  private final @Nullable Object[] values;

  public EncodedValues(@Nonnull Optional<Payloads> payloads, @Nonnull DataConverter converter) {
    this.payloads = Objects.requireNonNull(payloads);
    this.converter = Objects.requireNonNull(converter);
    this.values = null;
  }

  public EncodedValues(Object... values) {
    this.values = values == null ? NO_VALUES : values.clone();
    this.payloads = null;
    this.converter = null;
  }

  /**
   * @param dataConverter used to encode values supplied by user code. Ignored when this instance
   *     already holds payloads received over the wire.
   * @return payloads or empty if there are no values
   */
  public Optional<Payloads> toPayloads(@Nonnull DataConverter dataConverter) {
    if (payloads != null) {
      return payloads;
    }
    if (values.length == 0) {
      return Optional.empty();
    }
    Preconditions.checkNotNull(dataConverter, "dataConverter");
    return dataConverter.toPayloads(values);
  }

  @Override
  public int getSize() {
    if (values != null) {
      return values.length;
    }
    return payloads.isPresent() ? payloads.get().getPayloadsCount() : 0;
  }

  @Override
  public <T> T get(int index, Class<T> parameterType, Type genericParameterType)
      throws DataConverterException {
    if (values != null) {
      // same as a decoded value without a payload at index
      if (index >= values.length) {
        return Defaults.defaultValue(parameterType);
      }
      @SuppressWarnings("unchecked")
      T result = (T) values[index];
      return result;
    }
    return converter.fromPayloads(index, payloads, parameterType, genericParameterType);
  }
}

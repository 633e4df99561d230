package io.relay.common.converter;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.base.Preconditions;
import com.google.protobuf.ByteString;
import io.temporal.api.common.v1.Payload;
import java.io.IOException;
import java.lang.reflect.Type;
import java.util.Optional;

/**
 * Encodes any value as {@code json/plain}. This is the last converter in the default chain, so it
 * handles everything the binary converters don't.
 *
 * <p>Failures travel between SDKs written in different languages. Details decoded into a Java
 * class may therefore carry properties that the class doesn't declare; the default mapper ignores
 * them.
 */
public class JacksonJsonPayloadConverter implements PayloadConverter {

  private final ObjectMapper mapper;

  /**
   * @return a new mapper configured the way {@link #JacksonJsonPayloadConverter()} uses it, to be
   *     customized and passed to {@link #JacksonJsonPayloadConverter(ObjectMapper)}
   */
  public static ObjectMapper newDefaultObjectMapper() {
    ObjectMapper mapper = new ObjectMapper();
    mapper.registerModule(new JavaTimeModule());
    mapper.registerModule(new Jdk8Module());
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    mapper.disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE);
    mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    mapper.setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);
    return mapper;
  }

  public JacksonJsonPayloadConverter() {
    this(newDefaultObjectMapper());
  }

  public JacksonJsonPayloadConverter(ObjectMapper mapper) {
    this.mapper = Preconditions.checkNotNull(mapper, "mapper");
  }

  @Override
  public String getEncodingType() {
    return EncodingKeys.METADATA_ENCODING_JSON_NAME;
  }

  @Override
  public Optional<Payload> toData(Object value) throws DataConverterException {
    byte[] json;
    try {
      json = mapper.writeValueAsBytes(value);
    } catch (JsonProcessingException e) {
      throw new DataConverterException(
          "Can't encode " + value.getClass().getName() + " as JSON", e);
    }
    return Optional.of(newPayloadBuilder().setData(ByteString.copyFrom(json)).build());
  }

  @Override
  public <T> T fromData(Payload content, Class<T> valueType, Type valueGenericType)
      throws DataConverterException {
    if (content.getData().isEmpty()) {
      return null;
    }
    JavaType type = mapper.getTypeFactory().constructType(valueGenericType);
    try {
      return mapper.readValue(content.getData().newInput(), type);
    } catch (IOException e) {
      throw new DataConverterException(content, valueType, e);
    }
  }
}

package io.relay.common.converter;

import com.google.protobuf.ByteString;
import java.nio.charset.StandardCharsets;

public final class EncodingKeys {
  public static final String METADATA_ENCODING_KEY = "encoding";

  public static final String METADATA_ENCODING_NULL_NAME = "binary/null";
  public static final ByteString METADATA_ENCODING_NULL =
      ByteString.copyFrom(METADATA_ENCODING_NULL_NAME, StandardCharsets.UTF_8);

  public static final String METADATA_ENCODING_RAW_NAME = "binary/plain";
  public static final ByteString METADATA_ENCODING_RAW =
      ByteString.copyFrom(METADATA_ENCODING_RAW_NAME, StandardCharsets.UTF_8);

  public static final String METADATA_ENCODING_JSON_NAME = "json/plain";
  public static final ByteString METADATA_ENCODING_JSON =
      ByteString.copyFrom(METADATA_ENCODING_JSON_NAME, StandardCharsets.UTF_8);

  private EncodingKeys() {}
}

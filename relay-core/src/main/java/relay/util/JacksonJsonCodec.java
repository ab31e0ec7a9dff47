package relay.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;
import java.util.Objects;

/**
 * {@link JsonCodec} backed by a Jackson {@link ObjectMapper}.
 */
public final class JacksonJsonCodec implements JsonCodec {
  static final JacksonJsonCodec INSTANCE = new JacksonJsonCodec(new ObjectMapper());

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
  };

  private final ObjectMapper mapper;

  public JacksonJsonCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  @Override
  public String toJson(Map<String, ?> value) {
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot serialize value", e);
    }
  }

  @Override
  public Map<String, Object> parseObject(String json) {
    if (json == null) {
      throw new IllegalArgumentException("Expected JSON object, got null");
    }
    try {
      Map<String, Object> parsed = mapper.readValue(json, MAP_TYPE);
      if (parsed == null) {
        throw new IllegalArgumentException("Expected JSON object, got null");
      }
      return parsed;
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid JSON object", e);
    }
  }
}

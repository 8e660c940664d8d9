package syndicator.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.List;

/**
 * Shared Jackson setup for JSON columns.
 */
public final class JsonSupport {
  private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
  private static final ObjectMapper MAPPER = newObjectMapper();

  private JsonSupport() {}

  /**
   * Mapper with {@code java.time} support writing ISO-8601 strings and ignoring unknown
   * properties, so that rows written by newer versions still decode.
   */
  public static ObjectMapper newObjectMapper() {
    ObjectMapper mapper = new ObjectMapper();
    mapper.registerModule(new JavaTimeModule());
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    return mapper;
  }

  /** Encodes remote ids as a JSON array. */
  public static String writeIds(List<String> ids) {
    try {
      return MAPPER.writeValueAsString(ids == null ? List.of() : ids);
    } catch (JsonProcessingException e) {
      throw new StoreException("Failed to encode remote ids", e);
    }
  }

  /** Decodes a JSON array of remote ids; {@code null} or blank yields an empty list. */
  public static List<String> readIds(String json) {
    if (json == null || json.isBlank()) {
      return List.of();
    }
    try {
      return List.copyOf(MAPPER.readValue(json, STRING_LIST));
    } catch (JsonProcessingException e) {
      throw new StoreException("Failed to decode remote ids: " + json, e);
    }
  }
}

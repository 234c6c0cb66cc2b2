package com.github.spud.chatagent.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.springframework.boot.json.AbstractJsonParser;
import org.springframework.boot.json.JsonParseException;

public class JsonUtils extends AbstractJsonParser {

  private static final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
  };

  private static final JsonUtils INSTANCE = new JsonUtils();

  public static JsonNode readTree(String json) {
    return INSTANCE.tryParse(() -> objectMapper.readTree(json), Exception.class);
  }

  public static String toJson(Object obj) {
    return INSTANCE.tryParse(() -> objectMapper.writeValueAsString(obj), Exception.class);
  }

  public static <T> T fromJson(String json, TypeReference<T> typeReference) {
    return INSTANCE.tryParse(() -> objectMapper.readValue(json, typeReference), Exception.class);
  }

  /**
   * 解析 JSON 对象；空串、null 或非对象 JSON 返回空 Map
   */
  public static Map<String, Object> toMap(String json) {
    if (json == null || json.isBlank()) {
      return Collections.emptyMap();
    }
    JsonNode node = readTree(json);
    if (node == null || !node.isObject()) {
      return Collections.emptyMap();
    }
    return objectMapper.convertValue(node, MAP_TYPE);
  }

  @Override
  public Map<String, Object> parseMap(String json) throws JsonParseException {
    return toMap(json);
  }

  @Override
  public List<Object> parseList(String json) throws JsonParseException {
    return Collections.emptyList();
  }

}

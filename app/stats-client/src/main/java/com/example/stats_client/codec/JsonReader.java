package com.example.stats_client.codec;

import com.example.common.json.JsonFields;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import java.util.List;

/** Jackson の変換失敗を StatsDecodeException に揃える薄いラッパー。 */
final class JsonReader {

  private final ObjectMapper objectMapper;

  JsonReader(ObjectMapper objectMapper) {
    this.objectMapper = strict(objectMapper);
  }

  /**
   * 共有 ObjectMapper のコピーに対して、値の種類を跨ぐ暗黙変換 (小数→整数, 文字列→真偽値など) を禁止する。
   * 整数→浮動小数は許可する。
   */
  static ObjectMapper strict(ObjectMapper shared) {
    final ObjectMapper mapper =
        shared
            .copy()
            .configure(DeserializationFeature.ACCEPT_FLOAT_AS_INT, false)
            .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);
    mapper
        .coercionConfigFor(LogicalType.Integer)
        .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
        .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
        .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
    mapper
        .coercionConfigFor(LogicalType.Float)
        .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
        .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
    mapper
        .coercionConfigFor(LogicalType.Boolean)
        .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
        .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail);
    mapper
        .coercionConfigFor(LogicalType.Textual)
        .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
        .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
        .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
    return mapper;
  }

  /** null 値は型不一致として扱う。キー欠落の判定は呼び出し側の責務。 */
  <T> T read(JsonNode node, String field, Class<T> type) {
    return read(node, field, objectMapper.constructType(type));
  }

  <T> T read(JsonNode node, String field, JavaType type) {
    if (JsonFields.isAbsentOrNull(node)) {
      throw StatsDecodeException.typeMismatch(
          field, "expected " + type.getRawClass().getSimpleName() + " but was null");
    }
    try {
      return objectMapper.treeToValue(node, type);
    } catch (JsonProcessingException | IllegalArgumentException ex) {
      throw StatsDecodeException.typeMismatch(field, ex);
    }
  }

  <T> T readNullable(JsonNode node, String field, Class<T> type) {
    return JsonFields.isAbsentOrNull(node) ? null : read(node, field, type);
  }

  <T> List<T> readList(JsonNode node, String field, Class<T> elementType) {
    return read(
        node, field, objectMapper.getTypeFactory().constructCollectionType(List.class, elementType));
  }

  JsonNode require(JsonNode parent, String field) {
    final JsonNode node = JsonFields.field(parent, field);
    if (JsonFields.isAbsent(node)) {
      throw StatsDecodeException.missingField(field);
    }
    return node;
  }

  JsonNode requireObject(JsonNode node, String field) {
    if (node == null || !node.isObject()) {
      throw StatsDecodeException.typeMismatch(field, "expected an object");
    }
    return node;
  }
}

/*
 * どこで: 共通ユーティリティ
 * 何を: JSON ノードの「キー欠落」と「null 値」を区別して判定する
 * なぜ: 上流 API はキー欠落と明示的 null で意味が異なるフィールドを持つため
 */
package com.example.common.json;

import com.fasterxml.jackson.databind.JsonNode;

public final class JsonFields {

  private JsonFields() {}

  /** キー自体が存在しない場合のみ true。明示的な null は存在扱い。 */
  public static boolean isAbsent(JsonNode node) {
    return node == null || node.isMissingNode();
  }

  public static boolean isAbsentOrNull(JsonNode node) {
    return isAbsent(node) || node.isNull();
  }

  /** 親がオブジェクトでない場合やキーが無い場合は null を返す。 */
  public static JsonNode field(JsonNode parent, String name) {
    if (parent == null || !parent.isObject()) {
      return null;
    }
    return parent.get(name);
  }
}

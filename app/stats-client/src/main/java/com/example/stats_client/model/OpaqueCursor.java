/*
 * どこで: Stats ドメインモデル
 * 何を: 一覧/検索系リソースの不透明な前方カーソルを保持する
 * なぜ: 中身を解釈せずに次リクエストへそのまま引き渡すため
 */
package com.example.stats_client.model;

import com.example.common.json.JsonFields;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;
import org.springframework.lang.Nullable;

public record OpaqueCursor(JsonNode token) {

  public OpaqueCursor {
    Objects.requireNonNull(token, "token is required");
    if (token.isNull() || token.isMissingNode()) {
      throw new IllegalArgumentException("token must not be null");
    }
    token = token.deepCopy();
  }

  @Override
  public JsonNode token() {
    return token.deepCopy();
  }

  /** キー欠落または null は「次ページなし」として null を返す。 */
  @Nullable
  public static OpaqueCursor fromNullable(@Nullable JsonNode token) {
    return JsonFields.isAbsentOrNull(token) ? null : new OpaqueCursor(token);
  }
}

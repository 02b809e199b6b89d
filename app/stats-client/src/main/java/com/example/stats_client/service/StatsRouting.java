/*
 * どこで: Stats サービス層
 * 何を: 論理リクエストを上流 API のパスとクエリへ変換する
 * なぜ: transport を URL 組み立てから切り離し、リクエスト値だけで再送できるようにするため
 */
package com.example.stats_client.service;

import com.example.stats_client.config.StatsApiProperties;
import com.example.stats_client.model.OpaqueCursor;
import com.example.stats_client.model.StatsRequest;
import com.example.stats_client.model.StatsResource;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Iterator;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

@Component
@RequiredArgsConstructor
public class StatsRouting {

  private final StatsApiProperties properties;

  public StatsRoute route(StatsRequest request) {
    if (request.resource() == StatsResource.NEWS) {
      return newsRoute(request);
    }
    final MultiValueMap<String, String> query = new LinkedMultiValueMap<>();
    if (request.page() != null) {
      query.add("cursor[page]", String.valueOf(request.page()));
    }
    if (request.spotlightId() != null) {
      query.add("spotlight", String.valueOf(request.spotlightId()));
    }
    return new StatsRoute(
        properties.rankingsPath(),
        Map.of(
            "mode", request.mode().value(),
            "type", request.resource().rankingType().value()),
        query);
  }

  private StatsRoute newsRoute(StatsRequest request) {
    final MultiValueMap<String, String> query = new LinkedMultiValueMap<>();
    if (request.year() != null) {
      query.add("year", String.valueOf(request.year()));
    }
    if (request.cursor() != null) {
      addCursor(query, request.cursor());
    }
    return new StatsRoute(properties.newsPath(), Map.of(), query);
  }

  /** オブジェクト形式のトークンは cursor[key]=value に展開し、それ以外は cursor_string で渡す。 */
  private void addCursor(MultiValueMap<String, String> query, OpaqueCursor cursor) {
    // 不透明トークンの中身を読むのは上流 URL を組み立てるこの箇所だけ
    final JsonNode token = cursor.token();
    if (!token.isObject()) {
      query.add("cursor_string", asQueryValue(token));
      return;
    }
    final Iterator<Map.Entry<String, JsonNode>> fields = token.fields();
    while (fields.hasNext()) {
      final Map.Entry<String, JsonNode> field = fields.next();
      query.add("cursor[" + field.getKey() + "]", asQueryValue(field.getValue()));
    }
  }

  private String asQueryValue(JsonNode value) {
    return value.isValueNode() ? value.asText() : value.toString();
  }
}

/*
 * どこで: Stats コーデック層
 * 何を: 統計値の兄弟フィールドと入れ子の user を 1 レコードへ統合/分解する
 * なぜ: ランキング応答は自己記述的な入れ子構造ではなく、フラットな 1 マップに両者が並ぶため
 */
package com.example.stats_client.codec;

import com.example.stats_client.model.GradeCounts;
import com.example.stats_client.model.UserCompact;
import com.example.stats_client.model.UserLevel;
import com.example.stats_client.model.UserStatistics;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class RankingEntryCodec {

  private static final String USER = "user";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  private final JsonReader reader;

  public RankingEntryCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
    this.reader = new JsonReader(objectMapper);
  }

  /**
   * 役割: ランキング 1 件を statistics 付きの UserCompact へ変換する。
   * 動作: トップレベルのキーを RankingEntryFields に集めてから必須チェックを行う。未知キーは無視する。
   * 失敗: 必須キー欠落は MISSING_FIELD、値の型不一致は TYPE_MISMATCH。
   */
  public UserCompact decode(JsonNode entry) {
    reader.requireObject(entry, "ranking");
    final RankingEntryFields fields = new RankingEntryFields();
    final Iterator<Map.Entry<String, JsonNode>> iterator = entry.fields();
    while (iterator.hasNext()) {
      final Map.Entry<String, JsonNode> field = iterator.next();
      collect(fields, field.getKey(), field.getValue());
    }
    return fields.build();
  }

  public List<UserCompact> decodeAll(JsonNode entries, String field) {
    if (entries == null || !entries.isArray()) {
      throw StatsDecodeException.typeMismatch(field, "expected an array");
    }
    final List<UserCompact> users = new ArrayList<>(entries.size());
    for (JsonNode entry : entries) {
      users.add(decode(entry));
    }
    return users;
  }

  /**
   * statistics を持たない UserCompact はランキング応答から組み立てられたものではないため、
   * 呼び出し側の誤りとして即座に失敗させる。
   */
  public ObjectNode encode(UserCompact user) {
    if (!user.hasStatistics()) {
      throw new IllegalStateException(
          "user " + user.userId() + " has no statistics and cannot be encoded as a ranking entry");
    }
    final UserStatistics statistics = user.statistics();
    final ObjectNode node = objectMapper.createObjectNode();
    node.put("hit_accuracy", statistics.hitAccuracy());
    if (statistics.countryRank() != null) {
      node.put("country_rank", statistics.countryRank());
    }
    if (statistics.globalRank() != null) {
      node.put("global_rank", statistics.globalRank());
    }
    node.set("grade_counts", objectMapper.valueToTree(statistics.gradeCounts()));
    node.put("is_ranked", statistics.isRanked());
    node.set("level", objectMapper.valueToTree(statistics.level()));
    node.put("maximum_combo", statistics.maximumCombo());
    node.put("play_count", statistics.playCount());
    node.put("play_time", statistics.playTime());
    node.put("pp", statistics.pp());
    node.put("ranked_score", statistics.rankedScore());
    node.put("replays_watched_by_others", statistics.replaysWatchedByOthers());
    node.put("total_hits", statistics.totalHits());
    node.put("total_score", statistics.totalScore());
    node.set(USER, UserFieldTable.write(user, objectMapper));
    return node;
  }

  public ArrayNode encodeAll(List<UserCompact> users) {
    final ArrayNode array = objectMapper.createArrayNode();
    for (UserCompact user : users) {
      array.add(encode(user));
    }
    return array;
  }

  private void collect(RankingEntryFields fields, String key, JsonNode value) {
    switch (key) {
      case "hit_accuracy" -> fields.hitAccuracy(reader.read(value, key, Double.class));
      case "country_rank" -> fields.countryRank(reader.readNullable(value, key, Integer.class));
      case "global_rank" -> fields.globalRank(reader.readNullable(value, key, Integer.class));
      case "grade_counts" -> fields.gradeCounts(reader.read(value, key, GradeCounts.class));
      case "is_ranked" -> fields.isRanked(reader.read(value, key, Boolean.class));
      case "level" -> fields.level(reader.read(value, key, UserLevel.class));
      case "maximum_combo" -> fields.maximumCombo(reader.read(value, key, Integer.class));
      case "play_count" -> fields.playCount(reader.read(value, key, Integer.class));
      // play_time と pp はキーがあれば null を 0 とみなす。キー欠落は build() で検出する
      case "play_time" ->
          fields.playTime(value.isNull() ? 0L : reader.read(value, key, Long.class));
      case "pp" -> fields.pp(value.isNull() ? 0.0 : reader.read(value, key, Double.class));
      case "ranked_score" -> fields.rankedScore(reader.read(value, key, Long.class));
      case "replays_watched_by_others" ->
          fields.replaysWatchedByOthers(reader.read(value, key, Integer.class));
      case "total_hits" -> fields.totalHits(reader.read(value, key, Long.class));
      case "total_score" -> fields.totalScore(reader.read(value, key, Long.class));
      case USER -> {
        if (!value.isNull()) {
          fields.user(decodeUser(value));
        }
      }
      default -> {
        // 前方互換のため未知キーは読み捨てる
      }
    }
  }

  private UserCompact decodeUser(JsonNode value) {
    final ObjectNode user = reader.requireObject(value, USER).deepCopy();
    for (UserFieldTable.UserField field : UserFieldTable.REQUIRED) {
      if (reader.require(user, field.wireName()).isNull()) {
        throw StatsDecodeException.typeMismatch(field.wireName(), "expected a value but was null");
      }
    }
    // 統計値は兄弟フィールド側が正とする
    user.remove("statistics");
    return reader.read(user, USER, UserCompact.class);
  }
}

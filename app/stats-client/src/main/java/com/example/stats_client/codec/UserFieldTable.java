/*
 * どこで: Stats コーデック層
 * 何を: ランキング形式の "user" オブジェクトへ書き出す項目と出力条件の一覧
 * なぜ: null 省略の可否と改名をフィールド単位で明示し、一括設定に頼らないため
 */
package com.example.stats_client.codec;

import com.example.stats_client.model.UserCompact;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.function.Function;

final class UserFieldTable {

  enum Emit {
    ALWAYS,
    NON_NULL
  }

  /**
   * name はレコード側の項目名 (snake_case)、renamedTo はワイヤ名が異なる場合のみ指定する。
   */
  record UserField(
      String name, Emit emit, String renamedTo, Function<UserCompact, Object> accessor) {

    String wireName() {
      return renamedTo == null ? name : renamedTo;
    }
  }

  // statistics は兄弟フィールドとして別に書き出すため、この一覧には含めない
  static final List<UserField> FIELDS =
      List.of(
          always("avatar_url", UserCompact::avatarUrl),
          always("country_code", UserCompact::countryCode),
          always("default_group", UserCompact::defaultGroup),
          always("is_active", UserCompact::isActive),
          always("is_bot", UserCompact::isBot),
          always("is_deleted", UserCompact::isDeleted),
          always("is_online", UserCompact::isOnline),
          always("is_supporter", UserCompact::isSupporter),
          nonNull("last_visit", UserCompact::lastVisit),
          always("pm_friends_only", UserCompact::pmFriendsOnly),
          nonNull("profile_color", "profile_colour", UserCompact::profileColor),
          always("user_id", "id", UserCompact::userId),
          always("username", UserCompact::username),
          nonNull("account_history", UserCompact::accountHistory),
          nonNull("badges", UserCompact::badges),
          nonNull("beatmap_playcounts_count", UserCompact::beatmapPlaycountsCount),
          nonNull("country", UserCompact::country),
          nonNull("cover", UserCompact::cover),
          nonNull(
              "favourite_mapset_count",
              "favourite_beatmapset_count",
              UserCompact::favouriteMapsetCount),
          nonNull("follower_count", UserCompact::followerCount),
          nonNull(
              "graveyard_mapset_count",
              "graveyard_beatmapset_count",
              UserCompact::graveyardMapsetCount),
          nonNull("groups", UserCompact::groups),
          nonNull("is_admin", UserCompact::isAdmin),
          nonNull("is_bng", UserCompact::isBng),
          nonNull("is_full_bn", UserCompact::isFullBn),
          nonNull("is_gmt", UserCompact::isGmt),
          nonNull("is_limited_bn", UserCompact::isLimitedBn),
          nonNull("is_moderator", UserCompact::isModerator),
          nonNull("is_nat", UserCompact::isNat),
          nonNull("is_silenced", UserCompact::isSilenced),
          nonNull(
              "loved_mapset_count", "loved_beatmapset_count", UserCompact::lovedMapsetCount),
          nonNull("medals", "user_achievements", UserCompact::medals),
          nonNull("monthly_playcounts", UserCompact::monthlyPlaycounts),
          nonNull("page", UserCompact::page),
          nonNull("previous_usernames", UserCompact::previousUsernames),
          nonNull("rank_history", UserCompact::rankHistory),
          nonNull(
              "ranked_mapset_count", "ranked_beatmapset_count", UserCompact::rankedMapsetCount),
          nonNull("replays_watched_counts", UserCompact::replaysWatchedCounts),
          nonNull("scores_best_count", UserCompact::scoresBestCount),
          nonNull("scores_first_count", UserCompact::scoresFirstCount),
          nonNull("scores_recent_count", UserCompact::scoresRecentCount),
          nonNull("support_level", UserCompact::supportLevel),
          nonNull(
              "pending_mapset_count",
              "pending_beatmapset_count",
              UserCompact::pendingMapsetCount));

  /** ALWAYS の項目はデコード時の必須項目でもある。欠落は MISSING_FIELD、null は TYPE_MISMATCH。 */
  static final List<UserField> REQUIRED =
      FIELDS.stream().filter(field -> field.emit() == Emit.ALWAYS).toList();

  private UserFieldTable() {}

  static ObjectNode write(UserCompact user, ObjectMapper objectMapper) {
    final ObjectNode node = objectMapper.createObjectNode();
    for (UserField field : FIELDS) {
      final Object value = field.accessor().apply(user);
      if (value == null) {
        if (field.emit() == Emit.ALWAYS) {
          node.putNull(field.wireName());
        }
        continue;
      }
      node.set(field.wireName(), objectMapper.valueToTree(value));
    }
    return node;
  }

  private static UserField always(String name, Function<UserCompact, Object> accessor) {
    return new UserField(name, Emit.ALWAYS, null, accessor);
  }

  private static UserField always(
      String name, String renamedTo, Function<UserCompact, Object> accessor) {
    return new UserField(name, Emit.ALWAYS, renamedTo, accessor);
  }

  private static UserField nonNull(String name, Function<UserCompact, Object> accessor) {
    return new UserField(name, Emit.NON_NULL, null, accessor);
  }

  private static UserField nonNull(
      String name, String renamedTo, Function<UserCompact, Object> accessor) {
    return new UserField(name, Emit.NON_NULL, renamedTo, accessor);
  }
}

package com.example.stats_client.support;

import com.example.stats_client.model.AccountHistory;
import com.example.stats_client.model.Badge;
import com.example.stats_client.model.GameMode;
import com.example.stats_client.model.GradeCounts;
import com.example.stats_client.model.Group;
import com.example.stats_client.model.MedalCompact;
import com.example.stats_client.model.MonthlyCount;
import com.example.stats_client.model.UserCompact;
import com.example.stats_client.model.UserCover;
import com.example.stats_client.model.UserLevel;
import com.example.stats_client.model.UserPage;
import com.example.stats_client.model.UserStatistics;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

/** テスト共通のランキング応答断片とドメイン値。 */
public final class StatsFixtures {

  private StatsFixtures() {}

  /** Spring Boot が構成する ObjectMapper と同じ既定値 (JavaTimeModule, ISO 日時) を使う。 */
  public static ObjectMapper objectMapper() {
    return Jackson2ObjectMapperBuilder.json().build();
  }

  public static UserStatistics statistics(Integer countryRank, Integer globalRank) {
    return new UserStatistics(
        98.5,
        countryRank,
        globalRank,
        new GradeCounts(1, 2, 30, 4, 120),
        true,
        new UserLevel(100, 42),
        1000,
        5000,
        100000L,
        7000.0,
        123456L,
        10,
        99999L,
        987654L);
  }

  /** 必須プロフィール項目だけを持つユーザー。 */
  public static UserCompact minimalUser(long userId, String username) {
    return UserCompact.builder()
        .avatarUrl("https://a.ppy.sh/" + userId)
        .countryCode("JP")
        .defaultGroup("default")
        .isActive(true)
        .isBot(false)
        .isDeleted(false)
        .isOnline(false)
        .isSupporter(true)
        .pmFriendsOnly(false)
        .userId(userId)
        .username(username)
        .build();
  }

  /** 任意項目をひととおり埋めたユーザー。 */
  public static UserCompact fullUser(long userId, String username) {
    return minimalUser(userId, username).toBuilder()
        .lastVisit(Instant.parse("2026-09-30T12:00:00Z"))
        .profileColor("#ff66aa")
        .accountHistory(
            List.of(
                new AccountHistory(
                    5L, "spam", "note", Instant.parse("2025-01-02T03:04:05Z"), 0L, false)))
        .badges(
            List.of(
                new Badge(
                    Instant.parse("2024-06-01T00:00:00Z"),
                    "Tournament winner",
                    "https://assets.ppy.sh/badge.png",
                    "https://osu.ppy.sh/wiki/badge")))
        .beatmapPlaycountsCount(321)
        .country("Japan")
        .cover(new UserCover(null, "https://assets.ppy.sh/cover.jpg", "3"))
        .favouriteMapsetCount(12)
        .followerCount(4500)
        .graveyardMapsetCount(2)
        .groups(
            List.of(
                new Group(
                    7,
                    "nat",
                    "Nomination Assessment Team",
                    "NAT",
                    "#fa3703",
                    null,
                    true,
                    true,
                    false,
                    List.of(GameMode.OSU))))
        .isAdmin(false)
        .isBng(false)
        .isFullBn(false)
        .isGmt(false)
        .isLimitedBn(false)
        .isModerator(false)
        .isNat(true)
        .isSilenced(false)
        .lovedMapsetCount(1)
        .medals(List.of(new MedalCompact(Instant.parse("2023-03-03T03:03:03Z"), 55)))
        .monthlyPlaycounts(List.of(new MonthlyCount(LocalDate.parse("2026-08-01"), 310)))
        .page(new UserPage("<div>hi</div>", "hi"))
        .previousUsernames(List.of("old-name"))
        .rankHistory(List.of(120, 118, 115))
        .rankedMapsetCount(3)
        .replaysWatchedCounts(List.of(new MonthlyCount(LocalDate.parse("2026-08-01"), 9)))
        .scoresBestCount(100)
        .scoresFirstCount(8)
        .scoresRecentCount(0)
        .supportLevel(2)
        .pendingMapsetCount(1)
        .build();
  }

  /** user.id と username 以外は固定値のランキング 1 件 (performance 応答の形)。 */
  public static String rankingEntryJson(long userId, String username) {
    return """
        {
          "hit_accuracy": 98.5,
          "country_rank": 3,
          "global_rank": 21,
          "grade_counts": {"ss": 1, "ssh": 2, "s": 30, "sh": 4, "a": 120},
          "is_ranked": true,
          "level": {"current": 100, "progress": 42},
          "maximum_combo": 1000,
          "play_count": 5000,
          "play_time": 100000,
          "pp": 7000.0,
          "ranked_score": 123456,
          "replays_watched_by_others": 10,
          "total_hits": 99999,
          "total_score": 987654,
          "user": {
            "avatar_url": "https://a.ppy.sh/%d",
            "country_code": "JP",
            "default_group": "default",
            "id": %d,
            "is_active": true,
            "is_bot": false,
            "is_deleted": false,
            "is_online": false,
            "is_supporter": true,
            "last_visit": null,
            "pm_friends_only": false,
            "profile_colour": null,
            "username": "%s"
          }
        }
        """
        .formatted(userId, userId, username);
  }

  public static String rankingsBodyJson(String cursor, String... entries) {
    return """
        {"cursor": %s, "ranking": [%s], "total": 50}
        """
        .formatted(cursor, String.join(",", entries));
  }

  public static String newsBodyJson(String cursor, long postId) {
    return """
        {
          "cursor": %s,
          "news_posts": [
            {
              "id": %d,
              "author": "peppy",
              "edit_url": "https://github.com/ppy/osu-wiki/news.md",
              "first_image": "https://osu.ppy.sh/img.jpg",
              "published_at": "2026-10-01T00:00:00Z",
              "slug": "2026-10-01-news",
              "title": "News %d"
            }
          ],
          "search": {"limit": 12, "sort": "published_desc"},
          "news_sidebar": {"current_year": 2026, "news_posts": [], "years": [2026, 2025]}
        }
        """
        .formatted(cursor, postId, postId);
  }
}

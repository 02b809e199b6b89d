/*
 * どこで: Stats ドメインモデル
 * 何を: ランキング 1 件分のユーザー情報と埋め込み統計値を表現する
 * なぜ: 統計値とプロフィールを 1 レコードとして扱い、往復変換の比較単位にするため
 */
package com.example.stats_client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import org.springframework.lang.Nullable;

/**
 * statistics はランキング応答の兄弟フィールドから組み立てた場合にだけ設定される。
 * statistics を持たないインスタンスはランキング形式へエンコードできない。
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UserCompact(
    String avatarUrl,
    String countryCode,
    String defaultGroup,
    @JsonProperty("is_active") boolean isActive,
    @JsonProperty("is_bot") boolean isBot,
    @JsonProperty("is_deleted") boolean isDeleted,
    @JsonProperty("is_online") boolean isOnline,
    @JsonProperty("is_supporter") boolean isSupporter,
    @Nullable Instant lastVisit,
    boolean pmFriendsOnly,
    @JsonProperty("profile_colour") @Nullable String profileColor,
    @JsonProperty("id") long userId,
    String username,
    @Nullable List<AccountHistory> accountHistory,
    @Nullable List<Badge> badges,
    @Nullable Integer beatmapPlaycountsCount,
    @Nullable String country,
    @Nullable UserCover cover,
    @JsonProperty("favourite_beatmapset_count") @Nullable Integer favouriteMapsetCount,
    @Nullable Integer followerCount,
    @JsonProperty("graveyard_beatmapset_count") @Nullable Integer graveyardMapsetCount,
    @Nullable List<Group> groups,
    @JsonProperty("is_admin") @Nullable Boolean isAdmin,
    @JsonProperty("is_bng") @Nullable Boolean isBng,
    @JsonProperty("is_full_bn") @Nullable Boolean isFullBn,
    @JsonProperty("is_gmt") @Nullable Boolean isGmt,
    @JsonProperty("is_limited_bn") @Nullable Boolean isLimitedBn,
    @JsonProperty("is_moderator") @Nullable Boolean isModerator,
    @JsonProperty("is_nat") @Nullable Boolean isNat,
    @JsonProperty("is_silenced") @Nullable Boolean isSilenced,
    @JsonProperty("loved_beatmapset_count") @Nullable Integer lovedMapsetCount,
    @JsonProperty("user_achievements") @Nullable List<MedalCompact> medals,
    @Nullable List<MonthlyCount> monthlyPlaycounts,
    @Nullable UserPage page,
    @Nullable List<String> previousUsernames,
    @Nullable List<Integer> rankHistory,
    @JsonProperty("ranked_beatmapset_count") @Nullable Integer rankedMapsetCount,
    @Nullable List<MonthlyCount> replaysWatchedCounts,
    @Nullable Integer scoresBestCount,
    @Nullable Integer scoresFirstCount,
    @Nullable Integer scoresRecentCount,
    @Nullable UserStatistics statistics,
    @Nullable Integer supportLevel,
    @JsonProperty("pending_beatmapset_count") @Nullable Integer pendingMapsetCount) {

  public UserCompact withStatistics(UserStatistics statistics) {
    return toBuilder().statistics(statistics).build();
  }

  public boolean hasStatistics() {
    return statistics != null;
  }
}

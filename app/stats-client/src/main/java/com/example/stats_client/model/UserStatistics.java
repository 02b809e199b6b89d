/*
 * どこで: Stats ドメインモデル
 * 何を: ランキング 1 件に埋め込まれる 14 項目の統計値を表現する
 * なぜ: ワイヤ上ではユーザー情報と同階層に平坦化されている統計値を型で束ねるため
 */
package com.example.stats_client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.springframework.lang.Nullable;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UserStatistics(
    double hitAccuracy,
    @Nullable Integer countryRank,
    @Nullable Integer globalRank,
    GradeCounts gradeCounts,
    @JsonProperty("is_ranked") boolean isRanked,
    UserLevel level,
    int maximumCombo,
    int playCount,
    long playTime,
    double pp,
    long rankedScore,
    int replaysWatchedByOthers,
    long totalHits,
    long totalScore) {}

/*
 * どこで: Stats ドメインモデル
 * 何を: transport に渡す論理リクエストを表現する
 * なぜ: 次ページ取得時に元リクエストと同じ形を値として再構築できるようにするため
 */
package com.example.stats_client.model;

import java.util.Objects;
import org.springframework.lang.Nullable;

public record StatsRequest(
    StatsResource resource,
    @Nullable GameMode mode,
    @Nullable Integer page,
    @Nullable Integer spotlightId,
    @Nullable OpaqueCursor cursor,
    @Nullable Integer year) {

  public StatsRequest {
    Objects.requireNonNull(resource, "resource is required");
    if (resource != StatsResource.NEWS && mode == null) {
      throw new IllegalArgumentException("mode is required");
    }
  }

  public static StatsRequest rankings(RankingKind kind, GameMode mode, @Nullable Integer page) {
    return new StatsRequest(kind.resource(), mode, page, null, null, null);
  }

  public static StatsRequest countryRankings(GameMode mode, @Nullable Integer page) {
    return new StatsRequest(StatsResource.COUNTRY_RANKINGS, mode, page, null, null, null);
  }

  public static StatsRequest chartRankings(GameMode mode, @Nullable Integer spotlightId) {
    return new StatsRequest(StatsResource.CHART_RANKINGS, mode, null, spotlightId, null, null);
  }

  public static StatsRequest news(@Nullable OpaqueCursor cursor, @Nullable Integer year) {
    return new StatsRequest(StatsResource.NEWS, null, null, null, cursor, year);
  }
}

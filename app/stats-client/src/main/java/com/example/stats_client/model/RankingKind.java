/*
 * どこで: Stats ドメインモデル
 * 何を: 汎用の次ページ取得に対応するユーザーランキング種別だけを定義する
 * なぜ: charts/country をページ文脈として表現できないようにし、到達不能分岐を型で排除するため
 */
package com.example.stats_client.model;

public enum RankingKind {
  PERFORMANCE(RankingType.PERFORMANCE, StatsResource.PERFORMANCE_RANKINGS),
  SCORE(RankingType.SCORE, StatsResource.SCORE_RANKINGS);

  private final RankingType rankingType;
  private final StatsResource resource;

  RankingKind(RankingType rankingType, StatsResource resource) {
    this.rankingType = rankingType;
    this.resource = resource;
  }

  public RankingType rankingType() {
    return rankingType;
  }

  public StatsResource resource() {
    return resource;
  }

  public String value() {
    return rankingType.value();
  }

  public static RankingKind fromValue(String kind) {
    for (RankingKind rankingKind : values()) {
      if (rankingKind.value().equalsIgnoreCase(kind)) {
        return rankingKind;
      }
    }
    throw new IllegalArgumentException("unsupported ranking kind: " + kind);
  }
}

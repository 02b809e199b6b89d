/*
 * どこで: Stats ドメインモデル
 * 何を: 論理リクエストの対象リソースを定義する
 * なぜ: ルーティングとメトリクスのタグを同じ語彙で扱うため
 */
package com.example.stats_client.model;

public enum StatsResource {
  PERFORMANCE_RANKINGS("performance_rankings", RankingType.PERFORMANCE),
  SCORE_RANKINGS("score_rankings", RankingType.SCORE),
  COUNTRY_RANKINGS("country_rankings", RankingType.COUNTRY),
  CHART_RANKINGS("chart_rankings", RankingType.CHARTS),
  NEWS("news", null);

  private final String value;
  private final RankingType rankingType;

  StatsResource(String value, RankingType rankingType) {
    this.value = value;
    this.rankingType = rankingType;
  }

  public String value() {
    return value;
  }

  /** rankings 系以外は null。 */
  public RankingType rankingType() {
    return rankingType;
  }
}

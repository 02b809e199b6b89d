package com.example.stats_client.model;

import java.util.List;

/** スポットライト単位のランキング。カーソルを持たず 1 回の取得で完結する。 */
public record ChartRankings(
    List<Beatmapset> mapsets, List<UserCompact> ranking, Spotlight spotlight) {

  public ChartRankings {
    mapsets = mapsets == null ? List.of() : List.copyOf(mapsets);
    ranking = ranking == null ? List.of() : List.copyOf(ranking);
  }
}

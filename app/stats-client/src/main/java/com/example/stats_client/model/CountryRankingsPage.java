package com.example.stats_client.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public record CountryRankingsPage(
    GameMode mode, List<CountryRanking> ranking, PageCursor cursor, int total)
    implements ResultPage<CountryRanking> {

  public CountryRankingsPage {
    Objects.requireNonNull(mode, "mode is required");
    Objects.requireNonNull(cursor, "cursor is required");
    ranking = ranking == null ? List.of() : List.copyOf(ranking);
  }

  @Override
  public List<CountryRanking> items() {
    return ranking;
  }

  @Override
  public boolean hasMore() {
    return cursor.hasNext();
  }

  public CountryRankingsPage append(CountryRankingsPage next) {
    final List<CountryRanking> merged = new ArrayList<>(ranking.size() + next.ranking().size());
    merged.addAll(ranking);
    merged.addAll(next.ranking());
    return new CountryRankingsPage(mode, merged, next.cursor(), next.total());
  }
}

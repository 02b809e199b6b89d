/*
 * どこで: Stats ドメインモデル
 * 何を: performance/score ランキングの 1 ページと再取得用の文脈を保持する
 * なぜ: 呼び出し元が mode や種別を再指定せずに次ページを取得できるようにするため
 */
package com.example.stats_client.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** kind と mode は元リクエスト由来で、応答本文からは決して上書きされない。 */
public record RankingsPage(
    RankingKind kind, GameMode mode, List<UserCompact> ranking, PageCursor cursor, int total)
    implements ResultPage<UserCompact> {

  public RankingsPage {
    Objects.requireNonNull(kind, "kind is required");
    Objects.requireNonNull(mode, "mode is required");
    Objects.requireNonNull(cursor, "cursor is required");
    ranking = ranking == null ? List.of() : List.copyOf(ranking);
  }

  @Override
  public List<UserCompact> items() {
    return ranking;
  }

  @Override
  public boolean hasMore() {
    return cursor.hasNext();
  }

  /** 後続ページを連結する。cursor と total は後続ページ側の値を採用する。 */
  public RankingsPage append(RankingsPage next) {
    final List<UserCompact> merged = new ArrayList<>(ranking.size() + next.ranking().size());
    merged.addAll(ranking);
    merged.addAll(next.ranking());
    return new RankingsPage(kind, mode, merged, next.cursor(), next.total());
  }
}

/*
 * どこで: Stats サービス層
 * 何を: 取得済みページの保存文脈から次ページのリクエストを再構築して送信する
 * なぜ: 呼び出し元が初回の引数を再指定せずにページ送りできるようにするため
 */
package com.example.stats_client.service;

import com.example.stats_client.model.CountryRankingsPage;
import com.example.stats_client.model.NewsPage;
import com.example.stats_client.model.RankingsPage;
import com.example.stats_client.model.StatsResource;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * 各 next は上流へ高々 1 回だけリクエストする。
 *
 * <p>カーソルが終端を示す場合は transport を呼ばずに空の Optional で完了する。送信やデコードの失敗は
 * 加工せずに返却 future の例外完了として伝播し、元のページはそのまま有効。同じページに対する複数の
 * next は互いに独立で、完了順序は保証しない。
 */
@Service
@RequiredArgsConstructor
public class NextPageDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(NextPageDispatcher.class);

  private final StatsClient statsClient;
  private final StatsMetrics metrics;

  public CompletableFuture<Optional<RankingsPage>> next(RankingsPage page) {
    final OptionalInt nextPage = page.cursor().pageNumber();
    if (nextPage.isEmpty()) {
      return exhausted(page.kind().resource());
    }
    final CompletableFuture<RankingsPage> fetch =
        switch (page.kind()) {
          case PERFORMANCE -> statsClient.performanceRankings(page.mode(), nextPage.getAsInt());
          case SCORE -> statsClient.scoreRankings(page.mode(), nextPage.getAsInt());
        };
    return fetch.thenApply(Optional::of);
  }

  public CompletableFuture<Optional<CountryRankingsPage>> next(CountryRankingsPage page) {
    final OptionalInt nextPage = page.cursor().pageNumber();
    if (nextPage.isEmpty()) {
      return exhausted(StatsResource.COUNTRY_RANKINGS);
    }
    return statsClient.countryRankings(page.mode(), nextPage.getAsInt()).thenApply(Optional::of);
  }

  /** ニュースは同じ一覧呼び出しを保存済みの不透明カーソルで再実行する。 */
  public CompletableFuture<Optional<NewsPage>> next(NewsPage page) {
    if (page.cursor() == null) {
      return exhausted(StatsResource.NEWS);
    }
    return statsClient.news(page.cursor()).thenApply(Optional::of);
  }

  private <T> CompletableFuture<Optional<T>> exhausted(StatsResource resource) {
    logger.debug("stats {} has no further pages", resource.value());
    metrics.recordPaginationExhausted(resource.value());
    return CompletableFuture.completedFuture(Optional.empty());
  }
}

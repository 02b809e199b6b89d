/*
 * どこで: Stats サービス層
 * 何を: 先頭ページから指定ページ数までカーソルを辿って結果を連結する
 * なぜ: API 層が 1 リクエストで複数ページ分のランキング/ニュースを返せるようにするため
 */
package com.example.stats_client.service;

import com.example.stats_client.config.StatsApiProperties;
import com.example.stats_client.model.CountryRankingsPage;
import com.example.stats_client.model.GameMode;
import com.example.stats_client.model.NewsPage;
import com.example.stats_client.model.OpaqueCursor;
import com.example.stats_client.model.RankingKind;
import com.example.stats_client.model.RankingsPage;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class PaginationService {

  private final StatsClient statsClient;
  private final NextPageDispatcher dispatcher;
  private final StatsApiProperties properties;

  public CompletableFuture<RankingsPage> rankings(
      RankingKind kind, GameMode mode, @Nullable Integer page, int pages) {
    validatePages(pages);
    return statsClient
        .rankings(kind, mode, page)
        .thenCompose(first -> follow(first, pages - 1, dispatcher::next, RankingsPage::append));
  }

  public CompletableFuture<CountryRankingsPage> countryRankings(
      GameMode mode, @Nullable Integer page, int pages) {
    validatePages(pages);
    return statsClient
        .countryRankings(mode, page)
        .thenCompose(
            first -> follow(first, pages - 1, dispatcher::next, CountryRankingsPage::append));
  }

  public CompletableFuture<NewsPage> news(int pages) {
    validatePages(pages);
    return statsClient
        .news((OpaqueCursor) null)
        .thenCompose(first -> follow(first, pages - 1, dispatcher::next, NewsPage::append));
  }

  // 連結済みページは常に最後に取得したページのカーソルを持つため、そのまま次の起点にできる
  private <P> CompletableFuture<P> follow(
      P accumulated,
      int remaining,
      Function<P, CompletableFuture<Optional<P>>> next,
      BinaryOperator<P> append) {
    if (remaining <= 0) {
      return CompletableFuture.completedFuture(accumulated);
    }
    return next.apply(accumulated)
        .thenCompose(
            fetched ->
                fetched
                    .map(
                        page ->
                            follow(append.apply(accumulated, page), remaining - 1, next, append))
                    .orElseGet(() -> CompletableFuture.completedFuture(accumulated)));
  }

  private void validatePages(int pages) {
    if (pages < 1 || pages > properties.maxPages()) {
      throw new IllegalArgumentException("pages must be between 1 and " + properties.maxPages());
    }
  }
}

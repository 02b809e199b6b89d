package com.example.stats_client.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.stats_client.config.StatsApiProperties;
import com.example.stats_client.model.CountryRanking;
import com.example.stats_client.model.CountryRankingsPage;
import com.example.stats_client.model.GameMode;
import com.example.stats_client.model.NewsPage;
import com.example.stats_client.model.NewsSearch;
import com.example.stats_client.model.OpaqueCursor;
import com.example.stats_client.model.PageCursor;
import com.example.stats_client.model.RankingKind;
import com.example.stats_client.model.RankingsPage;
import com.example.stats_client.support.StatsFixtures;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;

class PaginationServiceTest {

  private final StatsClient statsClient = mock(StatsClient.class);
  private final NextPageDispatcher dispatcher = mock(NextPageDispatcher.class);
  private final PaginationService service =
      new PaginationService(
          statsClient,
          dispatcher,
          new StatsApiProperties(null, null, null, null, null, null, null, 5));

  @Test
  void rankingsFollowsCursorUntilPageCountReached() {
    final RankingsPage first = rankingsPage(PageCursor.page(2), 1L);
    final RankingsPage second = rankingsPage(PageCursor.page(3), 2L);
    final RankingsPage third = rankingsPage(PageCursor.page(4), 3L);
    when(statsClient.rankings(RankingKind.PERFORMANCE, GameMode.OSU, null))
        .thenReturn(CompletableFuture.completedFuture(first));
    when(dispatcher.next(any(RankingsPage.class)))
        .thenReturn(
            CompletableFuture.completedFuture(Optional.of(second)),
            CompletableFuture.completedFuture(Optional.of(third)));

    final RankingsPage merged =
        service.rankings(RankingKind.PERFORMANCE, GameMode.OSU, null, 3).join();

    assertThat(merged.ranking()).extracting(user -> user.userId()).containsExactly(1L, 2L, 3L);
    assertThat(merged.cursor()).isEqualTo(PageCursor.page(4));
    verify(dispatcher, times(2)).next(any(RankingsPage.class));
  }

  @Test
  void rankingsStopsAtExhaustedCursor() {
    final RankingsPage first = rankingsPage(PageCursor.page(2), 1L);
    final RankingsPage last = rankingsPage(PageCursor.none(), 2L);
    when(statsClient.rankings(RankingKind.SCORE, GameMode.OSU, 1))
        .thenReturn(CompletableFuture.completedFuture(first));
    when(dispatcher.next(any(RankingsPage.class)))
        .thenReturn(
            CompletableFuture.completedFuture(Optional.of(last)),
            CompletableFuture.completedFuture(Optional.empty()));

    final RankingsPage merged = service.rankings(RankingKind.SCORE, GameMode.OSU, 1, 5).join();

    assertThat(merged.ranking()).hasSize(2);
    assertThat(merged.hasMore()).isFalse();
  }

  @Test
  void singlePageDoesNotDispatch() {
    final CountryRankingsPage first =
        new CountryRankingsPage(
            GameMode.TAIKO,
            List.of(new CountryRanking(10, "Japan", "JP", 100L, 5000.0, 99L)),
            PageCursor.page(2),
            30);
    when(statsClient.countryRankings(GameMode.TAIKO, null))
        .thenReturn(CompletableFuture.completedFuture(first));

    final CountryRankingsPage result = service.countryRankings(GameMode.TAIKO, null, 1).join();

    assertThat(result).isEqualTo(first);
    verify(dispatcher, never()).next(any(CountryRankingsPage.class));
  }

  @Test
  void newsFollowsOpaqueCursor() {
    final OpaqueCursor cursor = new OpaqueCursor(JsonNodeFactory.instance.textNode("c1"));
    final NewsPage first = new NewsPage(List.of(), new NewsSearch(12, null), null, cursor);
    final NewsPage second = new NewsPage(List.of(), new NewsSearch(12, null), null, null);
    when(statsClient.news((OpaqueCursor) null))
        .thenReturn(CompletableFuture.completedFuture(first));
    when(dispatcher.next(any(NewsPage.class)))
        .thenReturn(CompletableFuture.completedFuture(Optional.of(second)));

    final NewsPage merged = service.news(3).join();

    assertThat(merged.hasMore()).isFalse();
    verify(dispatcher, times(1)).next(any(NewsPage.class));
  }

  @Test
  void pagesOutsideConfiguredRangeAreRejected() {
    assertThatThrownBy(() -> service.rankings(RankingKind.PERFORMANCE, GameMode.OSU, null, 0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("pages must be between 1 and 5");
    assertThatThrownBy(() -> service.news(6)).isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(statsClient, dispatcher);
  }

  private RankingsPage rankingsPage(PageCursor cursor, long userId) {
    return new RankingsPage(
        RankingKind.PERFORMANCE,
        GameMode.OSU,
        List.of(
            StatsFixtures.minimalUser(userId, "user" + userId)
                .withStatistics(StatsFixtures.statistics(null, null))),
        cursor,
        50);
  }
}

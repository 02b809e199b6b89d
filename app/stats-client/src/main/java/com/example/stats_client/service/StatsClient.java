/*
 * どこで: Stats サービス層
 * 何を: ランキング/ニュースの論理リクエストを組み立てて送信し、応答をページ型へデコードする
 * なぜ: 呼び出し元と次ページ取得の両方が同じリクエスト組み立て経路を通るようにするため
 */
package com.example.stats_client.service;

import com.example.stats_client.codec.RankingsPageCodec;
import com.example.stats_client.codec.StatsDecodeException;
import com.example.stats_client.model.ChartRankings;
import com.example.stats_client.model.CountryRankingsPage;
import com.example.stats_client.model.GameMode;
import com.example.stats_client.model.NewsPage;
import com.example.stats_client.model.OpaqueCursor;
import com.example.stats_client.model.RankingKind;
import com.example.stats_client.model.RankingsPage;
import com.example.stats_client.model.StatsRequest;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class StatsClient {

  private static final Logger logger = LoggerFactory.getLogger(StatsClient.class);

  private final StatsTransport transport;
  private final RankingsPageCodec codec;

  public CompletableFuture<RankingsPage> performanceRankings(
      GameMode mode, @Nullable Integer page) {
    return rankings(RankingKind.PERFORMANCE, mode, page);
  }

  public CompletableFuture<RankingsPage> scoreRankings(GameMode mode, @Nullable Integer page) {
    return rankings(RankingKind.SCORE, mode, page);
  }

  /** kind と mode はデコード結果のページ文脈としてそのまま引き継がれる。 */
  public CompletableFuture<RankingsPage> rankings(
      RankingKind kind, GameMode mode, @Nullable Integer page) {
    validateMode(mode);
    validatePage(page);
    final StatsRequest request = StatsRequest.rankings(kind, mode, page);
    return send(request, body -> codec.decodeRankings(body, kind, mode));
  }

  public CompletableFuture<CountryRankingsPage> countryRankings(
      GameMode mode, @Nullable Integer page) {
    validateMode(mode);
    validatePage(page);
    final StatsRequest request = StatsRequest.countryRankings(mode, page);
    return send(request, body -> codec.decodeCountryRankings(body, mode));
  }

  public CompletableFuture<ChartRankings> chartRankings(
      GameMode mode, @Nullable Integer spotlightId) {
    validateMode(mode);
    if (spotlightId != null && spotlightId < 0) {
      throw new IllegalArgumentException("spotlight must not be negative");
    }
    final StatsRequest request = StatsRequest.chartRankings(mode, spotlightId);
    return send(request, codec::decodeChartRankings);
  }

  /** cursor が null の場合は先頭ページを取得する。 */
  public CompletableFuture<NewsPage> news(@Nullable OpaqueCursor cursor) {
    return send(StatsRequest.news(cursor, null), codec::decodeNews);
  }

  public CompletableFuture<NewsPage> news(int year) {
    if (year < 0) {
      throw new IllegalArgumentException("year must not be negative");
    }
    return send(StatsRequest.news(null, year), codec::decodeNews);
  }

  private <T> CompletableFuture<T> send(StatsRequest request, Function<JsonNode, T> decoder) {
    return transport
        .submit(request)
        .thenApply(
            body -> {
              try {
                return decoder.apply(body);
              } catch (StatsDecodeException ex) {
                logger.warn(
                    "stats {} response decode failed reason={} field={}",
                    request.resource().value(),
                    ex.reason(),
                    ex.field());
                throw ex;
              }
            });
  }

  private void validateMode(GameMode mode) {
    if (mode == null) {
      throw new IllegalArgumentException("mode is required");
    }
  }

  private void validatePage(Integer page) {
    if (page != null && page < 0) {
      throw new IllegalArgumentException("page must not be negative");
    }
  }
}

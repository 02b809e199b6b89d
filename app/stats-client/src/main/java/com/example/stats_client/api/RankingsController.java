/*
 * どこで: Stats API
 * 何を: ランキングを上流と同じワイヤ形式で公開する
 * なぜ: デコードとエンコードを往復させ、複数ページをカーソル追従で 1 応答にまとめるため
 */
package com.example.stats_client.api;

import com.example.stats_client.codec.RankingsPageCodec;
import com.example.stats_client.model.ChartRankings;
import com.example.stats_client.model.CountryRankingsPage;
import com.example.stats_client.model.GameMode;
import com.example.stats_client.model.RankingKind;
import com.example.stats_client.model.RankingType;
import com.example.stats_client.model.RankingsPage;
import com.example.stats_client.service.PaginationService;
import com.example.stats_client.service.StatsClient;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/rankings")
@RequiredArgsConstructor
public class RankingsController {

  private final PaginationService paginationService;
  private final StatsClient statsClient;
  private final RankingsPageCodec codec;

  @GetMapping("/{mode}/{type}")
  public ResponseEntity<ObjectNode> rankings(
      @PathVariable("mode") String mode,
      @PathVariable("type") String type,
      @RequestParam(name = "page", required = false) Integer page,
      @RequestParam(name = "pages", defaultValue = "1") int pages) {
    final GameMode gameMode = GameMode.fromValue(mode);
    if (RankingType.COUNTRY.value().equalsIgnoreCase(type)) {
      final CountryRankingsPage rankings =
          AsyncResults.await(paginationService.countryRankings(gameMode, page, pages));
      return ResponseEntity.ok(codec.encodeCountryRankings(rankings));
    }
    final RankingKind kind = RankingKind.fromValue(type);
    final RankingsPage rankings =
        AsyncResults.await(paginationService.rankings(kind, gameMode, page, pages));
    return ResponseEntity.ok(codec.encodeRankings(rankings));
  }

  @GetMapping("/{mode}/charts")
  public ResponseEntity<ObjectNode> charts(
      @PathVariable("mode") String mode,
      @RequestParam(name = "spotlight", required = false) Integer spotlight) {
    final ChartRankings rankings =
        AsyncResults.await(statsClient.chartRankings(GameMode.fromValue(mode), spotlight));
    return ResponseEntity.ok(codec.encodeChartRankings(rankings));
  }
}

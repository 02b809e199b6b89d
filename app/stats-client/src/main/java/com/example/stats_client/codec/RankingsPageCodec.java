/*
 * どこで: Stats コーデック層
 * 何を: ランキング/ニュース応答の外側エンベロープを各ページ型へ変換する
 * なぜ: ページ文脈 (種別/mode) を応答本文ではなく元リクエストから与えるため
 */
package com.example.stats_client.codec;

import com.example.common.json.JsonFields;
import com.example.stats_client.model.Beatmapset;
import com.example.stats_client.model.ChartRankings;
import com.example.stats_client.model.CountryRanking;
import com.example.stats_client.model.CountryRankingsPage;
import com.example.stats_client.model.GameMode;
import com.example.stats_client.model.NewsPage;
import com.example.stats_client.model.NewsPost;
import com.example.stats_client.model.NewsSearch;
import com.example.stats_client.model.NewsSidebar;
import com.example.stats_client.model.OpaqueCursor;
import com.example.stats_client.model.PageCursor;
import com.example.stats_client.model.RankingKind;
import com.example.stats_client.model.RankingsPage;
import com.example.stats_client.model.Spotlight;
import com.example.stats_client.model.UserCompact;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * 応答本文に含まれる mode / ranking_type は読み捨てる。
 * 本文が別の mode や charts 種別を名乗っていても、ページ文脈は呼び出し側の指定値のまま。
 */
@Component
public class RankingsPageCodec {

  private static final String RANKING = "ranking";
  private static final String TOTAL = "total";

  private final RankingEntryCodec entryCodec;
  private final PageCursorCodec cursorCodec;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  private final JsonReader reader;

  public RankingsPageCodec(
      RankingEntryCodec entryCodec, PageCursorCodec cursorCodec, ObjectMapper objectMapper) {
    this.entryCodec = entryCodec;
    this.cursorCodec = cursorCodec;
    this.objectMapper = objectMapper;
    this.reader = new JsonReader(objectMapper);
  }

  public RankingsPage decodeRankings(JsonNode body, RankingKind kind, GameMode mode) {
    reader.requireObject(body, "body");
    final PageCursor cursor = cursorCodec.decode(body.get(PageCursorCodec.CURSOR));
    final List<UserCompact> ranking =
        entryCodec.decodeAll(reader.require(body, RANKING), RANKING);
    final int total = reader.read(reader.require(body, TOTAL), TOTAL, Integer.class);
    return new RankingsPage(kind, mode, ranking, cursor, total);
  }

  public CountryRankingsPage decodeCountryRankings(JsonNode body, GameMode mode) {
    reader.requireObject(body, "body");
    final PageCursor cursor = cursorCodec.decode(body.get(PageCursorCodec.CURSOR));
    final List<CountryRanking> ranking =
        reader.readList(reader.require(body, RANKING), RANKING, CountryRanking.class);
    final int total = reader.read(reader.require(body, TOTAL), TOTAL, Integer.class);
    return new CountryRankingsPage(mode, ranking, cursor, total);
  }

  public ChartRankings decodeChartRankings(JsonNode body) {
    reader.requireObject(body, "body");
    final List<Beatmapset> mapsets =
        reader.readList(reader.require(body, "beatmapsets"), "beatmapsets", Beatmapset.class);
    final List<UserCompact> ranking =
        entryCodec.decodeAll(reader.require(body, RANKING), RANKING);
    final Spotlight spotlight =
        reader.read(reader.require(body, "spotlight"), "spotlight", Spotlight.class);
    return new ChartRankings(mapsets, ranking, spotlight);
  }

  /** ニュースのカーソルは不透明値のまま保持し、ページ番号として解釈しない。 */
  public NewsPage decodeNews(JsonNode body) {
    reader.requireObject(body, "body");
    final OpaqueCursor cursor = OpaqueCursor.fromNullable(body.get(PageCursorCodec.CURSOR));
    final List<NewsPost> posts =
        reader.readList(reader.require(body, "news_posts"), "news_posts", NewsPost.class);
    final NewsSearch search = decodeSearch(reader.require(body, "search"));
    final NewsSidebar sidebar =
        reader.read(reader.require(body, "news_sidebar"), "news_sidebar", NewsSidebar.class);
    return new NewsPage(posts, search, sidebar, cursor);
  }

  public ObjectNode encodeRankings(RankingsPage page) {
    final ObjectNode node = objectMapper.createObjectNode();
    node.put("mode", page.mode().value());
    cursorCodec.write(node, PageCursorCodec.CURSOR, page.cursor());
    node.set(RANKING, entryCodec.encodeAll(page.ranking()));
    node.put("ranking_type", page.kind().value());
    node.put(TOTAL, page.total());
    return node;
  }

  public ObjectNode encodeCountryRankings(CountryRankingsPage page) {
    final ObjectNode node = objectMapper.createObjectNode();
    cursorCodec.write(node, PageCursorCodec.CURSOR, page.cursor());
    node.set(RANKING, objectMapper.valueToTree(page.ranking()));
    node.put(TOTAL, page.total());
    return node;
  }

  public ObjectNode encodeChartRankings(ChartRankings rankings) {
    final ObjectNode node = objectMapper.createObjectNode();
    node.set("beatmapsets", objectMapper.valueToTree(rankings.mapsets()));
    node.set(RANKING, entryCodec.encodeAll(rankings.ranking()));
    node.set("spotlight", objectMapper.valueToTree(rankings.spotlight()));
    return node;
  }

  private NewsSearch decodeSearch(JsonNode search) {
    reader.requireObject(search, "search");
    final int limit = reader.read(reader.require(search, "limit"), "limit", Integer.class);
    return new NewsSearch(limit, OpaqueCursor.fromNullable(JsonFields.field(search, "cursor")));
  }
}

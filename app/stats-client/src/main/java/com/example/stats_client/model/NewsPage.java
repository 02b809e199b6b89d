/*
 * どこで: Stats ドメインモデル
 * 何を: ニュース一覧の 1 ページと不透明カーソルを保持する
 * なぜ: 次ページは同じ一覧呼び出しをカーソルだけ差し替えて再実行するため
 */
package com.example.stats_client.model;

import java.util.ArrayList;
import java.util.List;
import org.springframework.lang.Nullable;

public record NewsPage(
    List<NewsPost> posts, NewsSearch search, NewsSidebar sidebar, @Nullable OpaqueCursor cursor)
    implements ResultPage<NewsPost> {

  public NewsPage {
    posts = posts == null ? List.of() : List.copyOf(posts);
  }

  @Override
  public List<NewsPost> items() {
    return posts;
  }

  @Override
  public boolean hasMore() {
    return cursor != null;
  }

  public NewsPage append(NewsPage next) {
    final List<NewsPost> merged = new ArrayList<>(posts.size() + next.posts().size());
    merged.addAll(posts);
    merged.addAll(next.posts());
    return new NewsPage(merged, next.search(), next.sidebar(), next.cursor());
  }
}
